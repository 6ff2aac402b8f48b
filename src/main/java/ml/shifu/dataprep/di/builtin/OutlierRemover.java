/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.dataprep.di.builtin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.dataprep.container.obj.Column;
import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.di.spi.OutlierDetector;
import ml.shifu.dataprep.di.spi.Transformation;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.ProcessingException;
import ml.shifu.dataprep.util.Constants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

/**
 * Remove statistical outliers. Every numerical column is checked independently by the bound {@link OutlierDetector},
 * all against the table as it entered this stage, and a row flagged by any column is dropped.
 */
public class OutlierRemover implements Transformation {

    private static Logger log = LoggerFactory.getLogger(OutlierRemover.class);

    private final OutlierDetector outlierDetector;

    @Inject
    public OutlierRemover(OutlierDetector outlierDetector) {
        log.debug("OutlierDetector Injected: {}", outlierDetector.getClass().getName());
        this.outlierDetector = outlierDetector;
    }

    @Override
    public String getName() {
        return Constants.STAGE_REMOVE_OUTLIERS;
    }

    @Override
    public Table apply(Table table) {
        int size = table.getRowCount();
        boolean[] removed = new boolean[size];

        for(Column column: table.getNumericalColumns()) {
            boolean[] outliers = outlierDetector.detect(column);
            if(outliers.length != size) {
                Map<String, Object> details = new LinkedHashMap<String, Object>();
                details.put("column", column.getName());
                details.put("flags", outliers.length);
                details.put("rows", size);
                throw new ProcessingException(DataPrepErrorCode.ERROR_MALFORMED_DATA, "Outlier flags of column "
                        + column.getName() + " has size " + outliers.length + ", expected " + size, details);
            }
            for(int i = 0; i < size; i++) {
                removed[i] |= outliers[i];
            }
        }

        List<Integer> kept = new ArrayList<Integer>(size);
        for(int i = 0; i < size; i++) {
            if(!removed[i]) {
                kept.add(i);
            }
        }

        if(kept.size() == size) {
            return table;
        }

        log.info("Removed {} outlier records", size - kept.size());
        return table.selectRows(kept);
    }

}
