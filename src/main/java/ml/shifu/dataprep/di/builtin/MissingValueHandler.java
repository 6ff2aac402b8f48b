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
import java.util.List;

import ml.shifu.dataprep.container.obj.Column;
import ml.shifu.dataprep.container.obj.MissingValueStrategy;
import ml.shifu.dataprep.container.obj.ProcessingConfig;
import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.core.ColumnStatsCalculator;
import ml.shifu.dataprep.di.spi.Transformation;
import ml.shifu.dataprep.util.Constants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

/**
 * Handle missing values according to the configured {@link MissingValueStrategy}.
 *
 * <ul>
 * <li>drop: remove every row with a missing cell in any column.</li>
 * <li>mean / median: fill missing cells of numerical columns with the mean / median of the column's present values;
 * other columns are left as they are.</li>
 * <li>anything else: log a warning and fill as mean.</li>
 * </ul>
 */
public class MissingValueHandler implements Transformation {

    private static Logger log = LoggerFactory.getLogger(MissingValueHandler.class);

    private final MissingValueStrategy strategy;

    @Inject
    public MissingValueHandler(ProcessingConfig config) {
        this(config.getMissingValueStrategy());
    }

    public MissingValueHandler(MissingValueStrategy strategy) {
        this.strategy = strategy;
    }

    @Override
    public String getName() {
        return Constants.STAGE_HANDLE_MISSING_VALUES;
    }

    @Override
    public Table apply(Table table) {
        return handle(table, strategy);
    }

    public MissingValueStrategy getStrategy() {
        return strategy;
    }

    public static Table handle(Table table, MissingValueStrategy strategy) {
        switch(strategy.getKind()) {
            case DROP:
                return dropMissing(table);
            case MEAN:
                return fillNumerical(table, false);
            case MEDIAN:
                return fillNumerical(table, true);
            default:
                log.warn("Unknown strategy '{}', falling back to mean", strategy.getName());
                return fillNumerical(table, false);
        }
    }

    private static Table dropMissing(Table table) {
        List<Integer> kept = new ArrayList<Integer>(table.getRowCount());
        for(int i = 0; i < table.getRowCount(); i++) {
            if(!table.hasMissing(i)) {
                kept.add(i);
            }
        }

        if(kept.size() == table.getRowCount()) {
            return table;
        }

        log.info("Dropped {} records with missing values", table.getRowCount() - kept.size());
        return table.selectRows(kept);
    }

    private static Table fillNumerical(Table table, boolean useMedian) {
        Table result = table;
        for(Column column: table.getNumericalColumns()) {
            int missingCount = column.getMissingCount();
            if(missingCount == 0) {
                continue;
            }

            ColumnStatsCalculator calculator = new ColumnStatsCalculator(column);
            double fillValue = useMedian ? calculator.getMedian() : calculator.getMean();
            if(Double.isNaN(fillValue)) {
                log.warn("Column {} has no present value, {} missing values are kept", column.getName(),
                        missingCount);
                continue;
            }

            log.debug("Fill {} missing values of column {} with {}", missingCount, column.getName(), fillValue);
            result = result.withColumn(column.fillMissing(fillValue));
        }
        return result;
    }

}
