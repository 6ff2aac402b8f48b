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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import ml.shifu.dataprep.container.obj.Column;
import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.di.spi.Transformation;
import ml.shifu.dataprep.util.Constants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remove rows equal, on all columns, to an earlier row. The first occurrence is kept and kept rows stay in input
 * order. Two missing cells compare equal.
 */
public class DuplicateRowRemover implements Transformation {

    private static Logger log = LoggerFactory.getLogger(DuplicateRowRemover.class);

    @Override
    public String getName() {
        return Constants.STAGE_DEDUPLICATE;
    }

    @Override
    public Table apply(Table table) {
        int initialCount = table.getRowCount();
        Set<List<Object>> seen = new HashSet<List<Object>>(initialCount * 2);
        List<Integer> kept = new ArrayList<Integer>(initialCount);
        List<Column> columns = table.getColumns();

        for(int i = 0; i < initialCount; i++) {
            if(seen.add(rowKey(columns, i))) {
                kept.add(i);
            }
        }

        if(kept.size() == initialCount) {
            return table;
        }

        log.info("Removed {} duplicate records", initialCount - kept.size());
        return table.selectRows(kept);
    }

    /**
     * Row values with every missing cell, null or NaN, as null.
     */
    private static List<Object> rowKey(List<Column> columns, int row) {
        List<Object> key = new ArrayList<Object>(columns.size());
        for(Column column: columns) {
            key.add(column.isMissing(row) ? null : column.get(row));
        }
        return key;
    }

}
