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
package ml.shifu.dataprep.container.obj;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory table: an ordered set of named {@link Column}s sharing one row count. Rows are identified by position.
 *
 * <p>
 * A table is never changed after construction; {@link #selectRows(List)} and {@link #withColumn(Column)} return new
 * instances, so a table handed to the pipeline stays exactly as the caller built it.
 */
public final class Table {

    private final Map<String, Column> columns;

    private final int rowCount;

    public Table(List<Column> columns) {
        Map<String, Column> map = new LinkedHashMap<String, Column>();
        int size = -1;
        for(Column column: columns) {
            if(map.containsKey(column.getName())) {
                throw new IllegalArgumentException("Duplicated column name: " + column.getName());
            }
            if(size >= 0 && column.size() != size) {
                throw new IllegalArgumentException("Column '" + column.getName() + "' has " + column.size()
                        + " rows, expected " + size);
            }
            size = column.size();
            map.put(column.getName(), column);
        }
        this.columns = Collections.unmodifiableMap(map);
        this.rowCount = Math.max(size, 0);
    }

    public static Table of(Column... columns) {
        return new Table(Arrays.asList(columns));
    }

    /**
     * @return table without any column or row
     */
    public static Table empty() {
        return new Table(Collections.<Column> emptyList());
    }

    public int getRowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<String> getColumnNames() {
        return new ArrayList<String>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Column getColumn(String name) {
        Column column = columns.get(name);
        if(column == null) {
            throw new IllegalArgumentException("Cannot find column " + name);
        }
        return column;
    }

    public List<Column> getColumns() {
        return new ArrayList<Column>(columns.values());
    }

    public List<Column> getNumericalColumns() {
        List<Column> numerical = new ArrayList<Column>();
        for(Column column: columns.values()) {
            if(column.isNumerical()) {
                numerical.add(column);
            }
        }
        return numerical;
    }

    /**
     * Values of one row, in column order.
     */
    public List<Object> getRow(int row) {
        if(row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " is out of range [0, " + rowCount + ")");
        }
        List<Object> values = new ArrayList<Object>(columns.size());
        for(Column column: columns.values()) {
            values.add(column.get(row));
        }
        return values;
    }

    /**
     * Whether any cell of the row is missing.
     */
    public boolean hasMissing(int row) {
        for(Column column: columns.values()) {
            if(column.isMissing(row)) {
                return true;
            }
        }
        return false;
    }

    /**
     * New table with the given rows, in the given order.
     */
    public Table selectRows(List<Integer> rows) {
        List<Column> selected = new ArrayList<Column>(columns.size());
        for(Column column: columns.values()) {
            selected.add(column.select(rows));
        }
        return new Table(selected);
    }

    /**
     * New table where the column of the same name is replaced, or the column appended if there is none.
     */
    public Table withColumn(Column column) {
        List<Column> list = new ArrayList<Column>(columns.values());
        boolean replaced = false;
        for(int i = 0; i < list.size(); i++) {
            if(list.get(i).getName().equals(column.getName())) {
                list.set(i, column);
                replaced = true;
                break;
            }
        }
        if(!replaced) {
            list.add(column);
        }
        return new Table(list);
    }

    /**
     * @return count of missing cells per column, in column order
     */
    public Map<String, Integer> countMissingValues() {
        Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
        for(Column column: columns.values()) {
            counts.put(column.getName(), column.getMissingCount());
        }
        return counts;
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rowCount;
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof Table)) {
            return false;
        }
        Table other = (Table) obj;
        return rowCount == other.rowCount && getColumns().equals(other.getColumns());
    }

    @Override
    public String toString() {
        return "Table(columns=" + columns.keySet() + ", rows=" + rowCount + ")";
    }
}
