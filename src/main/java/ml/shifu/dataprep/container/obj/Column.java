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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable, named sequence of values of one {@link DataType}.
 *
 * <p>
 * A cell is missing if it is null, or NaN in a float64 column. Every operation returning a column builds a new
 * instance.
 */
public final class Column {

    private final String name;

    private final DataType type;

    private final List<Object> values;

    public Column(String name, DataType type, List<?> values) {
        if(StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Column name should not be blank.");
        }
        if(type == null) {
            throw new IllegalArgumentException("Column '" + name + "' has no type.");
        }
        this.name = name;
        this.type = type;

        List<Object> copy = new ArrayList<Object>(values == null ? 0 : values.size());
        if(values != null) {
            for(Object value: values) {
                copy.add(value == null ? null : type.coerce(value));
            }
        }
        this.values = Collections.unmodifiableList(copy);
    }

    public static Column ofLongs(String name, Long... values) {
        return new Column(name, DataType.INT64, Arrays.asList(values));
    }

    public static Column ofDoubles(String name, Double... values) {
        return new Column(name, DataType.FLOAT64, Arrays.asList(values));
    }

    public static Column ofStrings(String name, String... values) {
        return new Column(name, DataType.OBJECT, Arrays.asList(values));
    }

    public static Column ofCategories(String name, String... values) {
        return new Column(name, DataType.CATEGORY, Arrays.asList(values));
    }

    /**
     * Whether a raw cell value counts as missing.
     */
    public static boolean isMissingValue(Object value) {
        if(value == null) {
            return true;
        }
        if(value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if(value instanceof Float) {
            return ((Float) value).isNaN();
        }
        return false;
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    public ColumnType getColumnType() {
        return type.getColumnType();
    }

    public boolean isNumerical() {
        return type.isNumerical();
    }

    public int size() {
        return values.size();
    }

    public Object get(int row) {
        return values.get(row);
    }

    public List<Object> getValues() {
        return values;
    }

    public boolean isMissing(int row) {
        return isMissingValue(values.get(row));
    }

    public int getMissingCount() {
        int count = 0;
        for(Object value: values) {
            if(isMissingValue(value)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Numeric value of one cell, NaN if missing.
     */
    public double getDouble(int row) {
        checkNumerical();
        Object value = values.get(row);
        return isMissingValue(value) ? Double.NaN : ((Number) value).doubleValue();
    }

    /**
     * @return present values of a numerical column, in row order
     */
    public double[] getPresentValues() {
        checkNumerical();
        double[] present = new double[size() - getMissingCount()];
        int i = 0;
        for(Object value: values) {
            if(!isMissingValue(value)) {
                present[i++] = ((Number) value).doubleValue();
            }
        }
        return present;
    }

    /**
     * New column holding the given rows, in the given order.
     */
    public Column select(List<Integer> rows) {
        List<Object> selected = new ArrayList<Object>(rows.size());
        for(Integer row: rows) {
            selected.add(values.get(row));
        }
        return new Column(name, type, selected);
    }

    /**
     * New column with every missing cell replaced by {@code fillValue}. An int64 column that gets any cell filled is
     * promoted to float64, since an imputed statistic is generally not integral.
     *
     * @param fillValue
     *            replacement value; if itself missing, the column is returned unchanged
     */
    public Column fillMissing(Object fillValue) {
        if(isMissingValue(fillValue) || getMissingCount() == 0) {
            return this;
        }

        DataType filledType = (type == DataType.INT64) ? DataType.FLOAT64 : type;
        List<Object> filled = new ArrayList<Object>(values.size());
        for(Object value: values) {
            filled.add(isMissingValue(value) ? fillValue : value);
        }
        return new Column(name, filledType, filled);
    }

    private void checkNumerical() {
        if(!isNumerical()) {
            throw new IllegalStateException("Column '" + name + "' of type " + type + " is not numerical.");
        }
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + type.hashCode()) + values.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof Column)) {
            return false;
        }
        Column other = (Column) obj;
        return name.equals(other.name) && type == other.type && values.equals(other.values);
    }

    @Override
    public String toString() {
        return "Column(name=" + name + ", type=" + type + ", size=" + size() + ")";
    }
}
