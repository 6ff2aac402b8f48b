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

/**
 * Element type of a {@link Column}. The tag is what a {@link DatasetSchema} declares in its column types and is
 * compared as an exact string, so {@code int64} and {@code float64} are different types.
 */
public enum DataType {

    INT64("int64", ColumnType.N), FLOAT64("float64", ColumnType.N), OBJECT("object", ColumnType.T), CATEGORY(
            "category", ColumnType.C);

    private final String tag;

    private final ColumnType columnType;

    private DataType(String tag, ColumnType columnType) {
        this.tag = tag;
        this.columnType = columnType;
    }

    public String getTag() {
        return tag;
    }

    public ColumnType getColumnType() {
        return columnType;
    }

    public boolean isNumerical() {
        return columnType.isNumerical();
    }

    /**
     * Convert a non-missing cell value into the java representation of this type: {@link Long} for int64,
     * {@link Double} for float64, {@link String} for category. Object columns keep any value as is.
     *
     * @param value
     *            cell value, not null
     * @return converted value
     * @throws IllegalArgumentException
     *             if the value cannot be held by this type
     */
    public Object coerce(Object value) {
        switch(this) {
            case INT64:
                if(value instanceof Long) {
                    return value;
                }
                if(value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).longValue();
                }
                break;
            case FLOAT64:
                if(value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                break;
            case CATEGORY:
                if(value instanceof CharSequence) {
                    return value.toString();
                }
                break;
            default:
                return value;
        }
        throw new IllegalArgumentException("Value " + value + " of " + value.getClass().getName()
                + " cannot be held by type " + tag);
    }

    /**
     * Find data type by tag, case insensitive.
     *
     * @param tag
     *            the type tag like 'int64'
     * @return the data type, or null if no type has such tag
     */
    public static DataType find(String tag) {
        for(DataType dt: values()) {
            if(dt.tag.equalsIgnoreCase(tag)) {
                return dt;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return tag;
    }
}
