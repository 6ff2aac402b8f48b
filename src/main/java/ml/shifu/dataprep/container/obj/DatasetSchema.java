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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeSet;

import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;
import ml.shifu.dataprep.exception.ValidationException;
import ml.shifu.dataprep.util.JSONUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@link DatasetSchema} declares the columns a dataset must have and the type tag expected for each of them.
 *
 * <p>
 * A required column does not need a declared type, and a declared type is only checked when the column is present
 * in the validated table. Schemas are never inferred from data; they come from code or from a json file, see
 * {@link #load(File)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetSchema {

    private final String name;

    private final String version;

    private final Date createdAt;

    private final List<String> requiredColumns;

    private final Map<String, String> columnTypes;

    private final Map<String, Object> metadata;

    public DatasetSchema(String name, String version, List<String> requiredColumns, Map<String, String> columnTypes) {
        this(name, version, null, requiredColumns, columnTypes, null);
    }

    @JsonCreator
    public DatasetSchema(@JsonProperty("name") String name, @JsonProperty("version") String version,
            @JsonProperty("createdAt") Date createdAt,
            @JsonProperty("requiredColumns") List<String> requiredColumns,
            @JsonProperty("columnTypes") Map<String, String> columnTypes,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.name = name;
        this.version = version;
        this.createdAt = (createdAt == null) ? new Date() : new Date(createdAt.getTime());
        // ordered set semantics, first occurrence wins
        this.requiredColumns = Collections.unmodifiableList(new ArrayList<String>(
                requiredColumns == null ? Collections.<String> emptySet() : new LinkedHashSet<String>(
                        requiredColumns)));
        this.columnTypes = Collections.unmodifiableMap(columnTypes == null ? Collections.<String, String> emptyMap()
                : new LinkedHashMap<String, String>(columnTypes));
        this.metadata = Collections.unmodifiableMap(metadata == null ? Collections.<String, Object> emptyMap()
                : new LinkedHashMap<String, Object>(metadata));
    }

    /**
     * Load schema from json file.
     *
     * @throws DataPrepException
     *             if the file cannot be read or parsed
     */
    public static DatasetSchema load(File file) {
        try {
            return JSONUtils.readValue(file, DatasetSchema.class);
        } catch (IOException e) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_LOAD_SCHEMA, e, "Could not load schema from " + file);
        }
    }

    /**
     * Validate if the table matches the schema. All required columns are checked before any column type; the first
     * failing check aborts validation.
     *
     * @param table
     *            table to validate
     * @return true if valid
     * @throws ValidationException
     *             if a required column is missing, or a present column has not the declared type
     */
    public boolean validate(Table table) {
        Set<String> missingColumns = new TreeSet<String>(requiredColumns);
        missingColumns.removeAll(table.getColumnNames());
        if(!missingColumns.isEmpty()) {
            throw new ValidationException(DataPrepErrorCode.ERROR_MISSING_COLUMNS, "Missing required columns: "
                    + missingColumns);
        }

        for(Entry<String, String> entry: columnTypes.entrySet()) {
            String column = entry.getKey();
            if(!table.hasColumn(column)) {
                continue;
            }
            String actualType = table.getColumn(column).getType().getTag();
            if(!actualType.equals(entry.getValue())) {
                throw new ValidationException(DataPrepErrorCode.ERROR_COLUMN_TYPE_MISMATCH, String.format(
                        "Column '%s' has type %s, expected %s", column, actualType, entry.getValue()));
            }
        }

        return true;
    }

    /**
     * Columns of the table named neither as required column nor in column types, in table order.
     */
    public List<String> findUnknownColumns(Table table) {
        List<String> unknown = new ArrayList<String>();
        for(String column: table.getColumnNames()) {
            if(!requiredColumns.contains(column) && !columnTypes.containsKey(column)) {
                unknown.add(column);
            }
        }
        return unknown;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public Date getCreatedAt() {
        return new Date(createdAt.getTime());
    }

    public List<String> getRequiredColumns() {
        return requiredColumns;
    }

    public Map<String, String> getColumnTypes() {
        return columnTypes;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "DatasetSchema(name=" + name + ", version=" + version + ", columns=" + requiredColumns.size() + ")";
    }
}
