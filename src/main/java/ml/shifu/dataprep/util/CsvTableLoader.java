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
package ml.shifu.dataprep.util;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import ml.shifu.dataprep.container.obj.Column;
import ml.shifu.dataprep.container.obj.DataType;
import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Charsets;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

/**
 * Load a delimited file with a header line into a {@link Table}.
 * 
 * <p>
 * Empty cells and the tokens {@code NA}, {@code NaN}, {@code null} are read as missing values. Column types are always
 * inferred from the cells, see {@link #inferType(List)}. Quoted fields are not supported; the delimiter must not occur
 * inside a value.
 */
public class CsvTableLoader {

    private static Logger log = LoggerFactory.getLogger(CsvTableLoader.class);

    public static final Set<String> MISSING_TOKENS = ImmutableSet.of("", "NA", "NaN", "null");

    private String delimiter = Constants.DEFAULT_DELIMITER;

    public CsvTableLoader() {
    }

    public CsvTableLoader(String delimiter) {
        setDelimiter(delimiter);
    }

    public Table load(String filePath) {
        return load(new File(filePath));
    }

    public Table load(File file) {
        if(!file.isFile()) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_INPUT_NOT_FOUND, "Input file " + file.getPath()
                    + " does not exist");
        }

        List<String> lines;
        try {
            lines = FileUtils.readLines(file, Charsets.UTF_8);
        } catch (IOException e) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_LOAD_INPUT, e, "Cannot load file " + file.getPath());
        }

        Splitter splitter = Splitter.on(delimiter).trimResults();
        List<String> header = null;
        List<List<String>> cells = new ArrayList<List<String>>();
        int lineNo = 0;
        for(String line: lines) {
            lineNo++;
            if(StringUtils.isBlank(line)) {
                continue;
            }
            List<String> fields = splitter.splitToList(line);
            if(header == null) {
                header = fields;
                for(int i = 0; i < header.size(); i++) {
                    cells.add(new ArrayList<String>());
                }
                continue;
            }
            if(fields.size() != header.size()) {
                throw new DataPrepException(DataPrepErrorCode.ERROR_LOAD_INPUT, String.format(
                        "Line %d of %s has %d fields, expected %d", lineNo, file.getPath(), fields.size(),
                        header.size()));
            }
            for(int i = 0; i < fields.size(); i++) {
                cells.get(i).add(fields.get(i));
            }
        }

        if(header == null) {
            log.warn("File {} has no header, an empty table is returned.", file.getPath());
            return Table.empty();
        }

        List<Column> columns = new ArrayList<Column>(header.size());
        for(int i = 0; i < header.size(); i++) {
            columns.add(toColumn(file, header.get(i), cells.get(i)));
        }

        Table table = new Table(columns);
        log.debug("Loaded {} records with {} columns from {}", table.getRowCount(), table.getColumnCount(),
                file.getPath());
        return table;
    }

    private Column toColumn(File file, String name, List<String> raw) {
        DataType type = inferType(raw);

        List<Object> values = new ArrayList<Object>(raw.size());
        for(String cell: raw) {
            if(isMissingToken(cell)) {
                values.add(null);
                continue;
            }
            try {
                values.add(parse(type, cell));
            } catch (NumberFormatException e) {
                throw new DataPrepException(DataPrepErrorCode.ERROR_LOAD_INPUT, e, String.format(
                        "Value '%s' of column '%s' in %s is not %s", cell, name, file.getPath(), type));
            }
        }
        return new Column(name, type, values);
    }

    private static Object parse(DataType type, String cell) {
        switch(type) {
            case INT64:
                return Long.parseLong(cell);
            case FLOAT64:
                return Double.parseDouble(cell);
            default:
                return cell;
        }
    }

    /**
     * Integers without any missing cell are int64, other all-numeric columns float64, the rest object.
     */
    static DataType inferType(List<String> raw) {
        boolean integral = true;
        boolean numeric = true;
        boolean hasMissing = false;
        for(String cell: raw) {
            if(isMissingToken(cell)) {
                hasMissing = true;
                continue;
            }
            if(integral && !isLong(cell)) {
                integral = false;
            }
            if(!isDouble(cell)) {
                numeric = false;
                break;
            }
        }

        if(!numeric) {
            return DataType.OBJECT;
        }
        return (integral && !hasMissing) ? DataType.INT64 : DataType.FLOAT64;
    }

    private static boolean isMissingToken(String cell) {
        return cell == null || MISSING_TOKENS.contains(cell);
    }

    private static boolean isLong(String cell) {
        try {
            Long.parseLong(cell);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDouble(String cell) {
        try {
            Double.parseDouble(cell);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public void setDelimiter(String delimiter) {
        if(StringUtils.isEmpty(delimiter)) {
            throw new IllegalArgumentException("Delimiter should not be empty.");
        }
        this.delimiter = delimiter;
    }

}
