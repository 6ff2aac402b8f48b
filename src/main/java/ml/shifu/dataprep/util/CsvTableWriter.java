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

import ml.shifu.dataprep.container.obj.Column;
import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;

import org.apache.commons.io.FileUtils;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;

/**
 * Write a {@link Table} as a delimited file with a header line; missing values are written as empty cells.
 */
public class CsvTableWriter {

    private final Joiner joiner;

    public CsvTableWriter() {
        this(Constants.DEFAULT_DELIMITER);
    }

    public CsvTableWriter(String delimiter) {
        this.joiner = Joiner.on(delimiter);
    }

    public void write(Table table, File file) {
        List<String> lines = new ArrayList<String>(table.getRowCount() + 1);
        lines.add(joiner.join(table.getColumnNames()));

        List<Column> columns = table.getColumns();
        for(int i = 0; i < table.getRowCount(); i++) {
            List<String> cells = new ArrayList<String>(columns.size());
            for(Column column: columns) {
                cells.add(column.isMissing(i) ? "" : String.valueOf(column.get(i)));
            }
            lines.add(joiner.join(cells));
        }

        try {
            FileUtils.forceMkdirParent(file);
            FileUtils.writeLines(file, Charsets.UTF_8.name(), lines, "\n");
        } catch (IOException e) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_WRITE_OUTPUT, e, "Cannot write file " + file.getPath());
        }
    }

}
