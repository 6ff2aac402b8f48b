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
package ml.shifu.dataprep.core.processor;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.dataprep.container.ProcessingResult;
import ml.shifu.dataprep.container.obj.DatasetSchema;
import ml.shifu.dataprep.container.obj.ProcessingConfig;
import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.core.DataProcessor;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;
import ml.shifu.dataprep.exception.ValidationException;
import ml.shifu.dataprep.util.Constants;
import ml.shifu.dataprep.util.CsvTableLoader;
import ml.shifu.dataprep.util.CsvTableWriter;
import ml.shifu.dataprep.util.JSONUtils;
import ml.shifu.dataprep.util.ProcessingLogger;
import ml.shifu.dataprep.util.ProcessingLogger.Status;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cleanse processor: load each input file, validate it against the schema, run the cleansing pipeline on it and write
 * the cleaned records into the output directory under the input file name. Column types are inferred while loading, so
 * the schema column types are only enforced when schema validation is enabled.
 * 
 * <p>
 * A dataset whose processing fails does not stop the batch. Missing input, unreadable files, schema violations and
 * write failures abort the run. When an output directory is given, {@link #SUMMARY_FILE} in it lists the summary of
 * every processed input.
 */
public class CleanseProcessor implements Processor {

    private final static Logger log = LoggerFactory.getLogger(CleanseProcessor.class);

    /**
     * Name of the file in the output directory listing the summary of each input
     */
    public static final String SUMMARY_FILE = "_summary.json";

    private static final String INPUT = "input";

    private final ProcessingConfig config;

    private final DatasetSchema schema;

    private final List<File> inputs;

    private final File outputDir;

    private String delimiter = Constants.DEFAULT_DELIMITER;

    private final List<ProcessingResult> results = new ArrayList<ProcessingResult>();

    /**
     * @param config
     *            processing config
     * @param schema
     *            schema the inputs must match, null to skip validation
     * @param inputs
     *            input files
     * @param outputDir
     *            directory of cleaned files, null to not write them
     */
    public CleanseProcessor(ProcessingConfig config, DatasetSchema schema, List<File> inputs, File outputDir) {
        this.config = config;
        this.schema = schema;
        this.inputs = inputs;
        this.outputDir = outputDir;
    }

    @Override
    public int run() throws Exception {
        log.info("Step Start: cleanse");
        long start = System.currentTimeMillis();
        ProcessingLogger processingLogger = new ProcessingLogger(log);
        results.clear();
        int failed = 0;
        try {
            DataProcessor dataProcessor = new DataProcessor(config);
            CsvTableLoader loader = new CsvTableLoader(delimiter);
            CsvTableWriter writer = new CsvTableWriter(delimiter);

            for(int i = 0; i < inputs.size(); i++) {
                File input = inputs.get(i);
                Table table = loader.load(input);
                validate(table);

                ProcessingResult result = dataProcessor.process(table);
                results.add(result);
                if(result.isSuccess()) {
                    if(outputDir != null) {
                        writer.write(result.getData(), new File(outputDir, input.getName()));
                    }
                    processingLogger.logOperation(input.getName(), Status.SUCCESS, result.getStats());
                } else {
                    failed++;
                    processingLogger.logOperation(input.getName(), Status.ERROR, result.getStats());
                }
                processingLogger.logProgress(i + 1, inputs.size());
            }

            processingLogger.logMetrics(dataProcessor.getProcessingStats().toMap());
            if(outputDir != null) {
                writeSummary();
            }
        } catch (DataPrepException e) {
            Map<String, Object> details = new LinkedHashMap<String, Object>();
            details.put(Constants.STATS_ERROR, e.getError().name());
            processingLogger.logOperation("cleanse", Status.ERROR, details);
            log.error("Error:", e);
            return -1;
        }

        log.info("Step Finished: cleanse with {} ms", (System.currentTimeMillis() - start));
        if(failed > 0) {
            log.warn("{} of {} datasets failed to be processed.", failed, inputs.size());
            return 1;
        }
        return 0;
    }

    private void writeSummary() {
        List<Map<String, Object>> summaries = new ArrayList<Map<String, Object>>(results.size());
        for(int i = 0; i < results.size(); i++) {
            Map<String, Object> summary = new LinkedHashMap<String, Object>();
            summary.put(INPUT, inputs.get(i).getPath());
            summary.putAll(results.get(i).getSummary());
            summaries.add(summary);
        }
        File file = new File(outputDir, SUMMARY_FILE);
        try {
            FileUtils.forceMkdir(outputDir);
            JSONUtils.writeValue(file, summaries);
        } catch (IOException e) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_WRITE_OUTPUT, e, "Cannot write summary " + file);
        }
    }

    private void validate(Table table) {
        if(schema == null) {
            return;
        }
        if(config.isValidateSchema()) {
            schema.validate(table);
        }
        if(!config.isAllowUnknownColumns()) {
            List<String> unknown = schema.findUnknownColumns(table);
            if(!unknown.isEmpty()) {
                throw new ValidationException(DataPrepErrorCode.ERROR_UNKNOWN_COLUMNS, "Unknown columns: " + unknown);
            }
        }
    }

    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * @return results of the last run, one per processed input
     */
    public List<ProcessingResult> getResults() {
        return Collections.unmodifiableList(results);
    }

}
