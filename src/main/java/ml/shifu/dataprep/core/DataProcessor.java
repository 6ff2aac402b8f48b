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
package ml.shifu.dataprep.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.dataprep.container.ProcessingResult;
import ml.shifu.dataprep.container.ProcessingStats;
import ml.shifu.dataprep.container.obj.ProcessingConfig;
import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.di.module.CleansingModule;
import ml.shifu.dataprep.di.service.TransformationService;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.ProcessingException;
import ml.shifu.dataprep.util.Constants;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ticker;
import com.google.inject.Guice;

/**
 * Main class for data cleansing: deduplicate, remove outliers, handle missing values, then compute statistics.
 *
 * <p>
 * {@link #process(Table)} never throws for data quality problems. An empty table, or any failure inside the
 * pipeline, comes back as a {@link ProcessingResult.Failure} so a batch caller can go on with its next table. Schema
 * validation is not part of processing, callers run {@link ml.shifu.dataprep.container.obj.DatasetSchema#validate}
 * themselves when their config asks for it.
 *
 * <p>
 * A processor accumulates the number of processed records; use one instance per worker thread.
 */
public class DataProcessor {

    private static Logger log = LoggerFactory.getLogger(DataProcessor.class);

    private final ProcessingConfig config;

    private final TransformationService transformationService;

    private final ProcessingState state;

    public DataProcessor(ProcessingConfig config) {
        this(config, Ticker.systemTicker());
    }

    public DataProcessor(ProcessingConfig config, Ticker ticker) {
        this(config, Guice.createInjector(new CleansingModule(config)).getInstance(TransformationService.class),
                ticker);
    }

    public DataProcessor(ProcessingConfig config, TransformationService transformationService, Ticker ticker) {
        this.config = config;
        this.transformationService = transformationService;
        this.state = new ProcessingState(ticker);
        log.debug("DataProcessor initialized with {} transformations, {}", transformationService
                .getTransformations().size(), config);
    }

    /**
     * Process the input table according to configured rules.
     *
     * @param table
     *            input table, never modified
     * @return result of the processing operation
     */
    public ProcessingResult process(Table table) {
        if(table == null || table.isEmpty()) {
            log.error("Processing failed: {}", Constants.EMPTY_DATASET_MESSAGE);
            return ProcessingResult.failure(DataPrepErrorCode.ERROR_EMPTY_DATASET, Constants.EMPTY_DATASET_MESSAGE);
        }

        try {
            Pair<Table, Map<String, Integer>> transformed = transformationService.exec(table);
            Table cleaned = transformed.getLeft();

            Map<String, Object> stats = new LinkedHashMap<String, Object>();
            stats.put(Constants.STATS_RECORD_COUNT, cleaned.getRowCount());
            stats.put(Constants.STATS_MISSING_VALUES, cleaned.countMissingValues());
            stats.put(Constants.STATS_INITIAL_MISSING_VALUES, table.countMissingValues());
            stats.put(Constants.STATS_ROWS_REMOVED, transformed.getRight());
            stats.put(Constants.STATS_PROCESSING_TIME, state.getUptimeSeconds());

            log.info("Successfully processed {} records", cleaned.getRowCount());
            state.addProcessed(cleaned.getRowCount());

            return ProcessingResult.success(cleaned, stats);
        } catch (ProcessingException e) {
            log.error("Processing failed: {}", e.getMessage(), e);
            return ProcessingResult.failure(e.getError(), e.getMessage(), e.getDetails());
        } catch (RuntimeException e) {
            String message = (e.getMessage() == null) ? e.toString() : e.getMessage();
            log.error("Processing failed: {}", message, e);
            return ProcessingResult.failure(DataPrepErrorCode.ERROR_PROCESSING, message);
        }
    }

    /**
     * Process tables one after another; a failed table does not stop the batch.
     */
    public List<ProcessingResult> process(Collection<Table> tables) {
        List<ProcessingResult> results = new ArrayList<ProcessingResult>(tables.size());
        for(Table table: tables) {
            results.add(process(table));
        }
        return results;
    }

    /**
     * @return current processing statistics
     */
    public ProcessingStats getProcessingStats() {
        return state.snapshot();
    }

    public ProcessingConfig getConfig() {
        return config;
    }

}
