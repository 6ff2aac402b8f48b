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

/**
 * Constants shared by the processor, results and the command line.
 */
public interface Constants {

    public static final String DEFAULT_MISSING_VALUE_STRATEGY = "mean";

    public static final String DEFAULT_LOG_LEVEL = "INFO";

    public static final String DEFAULT_DELIMITER = ",";

    /**
     * IQR multiplier used to derive outlier fences.
     */
    public static final double IQR_MULTIPLIER = 1.5d;

    public static final String EMPTY_DATASET_MESSAGE = "Empty dataset provided";

    // keys of result stats
    public static final String STATS_RECORD_COUNT = "record_count";
    public static final String STATS_MISSING_VALUES = "missing_values";
    public static final String STATS_INITIAL_MISSING_VALUES = "initial_missing_values";
    public static final String STATS_ROWS_REMOVED = "rows_removed";
    public static final String STATS_PROCESSING_TIME = "processing_time";
    public static final String STATS_ERROR = "error";
    public static final String STATS_DETAILS = "details";

    // keys of processor stats and result summary
    public static final String TOTAL_PROCESSED = "total_processed";
    public static final String UPTIME_SECONDS = "uptime_seconds";
    public static final String AVERAGE_THROUGHPUT = "average_throughput";
    public static final String SUCCESS = "success";
    public static final String PROCESSED_AT = "processed_at";

    // names of pipeline stages
    public static final String STAGE_DEDUPLICATE = "deduplicate";
    public static final String STAGE_REMOVE_OUTLIERS = "remove_outliers";
    public static final String STAGE_HANDLE_MISSING_VALUES = "handle_missing_values";

}
