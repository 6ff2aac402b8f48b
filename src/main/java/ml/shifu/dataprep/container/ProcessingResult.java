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
package ml.shifu.dataprep.container;

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.util.Constants;

import org.apache.commons.lang3.time.DateFormatUtils;

/**
 * Outcome of one pipeline invocation, either a {@link Success} carrying the cleaned table or a {@link Failure}
 * carrying the reason.
 *
 * <p>
 * A success always has data, and its stats hold at least {@link Constants#STATS_RECORD_COUNT} and
 * {@link Constants#STATS_PROCESSING_TIME}. A failure never has data, and its stats hold
 * {@link Constants#STATS_ERROR}. Results hold no reference back to the processor that created them.
 */
public abstract class ProcessingResult {

    private final Map<String, Object> stats;

    private final Date processedAt;

    private ProcessingResult(Map<String, ?> stats) {
        this.stats = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(stats));
        this.processedAt = new Date();
    }

    public static Success success(Table data, Map<String, ?> stats) {
        return new Success(data, stats);
    }

    public static Failure failure(DataPrepErrorCode errorCode, String message) {
        return failure(errorCode, message, null);
    }

    public static Failure failure(DataPrepErrorCode errorCode, String message, Map<String, ?> details) {
        return new Failure(errorCode, message, details);
    }

    public abstract boolean isSuccess();

    /**
     * @return cleaned table, null for a failure
     */
    public abstract Table getData();

    public Map<String, Object> getStats() {
        return stats;
    }

    public Date getProcessedAt() {
        return new Date(processedAt.getTime());
    }

    /**
     * Generate a summary of the processing result.
     */
    public Map<String, Object> getSummary() {
        Object processingTime = stats.get(Constants.STATS_PROCESSING_TIME);
        Map<String, Object> summary = new LinkedHashMap<String, Object>();
        summary.put(Constants.SUCCESS, isSuccess());
        summary.put(Constants.STATS_RECORD_COUNT, getData() == null ? 0 : getData().getRowCount());
        summary.put(Constants.STATS_PROCESSING_TIME, processingTime == null ? 0L : processingTime);
        summary.put(Constants.PROCESSED_AT,
                DateFormatUtils.ISO_8601_EXTENDED_DATETIME_TIME_ZONE_FORMAT.format(processedAt));
        return summary;
    }

    public static final class Success extends ProcessingResult {

        private final Table data;

        private Success(Table data, Map<String, ?> stats) {
            super(stats);
            if(data == null) {
                throw new IllegalArgumentException("A successful result should carry data.");
            }
            this.data = data;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Table getData() {
            return data;
        }

        public int getRecordCount() {
            return data.getRowCount();
        }

        @Override
        public String toString() {
            return "Success(records=" + data.getRowCount() + ", stats=" + getStats() + ")";
        }
    }

    public static final class Failure extends ProcessingResult {

        private final DataPrepErrorCode errorCode;

        private Failure(DataPrepErrorCode errorCode, String message, Map<String, ?> details) {
            super(errorStats(message, details));
            this.errorCode = errorCode;
        }

        private static Map<String, Object> errorStats(String message, Map<String, ?> details) {
            Map<String, Object> stats = new LinkedHashMap<String, Object>();
            stats.put(Constants.STATS_ERROR, message);
            if(details != null && !details.isEmpty()) {
                stats.put(Constants.STATS_DETAILS, Collections.unmodifiableMap(new LinkedHashMap<String, Object>(
                        details)));
            }
            return stats;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Table getData() {
            return null;
        }

        public DataPrepErrorCode getErrorCode() {
            return errorCode;
        }

        public String getErrorMessage() {
            return (String) getStats().get(Constants.STATS_ERROR);
        }

        @Override
        public String toString() {
            return "Failure(error=" + errorCode + ", message=" + getErrorMessage() + ")";
        }
    }
}
