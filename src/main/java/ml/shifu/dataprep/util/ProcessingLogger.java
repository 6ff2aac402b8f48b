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

import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

import com.google.common.base.Stopwatch;

/**
 * Logger for cleansing jobs: operations with timing information, progress and metrics.
 */
public class ProcessingLogger {

    public static enum Status {
        SUCCESS, WARNING, ERROR
    }

    private final Logger logger;

    private final Stopwatch stopwatch;

    public ProcessingLogger(Logger logger) {
        this.logger = logger;
        this.stopwatch = Stopwatch.createStarted();
    }

    /**
     * Log a processing operation with the time elapsed since this logger was created.
     */
    public void logOperation(String operation, Status status, Map<String, ?> details) {
        double duration = stopwatch.elapsed(TimeUnit.MILLISECONDS) / 1000d;
        StringBuilder message = new StringBuilder(128);
        message.append("Operation: ").append(operation).append(" | Status: ").append(status)
                .append(" | Duration: ").append(String.format(Locale.ROOT, "%.2f", duration)).append('s');
        if(details != null && !details.isEmpty()) {
            message.append(" | Details: ").append(details);
        }

        switch(status) {
            case ERROR:
                logger.error(message.toString());
                break;
            case WARNING:
                logger.warn(message.toString());
                break;
            default:
                logger.info(message.toString());
                break;
        }
    }

    public void logProgress(int current, int total) {
        double percentage = total > 0 ? current * 100d / total : 0d;
        logger.info("Progress: {}/{} ({}%)", current, total, String.format(Locale.ROOT, "%.1f", percentage));
    }

    public void logMetrics(Map<String, ?> metrics) {
        logger.info("Processing Metrics:");
        for(Entry<String, ?> entry: metrics.entrySet()) {
            logger.info("  {}: {}", entry.getKey(), entry.getValue());
        }
    }
}
