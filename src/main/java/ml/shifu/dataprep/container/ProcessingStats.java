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

import java.util.LinkedHashMap;
import java.util.Map;

import ml.shifu.dataprep.util.Constants;

/**
 * Read-only snapshot of a processor's running totals.
 */
public class ProcessingStats {

    private final long totalProcessed;

    private final long uptimeSeconds;

    public ProcessingStats(long totalProcessed, long uptimeSeconds) {
        this.totalProcessed = totalProcessed;
        this.uptimeSeconds = uptimeSeconds;
    }

    public long getTotalProcessed() {
        return totalProcessed;
    }

    public long getUptimeSeconds() {
        return uptimeSeconds;
    }

    /**
     * @return records per second of uptime, 0 if the processor has been up for less than one second
     */
    public double getAverageThroughput() {
        return uptimeSeconds > 0 ? (double) totalProcessed / uptimeSeconds : 0d;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        map.put(Constants.TOTAL_PROCESSED, totalProcessed);
        map.put(Constants.UPTIME_SECONDS, uptimeSeconds);
        map.put(Constants.AVERAGE_THROUGHPUT, getAverageThroughput());
        return map;
    }

    @Override
    public String toString() {
        return "ProcessingStats" + toMap();
    }
}
