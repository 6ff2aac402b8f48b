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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import ml.shifu.dataprep.container.ProcessingStats;

import com.google.common.base.Ticker;

/**
 * Mutable running state owned by one {@link DataProcessor}: start time and total processed records. The counter is
 * atomic, but a processor per worker thread is still the expected usage.
 */
class ProcessingState {

    private final Ticker ticker;

    private final long startNanos;

    private final AtomicLong totalProcessed = new AtomicLong(0L);

    ProcessingState(Ticker ticker) {
        this.ticker = ticker;
        this.startNanos = ticker.read();
    }

    /**
     * @return whole seconds elapsed since this state was created
     */
    long getUptimeSeconds() {
        return TimeUnit.NANOSECONDS.toSeconds(ticker.read() - startNanos);
    }

    void addProcessed(long count) {
        totalProcessed.addAndGet(count);
    }

    ProcessingStats snapshot() {
        return new ProcessingStats(totalProcessed.get(), getUptimeSeconds());
    }
}
