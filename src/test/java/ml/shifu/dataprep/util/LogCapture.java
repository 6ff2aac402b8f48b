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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;

/**
 * Collects events of one log4j logger at any level, attach with {@link #attach(Class)} and remove with
 * {@link #detach()}.
 */
public class LogCapture extends AppenderSkeleton {

    private final List<LoggingEvent> events = new ArrayList<LoggingEvent>();

    private Logger logger;

    private Level previousLevel;

    public static LogCapture attach(Class<?> clazz) {
        LogCapture capture = new LogCapture();
        capture.logger = Logger.getLogger(clazz);
        capture.previousLevel = capture.logger.getLevel();
        capture.logger.setLevel(Level.ALL);
        capture.logger.addAppender(capture);
        return capture;
    }

    public void detach() {
        logger.removeAppender(this);
        logger.setLevel(previousLevel);
    }

    @Override
    protected synchronized void append(LoggingEvent event) {
        events.add(event);
    }

    public synchronized List<String> getMessages(Level level) {
        List<String> messages = new ArrayList<String>();
        for(LoggingEvent event: events) {
            if(event.getLevel().equals(level)) {
                messages.add(event.getRenderedMessage());
            }
        }
        return messages;
    }

    @Override
    public void close() {
    }

    @Override
    public boolean requiresLayout() {
        return false;
    }

}
