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

import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.PatternLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configure log4j loggers at runtime, for the command line where level and file come from
 * {@link ml.shifu.dataprep.container.obj.ProcessingConfig}.
 */
public final class LoggerUtils {

    public static final String SIMPLE_PATTERN = "%p | %m%n";

    public static final String DETAILED_PATTERN = "%d{ISO8601} | %c | %p | %m%n";

    private static final String CONSOLE_APPENDER = "dataprep-console";

    private static final String FILE_APPENDER = "dataprep-file";

    private LoggerUtils() {
    }

    /**
     * Configure and return a logger instance: level, console output and, if {@code logFile} is not blank, a file
     * output with timestamps. Calling it twice for the same name replaces the appenders installed before.
     *
     * @param name
     *            logger name, usually a package
     * @param logLevel
     *            DEBUG, INFO, WARN, ERROR; unknown levels fall back to INFO
     * @param logFile
     *            path to log file, null for console only
     * @return slf4j logger of this name
     */
    public static Logger setupLogger(String name, String logLevel, String logFile) {
        org.apache.log4j.Logger logger = LogManager.getLogger(name);
        logger.setLevel(Level.toLevel(StringUtils.upperCase(logLevel), Level.INFO));
        logger.setAdditivity(false);

        removeAppender(logger, CONSOLE_APPENDER);
        ConsoleAppender console = new ConsoleAppender(new PatternLayout(SIMPLE_PATTERN), ConsoleAppender.SYSTEM_OUT);
        console.setName(CONSOLE_APPENDER);
        logger.addAppender(console);

        removeAppender(logger, FILE_APPENDER);
        if(StringUtils.isNotBlank(logFile)) {
            File file = new File(logFile);
            try {
                FileUtils.forceMkdirParent(file);
                FileAppender fileAppender = new FileAppender(new PatternLayout(DETAILED_PATTERN),
                        file.getAbsolutePath(), true);
                fileAppender.setName(FILE_APPENDER);
                logger.addAppender(fileAppender);
            } catch (IOException e) {
                throw new DataPrepException(DataPrepErrorCode.ERROR_DATAPREP_CONFIG, e, "Cannot open log file "
                        + logFile);
            }
        }

        return LoggerFactory.getLogger(name);
    }

    private static void removeAppender(org.apache.log4j.Logger logger, String appenderName) {
        Appender appender = logger.getAppender(appenderName);
        if(appender != null) {
            logger.removeAppender(appender);
            appender.close();
        }
    }

}
