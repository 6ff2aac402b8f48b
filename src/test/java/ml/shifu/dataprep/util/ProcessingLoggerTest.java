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
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.dataprep.util.ProcessingLogger.Status;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * ProcessingLoggerTest class, covers {@link LoggerUtils} as well
 */
public class ProcessingLoggerTest {

    @Test
    public void testLogOperation() {
        LogCapture capture = LogCapture.attach(ProcessingLoggerTest.class);
        try {
            ProcessingLogger logger = new ProcessingLogger(LoggerFactory.getLogger(ProcessingLoggerTest.class));
            logger.logOperation("load", Status.SUCCESS, Collections.singletonMap("rows", 5));
            logger.logOperation("clean", Status.ERROR, null);
            logger.logOperation("check", Status.WARNING, Collections.<String, Object> emptyMap());
        } finally {
            capture.detach();
        }

        List<String> infos = capture.getMessages(Level.INFO);
        Assert.assertEquals(infos.size(), 1);
        Assert.assertTrue(infos.get(0).matches("Operation: load \\| Status: SUCCESS \\| Duration: \\d+\\.\\d{2}s "
                + "\\| Details: \\{rows=5\\}"), infos.get(0));
        Assert.assertTrue(capture.getMessages(Level.ERROR).get(0).startsWith("Operation: clean | Status: ERROR"));
        Assert.assertFalse(capture.getMessages(Level.WARN).get(0).contains("Details"));
    }

    @Test
    public void testLogProgressAndMetrics() {
        LogCapture capture = LogCapture.attach(ProcessingLoggerTest.class);
        try {
            ProcessingLogger logger = new ProcessingLogger(LoggerFactory.getLogger(ProcessingLoggerTest.class));
            logger.logProgress(3, 10);
            logger.logProgress(0, 0);

            Map<String, Object> metrics = new LinkedHashMap<String, Object>();
            metrics.put("total_processed", 42L);
            logger.logMetrics(metrics);
        } finally {
            capture.detach();
        }

        List<String> infos = capture.getMessages(Level.INFO);
        Assert.assertEquals(infos.get(0), "Progress: 3/10 (30.0%)");
        Assert.assertEquals(infos.get(1), "Progress: 0/0 (0.0%)");
        Assert.assertEquals(infos.get(2), "Processing Metrics:");
        Assert.assertEquals(infos.get(3), "  total_processed: 42");
    }

    @Test
    public void testSetupLogger() throws IOException {
        File tmpDir = Files.createTempDirectory("logger-utils").toFile();
        String name = "ml.shifu.dataprep.logtest";
        try {
            File logFile = new File(tmpDir, "logs/dataprep.log");
            Logger logger = LoggerUtils.setupLogger(name, "debug", logFile.getPath());
            Assert.assertTrue(logger.isDebugEnabled());
            logger.info("hello file");

            String content = FileUtils.readFileToString(logFile, "UTF-8");
            Assert.assertTrue(content.contains(" | " + name + " | INFO | hello file"), content);

            Logger reset = LoggerUtils.setupLogger(name, "verbose", null);
            Assert.assertFalse(reset.isDebugEnabled());
            Assert.assertTrue(reset.isInfoEnabled());
            reset.info("console only");
            Assert.assertFalse(FileUtils.readFileToString(logFile, "UTF-8").contains("console only"));
        } finally {
            org.apache.log4j.Logger.getLogger(name).removeAllAppenders();
            FileUtils.deleteQuietly(tmpDir);
        }
    }

}
