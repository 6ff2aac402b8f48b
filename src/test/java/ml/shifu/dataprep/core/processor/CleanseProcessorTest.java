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
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.dataprep.container.obj.DataType;
import ml.shifu.dataprep.container.obj.DatasetSchema;
import ml.shifu.dataprep.container.obj.ProcessingConfig;
import ml.shifu.dataprep.util.Constants;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * CleanseProcessorTest class
 */
public class CleanseProcessorTest {

    private File tmpDir;

    private File outputDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tmpDir = Files.createTempDirectory("cleanse-processor").toFile();
        outputDir = new File(tmpDir, "output");
    }

    @AfterMethod
    public void tearDown() {
        FileUtils.deleteQuietly(tmpDir);
    }

    private File writeInput(String name, String content) throws IOException {
        File file = new File(tmpDir, name);
        FileUtils.writeStringToFile(file, content, "UTF-8");
        return file;
    }

    private DatasetSchema genSchema() {
        Map<String, String> columnTypes = new LinkedHashMap<String, String>();
        columnTypes.put("id", "int64");
        columnTypes.put("value", "float64");
        return new DatasetSchema("sales", "1.0", Arrays.asList("id", "value"), columnTypes);
    }

    @Test
    public void testCleanse() throws Exception {
        File input = writeInput("sales.csv", "id,value\n1,1.0\n2,\n3,5.0\n3,5.0\n");
        CleanseProcessor processor = new CleanseProcessor(new ProcessingConfig(), genSchema(), Arrays.asList(input),
                outputDir);

        Assert.assertEquals(processor.run(), 0);
        Assert.assertEquals(processor.getResults().size(), 1);
        Assert.assertTrue(processor.getResults().get(0).isSuccess());

        List<String> lines = FileUtils.readLines(new File(outputDir, "sales.csv"), "UTF-8");
        Assert.assertEquals(lines, Arrays.asList("id,value", "1,1.0", "2,3.0", "3,5.0"));

        List<?> summaries = new ObjectMapper().readValue(new File(outputDir, CleanseProcessor.SUMMARY_FILE),
                List.class);
        Assert.assertEquals(summaries.size(), 1);
        Map<?, ?> summary = (Map<?, ?>) summaries.get(0);
        Assert.assertEquals(summary.get("input"), input.getPath());
        Assert.assertEquals(summary.get(Constants.SUCCESS), Boolean.TRUE);
        Assert.assertEquals(summary.get(Constants.STATS_RECORD_COUNT), 3);
    }

    @Test
    public void testMissingRequiredColumn() throws Exception {
        File input = writeInput("sales.csv", "value\n1.0\n2.0\n");
        CleanseProcessor processor = new CleanseProcessor(new ProcessingConfig(), genSchema(), Arrays.asList(input),
                outputDir);

        Assert.assertEquals(processor.run(), -1);
        Assert.assertFalse(new File(outputDir, "sales.csv").exists());
    }

    @Test
    public void testSchemaValidationDisabled() throws Exception {
        File input = writeInput("sales.csv", "value\n1.0\n2.0\n");
        ProcessingConfig config = new ProcessingConfig("mean", false, false, "INFO", null);
        CleanseProcessor processor = new CleanseProcessor(config, genSchema(), Arrays.asList(input), outputDir);

        Assert.assertEquals(processor.run(), 0);
    }

    @Test
    public void testColumnTypesIgnoredWithoutValidation() throws Exception {
        DatasetSchema schema = new DatasetSchema("counts", "1.0", Arrays.asList("id"), Collections.singletonMap(
                "value", "int64"));
        File input = writeInput("counts.csv", "id,value\n1,1.5\n2,2.5\n");
        ProcessingConfig config = new ProcessingConfig("mean", false, true, "INFO", null);
        CleanseProcessor processor = new CleanseProcessor(config, schema, Arrays.asList(input), outputDir);

        Assert.assertEquals(processor.run(), 0);
        Assert.assertEquals(processor.getResults().get(0).getData().getColumn("value").getType(), DataType.FLOAT64);
    }

    @Test
    public void testColumnTypeMismatch() throws Exception {
        DatasetSchema schema = new DatasetSchema("counts", "1.0", Arrays.asList("id"), Collections.singletonMap(
                "value", "int64"));
        // integers with a hole are read as float64
        File input = writeInput("counts.csv", "id,value\n1,\n2,2\n");
        CleanseProcessor processor = new CleanseProcessor(new ProcessingConfig(), schema, Arrays.asList(input),
                outputDir);

        Assert.assertEquals(processor.run(), -1);
        Assert.assertTrue(processor.getResults().isEmpty());
        Assert.assertFalse(new File(outputDir, "counts.csv").exists());
    }

    @Test
    public void testUnknownColumns() throws Exception {
        File input = writeInput("sales.csv", "id,value,note\n1,1.0,x\n2,2.0,y\n");

        CleanseProcessor strict = new CleanseProcessor(new ProcessingConfig(), genSchema(), Arrays.asList(input),
                outputDir);
        Assert.assertEquals(strict.run(), -1);

        ProcessingConfig lenient = new ProcessingConfig("mean", true, true, "INFO", null);
        CleanseProcessor processor = new CleanseProcessor(lenient, genSchema(), Arrays.asList(input), outputDir);
        Assert.assertEquals(processor.run(), 0);
        Assert.assertEquals(FileUtils.readLines(new File(outputDir, "sales.csv"), "UTF-8").get(0), "id,value,note");
    }

    @Test
    public void testFailedDatasetDoesNotStopBatch() throws Exception {
        File empty = writeInput("empty.csv", "id,value\n");
        File valid = writeInput("valid.csv", "id,value\n1,2.0\n2,4.0\n");
        CleanseProcessor processor = new CleanseProcessor(new ProcessingConfig(), null, Arrays.asList(empty, valid),
                outputDir);

        Assert.assertEquals(processor.run(), 1);
        Assert.assertEquals(processor.getResults().size(), 2);
        Assert.assertFalse(processor.getResults().get(0).isSuccess());
        Assert.assertTrue(processor.getResults().get(1).isSuccess());
        Assert.assertFalse(new File(outputDir, "empty.csv").exists());
        Assert.assertTrue(new File(outputDir, "valid.csv").exists());
    }

    @Test
    public void testMissingInput() throws Exception {
        CleanseProcessor processor = new CleanseProcessor(new ProcessingConfig(), null, Arrays.asList(new File(
                tmpDir, "absent.csv")), null);
        Assert.assertEquals(processor.run(), -1);
    }

}
