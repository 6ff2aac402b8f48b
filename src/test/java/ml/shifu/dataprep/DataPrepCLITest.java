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
package ml.shifu.dataprep;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * DataPrepCLITest class
 */
public class DataPrepCLITest {

    private File tmpDir;

    private File input;

    private File outputDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tmpDir = Files.createTempDirectory("dataprep-cli").toFile();
        input = new File(tmpDir, "data.csv");
        FileUtils.writeStringToFile(input, "id,value\n1,2.0\n2,\n3,4.0\n", "UTF-8");
        outputDir = new File(tmpDir, "out");
    }

    @AfterMethod
    public void tearDown() {
        FileUtils.deleteQuietly(tmpDir);

        // undo the logger setup of the command line
        Logger logger = Logger.getLogger("ml.shifu.dataprep");
        logger.removeAllAppenders();
        logger.setAdditivity(true);
        logger.setLevel(Level.DEBUG);
    }

    @Test
    public void testHelp() {
        Assert.assertEquals(DataPrepCLI.run(new String[] { "-h" }), 0);
        Assert.assertEquals(DataPrepCLI.run(new String[] { "--help" }), 0);
    }

    @Test
    public void testInvalidOptions() {
        Assert.assertEquals(DataPrepCLI.run(new String[0]), -1);
        Assert.assertEquals(DataPrepCLI.run(new String[] { "-o", outputDir.getPath() }), -1);
    }

    @Test
    public void testCleanse() throws IOException {
        int status = DataPrepCLI.run(new String[] { "-i", input.getPath(), "-o", outputDir.getPath() });

        Assert.assertEquals(status, 0);
        List<String> lines = FileUtils.readLines(new File(outputDir, "data.csv"), "UTF-8");
        Assert.assertEquals(lines, Arrays.asList("id,value", "1,2.0", "2,3.0", "3,4.0"));
    }

    @Test
    public void testStrategyAndConfig() throws IOException {
        File config = new File(tmpDir, "config.json");
        FileUtils.writeStringToFile(config, "{\"missingValueStrategy\": \"median\", \"logLevel\": \"WARN\"}",
                "UTF-8");

        int status = DataPrepCLI.run(new String[] { "-i", input.getPath(), "-o", outputDir.getPath(), "-c",
                config.getPath(), "--strategy", "drop" });

        Assert.assertEquals(status, 0);
        List<String> lines = FileUtils.readLines(new File(outputDir, "data.csv"), "UTF-8");
        Assert.assertEquals(lines, Arrays.asList("id,value", "1,2.0", "3,4.0"));
    }

    @Test
    public void testSchemaViolation() throws IOException {
        File schema = new File(tmpDir, "schema.json");
        FileUtils.writeStringToFile(schema, "{\"name\": \"s\", \"version\": \"1\", \"requiredColumns\": [\"id\", "
                + "\"label\"]}", "UTF-8");

        int status = DataPrepCLI.run(new String[] { "-i", input.getPath(), "-s", schema.getPath() });
        Assert.assertEquals(status, -1);
    }

    @Test
    public void testBadConfigFile() {
        int status = DataPrepCLI.run(new String[] { "-i", input.getPath(), "-c",
                new File(tmpDir, "absent.json").getPath() });
        Assert.assertEquals(status, -1);
    }

    @Test
    public void testMissingInput() {
        int status = DataPrepCLI.run(new String[] { "-i", new File(tmpDir, "absent.csv").getPath() });
        Assert.assertEquals(status, -1);
    }

}
