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
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Environment} resolves settings like 'DP_MISSING_STRATEGY' and returns them to user by calling
 * {@link #getProperty(String)} method.
 *
 * <p>
 * A setting is looked up in the process environment first, then in JVM system properties, then in the config files
 * loaded by {@link #loadDataPrepConfig()}.
 */
public final class Environment {

    public static final String DATAPREP_HOME = "DATAPREP_HOME";

    public static final String MISSING_STRATEGY = "DP_MISSING_STRATEGY";
    public static final String VALIDATE_SCHEMA = "DP_VALIDATE_SCHEMA";
    public static final String ALLOW_UNKNOWN = "DP_ALLOW_UNKNOWN";
    public static final String LOG_LEVEL = "DP_LOG_LEVEL";
    public static final String LOG_FILE = "DP_LOG_FILE";

    private static Logger logger = LoggerFactory.getLogger(Environment.class);
    private static Properties properties = new Properties();

    static {
        try {
            loadDataPrepConfig();
        } catch (IOException e) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_DATAPREP_CONFIG, e);
        }

        if(properties.isEmpty()) {
            logger.debug("No dataprep config is found or there is no content in it");
        }
    }

    private Environment() {
    }

    /*
     * Load properties from
     * 1. ${DATAPREP_HOME}/conf/dataprep.config
     * 2. ./.env
     * 3. ~/.dataprep.config
     *
     * Later files override earlier ones. Provide function to reload.
     */
    public static void loadDataPrepConfig() throws IOException {
        String home = lookup(DATAPREP_HOME);
        if(StringUtils.isNotBlank(home)) {
            loadProperties(properties, home + File.separator + "conf" + File.separator + "dataprep.config");
        }

        loadProperties(properties, ".env");

        String userHome = System.getProperty("user.home");
        loadProperties(properties, userHome + File.separator + ".dataprep.config");
    }

    /*
     * Get property by name, environment first, then system properties, then config files
     */
    public static String getProperty(String propertyName) {
        String value = lookup(propertyName);
        return (value == null) ? properties.getProperty(propertyName) : value;
    }

    public static void setProperty(String propertyName, String propertyValue) {
        properties.put(propertyName, propertyValue);
    }

    public static void removeProperty(String propertyName) {
        properties.remove(propertyName);
    }

    /*
     * Get property, if null return default value
     */
    public static String getProperty(String propertyName, String defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : propertyValue.trim();
    }

    /*
     * Get property as Boolean value, if null return default value
     */
    public static Boolean getBoolean(String propertyName, Boolean defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Boolean.valueOf(propertyValue.trim());
    }

    private static String lookup(String name) {
        String value = System.getenv(name);
        return (value == null) ? System.getProperty(name) : value;
    }

    /*
     * Load properties from file, ignore if not exists
     */
    private static void loadProperties(Properties props, String fileName) throws IOException {
        File file = new File(fileName);
        if(!file.isFile()) {
            return;
        }

        InputStream in = null;
        try {
            in = new FileInputStream(file);
            props.load(in);
            logger.debug("Loaded dataprep config from {}", file.getAbsolutePath());
        } finally {
            IOUtils.closeQuietly(in);
        }
    }
}
