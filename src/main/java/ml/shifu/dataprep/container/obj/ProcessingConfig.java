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
package ml.shifu.dataprep.container.obj;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;
import ml.shifu.dataprep.util.Constants;
import ml.shifu.dataprep.util.Environment;
import ml.shifu.dataprep.util.JSONUtils;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@link ProcessingConfig} holds the settings of one cleansing pipeline. It is immutable once built.
 *
 * <p>
 * Only {@link #getMissingValueStrategy()} changes what {@link ml.shifu.dataprep.core.DataProcessor} does; the
 * validation flags tell the orchestration whether to check a schema before processing, and the logging settings
 * tell it where to send log output.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessingConfig {

    private final String missingValueStrategy;

    private final boolean validateSchema;

    private final boolean allowUnknownColumns;

    private final String logLevel;

    /**
     * Log file path, null means console only.
     */
    private final String logFile;

    public ProcessingConfig() {
        this(Constants.DEFAULT_MISSING_VALUE_STRATEGY);
    }

    public ProcessingConfig(String missingValueStrategy) {
        this(missingValueStrategy, true, false, Constants.DEFAULT_LOG_LEVEL, null);
    }

    @JsonCreator
    public ProcessingConfig(@JsonProperty("missingValueStrategy") String missingValueStrategy,
            @JsonProperty("validateSchema") Boolean validateSchema,
            @JsonProperty("allowUnknownColumns") Boolean allowUnknownColumns,
            @JsonProperty("logLevel") String logLevel, @JsonProperty("logFile") String logFile) {
        this.missingValueStrategy = StringUtils.isBlank(missingValueStrategy) ? Constants.DEFAULT_MISSING_VALUE_STRATEGY
                : missingValueStrategy.trim();
        this.validateSchema = (validateSchema == null) ? true : validateSchema;
        this.allowUnknownColumns = (allowUnknownColumns == null) ? false : allowUnknownColumns;
        this.logLevel = StringUtils.isBlank(logLevel) ? Constants.DEFAULT_LOG_LEVEL : logLevel.trim();
        this.logFile = StringUtils.trimToNull(logFile);
    }

    /**
     * Create configuration from environment variables, system properties or dataprep config files.
     */
    public static ProcessingConfig fromEnvironment() {
        return new ProcessingConfig(
                Environment.getProperty(Environment.MISSING_STRATEGY, Constants.DEFAULT_MISSING_VALUE_STRATEGY),
                Environment.getBoolean(Environment.VALIDATE_SCHEMA, Boolean.TRUE),
                Environment.getBoolean(Environment.ALLOW_UNKNOWN, Boolean.FALSE),
                Environment.getProperty(Environment.LOG_LEVEL, Constants.DEFAULT_LOG_LEVEL),
                Environment.getProperty(Environment.LOG_FILE));
    }

    /**
     * Load configuration from json file.
     *
     * @throws DataPrepException
     *             if the file cannot be read or parsed
     */
    public static ProcessingConfig load(File file) {
        try {
            return JSONUtils.readValue(file, ProcessingConfig.class);
        } catch (IOException e) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_LOAD_PROCESSING_CONFIG, e,
                    "Could not load processing config from " + file);
        }
    }

    /**
     * Copy of this config with another missing value strategy.
     */
    public ProcessingConfig withMissingValueStrategy(String strategy) {
        return new ProcessingConfig(strategy, validateSchema, allowUnknownColumns, logLevel, logFile);
    }

    @JsonProperty("missingValueStrategy")
    public String getMissingValueStrategyName() {
        return missingValueStrategy;
    }

    @JsonIgnore
    public MissingValueStrategy getMissingValueStrategy() {
        return MissingValueStrategy.of(missingValueStrategy);
    }

    public boolean isValidateSchema() {
        return validateSchema;
    }

    public boolean isAllowUnknownColumns() {
        return allowUnknownColumns;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public String getLogFile() {
        return logFile;
    }

    /**
     * Convert configuration to a nested map grouped by concern.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> processing = new LinkedHashMap<String, Object>();
        processing.put("missing_value_strategy", missingValueStrategy);

        Map<String, Object> validation = new LinkedHashMap<String, Object>();
        validation.put("validate_schema", validateSchema);
        validation.put("allow_unknown_columns", allowUnknownColumns);

        Map<String, Object> logging = new LinkedHashMap<String, Object>();
        logging.put("level", logLevel);
        logging.put("file", logFile);

        Map<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("processing", processing);
        map.put("validation", validation);
        map.put("logging", logging);
        return map;
    }

    @Override
    public String toString() {
        return "ProcessingConfig(missingValueStrategy=" + missingValueStrategy + ", validateSchema=" + validateSchema
                + ", allowUnknownColumns=" + allowUnknownColumns + ", logLevel=" + logLevel + ", logFile=" + logFile
                + ")";
    }
}
