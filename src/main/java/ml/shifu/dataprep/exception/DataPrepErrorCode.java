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
package ml.shifu.dataprep.exception;

/**
 * Data preparation error code
 */
public enum DataPrepErrorCode {
    /**
     * Configuration Error 400 ~ 500
     */
    ERROR_DATAPREP_CONFIG(400, "Errors happen when loading dataprep config"), ERROR_LOAD_PROCESSING_CONFIG(401,
            "Could not load processing config file"), ERROR_LOAD_SCHEMA(402, "Could not load dataset schema file"),
    ERROR_BINDING_CLASS(403, "Could not find the class bound to the transformation spi"),

    /*
     * File/System error: 1001 - 1050
     */
    ERROR_INPUT_NOT_FOUND(1001, "The input data is not found"), ERROR_LOAD_INPUT(1002,
            "Could not load the input data"), ERROR_WRITE_OUTPUT(1003, "Could not write the cleaned data"),

    /*
     * data validate 1151 - 1200
     */
    ERROR_EMPTY_DATASET(1151, "Empty dataset provided"), ERROR_MISSING_COLUMNS(1152,
            "The input data misses required columns"), ERROR_COLUMN_TYPE_MISMATCH(1153,
            "The input data has a column whose type is not the declared one"), ERROR_UNKNOWN_COLUMNS(1154,
            "The input data has columns not declared in the schema"),

    /*
     * processing 1201 - 1250
     */
    ERROR_PROCESSING(1201, "Errors happen when processing the dataset"), ERROR_MALFORMED_DATA(1202,
            "The input data is malformed");

    /**
     * code
     */
    private final int code;

    /**
     * description
     */
    private final String description;

    /**
     * Constructor, not public
     *
     * @param code
     *            the code
     * @param description
     *            the description
     */
    private DataPrepErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * description getter
     *
     * @return description
     */
    public String getDescription() {
        return description;
    }

    /**
     * code getter
     *
     * @return code
     */
    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }

}
