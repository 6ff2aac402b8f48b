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
 * DataPrepException, contain error code
 */
public class DataPrepException extends RuntimeException {

    private static final long serialVersionUID = -4713092201773610498L;

    /**
     * error code
     */
    private final DataPrepErrorCode error;

    public DataPrepException(DataPrepErrorCode code) {
        super(code.getDescription());
        this.error = code;
    }

    public DataPrepException(DataPrepErrorCode code, Exception e) {
        super(code.getDescription(), e);
        this.error = code;
    }

    public DataPrepException(DataPrepErrorCode code, String msg) {
        super(msg);
        this.error = code;
    }

    public DataPrepException(DataPrepErrorCode code, Exception e, String msg) {
        super(msg, e);
        this.error = code;
    }

    public DataPrepErrorCode getError() {
        return error;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [error=" + error + ", message=" + getMessage() + "]";
    }

}
