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
 * Raised when a table does not satisfy a {@link ml.shifu.dataprep.container.obj.DatasetSchema}.
 *
 * <p>
 * Schema mismatches are a caller configuration problem, so they are thrown to whoever asked for the validation
 * instead of being folded into a processing result.
 */
public class ValidationException extends DataPrepException {

    private static final long serialVersionUID = 5920193378405617362L;

    public ValidationException(DataPrepErrorCode code, String msg) {
        super(code, msg);
    }

}
