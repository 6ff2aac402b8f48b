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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure inside the cleansing pipeline. {@link ml.shifu.dataprep.core.DataProcessor} converts it into a failed
 * result, together with its {@link #getDetails()}.
 */
public class ProcessingException extends DataPrepException {

    private static final long serialVersionUID = 1864526207193052716L;

    private final Map<String, Object> details;

    public ProcessingException(DataPrepErrorCode code, String msg) {
        this(code, msg, null);
    }

    public ProcessingException(DataPrepErrorCode code, String msg, Map<String, ?> details) {
        super(code, msg);
        this.details = (details == null) ? Collections.<String, Object> emptyMap() : Collections
                .unmodifiableMap(new LinkedHashMap<String, Object>(details));
    }

    public ProcessingException(DataPrepErrorCode code, Exception e, String msg, Map<String, ?> details) {
        super(code, e, msg);
        this.details = (details == null) ? Collections.<String, Object> emptyMap() : Collections
                .unmodifiableMap(new LinkedHashMap<String, Object>(details));
    }

    /**
     * @return extra information about the failure, never null
     */
    public Map<String, Object> getDetails() {
        return details;
    }

}
