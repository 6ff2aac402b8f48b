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
package ml.shifu.dataprep.di.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.di.spi.Transformation;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.ProcessingException;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

public class TransformationService {

    private static Logger log = LoggerFactory.getLogger(TransformationService.class);

    private final List<Transformation> transformations;

    @Inject
    public TransformationService(List<Transformation> transformations) {
        this.transformations = Collections.unmodifiableList(new ArrayList<Transformation>(transformations));
    }

    public List<Transformation> getTransformations() {
        return transformations;
    }

    /**
     * Apply all transformations in order. A runtime failure of a stage is rethrown as {@link ProcessingException}
     * whose details name the stage.
     *
     * @return the final table, and the count of rows each stage removed keyed by stage name
     */
    public Pair<Table, Map<String, Integer>> exec(Table table) {
        Map<String, Integer> rowsRemoved = new LinkedHashMap<String, Integer>();
        Table result = table;
        for(Transformation transformation: transformations) {
            int before = result.getRowCount();
            try {
                result = transformation.apply(result);
            } catch (ProcessingException e) {
                throw e;
            } catch (RuntimeException e) {
                String message = (e.getMessage() == null) ? e.toString() : e.getMessage();
                throw new ProcessingException(DataPrepErrorCode.ERROR_PROCESSING, e, message,
                        Collections.singletonMap("stage", transformation.getName()));
            }
            rowsRemoved.put(transformation.getName(), before - result.getRowCount());
            log.debug("Applied transformation: {}, {} -> {} records", transformation.getName(), before,
                    result.getRowCount());
        }
        return Pair.of(result, rowsRemoved);
    }
}
