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
package ml.shifu.dataprep.di.spi;

import ml.shifu.dataprep.container.obj.Table;

/**
 * One stage of the cleansing pipeline. Implementations must not change the input table; they return a new table,
 * or the input itself when nothing changes.
 */
public interface Transformation {

    /**
     * @return stage name used in logs and in the rows removed stats
     */
    public String getName();

    public Table apply(Table table);
}
