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

import ml.shifu.dataprep.container.obj.Column;

public interface OutlierDetector {

    /**
     * Flag the outlier cells of a numerical column. Bounds are derived from the whole column before any row is
     * flagged; missing cells are never outliers.
     *
     * @param column
     *            numerical column
     * @return one flag per row, true for outliers
     */
    public boolean[] detect(Column column);
}
