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

/**
 * Semantic type of a column: N means numerical, C means categorical and T means free text. Only numerical columns
 * take part in outlier detection and mean/median imputation.
 */
public enum ColumnType {
    N, C, T;

    public boolean isNumerical() {
        return this == N;
    }

    public boolean isCategorical() {
        return this == C;
    }

    public boolean isText() {
        return this == T;
    }
}
