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
package ml.shifu.dataprep.di.builtin;

import ml.shifu.dataprep.container.obj.Column;
import ml.shifu.dataprep.core.ColumnStatsCalculator;
import ml.shifu.dataprep.di.spi.OutlierDetector;
import ml.shifu.dataprep.util.Constants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interquartile range rule: a value is an outlier if it lies strictly below {@code Q1 - 1.5 * IQR} or strictly above
 * {@code Q3 + 1.5 * IQR}, with {@code IQR = Q3 - Q1}.
 */
public class IqrOutlierDetector implements OutlierDetector {

    private static Logger log = LoggerFactory.getLogger(IqrOutlierDetector.class);

    /**
     * Compute the [lower, upper] fences of a numerical column, NaN fences if the column has no present value.
     */
    public static double[] computeBounds(Column column) {
        ColumnStatsCalculator calculator = new ColumnStatsCalculator(column);
        double q1 = calculator.getFirstQuartile();
        double q3 = calculator.getThirdQuartile();
        double iqr = q3 - q1;
        return new double[] { q1 - Constants.IQR_MULTIPLIER * iqr, q3 + Constants.IQR_MULTIPLIER * iqr };
    }

    @Override
    public boolean[] detect(Column column) {
        double[] bounds = computeBounds(column);
        log.debug("Outlier bounds of column {}: [{}, {}]", column.getName(), bounds[0], bounds[1]);

        boolean[] outliers = new boolean[column.size()];
        for(int i = 0; i < column.size(); i++) {
            double value = column.getDouble(i);
            // comparisons against NaN are false, so missing cells and NaN bounds never flag a row
            outliers[i] = value < bounds[0] || value > bounds[1];
        }
        return outliers;
    }

}
