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
package ml.shifu.dataprep.core;

import ml.shifu.dataprep.container.obj.Column;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Calculator, it helps to calculate the mean, median and quartiles of the present values of a numerical column.
 * Missing cells are skipped; if no value is present every statistic is NaN.
 *
 * <p>
 * Percentiles use linear interpolation between closest ranks (R-7), so the median of an even count is the average of
 * the two middle values.
 */
public class ColumnStatsCalculator {

    private final double[] values;

    private final Percentile percentile;

    private Double mean;

    public ColumnStatsCalculator(Column column) {
        this.values = column.getPresentValues();
        this.percentile = new Percentile().withEstimationType(EstimationType.R_7);
        this.percentile.setData(values);
    }

    public int getValidSize() {
        return values.length;
    }

    public double getMean() {
        if(mean == null) {
            mean = values.length == 0 ? Double.NaN : new Mean().evaluate(values);
        }
        return mean;
    }

    public double getMedian() {
        return getPercentile(50d);
    }

    public double getFirstQuartile() {
        return getPercentile(25d);
    }

    public double getThirdQuartile() {
        return getPercentile(75d);
    }

    /**
     * @param p
     *            percentile in (0, 100]
     */
    public double getPercentile(double p) {
        if(values.length == 0) {
            return Double.NaN;
        }
        return percentile.evaluate(p);
    }

}
