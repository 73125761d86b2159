/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.fable.ets;

import com.amazon.fable.CommonUtils;
import com.amazon.fable.statistics.ClassicalDecomposition;
import com.amazon.fable.statistics.Moments;

/**
 * Heuristic initial states: seasonal indices from a classical decomposition of
 * the first seasons, then a level and slope from a straight line through the
 * first seasonally adjusted values.
 */
class EtsInitializer {

    private final double level;

    private final double slope;

    private final double[] season;

    private final double spread;

    EtsInitializer(EtsStructure structure, double[] values, int period) {
        double[] y = CommonUtils.fillLinear(values);
        int n = y.length;
        double[] adjusted = y;
        if (structure.hasSeason()) {
            int k = Math.min(n, 3 * period);
            double[] head = new double[k];
            System.arraycopy(y, 0, head, 0, k);
            ClassicalDecomposition decomposition = ClassicalDecomposition.of(head, period,
                    structure.isMultiplicativeSeason());
            season = decomposition.getSeasonalIndices();
            adjusted = new double[n];
            for (int t = 0; t < n; t++) {
                adjusted[t] = structure.isMultiplicativeSeason() ? y[t] / season[t % period]
                        : y[t] - season[t % period];
            }
        } else {
            season = new double[0];
        }

        int m = Math.min(Math.max(10, 2 * period), n);
        if (structure.hasTrend() && m > 1) {
            double meanT = (m + 1) / 2.0;
            double meanY = 0;
            for (int t = 0; t < m; t++) {
                meanY += adjusted[t];
            }
            meanY /= m;
            double sxy = 0;
            double sxx = 0;
            for (int t = 0; t < m; t++) {
                sxy += (t + 1 - meanT) * (adjusted[t] - meanY);
                sxx += (t + 1 - meanT) * (t + 1 - meanT);
            }
            slope = sxy / sxx;
            level = meanY - slope * meanT;
        } else {
            double sum = 0;
            for (int t = 0; t < m; t++) {
                sum += adjusted[t];
            }
            level = sum / m;
            slope = 0;
        }

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double value : Moments.observed(values)) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        spread = Math.max(max - min, 1e-6 * Math.max(1, Math.abs(level)));
    }

    double getLevel() {
        return level;
    }

    double getSlope() {
        return slope;
    }

    double[] getSeason() {
        return season.clone();
    }

    /**
     * @return the range of the observed values, or a small positive number for a
     *         constant series
     */
    double getSpread() {
        return spread;
    }
}
