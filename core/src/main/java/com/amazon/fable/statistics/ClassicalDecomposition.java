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

package com.amazon.fable.statistics;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;
import static com.amazon.fable.CommonUtils.isObserved;

import java.util.Arrays;

import lombok.Getter;

/**
 * A moving average decomposition of a series into trend, seasonal and
 * remainder components. The trend is a centred moving average of order
 * {@code period}, so it is missing for the first and last half season.
 */
@Getter
public class ClassicalDecomposition {

    private final int period;

    private final boolean multiplicative;

    private final double[] trend;

    /**
     * Seasonal indices by position within the season, normalized to sum to zero
     * (additive) or average to one (multiplicative).
     */
    private final double[] seasonalIndices;

    private final double[] seasonal;

    private final double[] remainder;

    private ClassicalDecomposition(int period, boolean multiplicative, double[] trend, double[] seasonalIndices,
            double[] seasonal, double[] remainder) {
        this.period = period;
        this.multiplicative = multiplicative;
        this.trend = trend;
        this.seasonalIndices = seasonalIndices;
        this.seasonal = seasonal;
        this.remainder = remainder;
    }

    /**
     * @param values         values, NaN for missing
     * @param period         seasonal period, at least 2
     * @param multiplicative whether to divide rather than subtract
     * @return the decomposition
     */
    public static ClassicalDecomposition of(double[] values, int period, boolean multiplicative) {
        checkNotNull(values, "values must not be null");
        checkArgument(period > 1, "period must be above 1");
        checkArgument(values.length >= 2 * period, "decomposition needs two full seasons");
        int n = values.length;
        double[] trend = movingAverage(values, period);

        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int t = 0; t < n; t++) {
            if (isObserved(trend[t]) && isObserved(values[t])) {
                double detrended = multiplicative ? values[t] / trend[t] : values[t] - trend[t];
                if (isObserved(detrended)) {
                    sums[t % period] += detrended;
                    counts[t % period]++;
                }
            }
        }
        double[] indices = new double[period];
        double total = 0;
        for (int j = 0; j < period; j++) {
            indices[j] = (counts[j] == 0) ? (multiplicative ? 1 : 0) : sums[j] / counts[j];
            total += indices[j];
        }
        double average = total / period;
        for (int j = 0; j < period; j++) {
            if (multiplicative) {
                indices[j] = (average != 0) ? indices[j] / average : 1;
            } else {
                indices[j] -= average;
            }
        }

        double[] seasonal = new double[n];
        double[] remainder = new double[n];
        for (int t = 0; t < n; t++) {
            seasonal[t] = indices[t % period];
            if (multiplicative) {
                remainder[t] = values[t] / (trend[t] * seasonal[t]);
            } else {
                remainder[t] = values[t] - trend[t] - seasonal[t];
            }
        }
        return new ClassicalDecomposition(period, multiplicative, trend, indices, seasonal, remainder);
    }

    /**
     * A centred moving average of order {@code period}; a 2 x m average when the
     * period is even. Windows containing a missing value give a missing average.
     */
    static double[] movingAverage(double[] values, int period) {
        int n = values.length;
        double[] answer = new double[n];
        Arrays.fill(answer, Double.NaN);
        int half = period / 2;
        for (int t = half; t < n - half; t++) {
            double sum = 0;
            if (period % 2 == 1) {
                for (int j = -half; j <= half; j++) {
                    sum += values[t + j];
                }
                answer[t] = sum / period;
            } else {
                sum = 0.5 * values[t - half] + 0.5 * values[t + half];
                for (int j = -half + 1; j < half; j++) {
                    sum += values[t + j];
                }
                answer[t] = sum / period;
            }
        }
        return answer;
    }

    /**
     * The strength of seasonality, max(0, 1 - var(remainder) / var(season +
     * remainder)), computed on the additive decomposition.
     *
     * @param values values, NaN for missing
     * @param period seasonal period
     * @return a value in [0, 1], or 0 when there are fewer than two seasons
     */
    public static double seasonalStrength(double[] values, int period) {
        if (period <= 1 || values.length < 2 * period) {
            return 0;
        }
        ClassicalDecomposition decomposition = of(values, period, false);
        double[] remainder = decomposition.getRemainder();
        double[] seasonal = decomposition.getSeasonal();
        double[] detrended = new double[remainder.length];
        for (int t = 0; t < detrended.length; t++) {
            detrended[t] = seasonal[t] + remainder[t];
        }
        double denominator = Moments.variance(detrended);
        if (!(denominator > 0)) {
            return 0;
        }
        return Math.max(0, 1 - Moments.variance(remainder) / denominator);
    }
}
