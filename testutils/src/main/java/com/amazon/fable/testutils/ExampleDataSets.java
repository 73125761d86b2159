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

package com.amazon.fable.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic series used across the test suites. Every generator is
 * deterministic for a given seed.
 */
public class ExampleDataSets {

    private ExampleDataSets() {
    }

    /**
     * @return x[t] = x[t - 1] + drift + e[t] with standard deviation sigma,
     *         starting at start
     */
    public static double[] randomWalk(int length, double start, double drift, double sigma, long seed) {
        Random random = new Random(seed);
        double[] values = new double[length];
        double current = start;
        for (int i = 0; i < length; i++) {
            current += drift + sigma * random.nextGaussian();
            values[i] = current;
        }
        return values;
    }

    /**
     * A stationary first order autoregression around a mean. The first value is
     * drawn from the stationary distribution.
     */
    public static double[] ar1(int length, double mean, double phi, double sigma, long seed) {
        if (Math.abs(phi) >= 1) {
            throw new IllegalArgumentException("phi must be inside (-1, 1)");
        }
        Random random = new Random(seed);
        double[] values = new double[length];
        double deviation = sigma / Math.sqrt(1 - phi * phi) * random.nextGaussian();
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                deviation = phi * deviation + sigma * random.nextGaussian();
            }
            values[i] = mean + deviation;
        }
        return values;
    }

    /**
     * Positive seasonal data with a slow linear trend and multiplicative seasonal
     * factors, similar to quarterly visitor counts.
     *
     * @param length  the number of observations
     * @param period  the seasonal period
     * @param level   the starting level
     * @param trend   the change of level per step
     * @param noise   the relative standard deviation of the noise
     * @param seed    the random seed
     * @return the values, all strictly positive
     */
    public static double[] seasonal(int length, int period, double level, double trend, double noise, long seed) {
        Random random = new Random(seed);
        double[] factors = new double[period];
        double sum = 0;
        for (int j = 0; j < period; j++) {
            factors[j] = 1 + 0.3 * Math.sin(2 * Math.PI * j / period) + 0.1 * random.nextGaussian();
            sum += factors[j];
        }
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            double base = (level + trend * i) * factors[i % period] * period / sum;
            values[i] = Math.max(base * (1 + noise * random.nextGaussian()), 1e-3 * level);
        }
        return values;
    }

    /**
     * A panel of seasonal series sharing period and length, one row per series,
     * with distinct levels.
     */
    public static double[][] seasonalPanel(int series, int length, int period, long seed) {
        double[][] panel = new double[series][];
        for (int k = 0; k < series; k++) {
            panel[k] = seasonal(length, period, 100.0 * (k + 1), 0.5 * (k + 1), 0.05, seed + k);
        }
        return panel;
    }

    public static double[] constant(int length, double value) {
        double[] values = new double[length];
        Arrays.fill(values, value);
        return values;
    }

    /**
     * @return a copy of values with the given positions replaced by NaN
     */
    public static double[] withMissing(double[] values, int... positions) {
        double[] copy = values.clone();
        for (int position : positions) {
            copy[position] = Double.NaN;
        }
        return copy;
    }
}
