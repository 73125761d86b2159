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

/**
 * Moments of arrays that may contain missing (NaN) values. Missing values are
 * skipped.
 */
public class Moments {

    private Moments() {
    }

    public static double mean(double[] values) {
        checkNotNull(values, "values must not be null");
        double sum = 0;
        int count = 0;
        for (double value : values) {
            if (isObserved(value)) {
                sum += value;
                ++count;
            }
        }
        return (count == 0) ? Double.NaN : sum / count;
    }

    /**
     * @param values values
     * @return the unbiased sample variance, NaN with fewer than two values
     */
    public static double variance(double[] values) {
        double mean = mean(values);
        double sum = 0;
        int count = 0;
        for (double value : values) {
            if (isObserved(value)) {
                sum += (value - mean) * (value - mean);
                ++count;
            }
        }
        return (count < 2) ? Double.NaN : sum / (count - 1);
    }

    public static double sumOfSquares(double[] values) {
        checkNotNull(values, "values must not be null");
        double sum = 0;
        for (double value : values) {
            if (isObserved(value)) {
                sum += value * value;
            }
        }
        return sum;
    }

    public static double meanAbsolute(double[] values) {
        checkNotNull(values, "values must not be null");
        double sum = 0;
        int count = 0;
        for (double value : values) {
            if (isObserved(value)) {
                sum += Math.abs(value);
                ++count;
            }
        }
        return (count == 0) ? Double.NaN : sum / count;
    }

    public static double meanSquare(double[] values) {
        checkNotNull(values, "values must not be null");
        double sum = 0;
        int count = 0;
        for (double value : values) {
            if (isObserved(value)) {
                sum += value * value;
                ++count;
            }
        }
        return (count == 0) ? Double.NaN : sum / count;
    }

    /**
     * The sample autocorrelation at the given lag. Pairs with a missing member are
     * left out of the lagged sum.
     *
     * @param values values
     * @param lag    a positive lag
     * @return the autocorrelation, NaN when undefined
     */
    public static double autocorrelation(double[] values, int lag) {
        checkArgument(lag > 0, "lag must be positive");
        double mean = mean(values);
        double denominator = 0;
        for (double value : values) {
            if (isObserved(value)) {
                denominator += (value - mean) * (value - mean);
            }
        }
        if (!(denominator > 0) || lag >= values.length) {
            return Double.NaN;
        }
        double numerator = 0;
        for (int i = lag; i < values.length; i++) {
            if (isObserved(values[i]) && isObserved(values[i - lag])) {
                numerator += (values[i] - mean) * (values[i - lag] - mean);
            }
        }
        return numerator / denominator;
    }

    /**
     * @param values values
     * @return the observed values in order
     */
    public static double[] observed(double[] values) {
        checkNotNull(values, "values must not be null");
        int count = 0;
        for (double value : values) {
            if (isObserved(value)) {
                ++count;
            }
        }
        double[] answer = new double[count];
        int index = 0;
        for (double value : values) {
            if (isObserved(value)) {
                answer[index++] = value;
            }
        }
        return answer;
    }
}
