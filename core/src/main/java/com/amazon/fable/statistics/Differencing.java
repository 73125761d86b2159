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

/**
 * Lagged differences and the polynomial that undoes them.
 */
public class Differencing {

    private Differencing() {
    }

    /**
     * @param values values, NaN for missing
     * @param lag    the lag
     * @return x[t] - x[t - lag] for t >= lag; a missing operand gives a missing
     *         difference
     */
    public static double[] difference(double[] values, int lag) {
        checkNotNull(values, "values must not be null");
        checkArgument(lag > 0, "lag must be positive");
        if (values.length <= lag) {
            return new double[0];
        }
        double[] answer = new double[values.length - lag];
        for (int i = 0; i < answer.length; i++) {
            answer[i] = values[i + lag] - values[i];
        }
        return answer;
    }

    public static double[] difference(double[] values, int d, int seasonalD, int period) {
        double[] answer = values;
        for (int i = 0; i < seasonalD; i++) {
            answer = difference(answer, period);
        }
        for (int i = 0; i < d; i++) {
            answer = difference(answer, 1);
        }
        return answer;
    }

    /**
     * The coefficients delta of (1 - B)^d (1 - B^m)^D = 1 - sum delta_k B^k, so
     * that y[t] = w[t] + sum delta_k y[t - k] where w is the differenced series.
     *
     * @param d         non-seasonal order
     * @param seasonalD seasonal order
     * @param period    the seasonal period
     * @return delta_1 ... delta_K with K = d + period * D
     */
    public static double[] integrationCoefficients(int d, int seasonalD, int period) {
        double[] polynomial = { 1.0 };
        for (int i = 0; i < d; i++) {
            polynomial = Polynomials.multiply(polynomial, new double[] { 1.0, -1.0 });
        }
        for (int i = 0; i < seasonalD; i++) {
            double[] factor = new double[period + 1];
            factor[0] = 1.0;
            factor[period] = -1.0;
            polynomial = Polynomials.multiply(polynomial, factor);
        }
        double[] delta = new double[polynomial.length - 1];
        for (int k = 1; k < polynomial.length; k++) {
            delta[k - 1] = -polynomial[k];
        }
        return delta;
    }
}
