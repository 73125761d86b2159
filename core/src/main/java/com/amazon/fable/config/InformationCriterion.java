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

package com.amazon.fable.config;

import static com.amazon.fable.CommonUtils.checkArgument;

/**
 * The criterion used to rank candidate structures. {@code k} counts every
 * estimated parameter including the innovation variance.
 */
public enum InformationCriterion {
    /**
     * Akaike's criterion, -2 logLik + 2k.
     */
    AIC,
    /**
     * Akaike's criterion with the small sample correction 2k(k+1)/(n-k-1).
     */
    AICC,
    /**
     * The Bayesian (Schwarz) criterion, -2 logLik + k log n.
     */
    BIC;

    public double value(double logLik, int k, int n) {
        checkArgument(k > 0 && n > 0, "incorrect arguments");
        switch (this) {
        case AIC:
            return aic(logLik, k);
        case AICC:
            return aicc(logLik, k, n);
        default:
            return bic(logLik, k, n);
        }
    }

    /**
     * Relative difference below which two criterion values are considered tied.
     */
    public static final double TIE_TOLERANCE = 1e-10;

    /**
     * Compares a candidate with the incumbent. Ties within
     * {@link #TIE_TOLERANCE} go to the candidate with fewer parameters; remaining
     * ties keep the incumbent, which was considered first.
     *
     * @param value               the candidate's criterion value
     * @param parameters          the candidate's number of parameters
     * @param incumbent           the incumbent's criterion value
     * @param incumbentParameters the incumbent's number of parameters
     * @return true if the candidate should replace the incumbent
     */
    public static boolean prefers(double value, int parameters, double incumbent, int incumbentParameters) {
        if (value == incumbent
                || Math.abs(value - incumbent) <= TIE_TOLERANCE * Math.max(Math.abs(value), Math.abs(incumbent))) {
            return parameters < incumbentParameters;
        }
        return value < incumbent;
    }

    public static double aic(double logLik, int k) {
        return -2 * logLik + 2 * k;
    }

    public static double aicc(double logLik, int k, int n) {
        if (n - k - 1 <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return aic(logLik, k) + 2.0 * k * (k + 1) / (n - k - 1);
    }

    public static double bic(double logLik, int k, int n) {
        return -2 * logLik + k * Math.log(n);
    }
}
