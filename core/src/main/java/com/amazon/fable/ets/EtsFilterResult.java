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

import lombok.Getter;

/**
 * The output of running the exponential smoothing recursion over a stretch of
 * observations.
 */
@Getter
public class EtsFilterResult {

    /**
     * One-step forecasts.
     */
    private final double[] fitted;

    /**
     * Observation minus one-step forecast, NaN where the observation is missing.
     */
    private final double[] residuals;

    /**
     * Innovations: the residual for additive errors and the residual relative to
     * the one-step forecast for multiplicative errors.
     */
    private final double[] innovations;

    private final double[] levels;

    private final double[] slopes;

    private final double[] seasons;

    private final EtsState finalState;

    private final double sumOfSquaredInnovations;

    private final double sumLogForecasts;

    private final int observations;

    private final boolean valid;

    EtsFilterResult(double[] fitted, double[] residuals, double[] innovations, double[] levels, double[] slopes,
            double[] seasons, EtsState finalState, double sumOfSquaredInnovations, double sumLogForecasts,
            int observations, boolean valid) {
        this.fitted = fitted;
        this.residuals = residuals;
        this.innovations = innovations;
        this.levels = levels;
        this.slopes = slopes;
        this.seasons = seasons;
        this.finalState = finalState;
        this.sumOfSquaredInnovations = sumOfSquaredInnovations;
        this.sumLogForecasts = sumLogForecasts;
        this.observations = observations;
        this.valid = valid;
    }

    /**
     * The Gaussian log-likelihood with the innovation variance concentrated out,
     * including the Jacobian term for multiplicative errors.
     *
     * @param multiplicativeError whether the errors are multiplicative
     * @return the log-likelihood, NaN for an invalid run
     */
    public double logLikelihood(boolean multiplicativeError) {
        if (!valid || observations == 0) {
            return Double.NaN;
        }
        int n = observations;
        double variance = Math.max(sumOfSquaredInnovations / n, Double.MIN_NORMAL);
        double answer = -0.5 * n * (Math.log(2 * Math.PI * variance) + 1);
        if (multiplicativeError) {
            answer -= sumLogForecasts;
        }
        return answer;
    }
}
