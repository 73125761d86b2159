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

package com.amazon.fable.arima;

import lombok.Getter;

/**
 * The output of the Kalman filter over a stretch of observations, together with
 * the predicted state for the time after the last one.
 */
@Getter
public class ArimaFilterResult {

    private final double[] fitted;

    private final double[] residuals;

    /**
     * The observations with missing values replaced by their one-step
     * predictions, used to integrate later differences.
     */
    private final double[] filled;

    private final double[] predictedState;

    private final double[][] predictedCovariance;

    private final double sumOfSquares;

    private final double sumLogVariance;

    private final int observations;

    private final boolean valid;

    ArimaFilterResult(double[] fitted, double[] residuals, double[] filled, double[] predictedState,
            double[][] predictedCovariance, double sumOfSquares, double sumLogVariance, int observations,
            boolean valid) {
        this.fitted = fitted;
        this.residuals = residuals;
        this.filled = filled;
        this.predictedState = predictedState;
        this.predictedCovariance = predictedCovariance;
        this.sumOfSquares = sumOfSquares;
        this.sumLogVariance = sumLogVariance;
        this.observations = observations;
        this.valid = valid;
    }

    /**
     * @return the maximum likelihood estimate of the innovation variance
     */
    public double innovationVariance() {
        return sumOfSquares / observations;
    }

    /**
     * The exact Gaussian log-likelihood with the innovation variance concentrated
     * out.
     *
     * @return the log-likelihood, NaN for an invalid run
     */
    public double logLikelihood() {
        if (!valid || observations == 0) {
            return Double.NaN;
        }
        double variance = Math.max(innovationVariance(), Double.MIN_NORMAL);
        return -0.5 * (observations * Math.log(2 * Math.PI * variance) + sumLogVariance + observations);
    }
}
