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

import static com.amazon.fable.CommonUtils.countObserved;
import static com.amazon.fable.CommonUtils.fillLinear;
import static com.amazon.fable.CommonUtils.isObserved;

import com.amazon.fable.statistics.Differencing;

import java.util.Arrays;

/**
 * The Kalman filter of an ARIMA model applied to the undifferenced series. Each
 * observation is differenced against the previous (filled) observations and
 * the state space recursion runs on the differenced value minus the constant.
 */
public class ArimaFilter {

    private final ArimaStateSpace space;

    private final double constant;

    private final double[] delta;

    public ArimaFilter(ArimaOrder order, ArimaCoefficients coefficients) {
        this.space = new ArimaStateSpace(coefficients.expandedAr(order.getPeriod()),
                coefficients.expandedMa(order.getPeriod()));
        this.constant = order.isConstant() ? coefficients.getConstant() : 0;
        this.delta = Differencing.integrationCoefficients(order.getD(),
                order.getSeasonalD(), order.getPeriod());
    }

    ArimaStateSpace getSpace() {
        return space;
    }

    double[] getDelta() {
        return delta;
    }

    double getConstant() {
        return constant;
    }

    /**
     * @param values the observations, NaN for missing
     * @return the filter output, invalid when the initial covariance cannot be
     *         computed
     */
    public ArimaFilterResult run(double[] values) {
        double[][] initial = space.stationaryCovariance();
        if (initial == null) {
            return new ArimaFilterResult(new double[values.length], new double[values.length], values,
                    new double[space.getDimension()], new double[0][0], 0, 0, 0, false);
        }
        return resume(new double[space.getDimension()], initial, new double[0], values);
    }

    /**
     * Continues the filter from a predicted state.
     *
     * @param state      the predicted state for the first new value
     * @param covariance its covariance
     * @param history    the filled observations so far
     * @param values     the new observations
     * @return the filter output over the new observations
     */
    public ArimaFilterResult resume(double[] state, double[][] covariance, double[] history, double[] values) {
        int offset = history.length;
        int n = values.length;
        double[] work = Arrays.copyOf(history, offset + n);
        System.arraycopy(values, 0, work, offset, n);
        primeLeadingValues(work, offset, values);
        double[] fitted = new double[n];
        double[] residuals = new double[n];
        double[] a = Arrays.copyOf(state, state.length);
        double[][] p = ArimaStateSpace.copy(covariance);
        int dimension = space.getDimension();
        double sumOfSquares = 0;
        double sumLog = 0;
        int used = 0;
        boolean valid = true;

        for (int i = 0; i < n; i++) {
            int t = offset + i;
            if (t < delta.length) {
                fitted[i] = Double.NaN;
                residuals[i] = Double.NaN;
                continue;
            }
            double integration = 0;
            for (int k = 1; k <= delta.length; k++) {
                if (delta[k - 1] != 0) {
                    integration += delta[k - 1] * work[t - k];
                }
            }
            double prediction = constant + a[0] + integration;
            fitted[i] = prediction;
            if (isObserved(values[i]) && isObserved(integration)) {
                double v = values[i] - prediction;
                double f = p[0][0];
                if (!(f > 0)) {
                    valid = false;
                    break;
                }
                double[] gain = new double[dimension];
                for (int j = 0; j < dimension; j++) {
                    gain[j] = p[j][0] / f;
                    a[j] += gain[j] * v;
                }
                double[] row = Arrays.copyOf(p[0], dimension);
                for (int j = 0; j < dimension; j++) {
                    for (int k = 0; k < dimension; k++) {
                        p[j][k] -= gain[j] * row[k];
                    }
                }
                sumOfSquares += v * v / f;
                sumLog += Math.log(f);
                residuals[i] = v;
                ++used;
            } else {
                residuals[i] = Double.NaN;
                if (!isObserved(values[i])) {
                    work[t] = prediction;
                }
            }
            a = space.transition(a);
            p = space.predictCovariance(p);
        }
        valid = valid && isObserved(sumOfSquares) && isObserved(sumLog) && isObserved(a[0]);
        return new ArimaFilterResult(fitted, residuals, Arrays.copyOfRange(work, offset, offset + n), a, p,
                sumOfSquares, sumLog, used, valid);
    }

    /**
     * Missing values among the first observations, which differencing consumes,
     * are interpolated so that later differences stay defined.
     */
    private void primeLeadingValues(double[] work, int offset, double[] values) {
        if (offset >= delta.length || countObserved(values) == 0) {
            return;
        }
        double[] interpolated = null;
        for (int t = offset; t < Math.min(delta.length, work.length); t++) {
            if (!isObserved(work[t])) {
                if (interpolated == null) {
                    interpolated = fillLinear(values);
                }
                work[t] = interpolated[t - offset];
            }
        }
    }
}
