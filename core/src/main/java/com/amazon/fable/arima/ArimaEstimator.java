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

import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;

import com.amazon.fable.optim.LikelihoodOptimizer;
import com.amazon.fable.optim.OptimizationException;
import com.amazon.fable.optim.OptimizationResult;
import com.amazon.fable.statistics.Differencing;
import com.amazon.fable.statistics.Moments;
import com.amazon.fable.statistics.Polynomials;

/**
 * Maximum likelihood estimation of the coefficients of one ARIMA order.
 */
@Slf4j
public class ArimaEstimator {

    /**
     * Roots of the fitted polynomials must have at least this modulus.
     */
    public static final double ROOT_MARGIN = 1.001;

    static final double HESSIAN_STEP = 1e-4;

    private final LikelihoodOptimizer optimizer;

    public ArimaEstimator(LikelihoodOptimizer optimizer) {
        this.optimizer = checkNotNull(optimizer, "optimizer must not be null");
    }

    @Getter
    public static class Estimate {

        private final ArimaCoefficients coefficients;

        private final double[] standardErrors;

        private final int evaluations;

        Estimate(ArimaCoefficients coefficients, double[] standardErrors, int evaluations) {
            this.coefficients = coefficients;
            this.standardErrors = standardErrors;
            this.evaluations = evaluations;
        }
    }

    /**
     * @param values the undifferenced series, NaN for missing
     * @param order  the order to estimate
     * @return the estimated coefficients and their standard errors
     * @throws OptimizationException if no admissible optimum is found
     */
    public Estimate estimate(double[] values, ArimaOrder order) {
        double[] start = new double[order.coefficientCount()];
        double[] steps = new double[start.length];
        Arrays.fill(steps, LikelihoodOptimizer.DEFAULT_SIMPLEX_STEP);
        if (order.isConstant()) {
            double[] differenced = Differencing.difference(values, order.getD(), order.getSeasonalD(),
                    order.getPeriod());
            double mean = Moments.mean(differenced);
            double variance = Moments.variance(differenced);
            start[start.length - 1] = Double.isNaN(mean) ? 0 : mean;
            steps[steps.length - 1] = Double.isNaN(variance) ? 1e-4 : Math.max(0.1 * Math.sqrt(variance), 1e-4);
        }
        OptimizationResult result = optimizer.minimize(x -> negativeLogLikelihood(values, order, x), start, steps);
        if (!(result.getValue() < LikelihoodOptimizer.PENALTY)) {
            throw new OptimizationException("no admissible coefficients found for " + order);
        }
        ArimaCoefficients coefficients = ArimaCoefficients.fromVector(order, result.getPoint());
        checkRoots(order, coefficients);
        double[] standardErrors = standardErrors(values, order, result.getPoint());
        return new Estimate(coefficients, standardErrors, result.getEvaluations());
    }

    static double negativeLogLikelihood(double[] values, ArimaOrder order, double[] x) {
        ArimaCoefficients coefficients = ArimaCoefficients.fromVector(order, x);
        if (!coefficients.isAdmissible()) {
            return LikelihoodOptimizer.PENALTY;
        }
        ArimaFilterResult result = new ArimaFilter(order, coefficients).run(values);
        if (!result.isValid()) {
            return LikelihoodOptimizer.PENALTY;
        }
        return -result.logLikelihood();
    }

    static void checkRoots(ArimaOrder order, ArimaCoefficients coefficients) {
        int period = order.getPeriod();
        double arModulus = Polynomials
                .minimumRootModulus(Polynomials.autoregressive(coefficients.expandedAr(period)));
        if (!(arModulus > ROOT_MARGIN)) {
            throw new OptimizationException(
                    order + " has an autoregressive root of modulus " + arModulus + ", too close to the unit circle");
        }
        double maModulus = Polynomials.minimumRootModulus(Polynomials.movingAverage(coefficients.expandedMa(period)));
        if (!(maModulus > ROOT_MARGIN)) {
            throw new OptimizationException(
                    order + " has a moving average root of modulus " + maModulus + ", too close to the unit circle");
        }
    }

    /**
     * Standard errors from the inverse of a central difference Hessian of the
     * negative log-likelihood.
     *
     * @return the standard errors, NaN where the Hessian cannot be inverted
     */
    static double[] standardErrors(double[] values, ArimaOrder order, double[] x) {
        int k = x.length;
        double[] answer = new double[k];
        Arrays.fill(answer, Double.NaN);
        if (k == 0) {
            return answer;
        }
        double[] h = new double[k];
        for (int i = 0; i < k; i++) {
            h[i] = HESSIAN_STEP * Math.max(Math.abs(x[i]), 1);
        }
        double[][] hessian = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = i; j < k; j++) {
                double value = (shifted(values, order, x, i, h[i], j, h[j])
                        - shifted(values, order, x, i, h[i], j, -h[j]) - shifted(values, order, x, i, -h[i], j, h[j])
                        + shifted(values, order, x, i, -h[i], j, -h[j])) / (4 * h[i] * h[j]);
                hessian[i][j] = value;
                hessian[j][i] = value;
            }
        }
        RealMatrix inverse;
        try {
            inverse = new LUDecomposition(new Array2DRowRealMatrix(hessian, false)).getSolver().getInverse();
        } catch (SingularMatrixException e) {
            log.debug("singular Hessian for {}, standard errors are not available", order);
            return answer;
        }
        for (int i = 0; i < k; i++) {
            double variance = inverse.getEntry(i, i);
            if (variance > 0 && !Double.isInfinite(variance)) {
                answer[i] = Math.sqrt(variance);
            }
        }
        return answer;
    }

    private static double shifted(double[] values, ArimaOrder order, double[] x, int i, double hi, int j,
            double hj) {
        double[] point = Arrays.copyOf(x, x.length);
        point[i] += hi;
        point[j] += hj;
        return negativeLogLikelihood(values, order, point);
    }
}
