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

import org.apache.commons.math3.analysis.solvers.LaguerreSolver;
import org.apache.commons.math3.complex.Complex;

/**
 * Operations on lag polynomials. Coefficients are stored in ascending powers of
 * the backshift operator, so index 0 holds the constant term.
 */
public class Polynomials {

    private Polynomials() {
    }

    public static double[] multiply(double[] a, double[] b) {
        checkNotNull(a, "a must not be null");
        checkNotNull(b, "b must not be null");
        checkArgument(a.length > 0 && b.length > 0, "polynomials must have at least one coefficient");
        double[] answer = new double[a.length + b.length - 1];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < b.length; j++) {
                answer[i + j] += a[i] * b[j];
            }
        }
        return answer;
    }

    /**
     * @param phi autoregressive coefficients phi_1 ... phi_p
     * @return 1 - phi_1 B - ... - phi_p B^p
     */
    public static double[] autoregressive(double[] phi) {
        double[] answer = new double[phi.length + 1];
        answer[0] = 1;
        for (int i = 0; i < phi.length; i++) {
            answer[i + 1] = -phi[i];
        }
        return answer;
    }

    /**
     * @param theta moving average coefficients theta_1 ... theta_q
     * @return 1 + theta_1 B + ... + theta_q B^q
     */
    public static double[] movingAverage(double[] theta) {
        double[] answer = new double[theta.length + 1];
        answer[0] = 1;
        System.arraycopy(theta, 0, answer, 1, theta.length);
        return answer;
    }

    /**
     * Spreads seasonal coefficients to multiples of the period, so that
     * coefficient i becomes the coefficient of B^(period * (i + 1)).
     */
    public static double[] spread(double[] seasonal, int period) {
        double[] answer = new double[seasonal.length * period];
        for (int i = 0; i < seasonal.length; i++) {
            answer[(i + 1) * period - 1] = seasonal[i];
        }
        return answer;
    }

    /**
     * Expands (1 - sum phi B^i)(1 - sum Phi B^(m j)) and returns the
     * coefficients a_k of 1 - sum a_k B^k.
     */
    public static double[] expandAutoregressive(double[] phi, double[] seasonalPhi, int period) {
        double[] product = multiply(autoregressive(phi), autoregressive(spread(seasonalPhi, period)));
        double[] answer = new double[product.length - 1];
        for (int k = 1; k < product.length; k++) {
            answer[k - 1] = -product[k];
        }
        return answer;
    }

    /**
     * Expands (1 + sum theta B^i)(1 + sum Theta B^(m j)) and returns the
     * coefficients b_k of 1 + sum b_k B^k.
     */
    public static double[] expandMovingAverage(double[] theta, double[] seasonalTheta, int period) {
        double[] product = multiply(movingAverage(theta), movingAverage(spread(seasonalTheta, period)));
        double[] answer = new double[product.length - 1];
        System.arraycopy(product, 1, answer, 0, answer.length);
        return answer;
    }

    /**
     * Checks that the autoregressive polynomial 1 - sum phi_i B^i has all roots
     * outside the unit circle by stepping down through the partial
     * autocorrelations.
     *
     * @param phi autoregressive coefficients
     * @return true if the process is stationary
     */
    public static boolean isStationary(double[] phi) {
        double[] a = phi.clone();
        for (int k = a.length; k >= 1; k--) {
            double r = a[k - 1];
            if (!(Math.abs(r) < 1)) {
                return false;
            }
            double[] next = new double[k - 1];
            double scale = 1 - r * r;
            for (int j = 1; j < k; j++) {
                next[j - 1] = (a[j - 1] + r * a[k - j - 1]) / scale;
            }
            a = next;
        }
        return true;
    }

    /**
     * @param theta moving average coefficients
     * @return true if 1 + sum theta_i B^i has all roots outside the unit circle
     */
    public static boolean isInvertible(double[] theta) {
        double[] negated = new double[theta.length];
        for (int i = 0; i < theta.length; i++) {
            negated[i] = -theta[i];
        }
        return isStationary(negated);
    }

    /**
     * @param polynomial coefficients in ascending powers
     * @return the smallest modulus of the roots, infinity for a constant
     */
    public static double minimumRootModulus(double[] polynomial) {
        int degree = polynomial.length - 1;
        while (degree > 0 && polynomial[degree] == 0) {
            --degree;
        }
        if (degree == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double[] trimmed = new double[degree + 1];
        System.arraycopy(polynomial, 0, trimmed, 0, degree + 1);
        Complex[] roots = new LaguerreSolver().solveAllComplex(trimmed, 0);
        double minimum = Double.POSITIVE_INFINITY;
        for (Complex root : roots) {
            minimum = Math.min(minimum, root.abs());
        }
        return minimum;
    }
}
