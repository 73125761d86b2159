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

import java.util.Arrays;

/**
 * The Harvey state space form of an ARMA process with expanded polynomials
 * {@code (1 - sum a_k B^k) z_t = (1 + sum b_k B^k) e_t}. The state has
 * dimension {@code r = max(p, q + 1)}, the transition matrix is the companion
 * matrix of the AR coefficients, the disturbance loading is
 * {@code R = (1, b_1, ..., b_(r-1))'} and the observation picks the first state
 * component.
 */
public class ArimaStateSpace {

    static final int MAX_DOUBLING_ITERATIONS = 64;

    static final double DOUBLING_TOLERANCE = 1e-10;

    private final double[] transition;

    private final double[] loading;

    private final int dimension;

    public ArimaStateSpace(double[] ar, double[] ma) {
        dimension = Math.max(ar.length, ma.length + 1);
        transition = new double[dimension];
        System.arraycopy(ar, 0, transition, 0, ar.length);
        loading = new double[dimension];
        loading[0] = 1;
        System.arraycopy(ma, 0, loading, 1, ma.length);
    }

    public int getDimension() {
        return dimension;
    }

    double[] getLoading() {
        return loading;
    }

    /**
     * @return T a
     */
    double[] transition(double[] a) {
        double[] answer = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            answer[i] = transition[i] * a[0] + ((i + 1 < dimension) ? a[i + 1] : 0);
        }
        return answer;
    }

    /**
     * @return T P T' + R R', using the companion structure of T
     */
    double[][] predictCovariance(double[][] p) {
        double[][] tp = new double[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                tp[i][j] = transition[i] * p[0][j] + ((i + 1 < dimension) ? p[i + 1][j] : 0);
            }
        }
        double[][] answer = new double[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                answer[i][j] = tp[i][0] * transition[j] + ((j + 1 < dimension) ? tp[i][j + 1] : 0)
                        + loading[i] * loading[j];
            }
        }
        return answer;
    }

    /**
     * Solves P = T P T' + R R' by doubling: P_(k+1) = P_k + A_k P_k A_k' and
     * A_(k+1) = A_k A_k, starting from P_0 = R R' and A_0 = T.
     *
     * @return the stationary covariance of the state, or null when the iteration
     *         does not converge
     */
    double[][] stationaryCovariance() {
        double[][] p = new double[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                p[i][j] = loading[i] * loading[j];
            }
        }
        double[][] a = new double[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            a[i][0] = transition[i];
            if (i + 1 < dimension) {
                a[i][i + 1] = 1;
            }
        }
        for (int iteration = 0; iteration < MAX_DOUBLING_ITERATIONS; iteration++) {
            double[][] increment = multiply(multiply(a, p), transpose(a));
            double change = 0;
            double size = 0;
            for (int i = 0; i < dimension; i++) {
                for (int j = 0; j < dimension; j++) {
                    p[i][j] += increment[i][j];
                    change = Math.max(change, Math.abs(increment[i][j]));
                    size = Math.max(size, Math.abs(p[i][j]));
                }
            }
            if (Double.isNaN(size) || Double.isInfinite(size)) {
                return null;
            }
            if (change <= DOUBLING_TOLERANCE * (1 + size)) {
                return p;
            }
            a = multiply(a, a);
        }
        return null;
    }

    static double[][] multiply(double[][] x, double[][] y) {
        int n = x.length;
        double[][] answer = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < n; k++) {
                double factor = x[i][k];
                if (factor != 0) {
                    for (int j = 0; j < n; j++) {
                        answer[i][j] += factor * y[k][j];
                    }
                }
            }
        }
        return answer;
    }

    static double[][] transpose(double[][] x) {
        int n = x.length;
        double[][] answer = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                answer[j][i] = x[i][j];
            }
        }
        return answer;
    }

    static double[][] copy(double[][] x) {
        double[][] answer = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            answer[i] = Arrays.copyOf(x[i], x[i].length);
        }
        return answer;
    }
}
