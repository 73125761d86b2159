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

import static com.amazon.fable.CommonUtils.checkArgument;

/**
 * Forecast moments of the ETS models with multiplicative errors and a
 * multiplicative season, (M,N,M), (M,A,M) and (M,Ad,M). These are the class 3
 * models of Hyndman, Koehler, Ord and Snyder (2008, section 6.5).
 * <p>
 * With x = (level, slope) and s the seasonal states, a step at seasonal
 * position p with innovation e maps x to (F + e g w') x and s to
 * (I + e gamma E_pp) s. The product Z = x s' is then linear in Z with
 * coefficients in e, so vec(Z) evolves as (C0 + e C1 + e^2 C2) vec(Z). The
 * first two moments of vec(Z) follow from the Gaussian moments of e, and the
 * forecast y = (w'x) s_p (1 + e) is a linear function of vec(Z).
 * <p>
 * vec(Z) is stored column major: entry j * q + i holds x_i s_j, where q is the
 * number of trend states.
 */
class EtsSeasonalMoments {

    private final int q;

    private final int period;

    private final double phi;

    private final double[] g;

    private final double gamma;

    private final double sigma2;

    EtsSeasonalMoments(EtsStructure structure, EtsParameters parameters, int period, double sigma2) {
        checkArgument(structure.isMultiplicativeError() && structure.isMultiplicativeSeason(),
                "moments need multiplicative errors and a multiplicative season");
        this.q = structure.hasTrend() ? 2 : 1;
        this.period = period;
        this.phi = structure.isDamped() ? parameters.getPhi() : 1.0;
        this.g = structure.hasTrend() ? new double[] { parameters.getAlpha(), parameters.getBeta() }
                : new double[] { parameters.getAlpha() };
        this.gamma = parameters.getGamma();
        this.sigma2 = sigma2;
    }

    /**
     * @param state        the state after the last observation
     * @param firstTime    the time index of the first forecast
     * @param h            the number of steps
     * @param meanOut      receives the forecast means
     * @param varianceOut  receives the forecast variances
     */
    void forecast(EtsState state, int firstTime, int h, double[] meanOut, double[] varianceOut) {
        int d = q * period;
        double[] x = (q == 2) ? new double[] { state.level, state.slope } : new double[] { state.level };
        double[] mean = new double[d];
        for (int j = 0; j < period; j++) {
            for (int i = 0; i < q; i++) {
                mean[j * q + i] = x[i] * state.season[j];
            }
        }
        double[][] second = new double[d][d];
        for (int a = 0; a < d; a++) {
            for (int b = 0; b < d; b++) {
                second[a][b] = mean[a] * mean[b];
            }
        }

        for (int step = 0; step < h; step++) {
            int p = (firstTime + step) % period;
            double mu = measure(mean, p);
            double square = 0;
            for (int a = 0; a < q; a++) {
                for (int b = 0; b < q; b++) {
                    square += weight(a) * weight(b) * second[p * q + a][p * q + b];
                }
            }
            meanOut[step] = mu;
            varianceOut[step] = Math.max(0, (1 + sigma2) * square - mu * mu);

            double[] c0 = apply(0, p, mean);
            double[] c2 = apply(2, p, mean);
            for (int k = 0; k < d; k++) {
                mean[k] = c0[k] + sigma2 * c2[k];
            }
            second = advance(second, p);
        }
    }

    private double weight(int i) {
        return (i == 0) ? 1.0 : phi;
    }

    private double measure(double[] z, int p) {
        double answer = 0;
        for (int i = 0; i < q; i++) {
            answer += weight(i) * z[p * q + i];
        }
        return answer;
    }

    /**
     * E[(C0 + e C1 + e^2 C2) S (C0 + e C1 + e^2 C2)'] for Gaussian e.
     */
    private double[][] advance(double[][] second, int p) {
        double[][] p0 = transpose(leftApply(0, p, second));
        double[][] p1 = transpose(leftApply(1, p, second));
        double[][] p2 = transpose(leftApply(2, p, second));
        double[][] c00 = leftApply(0, p, p0);
        double[][] c11 = leftApply(1, p, p1);
        double[][] c02 = leftApply(0, p, p2);
        double[][] c22 = leftApply(2, p, p2);
        int d = second.length;
        double[][] answer = new double[d][d];
        for (int a = 0; a < d; a++) {
            for (int b = 0; b < d; b++) {
                answer[a][b] = c00[a][b] + sigma2 * (c11[a][b] + c02[a][b] + c02[b][a])
                        + 3 * sigma2 * sigma2 * c22[a][b];
            }
        }
        return answer;
    }

    private double[][] leftApply(int operator, int p, double[][] matrix) {
        int d = matrix.length;
        double[][] answer = new double[d][d];
        double[] column = new double[d];
        for (int c = 0; c < d; c++) {
            for (int r = 0; r < d; r++) {
                column[r] = matrix[r][c];
            }
            double[] applied = apply(operator, p, column);
            for (int r = 0; r < d; r++) {
                answer[r][c] = applied[r];
            }
        }
        return answer;
    }

    private static double[][] transpose(double[][] matrix) {
        int d = matrix.length;
        double[][] answer = new double[d][d];
        for (int a = 0; a < d; a++) {
            for (int b = 0; b < d; b++) {
                answer[b][a] = matrix[a][b];
            }
        }
        return answer;
    }

    /**
     * C0 v = vec(F V), C1 v = vec(G V + gamma F V E_pp), C2 v = vec(gamma G V
     * E_pp), with G = g w'.
     */
    private double[] apply(int operator, int p, double[] v) {
        double[] answer = new double[v.length];
        for (int j = 0; j < period; j++) {
            switch (operator) {
            case 0:
                transition(v, j, answer, 1.0);
                break;
            case 1:
                gain(v, j, answer, 1.0);
                if (j == p) {
                    transition(v, j, answer, gamma);
                }
                break;
            default:
                if (j == p) {
                    gain(v, j, answer, gamma);
                }
            }
        }
        return answer;
    }

    // F = [[1, phi], [0, phi]] with a trend, [1] without
    private void transition(double[] v, int j, double[] out, double factor) {
        int base = j * q;
        if (q == 2) {
            out[base] += factor * (v[base] + phi * v[base + 1]);
            out[base + 1] += factor * phi * v[base + 1];
        } else {
            out[base] += factor * v[base];
        }
    }

    private void gain(double[] v, int j, double[] out, double factor) {
        int base = j * q;
        double projected = 0;
        for (int i = 0; i < q; i++) {
            projected += weight(i) * v[base + i];
        }
        for (int i = 0; i < q; i++) {
            out[base + i] += factor * g[i] * projected;
        }
    }
}
