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

import java.util.ArrayList;
import java.util.List;

import com.amazon.fable.spec.EtsOptions;
import com.amazon.fable.spec.ModelOption;
import com.amazon.fable.spec.ModelSpecification;

/**
 * Maps the unit box onto the admissible parameters of one structure. Smoothing
 * parameters are nested so that beta stays below alpha and gamma below
 * 1 - alpha; the last seasonal state is fixed by the normalization of the
 * others.
 */
class EtsParameterSpace {

    static final double LOWER = 1e-4;

    static final double UPPER = 0.9999;

    static final double PHI_LOWER = 0.8;

    static final double PHI_UPPER = 0.98;

    private static final double START_ALPHA = 0.2;

    private static final double START_BETA = 0.1;

    private static final double START_GAMMA = 0.05;

    private static final double START_PHI = 0.978;

    private final EtsStructure structure;

    private final int period;

    private final EtsInitializer initializer;

    private final ModelOption<Double> alpha;

    private final ModelOption<Double> beta;

    private final ModelOption<Double> gamma;

    private final ModelOption<Double> phi;

    private final List<String> free = new ArrayList<>();

    EtsParameterSpace(EtsStructure structure, int period, ModelSpecification specification,
            EtsInitializer initializer) {
        this.structure = structure;
        this.period = period;
        this.initializer = initializer;
        this.alpha = specification.get(EtsOptions.ALPHA);
        this.beta = specification.get(EtsOptions.BETA);
        this.gamma = specification.get(EtsOptions.GAMMA);
        this.phi = specification.get(EtsOptions.PHI);
        if (alpha.isAutomatic()) {
            free.add("alpha");
        }
        if (structure.hasTrend() && beta.isAutomatic()) {
            free.add("beta");
        }
        if (structure.hasSeason() && gamma.isAutomatic()) {
            free.add("gamma");
        }
        if (structure.isDamped() && phi.isAutomatic()) {
            free.add("phi");
        }
        free.add("l");
        if (structure.hasTrend()) {
            free.add("b");
        }
        if (structure.hasSeason()) {
            for (int j = 0; j < period - 1; j++) {
                free.add("s" + j);
            }
        }
    }

    /**
     * @return the number of estimated parameters, excluding the innovation
     *         variance
     */
    int dimension() {
        return free.size();
    }

    static int freeParameterCount(EtsStructure structure, int period, ModelSpecification specification) {
        int count = 1;
        if (specification.get(EtsOptions.ALPHA).isAutomatic()) {
            ++count;
        }
        if (structure.hasTrend()) {
            count += specification.get(EtsOptions.BETA).isAutomatic() ? 2 : 1;
        }
        if (structure.hasSeason()) {
            count += specification.get(EtsOptions.GAMMA).isAutomatic() ? period : period - 1;
        }
        if (structure.isDamped() && specification.get(EtsOptions.PHI).isAutomatic()) {
            ++count;
        }
        return count;
    }

    double[] start() {
        double[] u = new double[free.size()];
        int index = 0;
        double alphaLow = alphaLower();
        double alphaHigh = alphaUpper();
        double alphaStart = alpha.orElse(Math.min(alphaHigh, Math.max(alphaLow, START_ALPHA)));
        if (alpha.isAutomatic()) {
            u[index++] = fraction(alphaStart, alphaLow, alphaHigh);
        }
        if (structure.hasTrend() && beta.isAutomatic()) {
            u[index++] = START_BETA;
        }
        if (structure.hasSeason() && gamma.isAutomatic()) {
            u[index++] = START_GAMMA;
        }
        if (structure.isDamped() && phi.isAutomatic()) {
            u[index++] = fraction(START_PHI, PHI_LOWER, PHI_UPPER);
        }
        u[index++] = 0.5;
        if (structure.hasTrend()) {
            u[index++] = 0.5;
        }
        if (structure.hasSeason()) {
            double[] season = initializer.getSeason();
            for (int j = 0; j < period - 1; j++) {
                double low = seasonLower(season[j]);
                double high = seasonUpper(season[j]);
                u[index++] = fraction(season[j], low, high);
            }
        }
        return u;
    }

    EtsParameters decode(double[] u) {
        checkArgument(u.length == free.size(), "incorrect dimension");
        int index = 0;
        double a = alpha.isFixed() ? alpha.getValue() : scale(u[index++], alphaLower(), alphaUpper());
        double b = Double.NaN;
        if (structure.hasTrend()) {
            b = beta.isFixed() ? beta.getValue() : scale(u[index++], LOWER, Math.max(LOWER, a));
        }
        double g = Double.NaN;
        if (structure.hasSeason()) {
            g = gamma.isFixed() ? gamma.getValue() : scale(u[index++], LOWER, Math.max(LOWER, 1 - a));
        }
        double p = Double.NaN;
        if (structure.isDamped()) {
            p = phi.isFixed() ? phi.getValue() : scale(u[index++], PHI_LOWER, PHI_UPPER);
        }
        double spread = initializer.getSpread();
        double level = scale(u[index++], initializer.getLevel() - spread, initializer.getLevel() + spread);
        double slope = Double.NaN;
        if (structure.hasTrend()) {
            slope = scale(u[index++], initializer.getSlope() - spread / 2, initializer.getSlope() + spread / 2);
        }
        double[] season = new double[structure.hasSeason() ? period : 0];
        if (structure.hasSeason()) {
            double[] start = initializer.getSeason();
            double sum = 0;
            for (int j = 0; j < period - 1; j++) {
                season[j] = scale(u[index++], seasonLower(start[j]), seasonUpper(start[j]));
                sum += season[j];
            }
            season[period - 1] = structure.isMultiplicativeSeason() ? period - sum : -sum;
        }
        return new EtsParameters(a, b, g, p, level, slope, season);
    }

    private double alphaLower() {
        double low = LOWER;
        if (structure.hasTrend() && beta.isFixed()) {
            low = Math.max(low, beta.getValue());
        }
        return low;
    }

    private double alphaUpper() {
        double high = UPPER;
        if (structure.hasSeason() && gamma.isFixed()) {
            high = Math.min(high, 1 - gamma.getValue());
        }
        return Math.max(high, alphaLower());
    }

    private double seasonLower(double start) {
        if (structure.isMultiplicativeSeason()) {
            return Math.max(1e-3, start - 1);
        }
        return start - initializer.getSpread();
    }

    private double seasonUpper(double start) {
        if (structure.isMultiplicativeSeason()) {
            return start + 1;
        }
        return start + initializer.getSpread();
    }

    private static double scale(double u, double low, double high) {
        return low + u * (high - low);
    }

    private static double fraction(double value, double low, double high) {
        if (high <= low) {
            return 0.5;
        }
        return Math.min(1, Math.max(0, (value - low) / (high - low)));
    }
}
