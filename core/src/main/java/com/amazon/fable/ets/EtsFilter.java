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
import static com.amazon.fable.CommonUtils.checkNotNull;
import static com.amazon.fable.CommonUtils.isObserved;

/**
 * The exponential smoothing recursion. All structures share the state update
 * written in terms of the response residual {@code y - mu}; the error type only
 * changes the likelihood and the way innovations are simulated.
 */
public class EtsFilter {

    private final EtsStructure structure;

    private final EtsParameters parameters;

    private final int period;

    private final double phi;

    public EtsFilter(EtsStructure structure, EtsParameters parameters, int period) {
        this.structure = checkNotNull(structure, "structure must not be null");
        this.parameters = checkNotNull(parameters, "parameters must not be null");
        checkArgument(!structure.hasSeason() || parameters.getSeason().length == period,
                "seasonal states must cover one period");
        this.period = period;
        this.phi = structure.isDamped() ? parameters.getPhi() : 1.0;
    }

    public EtsFilterResult run(double[] values) {
        return resume(parameters.initialState(structure), 0, values);
    }

    /**
     * Continues the recursion from a state.
     *
     * @param start  the state before the first value
     * @param offset the time index of the first value, counted from the start of
     *               the series
     * @param values the observations, NaN for missing
     * @return the filter output over these values
     */
    public EtsFilterResult resume(EtsState start, int offset, double[] values) {
        EtsState state = start.copy();
        int n = values.length;
        double[] fitted = new double[n];
        double[] residuals = new double[n];
        double[] innovations = new double[n];
        double[] levels = new double[n];
        double[] slopes = new double[n];
        double[] seasons = new double[n];
        double sse = 0;
        double sumLog = 0;
        int used = 0;
        boolean valid = true;
        for (int i = 0; i < n && valid; i++) {
            int position = structure.hasSeason() ? (offset + i) % period : 0;
            double mu = oneStep(state, position);
            fitted[i] = mu;
            double r = 0;
            if (structure.needsPositiveData() && !(mu > 0)) {
                valid = false;
            }
            if (isObserved(values[i])) {
                r = values[i] - mu;
                residuals[i] = r;
                double innovation = structure.isMultiplicativeError() ? r / mu : r;
                innovations[i] = innovation;
                sse += innovation * innovation;
                if (structure.isMultiplicativeError()) {
                    sumLog += Math.log(Math.abs(mu));
                }
                ++used;
            } else {
                residuals[i] = Double.NaN;
                innovations[i] = Double.NaN;
            }
            update(state, position, r);
            valid = valid && state.isFinite() && isObserved(mu);
            levels[i] = state.level;
            slopes[i] = state.slope;
            seasons[i] = structure.hasSeason() ? state.season[position] : Double.NaN;
        }
        return new EtsFilterResult(fitted, residuals, innovations, levels, slopes, seasons, state, sse, sumLog, used,
                valid && isObserved(sse));
    }

    double oneStep(EtsState state, int position) {
        double base = state.level + phi * state.slope;
        switch (structure.getSeason()) {
        case ADDITIVE:
            return base + state.season[position];
        case MULTIPLICATIVE:
            return base * state.season[position];
        default:
            return base;
        }
    }

    /**
     * Applies one step of the state update for the response residual r.
     */
    void update(EtsState state, int position, double r) {
        double dampedSlope = phi * state.slope;
        double base = state.level + dampedSlope;
        double alpha = parameters.getAlpha();
        double beta = structure.hasTrend() ? parameters.getBeta() : 0;
        switch (structure.getSeason()) {
        case MULTIPLICATIVE:
            double s = state.season[position];
            state.level = base + alpha * r / s;
            state.slope = structure.hasTrend() ? dampedSlope + beta * r / s : 0;
            state.season[position] = s + parameters.getGamma() * r / base;
            break;
        case ADDITIVE:
            state.level = base + alpha * r;
            state.slope = structure.hasTrend() ? dampedSlope + beta * r : 0;
            state.season[position] = state.season[position] + parameters.getGamma() * r;
            break;
        default:
            state.level = base + alpha * r;
            state.slope = structure.hasTrend() ? dampedSlope + beta * r : 0;
        }
    }

    int positionOf(int time) {
        return structure.hasSeason() ? time % period : 0;
    }

    /**
     * The coefficients c_1 ... c_(h-1) of the linear innovations form: the effect
     * of a unit residual on the forecasts 1 ... h-1 steps after it. Valid for
     * structures without a multiplicative season.
     */
    double[] impulseResponse(int h) {
        double[] seasonZero = new double[structure.hasSeason() ? period : 0];
        EtsState state = new EtsState(0, 0, seasonZero);
        update(state, 0, 1.0);
        double[] c = new double[Math.max(0, h - 1)];
        for (int j = 1; j < h; j++) {
            int position = positionOf(j);
            c[j - 1] = oneStep(state, position);
            update(state, position, 0);
        }
        return c;
    }
}
