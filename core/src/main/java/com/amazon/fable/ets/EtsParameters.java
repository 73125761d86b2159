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

import java.util.Arrays;

import lombok.Getter;

/**
 * Smoothing parameters and initial states of an exponential smoothing model.
 * Parameters that the structure does not use are NaN. The initial seasonal
 * states are indexed by position within the season: {@code season[j]} is the
 * state used at every time t with {@code t % period == j}, starting from the
 * first observation.
 */
@Getter
public class EtsParameters {

    private final double alpha;

    private final double beta;

    private final double gamma;

    private final double phi;

    private final double level;

    private final double slope;

    private final double[] season;

    public EtsParameters(double alpha, double beta, double gamma, double phi, double level, double slope,
            double[] season) {
        checkNotNull(season, "season must not be null");
        checkArgument(!Double.isNaN(alpha), "alpha is required");
        checkArgument(!Double.isNaN(level), "initial level is required");
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
        this.phi = phi;
        this.level = level;
        this.slope = slope;
        this.season = Arrays.copyOf(season, season.length);
    }

    public double[] getSeason() {
        return Arrays.copyOf(season, season.length);
    }

    /**
     * @return phi for damped trends, 1 otherwise
     */
    double dampingOrOne() {
        return Double.isNaN(phi) ? 1.0 : phi;
    }

    EtsState initialState(EtsStructure structure) {
        return new EtsState(level, structure.hasTrend() ? slope : 0, structure.hasSeason() ? season : new double[0]);
    }
}
