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

import java.util.Arrays;

import lombok.Getter;

/**
 * The level, slope and seasonal states of an exponential smoothing model at one
 * point of the filter. The seasonal array is circular: the state for time t is
 * held at {@code t % period}.
 */
@Getter
public class EtsState {

    double level;

    double slope;

    final double[] season;

    EtsState(double level, double slope, double[] season) {
        this.level = level;
        this.slope = slope;
        this.season = Arrays.copyOf(season, season.length);
    }

    EtsState copy() {
        return new EtsState(level, slope, season);
    }

    public double[] getSeason() {
        return Arrays.copyOf(season, season.length);
    }

    boolean isFinite() {
        if (Double.isNaN(level) || Double.isInfinite(level) || Double.isNaN(slope) || Double.isInfinite(slope)) {
            return false;
        }
        for (double value : season) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return false;
            }
        }
        return true;
    }
}
