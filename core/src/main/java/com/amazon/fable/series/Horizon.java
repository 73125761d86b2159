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

package com.amazon.fable.series;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.time.Period;

/**
 * How far ahead to forecast: a number of steps, or a calendar duration resolved
 * against the series' interval.
 */
public class Horizon {

    private final int steps;

    private final Period duration;

    private Horizon(int steps, Period duration) {
        this.steps = steps;
        this.duration = duration;
    }

    public static Horizon steps(int steps) {
        checkArgument(steps > 0, "horizon must be positive");
        return new Horizon(steps, null);
    }

    public static Horizon of(Period duration) {
        checkNotNull(duration, "duration must not be null");
        checkArgument(!duration.isNegative() && !duration.isZero(), "duration must be positive");
        return new Horizon(0, duration);
    }

    public static Horizon years(int years) {
        return of(Period.ofYears(years));
    }

    /**
     * @param series the series being forecast
     * @return the number of steps after the end of the series, at least 1
     */
    public int resolve(TimeSeries series) {
        if (duration == null) {
            return steps;
        }
        return Math.max(1, series.getInterval().stepsWithin(series.getEnd(), duration));
    }

    @Override
    public String toString() {
        return (duration == null) ? steps + " steps" : duration.toString();
    }
}
