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

import java.io.Serializable;
import java.time.LocalDate;
import java.time.Period;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The uniform step of a regular time index together with the natural seasonal
 * period of data observed at that step.
 */
@Getter
@EqualsAndHashCode
public class IndexInterval implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Upper bound on the number of steps searched when resolving a calendar
     * duration or locating a date on the grid.
     */
    public static final int MAX_STEPS = 1_000_000;

    private final Period step;

    private final int seasonalPeriod;

    private IndexInterval(Period step, int seasonalPeriod) {
        checkNotNull(step, "step must not be null");
        checkArgument(!step.isNegative() && !step.isZero(), "step must be positive");
        checkArgument(seasonalPeriod >= 1, "seasonal period must be at least 1");
        this.step = step.normalized();
        this.seasonalPeriod = seasonalPeriod;
    }

    public static IndexInterval of(Period step, int seasonalPeriod) {
        return new IndexInterval(step, seasonalPeriod);
    }

    public static IndexInterval yearly() {
        return new IndexInterval(Period.ofYears(1), 1);
    }

    public static IndexInterval quarterly() {
        return new IndexInterval(Period.ofMonths(3), 4);
    }

    public static IndexInterval monthly() {
        return new IndexInterval(Period.ofMonths(1), 12);
    }

    public static IndexInterval weekly() {
        return new IndexInterval(Period.ofDays(7), 52);
    }

    public static IndexInterval daily() {
        return new IndexInterval(Period.ofDays(1), 7);
    }

    /**
     * Steps are measured from the origin rather than chained, so month ends do not
     * drift.
     *
     * @param origin a time point on the grid
     * @param steps  a number of steps, possibly negative
     * @return the time point that many steps away from the origin
     */
    public LocalDate advance(LocalDate origin, long steps) {
        checkNotNull(origin, "origin must not be null");
        checkArgument(Math.abs(steps) <= MAX_STEPS, "too many steps");
        return origin.plus(step.multipliedBy((int) steps));
    }

    /**
     * @param origin   a time point on the grid
     * @param duration a calendar duration
     * @return the largest number of whole steps after the origin that fall within
     *         the duration
     */
    public int stepsWithin(LocalDate origin, Period duration) {
        checkNotNull(duration, "duration must not be null");
        LocalDate limit = origin.plus(duration);
        int steps = 0;
        while (steps < MAX_STEPS && !advance(origin, steps + 1).isAfter(limit)) {
            ++steps;
        }
        return steps;
    }

    @Override
    public String toString() {
        return step + "[" + seasonalPeriod + "]";
    }
}
