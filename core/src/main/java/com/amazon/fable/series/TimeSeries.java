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
import java.util.Arrays;
import java.util.Comparator;

import lombok.Getter;

import com.amazon.fable.CommonUtils;
import com.amazon.fable.IrregularSeriesException;

/**
 * A univariate series on a regular time index. Missing observations are NaN
 * values at valid time points; they are never gaps in the index.
 */
@Getter
public class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate start;

    private final IndexInterval interval;

    private final double[] values;

    private TimeSeries(LocalDate start, IndexInterval interval, double[] values) {
        this.start = checkNotNull(start, "start must not be null");
        this.interval = checkNotNull(interval, "interval must not be null");
        checkNotNull(values, "values must not be null");
        for (double value : values) {
            checkArgument(!Double.isInfinite(value), "values must be finite or NaN");
        }
        this.values = Arrays.copyOf(values, values.length);
    }

    public static TimeSeries of(LocalDate start, IndexInterval interval, double... values) {
        return new TimeSeries(start, interval, values);
    }

    /**
     * Builds a series from time-stamped observations, which may arrive in any
     * order.
     *
     * @param times    the time point of each observation
     * @param values   the observed values, NaN for missing
     * @param interval the expected interval
     * @return the series
     * @throws IrregularSeriesException if the time points are duplicated, leave a
     *                                  gap, or do not lie on the interval's grid
     */
    public static TimeSeries fromObservations(LocalDate[] times, double[] values, IndexInterval interval) {
        checkNotNull(times, "times must not be null");
        checkNotNull(values, "values must not be null");
        checkNotNull(interval, "interval must not be null");
        checkArgument(times.length == values.length, "times and values must have the same length");
        checkArgument(times.length > 0, "at least one observation is required");

        Integer[] order = new Integer[times.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
            checkNotNull(times[i], "time points must not be null");
        }
        Arrays.sort(order, Comparator.comparing(i -> times[i]));

        LocalDate start = times[order[0]];
        double[] sorted = new double[values.length];
        for (int i = 0; i < order.length; i++) {
            LocalDate time = times[order[i]];
            if (i > 0 && time.equals(times[order[i - 1]])) {
                throw new IrregularSeriesException("duplicated time point " + time);
            }
            LocalDate expected = interval.advance(start, i);
            if (time.isAfter(expected)) {
                throw new IrregularSeriesException("gap in the time index before " + time + ", expected " + expected);
            }
            if (!time.equals(expected)) {
                throw new IrregularSeriesException(time + " is not on the " + interval.getStep() + " grid");
            }
            sorted[i] = values[order[i]];
        }
        return new TimeSeries(start, interval, sorted);
    }

    public int length() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public double valueAt(int index) {
        return values[index];
    }

    public LocalDate timeAt(int index) {
        return interval.advance(start, index);
    }

    public LocalDate[] getTimes() {
        LocalDate[] times = new LocalDate[values.length];
        for (int i = 0; i < times.length; i++) {
            times[i] = timeAt(i);
        }
        return times;
    }

    /**
     * @return the last time point, or the time before the start for an empty
     *         series
     */
    public LocalDate getEnd() {
        return timeAt(values.length - 1);
    }

    /**
     * @param steps a number of steps after the end
     * @return the time point that many steps after the last observation
     */
    public LocalDate timeAfterEnd(int steps) {
        return timeAt(values.length - 1 + steps);
    }

    public int getSeasonalPeriod() {
        return interval.getSeasonalPeriod();
    }

    public int countObserved() {
        return CommonUtils.countObserved(values);
    }

    public boolean hasMissing() {
        return countObserved() < values.length;
    }

    /**
     * @return true if every observed value is strictly positive
     */
    public boolean isStrictlyPositive() {
        for (double value : values) {
            if (CommonUtils.isObserved(value) && value <= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param other a series
     * @return true if the other series shares the interval and starts one step
     *         after this series ends
     */
    public boolean isContinuedBy(TimeSeries other) {
        return interval.equals(other.interval) && timeAfterEnd(1).equals(other.start);
    }

    public TimeSeries append(TimeSeries other) {
        if (other.isEmpty()) {
            checkArgument(interval.equals(other.interval), "series has a different interval");
            return this;
        }
        checkArgument(isContinuedBy(other), "series does not continue this series");
        double[] joined = Arrays.copyOf(values, values.length + other.values.length);
        System.arraycopy(other.values, 0, joined, values.length, other.values.length);
        return new TimeSeries(start, interval, joined);
    }

    /**
     * @param newValues values for the same time points
     * @return a series on this index with the given values
     */
    public TimeSeries withValues(double[] newValues) {
        checkNotNull(newValues, "values must not be null");
        checkArgument(newValues.length == values.length, "incorrect length");
        return new TimeSeries(start, interval, newValues);
    }

    /**
     * @param fromIndex first index, inclusive
     * @param toIndex   last index, exclusive
     * @return the sub-series over the given positions
     */
    public TimeSeries slice(int fromIndex, int toIndex) {
        checkArgument(0 <= fromIndex && fromIndex <= toIndex && toIndex <= values.length, "incorrect range");
        return new TimeSeries(timeAt(fromIndex), interval, Arrays.copyOfRange(values, fromIndex, toIndex));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSeries)) {
            return false;
        }
        TimeSeries other = (TimeSeries) o;
        return start.equals(other.start) && interval.equals(other.interval) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * start.hashCode() + interval.hashCode()) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TimeSeries(" + start + ", " + interval + ", n=" + values.length + ")";
    }
}
