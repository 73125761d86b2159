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

package com.amazon.fable.tables;

import java.time.LocalDate;
import java.util.Arrays;

import lombok.Getter;

import com.amazon.fable.series.SeriesKey;

/**
 * One simulated future path of a cell.
 */
@Getter
public class GeneratedPath {

    private final SeriesKey key;

    private final String modelName;

    private final int path;

    private final LocalDate[] times;

    private final double[] values;

    GeneratedPath(SeriesKey key, String modelName, int path, LocalDate[] times, double[] values) {
        this.key = key;
        this.modelName = modelName;
        this.path = path;
        this.times = Arrays.copyOf(times, times.length);
        this.values = Arrays.copyOf(values, values.length);
    }

    public LocalDate[] getTimes() {
        return Arrays.copyOf(times, times.length);
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }
}
