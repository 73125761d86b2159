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

package com.amazon.fable.model;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * A decomposition of a fitted series into named components, one value per
 * time point of the series.
 */
public class ModelComponents {

    private final LocalDate[] times;

    private final LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();

    public ModelComponents(LocalDate[] times) {
        this.times = Arrays.copyOf(checkNotNull(times, "times must not be null"), times.length);
    }

    public ModelComponents add(String name, double[] values) {
        checkNotNull(name, "name must not be null");
        checkArgument(values.length == times.length, "component " + name + " has the wrong length");
        checkArgument(!columns.containsKey(name), "duplicated component " + name);
        columns.put(name, Arrays.copyOf(values, values.length));
        return this;
    }

    public List<String> getNames() {
        return new ArrayList<>(columns.keySet());
    }

    public double[] get(String name) {
        double[] values = columns.get(name);
        checkArgument(values != null, "unknown component " + name);
        return Arrays.copyOf(values, values.length);
    }

    public LocalDate[] getTimes() {
        return Arrays.copyOf(times, times.length);
    }

    public int size() {
        return times.length;
    }
}
