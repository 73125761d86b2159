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
import java.util.Arrays;
import java.util.List;

import com.amazon.fable.distribution.Hilo;
import com.amazon.fable.distribution.IDistribution;

/**
 * The forecast distributions of one model over consecutive future time points.
 */
public class ModelForecast {

    private final LocalDate[] times;

    private final IDistribution[] distributions;

    public ModelForecast(LocalDate[] times, IDistribution[] distributions) {
        checkNotNull(times, "times must not be null");
        checkNotNull(distributions, "distributions must not be null");
        checkArgument(times.length == distributions.length, "times and distributions must have the same length");
        for (int i = 1; i < times.length; i++) {
            checkArgument(times[i].isAfter(times[i - 1]), "forecast times must be increasing");
        }
        this.times = Arrays.copyOf(times, times.length);
        this.distributions = Arrays.copyOf(distributions, distributions.length);
    }

    public int size() {
        return times.length;
    }

    public LocalDate getTime(int step) {
        return times[step];
    }

    public IDistribution getDistribution(int step) {
        return distributions[step];
    }

    public LocalDate[] getTimes() {
        return Arrays.copyOf(times, times.length);
    }

    public IDistribution[] getDistributions() {
        return Arrays.copyOf(distributions, distributions.length);
    }

    public double[] getMeans() {
        double[] means = new double[distributions.length];
        for (int i = 0; i < means.length; i++) {
            means[i] = distributions[i].mean();
        }
        return means;
    }

    public List<Hilo> hilo(int step, double... levels) {
        return distributions[step].hilo(levels);
    }
}
