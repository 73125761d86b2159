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

package com.amazon.fable.distribution;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;

/**
 * An empirical distribution over simulated values. The values keep the order
 * in which they were produced so that two samples built from the same paths
 * can be added pairwise.
 */
public class Sample implements IDistribution {

    private final double[] values;

    private final double[] sorted;

    public Sample(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "a sample needs at least one value");
        for (double value : values) {
            checkArgument(!Double.isNaN(value) && !Double.isInfinite(value), "sample values must be finite");
        }
        this.values = Arrays.copyOf(values, values.length);
        this.sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
    }

    @Override
    public DistributionFamily getFamily() {
        return DistributionFamily.SAMPLE;
    }

    public int size() {
        return values.length;
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    @Override
    public double mean() {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    @Override
    public double variance() {
        if (values.length < 2) {
            return 0;
        }
        double mean = mean();
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / (values.length - 1);
    }

    /**
     * Linear interpolation between order statistics at position (n-1)p.
     */
    @Override
    public double quantile(double p) {
        IDistribution.checkProbability(p);
        double position = (sorted.length - 1) * p;
        int lower = (int) Math.floor(position);
        if (lower >= sorted.length - 1) {
            return sorted[sorted.length - 1];
        }
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[lower + 1] - sorted[lower]);
    }

    @Override
    public double cdf(double x) {
        int count = 0;
        while (count < sorted.length && sorted[count] <= x) {
            ++count;
        }
        return count * 1.0 / sorted.length;
    }

    @Override
    public IDistribution plus(IDistribution other) {
        checkNotNull(other, "other must not be null");
        switch (other.getFamily()) {
        case DEGENERATE:
            return shift(other.mean());
        case SAMPLE:
            Sample sample = (Sample) other;
            checkArgument(sample.values.length == values.length, "samples must have the same size");
            double[] sum = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                sum[i] = values[i] + sample.values[i];
            }
            return new Sample(sum);
        default:
            throw new IllegalArgumentException("cannot add a sample and a " + other.getFamily() + " distribution");
        }
    }

    @Override
    public IDistribution shift(double c) {
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[i] + c;
        }
        return new Sample(shifted);
    }

    @Override
    public IDistribution scale(double k) {
        checkArgument(k > 0, "scale factor must be positive");
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * k;
        }
        return new Sample(scaled);
    }

    /**
     * Draws with replacement from the stored values.
     */
    @Override
    public double[] sample(int n, Random random) {
        checkArgument(n > 0, "n must be positive");
        checkNotNull(random, "random must not be null");
        double[] answer = new double[n];
        for (int i = 0; i < n; i++) {
            answer[i] = values[random.nextInt(values.length)];
        }
        return answer;
    }

    @Override
    public String toString() {
        return "Sample(n=" + values.length + ", mean=" + mean() + ")";
    }
}
