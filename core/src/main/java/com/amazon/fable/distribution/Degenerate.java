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

import lombok.EqualsAndHashCode;

/**
 * A point mass.
 */
@EqualsAndHashCode
public class Degenerate implements IDistribution {

    private final double value;

    public Degenerate(double value) {
        checkArgument(!Double.isNaN(value) && !Double.isInfinite(value), "value must be finite");
        this.value = value;
    }

    @Override
    public DistributionFamily getFamily() {
        return DistributionFamily.DEGENERATE;
    }

    @Override
    public double mean() {
        return value;
    }

    @Override
    public double variance() {
        return 0;
    }

    @Override
    public double quantile(double p) {
        IDistribution.checkProbability(p);
        return value;
    }

    @Override
    public double cdf(double x) {
        return (x < value) ? 0 : 1;
    }

    @Override
    public IDistribution plus(IDistribution other) {
        checkNotNull(other, "other must not be null");
        return other.shift(value);
    }

    @Override
    public IDistribution shift(double c) {
        return new Degenerate(value + c);
    }

    @Override
    public IDistribution scale(double k) {
        checkArgument(k > 0, "scale factor must be positive");
        return new Degenerate(value * k);
    }

    @Override
    public double[] sample(int n, Random random) {
        checkArgument(n > 0, "n must be positive");
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    @Override
    public String toString() {
        return "Degenerate(" + value + ")";
    }
}
