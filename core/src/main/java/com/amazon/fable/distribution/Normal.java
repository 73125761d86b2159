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

import java.util.Random;

import lombok.EqualsAndHashCode;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * A Gaussian distribution. A zero standard deviation is allowed and behaves as
 * a point mass at the mean.
 */
@EqualsAndHashCode
public class Normal implements IDistribution {

    private static final NormalDistribution STANDARD = new NormalDistribution(null, 0, 1);

    private final double mu;

    private final double sigma;

    public Normal(double mu, double sigma) {
        checkArgument(!Double.isNaN(mu) && !Double.isInfinite(mu), "mean must be finite");
        checkArgument(sigma >= 0 && !Double.isInfinite(sigma), "standard deviation must be finite and non-negative");
        this.mu = mu;
        this.sigma = sigma;
    }

    public static Normal fromVariance(double mu, double variance) {
        checkArgument(variance >= 0, "variance must be non-negative");
        return new Normal(mu, Math.sqrt(variance));
    }

    @Override
    public DistributionFamily getFamily() {
        return DistributionFamily.NORMAL;
    }

    @Override
    public double mean() {
        return mu;
    }

    @Override
    public double variance() {
        return sigma * sigma;
    }

    @Override
    public double standardDeviation() {
        return sigma;
    }

    @Override
    public double quantile(double p) {
        IDistribution.checkProbability(p);
        if (sigma == 0) {
            return mu;
        }
        return mu + sigma * STANDARD.inverseCumulativeProbability(p);
    }

    @Override
    public double cdf(double x) {
        if (sigma == 0) {
            return (x < mu) ? 0 : 1;
        }
        return STANDARD.cumulativeProbability((x - mu) / sigma);
    }

    @Override
    public IDistribution plus(IDistribution other) {
        checkNotNull(other, "other must not be null");
        switch (other.getFamily()) {
        case NORMAL:
            return new Normal(mu + other.mean(), Math.sqrt(variance() + other.variance()));
        case DEGENERATE:
            return shift(other.mean());
        default:
            throw new IllegalArgumentException("cannot add a normal and a " + other.getFamily() + " distribution");
        }
    }

    @Override
    public IDistribution shift(double c) {
        return new Normal(mu + c, sigma);
    }

    @Override
    public IDistribution scale(double k) {
        checkArgument(k > 0, "scale factor must be positive");
        return new Normal(mu * k, sigma * k);
    }

    @Override
    public double[] sample(int n, Random random) {
        checkArgument(n > 0, "n must be positive");
        checkNotNull(random, "random must not be null");
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mu + sigma * random.nextGaussian();
        }
        return values;
    }

    @Override
    public String toString() {
        return "N(" + mu + ", " + variance() + ")";
    }
}
