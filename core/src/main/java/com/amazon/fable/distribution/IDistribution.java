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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A predictive distribution for a single time point. Implementations are
 * immutable values.
 */
public interface IDistribution {

    DistributionFamily getFamily();

    double mean();

    double variance();

    /**
     * @param p a probability in [0, 1]
     * @return the value below which a fraction {@code p} of the mass lies
     * @throws IllegalArgumentException if p is outside [0, 1]
     */
    double quantile(double p);

    double cdf(double x);

    /**
     * The sum of this distribution and an independent one.
     *
     * @param other another distribution
     * @return the distribution of the sum
     * @throws IllegalArgumentException if the combination is not supported
     */
    IDistribution plus(IDistribution other);

    IDistribution shift(double c);

    /**
     * @param k a strictly positive factor
     * @return the distribution of k times a draw from this distribution
     */
    IDistribution scale(double k);

    double[] sample(int n, Random random);

    default double standardDeviation() {
        return Math.sqrt(variance());
    }

    /**
     * The central interval covering {@code level} percent of the mass.
     *
     * @param level a percentage in (0, 100)
     * @return the interval
     */
    default Hilo interval(double level) {
        Hilo.checkLevel(level);
        double tail = (100 - level) / 200;
        return new Hilo(quantile(tail), quantile(1 - tail), level);
    }

    /**
     * @param levels percentages in (0, 100)
     * @return one interval per level, in the order given
     */
    default List<Hilo> hilo(double... levels) {
        checkArgument(levels != null && levels.length > 0, "at least one level is required");
        List<Hilo> answer = new ArrayList<>(levels.length);
        for (double level : levels) {
            answer.add(interval(level));
        }
        return answer;
    }

    static void checkProbability(double p) {
        checkArgument(p >= 0 && p <= 1, "probability must be in [0, 1]");
    }
}
