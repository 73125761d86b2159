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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class DistributionTest {

    private static final double EPSILON = 1e-9;

    static Stream<IDistribution> distributions() {
        double[] draws = new Normal(10, 2).sample(2001, new Random(42));
        return Stream.of(new Normal(10, 2), new Degenerate(10), new Sample(draws));
    }

    @Test
    public void testNormalInterval() {
        Hilo interval = new Normal(5, 2).interval(95);
        assertEquals(5 - 1.959964 * 2, interval.getLower(), 1e-5);
        assertEquals(5 + 1.959964 * 2, interval.getUpper(), 1e-5);
        assertEquals(95, interval.getLevel(), EPSILON);
    }

    @Test
    public void testNormalAlgebra() {
        IDistribution sum = new Normal(1, 3).plus(new Normal(2, 4));
        assertEquals(3, sum.mean(), EPSILON);
        assertEquals(25, sum.variance(), EPSILON);

        IDistribution shifted = new Normal(1, 3).plus(new Degenerate(4));
        assertEquals(DistributionFamily.NORMAL, shifted.getFamily());
        assertEquals(5, shifted.mean(), EPSILON);
        assertEquals(9, shifted.variance(), EPSILON);

        IDistribution scaled = new Normal(1, 3).scale(2);
        assertEquals(2, scaled.mean(), EPSILON);
        assertEquals(36, scaled.variance(), EPSILON);
    }

    @Test
    public void testZeroVarianceNormal() {
        Normal normal = new Normal(3, 0);
        assertEquals(3, normal.quantile(0.01), EPSILON);
        assertEquals(3, normal.quantile(0.99), EPSILON);
        assertEquals(0, normal.interval(80).width(), EPSILON);
    }

    @Test
    public void testDegenerate() {
        Degenerate point = new Degenerate(7);
        assertEquals(0, point.variance(), EPSILON);
        assertEquals(7, point.quantile(0.3), EPSILON);
        assertEquals(0, point.cdf(6.9), EPSILON);
        assertEquals(1, point.cdf(7), EPSILON);
    }

    @Test
    public void testSampleQuantiles() {
        Sample sample = new Sample(new double[] { 4, 1, 3, 2, 5 });
        assertEquals(1, sample.quantile(0), EPSILON);
        assertEquals(3, sample.quantile(0.5), EPSILON);
        assertEquals(5, sample.quantile(1), EPSILON);
        assertEquals(1.5, sample.quantile(0.125), EPSILON);
        assertEquals(3, sample.mean(), EPSILON);
        assertEquals(2.5, sample.variance(), EPSILON);
        assertEquals(0.6, sample.cdf(3), EPSILON);
    }

    @Test
    public void testSampleSum() {
        IDistribution sum = new Sample(new double[] { 1, 2 }).plus(new Sample(new double[] { 10, 20 }));
        assertEquals(16.5, sum.mean(), EPSILON);
        assertThrows(IllegalArgumentException.class,
                () -> new Sample(new double[] { 1, 2 }).plus(new Sample(new double[] { 1, 2, 3 })));
        assertThrows(IllegalArgumentException.class, () -> new Sample(new double[] { 1 }).plus(new Normal(0, 1)));
    }

    @ParameterizedTest
    @MethodSource("distributions")
    public void testIntervalsAreNested(IDistribution distribution) {
        List<Hilo> intervals = distribution.hilo(50, 80, 95);
        assertEquals(3, intervals.size());
        assertTrue(intervals.get(1).contains(intervals.get(0)));
        assertTrue(intervals.get(2).contains(intervals.get(1)));
        for (Hilo interval : intervals) {
            assertTrue(interval.contains(distribution.quantile(0.5)));
        }
    }

    @ParameterizedTest
    @MethodSource("distributions")
    public void testQuantileIsMonotone(IDistribution distribution) {
        double previous = Double.NEGATIVE_INFINITY;
        for (double p = 0.01; p < 1; p += 0.07) {
            double q = distribution.quantile(p);
            assertTrue(q >= previous);
            previous = q;
        }
        assertEquals(10, distribution.mean(), 0.2);
    }

    @ParameterizedTest
    @MethodSource("distributions")
    public void testIllegalArguments(IDistribution distribution) {
        assertThrows(IllegalArgumentException.class, () -> distribution.quantile(1.5));
        assertThrows(IllegalArgumentException.class, () -> distribution.interval(100));
        assertThrows(IllegalArgumentException.class, () -> distribution.interval(0));
        assertThrows(IllegalArgumentException.class, () -> distribution.scale(0));
    }
}
