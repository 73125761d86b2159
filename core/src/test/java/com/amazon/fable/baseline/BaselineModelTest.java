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

package com.amazon.fable.baseline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.fable.FitFailureException;
import com.amazon.fable.RefitException;
import com.amazon.fable.distribution.IDistribution;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.ModelForecast;
import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.BaselineOptions;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;

public class BaselineModelTest {

    private static final double EPSILON = 1e-10;

    private static final LocalDate START = LocalDate.of(2010, 1, 1);

    private static TimeSeries yearly(double... values) {
        return TimeSeries.of(START, IndexInterval.yearly(), values);
    }

    @Test
    public void testMean() {
        MeanModel model = new MeanFitter().fit(yearly(1, 2, 3, 4, 5), ModelSpecification.mean());
        assertEquals(3, model.getMean(), EPSILON);
        assertEquals(2.5, model.statistics().getSigma2(), EPSILON);
        assertArrayEquals(new double[] { -2, -1, 0, 1, 2 }, model.residuals(), EPSILON);
        IDistribution step = model.forecast(3).getDistribution(2);
        assertEquals(3, step.mean(), EPSILON);
        assertEquals(3, step.variance(), EPSILON);
        assertEquals("MEAN", model.getStructure());
        assertThrows(FitFailureException.class, () -> new MeanFitter().fit(yearly(1, Double.NaN),
                ModelSpecification.mean()));
    }

    @Test
    public void testNaive() {
        NaiveModel model = new NaiveFitter().fit(yearly(1, 3, 2, 5, 4), ModelSpecification.naive());
        assertTrue(Double.isNaN(model.fittedValues()[0]));
        assertArrayEquals(new double[] { 1, 3, 2, 5 }, Arrays.copyOfRange(model.fittedValues(), 1, 5),
                EPSILON);
        assertEquals(3.75, model.statistics().getSigma2(), EPSILON);
        ModelForecast forecast = model.forecast(4);
        for (int h = 1; h <= 4; h++) {
            assertEquals(4, forecast.getDistribution(h - 1).mean(), EPSILON);
            assertEquals(3.75 * h, forecast.getDistribution(h - 1).variance(), EPSILON);
        }
        assertEquals("NAIVE", model.getStructure());
    }

    @Test
    public void testNaiveWithDrift() {
        ModelSpecification specification = ModelSpecification.builder(ModelFamily.NAIVE)
                .fixed(BaselineOptions.DRIFT, true).build();
        NaiveModel model = new NaiveFitter().fit(yearly(1, 3, 2, 5, 4), specification);
        assertEquals(0.75, model.getDrift(), EPSILON);
        assertEquals(4.25, model.statistics().getSigma2(), EPSILON);
        IDistribution first = model.forecast(1).getDistribution(0);
        assertEquals(4.75, first.mean(), EPSILON);
        assertEquals(4.25 * 1.25, first.variance(), EPSILON);
        assertEquals("b", model.coefficients().get(0).getTerm());
    }

    @Test
    public void testSeasonalNaive() {
        TimeSeries series = TimeSeries.of(START, IndexInterval.quarterly(), 1, 2, 3, 4, 2, 3, 4, 5);
        SeasonalNaiveModel model = new SeasonalNaiveFitter().fit(series, ModelSpecification.snaive());
        assertEquals(4, model.getLag());
        assertEquals(1, model.statistics().getSigma2(), EPSILON);
        ModelForecast forecast = model.forecast(5);
        assertArrayEquals(new double[] { 2, 3, 4, 5, 2 }, forecast.getMeans(), EPSILON);
        assertEquals(1, forecast.getDistribution(3).variance(), EPSILON);
        assertEquals(2, forecast.getDistribution(4).variance(), EPSILON);
        assertEquals("SNAIVE[4]", model.getStructure());
    }

    @Test
    public void testSeasonalNaiveNeedsSeason() {
        assertThrows(FitFailureException.class,
                () -> new SeasonalNaiveFitter().fit(yearly(1, 2, 3, 4, 5), ModelSpecification.snaive()));
        TimeSeries series = TimeSeries.of(START, IndexInterval.quarterly(), 1, 2, 3);
        assertThrows(FitFailureException.class,
                () -> new SeasonalNaiveFitter().fit(series, ModelSpecification.snaive()));
    }

    @Test
    public void testNaiveSkipsMissingAnchor() {
        NaiveModel model = new NaiveFitter().fit(yearly(1, 2, 3, Double.NaN), ModelSpecification.naive());
        IDistribution first = model.forecast(1).getDistribution(0);
        assertEquals(3, first.mean(), EPSILON);
        assertEquals(2 * model.statistics().getSigma2(), first.variance(), EPSILON);
    }

    @Test
    public void testStreamAndRefit() {
        IFittedModel model = new NaiveFitter().fit(yearly(1, 3, 2, 5, 4), ModelSpecification.naive());
        IFittedModel streamed = model.stream(TimeSeries.of(START.plusYears(5), IndexInterval.yearly(), 7));
        assertEquals(7, streamed.forecast(1).getDistribution(0).mean(), EPSILON);
        assertEquals(6, streamed.getSeries().length());

        IFittedModel refitted = model.refit(yearly(10, 11));
        assertEquals(11, refitted.forecast(1).getDistribution(0).mean(), EPSILON);
        assertThrows(RefitException.class, () -> model.refit(yearly(10)));
    }
}
