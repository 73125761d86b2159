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

package com.amazon.fable.arima;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.fable.FitFailureException;
import com.amazon.fable.RefitException;
import com.amazon.fable.StreamException;
import com.amazon.fable.config.InformationCriterion;
import com.amazon.fable.distribution.Hilo;
import com.amazon.fable.model.Coefficient;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.ModelForecast;
import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ArimaOptions;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.testutils.ExampleDataSets;

public class ArimaFitterTest {

    private static final LocalDate START = LocalDate.of(2000, 1, 1);

    private final ArimaFitter fitter = new ArimaFitter();

    private static TimeSeries yearly(double... values) {
        return TimeSeries.of(START, IndexInterval.yearly(), values);
    }

    @Test
    public void testRandomWalkIsDifferencedOnce() {
        TimeSeries series = yearly(ExampleDataSets.randomWalk(300, 50, 0, 1, 5));
        ArimaModel model = fitter.fit(series, ModelSpecification.arima());
        assertEquals(1, model.getOrder().getD());
        assertEquals(0, model.getOrder().getSeasonalD());
        assertNotNull(model.getSelection());
        assertEquals(model.getOrder(), model.getSelection().getSelected());
    }

    @Test
    public void testStationarySeriesIsNotDifferenced() {
        TimeSeries series = yearly(ExampleDataSets.ar1(300, 10, 0.5, 1, 5));
        ArimaModel model = fitter.fit(series, ModelSpecification.arima());
        assertEquals(0, model.getOrder().getD());
        assertTrue(model.getOrder().getP() + model.getOrder().getQ() > 0);
        assertTrue(model.getOrder().isConstant());
    }

    @Test
    public void testSelectedOrderMinimizesCriterion() {
        TimeSeries series = yearly(ExampleDataSets.ar1(150, 0, 0.5, 1, 9));
        ArimaModel model = fitter.fit(series, ModelSpecification.arima());
        ArimaSelection selection = model.getSelection();
        assertEquals(InformationCriterion.AICC, selection.getCriterion());
        double best = model.statistics().getAicc();
        for (ArimaCandidateResult candidate : selection.getFittedCandidates()) {
            assertTrue(candidate.getStatistics().getAicc() >= best - 1e-9, candidate.getLabel());
        }
    }

    @Test
    public void testExhaustiveSearchRespectsMaxOrder() {
        TimeSeries series = yearly(ExampleDataSets.ar1(120, 0, 0.5, 1, 9));
        ModelSpecification specification = ModelSpecification.builder(ModelFamily.ARIMA)
                .fixed(ArimaOptions.STEPWISE, false).fixed(ArimaOptions.MAX_ORDER, 2).fixed(ArimaOptions.D, 0)
                .build();
        ArimaModel model = fitter.fit(series, specification);
        for (ArimaCandidateResult candidate : model.getSelection().getCandidates()) {
            ArimaOrder order = candidate.getOrder();
            assertTrue(order.getP() + order.getQ() <= 2, order.toString());
        }
    }

    @Test
    public void testFixedOrder() {
        TimeSeries series = yearly(ExampleDataSets.ar1(200, 3, 0.6, 1, 21));
        ModelSpecification specification = ModelSpecification.builder(ModelFamily.ARIMA).fixed(ArimaOptions.P, 1)
                .fixed(ArimaOptions.D, 0).fixed(ArimaOptions.Q, 0).fixed(ArimaOptions.CONSTANT, true).build();
        ArimaModel model = fitter.fit(series, specification);
        assertEquals("ARIMA(1,0,0) w/ mean", model.getStructure());
        List<Coefficient> coefficients = model.coefficients();
        assertEquals(2, coefficients.size());
        assertEquals(0.6, coefficients.get(0).getEstimate(), 0.15);
        assertEquals(3, coefficients.get(1).getEstimate(), 0.5);
        assertTrue(coefficients.get(0).getStandardError() > 0);
    }

    @Test
    public void testSeasonalDifferencing() {
        TimeSeries series = TimeSeries.of(START, IndexInterval.quarterly(),
                ExampleDataSets.seasonal(80, 4, 100, 0.5, 0.01, 4));
        ArimaModel model = fitter.fit(series, ModelSpecification.arima());
        assertEquals(1, model.getOrder().getSeasonalD());
        assertEquals(4, model.getOrder().getPeriod());
    }

    @Test
    public void testShortSeriesSelectsFiniteCriterion() {
        TimeSeries series = yearly(ExampleDataSets.ar1(8, 5, 0.3, 1, 13));
        ModelSpecification specification = ModelSpecification.builder(ModelFamily.ARIMA)
                .fixed(ArimaOptions.STEPWISE, false).fixed(ArimaOptions.D, 0).build();
        ArimaModel model = fitter.fit(series, specification);
        assertTrue(Double.isFinite(model.statistics().getAicc()), model.getStructure());
        for (ArimaCandidateResult candidate : model.getSelection().getFittedCandidates()) {
            assertTrue(Double.isFinite(candidate.getStatistics().getAicc()), candidate.getLabel());
        }

        ModelSpecification saturated = ModelSpecification.builder(ModelFamily.ARIMA).fixed(ArimaOptions.P, 1)
                .fixed(ArimaOptions.D, 0).fixed(ArimaOptions.Q, 1).fixed(ArimaOptions.CONSTANT, true).build();
        assertThrows(FitFailureException.class, () -> fitter.fit(yearly(1, 3, 2, 4, 3), saturated));
    }

    @Test
    public void testFailures() {
        assertThrows(FitFailureException.class,
                () -> fitter.fit(yearly(Double.NaN, Double.NaN), ModelSpecification.arima()));
        assertThrows(FitFailureException.class, () -> fitter.fit(yearly(1, 2, 3),
                ModelSpecification.builder(ModelFamily.ARIMA).fixed(ArimaOptions.D, 1).build()));
        assertThrows(FitFailureException.class, () -> fitter.fit(yearly(ExampleDataSets.ar1(40, 0, 0.5, 1, 1)),
                ModelSpecification.builder(ModelFamily.ARIMA).fixed(ArimaOptions.SEASONAL_P, 1).build()));
        assertThrows(FitFailureException.class, () -> fitter.fit(yearly(1, 2, 3, 4),
                ModelSpecification.builder(ModelFamily.ARIMA).fixed(ArimaOptions.D, 2).build()));
    }

    @Test
    public void testForecastIntervalsWiden() {
        TimeSeries series = yearly(ExampleDataSets.randomWalk(100, 20, 0.2, 1, 8));
        IFittedModel model = fitter.fit(series, ModelSpecification.arima());
        ModelForecast forecast = model.forecast(10);
        assertEquals(10, forecast.size());
        assertEquals(series.timeAfterEnd(1), forecast.getTime(0));
        double previous = 0;
        for (int i = 0; i < 10; i++) {
            Hilo interval = forecast.getDistribution(i).interval(95);
            assertTrue(interval.width() >= previous);
            previous = interval.width();
        }
    }

    @Test
    public void testRefitKeepsOrder() {
        TimeSeries series = yearly(ExampleDataSets.ar1(150, 0, 0.5, 1, 12));
        ArimaModel model = fitter.fit(series, ModelSpecification.arima());
        TimeSeries other = yearly(ExampleDataSets.ar1(150, 0, -0.3, 1, 13));
        ArimaModel refitted = (ArimaModel) model.refit(other);
        assertEquals(model.getOrder(), refitted.getOrder());
        assertEquals(other, refitted.getSeries());

        ArimaModel refiltered = (ArimaModel) model.refit(other, false);
        assertEquals(model.getCoefficients().getAr().length, refiltered.getCoefficients().getAr().length);
        for (int i = 0; i < model.getCoefficients().getAr().length; i++) {
            assertEquals(model.getCoefficients().getAr()[i], refiltered.getCoefficients().getAr()[i], 0);
        }
        assertThrows(RefitException.class, () -> model.refit(TimeSeries.of(START, IndexInterval.monthly(), 1, 2)));
    }

    @Test
    public void testStreamMatchesRefilter() {
        double[] values = ExampleDataSets.ar1(120, 0, 0.5, 1, 14);
        TimeSeries head = yearly(Arrays.copyOf(values, 100));
        TimeSeries all = yearly(values);
        ArimaModel model = fitter.fit(head, ModelSpecification.arima());

        IFittedModel streamed = model.stream(TimeSeries.of(head.timeAfterEnd(1), IndexInterval.yearly(),
                Arrays.copyOfRange(values, 100, 120)));
        IFittedModel refiltered = model.refit(all, false);
        assertEquals(120, streamed.getSeries().length());
        for (int h = 0; h < 5; h++) {
            assertEquals(refiltered.forecast(5).getDistribution(h).mean(),
                    streamed.forecast(5).getDistribution(h).mean(), 1e-6);
        }
        IFittedModel unchanged = model.stream(TimeSeries.of(head.timeAfterEnd(1), IndexInterval.yearly()));
        assertEquals(model.forecast(3).getMeans()[2], unchanged.forecast(3).getMeans()[2], 1e-12);

        assertThrows(StreamException.class,
                () -> model.stream(TimeSeries.of(head.timeAfterEnd(3), IndexInterval.yearly(), 1.0)));
    }

    @Test
    public void testGenerateIsReproducible() {
        ArimaModel model = fitter.fit(yearly(ExampleDataSets.ar1(80, 0, 0.5, 1, 2)), ModelSpecification.arima());
        double[][] first = model.generate(6, 3, new Random(1));
        double[][] second = model.generate(6, 3, new Random(1));
        assertEquals(3, first.length);
        for (int i = 0; i < 3; i++) {
            assertEquals(6, first[i].length);
            for (int j = 0; j < 6; j++) {
                assertEquals(first[i][j], second[i][j], 0);
            }
        }
    }

    @Test
    public void testMissingValuesAreInterpolated() {
        double[] values = ExampleDataSets.withMissing(ExampleDataSets.ar1(100, 5, 0.6, 1, 3), 10, 50, 51);
        ArimaModel model = fitter.fit(yearly(values), ModelSpecification.arima());
        TimeSeries interpolated = model.interpolate();
        assertFalse(interpolated.hasMissing());
        assertEquals(values[9], interpolated.valueAt(9), 0);
        assertNull(ArimaModel.fromCoefficients(model.getSpecification(), model.getSeries(), model.getOrder(),
                model.getCoefficients(), model.getStandardErrors()).getSelection());
    }
}
