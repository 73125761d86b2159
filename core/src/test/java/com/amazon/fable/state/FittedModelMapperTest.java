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

package com.amazon.fable.state;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.fable.FitterRegistry;
import com.amazon.fable.InvalidSpecException;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.ModelForecast;
import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.BaselineOptions;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.testutils.ExampleDataSets;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class FittedModelMapperTest {

    private static final TimeSeries SERIES = TimeSeries.of(LocalDate.of(2001, 1, 1), IndexInterval.quarterly(),
            ExampleDataSets.seasonal(48, 4, 100, 0.5, 0.03, 31));

    private final FittedModelMapper mapper = new FittedModelMapper();

    static Stream<ModelSpecification> specifications() {
        return Stream.of(ModelSpecification.ets(), ModelSpecification.arima(), ModelSpecification.mean(),
                ModelSpecification.naive(),
                ModelSpecification.builder(ModelFamily.NAIVE).fixed(BaselineOptions.DRIFT, true).build(),
                ModelSpecification.snaive());
    }

    private static void assertSameForecasts(IFittedModel expected, IFittedModel actual) {
        ModelForecast first = expected.forecast(8);
        ModelForecast second = actual.forecast(8);
        assertArrayEquals(first.getMeans(), second.getMeans(), 1e-9);
        for (int i = 0; i < 8; i++) {
            assertEquals(first.getDistribution(i).variance(), second.getDistribution(i).variance(), 1e-9);
        }
    }

    @ParameterizedTest
    @MethodSource("specifications")
    public void testRoundTrip(ModelSpecification specification) {
        IFittedModel model = FitterRegistry.defaultRegistry().fit(SERIES, specification);
        FittedModelState state = mapper.toState(model);
        IFittedModel restored = mapper.toModel(state);

        assertEquals(model.getFamily(), restored.getFamily());
        assertEquals(model.getStructure(), restored.getStructure());
        assertEquals(model.getSpecification(), restored.getSpecification());
        assertEquals(model.getSeries(), restored.getSeries());
        assertArrayEquals(model.fittedValues(), restored.fittedValues(), 1e-9);
        assertSameForecasts(model, restored);
    }

    @ParameterizedTest
    @MethodSource("specifications")
    public void testRoundTripThroughJackson(ModelSpecification specification) throws JsonProcessingException {
        IFittedModel model = FitterRegistry.defaultRegistry().fit(SERIES, specification);
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(model));
        FittedModelState state = jsonMapper.readValue(json, FittedModelState.class);
        assertSameForecasts(model, mapper.toModel(state));
    }

    @Test
    public void testSeriesStateKeepsMissingValues() {
        TimeSeriesMapper seriesMapper = new TimeSeriesMapper();
        TimeSeries series = TimeSeries.of(LocalDate.of(2020, 1, 31), IndexInterval.monthly(), 1, Double.NaN, 3);
        TimeSeriesState state = seriesMapper.toState(series);
        assertEquals("2020-01-31", state.getStart());
        assertEquals("P1M", state.getStep());
        assertEquals(12, state.getSeasonalPeriod());
        assertEquals(series, seriesMapper.toModel(state));
    }

    @Test
    public void testUnknownStoredOption() {
        ModelSpecificationMapper specificationMapper = new ModelSpecificationMapper();
        ModelSpecificationState state = specificationMapper.toState(ModelSpecification.ets());
        state.getOptions().add(new OptionState("lambda", false, "0.5"));
        assertThrows(InvalidSpecException.class, () -> specificationMapper.toModel(state));
    }
}
