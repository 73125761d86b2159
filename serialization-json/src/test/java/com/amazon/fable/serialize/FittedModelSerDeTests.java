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

package com.amazon.fable.serialize;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amazon.fable.FitterRegistry;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.testutils.ExampleDataSets;
import com.google.gson.JsonSyntaxException;

public class FittedModelSerDeTests {

    private final FittedModelSerDe serializer = new FittedModelSerDe();

    @ParameterizedTest(name = "{index} => family={0}, missing={1}")
    @CsvSource({ "ETS, false", "ETS, true", "ARIMA, false", "ARIMA, true", "MEAN, false", "NAIVE, true",
            "SNAIVE, false", "SNAIVE, true" })
    public void toJsonString(ModelFamily family, boolean missing) {
        double[] values = ExampleDataSets.seasonal(40, 4, 150, 0.5, 0.04, 5);
        if (missing) {
            values = ExampleDataSets.withMissing(values, 13, 29);
        }
        TimeSeries series = TimeSeries.of(LocalDate.of(2005, 1, 1), IndexInterval.quarterly(), values);
        IFittedModel model = FitterRegistry.defaultRegistry().fit(series, ModelSpecification.builder(family).build());

        String json = serializer.toJson(model);
        if (missing) {
            assertTrue(json.contains("NaN"));
        }
        IFittedModel restored = serializer.fromJson(json);

        assertEquals(model.getStructure(), restored.getStructure());
        assertEquals(model.getSpecification(), restored.getSpecification());
        assertEquals(model.getSeries(), restored.getSeries());
        assertArrayEquals(model.forecast(8).getMeans(), restored.forecast(8).getMeans(), 1e-6);
        assertEquals(model.statistics().getSigma2(), restored.statistics().getSigma2(),
                1e-6 * Math.abs(model.statistics().getSigma2()));
    }

    @Test
    public void testRestoredModelKeepsStreaming() {
        TimeSeries series = TimeSeries.of(LocalDate.of(2005, 1, 1), IndexInterval.quarterly(),
                ExampleDataSets.randomWalk(50, 20, 0.2, 1, 8));
        IFittedModel model = FitterRegistry.defaultRegistry().fit(series, ModelSpecification.arima());
        IFittedModel restored = serializer.fromJson(serializer.toJson(model));

        TimeSeries next = TimeSeries.of(series.timeAfterEnd(1), IndexInterval.quarterly(), 25, 26);
        assertArrayEquals(model.stream(next).forecast(4).getMeans(), restored.stream(next).forecast(4).getMeans(),
                1e-6);
    }

    @Test
    public void testMalformedJson() {
        assertThrows(JsonSyntaxException.class, () -> serializer.fromJson("{\"family\": [1, 2"));
    }
}
