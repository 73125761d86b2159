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

package com.amazon.fable.tables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.fable.baseline.MeanFitter;
import com.amazon.fable.baseline.NaiveFitter;
import com.amazon.fable.distribution.Hilo;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.series.Horizon;
import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.SeriesKey;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelSpecification;

public class FableTest {

    private static final double EPSILON = 1e-10;

    private static final SeriesKey KEY = SeriesKey.of("store", "1");

    private static final SeriesKey BROKEN = SeriesKey.of("store", "2");

    private Fable fable;

    @BeforeEach
    public void setUp() {
        TimeSeries series = TimeSeries.of(LocalDate.of(2010, 1, 1), IndexInterval.yearly(), 1, 2, 3, 4, 5);
        IFittedModel broken = mock(IFittedModel.class);
        when(broken.getSpecification()).thenReturn(ModelSpecification.mean());
        when(broken.forecast(any(Horizon.class))).thenThrow(new IllegalStateException("state lost"));

        Map<SeriesKey, Map<String, IFittedModel>> models = new LinkedHashMap<>();
        Map<String, IFittedModel> byName = new LinkedHashMap<>();
        byName.put("mean", new MeanFitter().fit(series, ModelSpecification.mean()));
        byName.put("naive", new NaiveFitter().fit(series, ModelSpecification.naive()));
        models.put(KEY, byName);
        Map<String, IFittedModel> brokenByName = new LinkedHashMap<>();
        brokenByName.put("mean", broken);
        models.put(BROKEN, brokenByName);
        fable = Fable.of(models, Horizon.steps(3));
    }

    @Test
    public void testRows() {
        assertEquals(6, fable.size());
        FableRow first = fable.getRows().get(0);
        assertEquals(KEY, first.getKey());
        assertEquals("mean", first.getModelName());
        assertEquals(1, first.getStep());
        assertEquals(LocalDate.of(2015, 1, 1), first.getTime());
        assertEquals(3, first.mean(), EPSILON);
        assertEquals(5, fable.rowsFor(KEY, "naive").get(2).mean(), EPSILON);
    }

    @Test
    public void testFailedForecastIsADiagnostic() {
        assertEquals(1, fable.getDiagnostics().size());
        FitFailure failure = fable.getDiagnostics().get(0);
        assertEquals(BROKEN, failure.getKey());
        assertEquals("forecast", failure.getOperation());
        assertEquals("IllegalStateException", failure.getExceptionType());
        assertEquals("state lost", failure.getMessage());
        assertTrue(fable.rowsFor(BROKEN, "mean").isEmpty());
    }

    @Test
    public void testHilo() {
        List<HiloRow> rows = fable.hilo(80, 95);
        assertEquals(6, rows.size());
        List<Hilo> intervals = rows.get(0).getIntervals();
        assertEquals(80, intervals.get(0).getLevel(), EPSILON);
        assertEquals(95, intervals.get(1).getLevel(), EPSILON);
        assertTrue(intervals.get(1).contains(intervals.get(0)));
        assertEquals(3, (intervals.get(0).getLower() + intervals.get(0).getUpper()) / 2, 1e-8);
        assertThrows(IllegalArgumentException.class, () -> fable.hilo());
        assertThrows(IllegalArgumentException.class, () -> fable.hilo(100));
    }

    @Test
    public void testFilterKeepsDiagnostics() {
        Fable firstStep = fable.filter(row -> row.getStep() == 1);
        assertEquals(2, firstStep.size());
        assertEquals(1, firstStep.getDiagnostics().size());
    }

    @Test
    public void testByCell() {
        Map<SeriesKey, Map<String, List<FableRow>>> cells = fable.byCell();
        assertEquals(1, cells.size());
        assertEquals(Arrays.asList("mean", "naive"), Arrays.asList(cells.get(KEY).keySet().toArray(new String[0])));
        assertEquals(3, cells.get(KEY).get("naive").size());
    }
}
