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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.amazon.fable.distribution.Hilo;
import com.amazon.fable.series.GroupedSeries;
import com.amazon.fable.series.Horizon;
import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.Observation;
import com.amazon.fable.series.SeriesKey;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.testutils.ExampleDataSets;

@Tag("functional")
public class MableFunctionalTest {

    private static final int SERIES = 4;

    private static final int LENGTH = 80;

    private static final int HOLDOUT = 8;

    private static final LocalDate START = LocalDate.of(1998, 1, 1);

    private static GroupedSeries all;

    private static GroupedSeries training;

    private static GroupedSeries test;

    @BeforeAll
    public static void generateData() {
        double[][] panel = ExampleDataSets.seasonalPanel(SERIES, LENGTH, 4, 2024);
        IndexInterval quarterly = IndexInterval.quarterly();
        List<Observation> observations = new ArrayList<>();
        // newest first, so grouping has to sort each series
        for (int t = LENGTH - 1; t >= 0; t--) {
            for (int k = 0; k < SERIES; k++) {
                observations.add(new Observation(SeriesKey.of("region", "r" + k), quarterly.advance(START, t),
                        panel[k][t]));
            }
        }
        all = GroupedSeries.fromRecords(observations, quarterly);
        GroupedSeries.Builder trainingBuilder = GroupedSeries.builder(quarterly);
        GroupedSeries.Builder testBuilder = GroupedSeries.builder(quarterly);
        for (SeriesKey key : all.getKeys()) {
            TimeSeries series = all.get(key);
            trainingBuilder.add(key, series.slice(0, LENGTH - HOLDOUT));
            testBuilder.add(key, series.slice(LENGTH - HOLDOUT, LENGTH));
        }
        training = trainingBuilder.build();
        test = testBuilder.build();
    }

    @Test
    public void testForecastPanel() {
        Mable mable = Mable.builder().series(all).model("ets", ModelSpecification.ets())
                .model("arima", ModelSpecification.arima()).parallelExecutionEnabled(true).build();
        assertEquals(8, mable.size());
        assertEquals(8, mable.fittedCount());

        Fable fable = mable.forecast(20);
        assertEquals(160, fable.size());
        assertTrue(fable.getDiagnostics().isEmpty());

        Map<SeriesKey, Map<String, List<FableRow>>> byCell = fable.byCell();
        for (int k = 0; k < SERIES; k++) {
            SeriesKey key = SeriesKey.of("region", "r" + k);
            double[] values = all.get(key).getValues();
            double max = Double.NEGATIVE_INFINITY;
            for (double value : values) {
                max = Math.max(max, value);
            }
            for (List<FableRow> rows : byCell.get(key).values()) {
                assertEquals(20, rows.size());
                assertEquals(all.get(key).timeAfterEnd(20), rows.get(19).getTime());
                for (FableRow row : rows) {
                    assertTrue(row.mean() > 0 && row.mean() < 2 * max);
                }
            }
        }

        for (HiloRow row : fable.hilo(80, 95)) {
            Hilo narrow = row.getIntervals().get(0);
            Hilo wide = row.getIntervals().get(1);
            assertTrue(narrow.width() > 0);
            assertTrue(wide.contains(narrow));
            assertTrue(narrow.contains(row.getMean()) || Double.isNaN(row.getMean()));
        }
    }

    @Test
    public void testHoldoutAccuracy() {
        Mable mable = Mable.builder().series(training).model("ets", ModelSpecification.ets())
                .model("arima", ModelSpecification.arima()).model("snaive", ModelSpecification.snaive()).build();
        TableExtract<AccuracyRow> accuracy = mable.accuracy(test, Horizon.steps(HOLDOUT));
        assertEquals(12, accuracy.size());
        assertTrue(accuracy.getFailures().isEmpty());
        for (AccuracyRow row : accuracy.getRows()) {
            assertEquals(AccuracyRow.TEST, row.getType());
            double mase = row.getMeasures().getMase();
            assertTrue(mase >= 0 && mase < 3, row.getKey() + " " + row.getModelName() + " MASE " + mase);
        }

        Mable updated = mable.stream(test);
        assertEquals(LENGTH, updated.getSeries().get(SeriesKey.of("region", "r0")).length());
        Fable fable = updated.forecast(Horizon.years(1));
        assertEquals(12 * 4, fable.size());
        assertEquals(all.get(SeriesKey.of("region", "r0")).timeAfterEnd(1), fable.getRows().get(0).getTime());
    }
}
