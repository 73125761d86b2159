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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.amazon.fable.FitterRegistry;
import com.amazon.fable.config.ErrorType;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.series.GroupedSeries;
import com.amazon.fable.series.Horizon;
import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.SeriesKey;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.EtsOptions;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.testutils.ExampleDataSets;

public class MableTest {

    private static final double EPSILON = 1e-10;

    private static final LocalDate START = LocalDate.of(2000, 1, 1);

    private static final SeriesKey A = SeriesKey.of("region", "a");

    private static final SeriesKey B = SeriesKey.of("region", "b");

    private static ModelSpecification multiplicativeEts;

    private static GroupedSeries data;

    private static Mable mable;

    @BeforeAll
    public static void fitTable() {
        multiplicativeEts = ModelSpecification.builder(ModelFamily.ETS)
                .fixed(EtsOptions.ERROR, ErrorType.MULTIPLICATIVE).build();
        data = GroupedSeries.builder(IndexInterval.quarterly())
                .add(A, quarterly(ExampleDataSets.randomWalk(40, 100, 1, 1, 11)))
                .add(B, quarterly(ExampleDataSets.constant(40, 0))).build();
        mable = buildMable(false);
    }

    private static TimeSeries quarterly(double[] values) {
        return TimeSeries.of(START, IndexInterval.quarterly(), values);
    }

    private static Mable buildMable(boolean parallel) {
        return Mable.builder().series(data).model("mean", ModelSpecification.mean())
                .model("naive", ModelSpecification.naive()).model("mets", multiplicativeEts)
                .parallelExecutionEnabled(parallel).threadPoolSize(2).build();
    }

    @Test
    public void testCellsFollowKeyThenModelOrder() {
        assertEquals(6, mable.size());
        assertEquals(Arrays.asList(A, B), mable.getKeys());
        assertEquals(Arrays.asList("mean", "naive", "mets"), mable.getModelNames());
        List<MableCell> cells = mable.getCells();
        assertEquals(A, cells.get(0).getKey());
        assertEquals("naive", cells.get(1).getModelName());
        assertEquals(B, cells.get(5).getKey());
        assertEquals("mets", cells.get(5).getModelName());
        assertSame(multiplicativeEts, mable.getSpecification("mets"));
        assertThrows(IllegalArgumentException.class, () -> mable.getSpecification("arima"));
    }

    @Test
    public void testFailingCellDoesNotAffectOthers() {
        assertEquals(5, mable.fittedCount());
        List<FitFailure> failures = mable.getFailures();
        assertEquals(1, failures.size());
        FitFailure failure = failures.get(0);
        assertEquals(B, failure.getKey());
        assertEquals("mets", failure.getModelName());
        assertEquals("fit", failure.getOperation());
        assertEquals("FitFailureException", failure.getExceptionType());
        assertFalse(failure.getCandidateFailures().isEmpty());

        MableCell failed = mable.getCell(B, "mets");
        assertFalse(failed.isFitted());
        assertThrows(IllegalStateException.class, failed::requireModel);
        assertTrue(mable.getCell(B, "mean").isFitted());
        assertTrue(mable.getCell(A, "mets").isFitted());
        assertThrows(IllegalArgumentException.class, () -> mable.getCell(SeriesKey.of("region", "c"), "mean"));
    }

    @Test
    public void testGetModels() {
        Map<SeriesKey, Map<String, IFittedModel>> models = mable.getModels();
        assertEquals(3, models.get(A).size());
        assertEquals(Arrays.asList("mean", "naive"), new ArrayList<>(models.get(B).keySet()));
        assertEquals(0, models.get(B).get("mean").forecast(1).getDistribution(0).mean(), EPSILON);
    }

    @Test
    public void testParallelMatchesSequential() {
        Mable parallel = buildMable(true);
        assertTrue(parallel.isParallelExecutionEnabled());
        assertEquals(2, parallel.getThreadPoolSize());
        assertEquals(0, mable.getThreadPoolSize());
        assertEquals(mable.fittedCount(), parallel.fittedCount());
        for (MableCell cell : mable.getCells()) {
            MableCell other = parallel.getCell(cell.getKey(), cell.getModelName());
            assertEquals(cell.isFitted(), other.isFitted());
            if (cell.isFitted()) {
                assertEquals(cell.getModel().getStructure(), other.getModel().getStructure());
                assertArrayEquals(cell.getModel().forecast(3).getMeans(), other.getModel().forecast(3).getMeans(),
                        EPSILON);
            }
        }
    }

    @Test
    public void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> Mable.builder().model("m", ModelSpecification.mean()).model("m", ModelSpecification.naive()));
        assertThrows(IllegalArgumentException.class, () -> Mable.builder().series(data).build());
        assertThrows(NullPointerException.class, () -> Mable.builder().model("m", ModelSpecification.mean()).build());
        assertThrows(IllegalArgumentException.class, () -> Mable.builder().series(data)
                .model("m", ModelSpecification.mean()).parallelExecutionEnabled(true).threadPoolSize(0).build());
    }

    @Test
    public void testFilterAndSelectShareCells() {
        Mable onlyA = mable.filter(key -> key.get("region").equals("a"));
        assertEquals(3, onlyA.size());
        assertEquals(Collections.singletonList(A), onlyA.getKeys());
        assertSame(mable.getCell(A, "naive"), onlyA.getCell(A, "naive"));

        Mable naive = mable.select("naive");
        assertEquals(2, naive.size());
        assertEquals(Collections.singletonList("naive"), naive.getModelNames());
        assertSame(mable.getCell(B, "naive"), naive.getCell(B, "naive"));
        assertThrows(IllegalArgumentException.class, () -> mable.select("unknown"));
    }

    @Test
    public void testForecastListsFailedCellsAsDiagnostics() {
        Fable fable = mable.forecast(4);
        assertEquals(20, fable.size());
        assertEquals(1, fable.getDiagnostics().size());
        List<FableRow> rows = fable.rowsFor(A, "naive");
        assertEquals(4, rows.size());
        double last = data.get(A).valueAt(39);
        for (int i = 0; i < 4; i++) {
            assertEquals(i + 1, rows.get(i).getStep());
            assertEquals(data.get(A).timeAfterEnd(i + 1), rows.get(i).getTime());
            assertEquals(last, rows.get(i).mean(), EPSILON);
        }
        assertEquals(8, mable.forecast(Horizon.years(2)).rowsFor(B, "mean").size());
    }

    @Test
    public void testRefit() {
        TimeSeries newA = quarterly(ExampleDataSets.randomWalk(30, 50, 0, 1, 12));
        GroupedSeries newData = GroupedSeries.builder(IndexInterval.quarterly()).add(A, newA).build();
        Mable refitted = mable.refit(newData);

        assertSame(newA, refitted.getSeries().get(A));
        assertSame(data.get(B), refitted.getSeries().get(B));
        double expectedMean = Arrays.stream(newA.getValues()).average().getAsDouble();
        assertEquals(expectedMean, refitted.getCell(A, "mean").getModel().forecast(1).getDistribution(0).mean(),
                1e-8);
        assertSame(mable.getCell(B, "mean"), refitted.getCell(B, "mean"));
        assertSame(mable.getCell(B, "mets"), refitted.getCell(B, "mets"));
        assertEquals("fit", refitted.getCell(B, "mets").getFailure().getOperation());
        assertEquals(mable.getCell(A, "mets").getModel().getStructure(),
                refitted.getCell(A, "mets").getModel().getStructure());
    }

    @Test
    public void testRefitErrorBecomesFailure() {
        double[] missing = new double[40];
        Arrays.fill(missing, Double.NaN);
        GroupedSeries newData = GroupedSeries.builder(IndexInterval.quarterly()).add(B, quarterly(missing)).build();
        Mable refitted = mable.refit(newData, false);
        FitFailure failure = refitted.getCell(B, "mean").getFailure();
        assertEquals("refit", failure.getOperation());
        assertEquals("RefitException", failure.getExceptionType());
        assertEquals(3, refitted.getFailures().size());
        assertTrue(refitted.getCell(A, "mean").isFitted());
    }

    @Test
    public void testStream() {
        TimeSeries original = data.get(A);
        TimeSeries next = TimeSeries.of(original.timeAfterEnd(1), IndexInterval.quarterly(), 120, 121);
        GroupedSeries newObservations = GroupedSeries.builder(IndexInterval.quarterly()).add(A, next).build();
        Mable streamed = mable.stream(newObservations);

        assertEquals(42, streamed.getSeries().get(A).length());
        assertEquals(42, streamed.getCell(A, "naive").getModel().getSeries().length());
        assertEquals(121, streamed.getCell(A, "naive").getModel().forecast(1).getDistribution(0).mean(), EPSILON);
        assertSame(mable.getCell(B, "naive"), streamed.getCell(B, "naive"));
        assertEquals(40, streamed.getSeries().get(B).length());
    }

    @Test
    public void testStreamErrorBecomesFailure() {
        TimeSeries late = TimeSeries.of(data.get(B).timeAfterEnd(3), IndexInterval.quarterly(), 1, 2);
        GroupedSeries newObservations = GroupedSeries.builder(IndexInterval.quarterly()).add(B, late).build();
        Mable streamed = mable.stream(newObservations);
        assertEquals("stream", streamed.getCell(B, "naive").getFailure().getOperation());
        assertEquals("StreamException", streamed.getCell(B, "naive").getFailure().getExceptionType());
        assertEquals(40, streamed.getSeries().get(B).length());
    }

    @Test
    public void testGenerateIsReproducible() {
        TableExtract<GeneratedPath> first = mable.generate(3, 5, 42);
        TableExtract<GeneratedPath> second = buildMable(true).generate(3, 5, 42);
        assertEquals(25, first.size());
        assertEquals(1, first.getFailures().size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.getRows().get(i).getKey(), second.getRows().get(i).getKey());
            assertArrayEquals(first.getRows().get(i).getValues(), second.getRows().get(i).getValues(), 0);
        }
        GeneratedPath path = first.getRows().get(0);
        assertEquals(data.get(A).timeAfterEnd(1), path.getTimes()[0]);
        assertNotEquals(first.getRows().get(0).getValues()[0], first.getRows().get(1).getValues()[0]);
        assertThrows(IllegalArgumentException.class, () -> mable.generate(0, 5, 42));
    }

    @Test
    public void testExtractions() {
        TableExtract<GlanceRow> glance = mable.glance();
        assertEquals(5, glance.size());
        assertTrue(glance.hasFailures());
        assertEquals("MEAN", glance.getRows().get(0).getStructure());

        assertEquals(200, mable.augment().size());
        assertEquals(5, mable.interpolate().size());
        assertTrue(mable.components().size() > 0);

        List<CoefficientRow> coefficients = mable.coefficients().getRows();
        CoefficientRow meanCoefficient = coefficients.get(0);
        assertEquals(A, meanCoefficient.getKey());
        assertEquals(Arrays.stream(data.get(A).getValues()).average().getAsDouble(), meanCoefficient.getEstimate(),
                1e-8);
    }

    @Test
    public void testTrainingAccuracy() {
        TableExtract<AccuracyRow> accuracy = mable.accuracy();
        assertEquals(5, accuracy.size());
        AccuracyRow row = accuracy.getRows().get(0);
        assertEquals(AccuracyRow.TRAINING, row.getType());
        assertEquals(0, row.getMeasures().getMe(), 1e-8);
    }

    @Test
    public void testTestAccuracy() {
        TimeSeries original = data.get(A);
        double last = original.valueAt(39);
        TimeSeries future = TimeSeries.of(original.timeAfterEnd(1), IndexInterval.quarterly(), last + 1, last + 2,
                last + 3);
        GroupedSeries actuals = GroupedSeries.builder(IndexInterval.quarterly()).add(A, future).build();
        TableExtract<AccuracyRow> accuracy = mable.select("naive").accuracy(actuals, Horizon.steps(4));
        assertEquals(1, accuracy.size());
        AccuracyRow row = accuracy.getRows().get(0);
        assertEquals(AccuracyRow.TEST, row.getType());
        assertEquals(2, row.getMeasures().getMe(), 1e-8);
        assertEquals(2, row.getMeasures().getMae(), 1e-8);
        assertEquals(1, accuracy.getFailures().size());
        assertEquals("accuracy", accuracy.getFailures().get(0).getOperation());
    }

    @Test
    public void testFromCells() {
        Map<String, ModelSpecification> specifications = new LinkedHashMap<>();
        for (String name : mable.getModelNames()) {
            specifications.put(name, mable.getSpecification(name));
        }
        Mable rebuilt = Mable.fromCells(data, specifications, mable.getCells(), FitterRegistry.defaultRegistry());
        assertEquals(mable.size(), rebuilt.size());
        assertFalse(rebuilt.isParallelExecutionEnabled());
        assertSame(mable.getCell(A, "mean"), rebuilt.getCell(A, "mean"));
        assertThrows(IllegalArgumentException.class,
                () -> Mable.fromCells(data, specifications, mable.getCells().subList(0, 3), null));
    }
}
