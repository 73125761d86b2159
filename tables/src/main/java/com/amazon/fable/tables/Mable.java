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

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.fable.FitterRegistry;
import com.amazon.fable.model.Coefficient;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.ModelComponents;
import com.amazon.fable.model.ModelForecast;
import com.amazon.fable.series.GroupedSeries;
import com.amazon.fable.series.Horizon;
import com.amazon.fable.series.SeriesKey;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.tables.accuracy.AccuracyCalculator;
import com.amazon.fable.tables.accuracy.AccuracyMeasures;
import com.amazon.fable.tables.executor.AbstractCellExecutor;
import com.amazon.fable.tables.executor.ParallelCellExecutor;
import com.amazon.fable.tables.executor.SequentialCellExecutor;

/**
 * A model table: one cell per (series key, model name), each holding a fitted
 * model or the reason fitting failed. Every cell is fitted independently, so a
 * failing cell never affects the others. Mables are immutable; every operation
 * returns a new table or extracted rows.
 */
@Slf4j
public class Mable {

    /**
     * By default cells are fitted one after the other in the calling thread.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    @Getter
    private final GroupedSeries series;

    private final LinkedHashMap<String, ModelSpecification> specifications;

    /**
     * Cells in key order, then model order.
     */
    private final List<MableCell> cells;

    private final FitterRegistry registry;

    @Getter
    private final boolean parallelExecutionEnabled;

    @Getter
    private final int threadPoolSize;

    private final AbstractCellExecutor executor;

    protected <T extends Builder<T>> Mable(Builder<T> builder) {
        checkNotNull(builder.series, "series must not be null");
        checkArgument(!builder.specifications.isEmpty(), "at least one model is required");
        builder.threadPoolSize.ifPresent(n -> checkArgument(n > 0, "threadPoolSize must be positive"));
        this.series = builder.series;
        this.specifications = new LinkedHashMap<>(builder.specifications);
        this.registry = builder.registry.orElseGet(FitterRegistry::defaultRegistry);
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            executor = new ParallelCellExecutor(threadPoolSize);
        } else {
            threadPoolSize = 0;
            executor = new SequentialCellExecutor();
        }

        List<SeriesKey> keys = series.getKeys();
        List<String> names = new ArrayList<>(specifications.keySet());
        List<Integer> positions = IntStream.range(0, keys.size() * names.size()).boxed()
                .collect(Collectors.toList());
        this.cells = Collections.unmodifiableList(executor.map(positions,
                i -> fitCell(keys.get(i / names.size()), names.get(i % names.size()))));
        log.info("fitted {} of {} cells for {} series and {} models", fittedCount(), cells.size(), series.size(),
                specifications.size());
    }

    private Mable(Mable source, GroupedSeries series, LinkedHashMap<String, ModelSpecification> specifications,
            List<MableCell> cells) {
        this(series, specifications, cells, source.registry, source.parallelExecutionEnabled, source.threadPoolSize,
                source.executor);
    }

    private Mable(GroupedSeries series, LinkedHashMap<String, ModelSpecification> specifications,
            List<MableCell> cells, FitterRegistry registry, boolean parallelExecutionEnabled, int threadPoolSize,
            AbstractCellExecutor executor) {
        this.series = series;
        this.specifications = specifications;
        this.cells = Collections.unmodifiableList(cells);
        this.registry = registry;
        this.parallelExecutionEnabled = parallelExecutionEnabled;
        this.threadPoolSize = threadPoolSize;
        this.executor = executor;
    }

    /**
     * Rebuilds a mable from existing cells without fitting anything. The result
     * runs its operations sequentially.
     *
     * @param series         the series of the cells
     * @param specifications the models by name
     * @param cells          the cells, in key order then model order
     * @param registry       the registry of the rebuilt table
     * @return the mable
     */
    public static Mable fromCells(GroupedSeries series, Map<String, ModelSpecification> specifications,
            List<MableCell> cells, FitterRegistry registry) {
        checkNotNull(series, "series must not be null");
        checkNotNull(specifications, "specifications must not be null");
        checkNotNull(cells, "cells must not be null");
        checkArgument(cells.size() == series.size() * specifications.size(), "one cell per key and model is required");
        return new Mable(series, new LinkedHashMap<>(specifications), new ArrayList<>(cells),
                (registry == null) ? FitterRegistry.defaultRegistry() : registry, false, 0,
                new SequentialCellExecutor());
    }

    private MableCell fitCell(SeriesKey key, String name) {
        ModelSpecification specification = specifications.get(name);
        try {
            IFittedModel model = registry.fit(series.get(key), specification);
            log.debug("{} {}: {}", key, name, model.getStructure());
            return MableCell.fitted(key, name, specification, model);
        } catch (RuntimeException e) {
            log.warn("{} {} failed to fit: {}", key, name, e.getMessage());
            return MableCell.failed(key, name, specification, FitFailure.from(key, name, "fit", e));
        }
    }

    public List<SeriesKey> getKeys() {
        return series.getKeys();
    }

    public List<String> getModelNames() {
        return new ArrayList<>(specifications.keySet());
    }

    public ModelSpecification getSpecification(String modelName) {
        ModelSpecification specification = specifications.get(modelName);
        checkArgument(specification != null, "unknown model " + modelName);
        return specification;
    }

    public List<MableCell> getCells() {
        return cells;
    }

    /**
     * @return the cell
     * @throws IllegalArgumentException if the table has no such cell
     */
    public MableCell getCell(SeriesKey key, String modelName) {
        for (MableCell cell : cells) {
            if (cell.getKey().equals(key) && cell.getModelName().equals(modelName)) {
                return cell;
            }
        }
        throw new IllegalArgumentException("no cell for " + key + " and " + modelName);
    }

    public int size() {
        return cells.size();
    }

    public int fittedCount() {
        return (int) cells.stream().filter(MableCell::isFitted).count();
    }

    public List<FitFailure> getFailures() {
        return cells.stream().filter(c -> !c.isFitted()).map(MableCell::getFailure).collect(Collectors.toList());
    }

    /**
     * @return the fitted models by key and model name; failed cells are left out
     */
    public Map<SeriesKey, Map<String, IFittedModel>> getModels() {
        Map<SeriesKey, Map<String, IFittedModel>> answer = new LinkedHashMap<>();
        for (MableCell cell : cells) {
            if (cell.isFitted()) {
                answer.computeIfAbsent(cell.getKey(), k -> new LinkedHashMap<>()).put(cell.getModelName(),
                        cell.getModel());
            }
        }
        return answer;
    }

    /**
     * @return a mable with the series accepted by the predicate, sharing the
     *         cells of this one
     */
    public Mable filter(Predicate<SeriesKey> predicate) {
        checkNotNull(predicate, "predicate must not be null");
        List<MableCell> kept = cells.stream().filter(c -> predicate.test(c.getKey())).collect(Collectors.toList());
        return new Mable(this, series.filter(predicate), specifications, kept);
    }

    /**
     * @return a mable with only the named models, sharing the cells of this one
     */
    public Mable select(String... modelNames) {
        checkArgument(modelNames != null && modelNames.length > 0, "at least one model name is required");
        LinkedHashMap<String, ModelSpecification> kept = new LinkedHashMap<>();
        for (String name : specifications.keySet()) {
            if (Arrays.asList(modelNames).contains(name)) {
                kept.put(name, specifications.get(name));
            }
        }
        for (String name : modelNames) {
            checkArgument(specifications.containsKey(name), "unknown model " + name);
        }
        List<MableCell> selected = cells.stream().filter(c -> kept.containsKey(c.getModelName()))
                .collect(Collectors.toList());
        return new Mable(this, series, kept, selected);
    }

    public Mable refit(GroupedSeries newData) {
        return refit(newData, true);
    }

    /**
     * Refits every fitted cell whose key appears in the new data, keeping each
     * model's structure. Failed cells stay failed and cells of keys absent from
     * the new data are unchanged; a refit error turns the cell into a failure.
     *
     * @param newData    the new data
     * @param reestimate false to keep the coefficients
     * @return the refitted mable
     */
    public Mable refit(GroupedSeries newData, boolean reestimate) {
        checkNotNull(newData, "data must not be null");
        List<MableCell> refitted = executor.map(cells, cell -> {
            if (!cell.isFitted() || !newData.contains(cell.getKey())) {
                return cell;
            }
            try {
                return cell.withModel(cell.getModel().refit(newData.get(cell.getKey()), reestimate));
            } catch (RuntimeException e) {
                log.warn("{} {} failed to refit: {}", cell.getKey(), cell.getModelName(), e.getMessage());
                return cell.withFailure(FitFailure.from(cell.getKey(), cell.getModelName(), "refit", e));
            }
        });
        GroupedSeries.Builder merged = GroupedSeries.builder(series.getInterval());
        for (SeriesKey key : series.getKeys()) {
            merged.add(key, newData.contains(key) && newData.getInterval().equals(series.getInterval())
                    ? newData.get(key)
                    : series.get(key));
        }
        return new Mable(this, merged.build(), specifications, refitted);
    }

    /**
     * Extends every fitted cell with observations continuing its series. Cells
     * of keys absent from the new data are unchanged; a stream error turns the
     * cell into a failure.
     *
     * @param newObservations observations starting one step after each series
     * @return the extended mable
     */
    public Mable stream(GroupedSeries newObservations) {
        checkNotNull(newObservations, "observations must not be null");
        List<MableCell> streamed = executor.map(cells, cell -> {
            if (!cell.isFitted() || !newObservations.contains(cell.getKey())) {
                return cell;
            }
            try {
                return cell.withModel(cell.getModel().stream(newObservations.get(cell.getKey())));
            } catch (RuntimeException e) {
                log.warn("{} {} failed to stream: {}", cell.getKey(), cell.getModelName(), e.getMessage());
                return cell.withFailure(FitFailure.from(cell.getKey(), cell.getModelName(), "stream", e));
            }
        });
        GroupedSeries.Builder merged = GroupedSeries.builder(series.getInterval());
        for (SeriesKey key : series.getKeys()) {
            TimeSeries current = series.get(key);
            TimeSeries addition = newObservations.contains(key) ? newObservations.get(key) : null;
            merged.add(key, addition != null && current.getInterval().equals(addition.getInterval())
                    && (addition.isEmpty() || current.isContinuedBy(addition)) ? current.append(addition) : current);
        }
        return new Mable(this, merged.build(), specifications, streamed);
    }

    public Fable forecast(int h) {
        return forecast(Horizon.steps(h));
    }

    public Fable forecast(Horizon horizon) {
        return Fable.forecast(cells, horizon, executor);
    }

    public TableExtract<CoefficientRow> coefficients() {
        return extract("coefficients", cell -> {
            List<CoefficientRow> rows = new ArrayList<>();
            for (Coefficient coefficient : cell.getModel().coefficients()) {
                rows.add(new CoefficientRow(cell.getKey(), cell.getModelName(), coefficient.getTerm(),
                        coefficient.getEstimate(), coefficient.getStandardError()));
            }
            return rows;
        });
    }

    public TableExtract<GlanceRow> glance() {
        return extract("glance", cell -> Collections.singletonList(new GlanceRow(cell.getKey(), cell.getModelName(),
                cell.getModel().getStructure(), cell.getModel().statistics())));
    }

    public TableExtract<AugmentRow> augment() {
        return extract("augment", cell -> {
            IFittedModel model = cell.getModel();
            TimeSeries data = model.getSeries();
            double[] fitted = model.fittedValues();
            double[] residuals = model.residuals();
            List<AugmentRow> rows = new ArrayList<>(data.length());
            for (int t = 0; t < data.length(); t++) {
                rows.add(new AugmentRow(cell.getKey(), cell.getModelName(), data.timeAt(t), data.valueAt(t),
                        fitted[t], residuals[t]));
            }
            return rows;
        });
    }

    public TableExtract<ComponentRow> components() {
        return extract("components", cell -> {
            ModelComponents components = cell.getModel().components();
            LocalDate[] times = components.getTimes();
            List<ComponentRow> rows = new ArrayList<>();
            for (String name : components.getNames()) {
                double[] values = components.get(name);
                for (int t = 0; t < times.length; t++) {
                    rows.add(new ComponentRow(cell.getKey(), cell.getModelName(), times[t], name, values[t]));
                }
            }
            return rows;
        });
    }

    public TableExtract<InterpolatedSeries> interpolate() {
        return extract("interpolate", cell -> Collections.singletonList(
                new InterpolatedSeries(cell.getKey(), cell.getModelName(), cell.getModel().interpolate())));
    }

    /**
     * Simulates future paths of every fitted cell. Each cell draws from its own
     * generator seeded from {@code seed} and the cell's position, so the result
     * does not depend on the executor.
     *
     * @param h      the number of steps
     * @param nPaths the number of paths per cell
     * @param seed   the seed
     * @return the paths
     */
    public TableExtract<GeneratedPath> generate(int h, int nPaths, long seed) {
        checkArgument(h > 0, "horizon must be positive");
        checkArgument(nPaths > 0, "number of paths must be positive");
        Map<MableCell, Integer> positions = new HashMap<>();
        for (int i = 0; i < cells.size(); i++) {
            positions.put(cells.get(i), i);
        }
        return extract("generate", cell -> {
            Random random = new Random(seed + 0x9E3779B97F4A7C15L * positions.get(cell));
            IFittedModel model = cell.getModel();
            double[][] paths = model.generate(h, nPaths, random);
            LocalDate[] times = new LocalDate[h];
            for (int i = 0; i < h; i++) {
                times[i] = model.getSeries().timeAfterEnd(i + 1);
            }
            List<GeneratedPath> rows = new ArrayList<>(nPaths);
            for (int path = 0; path < nPaths; path++) {
                rows.add(new GeneratedPath(cell.getKey(), cell.getModelName(), path, times, paths[path]));
            }
            return rows;
        });
    }

    /**
     * @return the accuracy of the fitted values on the training data
     */
    public TableExtract<AccuracyRow> accuracy() {
        return extract("accuracy", cell -> {
            IFittedModel model = cell.getModel();
            double[] training = model.getSeries().getValues();
            AccuracyMeasures measures = AccuracyCalculator.compute(training, model.fittedValues(), training,
                    model.getSeries().getSeasonalPeriod());
            return Collections.singletonList(
                    new AccuracyRow(cell.getKey(), cell.getModelName(), AccuracyRow.TRAINING, measures));
        });
    }

    /**
     * Forecasts every fitted cell and compares the forecast means with future
     * observations at the same time points.
     *
     * @param actuals the future observations
     * @param horizon the forecast horizon
     * @return the test accuracy of every cell whose key appears in the actuals
     */
    public TableExtract<AccuracyRow> accuracy(GroupedSeries actuals, Horizon horizon) {
        checkNotNull(actuals, "actuals must not be null");
        checkNotNull(horizon, "horizon must not be null");
        return extract("accuracy", cell -> {
            TimeSeries future = actuals.get(cell.getKey());
            checkArgument(future != null, "no actuals for " + cell.getKey());
            IFittedModel model = cell.getModel();
            ModelForecast forecast = model.forecast(horizon);
            Map<LocalDate, Double> observed = new HashMap<>();
            for (int t = 0; t < future.length(); t++) {
                observed.put(future.timeAt(t), future.valueAt(t));
            }
            double[] actual = new double[forecast.size()];
            double[] predicted = forecast.getMeans();
            for (int i = 0; i < actual.length; i++) {
                actual[i] = observed.getOrDefault(forecast.getTime(i), Double.NaN);
            }
            AccuracyMeasures measures = AccuracyCalculator.compute(actual, predicted, model.getSeries().getValues(),
                    model.getSeries().getSeasonalPeriod());
            return Collections.singletonList(
                    new AccuracyRow(cell.getKey(), cell.getModelName(), AccuracyRow.TEST, measures));
        });
    }

    private <R> TableExtract<R> extract(String operation, Function<MableCell, List<R>> task) {
        List<FitFailure> failures = new ArrayList<>();
        List<MableCell> fitted = new ArrayList<>();
        for (MableCell cell : cells) {
            if (cell.isFitted()) {
                fitted.add(cell);
            } else {
                failures.add(cell.getFailure());
            }
        }
        List<CellOutcome<List<R>>> outcomes = executor.map(fitted, cell -> {
            try {
                return CellOutcome.success(task.apply(cell));
            } catch (RuntimeException e) {
                log.warn("{} of {} {} failed: {}", operation, cell.getKey(), cell.getModelName(), e.getMessage());
                return CellOutcome.failure(FitFailure.from(cell.getKey(), cell.getModelName(), operation, e));
            }
        });
        List<R> rows = new ArrayList<>();
        for (CellOutcome<List<R>> outcome : outcomes) {
            if (outcome.isSuccess()) {
                rows.addAll(outcome.getValue());
            } else {
                failures.add(outcome.getFailure());
            }
        }
        return new TableExtract<>(rows, failures);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    @SuppressWarnings("unchecked")
    public static class Builder<T extends Builder<T>> {

        private GroupedSeries series;

        private final LinkedHashMap<String, ModelSpecification> specifications = new LinkedHashMap<>();

        private Optional<FitterRegistry> registry = Optional.empty();

        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;

        private Optional<Integer> threadPoolSize = Optional.empty();

        public T series(GroupedSeries series) {
            this.series = series;
            return (T) this;
        }

        /**
         * Adds a model column. Columns keep the order in which they are added.
         */
        public T model(String name, ModelSpecification specification) {
            checkNotNull(name, "name must not be null");
            checkNotNull(specification, "specification must not be null");
            checkArgument(!specifications.containsKey(name), "duplicated model name " + name);
            specifications.put(name, specification);
            return (T) this;
        }

        public T registry(FitterRegistry registry) {
            this.registry = Optional.ofNullable(registry);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        /**
         * Fits every cell.
         *
         * @return the fitted mable
         */
        public Mable build() {
            return new Mable(this);
        }
    }
}
