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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.amazon.fable.distribution.Hilo;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.ModelForecast;
import com.amazon.fable.series.Horizon;
import com.amazon.fable.series.SeriesKey;
import com.amazon.fable.tables.executor.AbstractCellExecutor;
import com.amazon.fable.tables.executor.SequentialCellExecutor;

/**
 * A forecast table: one row per (series, model, future time point) holding the
 * forecast distribution. Cells without a model, or whose forecast failed, are
 * listed in the diagnostics instead.
 */
@Slf4j
public class Fable {

    private final List<FableRow> rows;

    private final List<FitFailure> diagnostics;

    Fable(List<FableRow> rows, List<FitFailure> diagnostics) {
        this.rows = Collections.unmodifiableList(rows);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    /**
     * Forecasts a collection of fitted models.
     *
     * @param models  fitted models by series key and model name
     * @param horizon the horizon
     * @return the forecast table
     */
    public static Fable of(Map<SeriesKey, Map<String, IFittedModel>> models, Horizon horizon) {
        checkNotNull(models, "models must not be null");
        List<MableCell> cells = new ArrayList<>();
        models.forEach((key, byName) -> byName.forEach(
                (name, model) -> cells.add(MableCell.fitted(key, name, model.getSpecification(), model))));
        return forecast(cells, horizon, new SequentialCellExecutor());
    }

    static Fable forecast(List<MableCell> cells, Horizon horizon, AbstractCellExecutor executor) {
        checkNotNull(horizon, "horizon must not be null");
        List<FitFailure> diagnostics = new ArrayList<>();
        List<MableCell> fitted = new ArrayList<>();
        for (MableCell cell : cells) {
            if (cell.isFitted()) {
                fitted.add(cell);
            } else {
                diagnostics.add(cell.getFailure());
            }
        }
        List<CellOutcome<List<FableRow>>> results = executor.map(fitted, cell -> forecastCell(cell, horizon));
        List<FableRow> rows = new ArrayList<>();
        for (CellOutcome<List<FableRow>> result : results) {
            if (result.isSuccess()) {
                rows.addAll(result.getValue());
            } else {
                diagnostics.add(result.getFailure());
            }
        }
        log.info("forecast {} rows from {} cells, {} diagnostics", rows.size(), cells.size(), diagnostics.size());
        return new Fable(rows, diagnostics);
    }

    private static CellOutcome<List<FableRow>> forecastCell(MableCell cell, Horizon horizon) {
        try {
            ModelForecast forecast = cell.getModel().forecast(horizon);
            List<FableRow> cellRows = new ArrayList<>(forecast.size());
            for (int i = 0; i < forecast.size(); i++) {
                cellRows.add(new FableRow(cell.getKey(), cell.getModelName(), i + 1, forecast.getTime(i),
                        forecast.getDistribution(i)));
            }
            return CellOutcome.success(cellRows);
        } catch (RuntimeException e) {
            log.warn("forecast of {} {} failed: {}", cell.getKey(), cell.getModelName(), e.getMessage());
            return CellOutcome.failure(FitFailure.from(cell.getKey(), cell.getModelName(), "forecast", e));
        }
    }

    public List<FableRow> getRows() {
        return rows;
    }

    /**
     * @return the cells that produced no rows and why
     */
    public List<FitFailure> getDiagnostics() {
        return diagnostics;
    }

    public int size() {
        return rows.size();
    }

    /**
     * @param levels percentages in (0, 100)
     * @return one row per forecast row with an interval per level
     */
    public List<HiloRow> hilo(double... levels) {
        checkArgument(levels != null && levels.length > 0, "at least one level is required");
        List<HiloRow> answer = new ArrayList<>(rows.size());
        for (FableRow row : rows) {
            List<Hilo> intervals = row.hilo(levels);
            answer.add(new HiloRow(row.getKey(), row.getModelName(), row.getTime(), row.mean(), intervals));
        }
        return answer;
    }

    /**
     * @return a fable with the rows accepted by the predicate and the same
     *         diagnostics
     */
    public Fable filter(Predicate<FableRow> predicate) {
        checkNotNull(predicate, "predicate must not be null");
        return new Fable(rows.stream().filter(predicate).collect(Collectors.toList()), diagnostics);
    }

    public List<FableRow> rowsFor(SeriesKey key, String modelName) {
        return rows.stream().filter(r -> r.getKey().equals(key) && r.getModelName().equals(modelName))
                .collect(Collectors.toList());
    }

    /**
     * @return the rows grouped by series key and model name, in row order
     */
    public Map<SeriesKey, Map<String, List<FableRow>>> byCell() {
        Map<SeriesKey, Map<String, List<FableRow>>> answer = new LinkedHashMap<>();
        for (FableRow row : rows) {
            answer.computeIfAbsent(row.getKey(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(row.getModelName(), k -> new ArrayList<>()).add(row);
        }
        return answer;
    }
}
