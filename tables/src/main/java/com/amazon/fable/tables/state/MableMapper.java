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

package com.amazon.fable.tables.state;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.time.Period;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

import com.amazon.fable.CandidateFailure;
import com.amazon.fable.FitterRegistry;
import com.amazon.fable.series.GroupedSeries;
import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.SeriesKey;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.state.FittedModelMapper;
import com.amazon.fable.state.IStateMapper;
import com.amazon.fable.state.ModelSpecificationMapper;
import com.amazon.fable.state.ModelSpecificationState;
import com.amazon.fable.state.TimeSeriesMapper;
import com.amazon.fable.tables.FitFailure;
import com.amazon.fable.tables.Mable;
import com.amazon.fable.tables.MableCell;

/**
 * Converts a {@link Mable} to a {@link MableState} and back. Fitted cells are
 * restored through {@link FittedModelMapper}; failed cells keep their failure.
 */
@Getter
@Setter
public class MableMapper implements IStateMapper<Mable, MableState> {

    /**
     * The registry given to restored mables, used when they are refitted.
     */
    private FitterRegistry registry = FitterRegistry.defaultRegistry();

    private final FittedModelMapper modelMapper = new FittedModelMapper();

    private final ModelSpecificationMapper specificationMapper = new ModelSpecificationMapper();

    private final TimeSeriesMapper seriesMapper = new TimeSeriesMapper();

    @Override
    public MableState toState(Mable mable) {
        checkNotNull(mable, "mable must not be null");
        GroupedSeries grouped = mable.getSeries();
        MableState state = new MableState();
        state.setStep(grouped.getInterval().getStep().toString());
        state.setSeasonalPeriod(grouped.getInterval().getSeasonalPeriod());

        List<SeriesKey> keys = grouped.getKeys();
        List<SeriesEntryState> series = new ArrayList<>(keys.size());
        for (SeriesKey key : keys) {
            SeriesEntryState entry = new SeriesEntryState();
            entry.setKeyNames(new ArrayList<>(key.getNames()));
            entry.setKeyValues(new ArrayList<>(key.getValues()));
            entry.setSeriesState(seriesMapper.toState(grouped.get(key)));
            series.add(entry);
        }
        state.setSeries(series);

        List<String> names = mable.getModelNames();
        List<ModelSpecificationState> specifications = new ArrayList<>(names.size());
        for (String name : names) {
            specifications.add(specificationMapper.toState(mable.getSpecification(name)));
        }
        state.setModelNames(new ArrayList<>(names));
        state.setSpecificationStates(specifications);

        List<MableCellState> cells = new ArrayList<>(mable.size());
        for (MableCell cell : mable.getCells()) {
            MableCellState cellState = new MableCellState();
            cellState.setSeriesIndex(keys.indexOf(cell.getKey()));
            cellState.setModelName(cell.getModelName());
            if (cell.isFitted()) {
                cellState.setModelState(modelMapper.toState(cell.getModel()));
            } else {
                FitFailure failure = cell.getFailure();
                cellState.setFailureOperation(failure.getOperation());
                cellState.setFailureType(failure.getExceptionType());
                cellState.setFailureMessage(failure.getMessage());
                List<String> candidates = new ArrayList<>();
                for (CandidateFailure candidate : failure.getCandidateFailures()) {
                    candidates.add(candidate.getCandidate());
                    candidates.add(candidate.getMessage());
                }
                cellState.setCandidateFailures(candidates);
            }
            cells.add(cellState);
        }
        state.setCells(cells);
        return state;
    }

    @Override
    public Mable toModel(MableState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(state.getSeries() != null && state.getCells() != null, "series and cells must be present");
        checkArgument(state.getModelNames() != null && state.getSpecificationStates() != null
                && state.getModelNames().size() == state.getSpecificationStates().size(),
                "every model name needs a specification");

        IndexInterval interval = IndexInterval.of(Period.parse(state.getStep()), state.getSeasonalPeriod());
        GroupedSeries.Builder builder = GroupedSeries.builder(interval);
        List<SeriesKey> keys = new ArrayList<>();
        for (SeriesEntryState entry : state.getSeries()) {
            SeriesKey key = SeriesKey.of(entry.getKeyNames(), entry.getKeyValues());
            keys.add(key);
            builder.add(key, seriesMapper.toModel(entry.getSeriesState()));
        }
        GroupedSeries grouped = builder.build();

        Map<String, ModelSpecification> specifications = new LinkedHashMap<>();
        for (int i = 0; i < state.getModelNames().size(); i++) {
            specifications.put(state.getModelNames().get(i),
                    specificationMapper.toModel(state.getSpecificationStates().get(i)));
        }

        List<MableCell> cells = new ArrayList<>(state.getCells().size());
        for (MableCellState cellState : state.getCells()) {
            checkArgument(cellState.getSeriesIndex() >= 0 && cellState.getSeriesIndex() < keys.size(),
                    "incorrect series index " + cellState.getSeriesIndex());
            SeriesKey key = keys.get(cellState.getSeriesIndex());
            String name = cellState.getModelName();
            ModelSpecification specification = specifications.get(name);
            checkArgument(specification != null, "unknown model " + name);
            if (cellState.getModelState() != null) {
                cells.add(MableCell.fitted(key, name, specification, modelMapper.toModel(cellState.getModelState())));
            } else {
                List<CandidateFailure> candidates = new ArrayList<>();
                List<String> stored = cellState.getCandidateFailures();
                if (stored != null) {
                    for (int i = 0; i + 1 < stored.size(); i += 2) {
                        candidates.add(new CandidateFailure(stored.get(i), stored.get(i + 1)));
                    }
                }
                cells.add(MableCell.failed(key, name, specification,
                        new FitFailure(key, name, cellState.getFailureOperation(), cellState.getFailureType(),
                                cellState.getFailureMessage(), candidates)));
            }
        }
        return Mable.fromCells(grouped, specifications, cells, registry);
    }
}
