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

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.time.LocalDate;
import java.time.Period;

import com.amazon.fable.series.IndexInterval;
import com.amazon.fable.series.TimeSeries;

public class TimeSeriesMapper implements IStateMapper<TimeSeries, TimeSeriesState> {

    @Override
    public TimeSeriesState toState(TimeSeries series) {
        checkNotNull(series, "series must not be null");
        TimeSeriesState state = new TimeSeriesState();
        state.setStart(series.getStart().toString());
        state.setStep(series.getInterval().getStep().toString());
        state.setSeasonalPeriod(series.getSeasonalPeriod());
        state.setValues(series.getValues());
        return state;
    }

    @Override
    public TimeSeries toModel(TimeSeriesState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(state.getValues() != null, "values must be present");
        IndexInterval interval = IndexInterval.of(Period.parse(state.getStep()), state.getSeasonalPeriod());
        return TimeSeries.of(LocalDate.parse(state.getStart()), interval, state.getValues());
    }
}
