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

package com.amazon.fable.baseline;

import java.util.Collections;
import java.util.List;

import com.amazon.fable.model.Coefficient;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.BaselineOptions;
import com.amazon.fable.spec.ModelSpecification;

/**
 * The seasonal random walk, forecasting the last observation of the same
 * season.
 */
public class SeasonalNaiveModel extends AbstractRandomWalkModel {

    SeasonalNaiveModel(ModelSpecification specification, TimeSeries series, int period, double[] fitted,
            double[] residuals, ModelStatistics statistics) {
        super(specification, series, period, 0, 0, fitted, residuals, statistics);
    }

    public static SeasonalNaiveModel estimate(ModelSpecification specification, TimeSeries series,
            int period) {
        double[] values = series.getValues();
        double[] fitted = fittedValues(values, period, 0);
        double[] residuals = difference(values, fitted);
        return new SeasonalNaiveModel(specification, series, period, fitted, residuals,
                BaselineStatistics.of(residuals, 0));
    }

    @Override
    protected boolean hasDrift() {
        return false;
    }

    @Override
    public String getStructure() {
        return "SNAIVE[" + lag + "]";
    }

    @Override
    public List<Coefficient> coefficients() {
        return Collections.emptyList();
    }

    @Override
    protected IFittedModel reestimate(TimeSeries newSeries) {
        return new SeasonalNaiveFitter().fit(newSeries, specification.withFixed(BaselineOptions.PERIOD, lag));
    }

    @Override
    protected IFittedModel refilter(TimeSeries newSeries) {
        SeasonalNaiveModel model = estimate(specification, newSeries, lag);
        return new SeasonalNaiveModel(specification, newSeries, lag, model.fitted, model.residuals, statistics);
    }

    @Override
    protected IFittedModel extend(TimeSeries newObservations) {
        TimeSeries extended = series.append(newObservations);
        double[] values = extended.getValues();
        double[] allFitted = fittedValues(values, lag, 0);
        return new SeasonalNaiveModel(specification, extended, lag, allFitted, difference(values, allFitted),
                statistics);
    }
}
