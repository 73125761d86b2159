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

import java.util.ArrayList;
import java.util.List;

import com.amazon.fable.model.Coefficient;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.BaselineOptions;
import com.amazon.fable.spec.ModelSpecification;

/**
 * The random walk, forecasting the last observation, optionally with drift.
 */
public class NaiveModel extends AbstractRandomWalkModel {

    NaiveModel(ModelSpecification specification, TimeSeries series, double drift, int differences, double[] fitted,
            double[] residuals, ModelStatistics statistics) {
        super(specification, series, 1, drift, differences, fitted, residuals, statistics);
    }

    static NaiveModel estimate(ModelSpecification specification, TimeSeries series) {
        boolean withDrift = specification.get(BaselineOptions.DRIFT).getValue();
        double[] values = series.getValues();
        double[] driftAndCount = estimateDrift(values, 1);
        double drift = withDrift ? driftAndCount[0] : 0;
        return withDrift(specification, series, drift, (int) driftAndCount[1]);
    }

    public static NaiveModel withDrift(ModelSpecification specification, TimeSeries series, double drift,
            int differences) {
        double[] values = series.getValues();
        double[] fitted = fittedValues(values, 1, drift);
        double[] residuals = difference(values, fitted);
        boolean withDrift = specification.get(BaselineOptions.DRIFT).getValue();
        return new NaiveModel(specification, series, drift, differences, fitted, residuals,
                BaselineStatistics.of(residuals, withDrift ? 1 : 0));
    }

    @Override
    protected boolean hasDrift() {
        return specification.get(BaselineOptions.DRIFT).getValue();
    }

    @Override
    public String getStructure() {
        return hasDrift() ? "RW w/ drift" : "NAIVE";
    }

    @Override
    public List<Coefficient> coefficients() {
        List<Coefficient> answer = new ArrayList<>();
        if (hasDrift()) {
            answer.add(new Coefficient("b", drift, Math.sqrt(statistics.getSigma2() / differences)));
        }
        return answer;
    }

    @Override
    protected IFittedModel reestimate(TimeSeries newSeries) {
        return new NaiveFitter().fit(newSeries, specification);
    }

    @Override
    protected IFittedModel refilter(TimeSeries newSeries) {
        return withDrift(specification, newSeries, drift, differences);
    }

    @Override
    protected IFittedModel extend(TimeSeries newObservations) {
        TimeSeries extended = series.append(newObservations);
        double[] values = extended.getValues();
        double[] allFitted = fittedValues(values, 1, drift);
        return new NaiveModel(specification, extended, drift, differences, allFitted, difference(values, allFitted),
                statistics);
    }
}
