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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import lombok.Getter;

import com.amazon.fable.distribution.IDistribution;
import com.amazon.fable.distribution.Normal;
import com.amazon.fable.model.AbstractFittedModel;
import com.amazon.fable.model.Coefficient;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.IInnovationSampler;
import com.amazon.fable.model.ModelComponents;
import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.statistics.Moments;

/**
 * Forecasts every future value by the mean of the observations.
 */
public class MeanModel extends AbstractFittedModel {

    @Getter
    private final double mean;

    /**
     * The number of observations behind the mean.
     */
    private final int count;

    MeanModel(ModelSpecification specification, TimeSeries series, double mean, int count, double[] fitted,
            double[] residuals, ModelStatistics statistics) {
        super(specification, series, fitted, residuals, statistics);
        this.mean = mean;
        this.count = count;
    }

    static MeanModel estimate(ModelSpecification specification, TimeSeries series) {
        double[] values = series.getValues();
        return withMean(specification, series, Moments.mean(values), series.countObserved());
    }

    public static MeanModel withMean(ModelSpecification specification, TimeSeries series, double mean,
            int count) {
        double[] values = series.getValues();
        double[] fitted = new double[values.length];
        Arrays.fill(fitted, mean);
        double[] residuals = new double[values.length];
        for (int t = 0; t < values.length; t++) {
            residuals[t] = values[t] - mean;
        }
        return new MeanModel(specification, series, mean, count, fitted, residuals,
                BaselineStatistics.of(residuals, 1));
    }

    public int getCount() {
        return count;
    }

    @Override
    public String getStructure() {
        return "MEAN";
    }

    @Override
    public List<Coefficient> coefficients() {
        return Collections.singletonList(new Coefficient("mean", mean, Math.sqrt(statistics.getSigma2() / count)));
    }

    @Override
    protected IDistribution[] forecastDistributions(int h) {
        IDistribution[] answer = new IDistribution[h];
        double variance = statistics.getSigma2() * (1 + 1.0 / count);
        for (int i = 0; i < h; i++) {
            answer[i] = Normal.fromVariance(mean, variance);
        }
        return answer;
    }

    @Override
    protected double[] simulate(int h, Random random, IInnovationSampler sampler) {
        double[] path = new double[h];
        for (int i = 0; i < h; i++) {
            path[i] = mean + sampler.next(random);
        }
        return path;
    }

    @Override
    protected IFittedModel reestimate(TimeSeries newSeries) {
        return new MeanFitter().fit(newSeries, specification);
    }

    @Override
    protected IFittedModel refilter(TimeSeries newSeries) {
        return withMean(specification, newSeries, mean, count);
    }

    @Override
    protected IFittedModel extend(TimeSeries newObservations) {
        double[] fittedTail = new double[newObservations.length()];
        Arrays.fill(fittedTail, mean);
        double[] values = newObservations.getValues();
        double[] residualTail = new double[values.length];
        for (int t = 0; t < values.length; t++) {
            residualTail[t] = values[t] - mean;
        }
        return new MeanModel(specification, series.append(newObservations), mean, count,
                concat(fitted, fittedTail), concat(residuals, residualTail), statistics);
    }

    @Override
    public ModelComponents components() {
        return new ModelComponents(series.getTimes()).add("fitted", fitted).add("remainder", residuals);
    }
}
