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

package com.amazon.fable.model;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;
import static com.amazon.fable.CommonUtils.isObserved;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Random;

import com.amazon.fable.FitFailureException;
import com.amazon.fable.RefitException;
import com.amazon.fable.StreamException;
import com.amazon.fable.distribution.IDistribution;
import com.amazon.fable.optim.OptimizationException;
import com.amazon.fable.series.Horizon;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;

/**
 * The parts of a fitted model that do not depend on the family: the series,
 * fitted values and residuals, statistics, and the validation of new data
 * before it reaches the family specific code.
 */
public abstract class AbstractFittedModel implements IFittedModel {

    protected final ModelSpecification specification;

    protected final TimeSeries series;

    protected final double[] fitted;

    protected final double[] residuals;

    protected final ModelStatistics statistics;

    protected AbstractFittedModel(ModelSpecification specification, TimeSeries series, double[] fitted,
            double[] residuals, ModelStatistics statistics) {
        this.specification = checkNotNull(specification, "specification must not be null");
        this.series = checkNotNull(series, "series must not be null");
        checkArgument(fitted.length == series.length(), "fitted values must match the series");
        checkArgument(residuals.length == series.length(), "residuals must match the series");
        this.fitted = fitted;
        this.residuals = residuals;
        this.statistics = checkNotNull(statistics, "statistics must not be null");
    }

    @Override
    public ModelFamily getFamily() {
        return specification.getFamily();
    }

    @Override
    public ModelSpecification getSpecification() {
        return specification;
    }

    @Override
    public TimeSeries getSeries() {
        return series;
    }

    @Override
    public double[] fittedValues() {
        return Arrays.copyOf(fitted, fitted.length);
    }

    @Override
    public double[] residuals() {
        return Arrays.copyOf(residuals, residuals.length);
    }

    @Override
    public ModelStatistics statistics() {
        return statistics;
    }

    @Override
    public ModelForecast forecast(Horizon horizon) {
        checkNotNull(horizon, "horizon must not be null");
        return forecast(horizon.resolve(series));
    }

    @Override
    public ModelForecast forecast(int h) {
        checkArgument(h > 0, "horizon must be positive");
        IDistribution[] distributions = forecastDistributions(h);
        LocalDate[] times = new LocalDate[h];
        for (int i = 0; i < h; i++) {
            times[i] = series.timeAfterEnd(i + 1);
        }
        return new ModelForecast(times, distributions);
    }

    /**
     * @param h a positive horizon
     * @return the forecast distribution for each of the next h steps
     */
    protected abstract IDistribution[] forecastDistributions(int h);

    @Override
    public IFittedModel refit(TimeSeries newSeries) {
        return refit(newSeries, true);
    }

    @Override
    public IFittedModel refit(TimeSeries newSeries, boolean reestimate) {
        checkNotNull(newSeries, "series must not be null");
        if (!newSeries.getInterval().equals(series.getInterval())) {
            throw new RefitException(
                    "interval " + newSeries.getInterval() + " differs from the model's " + series.getInterval());
        }
        if (newSeries.countObserved() == 0) {
            throw new RefitException("series has no observations");
        }
        try {
            return reestimate ? reestimate(newSeries) : refilter(newSeries);
        } catch (FitFailureException | OptimizationException | IllegalArgumentException e) {
            throw new RefitException("cannot refit " + getStructure() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Estimates the coefficients of this structure on new data.
     */
    protected abstract IFittedModel reestimate(TimeSeries newSeries);

    /**
     * Runs this model, coefficients unchanged, over new data.
     */
    protected abstract IFittedModel refilter(TimeSeries newSeries);

    @Override
    public IFittedModel stream(TimeSeries newObservations) {
        checkNotNull(newObservations, "observations must not be null");
        if (!newObservations.getInterval().equals(series.getInterval())) {
            throw new StreamException(
                    "interval " + newObservations.getInterval() + " differs from the model's " + series.getInterval());
        }
        if (!newObservations.isEmpty() && !series.isContinuedBy(newObservations)) {
            throw new StreamException("observations start at " + newObservations.getStart() + ", expected "
                    + series.timeAfterEnd(1));
        }
        return extend(newObservations);
    }

    /**
     * @param newObservations observations continuing the series, possibly none
     * @return a new model whose state has absorbed the observations
     */
    protected abstract IFittedModel extend(TimeSeries newObservations);

    @Override
    public double[][] generate(int h, int paths, Random random) {
        return generate(h, paths, random, false);
    }

    @Override
    public double[][] generate(int h, int paths, Random random, boolean bootstrap) {
        checkArgument(h > 0, "horizon must be positive");
        checkArgument(paths > 0, "number of paths must be positive");
        checkNotNull(random, "random must not be null");
        IInnovationSampler sampler = bootstrap ? IInnovationSampler.bootstrap(innovationResiduals())
                : IInnovationSampler.gaussian(Math.sqrt(statistics.getSigma2()));
        double[][] answer = new double[paths][];
        for (int i = 0; i < paths; i++) {
            answer[i] = simulate(h, random, sampler);
        }
        return answer;
    }

    /**
     * @return one future path of length h
     */
    protected abstract double[] simulate(int h, Random random, IInnovationSampler sampler);

    /**
     * @return the residuals on the scale at which innovations enter the model
     */
    protected double[] innovationResiduals() {
        return residuals;
    }

    @Override
    public TimeSeries interpolate() {
        double[] values = series.getValues();
        for (int t = 0; t < values.length; t++) {
            if (!isObserved(values[t]) && isObserved(fitted[t])) {
                values[t] = fitted[t];
            }
        }
        return series.withValues(values);
    }

    /**
     * @return a seed that depends only on the data and the structure, so that
     *         simulated forecasts are reproducible
     */
    protected long simulationSeed() {
        return 31L * Arrays.hashCode(series.getValues()) + getStructure().hashCode();
    }

    protected static double[] concat(double[] first, double[] second) {
        double[] answer = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, answer, first.length, second.length);
        return answer;
    }

    @Override
    public String toString() {
        return getStructure();
    }
}
