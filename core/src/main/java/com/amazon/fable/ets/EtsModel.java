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

package com.amazon.fable.ets;

import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import lombok.Getter;

import com.amazon.fable.RefitException;
import com.amazon.fable.StreamException;
import com.amazon.fable.config.InformationCriterion;
import com.amazon.fable.distribution.IDistribution;
import com.amazon.fable.distribution.Normal;
import com.amazon.fable.distribution.Sample;
import com.amazon.fable.model.AbstractFittedModel;
import com.amazon.fable.model.Coefficient;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.IInnovationSampler;
import com.amazon.fable.model.ModelComponents;
import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.EtsOptions;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.statistics.Moments;

/**
 * A fitted exponential smoothing model. The final state of the filter is kept
 * so that forecasts, simulation and streaming continue from the last
 * observation.
 */
public class EtsModel extends AbstractFittedModel {

    /**
     * Number of simulated paths behind the forecast distributions of models with
     * additive errors and a multiplicative season.
     */
    public static final int DEFAULT_SIMULATION_PATHS = 5000;

    @Getter
    private final EtsStructure etsStructure;

    @Getter
    private final int period;

    @Getter
    private final EtsParameters parameters;

    /**
     * Estimated parameters excluding the innovation variance.
     */
    private final int freeParameters;

    private final double[] innovations;

    private final double[] levels;

    private final double[] slopes;

    private final double[] seasons;

    private final EtsState finalState;

    private final EtsSelection selection;

    /**
     * The fitter re-estimation goes through, null for the default one.
     */
    private final EtsFitter origin;

    EtsModel(ModelSpecification specification, TimeSeries series, EtsStructure structure, int period,
            EtsParameters parameters, int freeParameters, double[] fitted, double[] residuals, double[] innovations,
            double[] levels, double[] slopes, double[] seasons, EtsState finalState, ModelStatistics statistics,
            EtsSelection selection, EtsFitter origin) {
        super(specification, series, fitted, residuals, statistics);
        this.etsStructure = structure;
        this.period = period;
        this.parameters = parameters;
        this.freeParameters = freeParameters;
        this.innovations = innovations;
        this.levels = levels;
        this.slopes = slopes;
        this.seasons = seasons;
        this.finalState = finalState;
        this.selection = selection;
        this.origin = origin;
    }

    /**
     * Builds a model by running the filter with known parameters over a series.
     *
     * @param specification  the specification the model belongs to
     * @param series         the series
     * @param structure      the structure
     * @param period         the seasonal period
     * @param parameters     smoothing parameters and initial states
     * @param freeParameters the number of estimated parameters, excluding the
     *                       innovation variance
     * @return the model
     * @throws IllegalArgumentException if the filter leaves the admissible region
     */
    public static EtsModel fromParameters(ModelSpecification specification, TimeSeries series, EtsStructure structure,
            int period, EtsParameters parameters, int freeParameters) {
        checkNotNull(series, "series must not be null");
        EtsFilterResult result = new EtsFilter(structure, parameters, period).run(series.getValues());
        if (!result.isValid()) {
            throw new IllegalArgumentException(structure + " produces non-finite or non-positive forecasts");
        }
        ModelStatistics statistics = statistics(result, structure, freeParameters + 1);
        return new EtsModel(specification, series, structure, period, parameters, freeParameters,
                result.getFitted(), result.getResiduals(), result.getInnovations(), result.getLevels(),
                result.getSlopes(), result.getSeasons(), result.getFinalState(), statistics, null, null);
    }

    static ModelStatistics statistics(EtsFilterResult result, EtsStructure structure, int k) {
        int n = result.getObservations();
        double logLik = result.logLikelihood(structure.isMultiplicativeError());
        double sse = result.getSumOfSquaredInnovations();
        double sigma2 = (n > k - 1) ? sse / (n - (k - 1)) : sse / n;
        return ModelStatistics.builder().sigma2(sigma2).logLik(logLik).aic(InformationCriterion.aic(logLik, k))
                .aicc(InformationCriterion.aicc(logLik, k, n)).bic(InformationCriterion.bic(logLik, k, n))
                .mse(Moments.meanSquare(result.getResiduals())).mae(Moments.meanAbsolute(result.getResiduals()))
                .nobs(n).parameters(k).build();
    }

    EtsModel withSelection(EtsSelection newSelection, EtsFitter newOrigin) {
        return new EtsModel(specification, series, etsStructure, period, parameters, freeParameters, fitted,
                residuals, innovations, levels, slopes, seasons, finalState, statistics, newSelection, newOrigin);
    }

    /**
     * @return the candidates of the automatic search that produced this model,
     *         or null for a model built from known parameters
     */
    public EtsSelection getSelection() {
        return selection;
    }

    public int getFreeParameters() {
        return freeParameters;
    }

    @Override
    public String getStructure() {
        return etsStructure.toString();
    }

    @Override
    public List<Coefficient> coefficients() {
        List<Coefficient> answer = new ArrayList<>();
        answer.add(new Coefficient("alpha", parameters.getAlpha()));
        if (etsStructure.hasTrend()) {
            answer.add(new Coefficient("beta", parameters.getBeta()));
        }
        if (etsStructure.hasSeason()) {
            answer.add(new Coefficient("gamma", parameters.getGamma()));
        }
        if (etsStructure.isDamped()) {
            answer.add(new Coefficient("phi", parameters.getPhi()));
        }
        answer.add(new Coefficient("l[0]", parameters.getLevel()));
        if (etsStructure.hasTrend()) {
            answer.add(new Coefficient("b[0]", parameters.getSlope()));
        }
        if (etsStructure.hasSeason()) {
            double[] season = parameters.getSeason();
            for (int j = 0; j < period; j++) {
                answer.add(new Coefficient("s[" + (j - period + 1) + "]", season[j]));
            }
        }
        return answer;
    }

    private EtsFilter filter() {
        return new EtsFilter(etsStructure, parameters, period);
    }

    @Override
    protected IDistribution[] forecastDistributions(int h) {
        if (etsStructure.isMultiplicativeSeason()) {
            return etsStructure.isMultiplicativeError() ? seasonalMomentDistributions(h)
                    : simulatedDistributions(h);
        }
        EtsFilter filter = filter();
        double[] mu = pointForecasts(filter, h);
        double[] c = filter.impulseResponse(h);
        double sigma2 = statistics.getSigma2();
        IDistribution[] answer = new IDistribution[h];
        if (!etsStructure.isMultiplicativeError()) {
            double sum = 1;
            for (int i = 0; i < h; i++) {
                if (i > 0) {
                    sum += c[i - 1] * c[i - 1];
                }
                answer[i] = Normal.fromVariance(mu[i], sigma2 * sum);
            }
        } else {
            double[] theta = new double[h];
            for (int i = 0; i < h; i++) {
                theta[i] = mu[i] * mu[i];
                for (int j = 1; j <= i; j++) {
                    theta[i] += sigma2 * c[j - 1] * c[j - 1] * theta[i - j];
                }
                double variance = (1 + sigma2) * theta[i] - mu[i] * mu[i];
                answer[i] = Normal.fromVariance(mu[i], Math.max(0, variance));
            }
        }
        return answer;
    }

    private double[] pointForecasts(EtsFilter filter, int h) {
        EtsState state = finalState.copy();
        int n = series.length();
        double[] mu = new double[h];
        for (int i = 0; i < h; i++) {
            int position = filter.positionOf(n + i);
            mu[i] = filter.oneStep(state, position);
            filter.update(state, position, 0);
        }
        return mu;
    }

    private IDistribution[] seasonalMomentDistributions(int h) {
        double[] mean = new double[h];
        double[] variance = new double[h];
        new EtsSeasonalMoments(etsStructure, parameters, period, statistics.getSigma2()).forecast(finalState,
                series.length(), h, mean, variance);
        IDistribution[] answer = new IDistribution[h];
        for (int i = 0; i < h; i++) {
            answer[i] = Normal.fromVariance(mean[i], variance[i]);
        }
        return answer;
    }

    private IDistribution[] simulatedDistributions(int h) {
        Random random = new Random(simulationSeed());
        IInnovationSampler sampler = IInnovationSampler.gaussian(Math.sqrt(statistics.getSigma2()));
        double[][] byStep = new double[h][DEFAULT_SIMULATION_PATHS];
        for (int path = 0; path < DEFAULT_SIMULATION_PATHS; path++) {
            double[] values = simulate(h, random, sampler);
            for (int i = 0; i < h; i++) {
                byStep[i][path] = values[i];
            }
        }
        IDistribution[] answer = new IDistribution[h];
        for (int i = 0; i < h; i++) {
            answer[i] = new Sample(byStep[i]);
        }
        return answer;
    }

    @Override
    protected double[] simulate(int h, Random random, IInnovationSampler sampler) {
        EtsFilter filter = filter();
        EtsState state = finalState.copy();
        int n = series.length();
        double[] path = new double[h];
        for (int i = 0; i < h; i++) {
            int position = filter.positionOf(n + i);
            double mu = filter.oneStep(state, position);
            double e = sampler.next(random);
            double y = etsStructure.isMultiplicativeError() ? mu * (1 + e) : mu + e;
            path[i] = y;
            filter.update(state, position, y - mu);
        }
        return path;
    }

    @Override
    protected double[] innovationResiduals() {
        return innovations;
    }

    @Override
    protected IFittedModel reestimate(TimeSeries newSeries) {
        ModelSpecification pinned = specification.withFixed(EtsOptions.ERROR, etsStructure.getError())
                .withFixed(EtsOptions.TREND, etsStructure.getTrend())
                .withFixed(EtsOptions.SEASON, etsStructure.getSeason()).withFixed(EtsOptions.PERIOD, period);
        return (origin == null ? new EtsFitter() : origin).fit(newSeries, pinned);
    }

    @Override
    protected IFittedModel refilter(TimeSeries newSeries) {
        if (etsStructure.needsPositiveData() && !newSeries.isStrictlyPositive()) {
            throw new RefitException(getStructure() + " needs strictly positive data");
        }
        return fromParameters(specification, newSeries, etsStructure, period, parameters, freeParameters)
                .withSelection(null, origin);
    }

    @Override
    protected IFittedModel extend(TimeSeries newObservations) {
        EtsFilterResult result = filter().resume(finalState, series.length(), newObservations.getValues());
        if (!result.isValid()) {
            throw new StreamException(getStructure() + " cannot absorb the observations");
        }
        return new EtsModel(specification, series.append(newObservations), etsStructure, period, parameters,
                freeParameters, concat(fitted, result.getFitted()), concat(residuals, result.getResiduals()),
                concat(innovations, result.getInnovations()), concat(levels, result.getLevels()),
                concat(slopes, result.getSlopes()), concat(seasons, result.getSeasons()), result.getFinalState(),
                statistics, selection, origin);
    }

    @Override
    public ModelComponents components() {
        ModelComponents components = new ModelComponents(series.getTimes());
        components.add("level", levels);
        if (etsStructure.hasTrend()) {
            components.add("slope", slopes);
        }
        if (etsStructure.hasSeason()) {
            components.add("season", seasons);
        }
        components.add("remainder", innovations);
        return components;
    }
}
