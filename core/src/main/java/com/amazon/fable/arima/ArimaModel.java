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

package com.amazon.fable.arima;

import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import lombok.Getter;

import com.amazon.fable.StreamException;
import com.amazon.fable.config.InformationCriterion;
import com.amazon.fable.distribution.IDistribution;
import com.amazon.fable.distribution.Normal;
import com.amazon.fable.model.AbstractFittedModel;
import com.amazon.fable.model.Coefficient;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.IInnovationSampler;
import com.amazon.fable.model.ModelComponents;
import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ArimaOptions;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.statistics.Moments;
import com.amazon.fable.statistics.Polynomials;

/**
 * A fitted ARIMA model. The predicted state of the Kalman filter after the last
 * observation and the filled history are kept, so that forecasts, simulation
 * and streaming continue from there.
 */
public class ArimaModel extends AbstractFittedModel {

    @Getter
    private final ArimaOrder order;

    @Getter
    private final ArimaCoefficients coefficients;

    private final double[] standardErrors;

    private final double[] filled;

    private final double[] predictedState;

    private final double[][] predictedCovariance;

    private final ArimaSelection selection;

    /**
     * The fitter re-estimation goes through, null for the default one.
     */
    private final ArimaFitter origin;

    ArimaModel(ModelSpecification specification, TimeSeries series, ArimaOrder order, ArimaCoefficients coefficients,
            double[] standardErrors, double[] fitted, double[] residuals, double[] filled, double[] predictedState,
            double[][] predictedCovariance, ModelStatistics statistics, ArimaSelection selection,
            ArimaFitter origin) {
        super(specification, series, fitted, residuals, statistics);
        this.order = order;
        this.coefficients = coefficients;
        this.standardErrors = standardErrors;
        this.filled = filled;
        this.predictedState = predictedState;
        this.predictedCovariance = predictedCovariance;
        this.selection = selection;
        this.origin = origin;
    }

    /**
     * Builds a model by filtering a series with known coefficients.
     *
     * @param specification  the specification the model belongs to
     * @param series         the series
     * @param order          the orders
     * @param coefficients   the coefficients
     * @param standardErrors standard errors in the order of
     *                       {@link ArimaCoefficients#names}, NaN when unknown
     * @return the model
     * @throws IllegalArgumentException if the filter fails on the series
     */
    public static ArimaModel fromCoefficients(ModelSpecification specification, TimeSeries series, ArimaOrder order,
            ArimaCoefficients coefficients, double[] standardErrors) {
        checkNotNull(series, "series must not be null");
        ArimaFilterResult result = new ArimaFilter(order, coefficients).run(series.getValues());
        if (!result.isValid() || result.getObservations() == 0) {
            throw new IllegalArgumentException(order + " cannot be filtered over the series");
        }
        ModelStatistics statistics = statistics(result, order);
        return new ArimaModel(specification, series, order, coefficients, standardErrors, result.getFitted(),
                result.getResiduals(), result.getFilled(), result.getPredictedState(),
                result.getPredictedCovariance(), statistics, null, null);
    }

    static ModelStatistics statistics(ArimaFilterResult result, ArimaOrder order) {
        int n = result.getObservations();
        int k = order.coefficientCount() + 1;
        double logLik = result.logLikelihood();
        int degreesOfFreedom = n - order.coefficientCount();
        double sigma2 = result.getSumOfSquares() / (degreesOfFreedom > 0 ? degreesOfFreedom : n);
        return ModelStatistics.builder().sigma2(sigma2).logLik(logLik).aic(InformationCriterion.aic(logLik, k))
                .aicc(InformationCriterion.aicc(logLik, k, n)).bic(InformationCriterion.bic(logLik, k, n))
                .mse(Moments.meanSquare(result.getResiduals())).mae(Moments.meanAbsolute(result.getResiduals()))
                .nobs(n).parameters(k).build();
    }

    ArimaModel withSelection(ArimaSelection newSelection, ArimaFitter newOrigin) {
        return new ArimaModel(specification, series, order, coefficients, standardErrors, fitted, residuals, filled,
                predictedState, predictedCovariance, statistics, newSelection, newOrigin);
    }

    /**
     * @return the orders tried by the automatic search, or null for a model built
     *         from known coefficients
     */
    public ArimaSelection getSelection() {
        return selection;
    }

    public double[] getStandardErrors() {
        return Arrays.copyOf(standardErrors, standardErrors.length);
    }

    double[] getFilled() {
        return Arrays.copyOf(filled, filled.length);
    }

    double[] getPredictedState() {
        return Arrays.copyOf(predictedState, predictedState.length);
    }

    double[][] getPredictedCovariance() {
        return ArimaStateSpace.copy(predictedCovariance);
    }

    @Override
    public String getStructure() {
        return order.toString();
    }

    @Override
    public List<Coefficient> coefficients() {
        List<String> names = ArimaCoefficients.names(order);
        double[] estimates = coefficients.toVector(order);
        List<Coefficient> answer = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            double standardError = (i < standardErrors.length) ? standardErrors[i] : Double.NaN;
            answer.add(new Coefficient(names.get(i), estimates[i], standardError));
        }
        return answer;
    }

    private ArimaFilter filter() {
        return new ArimaFilter(order, coefficients);
    }

    @Override
    protected IDistribution[] forecastDistributions(int h) {
        double[] mean = pointForecasts(h);
        double[] psi = psiWeights(h);
        double sigma2 = statistics.getSigma2();
        IDistribution[] answer = new IDistribution[h];
        double sum = 0;
        for (int i = 0; i < h; i++) {
            sum += psi[i] * psi[i];
            answer[i] = Normal.fromVariance(mean[i], sigma2 * sum);
        }
        return answer;
    }

    private double[] pointForecasts(int h) {
        ArimaFilter filter = filter();
        ArimaStateSpace space = filter.getSpace();
        double[] delta = filter.getDelta();
        int n = filled.length;
        double[] path = Arrays.copyOf(filled, n + h);
        double[] a = Arrays.copyOf(predictedState, predictedState.length);
        double[] answer = new double[h];
        for (int i = 0; i < h; i++) {
            path[n + i] = filter.getConstant() + a[0] + integration(delta, path, n + i);
            answer[i] = path[n + i];
            a = space.transition(a);
        }
        return answer;
    }

    /**
     * @return psi_0 ... psi_(h-1) of the moving average representation of the
     *         undifferenced series
     */
    double[] psiWeights(int h) {
        double[] ar = Polynomials.multiply(Polynomials.autoregressive(coefficients.expandedAr(order.getPeriod())),
                Polynomials.autoregressive(filter().getDelta()));
        double[] ma = coefficients.expandedMa(order.getPeriod());
        double[] psi = new double[h];
        psi[0] = 1;
        for (int j = 1; j < h; j++) {
            double value = (j <= ma.length) ? ma[j - 1] : 0;
            for (int i = 1; i <= Math.min(j, ar.length - 1); i++) {
                value -= ar[i] * psi[j - i];
            }
            psi[j] = value;
        }
        return psi;
    }

    private static double integration(double[] delta, double[] path, int t) {
        double sum = 0;
        for (int k = 1; k <= delta.length; k++) {
            if (delta[k - 1] != 0) {
                sum += delta[k - 1] * path[t - k];
            }
        }
        return sum;
    }

    @Override
    protected double[] simulate(int h, Random random, IInnovationSampler sampler) {
        ArimaFilter filter = filter();
        ArimaStateSpace space = filter.getSpace();
        double[] loading = space.getLoading();
        double[] delta = filter.getDelta();
        int n = filled.length;
        double[] path = Arrays.copyOf(filled, n + h);
        double[] alpha = Arrays.copyOf(predictedState, predictedState.length);
        double e = sampler.next(random);
        for (int j = 0; j < alpha.length; j++) {
            alpha[j] += loading[j] * e;
        }
        for (int i = 0; i < h; i++) {
            path[n + i] = filter.getConstant() + alpha[0] + integration(delta, path, n + i);
            alpha = space.transition(alpha);
            e = sampler.next(random);
            for (int j = 0; j < alpha.length; j++) {
                alpha[j] += loading[j] * e;
            }
        }
        return Arrays.copyOfRange(path, n, n + h);
    }

    @Override
    protected IFittedModel reestimate(TimeSeries newSeries) {
        ModelSpecification pinned = specification.withFixed(ArimaOptions.P, order.getP())
                .withFixed(ArimaOptions.D, order.getD()).withFixed(ArimaOptions.Q, order.getQ())
                .withFixed(ArimaOptions.SEASONAL_P, order.getSeasonalP())
                .withFixed(ArimaOptions.SEASONAL_D, order.getSeasonalD())
                .withFixed(ArimaOptions.SEASONAL_Q, order.getSeasonalQ())
                .withFixed(ArimaOptions.PERIOD, order.getPeriod())
                .withFixed(ArimaOptions.CONSTANT, order.isConstant());
        return (origin == null ? new ArimaFitter() : origin).fit(newSeries, pinned);
    }

    @Override
    protected IFittedModel refilter(TimeSeries newSeries) {
        return fromCoefficients(specification, newSeries, order, coefficients, standardErrors).withSelection(null,
                origin);
    }

    @Override
    protected IFittedModel extend(TimeSeries newObservations) {
        ArimaFilterResult result = filter().resume(predictedState, predictedCovariance, filled,
                newObservations.getValues());
        if (!result.isValid()) {
            throw new StreamException(getStructure() + " cannot absorb the observations");
        }
        return new ArimaModel(specification, series.append(newObservations), order, coefficients, standardErrors,
                concat(fitted, result.getFitted()), concat(residuals, result.getResiduals()),
                concat(filled, result.getFilled()), result.getPredictedState(), result.getPredictedCovariance(),
                statistics, selection, origin);
    }

    @Override
    public ModelComponents components() {
        return new ModelComponents(series.getTimes()).add("fitted", fitted).add("remainder", residuals);
    }
}
