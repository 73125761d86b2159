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

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;
import static com.amazon.fable.CommonUtils.fillLinear;

import lombok.extern.slf4j.Slf4j;

import com.amazon.fable.FitFailureException;
import com.amazon.fable.config.InformationCriterion;
import com.amazon.fable.model.IModelFitter;
import com.amazon.fable.optim.LikelihoodOptimizer;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ArimaOptions;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelOption;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.statistics.ClassicalDecomposition;
import com.amazon.fable.statistics.Differencing;
import com.amazon.fable.statistics.KpssTest;

/**
 * Automatic ARIMA. The differencing orders are chosen first, by seasonal
 * strength and the KPSS test, and the remaining orders by a stepwise or
 * exhaustive search minimizing the information criterion.
 */
@Slf4j
public class ArimaFitter implements IModelFitter {

    /**
     * Seasonal strength above which one seasonal difference is taken.
     */
    public static final double SEASONAL_STRENGTH_THRESHOLD = 0.64;

    public static final int MAX_DIFFERENCES = 2;

    /**
     * Differenced observations needed beyond the coefficients.
     */
    static final int MIN_DIFFERENCED_OBSERVATIONS = 3;

    private final ArimaEstimator estimator;

    public ArimaFitter() {
        this(new LikelihoodOptimizer());
    }

    public ArimaFitter(LikelihoodOptimizer optimizer) {
        this.estimator = new ArimaEstimator(optimizer);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.ARIMA;
    }

    @Override
    public ArimaModel fit(TimeSeries series, ModelSpecification specification) {
        checkNotNull(series, "series must not be null");
        checkNotNull(specification, "specification must not be null");
        checkArgument(specification.getFamily() == ModelFamily.ARIMA, "not an ARIMA specification");
        int observed = series.countObserved();
        if (observed == 0) {
            throw new FitFailureException("series has no observations");
        }
        int period = specification.get(ArimaOptions.PERIOD).orElse(series.getSeasonalPeriod());
        if (period == 1 && (fixedPositive(specification.get(ArimaOptions.SEASONAL_P))
                || fixedPositive(specification.get(ArimaOptions.SEASONAL_D))
                || fixedPositive(specification.get(ArimaOptions.SEASONAL_Q)))) {
            throw new FitFailureException("seasonal orders need a seasonal period above 1");
        }

        double[] values = series.getValues();
        double[] filled = fillLinear(values);
        int seasonalD = specification.get(ArimaOptions.SEASONAL_D).isFixed()
                ? specification.get(ArimaOptions.SEASONAL_D).getValue()
                : seasonalDifferences(filled, period);
        int d = specification.get(ArimaOptions.D).isFixed() ? specification.get(ArimaOptions.D).getValue()
                : KpssTest.differencingOrder(Differencing.difference(filled, 0, seasonalD, period),
                        specification.get(ArimaOptions.UNITROOT_ALPHA).getValue(), MAX_DIFFERENCES);
        log.debug("differencing orders d = {}, D = {} with period {}", d, seasonalD, period);

        ModelOption<Boolean> constant = specification.get(ArimaOptions.CONSTANT);
        if (constant.isFixed() && constant.getValue() && d + seasonalD >= 2) {
            throw new FitFailureException("a constant is not allowed with d + D = " + (d + seasonalD));
        }
        if (observed - d - period * seasonalD < MIN_DIFFERENCED_OBSERVATIONS) {
            throw new FitFailureException("too few observations after differencing");
        }

        ArimaSearch search = new ArimaSearch(specification, d, seasonalD, period,
                order -> estimate(series, specification, order));
        ArimaModel best = specification.get(ArimaOptions.STEPWISE).getValue()
                ? search.stepwise(specification.get(ArimaOptions.GREEDY).getValue())
                : search.exhaustive();
        if (best == null) {
            throw new FitFailureException("no ARIMA candidate could be fitted", search.getFailures());
        }
        InformationCriterion criterion = specification.get(ArimaOptions.IC).getValue();
        log.debug("selected {} after {} candidates", best.getOrder(), search.getAttempts());
        return best.withSelection(new ArimaSelection(search.getResults(), best.getOrder(), criterion), this);
    }

    static int seasonalDifferences(double[] filled, int period) {
        if (period <= 1) {
            return 0;
        }
        return ClassicalDecomposition.seasonalStrength(filled, period) > SEASONAL_STRENGTH_THRESHOLD ? 1 : 0;
    }

    private static boolean fixedPositive(ModelOption<Integer> option) {
        return option.isFixed() && option.getValue() > 0;
    }

    ArimaModel estimate(TimeSeries series, ModelSpecification specification, ArimaOrder order) {
        int usable = series.countObserved() - order.differencingLoss();
        int k = order.coefficientCount() + 1;
        checkArgument(usable - k - 1 > 0, "too few observations for " + k + " parameters");
        ArimaEstimator.Estimate estimate = estimator.estimate(series.getValues(), order);
        ArimaModel model = ArimaModel.fromCoefficients(specification, series, order, estimate.getCoefficients(),
                estimate.getStandardErrors());
        // missing values inside the differencing window shrink the likelihood's sample
        checkArgument(model.statistics().getNobs() - k - 1 > 0, "too few observations for " + k + " parameters");
        return model;
    }
}
