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

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.fable.CandidateFailure;
import com.amazon.fable.FitFailureException;
import com.amazon.fable.config.ErrorType;
import com.amazon.fable.config.InformationCriterion;
import com.amazon.fable.config.SeasonType;
import com.amazon.fable.config.TrendType;
import com.amazon.fable.model.IModelFitter;
import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.optim.LikelihoodOptimizer;
import com.amazon.fable.optim.OptimizationException;
import com.amazon.fable.optim.OptimizationResult;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.EtsOptions;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelOption;
import com.amazon.fable.spec.ModelSpecification;

/**
 * Automatic exponential smoothing. Every admissible structure allowed by the
 * specification is estimated by maximum likelihood and the one minimizing the
 * information criterion is kept.
 */
@Slf4j
public class EtsFitter implements IModelFitter {

    private final LikelihoodOptimizer optimizer;

    public EtsFitter() {
        this(new LikelihoodOptimizer());
    }

    public EtsFitter(LikelihoodOptimizer optimizer) {
        this.optimizer = checkNotNull(optimizer, "optimizer must not be null");
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.ETS;
    }

    @Override
    public EtsModel fit(TimeSeries series, ModelSpecification specification) {
        checkNotNull(series, "series must not be null");
        checkNotNull(specification, "specification must not be null");
        checkArgument(specification.getFamily() == ModelFamily.ETS, "not an ETS specification");
        if (series.countObserved() == 0) {
            throw new FitFailureException("series has no observations");
        }
        int period = specification.get(EtsOptions.PERIOD).orElse(series.getSeasonalPeriod());
        InformationCriterion criterion = specification.get(EtsOptions.IC).getValue();

        List<EtsCandidateResult> results = new ArrayList<>();
        List<CandidateFailure> failures = new ArrayList<>();
        EtsModel best = null;
        double bestValue = Double.NaN;
        for (EtsStructure structure : candidates(specification)) {
            String reason = inadmissibility(structure, series, period, specification);
            if (reason != null) {
                log.debug("{} excluded: {}", structure, reason);
                results.add(EtsCandidateResult.failed(structure, reason));
                failures.add(new CandidateFailure(structure.toString(), reason));
                continue;
            }
            try {
                EtsModel model = estimate(series, specification, structure, period);
                ModelStatistics statistics = model.statistics();
                double value = statistics.get(criterion);
                results.add(EtsCandidateResult.fitted(structure, statistics));
                if (best == null
                        || InformationCriterion.prefers(value, statistics.getParameters(), bestValue,
                                best.statistics().getParameters())) {
                    best = model;
                    bestValue = value;
                }
            } catch (OptimizationException | IllegalArgumentException | ArithmeticException e) {
                log.debug("{} failed: {}", structure, e.getMessage());
                results.add(EtsCandidateResult.failed(structure, e.getMessage()));
                failures.add(new CandidateFailure(structure.toString(), String.valueOf(e.getMessage())));
            }
        }
        if (best == null) {
            throw new FitFailureException("no ETS candidate could be fitted", failures);
        }
        return best.withSelection(new EtsSelection(results, best.getEtsStructure(), criterion), this);
    }

    /**
     * @return the structures allowed by the specification, in canonical order
     */
    static List<EtsStructure> candidates(ModelSpecification specification) {
        ModelOption<ErrorType> error = specification.get(EtsOptions.ERROR);
        ModelOption<TrendType> trend = specification.get(EtsOptions.TREND);
        ModelOption<SeasonType> season = specification.get(EtsOptions.SEASON);
        List<EtsStructure> answer = new ArrayList<>();
        for (EtsStructure structure : EtsStructure.CANONICAL_ORDER) {
            if ((error.isAutomatic() || error.getValue() == structure.getError())
                    && (trend.isAutomatic() || trend.getValue() == structure.getTrend())
                    && (season.isAutomatic() || season.getValue() == structure.getSeason())) {
                answer.add(structure);
            }
        }
        return answer;
    }

    /**
     * @return the reason the structure cannot be fitted to the series, or null
     *         when it is admissible
     */
    static String inadmissibility(EtsStructure structure, TimeSeries series, int period,
            ModelSpecification specification) {
        int observed = series.countObserved();
        if (structure.needsPositiveData() && !series.isStrictlyPositive()) {
            return "multiplicative components need strictly positive data";
        }
        if (structure.hasSeason() && period <= 1) {
            return "seasonal components need a seasonal period above 1";
        }
        if (structure.hasSeason() && (observed < 2 * period || series.length() < 2 * period)) {
            return "seasonal components need two full seasons of data";
        }
        boolean combinationFixed = specification.get(EtsOptions.ERROR).isFixed()
                && specification.get(EtsOptions.SEASON).isFixed();
        if (specification.get(EtsOptions.RESTRICT).getValue() && !combinationFixed
                && structure.getError() == ErrorType.ADDITIVE && structure.isMultiplicativeSeason()) {
            return "additive errors with a multiplicative season are restricted";
        }
        int k = EtsParameterSpace.freeParameterCount(structure, period, specification) + 1;
        if (observed - k - 1 <= 0) {
            return "too few observations for " + k + " parameters";
        }
        return null;
    }

    EtsModel estimate(TimeSeries series, ModelSpecification specification, EtsStructure structure, int period) {
        double[] values = series.getValues();
        EtsInitializer initializer = new EtsInitializer(structure, values, period);
        EtsParameterSpace space = new EtsParameterSpace(structure, period, specification, initializer);
        OptimizationResult result = optimizer.minimizeInUnitBox(u -> {
            EtsFilterResult filtered = new EtsFilter(structure, space.decode(u), period).run(values);
            return -filtered.logLikelihood(structure.isMultiplicativeError());
        }, space.start());
        if (!(result.getValue() < LikelihoodOptimizer.PENALTY)) {
            throw new OptimizationException("no admissible parameters found");
        }
        EtsParameters parameters = space.decode(result.getPoint());
        return EtsModel.fromParameters(specification, series, structure, period, parameters, space.dimension());
    }
}
