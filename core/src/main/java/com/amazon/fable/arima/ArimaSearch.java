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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.exception.MathIllegalStateException;

import com.amazon.fable.CandidateFailure;
import com.amazon.fable.config.InformationCriterion;
import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.optim.OptimizationException;
import com.amazon.fable.spec.ArimaOptions;
import com.amazon.fable.spec.ModelOption;
import com.amazon.fable.spec.ModelSpecification;

/**
 * The search over (p, q, P, Q, constant) for fixed differencing orders. The
 * stepwise search starts from a handful of seed orders and moves to improving
 * neighbours until none improves or the model budget is spent; the exhaustive
 * search tries every feasible order.
 */
@Slf4j
class ArimaSearch {

    /**
     * Fits one order; failures are reported as exceptions.
     */
    @FunctionalInterface
    interface Estimation {
        ArimaModel fit(ArimaOrder order);
    }

    /**
     * Neighbour moves as {dp, dq, dP, dQ}, scanned in this order before the
     * constant is toggled.
     */
    static final int[][] NEIGHBOUR_MOVES = { { 0, 0, -1, 0 }, { 0, 0, 0, -1 }, { 0, 0, 1, 0 }, { 0, 0, 0, 1 },
            { 0, 0, -1, -1 }, { 0, 0, -1, 1 }, { 0, 0, 1, -1 }, { 0, 0, 1, 1 }, { -1, 0, 0, 0 }, { 0, -1, 0, 0 },
            { 1, 0, 0, 0 }, { 0, 1, 0, 0 }, { -1, -1, 0, 0 }, { -1, 1, 0, 0 }, { 1, -1, 0, 0 }, { 1, 1, 0, 0 } };

    private final int d;

    private final int seasonalD;

    private final int period;

    private final ModelOption<Integer> p;

    private final ModelOption<Integer> q;

    private final ModelOption<Integer> seasonalP;

    private final ModelOption<Integer> seasonalQ;

    private final ModelOption<Boolean> constant;

    private final int maxP;

    private final int maxQ;

    private final int maxSeasonalP;

    private final int maxSeasonalQ;

    private final int maxOrder;

    private final int maxModels;

    private final InformationCriterion criterion;

    private final Estimation estimation;

    @Getter
    private final List<ArimaCandidateResult> results = new ArrayList<>();

    @Getter
    private final List<CandidateFailure> failures = new ArrayList<>();

    private final Set<ArimaOrder> tried = new HashSet<>();

    private ArimaModel best;

    private double bestValue = Double.NaN;

    ArimaSearch(ModelSpecification specification, int d, int seasonalD, int period, Estimation estimation) {
        this.d = d;
        this.seasonalD = seasonalD;
        this.period = period;
        this.p = specification.get(ArimaOptions.P);
        this.q = specification.get(ArimaOptions.Q);
        this.seasonalP = specification.get(ArimaOptions.SEASONAL_P);
        this.seasonalQ = specification.get(ArimaOptions.SEASONAL_Q);
        this.constant = specification.get(ArimaOptions.CONSTANT);
        this.maxP = specification.get(ArimaOptions.MAX_P).getValue();
        this.maxQ = specification.get(ArimaOptions.MAX_Q).getValue();
        this.maxSeasonalP = specification.get(ArimaOptions.MAX_SEASONAL_P).getValue();
        this.maxSeasonalQ = specification.get(ArimaOptions.MAX_SEASONAL_Q).getValue();
        this.maxOrder = specification.get(ArimaOptions.MAX_ORDER).getValue();
        this.maxModels = specification.get(ArimaOptions.MAX_MODELS).getValue();
        this.criterion = specification.get(ArimaOptions.IC).getValue();
        this.estimation = checkNotNull(estimation, "estimation must not be null");
    }

    /**
     * @return the best model found, or null when no order could be fitted
     */
    ArimaModel stepwise(boolean greedy) {
        boolean defaultConstant = constant.isFixed() ? constant.getValue() : constantAllowed();
        int[][] seeds = { { 2, 2, 1, 1 }, { 0, 0, 0, 0 }, { 1, 0, 1, 0 }, { 0, 1, 0, 1 } };
        for (int[] seed : seeds) {
            tryOrder(seed(seed, defaultConstant));
        }
        if (constant.isAutomatic() && constantAllowed()) {
            tryOrder(seed(seeds[1], false));
        }
        if (best == null) {
            return null;
        }

        boolean improved = true;
        while (improved && !budgetSpent()) {
            improved = false;
            ArimaOrder incumbent = best.getOrder();
            ArimaModel scanBest = null;
            double scanValue = Double.NaN;
            for (ArimaOrder neighbour : neighbours(incumbent)) {
                if (budgetSpent()) {
                    break;
                }
                ArimaModel model = evaluate(neighbour);
                if (model == null) {
                    continue;
                }
                double value = model.statistics().get(criterion);
                if (greedy) {
                    if (improves(model, value, best, bestValue)) {
                        accept(model, value);
                        improved = true;
                        break;
                    }
                } else if (improves(model, value, best, bestValue)
                        && (scanBest == null || improves(model, value, scanBest, scanValue))) {
                    scanBest = model;
                    scanValue = value;
                }
            }
            if (!greedy && scanBest != null) {
                accept(scanBest, scanValue);
                improved = true;
            }
        }
        return best;
    }

    /**
     * @return the best model over every feasible order, or null when none could
     *         be fitted
     */
    ArimaModel exhaustive() {
        boolean[] constants = constant.isFixed() ? new boolean[] { constant.getValue() }
                : constantAllowed() ? new boolean[] { true, false } : new boolean[] { false };
        for (int ip = lower(p); ip <= upper(p, maxP); ip++) {
            for (int iq = lower(q); iq <= upper(q, maxQ); iq++) {
                for (int iP = lower(seasonalP); iP <= upper(seasonalP, maxSeasonalP); iP++) {
                    for (int iQ = lower(seasonalQ); iQ <= upper(seasonalQ, maxSeasonalQ); iQ++) {
                        for (boolean c : constants) {
                            if (budgetSpent()) {
                                return best;
                            }
                            if (feasible(ip, iq, iP, iQ, c)) {
                                tryOrder(order(ip, iq, iP, iQ, c));
                            }
                        }
                    }
                }
            }
        }
        return best;
    }

    private int lower(ModelOption<Integer> option) {
        return option.isFixed() ? option.getValue() : 0;
    }

    private int upper(ModelOption<Integer> option, int max) {
        return option.isFixed() ? option.getValue() : max;
    }

    boolean constantAllowed() {
        return d + seasonalD < 2;
    }

    private boolean budgetSpent() {
        return tried.size() >= maxModels;
    }

    private ArimaOrder seed(int[] seed, boolean withConstant) {
        int ip = p.isFixed() ? p.getValue() : Math.min(seed[0], maxP);
        int iq = q.isFixed() ? q.getValue() : Math.min(seed[1], maxQ);
        int iP = seasonalP.isFixed() ? seasonalP.getValue() : Math.min(seed[2], maxSeasonalP);
        int iQ = seasonalQ.isFixed() ? seasonalQ.getValue() : Math.min(seed[3], maxSeasonalQ);
        if (period == 1) {
            iP = 0;
            iQ = 0;
        }
        return feasible(ip, iq, iP, iQ, withConstant) ? order(ip, iq, iP, iQ, withConstant) : null;
    }

    List<ArimaOrder> neighbours(ArimaOrder incumbent) {
        List<ArimaOrder> answer = new ArrayList<>();
        for (int[] move : NEIGHBOUR_MOVES) {
            int ip = incumbent.getP() + move[0];
            int iq = incumbent.getQ() + move[1];
            int iP = incumbent.getSeasonalP() + move[2];
            int iQ = incumbent.getSeasonalQ() + move[3];
            if (feasible(ip, iq, iP, iQ, incumbent.isConstant())) {
                answer.add(order(ip, iq, iP, iQ, incumbent.isConstant()));
            }
        }
        boolean toggled = !incumbent.isConstant();
        if (feasible(incumbent.getP(), incumbent.getQ(), incumbent.getSeasonalP(), incumbent.getSeasonalQ(),
                toggled)) {
            answer.add(order(incumbent.getP(), incumbent.getQ(), incumbent.getSeasonalP(), incumbent.getSeasonalQ(),
                    toggled));
        }
        return answer;
    }

    boolean feasible(int ip, int iq, int iP, int iQ, boolean withConstant) {
        if (ip < 0 || iq < 0 || iP < 0 || iQ < 0) {
            return false;
        }
        if (!within(p, ip, maxP) || !within(q, iq, maxQ) || !within(seasonalP, iP, maxSeasonalP)
                || !within(seasonalQ, iQ, maxSeasonalQ)) {
            return false;
        }
        boolean allFixed = p.isFixed() && q.isFixed() && seasonalP.isFixed() && seasonalQ.isFixed();
        if (!allFixed && ip + iq + iP + iQ > maxOrder) {
            return false;
        }
        if (period == 1 && iP + iQ > 0) {
            return false;
        }
        if (withConstant && !constantAllowed()) {
            return false;
        }
        return constant.isAutomatic() || constant.getValue() == withConstant;
    }

    private static boolean within(ModelOption<Integer> option, int value, int max) {
        return option.isFixed() ? option.getValue() == value : value <= max;
    }

    private ArimaOrder order(int ip, int iq, int iP, int iQ, boolean withConstant) {
        return new ArimaOrder(ip, d, iq, iP, seasonalD, iQ, period, withConstant);
    }

    private void tryOrder(ArimaOrder order) {
        if (order == null || budgetSpent()) {
            return;
        }
        ArimaModel model = evaluate(order);
        if (model != null) {
            double value = model.statistics().get(criterion);
            if (best == null || improves(model, value, best, bestValue)) {
                accept(model, value);
            }
        }
    }

    /**
     * Fits an order not tried before.
     *
     * @return the model, or null when the order was already tried or failed
     */
    private ArimaModel evaluate(ArimaOrder order) {
        if (!tried.add(order)) {
            return null;
        }
        try {
            ArimaModel model = estimation.fit(order);
            ModelStatistics statistics = model.statistics();
            results.add(ArimaCandidateResult.fitted(order, statistics));
            log.debug("{}: {} = {}", order, criterion, statistics.get(criterion));
            return model;
        } catch (OptimizationException | IllegalArgumentException | ArithmeticException
                | MathIllegalStateException e) {
            log.debug("{} failed: {}", order, e.getMessage());
            String message = String.valueOf(e.getMessage());
            results.add(ArimaCandidateResult.failed(order, message));
            failures.add(new CandidateFailure(order.toString(), message));
            return null;
        }
    }

    private static boolean improves(ArimaModel model, double value, ArimaModel incumbent, double incumbentValue) {
        if (Double.isNaN(value)) {
            return false;
        }
        return Double.isNaN(incumbentValue) || InformationCriterion.prefers(value, model.statistics().getParameters(),
                incumbentValue, incumbent.statistics().getParameters());
    }

    private void accept(ArimaModel model, double value) {
        best = model;
        bestValue = value;
    }

    int getAttempts() {
        return tried.size();
    }
}
