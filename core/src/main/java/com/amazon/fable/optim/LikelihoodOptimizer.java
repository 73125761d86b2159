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

package com.amazon.fable.optim;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;

/**
 * Minimizes negative log-likelihoods. Objectives return
 * {@link #PENALTY} (or any non-finite value) at inadmissible points; such
 * values are replaced by the penalty so the optimizers never see NaN.
 */
@Getter
public class LikelihoodOptimizer {

    public static final double PENALTY = 1e10;

    public static final int DEFAULT_MAX_EVALUATIONS = 5000;

    public static final double DEFAULT_INITIAL_TRUST_REGION_RADIUS = 0.1;

    public static final double DEFAULT_STOPPING_TRUST_REGION_RADIUS = 1e-6;

    public static final double DEFAULT_SIMPLEX_STEP = 0.1;

    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-8;

    public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-8;

    private final int maxEvaluations;

    public LikelihoodOptimizer() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public LikelihoodOptimizer(int maxEvaluations) {
        checkArgument(maxEvaluations > 0, "maxEvaluations must be positive");
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * Minimizes over the unit box [0, 1]^k with BOBYQA. One dimensional problems
     * use Brent's method and zero dimensional ones are evaluated once.
     *
     * @param objective the function to minimize
     * @param start     a starting point inside the box
     * @return the minimum found
     * @throws OptimizationException if the evaluation cap is reached or the
     *                               optimizer fails
     */
    public OptimizationResult minimizeInUnitBox(MultivariateFunction objective, double[] start) {
        checkNotNull(objective, "objective must not be null");
        checkNotNull(start, "start must not be null");
        MultivariateFunction guarded = guard(objective);
        int dimension = start.length;
        if (dimension == 0) {
            return new OptimizationResult(start, guarded.value(start), 1);
        }
        double[] clamped = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            clamped[i] = Math.min(1, Math.max(0, start[i]));
        }
        try {
            if (dimension == 1) {
                BrentOptimizer brent = new BrentOptimizer(1e-10, 1e-12);
                UnivariatePointValuePair pair = brent.optimize(new MaxEval(maxEvaluations),
                        new UnivariateObjectiveFunction(x -> guarded.value(new double[] { x })), GoalType.MINIMIZE,
                        new SearchInterval(0, 1, clamped[0]));
                return new OptimizationResult(new double[] { pair.getPoint() }, pair.getValue(),
                        brent.getEvaluations());
            }
            BOBYQAOptimizer bobyqa = new BOBYQAOptimizer(2 * dimension + 1, DEFAULT_INITIAL_TRUST_REGION_RADIUS,
                    DEFAULT_STOPPING_TRUST_REGION_RADIUS);
            double[] lower = new double[dimension];
            double[] upper = new double[dimension];
            Arrays.fill(upper, 1.0);
            PointValuePair pair = bobyqa.optimize(new MaxEval(maxEvaluations), new ObjectiveFunction(guarded),
                    GoalType.MINIMIZE, new InitialGuess(clamped), new SimpleBounds(lower, upper));
            return new OptimizationResult(pair.getPoint(), pair.getValue(), bobyqa.getEvaluations());
        } catch (TooManyEvaluationsException e) {
            throw new OptimizationException("no convergence within " + maxEvaluations + " evaluations", e);
        } catch (MathIllegalStateException e) {
            throw new OptimizationException("optimizer failed: " + e.getMessage(), e);
        }
    }

    /**
     * Minimizes without bounds using the Nelder-Mead simplex.
     *
     * @param objective the function to minimize
     * @param start     the starting point
     * @param steps     the initial simplex step along each coordinate
     * @return the minimum found
     * @throws OptimizationException if the evaluation cap is reached
     */
    public OptimizationResult minimize(MultivariateFunction objective, double[] start, double[] steps) {
        checkNotNull(objective, "objective must not be null");
        checkNotNull(start, "start must not be null");
        checkArgument(steps.length == start.length, "steps and start must have the same length");
        MultivariateFunction guarded = guard(objective);
        if (start.length == 0) {
            return new OptimizationResult(start, guarded.value(start), 1);
        }
        try {
            SimplexOptimizer simplex = new SimplexOptimizer(DEFAULT_RELATIVE_TOLERANCE, DEFAULT_ABSOLUTE_TOLERANCE);
            PointValuePair pair = simplex.optimize(new MaxEval(maxEvaluations), new MaxIter(maxEvaluations),
                    new ObjectiveFunction(guarded), GoalType.MINIMIZE, new InitialGuess(start),
                    new NelderMeadSimplex(steps));
            return new OptimizationResult(pair.getPoint(), pair.getValue(), simplex.getEvaluations());
        } catch (TooManyEvaluationsException | TooManyIterationsException e) {
            throw new OptimizationException("no convergence within " + maxEvaluations + " evaluations", e);
        }
    }

    static MultivariateFunction guard(MultivariateFunction objective) {
        return point -> {
            double value = objective.value(point);
            return (Double.isNaN(value) || Double.isInfinite(value) || value > PENALTY) ? PENALTY : value;
        };
    }
}
