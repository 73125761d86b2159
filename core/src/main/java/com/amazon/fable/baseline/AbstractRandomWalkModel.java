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

import static com.amazon.fable.CommonUtils.isObserved;

import java.util.Random;

import lombok.Getter;

import com.amazon.fable.distribution.IDistribution;
import com.amazon.fable.distribution.Normal;
import com.amazon.fable.model.AbstractFittedModel;
import com.amazon.fable.model.IInnovationSampler;
import com.amazon.fable.model.ModelComponents;
import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelSpecification;

/**
 * A random walk at some lag: each value is forecast by the most recent
 * observation a whole number of lags earlier, plus an optional drift per step.
 */
public abstract class AbstractRandomWalkModel extends AbstractFittedModel {

    @Getter
    protected final int lag;

    /**
     * Drift per time step; zero without drift.
     */
    @Getter
    protected final double drift;

    /**
     * The number of lagged differences behind the drift estimate.
     */
    protected final int differences;

    protected AbstractRandomWalkModel(ModelSpecification specification, TimeSeries series, int lag, double drift,
            int differences, double[] fitted, double[] residuals, ModelStatistics statistics) {
        super(specification, series, fitted, residuals, statistics);
        this.lag = lag;
        this.drift = drift;
        this.differences = differences;
    }

    public int getDifferences() {
        return differences;
    }

    protected abstract boolean hasDrift();

    /**
     * @return the mean drift per step over the lagged differences, and their
     *         count
     */
    static double[] estimateDrift(double[] values, int lag) {
        double sum = 0;
        int count = 0;
        for (int t = lag; t < values.length; t++) {
            if (isObserved(values[t]) && isObserved(values[t - lag])) {
                sum += values[t] - values[t - lag];
                ++count;
            }
        }
        return new double[] { count == 0 ? 0 : sum / count / lag, count };
    }

    /**
     * @return the one-step-ahead fitted values for the given drift, NaN where no
     *         earlier observation at the lag exists
     */
    static double[] fittedValues(double[] values, int lag, double drift) {
        double[] fitted = new double[values.length];
        for (int t = 0; t < values.length; t++) {
            fitted[t] = Double.NaN;
            for (int s = t - lag; s >= 0; s -= lag) {
                if (isObserved(values[s])) {
                    fitted[t] = values[s] + drift * (t - s);
                    break;
                }
            }
        }
        return fitted;
    }

    static double[] difference(double[] values, double[] fitted) {
        double[] residuals = new double[values.length];
        for (int t = 0; t < values.length; t++) {
            residuals[t] = values[t] - fitted[t];
        }
        return residuals;
    }

    /**
     * @return the index of the most recent observation at or before {@code t}
     *         that is a whole number of lags before {@code t}, or -1
     */
    private int anchor(double[] values, int t) {
        int s = t - lag;
        while (s >= values.length) {
            s -= lag;
        }
        for (; s >= 0; s -= lag) {
            if (isObserved(values[s])) {
                return s;
            }
        }
        return -1;
    }

    @Override
    protected IDistribution[] forecastDistributions(int h) {
        double[] values = series.getValues();
        int n = values.length;
        double sigma2 = statistics.getSigma2();
        IDistribution[] answer = new IDistribution[h];
        for (int i = 0; i < h; i++) {
            int t = n + i;
            int s = anchor(values, t);
            if (s < 0) {
                throw new IllegalStateException("no observation to forecast " + getStructure() + " from");
            }
            int steps = (t - s) / lag;
            double variance = sigma2 * steps;
            if (hasDrift() && differences > 0) {
                variance *= 1 + (double) steps / differences;
            }
            answer[i] = Normal.fromVariance(values[s] + drift * (t - s), variance);
        }
        return answer;
    }

    @Override
    protected double[] simulate(int h, Random random, IInnovationSampler sampler) {
        double[] values = series.getValues();
        int n = values.length;
        double[] extended = new double[n + h];
        System.arraycopy(values, 0, extended, 0, n);
        for (int i = 0; i < h; i++) {
            int t = n + i;
            double previous = Double.NaN;
            for (int s = t - lag; s >= 0; s -= lag) {
                if (isObserved(extended[s])) {
                    previous = extended[s] + drift * (t - s);
                    break;
                }
            }
            extended[t] = previous + sampler.next(random);
        }
        double[] path = new double[h];
        System.arraycopy(extended, n, path, 0, h);
        return path;
    }

    @Override
    public ModelComponents components() {
        return new ModelComponents(series.getTimes()).add("fitted", fitted).add("remainder", residuals);
    }
}
