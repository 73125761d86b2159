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

package com.amazon.fable.tables.accuracy;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;
import static com.amazon.fable.CommonUtils.isObserved;

import com.amazon.fable.statistics.Moments;

/**
 * Computes {@link AccuracyMeasures} from actual values and point forecasts.
 * Pairs with a missing actual or forecast are ignored.
 */
public class AccuracyCalculator {

    private AccuracyCalculator() {
    }

    /**
     * @param actual    the observed values
     * @param predicted the point forecasts, aligned with {@code actual}
     * @param training  the training series, used to scale MASE and RMSSE
     * @param period    the seasonal lag of the scaling errors, 1 when
     *                  non-seasonal
     * @return the measures
     */
    public static AccuracyMeasures compute(double[] actual, double[] predicted, double[] training, int period) {
        checkNotNull(actual, "actual must not be null");
        checkNotNull(predicted, "predicted must not be null");
        checkNotNull(training, "training must not be null");
        checkArgument(actual.length == predicted.length, "actual and predicted must have the same length");
        checkArgument(period >= 1, "period must be at least 1");

        double[] errors = new double[actual.length];
        double sum = 0;
        double sumSquares = 0;
        double sumAbsolute = 0;
        double sumPercent = 0;
        double sumAbsolutePercent = 0;
        boolean zeroActual = false;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (!isObserved(actual[i]) || !isObserved(predicted[i])) {
                errors[i] = Double.NaN;
                continue;
            }
            double e = actual[i] - predicted[i];
            errors[i] = e;
            sum += e;
            sumSquares += e * e;
            sumAbsolute += Math.abs(e);
            if (actual[i] == 0) {
                zeroActual = true;
            } else {
                double percent = 100 * e / actual[i];
                sumPercent += percent;
                sumAbsolutePercent += Math.abs(percent);
            }
            ++count;
        }
        if (count == 0) {
            return new AccuracyMeasures(Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                    Double.NaN, Double.NaN);
        }
        double mae = sumAbsolute / count;
        double mse = sumSquares / count;
        double[] scales = naiveScales(training, period);
        double mpe = zeroActual ? Double.NaN : sumPercent / count;
        double mape = zeroActual ? Double.NaN : sumAbsolutePercent / count;
        return new AccuracyMeasures(sum / count, Math.sqrt(mse), mae, mpe, mape, mae / scales[0],
                Math.sqrt(mse / scales[1]), Moments.autocorrelation(errors, 1));
    }

    /**
     * @return the mean absolute and the mean squared seasonal naive error of the
     *         training series, NaN when there are none
     */
    static double[] naiveScales(double[] training, int period) {
        double sumAbsolute = 0;
        double sumSquares = 0;
        int count = 0;
        for (int t = period; t < training.length; t++) {
            if (isObserved(training[t]) && isObserved(training[t - period])) {
                double e = training[t] - training[t - period];
                sumAbsolute += Math.abs(e);
                sumSquares += e * e;
                ++count;
            }
        }
        if (count == 0) {
            return new double[] { Double.NaN, Double.NaN };
        }
        return new double[] { sumAbsolute / count, sumSquares / count };
    }
}
