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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Getter;

import com.amazon.fable.statistics.Polynomials;

/**
 * The coefficients of a seasonal ARIMA model. The vector form lists the
 * non-seasonal AR, non-seasonal MA, seasonal AR and seasonal MA coefficients,
 * followed by the constant when the model has one. The constant is the mean of
 * the differenced series.
 */
@Getter
public class ArimaCoefficients {

    private final double[] ar;

    private final double[] ma;

    private final double[] seasonalAr;

    private final double[] seasonalMa;

    private final double constant;

    public ArimaCoefficients(double[] ar, double[] ma, double[] seasonalAr, double[] seasonalMa, double constant) {
        this.ar = Arrays.copyOf(ar, ar.length);
        this.ma = Arrays.copyOf(ma, ma.length);
        this.seasonalAr = Arrays.copyOf(seasonalAr, seasonalAr.length);
        this.seasonalMa = Arrays.copyOf(seasonalMa, seasonalMa.length);
        this.constant = constant;
    }

    public static ArimaCoefficients fromVector(ArimaOrder order, double[] x) {
        checkArgument(x.length == order.coefficientCount(), "incorrect number of coefficients");
        int index = 0;
        double[] ar = Arrays.copyOfRange(x, index, index += order.getP());
        double[] ma = Arrays.copyOfRange(x, index, index += order.getQ());
        double[] sar = Arrays.copyOfRange(x, index, index += order.getSeasonalP());
        double[] sma = Arrays.copyOfRange(x, index, index += order.getSeasonalQ());
        double constant = order.isConstant() ? x[index] : 0;
        return new ArimaCoefficients(ar, ma, sar, sma, constant);
    }

    public double[] toVector(ArimaOrder order) {
        double[] x = new double[order.coefficientCount()];
        int index = 0;
        for (double value : ar) {
            x[index++] = value;
        }
        for (double value : ma) {
            x[index++] = value;
        }
        for (double value : seasonalAr) {
            x[index++] = value;
        }
        for (double value : seasonalMa) {
            x[index++] = value;
        }
        if (order.isConstant()) {
            x[index] = constant;
        }
        return x;
    }

    public static List<String> names(ArimaOrder order) {
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= order.getP(); i++) {
            names.add("ar" + i);
        }
        for (int i = 1; i <= order.getQ(); i++) {
            names.add("ma" + i);
        }
        for (int i = 1; i <= order.getSeasonalP(); i++) {
            names.add("sar" + i);
        }
        for (int i = 1; i <= order.getSeasonalQ(); i++) {
            names.add("sma" + i);
        }
        if (order.isConstant()) {
            names.add("constant");
        }
        return names;
    }

    public double[] getAr() {
        return Arrays.copyOf(ar, ar.length);
    }

    public double[] getMa() {
        return Arrays.copyOf(ma, ma.length);
    }

    public double[] getSeasonalAr() {
        return Arrays.copyOf(seasonalAr, seasonalAr.length);
    }

    public double[] getSeasonalMa() {
        return Arrays.copyOf(seasonalMa, seasonalMa.length);
    }

    /**
     * @return true if both autoregressive factors are stationary and both moving
     *         average factors are invertible
     */
    public boolean isAdmissible() {
        return Polynomials.isStationary(ar) && Polynomials.isStationary(seasonalAr) && Polynomials.isInvertible(ma)
                && Polynomials.isInvertible(seasonalMa);
    }

    /**
     * @return the coefficients a_k of the expanded autoregressive polynomial
     *         1 - sum a_k B^k
     */
    public double[] expandedAr(int period) {
        return Polynomials.expandAutoregressive(ar, seasonalAr, period);
    }

    /**
     * @return the coefficients b_k of the expanded moving average polynomial
     *         1 + sum b_k B^k
     */
    public double[] expandedMa(int period) {
        return Polynomials.expandMovingAverage(ma, seasonalMa, period);
    }
}
