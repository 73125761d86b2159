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

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The orders of a seasonal ARIMA model and whether it carries a constant.
 */
@Getter
@EqualsAndHashCode
public class ArimaOrder {

    private final int p;

    private final int d;

    private final int q;

    private final int seasonalP;

    private final int seasonalD;

    private final int seasonalQ;

    private final int period;

    private final boolean constant;

    public ArimaOrder(int p, int d, int q, int seasonalP, int seasonalD, int seasonalQ, int period,
            boolean constant) {
        checkArgument(p >= 0 && d >= 0 && q >= 0, "orders must be non-negative");
        checkArgument(seasonalP >= 0 && seasonalD >= 0 && seasonalQ >= 0, "seasonal orders must be non-negative");
        checkArgument(period >= 1, "period must be at least 1");
        checkArgument(period > 1 || seasonalP + seasonalD + seasonalQ == 0, "seasonal orders need a period above 1");
        this.p = p;
        this.d = d;
        this.q = q;
        this.seasonalP = seasonalP;
        this.seasonalD = seasonalD;
        this.seasonalQ = seasonalQ;
        this.period = period;
        this.constant = constant;
    }

    public boolean isSeasonal() {
        return seasonalP + seasonalD + seasonalQ > 0;
    }

    /**
     * @return the number of observations lost to differencing
     */
    public int differencingLoss() {
        return d + period * seasonalD;
    }

    public int coefficientCount() {
        return p + q + seasonalP + seasonalQ + (constant ? 1 : 0);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("ARIMA(").append(p).append(',').append(d).append(',').append(q)
                .append(')');
        if (isSeasonal()) {
            builder.append('(').append(seasonalP).append(',').append(seasonalD).append(',').append(seasonalQ)
                    .append(")[").append(period).append(']');
        }
        if (constant) {
            builder.append(d + seasonalD == 0 ? " w/ mean" : " w/ drift");
        }
        return builder.toString();
    }
}
