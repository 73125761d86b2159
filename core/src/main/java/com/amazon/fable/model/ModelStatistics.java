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

package com.amazon.fable.model;

import lombok.Builder;
import lombok.Getter;

import com.amazon.fable.config.InformationCriterion;

/**
 * Summary statistics of a fitted model. Values that are not defined for a
 * family are NaN.
 */
@Getter
@Builder(toBuilder = true)
public class ModelStatistics {

    @Builder.Default
    private final double sigma2 = Double.NaN;

    @Builder.Default
    private final double logLik = Double.NaN;

    @Builder.Default
    private final double aic = Double.NaN;

    @Builder.Default
    private final double aicc = Double.NaN;

    @Builder.Default
    private final double bic = Double.NaN;

    @Builder.Default
    private final double mse = Double.NaN;

    @Builder.Default
    private final double mae = Double.NaN;

    /**
     * The number of observations used in estimation.
     */
    private final int nobs;

    /**
     * The number of estimated parameters, including the innovation variance.
     */
    private final int parameters;

    public double get(InformationCriterion criterion) {
        switch (criterion) {
        case AIC:
            return aic;
        case BIC:
            return bic;
        default:
            return aicc;
        }
    }
}
