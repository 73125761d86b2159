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

import lombok.Getter;

import com.amazon.fable.model.ModelStatistics;

/**
 * The outcome of one order tried by the ARIMA search.
 */
@Getter
public class ArimaCandidateResult {

    private final ArimaOrder order;

    private final ModelStatistics statistics;

    private final String failure;

    private ArimaCandidateResult(ArimaOrder order, ModelStatistics statistics, String failure) {
        this.order = order;
        this.statistics = statistics;
        this.failure = failure;
    }

    static ArimaCandidateResult fitted(ArimaOrder order, ModelStatistics statistics) {
        return new ArimaCandidateResult(order, statistics, null);
    }

    static ArimaCandidateResult failed(ArimaOrder order, String failure) {
        return new ArimaCandidateResult(order, null, failure);
    }

    public boolean isFitted() {
        return failure == null;
    }

    public String getLabel() {
        return order.toString();
    }
}
