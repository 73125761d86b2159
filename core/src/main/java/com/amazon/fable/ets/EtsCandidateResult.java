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

import lombok.Getter;

import com.amazon.fable.model.ModelStatistics;

/**
 * The outcome of one candidate structure in an automatic ETS search: its
 * criteria when it was fitted, or the reason it was not.
 */
@Getter
public class EtsCandidateResult {

    private final EtsStructure structure;

    private final ModelStatistics statistics;

    private final String failure;

    private EtsCandidateResult(EtsStructure structure, ModelStatistics statistics, String failure) {
        this.structure = structure;
        this.statistics = statistics;
        this.failure = failure;
    }

    static EtsCandidateResult fitted(EtsStructure structure, ModelStatistics statistics) {
        return new EtsCandidateResult(structure, statistics, null);
    }

    static EtsCandidateResult failed(EtsStructure structure, String failure) {
        return new EtsCandidateResult(structure, null, failure);
    }

    public boolean isFitted() {
        return failure == null;
    }

    public String getLabel() {
        return structure.toString();
    }
}
