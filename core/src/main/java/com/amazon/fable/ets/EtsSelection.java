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

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

import com.amazon.fable.config.InformationCriterion;

/**
 * Every candidate considered by an automatic ETS search, in canonical order,
 * and the one that was selected.
 */
@Getter
public class EtsSelection {

    private final List<EtsCandidateResult> candidates;

    private final EtsStructure selected;

    private final InformationCriterion criterion;

    EtsSelection(List<EtsCandidateResult> candidates, EtsStructure selected, InformationCriterion criterion) {
        this.candidates = Collections.unmodifiableList(candidates);
        this.selected = selected;
        this.criterion = criterion;
    }

    public List<EtsCandidateResult> getFittedCandidates() {
        return candidates.stream().filter(EtsCandidateResult::isFitted).collect(Collectors.toList());
    }
}
