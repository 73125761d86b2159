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

package com.amazon.fable;

import java.util.Collections;
import java.util.List;

/**
 * Raised by a fitter when no candidate structure could be fitted. The failures
 * of every attempted candidate are kept so that callers can report them.
 */
public class FitFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<CandidateFailure> candidateFailures;

    public FitFailureException(String message) {
        this(message, Collections.emptyList());
    }

    public FitFailureException(String message, List<CandidateFailure> candidateFailures) {
        super(message);
        this.candidateFailures = Collections
                .unmodifiableList(CommonUtils.checkNotNull(candidateFailures, "candidateFailures must not be null"));
    }

    public List<CandidateFailure> getCandidateFailures() {
        return candidateFailures;
    }
}
