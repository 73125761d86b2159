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

package com.amazon.fable.tables;

import static com.amazon.fable.CommonUtils.checkNotNull;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.fable.CandidateFailure;
import com.amazon.fable.FitFailureException;
import com.amazon.fable.series.SeriesKey;

/**
 * Why a cell of a table holds no model, or why an operation on a cell failed.
 */
@Getter
public class FitFailure implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SeriesKey key;

    private final String modelName;

    /**
     * The table operation that failed, such as fit, refit or forecast.
     */
    private final String operation;

    private final String exceptionType;

    private final String message;

    private final List<CandidateFailure> candidateFailures;

    public FitFailure(SeriesKey key, String modelName, String operation, String exceptionType, String message,
            List<CandidateFailure> candidateFailures) {
        this.key = checkNotNull(key, "key must not be null");
        this.modelName = checkNotNull(modelName, "modelName must not be null");
        this.operation = checkNotNull(operation, "operation must not be null");
        this.exceptionType = checkNotNull(exceptionType, "exceptionType must not be null");
        this.message = message;
        this.candidateFailures = Collections.unmodifiableList(candidateFailures);
    }

    static FitFailure from(SeriesKey key, String modelName, String operation, RuntimeException e) {
        List<CandidateFailure> candidates = (e instanceof FitFailureException)
                ? ((FitFailureException) e).getCandidateFailures()
                : Collections.emptyList();
        return new FitFailure(key, modelName, operation, e.getClass().getSimpleName(), e.getMessage(), candidates);
    }

    @Override
    public String toString() {
        return key + " " + modelName + " " + operation + " failed with " + exceptionType + ": " + message;
    }
}
