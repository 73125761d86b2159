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

import lombok.Getter;

/**
 * The result of a table operation on one cell: a value, or the failure that
 * prevented it.
 */
@Getter
class CellOutcome<T> {

    private final T value;

    private final FitFailure failure;

    private CellOutcome(T value, FitFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    static <T> CellOutcome<T> success(T value) {
        return new CellOutcome<>(value, null);
    }

    static <T> CellOutcome<T> failure(FitFailure failure) {
        return new CellOutcome<>(null, failure);
    }

    boolean isSuccess() {
        return failure == null;
    }
}
