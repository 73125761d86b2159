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

import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Rows extracted from the cells of a table, with the cells that produced no
 * rows because they failed listed apart.
 *
 * @param <T> the row type
 */
@Getter
public class TableExtract<T> {

    private final List<T> rows;

    private final List<FitFailure> failures;

    TableExtract(List<T> rows, List<FitFailure> failures) {
        this.rows = Collections.unmodifiableList(rows);
        this.failures = Collections.unmodifiableList(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
