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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One estimated parameter of a fitted model.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class Coefficient implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String term;

    private final double estimate;

    /**
     * NaN when no standard error is available.
     */
    private final double standardError;

    public Coefficient(String term, double estimate) {
        this(term, estimate, Double.NaN);
    }

    public double getStatistic() {
        return estimate / standardError;
    }

    @Override
    public String toString() {
        return term + "=" + estimate;
    }
}
