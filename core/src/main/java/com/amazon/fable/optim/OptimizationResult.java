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

package com.amazon.fable.optim;

import java.util.Arrays;

import lombok.Getter;

/**
 * The minimizing point of an objective and the objective's value there.
 */
@Getter
public class OptimizationResult {

    private final double[] point;

    private final double value;

    private final int evaluations;

    public OptimizationResult(double[] point, double value, int evaluations) {
        this.point = Arrays.copyOf(point, point.length);
        this.value = value;
        this.evaluations = evaluations;
    }

    public double[] getPoint() {
        return Arrays.copyOf(point, point.length);
    }
}
