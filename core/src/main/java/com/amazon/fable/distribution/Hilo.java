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

package com.amazon.fable.distribution;

import static com.amazon.fable.CommonUtils.checkArgument;

import java.io.Serializable;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A two sided interval that covers {@code level} percent of the mass of a
 * distribution, leaving equal mass in both tails.
 */
@Getter
@EqualsAndHashCode
public class Hilo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double lower;

    private final double upper;

    private final double level;

    public Hilo(double lower, double upper, double level) {
        checkLevel(level);
        checkArgument(!(lower > upper), "lower bound exceeds upper bound");
        this.lower = lower;
        this.upper = upper;
        this.level = level;
    }

    public static void checkLevel(double level) {
        checkArgument(level > 0 && level < 100, "level must be in (0, 100)");
    }

    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return lower <= value && value <= upper;
    }

    /**
     * @param other another interval
     * @return true if the other interval lies within this one
     */
    public boolean contains(Hilo other) {
        return lower <= other.lower && other.upper <= upper;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]" + level;
    }
}
