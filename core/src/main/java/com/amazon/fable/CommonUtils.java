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

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * A missing observation is stored as NaN; infinities are never valid
     * observations either.
     *
     * @param value a value
     * @return true if the value is a usable observation
     */
    public static boolean isObserved(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    public static int countObserved(double[] values) {
        checkNotNull(values, "values must not be null");
        int count = 0;
        for (double value : values) {
            if (isObserved(value)) {
                ++count;
            }
        }
        return count;
    }

    /**
     * Fills missing values by linear interpolation between the nearest observed
     * neighbours; leading and trailing gaps take the nearest observed value.
     *
     * @param values the values, NaN marking missing entries
     * @return a new array without missing values
     */
    public static double[] fillLinear(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(countObserved(values) > 0, "at least one observed value is required");
        double[] answer = new double[values.length];
        int previous = -1;
        for (int i = 0; i < values.length; i++) {
            if (isObserved(values[i])) {
                answer[i] = values[i];
                if (previous == -1) {
                    for (int j = 0; j < i; j++) {
                        answer[j] = values[i];
                    }
                } else {
                    for (int j = previous + 1; j < i; j++) {
                        double fraction = (j - previous) * 1.0 / (i - previous);
                        answer[j] = values[previous] + fraction * (values[i] - values[previous]);
                    }
                }
                previous = i;
            }
        }
        for (int j = previous + 1; j < values.length; j++) {
            answer[j] = values[previous];
        }
        return answer;
    }
}
