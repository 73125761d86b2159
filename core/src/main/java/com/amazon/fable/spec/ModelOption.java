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

package com.amazon.fable.spec;

import static com.amazon.fable.CommonUtils.checkNotNull;
import static com.amazon.fable.CommonUtils.checkState;

import lombok.EqualsAndHashCode;

/**
 * The value of one model option: either fixed by the caller or left for the
 * fitter to determine from the data.
 *
 * @param <T> the option's value type
 */
@EqualsAndHashCode
public class ModelOption<T> {

    private static final ModelOption<?> AUTOMATIC = new ModelOption<>(null);

    private final T value;

    private ModelOption(T value) {
        this.value = value;
    }

    public static <T> ModelOption<T> fixed(T value) {
        return new ModelOption<>(checkNotNull(value, "a fixed option needs a value"));
    }

    @SuppressWarnings("unchecked")
    public static <T> ModelOption<T> automatic() {
        return (ModelOption<T>) AUTOMATIC;
    }

    public boolean isAutomatic() {
        return value == null;
    }

    public boolean isFixed() {
        return value != null;
    }

    /**
     * @return the fixed value
     * @throws IllegalStateException if the option is automatic
     */
    public T getValue() {
        checkState(value != null, "option is automatic");
        return value;
    }

    public T orElse(T other) {
        return (value == null) ? other : value;
    }

    @Override
    public String toString() {
        return (value == null) ? "auto" : String.valueOf(value);
    }
}
