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

package com.amazon.fable.config;

/**
 * How the innovations of an exponential smoothing model enter the observation
 * equation.
 */
public enum ErrorType {
    /**
     * The observation is the one-step forecast plus the innovation.
     */
    ADDITIVE("A"),
    /**
     * The observation is the one-step forecast scaled by one plus the
     * innovation. Requires strictly positive data.
     */
    MULTIPLICATIVE("M");

    private final String code;

    ErrorType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
