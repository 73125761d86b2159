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
 * The trend component of an exponential smoothing model.
 */
public enum TrendType {
    /**
     * No trend.
     */
    NONE("N"),
    /**
     * An additive slope carried forward unchanged.
     */
    ADDITIVE("A"),
    /**
     * An additive slope shrunk towards zero by the damping parameter phi at each
     * step.
     */
    ADDITIVE_DAMPED("Ad");

    private final String code;

    TrendType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
