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

import java.io.Serializable;

import lombok.Getter;

/**
 * The reason a single candidate structure was not fitted, either because it was
 * inadmissible for the data or because estimation failed.
 */
@Getter
public class CandidateFailure implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String candidate;

    private final String message;

    public CandidateFailure(String candidate, String message) {
        this.candidate = CommonUtils.checkNotNull(candidate, "candidate must not be null");
        this.message = CommonUtils.checkNotNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return candidate + ": " + message;
    }
}
