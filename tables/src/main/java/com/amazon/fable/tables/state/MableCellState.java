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

package com.amazon.fable.tables.state;

import static com.amazon.fable.state.Version.V1_0;

import java.io.Serializable;
import java.util.List;

import lombok.Data;

import com.amazon.fable.state.FittedModelState;

/**
 * The state of one cell. Exactly one of {@code modelState} and
 * {@code failureOperation} is set.
 */
@Data
public class MableCellState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    /**
     * Position of the cell's series in {@link MableState#getSeries()}.
     */
    private int seriesIndex;

    private String modelName;

    private FittedModelState modelState;

    private String failureOperation;

    private String failureType;

    private String failureMessage;

    /**
     * Candidate failures as alternating candidate labels and messages.
     */
    private List<String> candidateFailures;
}
