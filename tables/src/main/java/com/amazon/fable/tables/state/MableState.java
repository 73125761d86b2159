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

import com.amazon.fable.state.ModelSpecificationState;

/**
 * The state of a {@link com.amazon.fable.tables.Mable}: its series, its model
 * columns and one entry per cell in key order, then model order.
 */
@Data
public class MableState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private String step;

    private int seasonalPeriod;

    private List<SeriesEntryState> series;

    private List<String> modelNames;

    private List<ModelSpecificationState> specificationStates;

    private List<MableCellState> cells;
}
