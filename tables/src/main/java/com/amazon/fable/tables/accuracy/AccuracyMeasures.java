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

package com.amazon.fable.tables.accuracy;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Point forecast accuracy measures. Percentage measures are in percent; the
 * scaled measures are relative to the in-sample seasonal naive errors.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AccuracyMeasures implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Mean error.
     */
    private double me;

    /**
     * Root mean squared error.
     */
    private double rmse;

    /**
     * Mean absolute error.
     */
    private double mae;

    /**
     * Mean percentage error.
     */
    private double mpe;

    /**
     * Mean absolute percentage error.
     */
    private double mape;

    /**
     * Mean absolute scaled error.
     */
    private double mase;

    /**
     * Root mean squared scaled error.
     */
    private double rmsse;

    /**
     * Lag one autocorrelation of the errors.
     */
    private double acf1;
}
