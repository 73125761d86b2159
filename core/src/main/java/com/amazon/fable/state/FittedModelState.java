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

package com.amazon.fable.state;

import static com.amazon.fable.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

/**
 * The state of a fitted model of any family. The family decides which of the
 * family specific fields are used; the others keep their defaults. Fitted
 * values and residuals are not stored: they are recomputed from the
 * coefficients when the model is restored.
 */
@Data
public class FittedModelState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private String family;

    private ModelSpecificationState specificationState;

    private TimeSeriesState seriesState;

    private String structure;

    // exponential smoothing

    private String errorType;

    private String trendType;

    private String seasonType;

    private int period;

    private double alpha;

    private double beta;

    private double gamma;

    private double phi;

    private double level;

    private double slope;

    private double[] season;

    private int freeParameters;

    // ARIMA

    private int p;

    private int d;

    private int q;

    private int seasonalP;

    private int seasonalD;

    private int seasonalQ;

    private boolean constant;

    private double[] coefficients;

    private double[] standardErrors;

    // benchmarks

    private double mean;

    private int count;

    private double drift;

    private int differences;
}
