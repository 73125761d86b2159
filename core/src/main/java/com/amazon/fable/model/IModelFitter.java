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

package com.amazon.fable.model;

import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;

/**
 * Fits one family of models to a single series.
 */
public interface IModelFitter {

    ModelFamily getFamily();

    /**
     * @param series        the series
     * @param specification a specification of this fitter's family
     * @return the fitted model
     * @throws com.amazon.fable.FitFailureException if no candidate could be fitted
     */
    IFittedModel fit(TimeSeries series, ModelSpecification specification);
}
