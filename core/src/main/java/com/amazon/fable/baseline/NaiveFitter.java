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

package com.amazon.fable.baseline;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import com.amazon.fable.FitFailureException;
import com.amazon.fable.model.IModelFitter;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;

public class NaiveFitter implements IModelFitter {

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.NAIVE;
    }

    @Override
    public NaiveModel fit(TimeSeries series, ModelSpecification specification) {
        checkNotNull(series, "series must not be null");
        checkArgument(checkNotNull(specification, "specification must not be null").getFamily() == ModelFamily.NAIVE,
                "not a NAIVE specification");
        NaiveModel model = NaiveModel.estimate(specification, series);
        if (Double.isNaN(model.statistics().getSigma2())) {
            throw new FitFailureException("too few consecutive observations for a random walk");
        }
        return model;
    }
}
