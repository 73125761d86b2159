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

package com.amazon.fable.tables;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;
import static com.amazon.fable.CommonUtils.checkState;

import lombok.Getter;

import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.series.SeriesKey;
import com.amazon.fable.spec.ModelSpecification;

/**
 * One (series, model) cell of a mable: either a fitted model or the failure
 * that prevented fitting.
 */
@Getter
public class MableCell {

    private final SeriesKey key;

    private final String modelName;

    private final ModelSpecification specification;

    private final IFittedModel model;

    private final FitFailure failure;

    private MableCell(SeriesKey key, String modelName, ModelSpecification specification, IFittedModel model,
            FitFailure failure) {
        this.key = checkNotNull(key, "key must not be null");
        this.modelName = checkNotNull(modelName, "modelName must not be null");
        this.specification = checkNotNull(specification, "specification must not be null");
        checkArgument((model == null) != (failure == null), "a cell holds either a model or a failure");
        this.model = model;
        this.failure = failure;
    }

    public static MableCell fitted(SeriesKey key, String modelName, ModelSpecification specification,
            IFittedModel model) {
        return new MableCell(key, modelName, specification, checkNotNull(model, "model must not be null"), null);
    }

    public static MableCell failed(SeriesKey key, String modelName, ModelSpecification specification,
            FitFailure failure) {
        return new MableCell(key, modelName, specification, null, checkNotNull(failure, "failure must not be null"));
    }

    public boolean isFitted() {
        return model != null;
    }

    /**
     * @return the model
     * @throws IllegalStateException if the cell failed to fit
     */
    public IFittedModel requireModel() {
        checkState(model != null, "cell " + key + " " + modelName + " has no model: " + failure);
        return model;
    }

    MableCell withModel(IFittedModel newModel) {
        return fitted(key, modelName, specification, newModel);
    }

    MableCell withFailure(FitFailure newFailure) {
        return failed(key, modelName, specification, newFailure);
    }
}
