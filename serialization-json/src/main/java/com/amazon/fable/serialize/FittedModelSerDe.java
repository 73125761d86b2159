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

package com.amazon.fable.serialize;

import lombok.Getter;

import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.state.FittedModelMapper;
import com.amazon.fable.state.FittedModelState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Fitted model serialization. A model is converted to a
 * {@link FittedModelState} by a {@link FittedModelMapper} and the state is
 * written as JSON with <a href="https://github.com/google/gson">Gson</a>. The
 * Gson instance is exposed so that callers can customize the output.
 */
@Getter
public class FittedModelSerDe {

    private final FittedModelMapper mapper;

    private final Gson gson;

    /**
     * Default serialization. NaN and infinite values, such as missing
     * observations, are written as JSON literals.
     */
    public FittedModelSerDe() {
        this(new FittedModelMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    public FittedModelSerDe(FittedModelMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public String toJson(IFittedModel model) {
        return gson.toJson(mapper.toState(model));
    }

    /**
     * @param json a json string produced by {@link #toJson(IFittedModel)}
     * @return the restored model
     */
    public IFittedModel fromJson(String json) {
        FittedModelState state = gson.fromJson(json, FittedModelState.class);
        return mapper.toModel(state);
    }
}
