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

import com.amazon.fable.tables.Mable;
import com.amazon.fable.tables.state.MableMapper;
import com.amazon.fable.tables.state.MableState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * {@link Mable} serialization through {@link MableMapper} and Gson. Failed
 * cells are written with their failure and restored as failed cells.
 */
@Getter
public class MableSerDe {

    private final MableMapper mapper;

    private final Gson gson;

    public MableSerDe() {
        this(new MableMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    public MableSerDe(MableMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public String toJson(Mable mable) {
        return gson.toJson(mapper.toState(mable));
    }

    public Mable fromJson(String json) {
        MableState state = gson.fromJson(json, MableState.class);
        return mapper.toModel(state);
    }
}
