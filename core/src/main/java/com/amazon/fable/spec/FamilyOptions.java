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

package com.amazon.fable.spec;

import static com.amazon.fable.spec.ModelFamily.ARIMA;
import static com.amazon.fable.spec.ModelFamily.ETS;
import static com.amazon.fable.spec.ModelFamily.MEAN;
import static com.amazon.fable.spec.ModelFamily.NAIVE;
import static com.amazon.fable.spec.ModelFamily.SNAIVE;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The option schema of every family, in declaration order.
 */
final class FamilyOptions {

    private static final EnumMap<ModelFamily, Map<String, OptionDefinition<?>>> SCHEMA = new EnumMap<>(
            ModelFamily.class);

    static {
        register(ETS, EtsOptions.ERROR, EtsOptions.TREND, EtsOptions.SEASON, EtsOptions.PERIOD, EtsOptions.ALPHA,
                EtsOptions.BETA, EtsOptions.GAMMA, EtsOptions.PHI, EtsOptions.IC, EtsOptions.RESTRICT);
        register(ARIMA, ArimaOptions.P, ArimaOptions.D, ArimaOptions.Q, ArimaOptions.SEASONAL_P,
                ArimaOptions.SEASONAL_D, ArimaOptions.SEASONAL_Q, ArimaOptions.PERIOD, ArimaOptions.CONSTANT,
                ArimaOptions.IC, ArimaOptions.STEPWISE, ArimaOptions.GREEDY, ArimaOptions.MAX_P, ArimaOptions.MAX_Q,
                ArimaOptions.MAX_SEASONAL_P, ArimaOptions.MAX_SEASONAL_Q, ArimaOptions.MAX_ORDER,
                ArimaOptions.MAX_MODELS, ArimaOptions.UNITROOT_ALPHA);
        register(MEAN);
        register(NAIVE, BaselineOptions.DRIFT);
        register(SNAIVE, BaselineOptions.PERIOD);
    }

    private FamilyOptions() {
    }

    private static void register(ModelFamily family, OptionDefinition<?>... definitions) {
        Map<String, OptionDefinition<?>> map = new LinkedHashMap<>();
        for (OptionDefinition<?> definition : definitions) {
            map.put(definition.getName(), definition);
        }
        SCHEMA.put(family, Collections.unmodifiableMap(map));
    }

    static Map<String, OptionDefinition<?>> forFamily(ModelFamily family) {
        return SCHEMA.get(family);
    }
}
