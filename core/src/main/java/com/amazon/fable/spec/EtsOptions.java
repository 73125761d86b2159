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

import com.amazon.fable.config.ErrorType;
import com.amazon.fable.config.InformationCriterion;
import com.amazon.fable.config.SeasonType;
import com.amazon.fable.config.TrendType;

/**
 * Options of the ETS family.
 */
public final class EtsOptions {

    private EtsOptions() {
    }

    public static final OptionDefinition<ErrorType> ERROR = OptionDefinition.automatic("error", ErrorType.class,
            v -> true, "an error type");

    public static final OptionDefinition<TrendType> TREND = OptionDefinition.automatic("trend", TrendType.class,
            v -> true, "a trend type");

    public static final OptionDefinition<SeasonType> SEASON = OptionDefinition.automatic("season", SeasonType.class,
            v -> true, "a season type");

    public static final OptionDefinition<Integer> PERIOD = OptionDefinition.automatic("period", Integer.class,
            v -> v >= 1, "at least 1");

    public static final OptionDefinition<Double> ALPHA = OptionDefinition.automatic("alpha", Double.class,
            v -> v > 0 && v < 1, "in (0, 1)");

    public static final OptionDefinition<Double> BETA = OptionDefinition.automatic("beta", Double.class,
            v -> v > 0 && v < 1, "in (0, 1)");

    public static final OptionDefinition<Double> GAMMA = OptionDefinition.automatic("gamma", Double.class,
            v -> v > 0 && v < 1, "in (0, 1)");

    public static final OptionDefinition<Double> PHI = OptionDefinition.automatic("phi", Double.class,
            v -> v >= 0.8 && v <= 0.98, "in [0.8, 0.98]");

    public static final OptionDefinition<InformationCriterion> IC = OptionDefinition.fixedOnly("ic",
            InformationCriterion.class, InformationCriterion.AICC, v -> true, "an information criterion");

    /**
     * When true, additive errors are not combined with a multiplicative season
     * during an automatic search.
     */
    public static final OptionDefinition<Boolean> RESTRICT = OptionDefinition.fixedOnly("restrict", Boolean.class,
            true, v -> true, "a boolean");
}
