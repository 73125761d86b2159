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

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import com.amazon.fable.InvalidSpecException;

/**
 * An immutable, validated model specification: a family and a value for every
 * option of that family. Options that were not given take the family default.
 * One specification may be applied to any number of series.
 */
@EqualsAndHashCode
public class ModelSpecification {

    @Getter
    private final ModelFamily family;

    private final Map<String, ModelOption<?>> options;

    private ModelSpecification(ModelFamily family, Map<String, ModelOption<?>> options) {
        this.family = family;
        this.options = Collections.unmodifiableMap(options);
    }

    /**
     * @param family  the family
     * @param options option values by name; absent options take their default
     * @return the validated specification
     * @throws InvalidSpecException if any option is unknown, mistyped, out of
     *                              its domain or contradicts another
     */
    public static ModelSpecification of(ModelFamily family, Map<String, ModelOption<?>> options) {
        checkNotNull(family, "family must not be null");
        checkNotNull(options, "options must not be null");
        Map<String, OptionDefinition<?>> schema = family.getOptions();
        for (String name : options.keySet()) {
            if (!schema.containsKey(name)) {
                throw new InvalidSpecException("unknown option '" + name + "' for " + family);
            }
        }
        Map<String, ModelOption<?>> resolved = new LinkedHashMap<>();
        for (OptionDefinition<?> definition : schema.values()) {
            ModelOption<?> given = options.get(definition.getName());
            if (given == null) {
                resolved.put(definition.getName(), definition.getDefaultValue());
            } else {
                resolved.put(definition.getName(), definition.validate(family, given));
            }
        }
        ModelSpecification specification = new ModelSpecification(family, resolved);
        specification.checkConsistency();
        return specification;
    }

    public static Builder builder(ModelFamily family) {
        return new Builder(family);
    }

    public static ModelSpecification ets() {
        return builder(ModelFamily.ETS).build();
    }

    public static ModelSpecification arima() {
        return builder(ModelFamily.ARIMA).build();
    }

    public static ModelSpecification mean() {
        return builder(ModelFamily.MEAN).build();
    }

    public static ModelSpecification naive() {
        return builder(ModelFamily.NAIVE).build();
    }

    public static ModelSpecification snaive() {
        return builder(ModelFamily.SNAIVE).build();
    }

    @SuppressWarnings("unchecked")
    public <T> ModelOption<T> get(OptionDefinition<T> definition) {
        checkArgument(family.getOptions().get(definition.getName()) == definition,
                "option '" + definition.getName() + "' does not belong to " + family);
        return (ModelOption<T>) options.get(definition.getName());
    }

    public ModelOption<?> get(String name) {
        checkArgument(options.containsKey(name), "unknown option '" + name + "' for " + family);
        return options.get(name);
    }

    public Map<String, ModelOption<?>> getOptions() {
        return options;
    }

    /**
     * @return a new specification with one option replaced
     */
    public <T> ModelSpecification with(OptionDefinition<T> definition, ModelOption<T> option) {
        Map<String, ModelOption<?>> copy = new LinkedHashMap<>(options);
        copy.put(definition.getName(), option);
        return of(family, copy);
    }

    public <T> ModelSpecification withFixed(OptionDefinition<T> definition, T value) {
        return with(definition, ModelOption.fixed(value));
    }

    private void checkConsistency() {
        if (family == ModelFamily.ETS) {
            ModelOption<Double> alpha = get(EtsOptions.ALPHA);
            ModelOption<Double> beta = get(EtsOptions.BETA);
            ModelOption<Double> gamma = get(EtsOptions.GAMMA);
            if (alpha.isFixed() && beta.isFixed() && beta.getValue() > alpha.getValue()) {
                throw new InvalidSpecException("ETS option 'beta' must not exceed 'alpha'");
            }
            if (alpha.isFixed() && gamma.isFixed() && gamma.getValue() > 1 - alpha.getValue()) {
                throw new InvalidSpecException("ETS option 'gamma' must not exceed 1 - 'alpha'");
            }
        } else if (family == ModelFamily.ARIMA) {
            ModelOption<Integer> period = get(ArimaOptions.PERIOD);
            if (period.isFixed() && period.getValue() == 1) {
                if (get(ArimaOptions.SEASONAL_P).orElse(0) > 0 || get(ArimaOptions.SEASONAL_D).orElse(0) > 0
                        || get(ArimaOptions.SEASONAL_Q).orElse(0) > 0) {
                    throw new InvalidSpecException("seasonal ARIMA orders need a seasonal period above 1");
                }
            }
            ModelOption<Integer> d = get(ArimaOptions.D);
            ModelOption<Integer> seasonalD = get(ArimaOptions.SEASONAL_D);
            if (get(ArimaOptions.CONSTANT).orElse(false) && d.isFixed() && seasonalD.isFixed()
                    && d.getValue() + seasonalD.getValue() >= 2) {
                throw new InvalidSpecException(
                        "a constant with d + D >= 2 induces a polynomial trend of order 2 or more");
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(family.name()).append('(');
        boolean first = true;
        for (Map.Entry<String, ModelOption<?>> entry : options.entrySet()) {
            if (!first) {
                builder.append(", ");
            }
            builder.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return builder.append(')').toString();
    }

    public static class Builder {

        private final ModelFamily family;

        private final Map<String, ModelOption<?>> options = new LinkedHashMap<>();

        Builder(ModelFamily family) {
            this.family = checkNotNull(family, "family must not be null");
        }

        public Builder fixed(String name, Object value) {
            options.put(name, ModelOption.fixed(value));
            return this;
        }

        public <T> Builder fixed(OptionDefinition<T> definition, T value) {
            return fixed(definition.getName(), value);
        }

        public Builder automatic(String name) {
            options.put(name, ModelOption.automatic());
            return this;
        }

        public Builder option(String name, ModelOption<?> option) {
            options.put(name, checkNotNull(option, "option must not be null"));
            return this;
        }

        public ModelSpecification build() {
            return of(family, options);
        }
    }
}
