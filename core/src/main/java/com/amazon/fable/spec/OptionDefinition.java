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

import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.function.Predicate;

import lombok.Getter;

import com.amazon.fable.InvalidSpecException;

/**
 * The name, type, legal domain and default of one model option.
 *
 * @param <T> the option's value type
 */
@Getter
public class OptionDefinition<T> {

    private final String name;

    private final Class<T> type;

    private final boolean automaticAllowed;

    private final ModelOption<T> defaultValue;

    private final Predicate<T> domain;

    private final String domainDescription;

    private OptionDefinition(String name, Class<T> type, boolean automaticAllowed, ModelOption<T> defaultValue,
            Predicate<T> domain, String domainDescription) {
        this.name = checkNotNull(name, "name must not be null");
        this.type = checkNotNull(type, "type must not be null");
        this.automaticAllowed = automaticAllowed;
        this.defaultValue = checkNotNull(defaultValue, "default must not be null");
        this.domain = checkNotNull(domain, "domain must not be null");
        this.domainDescription = domainDescription;
    }

    /**
     * An option that may be left for the fitter to determine, and is by default.
     */
    static <T> OptionDefinition<T> automatic(String name, Class<T> type, Predicate<T> domain, String description) {
        return new OptionDefinition<>(name, type, true, ModelOption.automatic(), domain, description);
    }

    /**
     * An option that always has a concrete value.
     */
    static <T> OptionDefinition<T> fixedOnly(String name, Class<T> type, T defaultValue, Predicate<T> domain,
            String description) {
        return new OptionDefinition<>(name, type, false, ModelOption.fixed(defaultValue), domain, description);
    }

    /**
     * Checks an option against this definition, widening numbers to doubles where
     * the option is real valued.
     *
     * @param family the family the option is given for
     * @param option the option
     * @return the option, with its value converted to this definition's type
     * @throws InvalidSpecException if the option is not legal
     */
    ModelOption<T> validate(ModelFamily family, ModelOption<?> option) {
        if (option.isAutomatic()) {
            if (!automaticAllowed) {
                throw new InvalidSpecException(family + " option '" + name + "' cannot be automatic");
            }
            return ModelOption.automatic();
        }
        Object raw = option.getValue();
        if (type == Double.class && raw instanceof Number) {
            raw = ((Number) raw).doubleValue();
        }
        if (!type.isInstance(raw)) {
            throw new InvalidSpecException(family + " option '" + name + "' expects a " + type.getSimpleName()
                    + " but was given " + raw.getClass().getSimpleName());
        }
        T value = type.cast(raw);
        if (!domain.test(value)) {
            throw new InvalidSpecException(
                    family + " option '" + name + "' must be " + domainDescription + " but was " + value);
        }
        return ModelOption.fixed(value);
    }

    /**
     * @param text the text produced by {@link #format(Object)}
     * @return the value
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public T parse(String text) {
        checkNotNull(text, "text must not be null");
        if (type == Integer.class) {
            return type.cast(Integer.valueOf(text));
        } else if (type == Double.class) {
            return type.cast(Double.valueOf(text));
        } else if (type == Boolean.class) {
            return type.cast(Boolean.valueOf(text));
        } else if (type.isEnum()) {
            return (T) Enum.valueOf((Class) type, text);
        }
        throw new IllegalStateException("unsupported option type " + type);
    }

    public String format(Object value) {
        return (value instanceof Enum) ? ((Enum<?>) value).name() : String.valueOf(value);
    }
}
