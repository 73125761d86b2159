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

package com.amazon.fable.series;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The identity of one series within a grouped table: an ordered tuple of key
 * variable names and values.
 */
@Getter
@EqualsAndHashCode
public class SeriesKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final SeriesKey EMPTY = new SeriesKey(Collections.emptyList(), Collections.emptyList());

    private final List<String> names;

    private final List<String> values;

    private SeriesKey(List<String> names, List<String> values) {
        checkArgument(names.size() == values.size(), "names and values must have the same length");
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        checkArgument(this.names.stream().distinct().count() == this.names.size(), "duplicated key name");
    }

    public static SeriesKey empty() {
        return EMPTY;
    }

    /**
     * @param namesAndValues alternating key names and values
     * @return the key
     */
    public static SeriesKey of(String... namesAndValues) {
        checkNotNull(namesAndValues, "arguments must not be null");
        checkArgument(namesAndValues.length % 2 == 0, "expected alternating names and values");
        List<String> names = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            names.add(checkNotNull(namesAndValues[i], "key name must not be null"));
            values.add(checkNotNull(namesAndValues[i + 1], "key value must not be null"));
        }
        return new SeriesKey(names, values);
    }

    public static SeriesKey of(List<String> names, List<String> values) {
        checkNotNull(names, "names must not be null");
        checkNotNull(values, "values must not be null");
        return new SeriesKey(names, values);
    }

    public String get(String name) {
        int index = names.indexOf(name);
        checkArgument(index >= 0, "unknown key name " + name);
        return values.get(index);
    }

    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            map.put(names.get(i), values.get(i));
        }
        return map;
    }

    public int size() {
        return names.size();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(names.get(i)).append('=').append(values.get(i));
        }
        return builder.append('}').toString();
    }
}
