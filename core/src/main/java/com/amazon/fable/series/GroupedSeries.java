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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import lombok.Getter;

/**
 * An ordered collection of series with unique keys sharing one index interval.
 */
public class GroupedSeries {

    @Getter
    private final IndexInterval interval;

    @Getter
    private final List<String> keyNames;

    private final LinkedHashMap<SeriesKey, TimeSeries> series;

    private GroupedSeries(IndexInterval interval, List<String> keyNames, LinkedHashMap<SeriesKey, TimeSeries> series) {
        this.interval = interval;
        this.keyNames = Collections.unmodifiableList(new ArrayList<>(keyNames));
        this.series = series;
    }

    public static Builder builder(IndexInterval interval) {
        return new Builder(interval);
    }

    public static GroupedSeries of(TimeSeries series) {
        checkNotNull(series, "series must not be null");
        return builder(series.getInterval()).add(SeriesKey.empty(), series).build();
    }

    /**
     * Groups long format observations by key, in order of first appearance, and
     * validates each group as a regular series.
     *
     * @param observations the observations
     * @param interval     the expected interval
     * @return the grouped series
     * @throws com.amazon.fable.IrregularSeriesException if any group is irregular
     */
    public static GroupedSeries fromRecords(List<Observation> observations, IndexInterval interval) {
        checkNotNull(observations, "observations must not be null");
        checkArgument(!observations.isEmpty(), "at least one observation is required");
        LinkedHashMap<SeriesKey, List<Observation>> groups = new LinkedHashMap<>();
        for (Observation observation : observations) {
            groups.computeIfAbsent(observation.getKey(), k -> new ArrayList<>()).add(observation);
        }
        Builder builder = builder(interval);
        for (Map.Entry<SeriesKey, List<Observation>> entry : groups.entrySet()) {
            List<Observation> group = entry.getValue();
            LocalDate[] times = new LocalDate[group.size()];
            double[] values = new double[group.size()];
            for (int i = 0; i < times.length; i++) {
                times[i] = group.get(i).getTime();
                values[i] = group.get(i).getValue();
            }
            builder.add(entry.getKey(), TimeSeries.fromObservations(times, values, interval));
        }
        return builder.build();
    }

    public List<SeriesKey> getKeys() {
        return Collections.unmodifiableList(new ArrayList<>(series.keySet()));
    }

    public TimeSeries get(SeriesKey key) {
        return series.get(key);
    }

    public boolean contains(SeriesKey key) {
        return series.containsKey(key);
    }

    public int size() {
        return series.size();
    }

    public GroupedSeries filter(Predicate<SeriesKey> predicate) {
        LinkedHashMap<SeriesKey, TimeSeries> kept = new LinkedHashMap<>();
        series.forEach((key, value) -> {
            if (predicate.test(key)) {
                kept.put(key, value);
            }
        });
        return new GroupedSeries(interval, keyNames, kept);
    }

    public static class Builder {

        private final IndexInterval interval;

        private List<String> keyNames;

        private final LinkedHashMap<SeriesKey, TimeSeries> series = new LinkedHashMap<>();

        Builder(IndexInterval interval) {
            this.interval = checkNotNull(interval, "interval must not be null");
        }

        public Builder add(SeriesKey key, TimeSeries timeSeries) {
            checkNotNull(key, "key must not be null");
            checkNotNull(timeSeries, "series must not be null");
            checkArgument(!series.containsKey(key), "duplicated key " + key);
            checkArgument(interval.equals(timeSeries.getInterval()),
                    "series " + key + " has interval " + timeSeries.getInterval() + ", expected " + interval);
            if (keyNames == null) {
                keyNames = key.getNames();
            } else {
                checkArgument(keyNames.equals(key.getNames()), "key " + key + " does not have names " + keyNames);
            }
            series.put(key, timeSeries);
            return this;
        }

        public GroupedSeries build() {
            return new GroupedSeries(interval, (keyNames == null) ? Collections.emptyList() : keyNames,
                    new LinkedHashMap<>(series));
        }
    }
}
