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

package com.amazon.fable.ets;

import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import com.amazon.fable.config.ErrorType;
import com.amazon.fable.config.SeasonType;
import com.amazon.fable.config.TrendType;

/**
 * The error, trend and season components of one exponential smoothing model.
 */
@Getter
@EqualsAndHashCode
public class EtsStructure {

    /**
     * Every structure, ordered by error, then trend, then season.
     */
    public static final List<EtsStructure> CANONICAL_ORDER;

    static {
        List<EtsStructure> list = new ArrayList<>();
        for (ErrorType error : ErrorType.values()) {
            for (TrendType trend : TrendType.values()) {
                for (SeasonType season : SeasonType.values()) {
                    list.add(new EtsStructure(error, trend, season));
                }
            }
        }
        CANONICAL_ORDER = Collections.unmodifiableList(list);
    }

    private final ErrorType error;

    private final TrendType trend;

    private final SeasonType season;

    public EtsStructure(ErrorType error, TrendType trend, SeasonType season) {
        this.error = checkNotNull(error, "error must not be null");
        this.trend = checkNotNull(trend, "trend must not be null");
        this.season = checkNotNull(season, "season must not be null");
    }

    public boolean hasTrend() {
        return trend != TrendType.NONE;
    }

    public boolean isDamped() {
        return trend == TrendType.ADDITIVE_DAMPED;
    }

    public boolean hasSeason() {
        return season != SeasonType.NONE;
    }

    public boolean isMultiplicativeError() {
        return error == ErrorType.MULTIPLICATIVE;
    }

    public boolean isMultiplicativeSeason() {
        return season == SeasonType.MULTIPLICATIVE;
    }

    public boolean needsPositiveData() {
        return isMultiplicativeError() || isMultiplicativeSeason();
    }

    /**
     * @return the index of this structure in {@link #CANONICAL_ORDER}
     */
    public int canonicalIndex() {
        return CANONICAL_ORDER.indexOf(this);
    }

    @Override
    public String toString() {
        return "ETS(" + error.getCode() + "," + trend.getCode() + "," + season.getCode() + ")";
    }
}
