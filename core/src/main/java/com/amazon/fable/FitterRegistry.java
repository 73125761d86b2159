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

package com.amazon.fable;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import java.util.EnumMap;

import com.amazon.fable.arima.ArimaFitter;
import com.amazon.fable.baseline.MeanFitter;
import com.amazon.fable.baseline.NaiveFitter;
import com.amazon.fable.baseline.SeasonalNaiveFitter;
import com.amazon.fable.ets.EtsFitter;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.model.IModelFitter;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;

/**
 * Maps every model family to its fitter. A registry always covers the whole
 * family set; individual fitters can be replaced, for example with
 * differently configured optimizers.
 */
public class FitterRegistry {

    private final EnumMap<ModelFamily, IModelFitter> fitters;

    private FitterRegistry(EnumMap<ModelFamily, IModelFitter> fitters) {
        for (ModelFamily family : ModelFamily.values()) {
            checkArgument(fitters.containsKey(family), "no fitter registered for " + family);
        }
        this.fitters = fitters;
    }

    public static FitterRegistry defaultRegistry() {
        EnumMap<ModelFamily, IModelFitter> map = new EnumMap<>(ModelFamily.class);
        register(map, new EtsFitter());
        register(map, new ArimaFitter());
        register(map, new MeanFitter());
        register(map, new NaiveFitter());
        register(map, new SeasonalNaiveFitter());
        return new FitterRegistry(map);
    }

    private static void register(EnumMap<ModelFamily, IModelFitter> map, IModelFitter fitter) {
        map.put(checkNotNull(fitter.getFamily(), "fitter family must not be null"), fitter);
    }

    /**
     * @param fitter a fitter replacing the one of its family
     * @return a new registry
     */
    public FitterRegistry withOverride(IModelFitter fitter) {
        checkNotNull(fitter, "fitter must not be null");
        EnumMap<ModelFamily, IModelFitter> map = new EnumMap<>(fitters);
        register(map, fitter);
        return new FitterRegistry(map);
    }

    public IModelFitter get(ModelFamily family) {
        return fitters.get(checkNotNull(family, "family must not be null"));
    }

    /**
     * Fits a series with the fitter of the specification's family.
     */
    public IFittedModel fit(TimeSeries series, ModelSpecification specification) {
        checkNotNull(specification, "specification must not be null");
        return get(specification.getFamily()).fit(series, specification);
    }
}
