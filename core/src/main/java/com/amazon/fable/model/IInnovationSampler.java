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

package com.amazon.fable.model;

import static com.amazon.fable.CommonUtils.checkArgument;

import java.util.Random;

import com.amazon.fable.statistics.Moments;

/**
 * A source of innovations for simulating future paths.
 */
@FunctionalInterface
public interface IInnovationSampler {

    double next(Random random);

    static IInnovationSampler gaussian(double sigma) {
        return random -> sigma * random.nextGaussian();
    }

    /**
     * @param residuals residuals to resample; missing values are skipped
     * @return a sampler drawing uniformly from the residuals
     */
    static IInnovationSampler bootstrap(double[] residuals) {
        double[] pool = Moments.observed(residuals);
        checkArgument(pool.length > 0, "no residuals to resample");
        return random -> pool[random.nextInt(pool.length)];
    }
}
