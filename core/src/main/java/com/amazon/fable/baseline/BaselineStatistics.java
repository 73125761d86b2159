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

package com.amazon.fable.baseline;

import com.amazon.fable.model.ModelStatistics;
import com.amazon.fable.statistics.Moments;

/**
 * Statistics of the benchmark models, which have no likelihood; only the
 * residual variance and the error summaries are defined.
 */
final class BaselineStatistics {

    private BaselineStatistics() {
    }

    /**
     * @param residuals the residuals, NaN where undefined
     * @param estimated number of estimated coefficients
     * @return statistics with sigma2 on residuals' degrees of freedom
     */
    static ModelStatistics of(double[] residuals, int estimated) {
        double[] observed = Moments.observed(residuals);
        int n = observed.length;
        double sumOfSquares = Moments.sumOfSquares(observed);
        int degreesOfFreedom = n - estimated;
        double sigma2 = degreesOfFreedom > 0 ? sumOfSquares / degreesOfFreedom : Double.NaN;
        return ModelStatistics.builder().sigma2(sigma2).mse(Moments.meanSquare(residuals))
                .mae(Moments.meanAbsolute(residuals)).nobs(n).parameters(estimated + 1).build();
    }
}
