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

import java.util.List;
import java.util.Random;

import com.amazon.fable.series.Horizon;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;

/**
 * The capability set shared by every fitted model, whatever its family.
 * Fitted models are immutable; {@link #refit} and {@link #stream} return new
 * models.
 */
public interface IFittedModel {

    ModelFamily getFamily();

    ModelSpecification getSpecification();

    /**
     * @return a label of the selected structure, such as {@code ETS(M,Ad,M)} or
     *         {@code ARIMA(1,1,0)(0,1,1)[4]}
     */
    String getStructure();

    /**
     * @return the series the model was fitted to, including streamed
     *         observations
     */
    TimeSeries getSeries();

    double[] fittedValues();

    double[] residuals();

    List<Coefficient> coefficients();

    ModelStatistics statistics();

    /**
     * @param h the number of steps
     * @return h distributions, one per future time point
     */
    ModelForecast forecast(int h);

    ModelForecast forecast(Horizon horizon);

    /**
     * Re-estimates the coefficients of the same structure on new data.
     *
     * @param series the new data
     * @return the refitted model
     * @throws com.amazon.fable.RefitException if the data is incompatible
     */
    IFittedModel refit(TimeSeries series);

    /**
     * @param series     the new data
     * @param reestimate when false the coefficients are kept and only the states
     *                   and residuals are recomputed
     * @return the refitted model
     * @throws com.amazon.fable.RefitException if the data is incompatible
     */
    IFittedModel refit(TimeSeries series, boolean reestimate);

    /**
     * Extends the model with observations continuing its series.
     *
     * @param newObservations observations starting one step after the series
     * @return a new model whose state includes the observations
     * @throws com.amazon.fable.StreamException if the observations do not continue
     *                                          the series
     */
    IFittedModel stream(TimeSeries newObservations);

    /**
     * @return paths[path][step] with Gaussian innovations
     */
    double[][] generate(int h, int paths, Random random);

    /**
     * @param bootstrap when true the innovations are resampled from the residuals
     */
    double[][] generate(int h, int paths, Random random, boolean bootstrap);

    /**
     * @return the series with missing values replaced by one-step predictions
     */
    TimeSeries interpolate();

    ModelComponents components();
}
