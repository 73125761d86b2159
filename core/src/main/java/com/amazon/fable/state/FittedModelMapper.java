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

package com.amazon.fable.state;

import static com.amazon.fable.CommonUtils.checkArgument;
import static com.amazon.fable.CommonUtils.checkNotNull;

import com.amazon.fable.arima.ArimaCoefficients;
import com.amazon.fable.arima.ArimaModel;
import com.amazon.fable.arima.ArimaOrder;
import com.amazon.fable.baseline.MeanModel;
import com.amazon.fable.baseline.NaiveModel;
import com.amazon.fable.baseline.SeasonalNaiveModel;
import com.amazon.fable.config.ErrorType;
import com.amazon.fable.config.SeasonType;
import com.amazon.fable.config.TrendType;
import com.amazon.fable.ets.EtsModel;
import com.amazon.fable.ets.EtsParameters;
import com.amazon.fable.ets.EtsStructure;
import com.amazon.fable.model.IFittedModel;
import com.amazon.fable.series.TimeSeries;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelSpecification;

/**
 * Converts fitted models of every family to {@link FittedModelState} and back.
 * A restored model is rebuilt by filtering the stored series with the stored
 * coefficients, so its forecasts equal those of the original model. The
 * candidate lists of automatic searches are not kept.
 */
public class FittedModelMapper implements IStateMapper<IFittedModel, FittedModelState> {

    private final ModelSpecificationMapper specificationMapper = new ModelSpecificationMapper();

    private final TimeSeriesMapper seriesMapper = new TimeSeriesMapper();

    @Override
    public FittedModelState toState(IFittedModel model) {
        checkNotNull(model, "model must not be null");
        FittedModelState state = new FittedModelState();
        state.setFamily(model.getFamily().name());
        state.setSpecificationState(specificationMapper.toState(model.getSpecification()));
        state.setSeriesState(seriesMapper.toState(model.getSeries()));
        state.setStructure(model.getStructure());
        switch (model.getFamily()) {
        case ETS:
            saveEts((EtsModel) model, state);
            break;
        case ARIMA:
            saveArima((ArimaModel) model, state);
            break;
        case MEAN:
            MeanModel meanModel = (MeanModel) model;
            state.setMean(meanModel.getMean());
            state.setCount(meanModel.getCount());
            break;
        case NAIVE:
            NaiveModel naiveModel = (NaiveModel) model;
            state.setDrift(naiveModel.getDrift());
            state.setDifferences(naiveModel.getDifferences());
            break;
        case SNAIVE:
            state.setPeriod(((SeasonalNaiveModel) model).getLag());
            break;
        default:
            throw new IllegalStateException("unsupported family " + model.getFamily());
        }
        return state;
    }

    private static void saveEts(EtsModel model, FittedModelState state) {
        EtsStructure structure = model.getEtsStructure();
        EtsParameters parameters = model.getParameters();
        state.setErrorType(structure.getError().name());
        state.setTrendType(structure.getTrend().name());
        state.setSeasonType(structure.getSeason().name());
        state.setPeriod(model.getPeriod());
        state.setAlpha(parameters.getAlpha());
        state.setBeta(parameters.getBeta());
        state.setGamma(parameters.getGamma());
        state.setPhi(parameters.getPhi());
        state.setLevel(parameters.getLevel());
        state.setSlope(parameters.getSlope());
        state.setSeason(parameters.getSeason());
        state.setFreeParameters(model.getFreeParameters());
    }

    private static void saveArima(ArimaModel model, FittedModelState state) {
        ArimaOrder order = model.getOrder();
        state.setP(order.getP());
        state.setD(order.getD());
        state.setQ(order.getQ());
        state.setSeasonalP(order.getSeasonalP());
        state.setSeasonalD(order.getSeasonalD());
        state.setSeasonalQ(order.getSeasonalQ());
        state.setPeriod(order.getPeriod());
        state.setConstant(order.isConstant());
        state.setCoefficients(model.getCoefficients().toVector(order));
        state.setStandardErrors(model.getStandardErrors());
    }

    @Override
    public IFittedModel toModel(FittedModelState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(state.getFamily() != null, "family must be present");
        ModelFamily family = ModelFamily.valueOf(state.getFamily());
        ModelSpecification specification = specificationMapper.toModel(state.getSpecificationState());
        checkArgument(specification.getFamily() == family, "specification does not match the family");
        TimeSeries series = seriesMapper.toModel(state.getSeriesState());
        switch (family) {
        case ETS:
            EtsStructure structure = new EtsStructure(ErrorType.valueOf(state.getErrorType()),
                    TrendType.valueOf(state.getTrendType()), SeasonType.valueOf(state.getSeasonType()));
            EtsParameters parameters = new EtsParameters(state.getAlpha(), state.getBeta(), state.getGamma(),
                    state.getPhi(), state.getLevel(), state.getSlope(),
                    state.getSeason() == null ? new double[0] : state.getSeason());
            return EtsModel.fromParameters(specification, series, structure, state.getPeriod(), parameters,
                    state.getFreeParameters());
        case ARIMA:
            ArimaOrder order = new ArimaOrder(state.getP(), state.getD(), state.getQ(), state.getSeasonalP(),
                    state.getSeasonalD(), state.getSeasonalQ(), state.getPeriod(), state.isConstant());
            checkArgument(state.getCoefficients() != null, "coefficients must be present");
            double[] standardErrors = state.getStandardErrors() == null ? new double[0] : state.getStandardErrors();
            return ArimaModel.fromCoefficients(specification, series, order,
                    ArimaCoefficients.fromVector(order, state.getCoefficients()), standardErrors);
        case MEAN:
            return MeanModel.withMean(specification, series, state.getMean(), state.getCount());
        case NAIVE:
            return NaiveModel.withDrift(specification, series, state.getDrift(), state.getDifferences());
        case SNAIVE:
            return SeasonalNaiveModel.estimate(specification, series, state.getPeriod());
        default:
            throw new IllegalStateException("unsupported family " + family);
        }
    }
}
