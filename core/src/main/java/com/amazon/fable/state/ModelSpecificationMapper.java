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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.fable.InvalidSpecException;
import com.amazon.fable.spec.ModelFamily;
import com.amazon.fable.spec.ModelOption;
import com.amazon.fable.spec.ModelSpecification;
import com.amazon.fable.spec.OptionDefinition;

public class ModelSpecificationMapper implements IStateMapper<ModelSpecification, ModelSpecificationState> {

    @Override
    public ModelSpecificationState toState(ModelSpecification specification) {
        checkNotNull(specification, "specification must not be null");
        Map<String, OptionDefinition<?>> definitions = specification.getFamily().getOptions();
        List<OptionState> options = new ArrayList<>();
        for (Map.Entry<String, ModelOption<?>> entry : specification.getOptions().entrySet()) {
            ModelOption<?> option = entry.getValue();
            String value = option.isAutomatic() ? null : definitions.get(entry.getKey()).format(option.getValue());
            options.add(new OptionState(entry.getKey(), option.isAutomatic(), value));
        }
        ModelSpecificationState state = new ModelSpecificationState();
        state.setFamily(specification.getFamily().name());
        state.setOptions(options);
        return state;
    }

    /**
     * @throws InvalidSpecException if the stored options are not valid
     */
    @Override
    public ModelSpecification toModel(ModelSpecificationState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(state.getFamily() != null, "family must be present");
        ModelFamily family = ModelFamily.valueOf(state.getFamily());
        Map<String, OptionDefinition<?>> definitions = family.getOptions();
        Map<String, ModelOption<?>> options = new LinkedHashMap<>();
        if (state.getOptions() != null) {
            for (OptionState option : state.getOptions()) {
                OptionDefinition<?> definition = definitions.get(option.getName());
                if (definition == null) {
                    throw new InvalidSpecException(family + " has no option '" + option.getName() + "'");
                }
                if (option.isAutomatic()) {
                    options.put(option.getName(), ModelOption.automatic());
                } else {
                    options.put(option.getName(), ModelOption.fixed(definition.parse(option.getValue())));
                }
            }
        }
        return ModelSpecification.of(family, options);
    }
}
