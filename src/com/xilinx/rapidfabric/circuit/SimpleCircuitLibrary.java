/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidFabric.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.rapidfabric.circuit;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An in-memory {@link CircuitLibrary}. Models are stored in parallel lists and
 * addressed by the index wrapped in their {@link CircuitModelId}. The library
 * is populated once by the architecture loader and then only read.
 */
public class SimpleCircuitLibrary implements CircuitLibrary {

    private final List<String> names = new ArrayList<>();

    private final List<CircuitModelType> types = new ArrayList<>();

    private final List<CircuitModelId> passGateLogicModels = new ArrayList<>();

    private final List<GateType> gateTypes = new ArrayList<>();

    /**
     * Adds a new circuit model to the library.
     * @param name Name of the model, must be unique in the library.
     * @param type Kind of the model.
     * @return The id of the new model.
     */
    public CircuitModelId addModel(@NotNull String name, @NotNull CircuitModelType type) {
        if (names.contains(name)) {
            throw new IllegalArgumentException("ERROR: Circuit model '" + name + "' already exists in the library.");
        }
        names.add(name);
        types.add(type);
        passGateLogicModels.add(null);
        gateTypes.add(null);
        return new CircuitModelId(names.size() - 1);
    }

    /**
     * Adds a new gate model to the library.
     * @param name Name of the model, must be unique in the library.
     * @param gateType Logic function of the gate.
     * @return The id of the new model.
     */
    public CircuitModelId addGateModel(@NotNull String name, @NotNull GateType gateType) {
        CircuitModelId id = addModel(name, CircuitModelType.GATE);
        gateTypes.set(id.getIndex(), gateType);
        return id;
    }

    /**
     * Binds the model that implements the branches of a multiplexer or look-up table.
     * @param model The multiplexer or look-up table.
     * @param passGateLogicModel The model used for its branches.
     */
    public void setPassGateLogicModel(@NotNull CircuitModelId model, @NotNull CircuitModelId passGateLogicModel) {
        checkValid(model);
        checkValid(passGateLogicModel);
        CircuitModelType type = types.get(model.getIndex());
        if (type != CircuitModelType.MUX && type != CircuitModelType.LUT) {
            throw new IllegalArgumentException("ERROR: Circuit model '" + getModelName(model)
                    + "' of type " + type + " cannot have a pass-gate logic model.");
        }
        passGateLogicModels.set(model.getIndex(), passGateLogicModel);
    }

    /**
     * Finds a model by its name.
     * @param name Name of the model.
     * @return The id of the model, or null if no model has that name.
     */
    @Nullable
    public CircuitModelId getModel(String name) {
        int index = names.indexOf(name);
        return index < 0 ? null : new CircuitModelId(index);
    }

    public int getNumModels() {
        return names.size();
    }

    @NotNull
    @Override
    public String getModelName(@NotNull CircuitModelId model) {
        checkValid(model);
        return names.get(model.getIndex());
    }

    @NotNull
    @Override
    public CircuitModelType getModelType(@NotNull CircuitModelId model) {
        checkValid(model);
        return types.get(model.getIndex());
    }

    @Nullable
    @Override
    public CircuitModelId getPassGateLogicModel(@NotNull CircuitModelId model) {
        checkValid(model);
        return passGateLogicModels.get(model.getIndex());
    }

    @Nullable
    @Override
    public GateType getGateType(@NotNull CircuitModelId model) {
        checkValid(model);
        return gateTypes.get(model.getIndex());
    }

    private void checkValid(CircuitModelId model) {
        if (model.getIndex() < 0 || model.getIndex() >= names.size()) {
            throw new IllegalArgumentException("ERROR: " + model + " does not belong to this library of "
                    + names.size() + " models.");
        }
    }
}
