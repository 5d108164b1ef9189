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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only view of the circuit models of an architecture. The naming tools
 * only ever query a library; implementations must be safe to read from many
 * threads as long as nobody modifies them concurrently.
 */
public interface CircuitLibrary {

    /**
     * Gets the name of a circuit model.
     * @param model The model to query.
     * @return The name as declared in the architecture.
     */
    @NotNull
    public String getModelName(@NotNull CircuitModelId model);

    /**
     * Gets the kind of a circuit model.
     * @param model The model to query.
     * @return The model type.
     */
    @NotNull
    public CircuitModelType getModelType(@NotNull CircuitModelId model);

    /**
     * Gets the model implementing the pass-gate logic (branches) of a multiplexer
     * or look-up table.
     * @param model The multiplexer or look-up table model.
     * @return The pass-gate logic model, or null if none was bound.
     */
    @Nullable
    public CircuitModelId getPassGateLogicModel(@NotNull CircuitModelId model);

    /**
     * Gets the logic function of a gate model.
     * @param model A model of type {@link CircuitModelType#GATE}.
     * @return The gate type, or null if the model is not a gate.
     */
    @Nullable
    public GateType getGateType(@NotNull CircuitModelId model);
}
