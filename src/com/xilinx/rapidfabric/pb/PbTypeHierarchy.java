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

package com.xilinx.rapidfabric.pb;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Arena holding the physical block types (pb_types) of an architecture and the
 * modes that nest them. Every node only records its parent: a pb_type knows the
 * mode it was declared in (none for a top-level pb_type), a mode knows the
 * pb_type it belongs to and so does a port. Children are never recorded, so the structure can only
 * be walked upwards.
 */
public class PbTypeHierarchy {

    private static final int NO_PARENT = -1;

    private final List<String> pbTypeNames = new ArrayList<>();

    private final List<Integer> pbTypeParentModes = new ArrayList<>();

    private final List<String> modeNames = new ArrayList<>();

    private final List<Integer> modeParentPbTypes = new ArrayList<>();

    private final List<String> portNames = new ArrayList<>();

    private final List<Integer> portParentPbTypes = new ArrayList<>();

    /**
     * Adds a top-level pb_type, e.g. the complex block of a grid tile.
     * @param name Name of the pb_type.
     * @return The id of the new pb_type.
     */
    public PbTypeId addRootPbType(@NotNull String name) {
        return addPbType(name, NO_PARENT);
    }

    /**
     * Adds a pb_type declared inside a mode.
     * @param parentMode The mode that contains the new pb_type.
     * @param name Name of the pb_type.
     * @return The id of the new pb_type.
     */
    public PbTypeId addChildPbType(@NotNull ModeId parentMode, @NotNull String name) {
        checkValid(parentMode);
        return addPbType(name, parentMode.getIndex());
    }

    /**
     * Adds a mode to a pb_type.
     * @param parentPbType The pb_type the mode belongs to.
     * @param name Name of the mode.
     * @return The id of the new mode.
     */
    public ModeId addMode(@NotNull PbTypeId parentPbType, @NotNull String name) {
        checkValid(parentPbType);
        modeNames.add(name);
        modeParentPbTypes.add(parentPbType.getIndex());
        return new ModeId(modeNames.size() - 1);
    }

    /**
     * Adds a port to a pb_type. Port names only need to be unique within their pb_type.
     * @param parentPbType The pb_type the port belongs to.
     * @param name Name of the port.
     * @return The id of the new port.
     */
    public PbTypePortId addPort(@NotNull PbTypeId parentPbType, @NotNull String name) {
        checkValid(parentPbType);
        portNames.add(name);
        portParentPbTypes.add(parentPbType.getIndex());
        return new PbTypePortId(portNames.size() - 1);
    }

    private PbTypeId addPbType(String name, int parentMode) {
        pbTypeNames.add(name);
        pbTypeParentModes.add(parentMode);
        return new PbTypeId(pbTypeNames.size() - 1);
    }

    @NotNull
    public String getPbTypeName(@NotNull PbTypeId pbType) {
        checkValid(pbType);
        return pbTypeNames.get(pbType.getIndex());
    }

    /**
     * Gets the mode a pb_type was declared in.
     * @param pbType The pb_type to query.
     * @return The parent mode, or null for a top-level pb_type.
     */
    @Nullable
    public ModeId getParentMode(@NotNull PbTypeId pbType) {
        checkValid(pbType);
        int parent = pbTypeParentModes.get(pbType.getIndex());
        return parent == NO_PARENT ? null : new ModeId(parent);
    }

    public boolean isRoot(@NotNull PbTypeId pbType) {
        return getParentMode(pbType) == null;
    }

    @NotNull
    public String getModeName(@NotNull ModeId mode) {
        checkValid(mode);
        return modeNames.get(mode.getIndex());
    }

    /**
     * Gets the pb_type owning a mode.
     * @param mode The mode to query.
     * @return The parent pb_type.
     */
    @NotNull
    public PbTypeId getParentPbType(@NotNull ModeId mode) {
        checkValid(mode);
        return new PbTypeId(modeParentPbTypes.get(mode.getIndex()));
    }

    @NotNull
    public String getPortName(@NotNull PbTypePortId port) {
        checkValid(port);
        return portNames.get(port.getIndex());
    }

    /**
     * Gets the pb_type owning a port.
     * @param port The port to query.
     * @return The parent pb_type.
     */
    @NotNull
    public PbTypeId getParentPbType(@NotNull PbTypePortId port) {
        checkValid(port);
        return new PbTypeId(portParentPbTypes.get(port.getIndex()));
    }

    public int getNumPbTypes() {
        return pbTypeNames.size();
    }

    public int getNumModes() {
        return modeNames.size();
    }

    public int getNumPorts() {
        return portNames.size();
    }

    private void checkValid(PbTypeId pbType) {
        if (pbType.getIndex() < 0 || pbType.getIndex() >= pbTypeNames.size()) {
            throw new IllegalArgumentException("ERROR: " + pbType + " does not belong to this hierarchy.");
        }
    }

    private void checkValid(ModeId mode) {
        if (mode.getIndex() < 0 || mode.getIndex() >= modeNames.size()) {
            throw new IllegalArgumentException("ERROR: " + mode + " does not belong to this hierarchy.");
        }
    }

    private void checkValid(PbTypePortId port) {
        if (port.getIndex() < 0 || port.getIndex() >= portNames.size()) {
            throw new IllegalArgumentException("ERROR: " + port + " does not belong to this hierarchy.");
        }
    }
}
