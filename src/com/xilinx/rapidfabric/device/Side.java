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

package com.xilinx.rapidfabric.device;

/**
 * The four sides of a grid location or of the whole fabric. The declaration
 * order is significant: {@link #getIndex()} is embedded in top-level grid
 * port names.
 */
public enum Side {
    TOP("top"),
    RIGHT("right"),
    BOTTOM("bottom"),
    LEFT("left");

    private final String name;

    Side(String name) {
        this.name = name;
    }

    /**
     * Gets the canonical short name of this side, as used inside identifiers.
     * @return The lower case name, e.g. "top".
     */
    public String getName() {
        return name;
    }

    /**
     * Gets the numeric index of this side (top=0, right=1, bottom=2, left=3).
     * @return The index of the side.
     */
    public int getIndex() {
        return ordinal();
    }

    @Override
    public String toString() {
        return name;
    }
}
