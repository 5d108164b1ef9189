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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Helpers to classify grid locations against the border of a fabric. The I/O
 * ring occupies the outermost rows and columns; the core grids start one
 * location inside it.
 */
public class FabricGridTools {

    /**
     * Finds the side of the fabric border a grid location sits on. When a corner
     * belongs to two sides, the first match in the order top, right, bottom, left
     * wins.
     * @param deviceSize Width and height of the fabric, in grid locations.
     * @param coordinate The grid location to classify.
     * @return The border side, or null if the location is not on the border.
     */
    @Nullable
    public static Side findGridBorderSide(@NotNull Coordinate deviceSize, @NotNull Coordinate coordinate) {
        checkInsideDevice(deviceSize, coordinate);
        if (deviceSize.getY() - 1 == coordinate.getY()) {
            return Side.TOP;
        }
        if (deviceSize.getX() - 1 == coordinate.getX()) {
            return Side.RIGHT;
        }
        if (0 == coordinate.getY()) {
            return Side.BOTTOM;
        }
        if (0 == coordinate.getX()) {
            return Side.LEFT;
        }
        return null;
    }

    /**
     * Checks if a core grid location is adjacent to the I/O ring on the given side.
     * @param deviceSize Width and height of the fabric, in grid locations.
     * @param coordinate The grid location to check.
     * @param borderSide The side of the fabric to check against.
     * @return True if the location is the core row/column next to that side.
     */
    public static boolean isCoreGridOnBorderSide(@NotNull Coordinate deviceSize,
                                                 @NotNull Coordinate coordinate,
                                                 @NotNull Side borderSide) {
        checkInsideDevice(deviceSize, coordinate);
        switch (borderSide) {
            case TOP:
                return coordinate.getY() == deviceSize.getY() - 2;
            case RIGHT:
                return coordinate.getX() == deviceSize.getX() - 2;
            case BOTTOM:
                return coordinate.getY() == 1;
            case LEFT:
                return coordinate.getX() == 1;
        }
        throw new IllegalStateException("ERROR: Unhandled side " + borderSide);
    }

    private static void checkInsideDevice(Coordinate deviceSize, Coordinate coordinate) {
        if (coordinate.getX() >= deviceSize.getX() || coordinate.getY() >= deviceSize.getY()) {
            throw new IllegalArgumentException("ERROR: Grid location " + coordinate
                    + " is outside of a device of size " + deviceSize);
        }
    }
}
