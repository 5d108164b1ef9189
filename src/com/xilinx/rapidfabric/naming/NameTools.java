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

package com.xilinx.rapidfabric.naming;

import com.xilinx.rapidfabric.device.Coordinate;

/**
 * Low-level formatting rules shared by all naming tools. Numbers are rendered
 * in decimal without padding and tokens are glued with fixed separators.
 */
public class NameTools {

    /** Separator between two tokens of a name */
    public static final String SEP = "_";

    /** Separator between the components of a coordinate in module and port names */
    public static final String DOUBLE_SEP = "__";

    /**
     * Appends a postfix verbatim. A null or empty postfix leaves the name unchanged.
     * @param name The name to extend.
     * @param postfix The postfix to add, may be null.
     * @return The extended name.
     */
    public static String appendPostfix(String name, String postfix) {
        if (postfix == null || postfix.isEmpty()) {
            return name;
        }
        return name + postfix;
    }

    /**
     * Checks that a numeric descriptor (size, index, level, id) can be rendered
     * into an identifier.
     * @param what Name of the descriptor, reported in the error.
     * @param value The value to check.
     * @return The value, unchanged.
     * @throws NamingContractViolationException If the value is negative.
     */
    public static int checkNonNegative(String what, int value) {
        if (value < 0) {
            throw new NamingContractViolationException("Negative " + what + " cannot be part of a name", value);
        }
        return value;
    }

    /**
     * Renders a coordinate as "x" + separator + "y".
     * @param coordinate The coordinate to render.
     * @param separator The separator between x and y.
     * @return The rendered coordinate.
     */
    public static String coordinateToken(Coordinate coordinate, String separator) {
        return coordinate.getX() + separator + coordinate.getY();
    }

    /**
     * Renders a coordinate with the double separator used by block modules and
     * routing ports, e.g. "3__5".
     * @param coordinate The coordinate to render.
     * @return The rendered coordinate.
     */
    public static String coordinateToken(Coordinate coordinate) {
        return coordinateToken(coordinate, DOUBLE_SEP);
    }

    /**
     * Wraps a mode name into the token used by physical block module names.
     * @param modeName Name of the mode.
     * @return "mode[" + modeName + "]"
     */
    public static String modeToken(String modeName) {
        return "mode[" + modeName + "]";
    }
}
