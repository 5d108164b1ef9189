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

package com.xilinx.rapidfabric.util;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.xilinx.rapidfabric.device.Coordinate;
import com.xilinx.rapidfabric.device.FabricGridTools;
import com.xilinx.rapidfabric.device.RoutingResourceType;
import com.xilinx.rapidfabric.device.Side;
import com.xilinx.rapidfabric.naming.BlockNameTools;
import com.xilinx.rapidfabric.naming.NamingContractViolationException;
import com.xilinx.rapidfabric.naming.RoutingNameTools;
import com.xilinx.rapidfabric.netlist.FabricNetlistOptions;

/**
 * Prints the module names of a homogeneous fabric: an I/O ring around a core of
 * logic blocks, with a switch block at every channel intersection.
 */
public class FabricNamePrinter {

    public static final String IO_BLOCK_NAME = "io";

    public static final String LOGIC_BLOCK_NAME = "clb";

    public static final String GRID_PREFIX = "grid_";

    public static final String VERILOG_EXTENSION = ".v";

    /**
     * Creates the lines of the report for a fabric.
     * @param deviceSize Width and height of the fabric including the I/O ring,
     *        at least 3x3.
     * @param options Writer options, used to locate the netlist files.
     * @return The lines of the report.
     */
    public static List<String> createReport(Coordinate deviceSize, FabricNetlistOptions options) {
        if (deviceSize.getX() < 3 || deviceSize.getY() < 3) {
            throw new IllegalArgumentException("ERROR: A fabric needs at least 3x3 grids, got " + deviceSize);
        }
        List<String> lines = new ArrayList<>();
        lines.add("top: " + BlockNameTools.generateFpgaTopModuleName() + " -> "
                + getNetlistPath(options, BlockNameTools.generateFpgaTopNetlistName(VERILOG_EXTENSION)));

        for (int x = 0; x < deviceSize.getX(); x++) {
            for (int y = 0; y < deviceSize.getY(); y++) {
                Coordinate c = Coordinate.of(x, y);
                Side side = FabricGridTools.findGridBorderSide(deviceSize, c);
                if (isCorner(deviceSize, c)) {
                    continue;
                }
                String moduleName = side == null
                        ? BlockNameTools.generateGridBlockModuleName(GRID_PREFIX, LOGIC_BLOCK_NAME, false, null)
                        : BlockNameTools.generateGridBlockModuleName(GRID_PREFIX, IO_BLOCK_NAME, true, side);
                lines.add("grid " + c + ": " + moduleName);
            }
        }

        for (int x = 0; x < deviceSize.getX() - 1; x++) {
            for (int y = 0; y < deviceSize.getY() - 1; y++) {
                Coordinate c = Coordinate.of(x, y);
                lines.add("sb " + c + ": " + RoutingNameTools.generateSwitchBlockModuleName(c) + " -> "
                        + getNetlistPath(options, RoutingNameTools.generateRoutingBlockNetlistName(
                                RoutingNameTools.SWITCH_BLOCK_PREFIX, c, VERILOG_EXTENSION)));
            }
        }

        for (RoutingResourceType chanType : Arrays.asList(RoutingResourceType.CHANX, RoutingResourceType.CHANY)) {
            int minX = chanType == RoutingResourceType.CHANX ? 1 : 0;
            int minY = chanType == RoutingResourceType.CHANY ? 1 : 0;
            for (int x = minX; x < deviceSize.getX() - 1; x++) {
                for (int y = minY; y < deviceSize.getY() - 1; y++) {
                    Coordinate c = Coordinate.of(x, y);
                    lines.add("cb " + c + ": " + RoutingNameTools.generateConnectionBlockModuleName(chanType, c)
                            + " -> " + getNetlistPath(options,
                                RoutingNameTools.generateConnectionBlockNetlistName(chanType, c, VERILOG_EXTENSION)));
                    lines.add("chan " + c + ": " + RoutingNameTools.generateRoutingChannelModuleName(chanType, c));
                }
            }
        }
        return lines;
    }

    private static boolean isCorner(Coordinate deviceSize, Coordinate c) {
        boolean onXBorder = c.getX() == 0 || c.getX() == deviceSize.getX() - 1;
        boolean onYBorder = c.getY() == 0 || c.getY() == deviceSize.getY() - 1;
        return onXBorder && onYBorder;
    }

    private static String getNetlistPath(FabricNetlistOptions options, String netlistName) {
        return options.getOutputDirectory() + File.separator + netlistName;
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            MessageGenerator.briefMessage("USAGE: <width> <height> [--outputDirectory <dir>] [--verbose] ...");
            return;
        }
        try {
            Coordinate deviceSize = Coordinate.of(Integer.parseInt(args[0]), Integer.parseInt(args[1]));
            FabricNetlistOptions options = new FabricNetlistOptions(Arrays.copyOfRange(args, 2, args.length));
            MessageGenerator.printHeader("Fabric " + deviceSize.getX() + "x" + deviceSize.getY());
            if (options.isVerbose()) {
                MessageGenerator.briefMessage(options.toString());
            }
            for (String line : createReport(deviceSize, options)) {
                MessageGenerator.briefMessage(line);
            }
        } catch (NamingContractViolationException | IllegalArgumentException e) {
            MessageGenerator.briefErrorAndExit(e.getMessage());
        }
    }
}
