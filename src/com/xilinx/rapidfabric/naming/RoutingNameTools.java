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

import org.jetbrains.annotations.NotNull;

import com.xilinx.rapidfabric.device.Coordinate;
import com.xilinx.rapidfabric.device.PortDirection;
import com.xilinx.rapidfabric.device.RoutingResourceType;
import com.xilinx.rapidfabric.device.Side;

/**
 * Names of routing channels, switch blocks, connection blocks and their ports.
 * Routing blocks are addressed either by a grid coordinate or by a flat block
 * id. A given netlist uses only one of the two schemes.
 */
public class RoutingNameTools {

    public static final String SWITCH_BLOCK_PREFIX = "sb_";

    public static final String CONNECTION_BLOCK_PREFIX = "cb";

    /**
     * Gets the prefix of a routing channel.
     * @param chanType {@link RoutingResourceType#CHANX} or {@link RoutingResourceType#CHANY}.
     * @return "chanx" or "chany"
     */
    public static String getChannelPrefix(@NotNull RoutingResourceType chanType) {
        switch (chanType) {
            case CHANX:
                return "chanx";
            case CHANY:
                return "chany";
            default:
                throw new NamingContractViolationException("Invalid type of routing channel", chanType);
        }
    }

    private static String getConnectionBlockPrefix(RoutingResourceType cbType) {
        switch (cbType) {
            case CHANX:
                return CONNECTION_BLOCK_PREFIX + "x_";
            case CHANY:
                return CONNECTION_BLOCK_PREFIX + "y_";
            default:
                throw new NamingContractViolationException("Invalid type of connection block", cbType);
        }
    }

    private static String getPortDirectionToken(PortDirection portDirection) {
        switch (portDirection) {
            case IN_PORT:
                return "in_";
            case OUT_PORT:
                return "out_";
            default:
                throw new NamingContractViolationException("Invalid direction of routing track port", portDirection);
        }
    }

    /**
     * Generates the netlist name of a routing block (channel, connection block
     * or switch block) addressed by a unique block id.
     * @param prefix Prepended verbatim.
     * @param blockId Unique id of the block.
     * @param postfix Appended verbatim, may be empty.
     * @return prefix + blockId + postfix
     */
    public static String generateRoutingBlockNetlistName(@NotNull String prefix, int blockId, String postfix) {
        NameTools.checkNonNegative("routing block id", blockId);
        return NameTools.appendPostfix(prefix + blockId, postfix);
    }

    /**
     * Generates the netlist name of a routing block (channel, connection block
     * or switch block) addressed by its coordinate.
     * @param prefix Prepended verbatim.
     * @param coordinate Location of the block.
     * @param postfix Appended verbatim, may be empty.
     * @return prefix + x + "_" + y + postfix
     */
    public static String generateRoutingBlockNetlistName(@NotNull String prefix, @NotNull Coordinate coordinate,
                                                         String postfix) {
        return NameTools.appendPostfix(prefix + NameTools.coordinateToken(coordinate, NameTools.SEP), postfix);
    }

    public static String generateConnectionBlockNetlistName(@NotNull RoutingResourceType cbType,
                                                            @NotNull Coordinate coordinate, String postfix) {
        return generateRoutingBlockNetlistName(getConnectionBlockPrefix(cbType), coordinate, postfix);
    }

    /**
     * Generates the module name of a routing channel addressed by a unique block id.
     * @param chanType {@link RoutingResourceType#CHANX} or {@link RoutingResourceType#CHANY}.
     * @param blockId Unique id of the channel.
     * @return e.g. "chanx_12_"
     */
    public static String generateRoutingChannelModuleName(@NotNull RoutingResourceType chanType, int blockId) {
        NameTools.checkNonNegative("routing channel id", blockId);
        return getChannelPrefix(chanType) + NameTools.SEP + blockId + NameTools.SEP;
    }

    /**
     * Generates the module name of a routing channel at a given coordinate.
     * @param chanType {@link RoutingResourceType#CHANX} or {@link RoutingResourceType#CHANY}.
     * @param coordinate Location of the channel.
     * @return e.g. "chany_1_2_"
     */
    public static String generateRoutingChannelModuleName(@NotNull RoutingResourceType chanType,
                                                          @NotNull Coordinate coordinate) {
        return getChannelPrefix(chanType) + NameTools.SEP
                + NameTools.coordinateToken(coordinate, NameTools.SEP) + NameTools.SEP;
    }

    /**
     * Generates the port name of a routing track.
     * @param chanType {@link RoutingResourceType#CHANX} or {@link RoutingResourceType#CHANY}.
     * @param coordinate Location of the channel owning the track.
     * @param trackId Index of the track in the channel.
     * @param portDirection {@link PortDirection#IN_PORT} or {@link PortDirection#OUT_PORT}.
     * @return e.g. "chanx_1__0__in_4_"
     */
    public static String generateRoutingTrackPortName(@NotNull RoutingResourceType chanType,
                                                      @NotNull Coordinate coordinate, int trackId,
                                                      @NotNull PortDirection portDirection) {
        NameTools.checkNonNegative("track id", trackId);
        String portName = getTrackPortPrefix(chanType, coordinate);
        portName += getPortDirectionToken(portDirection);
        return portName + trackId + NameTools.SEP;
    }

    /**
     * Generates the port name of the mid-output of a routing track, which can
     * never clash with the in/out ports of the same track.
     * @param chanType {@link RoutingResourceType#CHANX} or {@link RoutingResourceType#CHANY}.
     * @param coordinate Location of the channel owning the track.
     * @param trackId Index of the track in the channel.
     * @return e.g. "chany_2__3__midout_0_"
     */
    public static String generateRoutingTrackMiddleOutputPortName(@NotNull RoutingResourceType chanType,
                                                                  @NotNull Coordinate coordinate, int trackId) {
        NameTools.checkNonNegative("track id", trackId);
        return getTrackPortPrefix(chanType, coordinate) + "midout_" + trackId + NameTools.SEP;
    }

    private static String getTrackPortPrefix(RoutingResourceType chanType, Coordinate coordinate) {
        return getChannelPrefix(chanType) + NameTools.SEP + NameTools.coordinateToken(coordinate)
                + NameTools.DOUBLE_SEP;
    }

    /**
     * Generates the module name of a switch block.
     * @param coordinate Location of the switch block.
     * @return e.g. "sb_3__5_"
     */
    public static String generateSwitchBlockModuleName(@NotNull Coordinate coordinate) {
        return SWITCH_BLOCK_PREFIX + NameTools.coordinateToken(coordinate) + NameTools.SEP;
    }

    /**
     * Generates the module name of a connection block.
     * @param cbType {@link RoutingResourceType#CHANX} or {@link RoutingResourceType#CHANY}.
     * @param coordinate Location of the connection block.
     * @return e.g. "cbx_1__0_"
     */
    public static String generateConnectionBlockModuleName(@NotNull RoutingResourceType cbType,
                                                           @NotNull Coordinate coordinate) {
        return getConnectionBlockPrefix(cbType) + NameTools.coordinateToken(coordinate) + NameTools.SEP;
    }

    /**
     * Generates the name of a grid pin port. Inside the top-level netlist the name
     * carries the grid location so pins of different grids never clash; inside a
     * grid module only the side, height and pin index are needed.
     * @param coordinate Location of the grid.
     * @param height Height offset of the pin inside a multi-row grid.
     * @param side Side of the grid the pin is on.
     * @param pinId Index of the pin.
     * @param forTopNetlist True when the name is used in the top-level netlist.
     * @return The port name.
     */
    public static String generateGridPortName(@NotNull Coordinate coordinate, int height, @NotNull Side side,
                                              int pinId, boolean forTopNetlist) {
        NameTools.checkNonNegative("grid pin height", height);
        NameTools.checkNonNegative("grid pin id", pinId);
        if (forTopNetlist) {
            StringBuilder sb = new StringBuilder("grid_");
            sb.append(NameTools.coordinateToken(coordinate));
            sb.append("__pin_");
            sb.append(height);
            sb.append(NameTools.DOUBLE_SEP);
            sb.append(side.getIndex());
            sb.append(NameTools.DOUBLE_SEP);
            sb.append(pinId);
            sb.append(NameTools.SEP);
            return sb.toString();
        }
        return side.getName() + "_height_" + height + "__pin_" + pinId + NameTools.SEP;
    }
}
