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
import org.jetbrains.annotations.Nullable;

import com.xilinx.rapidfabric.device.Side;
import com.xilinx.rapidfabric.pb.ModeId;
import com.xilinx.rapidfabric.pb.PbTypeHierarchy;
import com.xilinx.rapidfabric.pb.PbTypeId;
import com.xilinx.rapidfabric.pb.PbTypePortId;

/**
 * Names of grid blocks, physical blocks and the top-level fabric.
 */
public class BlockNameTools {

    public static final String FPGA_TOP_MODULE_NAME = "fpga_top";

    public static String generateFpgaTopModuleName() {
        return FPGA_TOP_MODULE_NAME;
    }

    public static String generateFpgaTopNetlistName(String postfix) {
        return NameTools.appendPostfix(FPGA_TOP_MODULE_NAME, postfix);
    }

    /**
     * Generates the prefix of a grid block module. Blocks on the border of the
     * fabric carry the side they sit on.
     * @param prefix Prepended verbatim.
     * @param ioSide Border side of the block, or null for a core block.
     * @return prefix, followed by side + "_" for border blocks.
     */
    public static String generateGridBlockPrefix(@NotNull String prefix, @Nullable Side ioSide) {
        if (ioSide == null) {
            return prefix;
        }
        return prefix + ioSide.getName() + NameTools.SEP;
    }

    /**
     * Generates the netlist name of a grid block.
     * @param blockName Name of the physical block.
     * @param isBlockIo True for I/O blocks, which are named after their side.
     * @param ioSide Side of the I/O block, ignored for other blocks.
     * @param postfix Appended verbatim, may be empty.
     * @return e.g. "io_top.v" or "clb.v"
     */
    public static String generateGridBlockNetlistName(@NotNull String blockName, boolean isBlockIo,
                                                      @Nullable Side ioSide, String postfix) {
        String moduleName = blockName;
        if (isBlockIo) {
            if (ioSide == null) {
                throw new NamingContractViolationException("I/O block '" + blockName + "' requires a side", ioSide);
            }
            moduleName += NameTools.SEP + ioSide.getName();
        }
        return NameTools.appendPostfix(moduleName, postfix);
    }

    /**
     * Generates the module name of a grid block.
     * @param prefix Prepended verbatim.
     * @param blockName Name of the physical block.
     * @param isBlockIo True for I/O blocks, which are named after their side.
     * @param ioSide Side of the I/O block, ignored for other blocks.
     * @return prefix + grid block netlist name without postfix
     */
    public static String generateGridBlockModuleName(@NotNull String prefix, @NotNull String blockName,
                                                     boolean isBlockIo, @Nullable Side ioSide) {
        return prefix + generateGridBlockNetlistName(blockName, isBlockIo, ioSide, "");
    }

    /**
     * Generates the module name of a physical block. To keep the name unique
     * among all the pb_types of the architecture, the hierarchy is traced back to
     * the top-level pb_type and every parent pb_type and mode is added:
     * <pre>
     * &lt;top_pb_type&gt;_mode[&lt;mode&gt;]_&lt;parent_pb_type&gt;_ ... mode[&lt;mode&gt;]_&lt;pb_type&gt;
     * </pre>
     * A top-level pb_type has no mode around it, so a virtual mode named after the
     * pb_type itself is appended, e.g. "clb_mode[clb]". This keeps the shape of
     * the name the same for every level and makes it differ from the grid block
     * name.
     * @param prefix Prepended verbatim.
     * @param hierarchy The hierarchy owning the pb_type.
     * @param physicalPbType The pb_type to name.
     * @return The module name.
     */
    public static String generatePhysicalBlockModuleName(@NotNull String prefix, @NotNull PbTypeHierarchy hierarchy,
                                                         @NotNull PbTypeId physicalPbType) {
        StringBuilder moduleName = new StringBuilder(hierarchy.getPbTypeName(physicalPbType));
        PbTypeId parentPbType = physicalPbType;
        // Walk up until the top-level pb_type
        ModeId parentMode;
        while ((parentMode = hierarchy.getParentMode(parentPbType)) != null) {
            moduleName.insert(0, NameTools.modeToken(hierarchy.getModeName(parentMode)) + NameTools.SEP);
            parentPbType = hierarchy.getParentPbType(parentMode);
            moduleName.insert(0, hierarchy.getPbTypeName(parentPbType) + NameTools.SEP);
        }

        if (hierarchy.isRoot(physicalPbType)) {
            moduleName.append(NameTools.SEP).append(NameTools.modeToken(hierarchy.getPbTypeName(physicalPbType)));
        }
        return prefix + moduleName;
    }

    /**
     * Generates the module name of a physical block inside a grid, including the
     * border side of the grid.
     * @param prefix Prepended verbatim.
     * @param hierarchy The hierarchy owning the pb_type.
     * @param pbType The pb_type to name.
     * @param borderSide Border side of the grid, or null for a core grid.
     * @return The module name.
     */
    public static String generateGridPhysicalBlockModuleName(@NotNull String prefix,
                                                             @NotNull PbTypeHierarchy hierarchy,
                                                             @NotNull PbTypeId pbType,
                                                             @Nullable Side borderSide) {
        String moduleNamePrefix = generateGridBlockPrefix(prefix, borderSide);
        return generatePhysicalBlockModuleName(moduleNamePrefix, hierarchy, pbType);
    }

    /**
     * Generates the name of a pb_type port. The owning pb_type is prepended so
     * ports sharing a name on different pb_types stay distinct, e.g. "fle_in".
     * @param hierarchy The hierarchy owning the port.
     * @param port The port to name.
     * @return &lt;pb_type_name&gt;_&lt;port_name&gt;
     */
    public static String generatePbTypePortName(@NotNull PbTypeHierarchy hierarchy, @NotNull PbTypePortId port) {
        return hierarchy.getPbTypeName(hierarchy.getParentPbType(port)) + NameTools.SEP + hierarchy.getPortName(port);
    }
}
