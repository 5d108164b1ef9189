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

import com.xilinx.rapidfabric.circuit.CircuitLibrary;
import com.xilinx.rapidfabric.circuit.CircuitModelId;
import com.xilinx.rapidfabric.circuit.CircuitModelType;
import com.xilinx.rapidfabric.circuit.GateType;
import com.xilinx.rapidfabric.circuit.SpicePortType;

/**
 * Names of the sub-circuits built from circuit models: multiplexers and their
 * branches, local decoders, memories, wire segments and constant drivers.
 * These names are shared by the Verilog and SPICE writers.
 */
public class CircuitModelNameTools {

    /**
     * Generates the node name inside a multiplexing structure, e.g. "mux_l2_in".
     * A node followed by an intermediate buffer gets an extra "_buf".
     * @param nodeLevel Level of the node in the multiplexer tree.
     * @param addBufferPostfix True if an intermediate buffer follows the node.
     * @return The node name.
     */
    public static String generateMuxNodeName(int nodeLevel, boolean addBufferPostfix) {
        NameTools.checkNonNegative("multiplexer node level", nodeLevel);
        String nodeName = "mux_l" + nodeLevel + "_in";
        if (addBufferPostfix) {
            nodeName += "_buf";
        }
        return nodeName;
    }

    /**
     * Generates the instance name of a branch inside a multiplexing structure,
     * e.g. "mux_l1_in_3".
     * @param nodeLevel Level of the branch in the multiplexer tree.
     * @param nodeIndexAtLevel Index of the branch among those of the same level.
     * @param addBufferPostfix True if an intermediate buffer follows the branch.
     * @return The instance name.
     */
    public static String generateMuxBranchInstanceName(int nodeLevel, int nodeIndexAtLevel,
                                                       boolean addBufferPostfix) {
        NameTools.checkNonNegative("multiplexer node level", nodeLevel);
        NameTools.checkNonNegative("multiplexer node index", nodeIndexAtLevel);
        String instanceName = "mux_l" + nodeLevel + "_in_" + nodeIndexAtLevel;
        if (addBufferPostfix) {
            instanceName += "_buf";
        }
        return instanceName;
    }

    /**
     * Generates the module name of a multiplexer.
     * Multiplexers are named &lt;model_name&gt;_size&lt;num_inputs&gt;, look-up tables
     * are named &lt;model_name&gt;_mux.
     * @param circuitLib The circuit library holding the model.
     * @param model A model of type {@link CircuitModelType#MUX} or {@link CircuitModelType#LUT}.
     * @param muxSize Number of inputs of the multiplexer.
     * @param postfix Appended verbatim, may be empty.
     * @return The module name.
     * @throws NamingContractViolationException If the model is neither a MUX nor a LUT.
     */
    public static String generateMuxSubcktName(@NotNull CircuitLibrary circuitLib, @NotNull CircuitModelId model,
                                               int muxSize, String postfix) {
        NameTools.checkNonNegative("multiplexer size", muxSize);
        String moduleName = circuitLib.getModelName(model);
        CircuitModelType type = circuitLib.getModelType(model);
        switch (type) {
            case MUX:
                moduleName += "_size" + muxSize;
                break;
            case LUT:
                moduleName += "_mux";
                break;
            default:
                throw new NamingContractViolationException("Circuit model '" + moduleName
                        + "' is not a multiplexer or a look-up table, got type", type);
        }
        return NameTools.appendPostfix(moduleName, postfix);
    }

    /**
     * Generates the module name of a branch of a multiplexer. When the branches
     * are implemented by a MUX2 standard cell, the cell name is used as is.
     * @param circuitLib The circuit library holding the model.
     * @param model The multiplexer or look-up table model.
     * @param muxSize Number of inputs of the whole multiplexer.
     * @param branchMuxSize Number of inputs of the branch.
     * @param postfix Appended before the branch size, may be empty.
     * @return The module name of the branch.
     */
    public static String generateMuxBranchSubcktName(@NotNull CircuitLibrary circuitLib,
                                                     @NotNull CircuitModelId model,
                                                     int muxSize, int branchMuxSize, String postfix) {
        NameTools.checkNonNegative("multiplexer size", muxSize);
        NameTools.checkNonNegative("multiplexer branch size", branchMuxSize);
        CircuitModelId subcktModel = circuitLib.getPassGateLogicModel(model);
        if (subcktModel != null && circuitLib.getModelType(subcktModel) == CircuitModelType.GATE) {
            GateType gateType = circuitLib.getGateType(subcktModel);
            if (gateType != GateType.MUX2) {
                throw new NamingContractViolationException("Pass-gate logic '"
                        + circuitLib.getModelName(subcktModel) + "' of '" + circuitLib.getModelName(model)
                        + "' must be a MUX2 gate, got gate type", gateType);
            }
            return circuitLib.getModelName(subcktModel);
        }
        String branchPostfix = (postfix == null ? "" : postfix) + "_size" + branchMuxSize;
        return generateMuxSubcktName(circuitLib, model, muxSize, branchPostfix);
    }

    /**
     * Generates the module name of the local decoder of a multiplexer, e.g. "decoder3to8".
     * @param addrSize Width of the address port.
     * @param dataSize Width of the data port.
     * @return The module name.
     */
    public static String generateMuxLocalDecoderSubcktName(int addrSize, int dataSize) {
        NameTools.checkNonNegative("decoder address size", addrSize);
        NameTools.checkNonNegative("decoder data size", dataSize);
        return "decoder" + addrSize + "to" + dataSize;
    }

    /**
     * Generates the module name of a routing track wire.
     * @param wireModelName Name of the wire circuit model.
     * @param segmentId Index of the segment type.
     * @return The module name.
     */
    public static String generateSegmentWireSubcktName(@NotNull String wireModelName, int segmentId) {
        NameTools.checkNonNegative("segment id", segmentId);
        return wireModelName + "_seg" + segmentId;
    }

    /**
     * Generates the port name of the mid-output of a routing track wire, the tap
     * wired to a connection block multiplexer.
     * <pre>
     *                 +------------------------------+
     *                 | Connection block multiplexer |
     *                 +------------------------------+
     *                               ^
     *                               |  mid-output        +--------------
     *             +--------------------+                 |
     *   input --->| Routing track wire |---------------->| Switch Block
     *             +--------------------+   output        +--------------
     * </pre>
     * @param regularOutputName Name of the regular output port of the wire.
     * @return The mid-output port name.
     */
    public static String generateSegmentWireMidOutputName(@NotNull String regularOutputName) {
        return "mid_" + regularOutputName;
    }

    /**
     * Generates the module name of the memory block of a circuit model.
     * @param circuitLib The circuit library holding the models.
     * @param model The circuit model being configured.
     * @param sramModel The memory cell model.
     * @param postfix Appended verbatim, may be empty.
     * @return &lt;model_name&gt;_&lt;sram_name&gt;&lt;postfix&gt;
     */
    public static String generateMemoryModuleName(@NotNull CircuitLibrary circuitLib,
                                                  @NotNull CircuitModelId model,
                                                  @NotNull CircuitModelId sramModel, String postfix) {
        String moduleName = circuitLib.getModelName(model) + NameTools.SEP + circuitLib.getModelName(sramModel);
        return NameTools.appendPostfix(moduleName, postfix);
    }

    /**
     * Generates the name of the bus port gathering the datapath inputs of one
     * multiplexer instance.
     * @param circuitLib The circuit library holding the model.
     * @param muxModel The multiplexer model.
     * @param muxSize Number of inputs of the multiplexer.
     * @param muxInstanceId Index of the instance inside the parent module.
     * @return The bus port name.
     */
    public static String generateMuxInputBusPortName(@NotNull CircuitLibrary circuitLib,
                                                     @NotNull CircuitModelId muxModel,
                                                     int muxSize, int muxInstanceId) {
        NameTools.checkNonNegative("multiplexer instance id", muxInstanceId);
        String postfix = NameTools.SEP + muxInstanceId + "_inbus";
        return generateMuxSubcktName(circuitLib, muxModel, muxSize, postfix);
    }

    /**
     * Generates the name of a local bus wired to the configuration ports of a multiplexer.
     * @param circuitLib The circuit library holding the model.
     * @param muxModel The multiplexer model.
     * @param muxSize Number of inputs of the multiplexer.
     * @param busId Index of the bus.
     * @param inverted True for the bus carrying inverted configuration bits.
     * @return The bus port name.
     */
    public static String generateMuxConfigBusPortName(@NotNull CircuitLibrary circuitLib,
                                                      @NotNull CircuitModelId muxModel,
                                                      int muxSize, int busId, boolean inverted) {
        NameTools.checkNonNegative("configuration bus id", busId);
        String postfix = "_configbus" + busId;
        if (inverted) {
            postfix += "_b";
        }
        return generateMuxSubcktName(circuitLib, muxModel, muxSize, postfix);
    }

    /**
     * Generates the name of a local wire connecting the SRAM ports of a
     * multiplexer instance. The name is the same for every SRAM organization.
     * @param circuitLib The circuit library holding the model.
     * @param muxModel The multiplexer model.
     * @param muxSize Number of inputs of the multiplexer.
     * @param muxInstanceId Index of the instance inside the parent module.
     * @param portType {@link SpicePortType#INPUT} or {@link SpicePortType#OUTPUT}.
     * @return The wire name.
     */
    public static String generateMuxSramPortName(@NotNull CircuitLibrary circuitLib,
                                                 @NotNull CircuitModelId muxModel,
                                                 int muxSize, int muxInstanceId,
                                                 @NotNull SpicePortType portType) {
        String prefix = generateMuxSubcktName(circuitLib, muxModel, muxSize, "");
        return SramNameTools.generateLocalSramPortName(prefix, muxInstanceId, portType);
    }

    /**
     * Generates the name of a global I/O port of the fabric driven by a circuit model.
     * @param prefix Prepended verbatim.
     * @param circuitLib The circuit library holding the model.
     * @param model The circuit model owning the global port.
     * @return prefix + model name
     */
    public static String generateFpgaGlobalIoPortName(@NotNull String prefix, @NotNull CircuitLibrary circuitLib,
                                                      @NotNull CircuitModelId model) {
        return prefix + circuitLib.getModelName(model);
    }

    /**
     * Generates the module name of a constant driver.
     * @param constValue Logic value of the constant, 0 or 1.
     * @return "const0" or "const1"
     * @throws NamingContractViolationException If the value is not 0 or 1.
     */
    public static String generateConstValueModuleName(int constValue) {
        if (constValue != 0 && constValue != 1) {
            throw new NamingContractViolationException("Invalid constant logic value", constValue);
        }
        return "const" + constValue;
    }

    /**
     * Generates the output port name of a constant driver, which is the module name itself.
     * @param constValue Logic value of the constant, 0 or 1.
     * @return "const0" or "const1"
     */
    public static String generateConstValueModuleOutputPortName(int constValue) {
        return generateConstValueModuleName(constValue);
    }
}
