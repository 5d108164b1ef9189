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
import com.xilinx.rapidfabric.circuit.SpicePortType;
import com.xilinx.rapidfabric.circuit.SramOrganization;

/**
 * Names of configuration memory ports. The port names of an SRAM depend on the
 * {@link SramOrganization} of the fabric:
 * <pre>
 *  STANDALONE   : &lt;sram&gt;_out, &lt;sram&gt;_outb
 *  SCAN_CHAIN   : Head ---&gt;| CCFF |---&gt;| CCFF |---&gt;| CCFF |---&gt; Tail
 *  MEMORY_BANK  : &lt;sram&gt;_bl, &lt;sram&gt;_wl, &lt;sram&gt;_blb, &lt;sram&gt;_wlb
 * </pre>
 */
public class SramNameTools {

    public static final String CONFIGURATION_CHAIN_HEAD = "ccff_head";

    public static final String CONFIGURATION_CHAIN_TAIL = "ccff_tail";

    public static final String CONFIGURATION_CHAIN_DATA_OUT = "mem_out";

    public static final String CONFIGURATION_CHAIN_INVERTED_DATA_OUT = "mem_outb";

    public static final String MUX_LOCAL_DECODER_ADDR = "addr";

    public static final String MUX_LOCAL_DECODER_DATA = "data";

    public static final String MUX_LOCAL_DECODER_DATA_INV = "data_inv";

    public static final String LOCAL_CONFIG_BUS = "config_bus";

    public static String generateConfigurationChainHeadName() {
        return CONFIGURATION_CHAIN_HEAD;
    }

    public static String generateConfigurationChainTailName() {
        return CONFIGURATION_CHAIN_TAIL;
    }

    public static String generateConfigurationChainDataOutName() {
        return CONFIGURATION_CHAIN_DATA_OUT;
    }

    public static String generateConfigurationChainInvertedDataOutName() {
        return CONFIGURATION_CHAIN_INVERTED_DATA_OUT;
    }

    public static String generateMuxLocalDecoderAddrPortName() {
        return MUX_LOCAL_DECODER_ADDR;
    }

    public static String generateMuxLocalDecoderDataPortName() {
        return MUX_LOCAL_DECODER_DATA;
    }

    public static String generateMuxLocalDecoderDataInvPortName() {
        return MUX_LOCAL_DECODER_DATA_INV;
    }

    public static String generateLocalConfigBusPortName() {
        return LOCAL_CONFIG_BUS;
    }

    /**
     * Generates the name of a reserved BLB/WL port. These ports only exist in
     * fabrics built from resistive memories. The SRAM organization is not
     * checked here; callers check it when writing the ports.
     * @param portType {@link SpicePortType#BLB} or {@link SpicePortType#WL}.
     * @return "reserved_blb" or "reserved_wl"
     */
    public static String generateReservedSramPortName(@NotNull SpicePortType portType) {
        switch (portType) {
            case BLB:
                return "reserved_blb";
            case WL:
                return "reserved_wl";
            default:
                throw new NamingContractViolationException("Invalid type of reserved SRAM port", portType);
        }
    }

    /**
     * Generates the name of the SRAM port exposed for formal verification.
     * @param circuitLib The circuit library holding the model.
     * @param sramModel The memory cell model.
     * @return &lt;sram_name&gt;_out_fm
     */
    public static String generateFormalVerificationSramPortName(@NotNull CircuitLibrary circuitLib,
                                                                @NotNull CircuitModelId sramModel) {
        return circuitLib.getModelName(sramModel) + "_out_fm";
    }

    /**
     * Generates the name of an SRAM port in the port list of a module.
     * @param circuitLib The circuit library holding the model.
     * @param sramModel The memory cell model.
     * @param sramOrgzType The SRAM organization of the fabric.
     * @param portType The port kind, legal values depend on the organization.
     * @return The port name.
     * @throws NamingContractViolationException If the port kind does not exist in
     *         the given organization.
     */
    public static String generateSramPortName(@NotNull CircuitLibrary circuitLib, @NotNull CircuitModelId sramModel,
                                              @NotNull SramOrganization sramOrgzType,
                                              @NotNull SpicePortType portType) {
        String portName = circuitLib.getModelName(sramModel) + NameTools.SEP;
        switch (sramOrgzType) {
            case STANDALONE:
                // Regular output on INPUT, inverted output on OUTPUT
                switch (portType) {
                    case INPUT:
                        return portName + "out";
                    case OUTPUT:
                        return portName + "outb";
                    default:
                        break;
                }
                break;
            case SCAN_CHAIN:
                switch (portType) {
                    case INPUT:
                        return portName + CONFIGURATION_CHAIN_HEAD;
                    case OUTPUT:
                        return portName + CONFIGURATION_CHAIN_TAIL;
                    default:
                        break;
                }
                break;
            case MEMORY_BANK:
                switch (portType) {
                    case BL:
                        return portName + "bl";
                    case WL:
                        return portName + "wl";
                    case BLB:
                        return portName + "blb";
                    case WLB:
                        return portName + "wlb";
                    default:
                        break;
                }
                break;
        }
        throw invalidPortType(sramOrgzType, portType);
    }

    /**
     * Generates the name of an SRAM wire local to a module.
     * @param circuitLib The circuit library holding the model.
     * @param sramModel The memory cell model.
     * @param sramOrgzType The SRAM organization of the fabric.
     * @param portType The port kind, legal values depend on the organization.
     * @return The local bus name.
     * @throws NamingContractViolationException If the port kind does not exist in
     *         the given organization.
     */
    public static String generateSramLocalPortName(@NotNull CircuitLibrary circuitLib,
                                                   @NotNull CircuitModelId sramModel,
                                                   @NotNull SramOrganization sramOrgzType,
                                                   @NotNull SpicePortType portType) {
        String portName = circuitLib.getModelName(sramModel) + NameTools.SEP;
        switch (sramOrgzType) {
            case STANDALONE:
            case MEMORY_BANK:
                switch (portType) {
                    case INPUT:
                        return portName + "out_local_bus";
                    case OUTPUT:
                        return portName + "outb_local_bus";
                    default:
                        break;
                }
                break;
            case SCAN_CHAIN:
                // INOUT carries the inverted output of the chain
                switch (portType) {
                    case INPUT:
                        return portName + "ccff_in_local_bus";
                    case OUTPUT:
                        return portName + "ccff_out_local_bus";
                    case INOUT:
                        return portName + "ccff_outb_local_bus";
                    default:
                        break;
                }
                break;
        }
        throw invalidPortType(sramOrgzType, portType);
    }

    /**
     * Generates the name of a local wire connecting the SRAM ports of a circuit
     * instance. The name is the same for every SRAM organization.
     * @param portPrefix Name identifying the circuit, e.g. its module name.
     * @param instanceId Index of the instance inside the parent module.
     * @param portType {@link SpicePortType#INPUT} or {@link SpicePortType#OUTPUT}.
     * @return &lt;prefix&gt;_&lt;instance&gt;_out or &lt;prefix&gt;_&lt;instance&gt;_outb
     */
    public static String generateLocalSramPortName(@NotNull String portPrefix, int instanceId,
                                                   @NotNull SpicePortType portType) {
        NameTools.checkNonNegative("instance id", instanceId);
        String portName = portPrefix + NameTools.SEP + instanceId + NameTools.SEP;
        switch (portType) {
            case INPUT:
                return portName + "out";
            case OUTPUT:
                return portName + "outb";
            default:
                throw new NamingContractViolationException("Invalid type of local SRAM port", portType);
        }
    }

    private static NamingContractViolationException invalidPortType(SramOrganization sramOrgzType,
                                                                    SpicePortType portType) {
        return new NamingContractViolationException("Invalid SRAM port type for organization " + sramOrgzType,
                portType);
    }
}
