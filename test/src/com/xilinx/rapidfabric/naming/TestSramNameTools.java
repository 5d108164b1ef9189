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

import java.util.EnumMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.rapidfabric.circuit.CircuitModelId;
import com.xilinx.rapidfabric.circuit.CircuitModelType;
import com.xilinx.rapidfabric.circuit.SimpleCircuitLibrary;
import com.xilinx.rapidfabric.circuit.SpicePortType;
import com.xilinx.rapidfabric.circuit.SramOrganization;

public class TestSramNameTools {

    private SimpleCircuitLibrary lib;
    private CircuitModelId sram;

    @BeforeEach
    public void setUp() {
        lib = new SimpleCircuitLibrary();
        sram = lib.addModel("sram6t", CircuitModelType.SRAM);
    }

    private static Map<SpicePortType, String> getExpectedPortNames(SramOrganization orgz) {
        Map<SpicePortType, String> expected = new EnumMap<>(SpicePortType.class);
        switch (orgz) {
            case STANDALONE:
                expected.put(SpicePortType.INPUT, "sram6t_out");
                expected.put(SpicePortType.OUTPUT, "sram6t_outb");
                break;
            case SCAN_CHAIN:
                expected.put(SpicePortType.INPUT, "sram6t_ccff_head");
                expected.put(SpicePortType.OUTPUT, "sram6t_ccff_tail");
                break;
            case MEMORY_BANK:
                expected.put(SpicePortType.BL, "sram6t_bl");
                expected.put(SpicePortType.WL, "sram6t_wl");
                expected.put(SpicePortType.BLB, "sram6t_blb");
                expected.put(SpicePortType.WLB, "sram6t_wlb");
                break;
        }
        return expected;
    }

    private static Map<SpicePortType, String> getExpectedLocalPortNames(SramOrganization orgz) {
        Map<SpicePortType, String> expected = new EnumMap<>(SpicePortType.class);
        switch (orgz) {
            case STANDALONE:
            case MEMORY_BANK:
                expected.put(SpicePortType.INPUT, "sram6t_out_local_bus");
                expected.put(SpicePortType.OUTPUT, "sram6t_outb_local_bus");
                break;
            case SCAN_CHAIN:
                expected.put(SpicePortType.INPUT, "sram6t_ccff_in_local_bus");
                expected.put(SpicePortType.OUTPUT, "sram6t_ccff_out_local_bus");
                expected.put(SpicePortType.INOUT, "sram6t_ccff_outb_local_bus");
                break;
        }
        return expected;
    }

    @ParameterizedTest
    @EnumSource(SramOrganization.class)
    public void testGenerateSramPortName(SramOrganization orgz) {
        Map<SpicePortType, String> expected = getExpectedPortNames(orgz);
        for (SpicePortType portType : SpicePortType.values()) {
            if (expected.containsKey(portType)) {
                Assertions.assertEquals(expected.get(portType),
                        SramNameTools.generateSramPortName(lib, sram, orgz, portType));
            } else {
                NamingContractViolationException ex = Assertions.assertThrows(NamingContractViolationException.class,
                        () -> SramNameTools.generateSramPortName(lib, sram, orgz, portType));
                Assertions.assertTrue(ex.getMessage().contains(orgz.toString()));
                Assertions.assertTrue(ex.getMessage().endsWith(portType.toString()));
            }
        }
    }

    @ParameterizedTest
    @EnumSource(SramOrganization.class)
    public void testGenerateSramLocalPortName(SramOrganization orgz) {
        Map<SpicePortType, String> expected = getExpectedLocalPortNames(orgz);
        for (SpicePortType portType : SpicePortType.values()) {
            if (expected.containsKey(portType)) {
                Assertions.assertEquals(expected.get(portType),
                        SramNameTools.generateSramLocalPortName(lib, sram, orgz, portType));
            } else {
                Assertions.assertThrows(NamingContractViolationException.class,
                        () -> SramNameTools.generateSramLocalPortName(lib, sram, orgz, portType));
            }
        }
    }

    @Test
    public void testMemoryBankBitLine() {
        Assertions.assertEquals("sram6t_bl",
                SramNameTools.generateSramPortName(lib, sram, SramOrganization.MEMORY_BANK, SpicePortType.BL));
    }

    @Test
    public void testGenerateReservedSramPortName() {
        Assertions.assertEquals("reserved_blb", SramNameTools.generateReservedSramPortName(SpicePortType.BLB));
        Assertions.assertEquals("reserved_wl", SramNameTools.generateReservedSramPortName(SpicePortType.WL));
        for (SpicePortType portType : SpicePortType.values()) {
            if (portType == SpicePortType.BLB || portType == SpicePortType.WL) {
                continue;
            }
            Assertions.assertThrows(NamingContractViolationException.class,
                    () -> SramNameTools.generateReservedSramPortName(portType));
        }
    }

    @Test
    public void testGenerateFormalVerificationSramPortName() {
        Assertions.assertEquals("sram6t_out_fm", SramNameTools.generateFormalVerificationSramPortName(lib, sram));
    }

    @Test
    public void testGenerateLocalSramPortName() {
        Assertions.assertEquals("mem_3_out", SramNameTools.generateLocalSramPortName("mem", 3, SpicePortType.INPUT));
        Assertions.assertEquals("mem_3_outb", SramNameTools.generateLocalSramPortName("mem", 3, SpicePortType.OUTPUT));
        Assertions.assertThrows(NamingContractViolationException.class,
                () -> SramNameTools.generateLocalSramPortName("mem", 3, SpicePortType.WLB));
    }

    @Test
    public void testFixedTokens() {
        Assertions.assertEquals("ccff_head", SramNameTools.generateConfigurationChainHeadName());
        Assertions.assertEquals("ccff_tail", SramNameTools.generateConfigurationChainTailName());
        Assertions.assertEquals("mem_out", SramNameTools.generateConfigurationChainDataOutName());
        Assertions.assertEquals("mem_outb", SramNameTools.generateConfigurationChainInvertedDataOutName());
        Assertions.assertEquals("addr", SramNameTools.generateMuxLocalDecoderAddrPortName());
        Assertions.assertEquals("data", SramNameTools.generateMuxLocalDecoderDataPortName());
        Assertions.assertEquals("data_inv", SramNameTools.generateMuxLocalDecoderDataInvPortName());
        Assertions.assertEquals("config_bus", SramNameTools.generateLocalConfigBusPortName());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, -7})
    public void testGenerateLocalSramPortNameRejectsNegativeInstance(int negative) {
        Assertions.assertThrows(NamingContractViolationException.class,
                () -> SramNameTools.generateLocalSramPortName("mux_tree_size4", negative, SpicePortType.INPUT));
    }
}
