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

package com.xilinx.rapidfabric.netlist;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.rapidfabric.util.Params;

public class TestFabricNetlistOptions {

    @AfterEach
    public void clearProperties() {
        System.clearProperty(Params.RAPIDFABRIC_OUTPUT_DIR_NAME);
        System.clearProperty(Params.RAPIDFABRIC_VERBOSE_NAME);
    }

    @Test
    public void testDefaults() {
        FabricNetlistOptions options = new FabricNetlistOptions(null);
        Assertions.assertEquals(Params.RAPIDFABRIC_DEFAULT_OUTPUT_DIR, options.getOutputDirectory());
        Assertions.assertFalse(options.isSupportIcarusSimulator());
        Assertions.assertFalse(options.isIncludeTiming());
        Assertions.assertFalse(options.isIncludeSignalInit());
        Assertions.assertFalse(options.isExplicitPortMapping());
        Assertions.assertFalse(options.isCompressRouting());
        Assertions.assertFalse(options.isVerbose());
    }

    @Test
    public void testParseArguments() {
        FabricNetlistOptions options = new FabricNetlistOptions(new String[] {
                "--outputDirectory", "out/verilog",
                "--supportIcarusSimulator",
                "--includeTiming",
                "--includeSignalInit",
                "--explicitPortMapping",
                "--compressRouting",
                "--verbose",
        });
        Assertions.assertEquals("out/verilog", options.getOutputDirectory());
        Assertions.assertTrue(options.isSupportIcarusSimulator());
        Assertions.assertTrue(options.isIncludeTiming());
        Assertions.assertTrue(options.isIncludeSignalInit());
        Assertions.assertTrue(options.isExplicitPortMapping());
        Assertions.assertTrue(options.isCompressRouting());
        Assertions.assertTrue(options.isVerbose());
    }

    @Test
    public void testUnknownArgument() {
        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> new FabricNetlistOptions(new String[] {"--fast"}));
        Assertions.assertEquals("ERROR: Fabric netlist argument '--fast' not recognized.", ex.getMessage());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new FabricNetlistOptions(new String[] {"--outputDirectory"}));
    }

    @Test
    public void testDefaultsFromParams() {
        System.setProperty(Params.RAPIDFABRIC_OUTPUT_DIR_NAME, "netlists");
        System.setProperty(Params.RAPIDFABRIC_VERBOSE_NAME, "true");
        FabricNetlistOptions options = new FabricNetlistOptions(new String[0]);
        Assertions.assertEquals("netlists", options.getOutputDirectory());
        Assertions.assertTrue(options.isVerbose());

        System.setProperty(Params.RAPIDFABRIC_VERBOSE_NAME, "false");
        Assertions.assertFalse(new FabricNetlistOptions(null).isVerbose());
    }

    @Test
    public void testToString() {
        FabricNetlistOptions options = new FabricNetlistOptions(new String[] {"--includeTiming"});
        String s = options.toString();
        Assertions.assertTrue(s.startsWith("Fabric Netlist Options\n"));
        Assertions.assertTrue(s.contains("Include timing: "));
        Assertions.assertTrue(s.contains("true"));
    }
}
