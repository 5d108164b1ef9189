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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.rapidfabric.device.Coordinate;
import com.xilinx.rapidfabric.netlist.FabricNetlistOptions;

public class TestFabricNamePrinter {

    @Test
    public void testCreateReport() {
        FabricNetlistOptions options = new FabricNetlistOptions(new String[] {"--outputDirectory", "out"});
        List<String> lines = FabricNamePrinter.createReport(Coordinate.of(4, 4), options);

        Assertions.assertEquals("top: fpga_top -> out" + File.separator + "fpga_top.v", lines.get(0));
        Assertions.assertTrue(lines.contains("grid (1,1): grid_clb"));
        Assertions.assertTrue(lines.contains("grid (0,1): grid_io_left"));
        Assertions.assertTrue(lines.contains("grid (1,3): grid_io_top"));
        Assertions.assertTrue(lines.contains("sb (0,0): sb_0__0_ -> out" + File.separator + "sb_0_0.v"));
        Assertions.assertTrue(lines.contains("cb (1,0): cbx_1__0_ -> out" + File.separator + "cbx_1_0.v"));
        Assertions.assertTrue(lines.contains("chan (0,1): chany_0_1_"));

        // Corners hold no grid
        for (String line : lines) {
            Assertions.assertFalse(line.startsWith("grid (0,0)"));
        }
        // Every line is a distinct block
        Set<String> unique = new HashSet<>(lines);
        Assertions.assertEquals(lines.size(), unique.size());
        // 1 top + 12 grids + 9 switch blocks + 2 * 6 connection blocks and channels
        Assertions.assertEquals(1 + 12 + 9 + 12 + 12, lines.size());
    }

    @Test
    public void testTooSmallFabric() {
        FabricNetlistOptions options = new FabricNetlistOptions(null);
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> FabricNamePrinter.createReport(Coordinate.of(2, 5), options));
    }
}
