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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestMessageGenerator {

    @Test
    public void testFormatString() {
        Assertions.assertEquals("Title\n", MessageGenerator.formatString("Title"));
        String line = MessageGenerator.formatString("Verbose: ", true);
        Assertions.assertEquals(MessageGenerator.KEY_COLUMN_WIDTH + " true\n".length(), line.length());
        Assertions.assertTrue(line.startsWith("Verbose: "));
        Assertions.assertTrue(line.endsWith(" true\n"));
    }

    @Test
    public void testCreateHeader() {
        String[] lines = MessageGenerator.createHeader("Fabric 4x4").split("\n");
        Assertions.assertEquals(3, lines.length);
        Assertions.assertEquals(lines[0], lines[2]);
        Assertions.assertEquals(lines[0].length(), lines[1].length());
        Assertions.assertTrue(lines[1].contains("Fabric 4x4"));
    }

    @Test
    public void testMakeWhiteSpace() {
        Assertions.assertEquals("", MessageGenerator.makeWhiteSpace(0));
        Assertions.assertEquals("   ", MessageGenerator.makeWhiteSpace(3));
    }
}
