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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestParams {

    @ParameterizedTest
    @ValueSource(strings = {"", "0", "false", "FALSE", "False"})
    public void testIsSetFalse(String value) {
        Assertions.assertFalse(Params.isSet(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "true", "yes", "out"})
    public void testIsSetTrue(String value) {
        Assertions.assertTrue(Params.isSet(value));
    }

    @Test
    public void testGetParamOrDefaultSetting() {
        String key = "RAPIDFABRIC_TEST_PARAM";
        Assertions.assertNull(Params.getParamValue(key));
        Assertions.assertEquals("dflt", Params.getParamOrDefaultSetting(key, "dflt"));
        System.setProperty(key, "value");
        try {
            Assertions.assertEquals("value", Params.getParamOrDefaultSetting(key, "dflt"));
            Assertions.assertTrue(Params.isParamSet(key));
        } finally {
            System.clearProperty(key);
        }
    }
}
