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

package com.xilinx.rapidfabric.circuit;

import java.lang.reflect.Modifier;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestSimpleCircuitLibrary {

    @Test
    public void testAddAndQueryModels() {
        SimpleCircuitLibrary lib = new SimpleCircuitLibrary();
        CircuitModelId mux = lib.addModel("mux_tree", CircuitModelType.MUX);
        CircuitModelId mux2 = lib.addGateModel("MUX2X1", GateType.MUX2);
        lib.setPassGateLogicModel(mux, mux2);

        Assertions.assertEquals(2, lib.getNumModels());
        Assertions.assertEquals("mux_tree", lib.getModelName(mux));
        Assertions.assertEquals(CircuitModelType.MUX, lib.getModelType(mux));
        Assertions.assertEquals(CircuitModelType.GATE, lib.getModelType(mux2));
        Assertions.assertEquals(GateType.MUX2, lib.getGateType(mux2));
        Assertions.assertNull(lib.getGateType(mux));
        Assertions.assertEquals(mux2, lib.getPassGateLogicModel(mux));
        Assertions.assertNull(lib.getPassGateLogicModel(mux2));
        Assertions.assertEquals(mux, lib.getModel("mux_tree"));
        Assertions.assertNull(lib.getModel("missing"));
    }

    @Test
    public void testDuplicateNameIsRejected() {
        SimpleCircuitLibrary lib = new SimpleCircuitLibrary();
        lib.addModel("sram6t", CircuitModelType.SRAM);
        RuntimeException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> lib.addModel("sram6t", CircuitModelType.SRAM));
        Assertions.assertEquals("ERROR: Circuit model 'sram6t' already exists in the library.", ex.getMessage());
    }

    @Test
    public void testPassGateLogicOnlyForMuxAndLut() {
        SimpleCircuitLibrary lib = new SimpleCircuitLibrary();
        CircuitModelId sram = lib.addModel("sram6t", CircuitModelType.SRAM);
        CircuitModelId tgate = lib.addModel("tgate", CircuitModelType.PASSGATE);
        Assertions.assertThrows(IllegalArgumentException.class, () -> lib.setPassGateLogicModel(sram, tgate));
    }

    @Test
    public void testForeignIdIsRejected() {
        SimpleCircuitLibrary lib = new SimpleCircuitLibrary();
        lib.addModel("sram6t", CircuitModelType.SRAM);
        CircuitModelId foreign = new CircuitModelId(5);
        Assertions.assertThrows(IllegalArgumentException.class, () -> lib.getModelName(foreign));
        Assertions.assertThrows(IllegalArgumentException.class, () -> lib.getModelType(new CircuitModelId(-1)));
    }

    @Test
    public void testIdsAreOnlyIssuedByTheLibrary() throws NoSuchMethodException {
        int modifiers = CircuitModelId.class.getDeclaredConstructor(int.class).getModifiers();
        Assertions.assertFalse(Modifier.isPublic(modifiers));
        Assertions.assertFalse(Modifier.isProtected(modifiers));

        SimpleCircuitLibrary lib = new SimpleCircuitLibrary();
        CircuitModelId first = lib.addModel("sram6t", CircuitModelType.SRAM);
        CircuitModelId second = lib.addModel("mux_tree", CircuitModelType.MUX);
        Assertions.assertEquals(0, first.getIndex());
        Assertions.assertEquals(1, second.getIndex());
    }
}
