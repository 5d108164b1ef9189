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

/**
 * The kinds of circuit models a circuit library describes.
 */
public enum CircuitModelType {
    /** Routing or local multiplexer */
    MUX,
    /** Look-up table */
    LUT,
    /** Standard logic gate, see {@link GateType} */
    GATE,
    /** Configuration memory cell */
    SRAM,
    /** Inverter or buffer */
    INVBUF,
    /** Pass-gate or transmission-gate */
    PASSGATE,
    /** Flip-flop */
    FF,
    /** Configuration-chain flip-flop */
    CCFF,
    /** I/O pad */
    IOPAD,
    /** Local wire */
    WIRE,
    /** Routing-channel wire segment */
    CHAN_WIRE,
    /** User-defined hard logic */
    HARDLOGIC;
}
