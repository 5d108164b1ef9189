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

/**
 * Thrown when a naming function receives a descriptor outside of the domain it
 * documents, e.g. a non-channel routing resource for a channel name or a port
 * type that does not exist in the active SRAM organization. This always points
 * at a bug in the caller; the netlist being generated must not be written.
 */
public class NamingContractViolationException extends RuntimeException {

    private static final long serialVersionUID = 3918402165837469212L;

    public NamingContractViolationException(String message) {
        super(message);
    }

    /**
     * Creates an exception whose message names the offending descriptor.
     * @param problem What is wrong, e.g. "Invalid type of connection block".
     * @param descriptor The offending value, rendered with its toString().
     */
    public NamingContractViolationException(String problem, Object descriptor) {
        super("ERROR: " + problem + ": " + descriptor);
    }
}
