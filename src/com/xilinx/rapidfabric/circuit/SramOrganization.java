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
 * How the configuration memories of a fabric are organized. A fabric uses
 * exactly one organization for its whole lifetime.
 */
public enum SramOrganization {
    /** Every memory bit is driven by its own external port */
    STANDALONE,
    /** Memories are configuration-chain flip-flops loaded serially */
    SCAN_CHAIN,
    /** Memories are addressed through bit-lines and word-lines */
    MEMORY_BANK;
}
