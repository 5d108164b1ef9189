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

package com.xilinx.rapidfabric.device;

/**
 * Kinds of nodes in the routing-resource graph. Only the two channel kinds
 * produce routing-channel and connection-block names.
 */
public enum RoutingResourceType {
    /** Logical source of a block output */
    SOURCE,
    /** Logical sink of a block input */
    SINK,
    /** Input pin of a grid block */
    IPIN,
    /** Output pin of a grid block */
    OPIN,
    /** Horizontal routing channel */
    CHANX,
    /** Vertical routing channel */
    CHANY;

    public boolean isChannel() {
        return this == CHANX || this == CHANY;
    }
}
