/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidSTG.
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

package com.xilinx.rapidstg.va;

/**
 * Direction of a module node. INTERNAL nodes are declared inside the module
 * and are not part of its port list.
 */
public enum VADirection {
    INPUT("input"),
    OUTPUT("output"),
    INOUT("inout"),
    INTERNAL(null);

    private final String keyword;

    VADirection(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The Verilog-A port direction keyword, null for internal nodes.
     */
    public String getKeyword() {
        return keyword;
    }

    public boolean isPort() {
        return keyword != null;
    }
}
