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

package com.xilinx.rapidstg.stg;

/**
 * Common base of everything owned by an {@link STG}. Each element has a name that
 * is unique among elements of its type and a stable index assigned in creation
 * order.
 */
public abstract class STGElement {

    private final String name;

    private int index = -1;

    protected STGElement(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return Position of this element among the elements of the same type, in
     * creation order. -1 until the element has been added to a net.
     */
    public int getIndex() {
        return index;
    }

    void setIndex(int index) {
        this.index = index;
    }

    public abstract STGElementType getElementType();

    @Override
    public String toString() {
        return name;
    }
}
