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
 * Direction argument of a cross() event.
 */
public enum VACrossingDirection {
    RISING(1),
    FALLING(-1),
    BOTH(0);

    private final int argument;

    VACrossingDirection(int argument) {
        this.argument = argument;
    }

    public int getArgument() {
        return argument;
    }

    /**
     * @param rising True for a low to high crossing.
     * @return True if this direction reacts to the crossing.
     */
    public boolean matches(boolean rising) {
        return this == BOTH || (this == RISING) == rising;
    }
}
