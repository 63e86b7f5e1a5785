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
 * An electrical node of a module.
 */
public class VAElectrical {

    private final String name;

    private final VADirection direction;

    VAElectrical(String name, VADirection direction) {
        this.name = name;
        this.direction = direction;
    }

    public String getName() {
        return name;
    }

    public VADirection getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return name;
    }
}
