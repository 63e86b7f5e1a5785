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
 * The potential difference V(p, n) between two nodes.
 */
public class VAPotential extends VAExpression {

    private final VAElectrical positive;

    private final VAElectrical negative;

    public VAPotential(VAElectrical positive, VAElectrical negative) {
        this.positive = positive;
        this.negative = negative;
    }

    public VAElectrical getPositive() {
        return positive;
    }

    public VAElectrical getNegative() {
        return negative;
    }

    @Override
    public <T> T accept(VAExpressionVisitor<T> visitor) {
        return visitor.visitPotential(this);
    }
}
