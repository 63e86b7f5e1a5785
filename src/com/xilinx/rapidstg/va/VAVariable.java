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
 * An integer module variable. Variables hold their value between analog
 * evaluations and start at their initial value.
 */
public class VAVariable extends VAExpression {

    private final String name;

    private final int initialValue;

    VAVariable(String name, int initialValue) {
        this.name = name;
        this.initialValue = initialValue;
    }

    public String getName() {
        return name;
    }

    public int getInitialValue() {
        return initialValue;
    }

    /**
     * @return A statement assigning expr to this variable.
     */
    public VAAssignment set(VAExpression expr) {
        return new VAAssignment(this, expr);
    }

    public VAAssignment set(int value) {
        return new VAAssignment(this, new VAConstant(value));
    }

    /**
     * @return A statement incrementing this variable by one.
     */
    public VAAssignment inc() {
        return new VAAssignment(this, plus(1));
    }

    /**
     * @return A statement decrementing this variable by one.
     */
    public VAAssignment dec() {
        return new VAAssignment(this, minus(1));
    }

    @Override
    public <T> T accept(VAExpressionVisitor<T> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
