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

public class VABinaryExpression extends VAExpression {

    private final VAOperator operator;

    private final VAExpression left;

    private final VAExpression right;

    public VABinaryExpression(VAOperator operator, VAExpression left, VAExpression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public VAOperator getOperator() {
        return operator;
    }

    public VAExpression getLeft() {
        return left;
    }

    public VAExpression getRight() {
        return right;
    }

    @Override
    public <T> T accept(VAExpressionVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }
}
