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
 * An expression of the behavioral model. Instances are immutable and may be
 * shared between statements.
 */
public abstract class VAExpression {

    public abstract <T> T accept(VAExpressionVisitor<T> visitor);

    public VAExpression and(VAExpression other) {
        return new VABinaryExpression(VAOperator.AND, this, other);
    }

    public VAExpression gt(VAExpression other) {
        return new VABinaryExpression(VAOperator.GT, this, other);
    }

    public VAExpression gt(double value) {
        return gt(new VAConstant(value));
    }

    public VAExpression eq(VAExpression other) {
        return new VABinaryExpression(VAOperator.EQ, this, other);
    }

    public VAExpression eq(double value) {
        return eq(new VAConstant(value));
    }

    public VAExpression ne(double value) {
        return new VABinaryExpression(VAOperator.NE, this, new VAConstant(value));
    }

    public VAExpression not() {
        return new VANotExpression(this);
    }

    public static VAConstant bool(boolean value) {
        return value ? VAConstant.TRUE : VAConstant.FALSE;
    }
}
