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
 * Conditional statement with an optional else branch. Both branches may keep
 * growing after construction, e.g. {@code new VAIf(c).then(a).orElse(b)}.
 */
public class VAIf extends VAStatement {

    private final VAExpression condition;

    private final VABlock thenBlock = new VABlock();

    private final VABlock elseBlock = new VABlock();

    public VAIf(VAExpression condition, VAStatement... thenStatements) {
        this.condition = condition;
        thenBlock.add(thenStatements);
    }

    public VAIf then(VAStatement... statements) {
        thenBlock.add(statements);
        return this;
    }

    public VAIf orElse(VAStatement... statements) {
        elseBlock.add(statements);
        return this;
    }

    public VAExpression getCondition() {
        return condition;
    }

    public VABlock getThen() {
        return thenBlock;
    }

    public VABlock getElse() {
        return elseBlock;
    }

    public boolean hasElse() {
        return !elseBlock.isEmpty();
    }

    @Override
    public void accept(VAStatementVisitor visitor) {
        visitor.visitIf(this);
    }
}
