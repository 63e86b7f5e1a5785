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

public class VAWhile extends VAStatement {

    private final VAExpression condition;

    private final VABlock body = new VABlock();

    public VAWhile(VAExpression condition, VAStatement... body) {
        this.condition = condition;
        this.body.add(body);
    }

    public VAExpression getCondition() {
        return condition;
    }

    public VABlock getBody() {
        return body;
    }

    @Override
    public void accept(VAStatementVisitor visitor) {
        visitor.visitWhile(this);
    }
}
