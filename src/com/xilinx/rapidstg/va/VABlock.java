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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, growable list of statements.
 */
public class VABlock extends VAStatement {

    private final List<VAStatement> statements = new ArrayList<>();

    public VABlock(VAStatement... statements) {
        add(statements);
    }

    public VABlock add(VAStatement... more) {
        this.statements.addAll(Arrays.asList(more));
        return this;
    }

    public List<VAStatement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public int size() {
        return statements.size();
    }

    @Override
    public void accept(VAStatementVisitor visitor) {
        visitor.visitBlock(this);
    }
}
