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
 * Statements guarded by a crossing event: {@code @(cross(...)) begin ... end}.
 * The body runs only in the evaluation where the crossing is detected.
 */
public class VAEventControl extends VAStatement {

    private final VACrossing event;

    private final VABlock body = new VABlock();

    public VAEventControl(VACrossing event, VAStatement... body) {
        this.event = event;
        this.body.add(body);
    }

    public VACrossing getEvent() {
        return event;
    }

    public VABlock getBody() {
        return body;
    }

    @Override
    public void accept(VAStatementVisitor visitor) {
        visitor.visitEventControl(this);
    }
}
