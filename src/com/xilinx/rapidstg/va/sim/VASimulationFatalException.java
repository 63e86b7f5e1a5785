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

package com.xilinx.rapidstg.va.sim;

/**
 * Thrown when a simulated module executes a $fatal statement.
 */
public class VASimulationFatalException extends RuntimeException {

    private static final long serialVersionUID = -1428712039468455230L;

    private final int evaluation;

    public VASimulationFatalException(String message, int evaluation) {
        super(message);
        this.evaluation = evaluation;
    }

    /**
     * @return The number of the analog evaluation that aborted, counted from 1.
     */
    public int getEvaluation() {
        return evaluation;
    }
}
