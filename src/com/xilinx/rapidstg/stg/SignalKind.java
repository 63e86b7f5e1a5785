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

package com.xilinx.rapidstg.stg;

/**
 * Kinds of signals in an STG. The declared kind comes from the section a signal
 * is listed in; the effective kind is obtained through a {@link KindMapping}.
 */
public enum SignalKind {
    INPUT("input"),
    OUTPUT("output"),
    INTERNAL("internal"),
    DUMMY("dummy");

    private final String sectionName;

    SignalKind(String sectionName) {
        this.sectionName = sectionName;
    }

    /**
     * @return The name of the STG section that declares signals of this kind
     * (without the leading dot, singular form).
     */
    public String getSectionName() {
        return sectionName;
    }

    /**
     * Controllable signals are driven by the generated model. Their transitions
     * fire in two phases (request and commit).
     * @return True for OUTPUT and INTERNAL.
     */
    public boolean isControllable() {
        return this == OUTPUT || this == INTERNAL;
    }

    /**
     * @return True if the signal owns physical edges (everything but DUMMY).
     */
    public boolean hasEdges() {
        return this != DUMMY;
    }
}
