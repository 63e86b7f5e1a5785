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

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps the kind a signal was declared with to the kind it takes in the built
 * net. Dummy signals always stay dummies.
 */
public class KindMapping {

    private final Map<SignalKind, SignalKind> map = new EnumMap<>(SignalKind.class);

    private KindMapping() {
        for (SignalKind k : SignalKind.values()) {
            map.put(k, k);
        }
    }

    /**
     * @return A mapping that keeps every declared kind.
     */
    public static KindMapping identity() {
        return new KindMapping();
    }

    /**
     * Creates the mapping selected by the command line flags.
     * @param seeInternals Expose internal signals: as outputs, or as inputs when
     * allInputs is also set.
     * @param allInputs Turn outputs (and exposed internal signals) into inputs.
     * @return The mapping.
     */
    public static KindMapping fromFlags(boolean seeInternals, boolean allInputs) {
        KindMapping m = new KindMapping();
        if (seeInternals) {
            m.set(SignalKind.INTERNAL, allInputs ? SignalKind.INPUT : SignalKind.OUTPUT);
        }
        if (allInputs) {
            m.set(SignalKind.OUTPUT, SignalKind.INPUT);
        }
        return m;
    }

    /**
     * Changes the effective kind of one declared kind.
     * @param declared INPUT, OUTPUT or INTERNAL.
     * @param effective Any kind.
     * @return This mapping.
     */
    public KindMapping set(SignalKind declared, SignalKind effective) {
        if (declared == SignalKind.DUMMY && effective != SignalKind.DUMMY) {
            throw new IllegalArgumentException("Dummy signals cannot be remapped to " + effective);
        }
        map.put(declared, effective);
        return this;
    }

    public SignalKind getEffectiveKind(SignalKind declared) {
        return map.get(declared);
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
