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

package com.xilinx.rapidstg.stg.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.xilinx.rapidstg.stg.SignalKind;

/**
 * The parsed contents of an STG file, before any name resolution. Sections may
 * appear several times in a file; their contents are concatenated in file
 * order. Can also be assembled programmatically.
 */
public class STGDescription {

    private String modelName;

    private final Map<SignalKind, List<String>> signals = new EnumMap<>(SignalKind.class);

    private final List<STGArc> arcs = new ArrayList<>();

    private final List<STGOverride> markings = new ArrayList<>();

    private final List<STGOverride> capacities = new ArrayList<>();

    private int graphSections;

    public STGDescription(String modelName) {
        this.modelName = modelName;
        for (SignalKind k : SignalKind.values()) {
            signals.put(k, new ArrayList<>());
        }
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    /**
     * @param declaredKind The section kind.
     * @return Names listed in all sections of that kind, in file order.
     */
    public List<String> getSignals(SignalKind declaredKind) {
        return Collections.unmodifiableList(signals.get(declaredKind));
    }

    public STGDescription addSignal(SignalKind declaredKind, String name) {
        signals.get(declaredKind).add(name);
        return this;
    }

    public List<STGArc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    public STGDescription addArc(STGArc arc) {
        arcs.add(arc);
        return this;
    }

    /**
     * Convenience to add an arc line written the way it appears in a .graph
     * section, e.g. "a+ b+ p1".
     */
    public STGDescription addArc(String line) {
        String[] parts = line.trim().split("\\s+");
        List<String> to = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            to.add(parts[i]);
        }
        if (graphSections == 0) graphSections = 1;
        return addArc(new STGArc(parts[0], to, -1));
    }

    public List<STGOverride> getMarkings() {
        return Collections.unmodifiableList(markings);
    }

    public STGDescription addMarking(STGOverride marking) {
        markings.add(marking);
        return this;
    }

    public List<STGOverride> getCapacities() {
        return Collections.unmodifiableList(capacities);
    }

    public STGDescription addCapacity(STGOverride capacity) {
        capacities.add(capacity);
        return this;
    }

    /**
     * @return Number of .graph sections seen.
     */
    public int getGraphSectionCount() {
        return graphSections;
    }

    public void addGraphSection() {
        graphSections++;
    }
}
