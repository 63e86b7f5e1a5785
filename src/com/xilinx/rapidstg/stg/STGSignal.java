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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A declared STG signal. Non-dummy signals index their transitions by edge, dummy
 * signals own a plain label-keyed set of transitions.
 */
public class STGSignal extends STGElement {

    private final SignalKind declaredKind;

    private final SignalKind kind;

    private Map<Edge, Map<String, STGTransition>> edgeTransitions;

    private Map<String, STGTransition> dummyTransitions;

    public STGSignal(String name, SignalKind declaredKind, SignalKind kind) {
        super(name);
        this.declaredKind = declaredKind;
        this.kind = kind;
        if (kind.hasEdges()) {
            edgeTransitions = new EnumMap<>(Edge.class);
            for (Edge e : Edge.values()) {
                edgeTransitions.put(e, new LinkedHashMap<>());
            }
        } else {
            dummyTransitions = new LinkedHashMap<>();
        }
    }

    /**
     * @return The kind of the section this signal was declared in.
     */
    public SignalKind getDeclaredKind() {
        return declaredKind;
    }

    /**
     * @return The effective kind after remapping.
     */
    public SignalKind getKind() {
        return kind;
    }

    public boolean isControllable() {
        return kind.isControllable();
    }

    public boolean isDummy() {
        return !kind.hasEdges();
    }

    /**
     * Gets the transitions labeled with this signal and the provided edge, in
     * creation order.
     * @param edge The edge class.
     * @return The transitions, empty for dummy signals.
     */
    public Collection<STGTransition> getTransitions(Edge edge) {
        if (edgeTransitions == null) return Collections.emptyList();
        return Collections.unmodifiableCollection(edgeTransitions.get(edge).values());
    }

    /**
     * @return Every transition of this signal. Edge-labeled transitions are
     * grouped by edge in {@link Edge} order.
     */
    public List<STGTransition> getTransitions() {
        if (edgeTransitions == null) {
            return new ArrayList<>(dummyTransitions.values());
        }
        List<STGTransition> all = new ArrayList<>();
        for (Map<String, STGTransition> m : edgeTransitions.values()) {
            all.addAll(m.values());
        }
        return all;
    }

    STGTransition getTransition(Edge edge, String label) {
        if (edgeTransitions == null) {
            return dummyTransitions.get(label);
        }
        return edgeTransitions.get(edge).get(label);
    }

    void addTransition(STGTransition t) {
        if (edgeTransitions == null) {
            dummyTransitions.put(t.getName(), t);
        } else {
            edgeTransitions.get(t.getEdge()).put(t.getName(), t);
        }
    }

    @Override
    public STGElementType getElementType() {
        return STGElementType.SIGNAL;
    }
}
