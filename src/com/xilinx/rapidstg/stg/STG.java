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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * A Signal Transition Graph: the bipartite place/transition net together with
 * the signals labeling its transitions. Elements are stored in creation order;
 * the lists act as an arena and each element's {@link STGElement#getIndex()}
 * addresses it within its list. Neighbour lists on places and transitions only
 * reference elements owned here.
 *
 * An STG is populated by {@link STGRegistry} during a build and is read-only
 * once {@link #isFrozen()} returns true.
 */
public class STG {

    private final String name;

    private final List<STGSignal> signals = new ArrayList<>();

    private final List<STGPlace> places = new ArrayList<>();

    private final List<STGTransition> transitions = new ArrayList<>();

    private final Map<String, STGSignal> signalMap = new HashMap<>();

    private final Map<String, STGPlace> placeMap = new HashMap<>();

    private final Map<String, STGTransition> transitionMap = new HashMap<>();

    private final Map<String, Integer> markingOverrides = new LinkedHashMap<>();

    private final Map<String, Integer> capacityOverrides = new LinkedHashMap<>();

    private final List<STGElement> initSequence = new ArrayList<>();

    private boolean frozen;

    public STG(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public List<STGSignal> getSignals() {
        return Collections.unmodifiableList(signals);
    }

    public List<STGPlace> getPlaces() {
        return Collections.unmodifiableList(places);
    }

    public List<STGTransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    @Nullable
    public STGSignal getSignal(String name) {
        return signalMap.get(name);
    }

    @Nullable
    public STGPlace getPlace(String name) {
        return placeMap.get(name);
    }

    /**
     * Gets the implicit place synthesized between two transitions.
     * @param from Name of the source transition.
     * @param to Name of the destination transition.
     * @return The implicit place or null if the two are not adjacent.
     */
    @Nullable
    public STGPlace getImplicitPlace(String from, String to) {
        return placeMap.get(from + "," + to);
    }

    @Nullable
    public STGTransition getTransition(String name) {
        return transitionMap.get(name);
    }

    /**
     * @return Explicit marking overrides by place name, in declaration order.
     */
    public Map<String, Integer> getMarkingOverrides() {
        return Collections.unmodifiableMap(markingOverrides);
    }

    /**
     * @return Explicit capacity overrides by place name, in declaration order.
     */
    public Map<String, Integer> getCapacityOverrides() {
        return Collections.unmodifiableMap(capacityOverrides);
    }

    /**
     * Gets the ordered initialization sequence: places (restore marking),
     * controllable signals (restore reset level) and controllable transitions
     * (clear ongoing cell) in the order they were first created.
     * @return The elements to initialize on reset.
     */
    public List<STGElement> getInitSequence() {
        return Collections.unmodifiableList(initSequence);
    }

    public boolean isFrozen() {
        return frozen;
    }

    void freeze() {
        frozen = true;
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("STG " + name + " cannot be modified after it has been built");
        }
    }

    void addSignal(STGSignal s) {
        checkNotFrozen();
        s.setIndex(signals.size());
        signals.add(s);
        signalMap.put(s.getName(), s);
        if (s.isControllable()) {
            initSequence.add(s);
        }
    }

    void addPlace(STGPlace p) {
        checkNotFrozen();
        p.setIndex(places.size());
        places.add(p);
        placeMap.put(p.getName(), p);
        initSequence.add(p);
    }

    void addTransition(STGTransition t) {
        checkNotFrozen();
        t.setIndex(transitions.size());
        transitions.add(t);
        transitionMap.put(t.getName(), t);
        t.getSignal().addTransition(t);
        if (t.hasOngoingCell()) {
            initSequence.add(t);
        }
    }

    void putMarkingOverride(String placeName, int marking) {
        checkNotFrozen();
        markingOverrides.put(placeName, marking);
    }

    void putCapacityOverride(String placeName, int capacity) {
        checkNotFrozen();
        capacityOverrides.put(placeName, capacity);
    }

    /**
     * Prints a short summary of the net to standard out.
     */
    public void printSummary() {
        int dummies = 0;
        for (STGSignal s : signals) {
            if (s.isDummy()) dummies++;
        }
        int implicit = 0;
        for (STGPlace p : places) {
            if (p.isImplicit()) implicit++;
        }
        System.out.println("STG " + name + ": " + (signals.size() - dummies) + " signals, "
                + dummies + " dummies, " + places.size() + " places (" + implicit + " implicit), "
                + transitions.size() + " transitions");
    }
}
