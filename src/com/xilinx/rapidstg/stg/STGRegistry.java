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

import java.util.HashSet;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

/**
 * Name to element cache for a single build. The registry is owned by the
 * {@link STGBuilder} and handed to the {@link STGNameResolver}; it is the only
 * path through which elements are added to the {@link STG} under construction,
 * so the same name always yields the same object.
 */
public class STGRegistry {

    private final STG stg;

    private final Set<String> usedOverrides = new HashSet<>();

    public STGRegistry(STG stg) {
        if (stg.isFrozen()) {
            throw new IllegalArgumentException("STG " + stg.getName() + " has already been built");
        }
        this.stg = stg;
    }

    public STG getSTG() {
        return stg;
    }

    /**
     * Registers a new signal.
     * @param name Name of the signal.
     * @param declaredKind Kind of the section the signal was declared in.
     * @param kind Effective kind.
     * @return The new signal.
     * @throws STGException if a signal of the same name already exists.
     */
    public STGSignal createSignal(String name, SignalKind declaredKind, SignalKind kind) {
        if (stg.getSignal(name) != null) {
            throw new STGException(STGErrorType.DUPLICATE_SIGNAL, "Duplicated signal " + name);
        }
        STGSignal s = new STGSignal(name, declaredKind, kind);
        stg.addSignal(s);
        return s;
    }

    @Nullable
    public STGSignal getSignal(String name) {
        return stg.getSignal(name);
    }

    /**
     * Records an initial marking for a place that may not exist yet.
     * @throws STGException if the place already has a marking override.
     */
    public void addMarkingOverride(String placeName, int marking) {
        if (stg.getMarkingOverrides().containsKey(placeName)) {
            throw new STGException(STGErrorType.DUPLICATE_MARKING, "Duplicated marking for place " + placeName);
        }
        stg.putMarkingOverride(placeName, marking);
    }

    /**
     * Records a capacity for a place that may not exist yet.
     * @throws STGException if the place already has a capacity override.
     */
    public void addCapacityOverride(String placeName, int capacity) {
        if (stg.getCapacityOverrides().containsKey(placeName)) {
            throw new STGException(STGErrorType.DUPLICATE_CAPACITY, "Duplicated capacity for place " + placeName);
        }
        stg.putCapacityOverride(placeName, capacity);
    }

    /**
     * Gets the place of the given name, creating it on first reference with the
     * recorded marking and capacity overrides (0 and 1 if none were given).
     * @param name Name of the place. Implicit places are named "from,to".
     * @return The cached or newly created place.
     */
    public STGPlace getOrCreatePlace(String name) {
        STGPlace p = stg.getPlace(name);
        if (p != null) return p;
        Integer marking = stg.getMarkingOverrides().get(name);
        Integer capacity = stg.getCapacityOverrides().get(name);
        if (marking != null || capacity != null) usedOverrides.add(name);
        p = new STGPlace(name,
                marking == null ? 0 : marking,
                capacity == null ? 1 : capacity,
                name.indexOf(',') != -1);
        stg.addPlace(p);
        return p;
    }

    /**
     * Gets the transition produced by the given token, creating it on first
     * reference.
     * @param token Literal token text, used as the transition's identity.
     * @param signal The labeling signal.
     * @param edge The edge, null for dummy signals.
     * @return The cached or newly created transition.
     */
    public STGTransition getOrCreateTransition(String token, STGSignal signal, Edge edge) {
        STGTransition t = signal.getTransition(edge, token);
        if (t != null) return t;
        t = new STGTransition(token, signal, edge);
        stg.addTransition(t);
        return t;
    }

    /**
     * @param placeName Name of a place with a marking or capacity override.
     * @return True if a place of that name was created during the build.
     */
    public boolean isOverrideUsed(String placeName) {
        return usedOverrides.contains(placeName);
    }
}
