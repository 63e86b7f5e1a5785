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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.xilinx.rapidstg.stg.parser.STGArc;
import com.xilinx.rapidstg.stg.parser.STGDescription;
import com.xilinx.rapidstg.stg.parser.STGOverride;
import com.xilinx.rapidstg.util.MessageGenerator;

/**
 * Builds an {@link STG} from a parsed {@link STGDescription}: registers the
 * signals, records marking and capacity overrides, resolves every arc and
 * splices implicit places between adjacent transitions. All structural checks
 * happen here and are reported as {@link STGException}s.
 */
public class STGBuilder {

    /** Order in which declaration sections are registered. */
    public static final List<SignalKind> REGISTRATION_ORDER = Arrays.asList(
            SignalKind.OUTPUT, SignalKind.INPUT, SignalKind.INTERNAL, SignalKind.DUMMY);

    private final KindMapping mapping;

    public STGBuilder(KindMapping mapping) {
        this.mapping = mapping;
    }

    public STGBuilder() {
        this(KindMapping.identity());
    }

    /**
     * Convenience to build with the given mapping.
     */
    public static STG build(STGDescription desc, KindMapping mapping) {
        return new STGBuilder(mapping).build(desc);
    }

    /**
     * Builds the net.
     * @param desc The parsed STG.
     * @return The complete, frozen net.
     * @throws STGException on any structural problem.
     */
    public STG build(STGDescription desc) {
        STG stg = new STG(desc.getModelName());
        STGRegistry registry = new STGRegistry(stg);

        registerSignals(desc, registry);

        for (STGOverride cap : desc.getCapacities()) {
            if (!cap.hasValue()) {
                throw new STGException(STGErrorType.INVALID_COUNT, "Capacity of " + cap + " has no value");
            }
            int capacity = parseCount(cap);
            if (capacity < 1) {
                throw new STGException(STGErrorType.INVALID_COUNT,
                        "Capacity of " + cap.getPlaceName() + " must be at least 1");
            }
            registry.addCapacityOverride(cap.getPlaceName(), capacity);
        }
        for (STGOverride mark : desc.getMarkings()) {
            registry.addMarkingOverride(mark.getPlaceName(), mark.hasValue() ? parseCount(mark) : 1);
        }

        if (desc.getGraphSectionCount() == 0) {
            throw new STGException(STGErrorType.NO_GRAPH, "No graph declaration was found");
        }
        boolean hasArc = false;
        for (STGArc arc : desc.getArcs()) {
            if (!arc.getDestinations().isEmpty()) {
                hasArc = true;
                break;
            }
        }
        if (!hasArc) {
            throw new STGException(STGErrorType.NO_ARCS, "There are no arcs in the graph of " + stg.getName());
        }

        STGNameResolver resolver = new STGNameResolver(registry);
        for (STGArc arc : desc.getArcs()) {
            STGElement from = resolver.resolve(arc.getSource());
            for (String toName : arc.getDestinations()) {
                connect(resolver, from, resolver.resolve(toName));
            }
        }

        warnUnusedOverrides(stg.getMarkingOverrides(), registry, "Marking");
        warnUnusedOverrides(stg.getCapacityOverrides(), registry, "Capacity");
        stg.freeze();
        return stg;
    }

    private void registerSignals(STGDescription desc, STGRegistry registry) {
        int interfaceSignals = 0;
        for (SignalKind declared : REGISTRATION_ORDER) {
            SignalKind kind = mapping.getEffectiveKind(declared);
            for (String name : desc.getSignals(declared)) {
                registry.createSignal(name, declared, kind);
                // hidden internal nodes do not make an interface
                if (kind == SignalKind.INPUT || kind == SignalKind.OUTPUT) interfaceSignals++;
            }
        }
        if (interfaceSignals == 0) {
            throw new STGException(STGErrorType.NO_SIGNALS, "There are no input or output signals in "
                    + desc.getModelName());
        }
    }

    private static int parseCount(STGOverride o) {
        try {
            return Integer.parseInt(o.getValue());
        } catch (NumberFormatException e) {
            throw new STGException(STGErrorType.INVALID_COUNT,
                    "Value of " + o + " is not a representable count", e);
        }
    }

    /**
     * Adds the arc from -&gt; to. Two adjacent transitions are joined through the
     * implicit place "from,to".
     */
    static void connect(STGNameResolver resolver, STGElement from, STGElement to) {
        boolean fromPlace = from.getElementType() == STGElementType.PLACE;
        boolean toPlace = to.getElementType() == STGElementType.PLACE;
        if (fromPlace && toPlace) {
            throw new STGException(STGErrorType.PLACE_TO_PLACE,
                    "There can't be an arc from place " + from + " to place " + to);
        }
        if (!fromPlace && !toPlace) {
            STGPlace implicit = resolver.resolvePlace(from.getName() + "," + to.getName());
            link((STGTransition) from, implicit);
            link(implicit, (STGTransition) to);
        } else if (fromPlace) {
            link((STGPlace) from, (STGTransition) to);
        } else {
            link((STGTransition) from, (STGPlace) to);
        }
    }

    private static void link(STGTransition t, STGPlace p) {
        t.addToPlace(p);
        p.addIncoming(t);
    }

    private static void link(STGPlace p, STGTransition t) {
        p.addOutgoing(t);
        t.addFromPlace(p);
    }

    private static void warnUnusedOverrides(Map<String, Integer> overrides, STGRegistry registry, String what) {
        for (String name : overrides.keySet()) {
            if (!registry.isOverrideUsed(name)) {
                MessageGenerator.warning(what + " given for " + name + ", which is not a place of the graph");
            }
        }
    }
}
