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
import java.util.List;

/**
 * A place of the net, either named in the STG text or implicit (synthesized
 * between two adjacent transitions and named "from,to").
 */
public class STGPlace extends STGElement {

    private final int capacity;

    private final int marking;

    private final boolean implicit;

    private final List<STGTransition> incoming = new ArrayList<>();

    private final List<STGTransition> outgoing = new ArrayList<>();

    public STGPlace(String name, int marking, int capacity, boolean implicit) {
        super(name);
        this.marking = marking;
        this.capacity = capacity;
        this.implicit = implicit;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return The initial token count.
     */
    public int getMarking() {
        return marking;
    }

    public boolean isImplicit() {
        return implicit;
    }

    /**
     * @return Transitions with an arc ending in this place, in arc order.
     */
    public List<STGTransition> getIncomingTransitions() {
        return Collections.unmodifiableList(incoming);
    }

    /**
     * @return Transitions with an arc starting in this place, in arc order.
     */
    public List<STGTransition> getOutgoingTransitions() {
        return Collections.unmodifiableList(outgoing);
    }

    void addIncoming(STGTransition t) {
        incoming.add(t);
    }

    void addOutgoing(STGTransition t) {
        outgoing.add(t);
    }

    @Override
    public STGElementType getElementType() {
        return STGElementType.PLACE;
    }
}
