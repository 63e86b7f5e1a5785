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
 * A transition of the net. Its name is the literal token that produced it
 * (e.g. "a+", "b~/2", "d1"). It is labeled either with a (signal, edge) pair or,
 * for dummy signals, with the signal alone (edge is null).
 */
public class STGTransition extends STGElement {

    private final STGSignal signal;

    private final Edge edge;

    private final List<STGPlace> fromPlaces = new ArrayList<>();

    private final List<STGPlace> toPlaces = new ArrayList<>();

    public STGTransition(String name, STGSignal signal, Edge edge) {
        super(name);
        this.signal = signal;
        this.edge = edge;
    }

    public STGSignal getSignal() {
        return signal;
    }

    /**
     * @return The edge of the label, null for dummy transitions.
     */
    public Edge getEdge() {
        return edge;
    }

    /**
     * Transitions of controllable signals split firing into request and commit
     * and therefore need an ongoing cell in the generated model.
     * @return True if this transition carries an ongoing cell.
     */
    public boolean hasOngoingCell() {
        return signal.isControllable();
    }

    public List<STGPlace> getFromPlaces() {
        return Collections.unmodifiableList(fromPlaces);
    }

    public List<STGPlace> getToPlaces() {
        return Collections.unmodifiableList(toPlaces);
    }

    void addFromPlace(STGPlace p) {
        fromPlaces.add(p);
    }

    void addToPlace(STGPlace p) {
        toPlaces.add(p);
    }

    @Override
    public STGElementType getElementType() {
        return STGElementType.TRANSITION;
    }
}
