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

import org.jetbrains.annotations.Nullable;

/**
 * The edge classes a signal transition can be labeled with.
 */
public enum Edge {
    RISE('+'),
    FALL('-'),
    TOGGLE('~');

    private final char marker;

    Edge(char marker) {
        this.marker = marker;
    }

    /**
     * @return The character that denotes this edge in STG text.
     */
    public char getMarker() {
        return marker;
    }

    /**
     * Gets the edge denoted by a marker character.
     * @param marker One of '+', '-' or '~'.
     * @return The matching edge or null if the character is not an edge marker.
     */
    @Nullable
    public static Edge getEdge(char marker) {
        for (Edge e : values()) {
            if (e.marker == marker) return e;
        }
        return null;
    }

    /**
     * @return True if a transition of this edge completes on a rising crossing.
     */
    public boolean completesOnRising() {
        return this != FALL;
    }

    /**
     * @return True if a transition of this edge completes on a falling crossing.
     */
    public boolean completesOnFalling() {
        return this != RISE;
    }
}
