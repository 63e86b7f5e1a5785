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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.xilinx.rapidstg.util.MessageGenerator;

/**
 * Maps graph tokens such as "a+", "b-/1", "dummy1" or "p3" to the transition or
 * place they denote, creating elements on first reference through the build's
 * {@link STGRegistry}.
 */
public class STGNameResolver {

    /** identifier, optional edge marker, optional /disambiguator */
    public static final Pattern TOKEN_PATTERN = Pattern.compile("([a-zA-Z_][a-zA-Z_0-9]*)([+\\-~]?)(/[0-9]*)?");

    private final STGRegistry registry;

    public STGNameResolver(STGRegistry registry) {
        this.registry = registry;
    }

    /**
     * Resolves a graph token. Tokens whose base identifier is a declared signal
     * denote transitions and must match {@link #TOKEN_PATTERN} entirely; anything
     * else denotes a place named by the full token, e.g. "p-1".
     * Resolving the same text twice returns the same object.
     * @param token The token text.
     * @return An {@link STGTransition} or an {@link STGPlace}.
     * @throws STGException of type MALFORMED_TOKEN if the token has no
     * identifier prefix, names a signal with trailing text or names a
     * non-dummy signal without an edge.
     */
    public STGElement resolve(String token) {
        Matcher m = token == null ? null : TOKEN_PATTERN.matcher(token);
        if (m == null || !m.lookingAt()) {
            throw new STGException(STGErrorType.MALFORMED_TOKEN, "Malformed transition or place name: " + token);
        }
        String base = m.group(1);
        String marker = m.group(2);
        boolean whole = m.end() == token.length();
        STGSignal signal = registry.getSignal(base);
        if (signal != null && !whole) {
            throw new STGException(STGErrorType.MALFORMED_TOKEN, "Malformed transition name: " + token);
        }
        if (signal == null) {
            if (whole && !marker.isEmpty()) {
                MessageGenerator.warning(token + " looks like a transition but " + base
                        + " is not a declared signal, treating it as a place");
            }
            return registry.getOrCreatePlace(token);
        }
        switch (signal.getKind()) {
            case DUMMY:
                return registry.getOrCreateTransition(token, signal, null);
            case INPUT:
            case OUTPUT:
            case INTERNAL:
                if (marker.isEmpty()) {
                    throw new STGException(STGErrorType.MALFORMED_TOKEN,
                            "Transition " + token + " of signal " + base + " has no edge (+, - or ~)");
                }
                return registry.getOrCreateTransition(token, signal, Edge.getEdge(marker.charAt(0)));
            default:
                throw new RuntimeException("ERROR: Unhandled signal kind " + signal.getKind());
        }
    }

    /**
     * Resolves a name that is known to denote a place (used for implicit places).
     * @param name The place name.
     * @return The cached or newly created place.
     */
    public STGPlace resolvePlace(String name) {
        return registry.getOrCreatePlace(name);
    }
}
