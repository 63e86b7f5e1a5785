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
import java.util.List;

/**
 * One line of the .graph section: a source token followed by the tokens it has
 * arcs to.
 */
public class STGArc {

    private final String source;

    private final List<String> destinations;

    private final int line;

    public STGArc(String source, List<String> destinations, int line) {
        this.source = source;
        this.destinations = Collections.unmodifiableList(new ArrayList<>(destinations));
        this.line = line;
    }

    public String getSource() {
        return source;
    }

    public List<String> getDestinations() {
        return destinations;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return source + " " + String.join(" ", destinations);
    }
}
