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

/**
 * An entry of a .marking or .capacity section. Implicit places are written
 * as &lt;from,to&gt; and stored under their synthesized name "from,to".
 */
public class STGOverride {

    private final String placeName;

    private final boolean implicit;

    private final String value;

    private final int line;

    /**
     * @param placeName Name of the (possibly implicit) place.
     * @param implicit True if written in the bracketed form.
     * @param value The decimal text after '=', or null if absent.
     * @param line Line of the entry.
     */
    public STGOverride(String placeName, boolean implicit, String value, int line) {
        this.placeName = placeName;
        this.implicit = implicit;
        this.value = value;
        this.line = line;
    }

    public String getPlaceName() {
        return placeName;
    }

    public boolean isImplicit() {
        return implicit;
    }

    public String getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        String n = implicit ? "<" + placeName + ">" : placeName;
        return value == null ? n : n + "=" + value;
    }
}
