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

import com.xilinx.rapidstg.stg.STGErrorType;
import com.xilinx.rapidstg.stg.STGException;

/**
 * Thrown when the text of an STG file does not follow the .g grammar.
 */
public class STGParseException extends STGException {

    private static final long serialVersionUID = 4870221390531208862L;

    private final int line;

    public STGParseException(String message, int line) {
        super(STGErrorType.SYNTAX_ERROR, message + " (line " + line + ")");
        this.line = line;
    }

    STGParseException(STGToken token, String message) {
        this(message, token.line);
    }

    /**
     * @return The 1-based line the problem was found on.
     */
    public int getLine() {
        return line;
    }

    static STGParseException unexpected(String expected, STGToken actual) {
        return new STGParseException(actual, "Parse Error: Expected " + expected + " but found " + actual);
    }
}
