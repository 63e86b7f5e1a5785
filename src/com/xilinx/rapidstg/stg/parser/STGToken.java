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

import java.util.Objects;

class STGToken {

    enum Type {
        WORD,
        SYMBOL,
        NEWLINE,
        EOF;
    }

    public final String text;
    public final Type type;
    public final int line;

    public STGToken(String text, Type type, int line) {
        this.text = Objects.requireNonNull(text);
        this.type = type;
        this.line = line;
    }

    public boolean is(Type type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isDirective() {
        return type == Type.WORD && text.startsWith(".");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        STGToken stgToken = (STGToken) o;
        return line == stgToken.line && type == stgToken.type && text.equals(stgToken.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, type, line);
    }

    @Override
    public String toString() {
        switch (type) {
            case NEWLINE: return "end of line@" + line;
            case EOF: return "end of file@" + line;
            default: return text + "@" + line;
        }
    }
}
