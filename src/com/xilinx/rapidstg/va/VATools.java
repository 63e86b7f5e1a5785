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

package com.xilinx.rapidstg.va;

/**
 * Helpers for Verilog-A identifiers.
 */
public class VATools {

    /**
     * Turns an STG element name into a legal Verilog-A identifier fragment.
     * Graph tokens may contain ',' (implicit places), edge markers and the
     * '/' instance separator; each is replaced by an escape built from '$'.
     * @param name The STG name, e.g. "a+,b-/2".
     * @return The legal identifier, e.g. "a$p$$b$m$2".
     */
    public static String legalize(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            switch (c) {
                case ',': sb.append("$$"); break;
                case '+': sb.append("$p"); break;
                case '-': sb.append("$m"); break;
                case '~': sb.append("$t"); break;
                case '/': sb.append('$'); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * @param value A real number.
     * @return The value as a Verilog-A literal, integral values without a
     * fraction.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value).replace('E', 'e');
    }
}
