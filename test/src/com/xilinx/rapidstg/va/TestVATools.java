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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestVATools {

    @ParameterizedTest
    @CsvSource({
        "p0,          p0",
        "a+,          a$p",
        "b-/2,        b$m$2",
        "x~,          x$t",
        "'a+,b-',     a$p$$b$m",
        "'c~/1,d/3',  c$t$1$$d$3",
    })
    public void testLegalize(String name, String expected) {
        Assertions.assertEquals(expected, VATools.legalize(name));
    }

    @ParameterizedTest
    @CsvSource({
        "0,       0",
        "500,     500",
        "10000,   10000",
        "1e-10,   1.0e-10",
        "1e-14,   1.0e-14",
        "0.05,    0.05",
    })
    public void testFormatNumber(double value, String expected) {
        Assertions.assertEquals(expected, VATools.formatNumber(value));
    }
}
