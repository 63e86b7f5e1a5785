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

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import com.xilinx.rapidstg.stg.STGErrorType;
import com.xilinx.rapidstg.stg.SignalKind;
import com.xilinx.rapidstg.support.RapidSTGFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestSTGParser {

    @Test
    public void testParseFile() throws IOException {
        STGDescription desc;
        try (STGParser p = new STGParser(RapidSTGFiles.getPath("mixed.g"))) {
            desc = p.parseSTG();
        }
        Assertions.assertEquals("mixed", desc.getModelName());
        Assertions.assertEquals(Arrays.asList("a"), desc.getSignals(SignalKind.INPUT));
        Assertions.assertEquals(Arrays.asList("c"), desc.getSignals(SignalKind.OUTPUT));
        Assertions.assertEquals(Arrays.asList("x"), desc.getSignals(SignalKind.INTERNAL));
        Assertions.assertEquals(Arrays.asList("d"), desc.getSignals(SignalKind.DUMMY));
        Assertions.assertEquals(1, desc.getGraphSectionCount());
        Assertions.assertEquals(6, desc.getArcs().size());
        STGArc first = desc.getArcs().get(0);
        Assertions.assertEquals("a+", first.getSource());
        Assertions.assertEquals(Arrays.asList("x~"), first.getDestinations());

        List<STGOverride> markings = desc.getMarkings();
        Assertions.assertEquals(1, markings.size());
        Assertions.assertEquals("c-,a+", markings.get(0).getPlaceName());
        Assertions.assertTrue(markings.get(0).isImplicit());
        Assertions.assertFalse(markings.get(0).hasValue());
    }

    @Test
    public void testOverridesAndMultipleDestinations() {
        STGDescription desc = STGParser.parseString(
                  ".model m\n"
                + ".inputs a b\n"
                + ".outputs c\n"
                + ".graph\n"
                + "a+ c+ p0   # fork\n"
                + "b+ c+\n"
                + "\n"
                + "p0 b+\n"
                + ".capacity p0=3 <a+,c+>=2\n"
                + ".marking { p0=2 <b+,c+> }\n"
                + ".end\n");
        Assertions.assertEquals(Arrays.asList("a", "b"), desc.getSignals(SignalKind.INPUT));
        Assertions.assertEquals(Arrays.asList("c+", "p0"), desc.getArcs().get(0).getDestinations());
        Assertions.assertEquals(3, desc.getArcs().size());

        Assertions.assertEquals(2, desc.getCapacities().size());
        Assertions.assertEquals("p0", desc.getCapacities().get(0).getPlaceName());
        Assertions.assertEquals("3", desc.getCapacities().get(0).getValue());
        Assertions.assertEquals("a+,c+", desc.getCapacities().get(1).getPlaceName());
        Assertions.assertEquals("2", desc.getCapacities().get(1).getValue());

        Assertions.assertEquals("2", desc.getMarkings().get(0).getValue());
        Assertions.assertNull(desc.getMarkings().get(1).getValue());
    }

    @Test
    public void testSectionsInAnyOrder() {
        STGDescription desc = STGParser.parseString(
                ".model m\n.graph\na+ p\n.marking { p }\n.inputs a\n.end\n");
        Assertions.assertEquals(Arrays.asList("a"), desc.getSignals(SignalKind.INPUT));
        Assertions.assertEquals(1, desc.getArcs().size());
    }

    @ParameterizedTest
    @CsvSource({
        "'.inputs a\\n.end\\n', 1",
        "'.model m\\n.inputs a\\n', 3",
        "'.model m\\n.inputs\\n.end\\n', 2",
        "'.model m\\n.inputs a\\n.foo b\\n.end\\n', 3",
        "'.model m\\n.inputs a\\n.graph\\na+ ?\\n.end\\n', 4",
        "'.model m\\n.inputs a\\n.marking { }\\n.end\\n', 3",
        "'.model m\\n.inputs a\\n.marking { p=x }\\n.end\\n', 3",
        "'.model m\\n.inputs a\\n.capacity <a+> \\n.end\\n', 3",
        "'.model m\\n.inputs a\\n.end\\n.graph\\n', 4",
    })
    public void testSyntaxErrors(String text, int line) {
        STGParseException e = Assertions.assertThrows(STGParseException.class,
                () -> STGParser.parseString(text.replace("\\n", "\n")));
        Assertions.assertEquals(STGErrorType.SYNTAX_ERROR, e.getType());
        Assertions.assertEquals(line, e.getLine());
        Assertions.assertTrue(e.getMessage().endsWith("(line " + line + ")"), e.getMessage());
    }
}
