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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestVAWriter {

    private VAModule module;

    private VADigitalPin in;

    private VADigitalPin out;

    private VAVariable count;

    @BeforeEach
    public void setup() {
        module = new VAModule("buf+");
        VAElectrical gnd = module.electrical("VSS", VADirection.INOUT);
        VAElectrical vdd = module.electrical("VDD", VADirection.INOUT);
        VAParameter cap = module.parameter("IN_CAP_PAR", 10e-15);
        VAParameter res = module.parameter("OUT_RES_PAR", 10e3);
        VAParameter rst = module.parameter("y_RST_VALUE_PAR", 1);
        in = module.inputPin("a", vdd, gnd, cap);
        out = module.driverPin("y", VADirection.OUTPUT, vdd, gnd, rst, VAConstant.FALSE, new VAConstant(1e-12), res);
        module.driverPin("h", VADirection.INTERNAL, vdd, gnd, null, VAConstant.FALSE, new VAConstant(1e-12), res);
        count = module.variable("count", 3);
    }

    @Test
    public void testDeclarations() {
        String va = VAWriter.toString(module);
        Assertions.assertTrue(va.startsWith("`include \"constants.vams\"\n`include \"disciplines.vams\"\n"));
        Assertions.assertTrue(va.contains("module buf$p(VSS, VDD, a, y);"), va);
        Assertions.assertTrue(va.contains("    inout VSS;\n    electrical VSS;\n"));
        Assertions.assertTrue(va.contains("    input a;\n    electrical a;\n"));
        Assertions.assertTrue(va.contains("    output y;\n    electrical y;\n"));
        Assertions.assertTrue(va.contains("    electrical h;\n"));
        Assertions.assertFalse(va.contains("output h;"));
        Assertions.assertTrue(va.contains("parameter real IN_CAP_PAR = 1.0e-14;"));
        Assertions.assertTrue(va.contains("parameter real OUT_RES_PAR = 10000;"));
        Assertions.assertTrue(va.contains("integer y_$state;"));
        Assertions.assertTrue(va.contains("integer count;"));
        Assertions.assertTrue(va.contains("count = 3;"));
        Assertions.assertTrue(va.contains("y_$state = (y_RST_VALUE_PAR != 0);"));
        Assertions.assertTrue(va.trim().endsWith("endmodule"));
    }

    @Test
    public void testContributions() {
        String va = VAWriter.toString(module);
        Assertions.assertTrue(va.contains("I(a, VSS) <+ IN_CAP_PAR*ddt(V(a, VSS));"), va);
        Assertions.assertTrue(va.contains(
                "I(y, VSS) <+ (V(y, VSS) - V(VDD, VSS)*transition(y_$state, 0, 1.0e-12, 1.0e-12))/OUT_RES_PAR;"), va);
    }

    @Test
    public void testStatements() {
        module.analog(
                new VAEventControl(in.rising(),
                        new VAIf(count.gt(1), new VAStrobe("say \"hi\"")).orElse(count.inc())),
                new VAEventControl(in.both()),
                new VAWhile(count.eq(0).not(), count.dec()),
                new VAIf(in.level().and(out.level()), out.toggle(), new VAFatal("stop")));
        String va = VAWriter.toString(module);
        Assertions.assertTrue(va.contains(
                "        @(cross(V(a, VSS) - V(VDD, VSS)/2, 1)) begin\n"
              + "            if ((count > 1)) begin\n"
              + "                $strobe(\"say \\\"hi\\\"\");\n"
              + "            end else begin\n"
              + "                count = (count + 1);\n"
              + "            end\n"
              + "        end\n"), va);
        Assertions.assertTrue(va.contains("@(cross(V(a, VSS) - V(VDD, VSS)/2, 0)) ;"), va);
        Assertions.assertTrue(va.contains("while (!(count == 0)) begin"), va);
        Assertions.assertTrue(va.contains("count = (count - 1);"), va);
        Assertions.assertTrue(va.contains("if (((V(a, VSS) > V(VDD, VSS)/2) && (V(y, VSS) > V(VDD, VSS)/2))) begin"), va);
        Assertions.assertTrue(va.contains("y_$state = !y_$state;"), va);
        Assertions.assertTrue(va.contains("$fatal(1, \"stop\");"), va);
    }

    @Test
    public void testWriteToFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("buf.va");
        VAWriter.writeToFile(module, file);
        Assertions.assertEquals(VAWriter.toString(module),
                new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Test
    public void testDuplicateIdentifier() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> module.variable("count", 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> module.parameter("a", 0));
    }

    @Test
    public void testInputCannotBeDriven() {
        Assertions.assertThrows(IllegalStateException.class, () -> in.write(true));
    }
}
