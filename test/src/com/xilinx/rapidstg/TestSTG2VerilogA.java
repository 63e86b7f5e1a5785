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

package com.xilinx.rapidstg;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.xilinx.rapidstg.support.RapidSTGFiles;
import com.xilinx.rapidstg.tests.CodePerfTracker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestSTG2VerilogA {

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Test
    public void testConvert(@TempDir Path tempDir) throws IOException {
        Path out = tempDir.resolve("handshake.va");
        int status = STG2VerilogA.run(RapidSTGFiles.getString("handshake.g"), "-o", out.toString());
        Assertions.assertEquals(0, status);
        String va = read(out);
        Assertions.assertTrue(va.contains("module handshake(VSS, VDD, RST, ack, req);"), va);
        Assertions.assertFalse(va.contains("__STG_ERROR__"));
    }

    @Test
    public void testPinNamesAndFlags(@TempDir Path tempDir) throws IOException {
        Path out = tempDir.resolve("mixed.va");
        int status = STG2VerilogA.run("-vdd", "vcc", "-vss", "gnd", "-rst", "rst_n", "-seeInternals", "-seeError",
                "-o", out.toString(), RapidSTGFiles.getString("mixed.g"));
        Assertions.assertEquals(0, status);
        String va = read(out);
        Assertions.assertTrue(va.contains("module mixed(gnd, vcc, rst_n, __STG_ERROR__, c, a, x);"), va);
        Assertions.assertTrue(va.contains("output x;"));
        Assertions.assertTrue(va.contains("__STG_ERROR___$state = STG_ERROR;"));
    }

    @Test
    public void testAllInputs(@TempDir Path tempDir) throws IOException {
        Path out = tempDir.resolve("inputs.va");
        int status = STG2VerilogA.run("-allInputs", "-o", out.toString(), RapidSTGFiles.getString("mixed.g"));
        Assertions.assertEquals(0, status);
        String va = read(out);
        Assertions.assertTrue(va.contains("input c;"), va);
        Assertions.assertTrue(va.contains("electrical x;"));
        Assertions.assertFalse(va.contains("input x;"));
        Assertions.assertTrue(va.contains("x_$state = (x_RST_VALUE_PAR != 0);"));
    }

    @Test
    public void testFailureWritesNothing(@TempDir Path tempDir) throws IOException {
        Path bad = tempDir.resolve("bad.g");
        Files.write(bad, ".model bad\n.inputs a\n.foo b\n.end\n".getBytes(StandardCharsets.UTF_8));
        Path out = tempDir.resolve("bad.va");
        Assertions.assertEquals(1, STG2VerilogA.run("-o", out.toString(), bad.toString()));
        Assertions.assertFalse(Files.exists(out));

        Assertions.assertEquals(1, STG2VerilogA.run("-o", out.toString(), tempDir.resolve("missing.g").toString()));
        Assertions.assertFalse(Files.exists(out));
    }

    @Test
    public void testVerbose(@TempDir Path tempDir) {
        Path out = tempDir.resolve("verbose.va");
        ByteArrayOutputStream capturedStdoutStream = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(capturedStdoutStream, true));
        int status;
        try {
            status = STG2VerilogA.run("-v", "-o", out.toString(), RapidSTGFiles.getString("handshake.g"));
        } finally {
            System.setOut(originalOut);
        }
        Assertions.assertEquals(0, status);
        String stdout = new String(capturedStdoutStream.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertTrue(stdout.contains("Synthesize Model"), stdout);
        Assertions.assertTrue(stdout.contains("Wrote Verilog-A model: " + out), stdout);
    }

    @Test
    public void testBadArguments() {
        Assertions.assertEquals(1, STG2VerilogA.run());
        Assertions.assertEquals(1, STG2VerilogA.run("-bogus", "x.g"));
        Assertions.assertEquals(0, STG2VerilogA.run("-h"));
    }

    @Test
    public void testCompileToFile(@TempDir Path tempDir) throws IOException {
        Path out = tempDir.resolve("racing.va");
        STGCompiler compiler = new STGCompiler();
        compiler.compileToFile(RapidSTGFiles.getString("racing.g"), out.toString(),
                new CodePerfTracker("racing", false));
        Assertions.assertTrue(read(out).contains("T_x$p$1"));
    }
}
