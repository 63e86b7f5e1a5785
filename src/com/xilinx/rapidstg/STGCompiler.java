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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.xilinx.rapidstg.codegen.FiringEngine;
import com.xilinx.rapidstg.codegen.STGCompilerConfig;
import com.xilinx.rapidstg.codegen.STGModel;
import com.xilinx.rapidstg.stg.STG;
import com.xilinx.rapidstg.stg.STGBuilder;
import com.xilinx.rapidstg.stg.parser.STGDescription;
import com.xilinx.rapidstg.stg.parser.STGParser;
import com.xilinx.rapidstg.tests.CodePerfTracker;
import com.xilinx.rapidstg.util.FileTools;
import com.xilinx.rapidstg.va.VAWriter;

/**
 * The compilation pipeline: parse a .g file, build the net, synthesize the
 * behavioral module and write it as Verilog-A.
 */
public class STGCompiler {

    private final STGCompilerConfig config;

    public STGCompiler(STGCompilerConfig config) {
        this.config = config;
    }

    public STGCompiler() {
        this(new STGCompilerConfig());
    }

    public STGCompilerConfig getConfig() {
        return config;
    }

    /**
     * Builds and synthesizes a parsed STG.
     */
    public STGModel compile(STGDescription desc, CodePerfTracker t) {
        t.start("Build Net");
        STG stg = STGBuilder.build(desc, config.getKindMapping());
        t.stop().start("Synthesize Model");
        STGModel model = new FiringEngine(config).synthesize(stg);
        t.stop();
        return model;
    }

    public STGModel compile(STGDescription desc) {
        return compile(desc, CodePerfTracker.SILENT);
    }

    /**
     * Compiles STG text held in memory.
     */
    public STGModel compileString(String text) {
        return compile(STGParser.parseString(text));
    }

    /**
     * Parses and compiles a .g file.
     * @param stgFileName Path of the STG file.
     * @param t Stage timer, {@link CodePerfTracker#SILENT} for none.
     * @return The synthesized model.
     */
    public STGModel compileFile(String stgFileName, CodePerfTracker t) {
        FileTools.errorIfFileDoesNotExist(stgFileName);
        t.start("Parse STG");
        STGDescription desc;
        try (STGParser parser = new STGParser(stgFileName)) {
            desc = parser.parseSTG();
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading file: " + stgFileName, e);
        }
        t.stop();
        return compile(desc, t);
    }

    /**
     * Compiles a .g file into a Verilog-A file. Nothing is written unless the
     * whole compilation succeeds.
     * @param stgFileName Path of the STG file.
     * @param outFileName Path of the Verilog-A file to write.
     * @param t Stage timer, {@link CodePerfTracker#SILENT} for none.
     * @return The synthesized model.
     */
    public STGModel compileToFile(String stgFileName, String outFileName, CodePerfTracker t) {
        STGModel model = compileFile(stgFileName, t);
        t.start("Write Verilog-A");
        Path out = Paths.get(outFileName);
        VAWriter.writeToFile(model.getModule(), out);
        t.stop();
        return model;
    }
}
