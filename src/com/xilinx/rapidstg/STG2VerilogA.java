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
import java.util.Arrays;
import java.util.List;

import com.xilinx.rapidstg.codegen.FiringEngine;
import com.xilinx.rapidstg.codegen.STGCompilerConfig;
import com.xilinx.rapidstg.codegen.STGModel;
import com.xilinx.rapidstg.stg.KindMapping;
import com.xilinx.rapidstg.stg.STGException;
import com.xilinx.rapidstg.tests.CodePerfTracker;
import com.xilinx.rapidstg.util.MessageGenerator;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Command line front end: converts a .g Signal Transition Graph into a
 * Verilog-A behavioral model.
 */
public class STG2VerilogA {

    protected static final String OUT_OPT = "o";
    protected static final String VDD_OPT = "vdd";
    protected static final String VSS_OPT = "vss";
    protected static final String RST_OPT = "rst";
    protected static final String SEE_INTERNALS_OPT = "seeInternals";
    protected static final String SEE_ERROR_OPT = "seeError";
    protected static final String ALL_INPUTS_OPT = "allInputs";
    protected static final String VERBOSE_OPT = "v";
    protected static final String HELP_OPT = "h";

    public static final String DEFAULT_OUTPUT = "verilogA.va";

    private static OptionParser createOptionParser() {
        OptionParser p = new OptionParser() {{
            accepts(OUT_OPT).withRequiredArg().defaultsTo(DEFAULT_OUTPUT).describedAs("Output Verilog-A file name");
            accepts(VDD_OPT).withRequiredArg().defaultsTo(STGCompilerConfig.DEFAULT_VDD).describedAs("Supply pin name");
            accepts(VSS_OPT).withRequiredArg().defaultsTo(STGCompilerConfig.DEFAULT_VSS).describedAs("Ground pin name");
            accepts(RST_OPT).withRequiredArg().defaultsTo(STGCompilerConfig.DEFAULT_RST).describedAs("Active low reset pin name");
            accepts(SEE_INTERNALS_OPT, "Expose internal signals as outputs (as inputs with -" + ALL_INPUTS_OPT + ")");
            accepts(ALL_INPUTS_OPT, "Turn every output into an input");
            accepts(SEE_ERROR_OPT, "Add the " + FiringEngine.ERROR_PIN + " output pin");
            accepts(VERBOSE_OPT, "Print stage runtimes and a net summary");
            acceptsAll(Arrays.asList(HELP_OPT, "?"), "Print Help").forHelp();
            nonOptions("STG (.g) file to convert").ofType(String.class);
        }};
        return p;
    }

    private static void printHelp(OptionParser p) {
        MessageGenerator.printHeader("STG to Verilog-A");
        System.out.println("Converts a Signal Transition Graph in .g format into a Verilog-A model that\n"
                + "replays the graph's firing rules and reports violations while it is simulated.\n");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Runs the converter.
     * @param args Command line arguments.
     * @return The process exit status, 0 on success.
     */
    public static int run(String... args) {
        OptionParser p = createOptionParser();
        OptionSet opts;
        try {
            opts = p.parse(args);
        } catch (OptionException e) {
            MessageGenerator.briefError("ERROR: " + e.getMessage());
            return 1;
        }
        if (opts.has(HELP_OPT)) {
            printHelp(p);
            return 0;
        }
        List<?> files = opts.nonOptionArguments();
        if (files.size() != 1) {
            MessageGenerator.briefError("ERROR: Expected exactly one STG file, found " + files.size());
            printHelp(p);
            return 1;
        }
        String stgFileName = (String) files.get(0);
        boolean verbose = opts.has(VERBOSE_OPT);

        STGCompilerConfig config = new STGCompilerConfig()
                .setKindMapping(KindMapping.fromFlags(opts.has(SEE_INTERNALS_OPT), opts.has(ALL_INPUTS_OPT)))
                .setVddName((String) opts.valueOf(VDD_OPT))
                .setVssName((String) opts.valueOf(VSS_OPT))
                .setRstName((String) opts.valueOf(RST_OPT))
                .setSeeError(opts.has(SEE_ERROR_OPT));
        String outFileName = (String) opts.valueOf(OUT_OPT);

        CodePerfTracker t = verbose ? new CodePerfTracker(STG2VerilogA.class.getSimpleName(), true)
                : CodePerfTracker.SILENT;
        try {
            STGModel model = new STGCompiler(config).compileToFile(stgFileName, outFileName, t);
            if (verbose) {
                t.printSummary();
                model.getSTG().printSummary();
                MessageGenerator.briefMessage("Wrote Verilog-A model: " + outFileName);
            }
        } catch (STGException | UncheckedIOException e) {
            MessageGenerator.briefError("ERROR: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            MessageGenerator.briefError(e.getMessage() == null ? e.toString() : e.getMessage());
            return 1;
        }
        return 0;
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }
}
