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
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Renders a {@link VAModule} as Verilog-A source text.
 */
public class VAWriter implements VAStatementVisitor, VAExpressionVisitor<String> {

    private static final String INDENT = "    ";

    private final PrintWriter pw;

    private int depth;

    private VAWriter(Writer out) {
        this.pw = out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
    }

    /**
     * Writes the module to out. The writer is flushed but not closed.
     */
    public static void write(VAModule module, Writer out) {
        VAWriter w = new VAWriter(out);
        w.writeModule(module);
        w.pw.flush();
    }

    public static void writeToFile(VAModule module, Path file) {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(module, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " + file, e);
        }
    }

    public static String toString(VAModule module) {
        StringWriter sw = new StringWriter();
        write(module, sw);
        return sw.toString();
    }

    private void line(String text) {
        for (int i = 0; !text.isEmpty() && i < depth; i++) {
            pw.print(INDENT);
        }
        pw.print(text);
        pw.print('\n');
    }

    private void writeModule(VAModule module) {
        line("`include \"constants.vams\"");
        line("`include \"disciplines.vams\"");
        line("");
        String ports = module.getPorts().stream().map(VAElectrical::getName).collect(Collectors.joining(", "));
        line("module " + module.getName() + "(" + ports + ");");
        depth++;
        for (VAElectrical e : module.getElectricals()) {
            if (e.getDirection().isPort()) {
                line(e.getDirection().getKeyword() + " " + e.getName() + ";");
            }
            line("electrical " + e.getName() + ";");
        }
        if (!module.getParameters().isEmpty()) {
            line("");
            for (VAParameter p : module.getParameters()) {
                line("parameter real " + p.getName() + " = " + VATools.formatNumber(p.getDefaultValue()) + ";");
            }
        }
        if (!module.getVariables().isEmpty()) {
            line("");
            for (VAVariable v : module.getVariables()) {
                line("integer " + v.getName() + ";");
            }
        }
        line("");
        line("analog begin");
        depth++;
        writeInitialStep(module);
        module.getAnalog().accept(this);
        for (VADigitalPin pin : module.getPins()) {
            writeContribution(pin);
        }
        depth--;
        line("end");
        depth--;
        line("endmodule");
    }

    private void writeInitialStep(VAModule module) {
        line("@(initial_step) begin");
        depth++;
        for (VAVariable v : module.getVariables()) {
            line(v.getName() + " = " + v.getInitialValue() + ";");
        }
        for (VADigitalPin pin : module.getPins()) {
            if (pin.isDriver() && pin.getResetValue() != null) {
                line(pin.getState().getName() + " = (" + pin.getResetValue().getName() + " != 0);");
            }
        }
        depth--;
        line("end");
    }

    private String potential(VAElectrical p, VAElectrical n) {
        return "V(" + p.getName() + ", " + n.getName() + ")";
    }

    private void writeContribution(VADigitalPin pin) {
        String v = potential(pin.getNode(), pin.getGround());
        String branch = "I(" + pin.getNode().getName() + ", " + pin.getGround().getName() + ")";
        if (pin.isDriver()) {
            String rf = pin.getRiseFall().accept(this);
            String target = potential(pin.getDomain(), pin.getGround()) + "*transition("
                    + pin.getState().getName() + ", " + pin.getDelay().accept(this) + ", " + rf + ", " + rf + ")";
            line(branch + " <+ (" + v + " - " + target + ")/" + pin.getLoad().accept(this) + ";");
        } else {
            line(branch + " <+ " + pin.getLoad().accept(this) + "*ddt(" + v + ");");
        }
    }

    private void writeBody(VABlock block) {
        depth++;
        block.accept(this);
        depth--;
    }

    private static String quote(String message) {
        return "\"" + message.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    public void visitBlock(VABlock block) {
        for (VAStatement s : block.getStatements()) {
            s.accept(this);
        }
    }

    @Override
    public void visitAssignment(VAAssignment assignment) {
        line(assignment.getTarget().getName() + " = " + assignment.getValue().accept(this) + ";");
    }

    @Override
    public void visitIf(VAIf statement) {
        line("if (" + statement.getCondition().accept(this) + ") begin");
        writeBody(statement.getThen());
        if (statement.hasElse()) {
            line("end else begin");
            writeBody(statement.getElse());
        }
        line("end");
    }

    @Override
    public void visitWhile(VAWhile statement) {
        line("while (" + statement.getCondition().accept(this) + ") begin");
        writeBody(statement.getBody());
        line("end");
    }

    @Override
    public void visitEventControl(VAEventControl statement) {
        VACrossing event = statement.getEvent();
        VADigitalPin pin = event.getPin();
        String arg = "cross(" + potential(pin.getNode(), pin.getGround()) + " - "
                + potential(pin.getDomain(), pin.getGround()) + "/2, " + event.getDirection().getArgument() + ")";
        if (statement.getBody().isEmpty()) {
            line("@(" + arg + ") ;");
            return;
        }
        line("@(" + arg + ") begin");
        writeBody(statement.getBody());
        line("end");
    }

    @Override
    public void visitStrobe(VAStrobe statement) {
        line("$strobe(" + quote(statement.getMessage()) + ");");
    }

    @Override
    public void visitFatal(VAFatal statement) {
        line("$fatal(1, " + quote(statement.getMessage()) + ");");
    }

    @Override
    public String visitConstant(VAConstant c) {
        return VATools.formatNumber(c.getValue());
    }

    @Override
    public String visitParameter(VAParameter p) {
        return p.getName();
    }

    @Override
    public String visitVariable(VAVariable v) {
        return v.getName();
    }

    @Override
    public String visitBinary(VABinaryExpression e) {
        return "(" + e.getLeft().accept(this) + " " + e.getOperator().getSymbol() + " "
                + e.getRight().accept(this) + ")";
    }

    @Override
    public String visitNot(VANotExpression e) {
        return "!" + e.getOperand().accept(this);
    }

    @Override
    public String visitPotential(VAPotential e) {
        return potential(e.getPositive(), e.getNegative());
    }

    @Override
    public String visitPinLevel(VAPinLevel e) {
        VADigitalPin pin = e.getPin();
        return "(" + potential(pin.getNode(), pin.getGround()) + " > "
                + potential(pin.getDomain(), pin.getGround()) + "/2)";
    }
}
