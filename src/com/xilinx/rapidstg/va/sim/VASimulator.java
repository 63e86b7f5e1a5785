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

package com.xilinx.rapidstg.va.sim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.rapidstg.util.Params;
import com.xilinx.rapidstg.va.VAAssignment;
import com.xilinx.rapidstg.va.VABinaryExpression;
import com.xilinx.rapidstg.va.VABlock;
import com.xilinx.rapidstg.va.VAConstant;
import com.xilinx.rapidstg.va.VADigitalPin;
import com.xilinx.rapidstg.va.VAElectrical;
import com.xilinx.rapidstg.va.VAEventControl;
import com.xilinx.rapidstg.va.VAExpression;
import com.xilinx.rapidstg.va.VAExpressionVisitor;
import com.xilinx.rapidstg.va.VAFatal;
import com.xilinx.rapidstg.va.VAIf;
import com.xilinx.rapidstg.va.VAModule;
import com.xilinx.rapidstg.va.VANotExpression;
import com.xilinx.rapidstg.va.VAOperator;
import com.xilinx.rapidstg.va.VAParameter;
import com.xilinx.rapidstg.va.VAPinLevel;
import com.xilinx.rapidstg.va.VAPotential;
import com.xilinx.rapidstg.va.VAStatement;
import com.xilinx.rapidstg.va.VAStatementVisitor;
import com.xilinx.rapidstg.va.VAStrobe;
import com.xilinx.rapidstg.va.VAVariable;
import com.xilinx.rapidstg.va.VAWhile;

/**
 * Executes the analog block of a {@link VAModule} in zero-delay, event driven
 * fashion. Every pin is a logic level; supply nodes sit at the supply voltage
 * and every other node at 0 V. One call to {@link #evaluate()} is one analog
 * evaluation: event bodies run for the crossings recorded since the previous
 * evaluation, then every driven pin whose state differs from its level flips
 * and records a new crossing. Output transitions therefore become visible one
 * evaluation after they were requested, the way a delayed transition() filter
 * makes them visible to the real simulator.
 *
 * Not thread-safe.
 */
public class VASimulator implements VAStatementVisitor, VAExpressionVisitor<Double> {

    private final VAModule module;

    private final Map<VAVariable, Integer> values = new HashMap<>();

    private final Map<VAParameter, Double> parameters = new HashMap<>();

    private final Map<VADigitalPin, Boolean> levels = new HashMap<>();

    /** Pins that crossed since the last evaluation, mapped to true for rising */
    private final Map<VADigitalPin, Boolean> crossings = new LinkedHashMap<>();

    private final Set<VAElectrical> supplyNodes = new HashSet<>();

    private final Map<VAElectrical, VADigitalPin> pinsByNode = new HashMap<>();

    private final List<String> messages = new ArrayList<>();

    private double supply = 1.0;

    private int evaluations;

    public VASimulator(VAModule module) {
        this.module = module;
        for (VAParameter p : module.getParameters()) {
            parameters.put(p, p.getDefaultValue());
        }
        for (VADigitalPin pin : module.getPins()) {
            supplyNodes.add(pin.getDomain());
            pinsByNode.put(pin.getNode(), pin);
        }
        initialize();
    }

    /**
     * Restores the state at time zero: variables at their initial values,
     * driven pins at their reset value (without crossing) and inputs low.
     * Messages and parameter overrides are kept.
     */
    public void initialize() {
        for (VAVariable v : module.getVariables()) {
            values.put(v, v.getInitialValue());
        }
        crossings.clear();
        for (VADigitalPin pin : module.getPins()) {
            boolean level = false;
            if (pin.isDriver()) {
                if (pin.getResetValue() != null) {
                    values.put(pin.getState(), parameters.get(pin.getResetValue()) != 0 ? 1 : 0);
                }
                level = values.get(pin.getState()) != 0;
            }
            levels.put(pin, level);
        }
        evaluations = 0;
    }

    /**
     * Overrides a parameter value. Reset values of driven pins are read again by
     * the next {@link #initialize()}.
     */
    public VASimulator setParameter(String name, double value) {
        VAParameter p = module.getParameter(name);
        if (p == null) {
            throw new IllegalArgumentException("Module " + module.getName() + " has no parameter " + name);
        }
        parameters.put(p, value);
        return this;
    }

    public VASimulator setSupply(double volts) {
        this.supply = volts;
        return this;
    }

    /**
     * Drives an input pin. A change of level records a crossing. If the pin
     * already has an unprocessed crossing, one evaluation runs first so that no
     * edge is lost.
     * @param name Name of the input pin.
     * @param level The new logic level.
     * @return This simulator.
     */
    public VASimulator setInput(String name, boolean level) {
        VADigitalPin pin = module.getPin(name);
        if (pin == null || pin.isDriver()) {
            throw new IllegalArgumentException(name + " is not an input of module " + module.getName());
        }
        if (levels.get(pin) == level) return this;
        if (crossings.containsKey(pin)) {
            evaluate();
        }
        levels.put(pin, level);
        crossings.put(pin, level);
        return this;
    }

    /**
     * Runs one analog evaluation.
     */
    public void evaluate() {
        evaluations++;
        module.getAnalog().accept(this);
        crossings.clear();
        for (VADigitalPin pin : module.getPins()) {
            if (!pin.isDriver()) continue;
            boolean state = values.get(pin.getState()) != 0;
            if (state != levels.get(pin)) {
                levels.put(pin, state);
                crossings.put(pin, state);
            }
        }
    }

    /**
     * Evaluates until no crossing is pending, at least once.
     * @return The number of evaluations performed.
     * @throws IllegalStateException if the module is still switching after
     * {@link Params#RS_SIM_MAX_EVALUATIONS} evaluations.
     */
    public int settle() {
        int count = 0;
        do {
            if (count >= Params.RS_SIM_MAX_EVALUATIONS) {
                throw new IllegalStateException("Module " + module.getName() + " did not settle after "
                        + count + " evaluations");
            }
            evaluate();
            count++;
        } while (!crossings.isEmpty());
        return count;
    }

    public boolean hasPendingCrossings() {
        return !crossings.isEmpty();
    }

    public int getValue(VAVariable v) {
        return values.get(v);
    }

    public int getValue(String variableName) {
        VAVariable v = module.getVariable(variableName);
        if (v == null) {
            throw new IllegalArgumentException("Module " + module.getName() + " has no variable " + variableName);
        }
        return values.get(v);
    }

    /**
     * Forces a variable, e.g. to preset a marking before probing a guard.
     */
    public void setValue(VAVariable v, int value) {
        values.put(v, value);
    }

    public boolean getLevel(VADigitalPin pin) {
        return levels.get(pin);
    }

    public boolean getLevel(String pinName) {
        VADigitalPin pin = module.getPin(pinName);
        if (pin == null) {
            throw new IllegalArgumentException("Module " + module.getName() + " has no pin " + pinName);
        }
        return levels.get(pin);
    }

    /**
     * Evaluates an expression against the current state.
     */
    public double evaluate(VAExpression expression) {
        return expression.accept(this);
    }

    /**
     * @return Messages printed by $strobe and $fatal, oldest first.
     */
    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public void clearMessages() {
        messages.clear();
    }

    public int getEvaluationCount() {
        return evaluations;
    }

    private double voltage(VAElectrical node) {
        VADigitalPin pin = pinsByNode.get(node);
        if (pin != null) {
            return levels.get(pin) ? supply : 0.0;
        }
        return supplyNodes.contains(node) ? supply : 0.0;
    }

    private boolean test(VAExpression e) {
        return e.accept(this) != 0.0;
    }

    @Override
    public void visitBlock(VABlock block) {
        for (VAStatement s : block.getStatements()) {
            s.accept(this);
        }
    }

    @Override
    public void visitAssignment(VAAssignment assignment) {
        values.put(assignment.getTarget(), (int) (double) assignment.getValue().accept(this));
    }

    @Override
    public void visitIf(VAIf statement) {
        if (test(statement.getCondition())) {
            statement.getThen().accept(this);
        } else {
            statement.getElse().accept(this);
        }
    }

    @Override
    public void visitWhile(VAWhile statement) {
        while (test(statement.getCondition())) {
            statement.getBody().accept(this);
        }
    }

    @Override
    public void visitEventControl(VAEventControl statement) {
        Boolean rising = crossings.get(statement.getEvent().getPin());
        if (rising != null && statement.getEvent().getDirection().matches(rising)) {
            statement.getBody().accept(this);
        }
    }

    @Override
    public void visitStrobe(VAStrobe statement) {
        messages.add(statement.getMessage());
    }

    @Override
    public void visitFatal(VAFatal statement) {
        messages.add(statement.getMessage());
        throw new VASimulationFatalException(statement.getMessage(), evaluations);
    }

    @Override
    public Double visitConstant(VAConstant c) {
        return c.getValue();
    }

    @Override
    public Double visitParameter(VAParameter p) {
        return parameters.get(p);
    }

    @Override
    public Double visitVariable(VAVariable v) {
        return (double) values.get(v);
    }

    private static double bool(boolean b) {
        return b ? 1.0 : 0.0;
    }

    @Override
    public Double visitBinary(VABinaryExpression e) {
        if (e.getOperator() == VAOperator.AND) {
            return bool(test(e.getLeft()) && test(e.getRight()));
        }
        double l = e.getLeft().accept(this);
        double r = e.getRight().accept(this);
        switch (e.getOperator()) {
            case GT:
                return bool(l > r);
            case EQ:
                return bool(l == r);
            case NE:
                return bool(l != r);
            default:
                throw new UnsupportedOperationException("Unsupported operator " + e.getOperator());
        }
    }

    @Override
    public Double visitNot(VANotExpression e) {
        return bool(!test(e.getOperand()));
    }

    @Override
    public Double visitPotential(VAPotential e) {
        return voltage(e.getPositive()) - voltage(e.getNegative());
    }

    @Override
    public Double visitPinLevel(VAPinLevel e) {
        VADigitalPin pin = e.getPin();
        return bool(voltage(pin.getNode()) - voltage(pin.getGround())
                > (voltage(pin.getDomain()) - voltage(pin.getGround())) / 2);
    }
}
