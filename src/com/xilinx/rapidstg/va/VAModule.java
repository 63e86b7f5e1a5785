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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

/**
 * A behavioral Verilog-A module: its nodes, parameters, integer variables,
 * digital pins and the statements of its analog block. Declarations keep the
 * order in which they were created.
 */
public class VAModule {

    private final String name;

    private final List<VAElectrical> electricals = new ArrayList<>();

    private final List<VAParameter> parameters = new ArrayList<>();

    private final List<VAVariable> variables = new ArrayList<>();

    private final List<VADigitalPin> pins = new ArrayList<>();

    private final VABlock analog = new VABlock();

    private final Set<String> identifiers = new HashSet<>();

    public VAModule(String name) {
        this.name = VATools.legalize(name);
    }

    public String getName() {
        return name;
    }

    private String claim(String identifier) {
        if (!identifiers.add(identifier)) {
            throw new IllegalArgumentException("Identifier " + identifier
                    + " is declared twice in module " + name);
        }
        return identifier;
    }

    public VAElectrical electrical(String name, VADirection direction) {
        VAElectrical e = new VAElectrical(claim(name), direction);
        electricals.add(e);
        return e;
    }

    public VAParameter parameter(String name, double defaultValue) {
        VAParameter p = new VAParameter(claim(name), defaultValue);
        parameters.add(p);
        return p;
    }

    public VAVariable variable(String name, int initialValue) {
        VAVariable v = new VAVariable(claim(name), initialValue);
        variables.add(v);
        return v;
    }

    /**
     * Creates an input pin loaded by a capacitance to ground.
     * @param name Node name.
     * @param domain Supply node defining the logic high level.
     * @param ground Ground node.
     * @param capacitance Input capacitance.
     * @return The pin.
     */
    public VADigitalPin inputPin(String name, VAElectrical domain, VAElectrical ground,
            VAExpression capacitance) {
        VAElectrical node = electrical(name, VADirection.INPUT);
        VADigitalPin pin = new VADigitalPin(node, domain, ground, null, null, null, null, capacitance);
        pins.add(pin);
        return pin;
    }

    /**
     * Creates a driven pin. Its state variable is named after the node with a
     * "_$state" suffix.
     * @param name Node name.
     * @param direction OUTPUT for a port, INTERNAL for a hidden node.
     * @param resetValue Parameter holding the value driven after reset, may be
     * null.
     * @return The pin.
     */
    public VADigitalPin driverPin(String name, VADirection direction, VAElectrical domain,
            VAElectrical ground, VAParameter resetValue, VAExpression delay, VAExpression riseFall,
            VAExpression resistance) {
        if (direction != VADirection.OUTPUT && direction != VADirection.INTERNAL) {
            throw new IllegalArgumentException("Driven pin " + name + " cannot be " + direction);
        }
        VAElectrical node = electrical(name, direction);
        VAVariable state = variable(name + "_$state", 0);
        VADigitalPin pin = new VADigitalPin(node, domain, ground, state, resetValue, delay, riseFall,
                resistance);
        pins.add(pin);
        return pin;
    }

    /**
     * Appends statements to the analog block.
     */
    public VAModule analog(VAStatement... statements) {
        analog.add(statements);
        return this;
    }

    public List<VAElectrical> getElectricals() {
        return Collections.unmodifiableList(electricals);
    }

    /**
     * @return The electricals that are ports, in declaration order.
     */
    public List<VAElectrical> getPorts() {
        List<VAElectrical> ports = new ArrayList<>();
        for (VAElectrical e : electricals) {
            if (e.getDirection().isPort()) ports.add(e);
        }
        return ports;
    }

    public List<VAParameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public List<VAVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<VADigitalPin> getPins() {
        return Collections.unmodifiableList(pins);
    }

    @Nullable
    public VADigitalPin getPin(String name) {
        for (VADigitalPin p : pins) {
            if (p.getName().equals(name)) return p;
        }
        return null;
    }

    @Nullable
    public VAVariable getVariable(String name) {
        for (VAVariable v : variables) {
            if (v.getName().equals(name)) return v;
        }
        return null;
    }

    @Nullable
    public VAParameter getParameter(String name) {
        for (VAParameter p : parameters) {
            if (p.getName().equals(name)) return p;
        }
        return null;
    }

    public VABlock getAnalog() {
        return analog;
    }
}
