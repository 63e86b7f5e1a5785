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

import org.jetbrains.annotations.Nullable;

/**
 * A digital signal carried on an electrical node of the module. Inputs load
 * their node with a capacitance. Drivers (outputs and internal nodes) keep the
 * requested logic value in a state variable and drive the node towards it
 * through a series resistance, with a delayed, slope limited transition.
 */
public class VADigitalPin {

    private final VAElectrical node;

    private final VAElectrical domain;

    private final VAElectrical ground;

    private final VAVariable state;

    private final VAParameter resetValue;

    private final VAExpression delay;

    private final VAExpression riseFall;

    private final VAExpression load;

    private final VAPinLevel level;

    VADigitalPin(VAElectrical node, VAElectrical domain, VAElectrical ground, VAVariable state,
            VAParameter resetValue, VAExpression delay, VAExpression riseFall, VAExpression load) {
        this.node = node;
        this.domain = domain;
        this.ground = ground;
        this.state = state;
        this.resetValue = resetValue;
        this.delay = delay;
        this.riseFall = riseFall;
        this.load = load;
        this.level = new VAPinLevel(this);
    }

    public String getName() {
        return node.getName();
    }

    public VAElectrical getNode() {
        return node;
    }

    public VAElectrical getDomain() {
        return domain;
    }

    public VAElectrical getGround() {
        return ground;
    }

    public VADirection getDirection() {
        return node.getDirection();
    }

    /**
     * @return True if the module drives this pin.
     */
    public boolean isDriver() {
        return state != null;
    }

    /**
     * @return The variable holding the driven logic value, null for inputs.
     */
    @Nullable
    public VAVariable getState() {
        return state;
    }

    /**
     * @return The parameter giving the value driven after reset, or null.
     */
    @Nullable
    public VAParameter getResetValue() {
        return resetValue;
    }

    public VAExpression getDelay() {
        return delay;
    }

    public VAExpression getRiseFall() {
        return riseFall;
    }

    /**
     * @return Input capacitance for inputs, output resistance for drivers.
     */
    public VAExpression getLoad() {
        return load;
    }

    /**
     * @return The logic level currently observed on the node.
     */
    public VAExpression level() {
        return level;
    }

    /**
     * @param value Logic value to drive.
     * @return A statement requesting the pin to move to value.
     */
    public VAAssignment write(VAExpression value) {
        checkDriver();
        return state.set(value);
    }

    public VAAssignment write(boolean value) {
        return write(VAExpression.bool(value));
    }

    /**
     * @return A statement inverting the driven value.
     */
    public VAAssignment toggle() {
        checkDriver();
        return state.set(state.not());
    }

    public VACrossing rising() {
        return new VACrossing(this, VACrossingDirection.RISING);
    }

    public VACrossing falling() {
        return new VACrossing(this, VACrossingDirection.FALLING);
    }

    public VACrossing both() {
        return new VACrossing(this, VACrossingDirection.BOTH);
    }

    private void checkDriver() {
        if (state == null) {
            throw new IllegalStateException("Input pin " + getName() + " cannot be driven");
        }
    }

    @Override
    public String toString() {
        return getName();
    }
}
