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

package com.xilinx.rapidstg.codegen;

import java.util.HashMap;
import java.util.Map;

import com.xilinx.rapidstg.stg.STG;
import com.xilinx.rapidstg.stg.STGPlace;
import com.xilinx.rapidstg.stg.STGSignal;
import com.xilinx.rapidstg.stg.STGTransition;
import com.xilinx.rapidstg.va.VADigitalPin;
import com.xilinx.rapidstg.va.VAExpression;
import com.xilinx.rapidstg.va.VAModule;
import com.xilinx.rapidstg.va.VAVariable;

import org.jetbrains.annotations.Nullable;

/**
 * The module generated from an STG together with the handles that tie each
 * net element to the variable or pin that represents it.
 */
public class STGModel {

    private final STG stg;

    private final VAModule module;

    private final Map<STGPlace, VAVariable> placeVars = new HashMap<>();

    private final Map<STGTransition, VAVariable> ongoingVars = new HashMap<>();

    private final Map<STGTransition, VAExpression> guards = new HashMap<>();

    private final Map<STGSignal, VADigitalPin> pins = new HashMap<>();

    private VAVariable errorVar;

    private VAVariable doneVar;

    private VAVariable counterVar;

    private VAVariable completedVar;

    private VADigitalPin resetPin;

    private VADigitalPin errorPin;

    STGModel(STG stg, VAModule module) {
        this.stg = stg;
        this.module = module;
    }

    public STG getSTG() {
        return stg;
    }

    public VAModule getModule() {
        return module;
    }

    /**
     * @return The token count variable of the named place.
     */
    @Nullable
    public VAVariable getPlaceVariable(String placeName) {
        STGPlace p = stg.getPlace(placeName);
        return p == null ? null : placeVars.get(p);
    }

    public VAVariable getPlaceVariable(STGPlace place) {
        return placeVars.get(place);
    }

    /**
     * @return The ongoing cell of the named transition, null for transitions
     * that fire atomically.
     */
    @Nullable
    public VAVariable getOngoingVariable(String transitionName) {
        STGTransition t = stg.getTransition(transitionName);
        return t == null ? null : ongoingVars.get(t);
    }

    @Nullable
    public VAVariable getOngoingVariable(STGTransition transition) {
        return ongoingVars.get(transition);
    }

    /**
     * @return The enabling condition of the transition.
     */
    public VAExpression getGuard(STGTransition transition) {
        return guards.get(transition);
    }

    @Nullable
    public VADigitalPin getPin(String signalName) {
        STGSignal s = stg.getSignal(signalName);
        return s == null ? null : pins.get(s);
    }

    public VADigitalPin getPin(STGSignal signal) {
        return pins.get(signal);
    }

    /**
     * @return The sticky error flag set by every runtime diagnostic.
     */
    public VAVariable getErrorVariable() {
        return errorVar;
    }

    public VAVariable getDoneVariable() {
        return doneVar;
    }

    /**
     * @return The pass counter of the cascade loop.
     */
    public VAVariable getCounterVariable() {
        return counterVar;
    }

    /**
     * @return The count of transitions completed by the last observed edge.
     */
    public VAVariable getCompletedVariable() {
        return completedVar;
    }

    public VADigitalPin getResetPin() {
        return resetPin;
    }

    /**
     * @return The error output, null unless requested in the configuration.
     */
    @Nullable
    public VADigitalPin getErrorPin() {
        return errorPin;
    }

    void putPlace(STGPlace p, VAVariable v) {
        placeVars.put(p, v);
    }

    void putOngoing(STGTransition t, VAVariable v) {
        ongoingVars.put(t, v);
    }

    void putGuard(STGTransition t, VAExpression guard) {
        guards.put(t, guard);
    }

    void putPin(STGSignal s, VADigitalPin pin) {
        pins.put(s, pin);
    }

    void setErrorVariable(VAVariable errorVar) {
        this.errorVar = errorVar;
    }

    void setLoopVariables(VAVariable done, VAVariable counter, VAVariable completed) {
        this.doneVar = done;
        this.counterVar = counter;
        this.completedVar = completed;
    }

    void setResetPin(VADigitalPin resetPin) {
        this.resetPin = resetPin;
    }

    void setErrorPin(VADigitalPin errorPin) {
        this.errorPin = errorPin;
    }
}
