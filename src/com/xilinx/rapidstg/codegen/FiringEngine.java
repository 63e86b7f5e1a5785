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

import java.util.List;

import com.xilinx.rapidstg.stg.Edge;
import com.xilinx.rapidstg.stg.STG;
import com.xilinx.rapidstg.stg.STGElement;
import com.xilinx.rapidstg.stg.STGErrorType;
import com.xilinx.rapidstg.stg.STGException;
import com.xilinx.rapidstg.stg.STGPlace;
import com.xilinx.rapidstg.stg.STGSignal;
import com.xilinx.rapidstg.stg.STGTransition;
import com.xilinx.rapidstg.stg.SignalKind;
import com.xilinx.rapidstg.va.VABlock;
import com.xilinx.rapidstg.va.VAConstant;
import com.xilinx.rapidstg.va.VADigitalPin;
import com.xilinx.rapidstg.va.VADirection;
import com.xilinx.rapidstg.va.VAElectrical;
import com.xilinx.rapidstg.va.VAEventControl;
import com.xilinx.rapidstg.va.VAExpression;
import com.xilinx.rapidstg.va.VAFatal;
import com.xilinx.rapidstg.va.VAIf;
import com.xilinx.rapidstg.va.VAModule;
import com.xilinx.rapidstg.va.VAParameter;
import com.xilinx.rapidstg.va.VAPotential;
import com.xilinx.rapidstg.va.VAStatement;
import com.xilinx.rapidstg.va.VAStrobe;
import com.xilinx.rapidstg.va.VATools;
import com.xilinx.rapidstg.va.VAVariable;
import com.xilinx.rapidstg.va.VAWhile;

/**
 * Synthesizes the behavioral module of an STG.
 *
 * Places become integer token counters and every transition of a controllable
 * signal gets an ongoing cell. Such a transition fires in two steps: the
 * request consumes its tokens and drives the signal, the commit (at the
 * matching crossing of the signal) produces its tokens. Input and dummy
 * transitions fire atomically, inputs at their crossing and dummies inside the
 * cascade loop. The loop runs the requests and dummy firings in emission order
 * until a complete pass fires nothing, and aborts the simulation once it
 * exceeds the configured number of passes.
 *
 * Every observed crossing of a signal must be explained by exactly one
 * completed transition. Violations, capacity overflows and write conflicts
 * print a message and set the sticky STG_ERROR flag, but the simulation
 * continues.
 */
public class FiringEngine {

    public static final String RISE_FALL_PAR = "RISE_FALL_PAR";
    public static final String DELAY_PAR = "DELAY_PAR";
    public static final String IN_CAP_PAR = "IN_CAP_PAR";
    public static final String OUT_RES_PAR = "OUT_RES_PAR";
    public static final String RST_VALUE_PAR_SUFFIX = "_RST_VALUE_PAR";

    public static final double DEFAULT_RISE_FALL = 100e-12;
    public static final double DEFAULT_DELAY = 100e-12;
    public static final double DEFAULT_IN_CAP = 10e-15;
    public static final double DEFAULT_OUT_RES = 10e3;

    /** Edge time of the error output */
    public static final double ERROR_PIN_RISE_FALL = 1e-12;

    /** Minimum supply, in volts, for the net to be active */
    public static final double ACTIVE_SUPPLY_THRESHOLD = 0.05;

    public static final String ERROR_VAR = "STG_ERROR";
    public static final String ERROR_PIN = "__STG_ERROR__";
    public static final String DONE_VAR = "_$done";
    public static final String COUNTER_VAR = "_$counter";
    public static final String COMPLETED_VAR = "_$completed";

    public static final String PLACE_PREFIX = "P_";
    public static final String TRANSITION_PREFIX = "T_";

    public static final String STUCK_MESSAGE = "STG seems to be stuck in an infinite loop of dummy, "
            + "internal or output transitions.";

    private static final Edge[] EMISSION_ORDER = {Edge.RISE, Edge.FALL, Edge.TOGGLE};

    private final STGCompilerConfig config;

    private STGModel model;

    private VAModule module;

    private VAVariable error;

    private VAVariable done;

    private VAVariable completed;

    private VAExpression active;

    public FiringEngine(STGCompilerConfig config) {
        this.config = config;
    }

    public FiringEngine() {
        this(new STGCompilerConfig());
    }

    /**
     * Generates the module of a built STG.
     * @param stg A complete net, as returned by the builder.
     * @return The module and its element handles.
     * @throws STGException if a signal uses the name of a supply or reset pin, or
     * a name the module generates for itself (STG_ERROR, P_&lt;place&gt;,
     * T_&lt;transition&gt;, the *_PAR parameters or the error pin).
     */
    public STGModel synthesize(STG stg) {
        if (!stg.isFrozen()) {
            throw new IllegalStateException("STG " + stg.getName() + " has not been built");
        }
        checkReservedNames(stg);
        try {
            module = new VAModule(stg.getName());
            model = new STGModel(stg, module);

            VAElectrical gnd = module.electrical(config.getVssName(), VADirection.INOUT);
            VAElectrical vdd = module.electrical(config.getVddName(), VADirection.INOUT);
            VAParameter riseFall = module.parameter(RISE_FALL_PAR, DEFAULT_RISE_FALL);
            VAParameter delay = module.parameter(DELAY_PAR, DEFAULT_DELAY);
            VAParameter inCap = module.parameter(IN_CAP_PAR, DEFAULT_IN_CAP);
            VAParameter outRes = module.parameter(OUT_RES_PAR, DEFAULT_OUT_RES);
            error = module.variable(ERROR_VAR, 0);
            model.setErrorVariable(error);

            VADigitalPin rst = module.inputPin(config.getRstName(), vdd, gnd, inCap);
            model.setResetPin(rst);
            active = rst.level().and(new VAPotential(vdd, gnd).gt(ACTIVE_SUPPLY_THRESHOLD));

            done = module.variable(DONE_VAR, 0);
            VAVariable counter = module.variable(COUNTER_VAR, 0);
            completed = module.variable(COMPLETED_VAR, 0);
            model.setLoopVariables(done, counter, completed);

            VADigitalPin errorPin = null;
            if (config.isSeeError()) {
                errorPin = module.driverPin(ERROR_PIN, VADirection.OUTPUT, vdd, gnd, null, VAConstant.FALSE,
                        new VAConstant(ERROR_PIN_RISE_FALL), outRes);
                model.setErrorPin(errorPin);
            }

            for (STGSignal s : stg.getSignals()) {
                if (s.isDummy()) continue;
                String name = VATools.legalize(s.getName());
                VADigitalPin pin;
                if (s.isControllable()) {
                    VAParameter resetValue = module.parameter(name + RST_VALUE_PAR_SUFFIX, 0);
                    VADirection dir = s.getKind() == SignalKind.OUTPUT ? VADirection.OUTPUT : VADirection.INTERNAL;
                    pin = module.driverPin(name, dir, vdd, gnd, resetValue, delay, riseFall, outRes);
                } else {
                    pin = module.inputPin(name, vdd, gnd, inCap);
                }
                model.putPin(s, pin);
            }
            for (STGPlace p : stg.getPlaces()) {
                model.putPlace(p, module.variable(PLACE_PREFIX + VATools.legalize(p.getName()), p.getMarking()));
            }
            for (STGTransition t : stg.getTransitions()) {
                if (t.hasOngoingCell()) {
                    model.putOngoing(t, module.variable(TRANSITION_PREFIX + VATools.legalize(t.getName()), 0));
                }
                model.putGuard(t, guard(t));
            }

            module.analog(new VAEventControl(rst.both()),
                    new VAIf(rst.level().not(), resetSequence(stg)));

            for (STGSignal s : stg.getSignals()) {
                if (!s.isDummy()) {
                    emitEdgeEvents(s);
                }
            }

            VABlock pass = cascadePass(stg);
            if (!pass.isEmpty()) {
                module.analog(new VAIf(active,
                        done.set(0),
                        counter.set(0),
                        new VAWhile(done.not(),
                                counter.inc(),
                                done.set(1),
                                pass,
                                new VAIf(counter.gt(config.getCascadePassLimit()), new VAFatal(STUCK_MESSAGE)))));
            }

            if (errorPin != null) {
                module.analog(errorPin.write(error));
            }
            return model;
        } catch (IllegalArgumentException e) {
            throw new STGException(STGErrorType.DUPLICATE_SIGNAL,
                    "A signal of " + stg.getName() + " clashes with a generated name: " + e.getMessage(), e);
        }
    }

    private void checkReservedNames(STG stg) {
        String[] reserved = {config.getVddName(), config.getVssName(), config.getRstName()};
        for (String r : reserved) {
            STGSignal s = stg.getSignal(r);
            if (s != null && !s.isDummy()) {
                throw new STGException(STGErrorType.DUPLICATE_SIGNAL,
                        "Signal " + r + " clashes with the supply or reset pin of the same name");
            }
        }
    }

    /**
     * Assignments restoring the initial state, in the order the net recorded
     * them.
     */
    private VABlock resetSequence(STG stg) {
        VABlock seq = new VABlock();
        for (STGElement e : stg.getInitSequence()) {
            switch (e.getElementType()) {
                case SIGNAL:
                    VADigitalPin pin = model.getPin((STGSignal) e);
                    seq.add(pin.write(pin.getResetValue().ne(0)));
                    break;
                case PLACE:
                    STGPlace p = (STGPlace) e;
                    seq.add(model.getPlaceVariable(p).set(p.getMarking()));
                    break;
                case TRANSITION:
                    seq.add(model.getOngoingVariable((STGTransition) e).set(0));
                    break;
            }
        }
        return seq;
    }

    private VAExpression guard(STGTransition t) {
        VAExpression g = null;
        for (STGPlace p : t.getFromPlaces()) {
            VAExpression hasToken = model.getPlaceVariable(p).gt(0);
            g = g == null ? hasToken : g.and(hasToken);
        }
        return g == null ? VAConstant.TRUE : g;
    }

    private VAStatement[] takeTokens(STGTransition t) {
        List<STGPlace> from = t.getFromPlaces();
        VAStatement[] stmts = new VAStatement[from.size()];
        for (int i = 0; i < stmts.length; i++) {
            stmts[i] = model.getPlaceVariable(from.get(i)).dec();
        }
        return stmts;
    }

    private VABlock putTokens(STGTransition t) {
        VABlock block = new VABlock();
        for (STGPlace p : t.getToPlaces()) {
            VAVariable tokens = model.getPlaceVariable(p);
            block.add(tokens.inc(),
                    new VAIf(tokens.gt(p.getCapacity()),
                            new VAStrobe(p.getName() + " capacity was violated"),
                            error.set(1)));
        }
        return block;
    }

    private VABlock fire(STGTransition t) {
        return new VABlock(takeTokens(t)).add(putTokens(t));
    }

    /**
     * Reactions to the rising and falling crossings of a signal: commit (for
     * controllable signals) or fire (for inputs) the transitions completed by
     * the edge, then check that exactly one did.
     */
    private void emitEdgeEvents(STGSignal s) {
        VADigitalPin pin = model.getPin(s);
        VAIf onRising = new VAIf(active, completed.set(0));
        VAIf onFalling = new VAIf(active, completed.set(0));
        for (Edge edge : EMISSION_ORDER) {
            for (STGTransition t : s.getTransitions(edge)) {
                VAStatement completion = s.isControllable() ? commit(t) : atomicCompletion(t);
                if (edge.completesOnRising()) {
                    onRising.then(completion);
                }
                if (edge.completesOnFalling()) {
                    onFalling.then(completion);
                }
            }
        }
        onRising.then(edgeChecks(s, Edge.RISE));
        onFalling.then(edgeChecks(s, Edge.FALL));
        module.analog(new VAEventControl(pin.rising(), onRising),
                new VAEventControl(pin.falling(), onFalling));
    }

    private VAStatement commit(STGTransition t) {
        VAVariable ongoing = model.getOngoingVariable(t);
        return new VAIf(ongoing, ongoing.set(0), putTokens(t), completed.inc());
    }

    private VAStatement atomicCompletion(STGTransition t) {
        return new VAIf(model.getGuard(t), fire(t), completed.inc());
    }

    private VAStatement[] edgeChecks(STGSignal s, Edge edge) {
        String label = s.getName() + edge.getMarker();
        return new VAStatement[] {
            new VAIf(completed.eq(0),
                    new VAStrobe("No transitions related to " + label + " are enabled"),
                    error.set(1)),
            new VAIf(completed.gt(1),
                    new VAStrobe("More than one transition fires for " + label),
                    error.set(1))
        };
    }

    /**
     * One pass of the cascade loop: dummy firings first, then the requests of
     * controllable transitions by signal, edge and creation order.
     */
    private VABlock cascadePass(STG stg) {
        VABlock pass = new VABlock();
        for (STGSignal s : stg.getSignals()) {
            if (!s.isDummy()) continue;
            for (STGTransition t : s.getTransitions()) {
                pass.add(new VAIf(model.getGuard(t), fire(t), done.set(0)));
            }
        }
        for (STGSignal s : stg.getSignals()) {
            if (!s.isControllable()) continue;
            for (Edge edge : EMISSION_ORDER) {
                for (STGTransition t : s.getTransitions(edge)) {
                    pass.add(request(t));
                }
            }
        }
        return pass;
    }

    private VAStatement request(STGTransition t) {
        VADigitalPin pin = model.getPin(t.getSignal());
        VAVariable state = pin.getState();
        VAIf req = new VAIf(model.getGuard(t));
        req.then(takeTokens(t));
        req.then(model.getOngoingVariable(t).set(1));
        switch (t.getEdge()) {
            case RISE:
                req.then(new VAIf(state, writeConflict(t, "high")).orElse(pin.write(true)));
                break;
            case FALL:
                req.then(new VAIf(state, pin.write(false)).orElse(writeConflict(t, "low")));
                break;
            case TOGGLE:
                req.then(pin.toggle());
                break;
        }
        req.then(done.set(0));
        return req;
    }

    private VABlock writeConflict(STGTransition t, String level) {
        return new VABlock(
                new VAStrobe(t.getName() + " failed to trigger because " + t.getSignal().getName()
                        + " is already " + level),
                error.set(1));
    }
}
