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

import com.xilinx.rapidstg.va.VAConstant;
import com.xilinx.rapidstg.va.VADigitalPin;
import com.xilinx.rapidstg.va.VADirection;
import com.xilinx.rapidstg.va.VAElectrical;
import com.xilinx.rapidstg.va.VAEventControl;
import com.xilinx.rapidstg.va.VAFatal;
import com.xilinx.rapidstg.va.VAIf;
import com.xilinx.rapidstg.va.VAModule;
import com.xilinx.rapidstg.va.VAParameter;
import com.xilinx.rapidstg.va.VAPotential;
import com.xilinx.rapidstg.va.VAStrobe;
import com.xilinx.rapidstg.va.VAVariable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestVASimulator {

    private VAModule module;

    private VAElectrical vdd;

    private VAElectrical gnd;

    private VADigitalPin a;

    private VADigitalPin y;

    private VAVariable rises;

    @BeforeEach
    public void setup() {
        module = new VAModule("follower");
        gnd = module.electrical("VSS", VADirection.INOUT);
        vdd = module.electrical("VDD", VADirection.INOUT);
        VAParameter res = module.parameter("OUT_RES_PAR", 10e3);
        VAParameter rst = module.parameter("y_RST_VALUE_PAR", 0);
        a = module.inputPin("a", vdd, gnd, new VAConstant(1e-15));
        y = module.driverPin("y", VADirection.OUTPUT, vdd, gnd, rst, VAConstant.FALSE, new VAConstant(1e-12), res);
        rises = module.variable("rises", 0);
    }

    private void follow() {
        module.analog(
                new VAEventControl(a.rising(), rises.inc(), new VAStrobe("a rose")),
                new VAIf(a.level(), y.write(true)).orElse(y.write(false)));
    }

    @Test
    public void testDrivenPinFollowsOneEvaluationLater() {
        follow();
        VASimulator sim = new VASimulator(module);
        Assertions.assertFalse(sim.getLevel("y"));

        sim.setInput("a", true);
        Assertions.assertTrue(sim.hasPendingCrossings());
        sim.evaluate();
        Assertions.assertEquals(1, sim.getValue(rises));
        Assertions.assertEquals(1, sim.getValue("y_$state"));
        // y switched at the end of the evaluation, its crossing is still pending
        Assertions.assertTrue(sim.getLevel("y"));
        Assertions.assertTrue(sim.hasPendingCrossings());

        Assertions.assertEquals(1, sim.settle());
        Assertions.assertFalse(sim.hasPendingCrossings());
        Assertions.assertEquals(1, sim.getValue(rises));
        Assertions.assertEquals(2, sim.getEvaluationCount());
        Assertions.assertEquals(1, sim.getMessages().size());
        Assertions.assertEquals("a rose", sim.getMessages().get(0));
    }

    @Test
    public void testNoEdgeIsLost() {
        follow();
        VASimulator sim = new VASimulator(module);
        sim.setInput("a", true);
        sim.setInput("a", false);
        sim.setInput("a", true);
        sim.settle();
        Assertions.assertEquals(2, sim.getValue(rises));
        Assertions.assertTrue(sim.getLevel("y"));
    }

    @Test
    public void testUnchangedInputRecordsNothing() {
        follow();
        VASimulator sim = new VASimulator(module);
        sim.setInput("a", false);
        Assertions.assertFalse(sim.hasPendingCrossings());
    }

    @Test
    public void testResetValueParameter() {
        VASimulator sim = new VASimulator(module);
        sim.setParameter("y_RST_VALUE_PAR", 1);
        Assertions.assertFalse(sim.getLevel("y"));
        sim.initialize();
        Assertions.assertTrue(sim.getLevel("y"));
        Assertions.assertFalse(sim.hasPendingCrossings());
        Assertions.assertThrows(IllegalArgumentException.class, () -> sim.setParameter("NOPE", 1));
    }

    @Test
    public void testFatal() {
        module.analog(new VAIf(a.level(), new VAFatal("boom")));
        VASimulator sim = new VASimulator(module);
        sim.settle();
        sim.setInput("a", true);
        VASimulationFatalException e = Assertions.assertThrows(VASimulationFatalException.class, sim::settle);
        Assertions.assertEquals("boom", e.getMessage());
        Assertions.assertEquals(2, e.getEvaluation());
        Assertions.assertEquals("boom", sim.getMessages().get(sim.getMessages().size() - 1));
    }

    @Test
    public void testOscillatorDoesNotSettle() {
        module.analog(y.toggle());
        VASimulator sim = new VASimulator(module);
        Assertions.assertThrows(IllegalStateException.class, sim::settle);
    }

    @Test
    public void testSupply() {
        VASimulator sim = new VASimulator(module);
        VAPotential supply = new VAPotential(vdd, gnd);
        Assertions.assertEquals(1.0, sim.evaluate(supply));
        Assertions.assertEquals(1.0, sim.evaluate(supply.gt(0.05)));
        sim.setSupply(0.0);
        Assertions.assertEquals(0.0, sim.evaluate(supply.gt(0.05)));
        sim.setSupply(1.8);
        sim.setInput("a", true);
        Assertions.assertEquals(1.8, sim.evaluate(new VAPotential(a.getNode(), gnd)));
        Assertions.assertEquals(1.0, sim.evaluate(a.level()));
    }

    @Test
    public void testInputsOnly() {
        VASimulator sim = new VASimulator(module);
        Assertions.assertThrows(IllegalArgumentException.class, () -> sim.setInput("y", true));
        Assertions.assertThrows(IllegalArgumentException.class, () -> sim.setInput("b", true));
        Assertions.assertThrows(IllegalArgumentException.class, () -> sim.getValue("b"));
    }
}
