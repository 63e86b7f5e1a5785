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

package com.xilinx.rapidstg.stg;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class TestSTGNameResolver {

    private STG stg;

    private STGNameResolver resolver;

    @BeforeEach
    public void setup() {
        stg = new STG("resolver");
        STGRegistry registry = new STGRegistry(stg);
        registry.createSignal("a", SignalKind.INPUT, SignalKind.INPUT);
        registry.createSignal("b", SignalKind.OUTPUT, SignalKind.OUTPUT);
        registry.createSignal("x", SignalKind.INTERNAL, SignalKind.INTERNAL);
        registry.createSignal("d", SignalKind.DUMMY, SignalKind.DUMMY);
        resolver = new STGNameResolver(registry);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a+", "a-/1", "b~", "x-/12", "d", "d/3", "p0", "q_1"})
    public void testResolveIsIdempotent(String token) {
        STGElement first = resolver.resolve(token);
        STGElement second = resolver.resolve(token);
        Assertions.assertSame(first, second);
        Assertions.assertEquals(token, first.getName());
    }

    @ParameterizedTest
    @CsvSource({
        "a+,   a, RISE",
        "a-/2, a, FALL",
        "b~,   b, TOGGLE",
        "x+/1, x, RISE",
    })
    public void testTransitions(String token, String signal, Edge edge) {
        STGElement e = resolver.resolve(token);
        Assertions.assertEquals(STGElementType.TRANSITION, e.getElementType());
        STGTransition t = (STGTransition) e;
        Assertions.assertEquals(signal, t.getSignal().getName());
        Assertions.assertEquals(edge, t.getEdge());
        Assertions.assertTrue(t.getSignal().getTransitions(edge).contains(t));
    }

    @Test
    public void testDistinctInstancesOfOneEdge() {
        STGTransition t1 = (STGTransition) resolver.resolve("a+/1");
        STGTransition t2 = (STGTransition) resolver.resolve("a+/2");
        Assertions.assertNotSame(t1, t2);
        Assertions.assertEquals(2, stg.getSignal("a").getTransitions(Edge.RISE).size());
    }

    @Test
    public void testDummyTransition() {
        STGTransition t = (STGTransition) resolver.resolve("d/1");
        Assertions.assertNull(t.getEdge());
        Assertions.assertTrue(t.getSignal().isDummy());
        Assertions.assertFalse(t.hasOngoingCell());
    }

    @Test
    public void testOngoingCells() {
        Assertions.assertFalse(((STGTransition) resolver.resolve("a+")).hasOngoingCell());
        Assertions.assertTrue(((STGTransition) resolver.resolve("b+")).hasOngoingCell());
        Assertions.assertTrue(((STGTransition) resolver.resolve("x-")).hasOngoingCell());
    }

    @Test
    public void testUnknownBaseIsPlace() {
        STGElement p = resolver.resolve("p3");
        Assertions.assertEquals(STGElementType.PLACE, p.getElementType());
        Assertions.assertSame(p, stg.getPlace("p3"));
        // An edge marker on an undeclared name still yields a place
        Assertions.assertEquals(STGElementType.PLACE, resolver.resolve("z+").getElementType());
    }

    @ParameterizedTest
    @ValueSource(strings = {"p-1", "q+/2x", "r~~", "s/t"})
    public void testUndeclaredBaseWithTrailingTextIsPlace(String token) {
        STGElement p = resolver.resolve(token);
        Assertions.assertEquals(STGElementType.PLACE, p.getElementType());
        Assertions.assertSame(p, stg.getPlace(token));
        Assertions.assertSame(p, resolver.resolve(token));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a", "b/2", "1a+", "a++", "", "a-1", "x~/2~"})
    public void testMalformedTokens(String token) {
        STGException e = Assertions.assertThrows(STGException.class, () -> resolver.resolve(token));
        Assertions.assertEquals(STGErrorType.MALFORMED_TOKEN, e.getType());
    }

    @Test
    public void testDuplicateSignal() {
        STGRegistry registry = new STGRegistry(new STG("dup"));
        registry.createSignal("a", SignalKind.INPUT, SignalKind.INPUT);
        STGException e = Assertions.assertThrows(STGException.class,
                () -> registry.createSignal("a", SignalKind.DUMMY, SignalKind.DUMMY));
        Assertions.assertEquals(STGErrorType.DUPLICATE_SIGNAL, e.getType());
        Assertions.assertEquals("Duplicated signal a", e.getMessage());
    }
}
