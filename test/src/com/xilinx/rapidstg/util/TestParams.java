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

package com.xilinx.rapidstg.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestParams {

    private static final String KEY = "RS_TEST_PARAMS_SETTING";

    @AfterEach
    public void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    public void testUnsetReturnsDefault() {
        Assertions.assertNull(Params.getParamValue(KEY));
        Assertions.assertNull(Params.getParamIntValue(KEY));
        Assertions.assertEquals(42, Params.getParamOrDefaultIntSetting(KEY, 42));
    }

    @Test
    public void testJvmProperty() {
        System.setProperty(KEY, "7");
        Assertions.assertEquals("7", Params.getParamValue(KEY));
        Assertions.assertEquals(7, Params.getParamOrDefaultIntSetting(KEY, 42));
    }

    @Test
    public void testUnparsableValue() {
        System.setProperty(KEY, "many");
        Assertions.assertNull(Params.getParamIntValue(KEY));
        Assertions.assertEquals(42, Params.getParamOrDefaultIntSetting(KEY, 42));
    }

    @Test
    public void testDefaults() {
        if (Params.getParamValue(Params.RS_CASCADE_PASS_LIMIT_NAME) == null) {
            Assertions.assertEquals(Params.RS_DEFAULT_CASCADE_PASS_LIMIT, Params.RS_CASCADE_PASS_LIMIT);
        }
        if (Params.getParamValue(Params.RS_SIM_MAX_EVALUATIONS_NAME) == null) {
            Assertions.assertEquals(Params.RS_DEFAULT_SIM_MAX_EVALUATIONS, Params.RS_SIM_MAX_EVALUATIONS);
        }
    }
}
