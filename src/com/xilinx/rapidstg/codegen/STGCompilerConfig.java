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

import com.xilinx.rapidstg.stg.KindMapping;
import com.xilinx.rapidstg.util.Params;

/**
 * Options of one STG compilation: signal kind remapping, the names of the
 * supply, ground and reset pins, and whether the sticky error flag gets an
 * output pin.
 */
public class STGCompilerConfig {

    public static final String DEFAULT_VDD = "VDD";

    public static final String DEFAULT_VSS = "VSS";

    public static final String DEFAULT_RST = "RST";

    private KindMapping kindMapping = KindMapping.identity();

    private String vddName = DEFAULT_VDD;

    private String vssName = DEFAULT_VSS;

    private String rstName = DEFAULT_RST;

    private boolean seeError;

    private int cascadePassLimit = Params.RS_CASCADE_PASS_LIMIT;

    public KindMapping getKindMapping() {
        return kindMapping;
    }

    public STGCompilerConfig setKindMapping(KindMapping kindMapping) {
        this.kindMapping = kindMapping;
        return this;
    }

    public String getVddName() {
        return vddName;
    }

    public STGCompilerConfig setVddName(String vddName) {
        this.vddName = vddName;
        return this;
    }

    public String getVssName() {
        return vssName;
    }

    public STGCompilerConfig setVssName(String vssName) {
        this.vssName = vssName;
        return this;
    }

    public String getRstName() {
        return rstName;
    }

    public STGCompilerConfig setRstName(String rstName) {
        this.rstName = rstName;
        return this;
    }

    public boolean isSeeError() {
        return seeError;
    }

    /**
     * @param seeError If true, the module gets an "__STG_ERROR__" output
     * following the sticky error flag.
     */
    public STGCompilerConfig setSeeError(boolean seeError) {
        this.seeError = seeError;
        return this;
    }

    public int getCascadePassLimit() {
        return cascadePassLimit;
    }

    /**
     * @param cascadePassLimit Passes of the cascade loop after which the model
     * aborts with $fatal. Defaults to {@link Params#RS_CASCADE_PASS_LIMIT}.
     */
    public STGCompilerConfig setCascadePassLimit(int cascadePassLimit) {
        if (cascadePassLimit < 1) {
            throw new IllegalArgumentException("Cascade pass limit must be positive: " + cascadePassLimit);
        }
        this.cascadePassLimit = cascadePassLimit;
        return this;
    }
}
