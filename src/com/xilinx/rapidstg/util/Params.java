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

/**
 * Aims to be a centralized helper class to manage global RapidSTG settings.
 */
public class Params {

    public static String RS_CASCADE_PASS_LIMIT_NAME = "RS_CASCADE_PASS_LIMIT";

    public static String RS_SIM_MAX_EVALUATIONS_NAME = "RS_SIM_MAX_EVALUATIONS";

    public static int RS_DEFAULT_CASCADE_PASS_LIMIT = 500;

    public static int RS_DEFAULT_SIM_MAX_EVALUATIONS = 10000;

    /**
     * Number of passes the generated cascade-resolution loop may run within a
     * single analog evaluation before it declares the net stuck and calls
     * $fatal.
     */
    public static int RS_CASCADE_PASS_LIMIT = getParamOrDefaultIntSetting(RS_CASCADE_PASS_LIMIT_NAME,
            RS_DEFAULT_CASCADE_PASS_LIMIT);

    /**
     * Upper bound on consecutive analog evaluations the simulator performs while
     * settling pending crossings. Guards against models whose outputs oscillate
     * forever.
     */
    public static int RS_SIM_MAX_EVALUATIONS = getParamOrDefaultIntSetting(RS_SIM_MAX_EVALUATIONS_NAME,
            RS_DEFAULT_SIM_MAX_EVALUATIONS);

    /**
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set integer value of the parameter, or null if none was set. If
     *         the property is set to a value that is not a parsable integer, a
     *         warning message is produced and returns null.
     */
    public static Integer getParamIntValue(String key) {
        String envValue = getParamValue(key);
        if (envValue != null) {
            try {
                return Integer.parseInt(envValue);
            } catch (NumberFormatException e) {
                MessageGenerator.warning("Couldn't interpret the value '" + envValue
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return null;
    }

    /**
     * Gets the string value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set, it returns the
     * set value. Otherwise it will return the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the paramter is not set.
     * @return The system parameter value if is set, otherwise it returns
     *         defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }

}
