/*
 * Copyright (c) 2025, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of VCD2PWL.
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

package com.vcd2pwl.util;

/**
 * Aims to be a centralized helper class to manage global VCD2PWL settings.
 */
public class Params {

    public static String VCD2PWL_SIMULATOR_SCRIPT_NAME = "VCD2PWL_SIMULATOR_SCRIPT";

    public static String VCD2PWL_TARGET_UNIT_NAME = "VCD2PWL_TARGET_UNIT";

    public static String VCD2PWL_DEFAULT_SIMULATOR_SCRIPT = "dump_vcd.sh";

    public static String VCD2PWL_DEFAULT_TARGET_UNIT = "ns";

    /**
     * Script invoked by verilog2pwl to simulate a testbench and dump its VCD. It is called
     * with the Verilog file and the top module name as arguments.
     */
    public static String VCD2PWL_SIMULATOR_SCRIPT = getParamOrDefaultSetting(VCD2PWL_SIMULATOR_SCRIPT_NAME,
            VCD2PWL_DEFAULT_SIMULATOR_SCRIPT);

    /**
     * Time unit of the emitted PWL times when no --unit option is given.
     */
    public static String VCD2PWL_TARGET_UNIT = getParamOrDefaultSetting(VCD2PWL_TARGET_UNIT_NAME,
            VCD2PWL_DEFAULT_TARGET_UNIT);

    /**
     * Checks if the named VCD2PWL parameter is set via an environment variable
     * or by a JVM parameter of the same name.
     *
     * @param key Name of the global VCD2PWL parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !( value == null
               || value.length() == 0
               || value.equals("0")
               || value.toLowerCase().equals("false")
               );
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
     * @param defaultValue The default value to return if the parameter is not set.
     * @return The system parameter value if is set, otherwise it returns
     *         defaultValue.
     */
    public static String getParamOrDefaultSetting(String key, String defaultValue) {
        String value = getParamValue(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }
}
