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

package com.vcd2pwl.sim;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vcd2pwl.util.FileTools;

/**
 * Finds the name of the testbench module in a Verilog source file with a line based scan.
 * No Verilog parsing is attempted: the last line starting with {@code module <name>}
 * wins, as testbenches are conventionally declared after the modules they instantiate.
 */
public class ModuleTopFinder {

    private static final Logger logger = LogManager.getLogger();

    public static final Pattern MODULE_PATTERN = Pattern.compile("^module (\\w+)");

    /**
     * @param verilogFileName The Verilog file.
     * @return Name of the last module declared in the file.
     * @throws IllegalStateException If the file declares no module.
     */
    public static String findModuleTop(Path verilogFileName) {
        String top = findModuleTop(FileTools.getLinesFromTextFile(verilogFileName));
        if (top == null) {
            throw new IllegalStateException("ERROR: Failed to parse module top of " + verilogFileName);
        }
        logger.info("Using module top: " + top);
        return top;
    }

    /**
     * @param lines Lines of Verilog source.
     * @return Name of the last module declared, or null if there is none.
     */
    public static String findModuleTop(List<String> lines) {
        String top = null;
        for (String line : lines) {
            Matcher m = MODULE_PATTERN.matcher(line);
            if (m.find()) {
                top = m.group(1);
            }
        }
        return top;
    }
}
