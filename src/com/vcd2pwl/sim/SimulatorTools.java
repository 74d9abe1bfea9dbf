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

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vcd2pwl.util.FileTools;
import com.vcd2pwl.util.Params;

/**
 * Runs an external Verilog simulator to dump the VCD trace of a testbench.
 */
public class SimulatorTools {

    private static final Logger logger = LogManager.getLogger();

    /**
     * Gets the directory a VCD is dumped into: the directory of the Verilog file.
     * @param verilogFileName The Verilog file.
     * @return Its parent directory, or the working directory if it has none.
     */
    public static Path getDumpDir(Path verilogFileName) {
        Path parent = verilogFileName.toAbsolutePath().getParent();
        return parent == null ? Paths.get(System.getProperty("user.dir")) : parent;
    }

    /**
     * Simulates with the script named by {@link Params#VCD2PWL_SIMULATOR_SCRIPT}.
     * @see #dumpVCD(Path, String, String, Path)
     */
    public static Path dumpVCD(Path verilogFileName, String moduleTop, Path logFileName) {
        return dumpVCD(verilogFileName, moduleTop, Params.VCD2PWL_SIMULATOR_SCRIPT, logFileName);
    }

    /**
     * Runs {@code <script> <verilog file> <module top>}, which is expected to write
     * {@code <module top>.vcd} next to the Verilog file.
     * @param verilogFileName The Verilog testbench.
     * @param moduleTop Name of the testbench module.
     * @param script The simulation script.
     * @param logFileName File that captures the script's stdout and stderr.
     * @return Path of the dumped VCD file.
     * @throws RuntimeException If the script fails or produced no VCD file.
     */
    public static Path dumpVCD(Path verilogFileName, String moduleTop, String script, Path logFileName) {
        List<String> command = new ArrayList<>();
        command.add(script);
        command.add(verilogFileName.toString());
        command.add(moduleTop);
        Integer exitCode = FileTools.runCommand(command, logFileName);
        if (exitCode == null || exitCode != 0) {
            throw new RuntimeException("ERROR: Failed to dump vcd from DUT verilog testbench. Exit code: "
                    + exitCode + ", see " + logFileName);
        }
        Path vcd = getDumpDir(verilogFileName).resolve(moduleTop + ".vcd");
        if (!Files.isRegularFile(vcd)) {
            throw new RuntimeException("ERROR: Simulation finished but no VCD was found at " + vcd);
        }
        logger.info("Dumped VCD: " + vcd);
        return vcd;
    }
}
