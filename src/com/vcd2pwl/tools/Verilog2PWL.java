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

package com.vcd2pwl.tools;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vcd2pwl.sim.ModuleTopFinder;
import com.vcd2pwl.sim.SimulatorTools;
import com.vcd2pwl.util.CodePerfTracker;
import com.vcd2pwl.util.FileTools;
import com.vcd2pwl.util.MessageGenerator;
import com.vcd2pwl.util.Params;

/**
 * Simulates a Verilog testbench with an external script and converts the dumped VCD
 * into SPICE piece-wise linear sources.
 */
public class Verilog2PWL {

    private static final Logger logger = LogManager.getLogger();

    /**
     * @param config Settings, the input file must be a Verilog (.v) testbench.
     * @param script Simulation script, called as {@code <script> <verilog> <module top>}.
     * @param t Runtime tracker.
     * @return The written PWL file.
     */
    public static Path run(PWLConfig config, String script, CodePerfTracker t) {
        Path input = config.getInputFile();
        if (!FileTools.hasExtension(input, "v")) {
            throw new IllegalArgumentException("ERROR: Not a verilog file: " + input);
        }
        FileTools.errorIfFileDoesNotExist(input);

        t.start("Find Module Top");
        String moduleTop = ModuleTopFinder.findModuleTop(input);
        if (config.getOutputFile() == null) {
            config.setOutputFile(Paths.get(moduleTop + VCD2PWL.PWL_EXTENSION));
        }
        t.stop().start("Simulate");
        Path log = SimulatorTools.getDumpDir(input).resolve("verilog2pwl." + FileTools.getBaseName(input) + ".sim.log");
        Path vcd = SimulatorTools.dumpVCD(input, moduleTop, script, log);
        t.stop();
        return VCD2PWL.convert(vcd, config, t);
    }

    public static void main(String[] args) {
        CodePerfTracker t = new CodePerfTracker(Verilog2PWL.class.getSimpleName());
        try {
            if (args.length == 0 || PWLConfig.hasHelpArg(args)) {
                PWLConfig.printHelp("Verilog2PWL", "Converts a Verilog testbench to piece-wise linear sources for SPICE.");
                return;
            }
            PWLConfig config = new PWLConfig(args);
            VCD2PWL.applyLogLevel(config);
            run(config, Params.VCD2PWL_SIMULATOR_SCRIPT, t);
        } catch (Exception e) {
            logger.error(e.getMessage(), e);
            MessageGenerator.briefErrorAndExit("ERROR: verilog2pwl failed, see log for details.");
        }
        t.printTotals();
    }
}
