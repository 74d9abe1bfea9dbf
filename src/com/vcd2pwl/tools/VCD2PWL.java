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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import com.vcd2pwl.pwl.PWLEmitter;
import com.vcd2pwl.util.CodePerfTracker;
import com.vcd2pwl.util.FileTools;
import com.vcd2pwl.util.MessageGenerator;
import com.vcd2pwl.vcd.VCDDocument;
import com.vcd2pwl.vcd.VCDTools;

/**
 * Converts a VCD trace into SPICE piece-wise linear sources.
 */
public class VCD2PWL {

    private static final Logger logger = LogManager.getLogger();

    public static final String PWL_EXTENSION = ".pwl";

    /**
     * @param inputFile The trace or testbench file.
     * @return {@code <input stem>.pwl} in the working directory.
     */
    public static Path getDefaultOutputFile(Path inputFile) {
        String stem = FileTools.getBaseName(inputFile);
        if (FileTools.hasExtension(inputFile, "gz")) {
            stem = FileTools.getBaseName(Paths.get(stem));
        }
        return Paths.get(stem + PWL_EXTENSION);
    }

    static void applyLogLevel(PWLConfig config) {
        if (config.isDebug()) {
            Configurator.setRootLevel(Level.DEBUG);
        }
    }

    /**
     * Parses a VCD file and writes the PWL sources of its top module.
     * @param vcdFile The VCD trace.
     * @param config Output file, transition times, unit and tracking mode.
     * @param t Runtime tracker.
     * @return The written PWL file.
     */
    public static Path convert(Path vcdFile, PWLConfig config, CodePerfTracker t) {
        Path output = config.getOutputFile() != null ? config.getOutputFile() : getDefaultOutputFile(vcdFile);

        t.start("Parse VCD");
        VCDDocument document = VCDTools.readVCDFile(vcdFile, config.isTrackAll());
        t.stop().start("Write PWL");
        PWLEmitter emitter = new PWLEmitter(document.getTimeScale(), config.getTransitionTimes(),
                config.getTargetUnit());
        logger.info("Transition times: " + emitter.getTransitionTimes() + " (" + emitter.getTargetUnit() + ")");
        emitter.export(document, output);
        t.stop();
        logger.info("Generate piece-wise linear under: " + output);
        return output;
    }

    public static Path run(PWLConfig config, CodePerfTracker t) {
        Path input = config.getInputFile();
        if (!FileTools.hasExtension(input, "vcd") && !input.toString().endsWith(".vcd.gz")) {
            logger.warn("Input file does not have a .vcd extension: " + input);
        }
        return convert(input, config, t);
    }

    public static void main(String[] args) {
        CodePerfTracker t = new CodePerfTracker(VCD2PWL.class.getSimpleName());
        try {
            if (args.length == 0 || PWLConfig.hasHelpArg(args)) {
                PWLConfig.printHelp("VCD2PWL", "Converts a VCD trace into SPICE piece-wise linear sources.");
                return;
            }
            PWLConfig config = new PWLConfig(args);
            applyLogLevel(config);
            run(config, t);
        } catch (Exception e) {
            logger.error(e.getMessage(), e);
            MessageGenerator.briefErrorAndExit("ERROR: vcd2pwl failed, see log for details.");
        }
        t.printTotals();
    }
}
