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

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.vcd2pwl.pwl.TransitionTimes;
import com.vcd2pwl.util.MessageGenerator;
import com.vcd2pwl.util.Params;
import com.vcd2pwl.vcd.TimeScale;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Command line settings shared by {@link VCD2PWL} and {@link Verilog2PWL}. Defaults can
 * be changed through options or the setters.
 */
public class PWLConfig {

    private Path inputFile;

    private Path outputFile;

    private BigDecimal trf;

    private BigDecimal tcrf;

    private TimeScale.Unit targetUnit;

    private boolean trackAll;

    private boolean debug;

    private static final List<String> INPUT_FILE_OPTS = Arrays.asList("i", "input_file");
    private static final List<String> OUTPUT_FILE_OPTS = Arrays.asList("o", "output_file");
    private static final List<String> TRF_OPTS = Collections.singletonList("trf");
    private static final List<String> TCRF_OPTS = Collections.singletonList("tcrf");
    private static final List<String> UNIT_OPTS = Collections.singletonList("unit");
    private static final List<String> FULL_OPTS = Collections.singletonList("full");
    private static final List<String> DEBUG_OPTS = Collections.singletonList("debug");
    private static final List<String> NO_DEBUG_OPTS = Collections.singletonList("no-debug");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    private PWLConfig() {
        trf = BigDecimal.ZERO;
        tcrf = BigDecimal.ZERO;
        targetUnit = TimeScale.Unit.fromSuffix(Params.VCD2PWL_TARGET_UNIT);
        trackAll = false;
        debug = false;
    }

    public PWLConfig(Path inputFile) {
        this();
        setInputFile(inputFile);
    }

    public PWLConfig(String[] arguments) {
        this();
        parseArguments(arguments);
    }

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(INPUT_FILE_OPTS, "Input file").withRequiredArg();
                acceptsAll(OUTPUT_FILE_OPTS, "Output PWL file (default is '<input name>.pwl')").withRequiredArg();
                acceptsAll(TRF_OPTS, "Rise/fall time of data signals, in the output unit (default 0)").withRequiredArg();
                acceptsAll(TCRF_OPTS, "Rise/fall time of the " + TransitionTimes.CLOCK_SIGNAL_NAME
                        + " signal, in the output unit (default 0)").withRequiredArg();
                acceptsAll(UNIT_OPTS, "Time unit of the output (s, ms, us, ns, ps or fs; default is '"
                        + Params.VCD2PWL_TARGET_UNIT + "')").withRequiredArg();
                acceptsAll(FULL_OPTS, "Track the signals of every scope, not just the top module");
                acceptsAll(DEBUG_OPTS, "Print debug messages");
                acceptsAll(NO_DEBUG_OPTS, "Do not print debug messages (default)");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
            }
        };
    }

    public static void printHelp(String toolName, String description) {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader(toolName);
        System.out.println(description);
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            e.printStackTrace();
        }
    }

    public static boolean hasHelpArg(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);
        return options.has(HELP_OPTS.get(0));
    }

    private void parseArguments(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);

        if (options.has(INPUT_FILE_OPTS.get(0))) {
            setInputFile(Paths.get((String) options.valueOf(INPUT_FILE_OPTS.get(0))));
        } else {
            throw new RuntimeException("No input file found. "
                    + "Please specify an input file using options " + INPUT_FILE_OPTS);
        }

        if (options.has(OUTPUT_FILE_OPTS.get(0))) {
            setOutputFile(Paths.get((String) options.valueOf(OUTPUT_FILE_OPTS.get(0))));
        }

        if (options.has(TRF_OPTS.get(0))) {
            setTrf(parseTime(TRF_OPTS.get(0), (String) options.valueOf(TRF_OPTS.get(0))));
        }

        if (options.has(TCRF_OPTS.get(0))) {
            setTcrf(parseTime(TCRF_OPTS.get(0), (String) options.valueOf(TCRF_OPTS.get(0))));
        }

        if (options.has(UNIT_OPTS.get(0))) {
            setTargetUnit(TimeScale.Unit.fromSuffix((String) options.valueOf(UNIT_OPTS.get(0))));
        }

        setTrackAll(options.has(FULL_OPTS.get(0)));
        setDebug(options.has(DEBUG_OPTS.get(0)) && !options.has(NO_DEBUG_OPTS.get(0)));
    }

    private static BigDecimal parseTime(String option, String value) {
        BigDecimal time;
        try {
            time = new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ERROR: --" + option + " expects a number, found '" + value + "'", e);
        }
        if (time.signum() < 0) {
            throw new IllegalArgumentException("ERROR: --" + option + " must not be negative, found " + value);
        }
        return time;
    }

    public Path getInputFile() {
        return inputFile;
    }

    public void setInputFile(Path inputFile) {
        this.inputFile = inputFile;
    }

    /**
     * @return The output file, or null if the tool should pick a default name.
     */
    public Path getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(Path outputFile) {
        this.outputFile = outputFile;
    }

    public BigDecimal getTrf() {
        return trf;
    }

    public void setTrf(BigDecimal trf) {
        this.trf = trf;
    }

    public BigDecimal getTcrf() {
        return tcrf;
    }

    public void setTcrf(BigDecimal tcrf) {
        this.tcrf = tcrf;
    }

    public TransitionTimes getTransitionTimes() {
        return new TransitionTimes(trf, tcrf);
    }

    public TimeScale.Unit getTargetUnit() {
        return targetUnit;
    }

    public void setTargetUnit(TimeScale.Unit targetUnit) {
        this.targetUnit = targetUnit;
    }

    public boolean isTrackAll() {
        return trackAll;
    }

    public void setTrackAll(boolean trackAll) {
        this.trackAll = trackAll;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
