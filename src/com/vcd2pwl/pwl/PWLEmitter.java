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

package com.vcd2pwl.pwl;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vcd2pwl.util.FileTools;
import com.vcd2pwl.vcd.Scope;
import com.vcd2pwl.vcd.Signal;
import com.vcd2pwl.vcd.TimeScale;
import com.vcd2pwl.vcd.VCDDocument;

/**
 * Writes the signals of a parsed VCD trace as SPICE piece-wise linear voltage sources.
 * Every bit of every exported signal gets its own source:
 * <pre>
 * Vdata[1] data[1] 0 pwl(
 * 0 0
 * +'5ns' 0 '5ns+0.1' vvdd
 * )
 * </pre>
 * A logic 1 is driven at {@value #HIGH_LEVEL}, a logic 0 at {@value #LOW_LEVEL}.
 */
public class PWLEmitter {

    private static final Logger logger = LogManager.getLogger();

    public static final String HIGH_LEVEL = "vvdd";

    public static final String LOW_LEVEL = "0";

    private static final String NEW_LINE = "\n";

    private final TimeScale timeScale;

    private final TransitionTimes transitionTimes;

    private final TimeScale.Unit targetUnit;

    /**
     * @param timeScale Timescale of the trace the signals were recorded with.
     * @param transitionTimes Rise/fall times of the emitted edges, in the target unit.
     * @param targetUnit Time unit of the emitted PWL times.
     */
    public PWLEmitter(TimeScale timeScale, TransitionTimes transitionTimes, TimeScale.Unit targetUnit) {
        this.timeScale = Objects.requireNonNull(timeScale, "timescale");
        this.transitionTimes = Objects.requireNonNull(transitionTimes);
        this.targetUnit = Objects.requireNonNull(targetUnit);
    }

    public PWLEmitter(TimeScale timeScale, TransitionTimes transitionTimes) {
        this(timeScale, transitionTimes, TimeScale.Unit.NS);
    }

    public TimeScale getTimeScale() {
        return timeScale;
    }

    public TransitionTimes getTransitionTimes() {
        return transitionTimes;
    }

    public TimeScale.Unit getTargetUnit() {
        return targetUnit;
    }

    public static String getLevel(byte bit) {
        return bit != 0 ? HIGH_LEVEL : LOW_LEVEL;
    }

    /**
     * Emits one PWL source per bit of the signal. A signal that carried an x or z value is
     * skipped.
     * @param signal The signal.
     * @return The PWL text, empty if the signal is not export safe.
     */
    public String emit(Signal signal) {
        if (!signal.isExportSafe()) {
            logger.info("Skipping piece-wise linear for x-state signal: " + signal);
            return "";
        }
        StringBuilder sb = new StringBuilder();
        int width = signal.getWidth();
        if (signal.isArray()) {
            int dim = signal.getDim();
            for (int n = 0; n < dim; n++) {
                for (int m = 0; m < width; m++) {
                    String pwlName = signal.getName() + (dim - 1 - n) + "[" + (width - 1 - m) + "]";
                    emitBit(sb, signal, pwlName, n * width + m);
                }
            }
        } else if (signal.isBus()) {
            for (int k = 0; k < width; k++) {
                emitBit(sb, signal, signal.getName() + "[" + (width - 1 - k) + "]", k);
            }
        } else {
            emitBit(sb, signal, signal.getName(), 0);
        }
        return sb.toString();
    }

    /**
     * Emits every signal of the scope in declaration order.
     * @param scope The scope.
     * @return The PWL text.
     */
    public String emit(Scope scope) {
        StringBuilder sb = new StringBuilder();
        for (Signal signal : scope.getSignals()) {
            sb.append(emit(signal));
        }
        return sb.toString();
    }

    /**
     * Emits the top module of the document. Side scopes are never exported.
     * @param document The parsed trace.
     * @return The PWL text.
     */
    public String emit(VCDDocument document) {
        Scope top = document.getTop();
        if (top == null) {
            throw new IllegalStateException("ERROR: VCD document declares no scope, nothing to export");
        }
        return emit(top);
    }

    /**
     * Writes the PWL sources of the document's top module to a file (gzipped if the name
     * ends in .gz).
     * @param document The parsed trace.
     * @param fileName The output file.
     */
    public void export(VCDDocument document, Path fileName) {
        String text = emit(document);
        try (BufferedWriter bw = FileTools.getProperOutputStream(fileName)) {
            bw.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem writing PWL file: " + fileName, e);
        }
        logger.info("Wrote PWL sources of " + document.getTop().getSignals().size() + " signal(s) to " + fileName);
    }

    private void emitBit(StringBuilder sb, Signal signal, String pwlName, int bitIndex) {
        String symbol = TransitionTimes.getSymbolFor(signal.getName());
        boolean step = transitionTimes.getValue(symbol).signum() == 0;
        Map<String, BigDecimal> bindings = transitionTimes.getBindings();

        sb.append('V').append(pwlName).append(' ').append(pwlName).append(" 0 pwl(").append(NEW_LINE);
        String prev = null;
        for (Entry<Long, byte[]> e : signal.getTimeline().entrySet()) {
            String level = getLevel(e.getValue()[bitIndex]);
            if (prev == null) {
                sb.append("0 ").append(level).append(NEW_LINE);
            } else if (!prev.equals(level)) {
                String t = ExpressionResolver.formatNumber(timeScale.convert(e.getKey(), targetUnit));
                String unit = targetUnit.getSuffix();
                String start = ExpressionResolver.resolve(t, bindings, BigDecimal.ONE, unit);
                if (step) {
                    sb.append("+'").append(start).append("' ").append(level).append(NEW_LINE);
                } else {
                    String end = ExpressionResolver.resolve(t + "+" + symbol, bindings, BigDecimal.ONE, unit);
                    sb.append("+'").append(start).append("' ").append(prev)
                      .append(" '").append(end).append("' ").append(level).append(NEW_LINE);
                }
            }
            prev = level;
        }
        sb.append(')').append(NEW_LINE).append(NEW_LINE);
    }
}
