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

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rise/fall times applied to PWL transitions. {@code trf} applies to every signal except
 * the one named {@link #CLOCK_SIGNAL_NAME}, which uses {@code tcrf}. Both are expressed in
 * the target time unit of the emitted waveforms.
 */
public class TransitionTimes {

    public static final String TRF = "trf";

    public static final String TCRF = "tcrf";

    public static final String CLOCK_SIGNAL_NAME = "CLK";

    public static final TransitionTimes ZERO = new TransitionTimes(BigDecimal.ZERO, BigDecimal.ZERO);

    private final BigDecimal trf;

    private final BigDecimal tcrf;

    public TransitionTimes(BigDecimal trf, BigDecimal tcrf) {
        this.trf = checkNonNegative(TRF, trf);
        this.tcrf = checkNonNegative(TCRF, tcrf);
    }

    public TransitionTimes(double trf, double tcrf) {
        this(BigDecimal.valueOf(trf), BigDecimal.valueOf(tcrf));
    }

    private static BigDecimal checkNonNegative(String symbol, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("ERROR: " + symbol + " must be a non-negative number, found " + value);
        }
        return value;
    }

    public BigDecimal getTrf() {
        return trf;
    }

    public BigDecimal getTcrf() {
        return tcrf;
    }

    /**
     * Picks the rise/fall parameter that applies to a signal.
     * @param signalName Name of the signal.
     * @return {@link #TCRF} for the clock signal, {@link #TRF} otherwise.
     */
    public static String getSymbolFor(String signalName) {
        return CLOCK_SIGNAL_NAME.equals(signalName) ? TCRF : TRF;
    }

    /**
     * @param symbol {@link #TRF} or {@link #TCRF}.
     * @return The value bound to the symbol, or null if the symbol is unknown.
     */
    public BigDecimal getValue(String symbol) {
        switch (symbol) {
            case TRF:
                return trf;
            case TCRF:
                return tcrf;
            default:
                return null;
        }
    }

    /**
     * @return Symbol bindings for {@link ExpressionResolver}.
     */
    public Map<String, BigDecimal> getBindings() {
        Map<String, BigDecimal> bindings = new LinkedHashMap<>();
        bindings.put(TRF, trf);
        bindings.put(TCRF, tcrf);
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public String toString() {
        return TRF + "=" + ExpressionResolver.formatNumber(trf) + ", " + TCRF + "=" + ExpressionResolver.formatNumber(tcrf);
    }
}
