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

package com.vcd2pwl.vcd;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The time base of a VCD trace as declared by its $timescale section. Converts raw
 * simulation ticks into a physical time unit.
 */
public class TimeScale {

    /** Number of decimal places kept by {@link #convert(long, Unit)} */
    public static final int ROUNDING_DIGITS = 3;

    private static final Pattern PATTERN_TIMESCALE = Pattern.compile("\\s*(\\d+)\\s*(fs|ps|ns|us|ms|s)\\s*");

    /**
     * Physical time units that may appear in a $timescale declaration.
     */
    public enum Unit {
        S(1e0),
        MS(1e3),
        US(1e6),
        NS(1e9),
        PS(1e12),
        FS(1e15);

        private final double perSecond;

        Unit(double perSecond) {
            this.perSecond = perSecond;
        }

        /**
         * @return How many of this unit make up one second.
         */
        public double getPerSecond() {
            return perSecond;
        }

        /**
         * @return The suffix used in VCD and SPICE text, e.g. "ns".
         */
        public String getSuffix() {
            return name().toLowerCase();
        }

        /**
         * Looks up a unit by its text suffix (case-insensitive).
         * @param suffix The suffix such as "ns" or "ps".
         * @return The matching unit.
         * @throws IllegalArgumentException If the suffix is not a known unit.
         */
        public static Unit fromSuffix(String suffix) {
            for (Unit u : values()) {
                if (u.getSuffix().equalsIgnoreCase(suffix.trim())) {
                    return u;
                }
            }
            throw new IllegalArgumentException("ERROR: Unrecognized time unit '" + suffix + "'");
        }

        @Override
        public String toString() {
            return getSuffix();
        }
    }

    private final int baseNum;

    private final Unit baseUnit;

    public TimeScale(int baseNum, Unit baseUnit) {
        if (baseNum <= 0) {
            throw new IllegalArgumentException("ERROR: Timescale magnitude must be positive, found " + baseNum);
        }
        this.baseNum = baseNum;
        this.baseUnit = Objects.requireNonNull(baseUnit);
    }

    /**
     * Parses the body of a $timescale section, such as "1 ns", "10ps" or "100 us".
     * @param text The timescale text.
     * @return The parsed timescale.
     * @throws VCDParseException If the text is not a valid timescale.
     */
    public static TimeScale parse(String text) {
        Matcher m = PATTERN_TIMESCALE.matcher(text);
        if (!m.matches()) {
            throw new VCDParseException("Invalid timescale definition: '" + text + "'");
        }
        int num;
        try {
            num = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new VCDParseException("Invalid timescale magnitude: '" + text + "'", e);
        }
        if (num <= 0) {
            throw new VCDParseException("Timescale magnitude must be positive: '" + text + "'");
        }
        return new TimeScale(num, Unit.fromSuffix(m.group(2)));
    }

    public int getBaseNum() {
        return baseNum;
    }

    public Unit getBaseUnit() {
        return baseUnit;
    }

    /**
     * Gets the multiplier from one {@link #getBaseUnit()} to the target unit.
     * @param target The unit to convert to.
     * @return The conversion factor.
     */
    public double getFactor(Unit target) {
        return target.getPerSecond() / baseUnit.getPerSecond();
    }

    /**
     * Converts a tick count from the trace into the target unit, rounded half-even to
     * {@link #ROUNDING_DIGITS} decimal places.
     * @param ticks The raw simulation time.
     * @param target The unit to convert to.
     * @return The time expressed in the target unit.
     */
    public double convert(long ticks, Unit target) {
        double value = (double) ticks * baseNum * getFactor(target);
        return new BigDecimal(value).setScale(ROUNDING_DIGITS, RoundingMode.HALF_EVEN).doubleValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeScale that = (TimeScale) o;
        return baseNum == that.baseNum && baseUnit == that.baseUnit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseNum, baseUnit);
    }

    @Override
    public String toString() {
        return baseNum + baseUnit.getSuffix();
    }
}
