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

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A register or wire declared in a VCD trace along with every value it was assigned.
 * Values are held as MSB-first bit vectors (index 0 is the most significant bit).
 * A bus of width W stores W bits; an array of depth D stores D*W bits, outer element
 * first.
 */
public class Signal {

    private static final Logger logger = LogManager.getLogger();

    private final String name;

    private final SignalKind kind;

    private final int width;

    private final int dim;

    private final Map<Long, byte[]> timeline = new LinkedHashMap<>();

    private byte[] lastValue;

    private boolean exportSafe = true;

    public Signal(String name, SignalKind kind, int width, int dim) {
        if (width < 1) {
            throw new IllegalArgumentException("ERROR: Signal " + name + " must be at least 1 bit wide, found " + width);
        }
        if (dim < 0) {
            throw new IllegalArgumentException("ERROR: Signal " + name + " has negative array depth " + dim);
        }
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.width = width;
        this.dim = dim;
        this.lastValue = new byte[getBitCount()];
    }

    public Signal(String name, SignalKind kind, int width) {
        this(name, kind, width, 0);
    }

    public String getName() {
        return name;
    }

    public SignalKind getKind() {
        return kind;
    }

    public int getWidth() {
        return width;
    }

    /**
     * @return The array depth, 0 for scalars and buses.
     */
    public int getDim() {
        return dim;
    }

    public boolean isArray() {
        return dim > 0;
    }

    public boolean isBus() {
        return dim == 0 && width > 1;
    }

    /**
     * @return Number of bits in each stored value.
     */
    public int getBitCount() {
        return dim > 0 ? dim * width : width;
    }

    /**
     * A signal is export safe as long as it has never been assigned an unknown (x) or
     * high impedance (z) value.
     * @return True if the signal may be written as a PWL source.
     */
    public boolean isExportSafe() {
        return exportSafe;
    }

    /**
     * Permanently excludes this signal from export after an x or z value was seen.
     */
    public void markAmbiguous() {
        exportSafe = false;
    }

    /**
     * @return Every recorded value keyed by tick, in trace order.
     */
    public Map<Long, byte[]> getTimeline() {
        return Collections.unmodifiableMap(timeline);
    }

    /**
     * @return A copy of the most recently recorded value (all zeros before any update).
     */
    public byte[] getLastValue() {
        return lastValue.clone();
    }

    public void update(long tick, long value) {
        update(tick, BigInteger.valueOf(value));
    }

    /**
     * Records a value for this signal at the provided tick. A second update for the same
     * tick replaces the first.
     * @param tick The simulation time of the change.
     * @param value The unsigned value assigned.
     * @throws ValueTooWideException If the value needs more bits than the signal holds.
     */
    public void update(long tick, BigInteger value) {
        byte[] bits = toBitArray(value, getBitCount());
        if (logger.isDebugEnabled()) {
            logger.debug(String.format("Update assignment for %-20s | %d: %s", name, tick, bitString(bits)));
        }
        timeline.put(tick, bits);
        lastValue = bits;
    }

    /**
     * Encodes an unsigned integer as an MSB-first bit array.
     * @param value The value, must not be negative.
     * @param bitCount Length of the resulting array.
     * @return The bit array.
     * @throws ValueTooWideException If value.bitLength() &gt; bitCount.
     */
    public static byte[] toBitArray(BigInteger value, int bitCount) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("ERROR: Negative value " + value + " cannot be assigned to a bit vector");
        }
        if (value.bitLength() > bitCount) {
            throw new ValueTooWideException(value, bitCount);
        }
        byte[] bits = new byte[bitCount];
        for (int i = 0; i < bitCount; i++) {
            bits[bitCount - 1 - i] = (byte) (value.testBit(i) ? 1 : 0);
        }
        return bits;
    }

    /**
     * Decodes an MSB-first bit array back into an unsigned integer.
     * @param bits The bit array.
     * @return The value.
     */
    public static BigInteger fromBitArray(byte[] bits) {
        BigInteger value = BigInteger.ZERO;
        for (byte b : bits) {
            value = value.shiftLeft(1);
            if (b != 0) {
                value = value.setBit(0);
            }
        }
        return value;
    }

    public static String bitString(byte[] bits) {
        StringBuilder sb = new StringBuilder(bits.length);
        for (byte b : bits) {
            sb.append(b != 0 ? '1' : '0');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        if (width == 1) {
            return name;
        }
        return name + "[" + (width - 1) + ":0]";
    }
}
