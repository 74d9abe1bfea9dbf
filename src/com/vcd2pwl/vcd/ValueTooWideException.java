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

/**
 * Thrown when a value does not fit in the bit vector of the signal it is assigned to.
 */
public class ValueTooWideException extends IllegalArgumentException {

    private final BigInteger value;

    private final int bitCount;

    public ValueTooWideException(BigInteger value, int bitCount) {
        super("ERROR: Value " + value + " requires more than " + bitCount + " bits.");
        this.value = value;
        this.bitCount = bitCount;
    }

    public BigInteger getValue() {
        return value;
    }

    public int getBitCount() {
        return bitCount;
    }
}
