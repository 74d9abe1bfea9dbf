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

/**
 * Declared kind of a traced variable. Both kinds record and export identically.
 */
public enum SignalKind {
    REGISTER("reg"),
    WIRE("wire");

    private final String vcdType;

    SignalKind(String vcdType) {
        this.vcdType = vcdType;
    }

    /**
     * @return The variable type keyword used in a $var declaration.
     */
    public String getVCDType() {
        return vcdType;
    }

    /**
     * Maps a $var type keyword to a signal kind.
     * @param vcdType The keyword, e.g. "reg".
     * @return The kind, or null if variables of this type are not modeled.
     */
    public static SignalKind fromVCDType(String vcdType) {
        for (SignalKind k : values()) {
            if (k.vcdType.equals(vcdType)) {
                return k;
            }
        }
        return null;
    }
}
