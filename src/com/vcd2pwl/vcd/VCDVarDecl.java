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
 * Body of a $var declaration, e.g. "$var reg 8 # data [7:0] $end".
 */
public class VCDVarDecl {

    private final String type;

    private final int size;

    private final String idCode;

    private final String reference;

    private final String bitIndex;

    public VCDVarDecl(String type, int size, String idCode, String reference, String bitIndex) {
        this.type = type;
        this.size = size;
        this.idCode = idCode;
        this.reference = reference;
        this.bitIndex = bitIndex;
    }

    /**
     * @return The declared variable type, e.g. "reg" or "wire".
     */
    public String getType() {
        return type;
    }

    /**
     * @return The declared bit width.
     */
    public int getSize() {
        return size;
    }

    public String getIdCode() {
        return idCode;
    }

    public String getReference() {
        return reference;
    }

    /**
     * @return The optional bit select that follows the reference, e.g. "[7:0]", or null.
     */
    public String getBitIndex() {
        return bitIndex;
    }

    @Override
    public String toString() {
        return type + " " + size + " " + idCode + " " + reference + (bitIndex == null ? "" : " " + bitIndex);
    }
}
