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
 * A value assigned to an identifier code. Scalar values are a single character
 * ("0", "1", "x", "z"); vector values are the binary digits without the 'b' prefix.
 */
public class VCDValueChange {

    private final String idCode;

    private final String value;

    public VCDValueChange(String idCode, String value) {
        this.idCode = idCode;
        this.value = value;
    }

    public String getIdCode() {
        return idCode;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return True if any digit is unknown (x) or high impedance (z).
     */
    public boolean isAmbiguous() {
        for (int i = 0; i < value.length(); i++) {
            switch (value.charAt(i)) {
                case 'x':
                case 'X':
                case 'z':
                case 'Z':
                    return true;
                default:
                    break;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return value + " " + idCode;
    }
}
