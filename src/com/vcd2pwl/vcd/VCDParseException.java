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
 * Signals a malformed or inconsistent VCD trace. Parsing stops and no document is produced.
 */
public class VCDParseException extends RuntimeException {

    public VCDParseException(VCDToken token, String message) {
        super(message + " [" + token + "]");
    }

    public VCDParseException(String message) {
        super(message);
    }

    public VCDParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public static VCDParseException unexpectedEOF() {
        return new VCDParseException("ERROR: Unexpected end of file");
    }

    public static VCDParseException unexpectedEOF(String context) {
        return new VCDParseException("ERROR: Unexpected end of file while reading " + context);
    }
}
