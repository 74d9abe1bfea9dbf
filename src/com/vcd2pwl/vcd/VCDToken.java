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

import java.util.Objects;

/**
 * A typed token of a VCD trace. Which payload getter is valid depends on
 * {@link #getKind()}; the others return null (or -1 for {@link #getTime()}).
 */
public class VCDToken {

    private final VCDTokenKind kind;

    private final long byteOffset;

    private final String text;

    private final long time;

    private final VCDScopeDecl scope;

    private final VCDVarDecl var;

    private final VCDValueChange change;

    private VCDToken(VCDTokenKind kind, long byteOffset, String text, long time, VCDScopeDecl scope,
                     VCDVarDecl var, VCDValueChange change) {
        this.kind = Objects.requireNonNull(kind);
        this.byteOffset = byteOffset;
        this.text = text;
        this.time = time;
        this.scope = scope;
        this.var = var;
        this.change = change;
    }

    /**
     * Creates a token that carries free text (date, version, timescale, comment) or no
     * payload at all.
     */
    public static VCDToken text(VCDTokenKind kind, String text, long byteOffset) {
        return new VCDToken(kind, byteOffset, text, -1, null, null, null);
    }

    public static VCDToken time(long time, long byteOffset) {
        return new VCDToken(VCDTokenKind.CHANGE_TIME, byteOffset, null, time, null, null, null);
    }

    public static VCDToken scope(VCDScopeDecl scope, long byteOffset) {
        return new VCDToken(VCDTokenKind.SCOPE, byteOffset, null, -1, scope, null, null);
    }

    public static VCDToken var(VCDVarDecl var, long byteOffset) {
        return new VCDToken(VCDTokenKind.VAR, byteOffset, null, -1, null, var, null);
    }

    public static VCDToken change(VCDTokenKind kind, VCDValueChange change, long byteOffset) {
        return new VCDToken(kind, byteOffset, null, -1, null, null, change);
    }

    public VCDTokenKind getKind() {
        return kind;
    }

    /**
     * @return Byte offset in the input just past the end of this token.
     */
    public long getByteOffset() {
        return byteOffset;
    }

    public String getText() {
        return text;
    }

    public long getTime() {
        return time;
    }

    public VCDScopeDecl getScope() {
        return scope;
    }

    public VCDVarDecl getVar() {
        return var;
    }

    public VCDValueChange getChange() {
        return change;
    }

    @Override
    public String toString() {
        Object payload;
        switch (kind) {
            case CHANGE_TIME:
                payload = "#" + time;
                break;
            case SCOPE:
                payload = scope;
                break;
            case VAR:
                payload = var;
                break;
            case CHANGE_SCALAR:
            case CHANGE_VECTOR:
            case CHANGE_REAL:
            case CHANGE_STRING:
                payload = change;
                break;
            default:
                payload = text;
        }
        return kind + (payload == null ? "" : " " + payload) + "@" + byteOffset;
    }
}
