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
 * Cursors threaded through one run of {@link VCDParser}: the document being built, the
 * scope new declarations are attached to and the simulation time of value changes.
 */
public class VCDParserState {

    private final VCDDocument document;

    private final boolean trackAll;

    private Scope currentScope;

    private long currentTick;

    public VCDParserState(VCDDocument document, boolean trackAll) {
        this.document = document;
        this.trackAll = trackAll;
    }

    public VCDDocument getDocument() {
        return document;
    }

    /**
     * @return True if value changes are recorded for every scope, false if only the top
     * module is tracked.
     */
    public boolean isTrackAll() {
        return trackAll;
    }

    /**
     * @return The open scope, or null when no scope is open.
     */
    public Scope getCurrentScope() {
        return currentScope;
    }

    public void setCurrentScope(Scope currentScope) {
        this.currentScope = currentScope;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public void setCurrentTick(long currentTick) {
        this.currentTick = currentTick;
    }
}
