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
 * Body of a $scope declaration, e.g. "$scope module tb $end".
 */
public class VCDScopeDecl {

    private final String type;

    private final String ident;

    public VCDScopeDecl(String type, String ident) {
        this.type = type;
        this.ident = ident;
    }

    /**
     * @return The scope type such as "module", "task" or "begin".
     */
    public String getType() {
        return type;
    }

    public String getIdent() {
        return ident;
    }

    @Override
    public String toString() {
        return type + " " + ident;
    }
}
