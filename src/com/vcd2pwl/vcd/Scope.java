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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named group of signals opened by a $scope declaration, keyed by the short VCD
 * identifier code of each signal.
 */
public class Scope {

    private final String name;

    private final Map<String, Signal> signals = new LinkedHashMap<>();

    public Scope(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public String getName() {
        return name;
    }

    public void addSignal(String identifier, Signal signal) {
        signals.put(identifier, signal);
    }

    public Signal getSignal(String identifier) {
        return signals.get(identifier);
    }

    public boolean containsIdentifier(String identifier) {
        return signals.containsKey(identifier);
    }

    /**
     * @return The identifier to signal map in declaration order.
     */
    public Map<String, Signal> getSignalMap() {
        return Collections.unmodifiableMap(signals);
    }

    public Collection<Signal> getSignals() {
        return Collections.unmodifiableCollection(signals.values());
    }

    @Override
    public String toString() {
        return name;
    }
}
