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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The contents of a parsed VCD trace. Only the first scope opened (the top module) is
 * exported; any other scope is kept as a side scope.
 */
public class VCDDocument {

    private static final Logger logger = LogManager.getLogger();

    private String date = "";

    private String version = "";

    private TimeScale timeScale;

    private Scope top;

    private final List<Scope> sideScopes = new ArrayList<>();

    private final List<Signal> signals = new ArrayList<>();

    private final Map<String, String> identifierNames = new HashMap<>();

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    /**
     * @return The timescale, or null if the trace has not declared one yet.
     */
    public TimeScale getTimeScale() {
        return timeScale;
    }

    public void setTimeScale(TimeScale timeScale) {
        this.timeScale = timeScale;
    }

    /**
     * @return The top module scope, or null if no scope was declared.
     */
    public Scope getTop() {
        return top;
    }

    public List<Scope> getSideScopes() {
        return Collections.unmodifiableList(sideScopes);
    }

    /**
     * @return Every declared signal of every scope, in declaration order.
     */
    public List<Signal> getSignals() {
        return Collections.unmodifiableList(signals);
    }

    /**
     * Gets the reference name of the signal declared under the provided identifier code.
     * @param identifier The VCD identifier code.
     * @return The signal name or null if the identifier was never declared.
     */
    public String getSignalName(String identifier) {
        return identifierNames.get(identifier);
    }

    /**
     * Opens a scope by name. The first scope becomes the top module; a later scope with a
     * different name becomes a side scope. Re-opening the top module is ignored.
     * @param name Name of the scope.
     * @return The newly created scope, or null if the name matched the top module.
     */
    public Scope openScope(String name) {
        logger.debug("Adding new scope: " + name);
        if (top == null) {
            top = new Scope(name);
            return top;
        }
        if (!top.getName().equals(name)) {
            Scope s = new Scope(name);
            sideScopes.add(s);
            return s;
        }
        logger.warn("Repeated scope entry: " + name + ". Please check vcd file.");
        return null;
    }

    /**
     * Declares a signal in the provided scope.
     * @param scope The scope that owns the signal.
     * @param identifier The VCD identifier code of the signal.
     * @param signal The signal.
     */
    public void addSignal(Scope scope, String identifier, Signal signal) {
        identifierNames.put(identifier, signal.getName());
        scope.addSignal(identifier, signal);
        signals.add(signal);
    }

    /**
     * Checks if the identifier names a signal of the top module.
     * @param identifier The VCD identifier code.
     * @return True if a top module signal is declared under this code.
     */
    public boolean isTopIdentifier(String identifier) {
        return top != null && top.containsIdentifier(identifier);
    }

    /**
     * Finds the signals recorded for an identifier code.
     * @param identifier The VCD identifier code.
     * @param topOnly If true, only the top module is searched; otherwise every scope is
     * searched and all signals sharing the code are returned.
     * @return The matching signals, empty if none.
     */
    public List<Signal> resolve(String identifier, boolean topOnly) {
        if (topOnly) {
            Signal s = top == null ? null : top.getSignal(identifier);
            return s == null ? Collections.emptyList() : Collections.singletonList(s);
        }
        List<Signal> found = new ArrayList<>();
        if (top != null && top.containsIdentifier(identifier)) {
            found.add(top.getSignal(identifier));
        }
        for (Scope s : sideScopes) {
            Signal sig = s.getSignal(identifier);
            if (sig != null) {
                found.add(sig);
            }
        }
        return found;
    }
}
