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

package com.vcd2pwl.util;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Simple tool for measuring the runtime of the named steps of a tool run and reporting
 * them.
 */
public class CodePerfTracker {

    private static final Logger logger = LogManager.getLogger();

    private final String name;

    private final List<String> segmentNames = new ArrayList<>();

    private final List<Long> runtimes = new ArrayList<>();

    private boolean verbose;

    public static final CodePerfTracker SILENT = new CodePerfTracker("", false);

    public CodePerfTracker(String name) {
        this(name, true);
    }

    public CodePerfTracker(String name, boolean verbose) {
        this.name = name;
        this.verbose = verbose;
    }

    public String getName() {
        return name;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    private int getSegmentIndex(String segmentName) {
        return segmentNames.indexOf(segmentName);
    }

    /**
     * @param segmentName Name of a stopped segment.
     * @return Its runtime in nanoseconds, or null if no such segment was recorded.
     */
    public Long getRuntime(String segmentName) {
        int i = getSegmentIndex(segmentName);
        return i == -1 ? null : runtimes.get(i);
    }

    public CodePerfTracker start(String segmentName) {
        if (this == SILENT) return this;
        segmentNames.add(segmentName);
        runtimes.add(System.nanoTime());
        return this;
    }

    public CodePerfTracker stop() {
        if (this == SILENT) return this;
        long end = System.nanoTime();
        int idx = runtimes.size()-1;
        if (idx < 0) return this;
        runtimes.set(idx, end - runtimes.get(idx));
        if (verbose) {
            print(idx);
        }
        return this;
    }

    private void print(int idx) {
        logger.info(String.format("%24s: %9.3fs", segmentNames.get(idx), runtimes.get(idx)/1000000000.0));
    }

    /**
     * Logs the total runtime of all stopped segments.
     */
    public void printTotals() {
        if (this == SILENT || !verbose) return;
        long total = 0L;
        for (Long r : runtimes) {
            total += r;
        }
        logger.info(String.format("%24s: %9.3fs", "[" + name + "] Total", total/1000000000.0));
    }
}
