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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vcd2pwl.util.FileTools;

/**
 * Convenience entry points for loading VCD traces.
 */
public class VCDTools {

    private static final Logger logger = LogManager.getLogger();

    public static VCDDocument readVCDFile(Path vcdFileName) {
        return readVCDFile(vcdFileName, false);
    }

    public static VCDDocument readVCDFile(String vcdFileName) {
        return readVCDFile(Paths.get(vcdFileName), false);
    }

    /**
     * Parses a VCD file (optionally gzipped).
     * @param vcdFileName The VCD file.
     * @param trackAll If true, signals of every scope are recorded, otherwise only those
     * of the top module.
     * @return The parsed trace.
     * @throws VCDParseException If the file is not a valid VCD trace.
     */
    public static VCDDocument readVCDFile(Path vcdFileName, boolean trackAll) {
        FileTools.errorIfFileDoesNotExist(vcdFileName);
        VCDDocument document;
        try (VCDParser parser = new VCDParser(vcdFileName)) {
            parser.setTrackAll(trackAll);
            document = parser.parse();
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading VCD file: " + vcdFileName, e);
        }
        logger.info("Read " + document.getSignals().size() + " signal(s) from " + vcdFileName
                + " (timescale " + document.getTimeScale() + ")");
        return document;
    }
}
