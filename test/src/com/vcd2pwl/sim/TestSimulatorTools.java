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

package com.vcd2pwl.sim;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
public class TestSimulatorTools {

    private static Path writeScript(Path dir, String body) throws IOException {
        Path script = dir.resolve("sim.sh");
        Files.write(script, ("#!/bin/sh\n" + body + "\n").getBytes(StandardCharsets.UTF_8));
        Assertions.assertTrue(script.toFile().setExecutable(true));
        return script;
    }

    @Test
    public void testDumpVCD(@TempDir Path tempDir) throws IOException {
        Path verilog = tempDir.resolve("tb.v");
        Files.write(verilog, "module tb; endmodule\n".getBytes(StandardCharsets.UTF_8));
        Path script = writeScript(tempDir, "echo \"simulating $2\"\necho '$timescale 1ns $end' > \"$(dirname \"$1\")/$2.vcd\"");
        Path log = tempDir.resolve("sim.log");

        Path vcd = SimulatorTools.dumpVCD(verilog, "tb", script.toString(), log);
        Assertions.assertEquals(tempDir.resolve("tb.vcd"), vcd);
        Assertions.assertTrue(Files.exists(vcd));
        Assertions.assertTrue(Files.readString(log).contains("simulating tb"));
    }

    @Test
    public void testScriptFailure(@TempDir Path tempDir) throws IOException {
        Path verilog = tempDir.resolve("tb.v");
        Path script = writeScript(tempDir, "exit 3");
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> SimulatorTools.dumpVCD(verilog, "tb", script.toString(), tempDir.resolve("sim.log")));
        Assertions.assertTrue(e.getMessage().contains("Exit code: 3"));
    }

    @Test
    public void testMissingVCD(@TempDir Path tempDir) throws IOException {
        Path verilog = tempDir.resolve("tb.v");
        Path script = writeScript(tempDir, "exit 0");
        Assertions.assertThrows(RuntimeException.class,
                () -> SimulatorTools.dumpVCD(verilog, "tb", script.toString(), tempDir.resolve("sim.log")));
    }

    @Test
    public void testMissingScript(@TempDir Path tempDir) {
        Path verilog = tempDir.resolve("tb.v");
        Assertions.assertThrows(RuntimeException.class, () -> SimulatorTools.dumpVCD(verilog, "tb",
                tempDir.resolve("no_such_script.sh").toString(), tempDir.resolve("sim.log")));
    }

    @Test
    public void testDumpDir(@TempDir Path tempDir) {
        Assertions.assertEquals(tempDir, SimulatorTools.getDumpDir(tempDir.resolve("tb.v")));
    }
}
