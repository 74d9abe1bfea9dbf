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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestFileTools {

    @ParameterizedTest
    @ValueSource(strings = {"test.txt", "test.txt.gz"})
    public void testWriteAndReadBack(String fileName, @TempDir Path tempDir) throws IOException {
        Path path = tempDir.resolve(fileName);
        FileTools.writeStringToTextFile("line one\nline two\n", path);
        try (InputStream in = FileTools.getInputStream(path)) {
            Assertions.assertEquals("line one\nline two\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    public void testGzipIsCompressed(@TempDir Path tempDir) throws IOException {
        Path path = tempDir.resolve("test.gz");
        FileTools.writeStringToTextFile("abc", path);
        byte[] bytes = Files.readAllBytes(path);
        // gzip magic number
        Assertions.assertEquals((byte) 0x1f, bytes[0]);
        Assertions.assertEquals((byte) 0x8b, bytes[1]);
    }

    @Test
    public void testGetLinesFromTextFile(@TempDir Path tempDir) throws IOException {
        Path path = tempDir.resolve("lines.txt");
        Files.write(path, "a\nb\n\nc".getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals(Arrays.asList("a", "b", "", "c"), FileTools.getLinesFromTextFile(path));
    }

    @Test
    public void testMissingFile(@TempDir Path tempDir) {
        Path path = tempDir.resolve("missing.vcd");
        Assertions.assertThrows(UncheckedIOException.class, () -> FileTools.getInputStream(path));
        Assertions.assertThrows(UncheckedIOException.class, () -> FileTools.getLinesFromTextFile(path));
        Assertions.assertThrows(UncheckedIOException.class, () -> FileTools.errorIfFileDoesNotExist(path));
        Assertions.assertThrows(UncheckedIOException.class, () -> FileTools.errorIfFileDoesNotExist(tempDir));
    }

    @Test
    public void testFileNames() {
        Assertions.assertEquals("pattern", FileTools.getBaseName(Paths.get("sim", "pattern.vcd")));
        Assertions.assertTrue(FileTools.hasExtension(Paths.get("tb.V"), "v"));
        Assertions.assertFalse(FileTools.hasExtension(Paths.get("tb.sv"), "v"));
        Assertions.assertFalse(FileTools.hasExtension(Paths.get("tb"), "v"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    public void testRunCommand(@TempDir Path tempDir) throws IOException {
        Path log = tempDir.resolve("run.log");
        List<String> command = Arrays.asList("sh", "-c", "echo hello; echo oops 1>&2; exit 2");
        Assertions.assertEquals(2, FileTools.runCommand(command, log));
        List<String> lines = FileTools.getLinesFromTextFile(log);
        Assertions.assertTrue(lines.contains("hello"));
        Assertions.assertTrue(lines.contains("oops"));

        Assertions.assertEquals(0, FileTools.runCommand(Arrays.asList("sh", "-c", "touch marker"), log, tempDir.toFile()));
        Assertions.assertTrue(Files.exists(tempDir.resolve("marker")));
    }

    @Test
    public void testRunMissingCommand(@TempDir Path tempDir) {
        Assertions.assertNull(FileTools.runCommand(Arrays.asList("no_such_command_vcd2pwl"), tempDir.resolve("run.log")));
    }
}
