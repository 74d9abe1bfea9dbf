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

package com.vcd2pwl.tools;

import java.math.BigDecimal;
import java.nio.file.Paths;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.vcd2pwl.util.Params;
import com.vcd2pwl.vcd.TimeScale;

import joptsimple.OptionException;

public class TestPWLConfig {

    @Test
    public void testDefaults() {
        PWLConfig config = new PWLConfig(new String[]{"-i", "trace.vcd"});
        Assertions.assertEquals(Paths.get("trace.vcd"), config.getInputFile());
        Assertions.assertNull(config.getOutputFile());
        Assertions.assertEquals(BigDecimal.ZERO, config.getTrf());
        Assertions.assertEquals(BigDecimal.ZERO, config.getTcrf());
        Assertions.assertEquals(TimeScale.Unit.fromSuffix(Params.VCD2PWL_TARGET_UNIT), config.getTargetUnit());
        Assertions.assertFalse(config.isTrackAll());
        Assertions.assertFalse(config.isDebug());
    }

    @Test
    public void testAllOptions() {
        PWLConfig config = new PWLConfig(new String[]{"--input_file", "tb.vcd", "-o", "out/tb.pwl", "--trf", "0.1",
                "--tcrf", "0.05", "--unit", "ps", "--full", "--debug"});
        Assertions.assertEquals(Paths.get("tb.vcd"), config.getInputFile());
        Assertions.assertEquals(Paths.get("out/tb.pwl"), config.getOutputFile());
        Assertions.assertEquals(new BigDecimal("0.1"), config.getTrf());
        Assertions.assertEquals(new BigDecimal("0.05"), config.getTcrf());
        Assertions.assertEquals(TimeScale.Unit.PS, config.getTargetUnit());
        Assertions.assertTrue(config.isTrackAll());
        Assertions.assertTrue(config.isDebug());
        Assertions.assertEquals("trf=0.1, tcrf=0.05", config.getTransitionTimes().toString());
    }

    @Test
    public void testNoDebug() {
        PWLConfig config = new PWLConfig(new String[]{"-i", "a.vcd", "--debug", "--no-debug"});
        Assertions.assertFalse(config.isDebug());
    }

    @Test
    public void testMissingInput() {
        Assertions.assertThrows(RuntimeException.class, () -> new PWLConfig(new String[]{"--trf", "1"}));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-1", "fast", ""})
    public void testInvalidTrf(String value) {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new PWLConfig(new String[]{"-i", "a.vcd", "--trf", value}));
    }

    @Test
    public void testInvalidUnit() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new PWLConfig(new String[]{"-i", "a.vcd", "--unit", "min"}));
    }

    @Test
    public void testUnknownOption() {
        Assertions.assertThrows(OptionException.class,
                () -> new PWLConfig(new String[]{"-i", "a.vcd", "--bogus"}));
    }

    @Test
    public void testHelp() {
        Assertions.assertTrue(PWLConfig.hasHelpArg(new String[]{"-h"}));
        Assertions.assertTrue(PWLConfig.hasHelpArg(new String[]{"--help"}));
        Assertions.assertFalse(PWLConfig.hasHelpArg(new String[]{"-i", "a.vcd"}));
    }
}
