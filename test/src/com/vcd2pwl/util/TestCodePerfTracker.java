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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestCodePerfTracker {

    @Test
    public void testSegments() {
        CodePerfTracker t = new CodePerfTracker("test", false);
        t.start("first").stop().start("second").stop();
        Assertions.assertTrue(t.getRuntime("first") >= 0);
        Assertions.assertTrue(t.getRuntime("second") >= 0);
        Assertions.assertNull(t.getRuntime("third"));
        t.printTotals();
    }

    @Test
    public void testSilent() {
        CodePerfTracker.SILENT.start("ignored").stop();
        Assertions.assertNull(CodePerfTracker.SILENT.getRuntime("ignored"));
    }
}
