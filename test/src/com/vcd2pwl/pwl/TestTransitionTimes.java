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

package com.vcd2pwl.pwl;

import java.math.BigDecimal;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestTransitionTimes {

    @Test
    public void testSymbolForSignal() {
        Assertions.assertEquals(TransitionTimes.TCRF, TransitionTimes.getSymbolFor("CLK"));
        Assertions.assertEquals(TransitionTimes.TRF, TransitionTimes.getSymbolFor("clk"));
        Assertions.assertEquals(TransitionTimes.TRF, TransitionTimes.getSymbolFor("data"));
    }

    @Test
    public void testValues() {
        TransitionTimes t = new TransitionTimes(0.5, 0.25);
        Assertions.assertEquals(new BigDecimal("0.5"), t.getValue(TransitionTimes.TRF));
        Assertions.assertEquals(new BigDecimal("0.25"), t.getValue(TransitionTimes.TCRF));
        Assertions.assertNull(t.getValue("vdd"));
        Assertions.assertEquals(2, t.getBindings().size());
        Assertions.assertEquals("trf=0.5, tcrf=0.25", t.toString());
    }

    @Test
    public void testNegativeRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TransitionTimes(-1, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TransitionTimes(BigDecimal.ZERO, null));
    }
}
