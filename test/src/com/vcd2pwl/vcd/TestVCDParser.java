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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.vcd2pwl.support.VCDTestFiles;

public class TestVCDParser {

    private static final String HEADER = "$timescale 1ns $end\n";

    private static VCDDocument parse(String text, boolean trackAll) {
        try (VCDParser parser = new VCDParser(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)))) {
            parser.setTrackAll(trackAll);
            return parser.parse();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<String> names(Scope scope) {
        List<String> names = new ArrayList<>();
        for (Signal s : scope.getSignals()) {
            names.add(s.getName());
        }
        return names;
    }

    private static Signal find(Scope scope, String name) {
        for (Signal s : scope.getSignals()) {
            if (s.getName().equals(name)) {
                return s;
            }
        }
        return null;
    }

    @Test
    public void testParseCounter() {
        VCDDocument doc = VCDTools.readVCDFile(VCDTestFiles.getPath("vcd/counter.vcd"));
        Assertions.assertEquals("Mon Sep 29 10:00:00 2025", doc.getDate());
        Assertions.assertEquals("Icarus Verilog", doc.getVersion());
        Assertions.assertEquals(new TimeScale(1, TimeScale.Unit.NS), doc.getTimeScale());

        Scope top = doc.getTop();
        Assertions.assertEquals("tb_counter", top.getName());
        Assertions.assertEquals(Arrays.asList("CLK", "rst", "cnt", "en", "dbg"), names(top));
        Assertions.assertEquals(1, doc.getSideScopes().size());
        Assertions.assertEquals("dut", doc.getSideScopes().get(0).getName());
        Assertions.assertEquals("CLK", doc.getSignalName("!"));

        Signal clk = find(top, "CLK");
        Assertions.assertEquals(SignalKind.REGISTER, clk.getKind());
        Assertions.assertEquals(Arrays.asList(0L, 5L, 10L, 15L, 20L, 25L), new ArrayList<>(clk.getTimeline().keySet()));
        Signal cnt = find(top, "cnt");
        Assertions.assertEquals(2, cnt.getWidth());
        Assertions.assertEquals("10", Signal.bitString(cnt.getTimeline().get(20L)));
        Assertions.assertEquals(SignalKind.WIRE, find(top, "en").getKind());
        Assertions.assertFalse(find(top, "dbg").isExportSafe());
        Assertions.assertTrue(clk.isExportSafe());

        // Side scope signals are declared but not recorded by default
        Signal q = doc.getSideScopes().get(0).getSignal("'");
        Assertions.assertTrue(q.getTimeline().isEmpty());
    }

    @Test
    public void testParseGzippedCounter() {
        VCDDocument plain = VCDTools.readVCDFile(VCDTestFiles.getPath("vcd/counter.vcd"));
        VCDDocument gz = VCDTools.readVCDFile(VCDTestFiles.getPath("vcd/counter.vcd.gz"));
        Assertions.assertEquals(names(plain.getTop()), names(gz.getTop()));
        Assertions.assertEquals(plain.getSignals().size(), gz.getSignals().size());
    }

    @Test
    public void testTrackAll() {
        VCDDocument doc = VCDTools.readVCDFile(VCDTestFiles.getPath("vcd/counter.vcd"), true);
        Signal q = doc.getSideScopes().get(0).getSignal("'");
        Assertions.assertEquals(Arrays.asList(0L, 10L), new ArrayList<>(q.getTimeline().keySet()));
    }

    @Test
    public void testTrackAllUnknownIdentifier() {
        String vcd = HEADER + "$scope module top $end $var reg 1 ! a $end $upscope $end\n#0 1! 1?";
        Assertions.assertThrows(VCDParseException.class, () -> parse(vcd, true));
        VCDDocument doc = parse(vcd, false);
        Assertions.assertEquals(1, doc.getTop().getSignal("!").getTimeline().size());
    }

    @Test
    public void testTrackAllSharedIdentifier() {
        String vcd = HEADER + "$scope module top $end $var wire 1 ! a $end $upscope $end\n"
                + "$scope module sub $end $var wire 1 ! b $end $upscope $end\n#3 1!";
        VCDDocument doc = parse(vcd, true);
        Assertions.assertEquals("1", Signal.bitString(doc.getTop().getSignal("!").getTimeline().get(3L)));
        Assertions.assertEquals("1", Signal.bitString(doc.getSideScopes().get(0).getSignal("!").getTimeline().get(3L)));
    }

    @Test
    public void testMissingTimeScale() {
        String vcd = "$scope module top $end $var reg 1 ! a $end $upscope $end\n#0 1!";
        VCDParseException e = Assertions.assertThrows(VCDParseException.class, () -> parse(vcd, false));
        Assertions.assertTrue(e.getMessage().contains("$timescale"));
    }

    @Test
    public void testDeclarationsOnlyNeedNoTimeScale() {
        VCDDocument doc = parse("$scope module top $end $var reg 1 ! a $end $upscope $end", false);
        Assertions.assertNull(doc.getTimeScale());
        Assertions.assertEquals(1, doc.getSignals().size());
    }

    @Test
    public void testAmbiguousValues() {
        String vcd = HEADER + "$scope module top $end $var reg 4 ! a $end $var reg 1 \" b $end $upscope $end\n"
                + "#0 b0000 ! 0\"\n#5 b10x1 ! 1\"\n#10 b1111 ! z\"";
        VCDDocument doc = parse(vcd, false);
        Signal a = doc.getTop().getSignal("!");
        Signal b = doc.getTop().getSignal("\"");
        Assertions.assertFalse(a.isExportSafe());
        Assertions.assertFalse(b.isExportSafe());
        Assertions.assertEquals(Arrays.asList(0L, 10L), new ArrayList<>(a.getTimeline().keySet()));
        Assertions.assertEquals(Arrays.asList(0L, 5L), new ArrayList<>(b.getTimeline().keySet()));
    }

    @Test
    public void testRepeatedTopScopeIgnored() {
        String vcd = HEADER + "$scope module top $end $var reg 1 ! a $end $upscope $end\n"
                + "$scope module top $end $var reg 1 \" b $end $upscope $end\n#0 1! 1\"";
        VCDDocument doc = parse(vcd, false);
        Assertions.assertEquals(Arrays.asList("a"), names(doc.getTop()));
        Assertions.assertTrue(doc.getSideScopes().isEmpty());
    }

    @Test
    public void testUnsupportedVariableTypesSkipped() {
        String vcd = HEADER + "$scope module top $end $var integer 32 ! i $end $var real 64 \" r $end "
                + "$var parameter 8 # p $end $var reg 1 $ a $end $upscope $end\n#0 1$ r1.5 \" sfoo !";
        VCDDocument doc = parse(vcd, false);
        Assertions.assertEquals(Arrays.asList("a"), names(doc.getTop()));
    }

    @Test
    public void testValueTooWide() {
        String vcd = HEADER + "$scope module top $end $var reg 2 ! a $end $upscope $end\n#0 b111 !";
        Assertions.assertThrows(ValueTooWideException.class, () -> parse(vcd, false));
    }

    @Test
    public void testNoScope() {
        VCDDocument doc = parse(HEADER, false);
        Assertions.assertNull(doc.getTop());
        Assertions.assertTrue(doc.getSignals().isEmpty());
    }

    @Test
    public void testParseOnlyOnce() {
        VCDParser parser = new VCDParser(new ByteArrayInputStream(HEADER.getBytes(StandardCharsets.UTF_8)));
        parser.parse();
        Assertions.assertThrows(IllegalStateException.class, parser::parse);
    }

    @Test
    public void testTrackAllResolvesEveryScope() {
        VCDDocument doc = new VCDDocument();
        Scope top = doc.openScope("top");
        Scope side = doc.openScope("side");
        Assertions.assertNull(doc.openScope("top"));
        doc.addSignal(top, "!", new Signal("a", SignalKind.WIRE, 1));
        doc.addSignal(side, "#", new Signal("b", SignalKind.WIRE, 1));
        Assertions.assertTrue(doc.isTopIdentifier("!"));
        Assertions.assertFalse(doc.isTopIdentifier("#"));
        Assertions.assertTrue(doc.resolve("#", true).isEmpty());
        Assertions.assertEquals(1, doc.resolve("#", false).size());
        Assertions.assertTrue(doc.resolve("?", false).isEmpty());
    }
}
