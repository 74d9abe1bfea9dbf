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
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Turns the words of a VCD trace into typed {@link VCDToken}s. Tokens are pulled one at a
 * time; {@link #hasNext()} returning false marks the end of the trace.
 */
public class VCDLexer implements Iterator<VCDToken>, AutoCloseable {

    public static final String END = "$end";
    public static final String COMMENT = "$comment";
    public static final String DATE = "$date";
    public static final String VERSION = "$version";
    public static final String TIMESCALE = "$timescale";
    public static final String SCOPE = "$scope";
    public static final String UPSCOPE = "$upscope";
    public static final String VAR = "$var";
    public static final String ENDDEFINITIONS = "$enddefinitions";
    public static final String DUMPVARS = "$dumpvars";
    public static final String DUMPALL = "$dumpall";
    public static final String DUMPON = "$dumpon";
    public static final String DUMPOFF = "$dumpoff";

    private final VCDTokenizer tokenizer;

    private VCDToken next;

    /** Set while inside a $dumpvars/$dumpall/$dumpon/$dumpoff block awaiting its $end */
    private boolean inDumpSection;

    public VCDLexer(Path fileName, InputStream in) {
        this.tokenizer = new VCDTokenizer(fileName, in);
    }

    public VCDLexer(InputStream in) {
        this(null, in);
    }

    public VCDLexer(VCDTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = lexNext();
        }
        return next != null;
    }

    @Override
    public VCDToken next() {
        if (!hasNext()) {
            throw new NoSuchElementException("End of VCD trace");
        }
        VCDToken t = next;
        next = null;
        return t;
    }

    public long getByteOffset() {
        return tokenizer.getByteOffset();
    }

    private VCDToken lexNext() {
        String word;
        while ((word = tokenizer.getOptionalNextTokenString()) != null) {
            switch (word.charAt(0)) {
                case '$':
                    VCDToken keyword = lexKeyword(word);
                    if (keyword != null) {
                        return keyword;
                    }
                    break;
                case '#':
                    return VCDToken.time(parseTime(word), getByteOffset());
                case '0':
                case '1':
                case 'x':
                case 'X':
                case 'z':
                case 'Z':
                    if (word.length() < 2) {
                        throw error("Missing identifier code in scalar value change '" + word + "'");
                    }
                    return VCDToken.change(VCDTokenKind.CHANGE_SCALAR,
                            new VCDValueChange(word.substring(1), word.substring(0, 1).toLowerCase()),
                            getByteOffset());
                case 'b':
                case 'B':
                    String bits = word.substring(1);
                    checkBinaryDigits(bits);
                    return VCDToken.change(VCDTokenKind.CHANGE_VECTOR,
                            new VCDValueChange(requireWord("vector value change"), bits.toLowerCase()),
                            getByteOffset());
                case 'r':
                case 'R':
                    String real = word.substring(1);
                    return VCDToken.change(VCDTokenKind.CHANGE_REAL,
                            new VCDValueChange(requireWord("real value change"), real), getByteOffset());
                case 's':
                case 'S':
                    String str = word.substring(1);
                    return VCDToken.change(VCDTokenKind.CHANGE_STRING,
                            new VCDValueChange(requireWord("string value change"), str), getByteOffset());
                default:
                    throw error("Unexpected token '" + word + "'");
            }
        }
        if (inDumpSection) {
            throw VCDParseException.unexpectedEOF("dump block, missing " + END);
        }
        return null;
    }

    /**
     * @return The token for the keyword, or null if the keyword closes a dump block.
     */
    private VCDToken lexKeyword(String word) {
        switch (word) {
            case COMMENT:
                return VCDToken.text(VCDTokenKind.COMMENT, readSectionText(word), getByteOffset());
            case DATE:
                return VCDToken.text(VCDTokenKind.DATE, readSectionText(word), getByteOffset());
            case VERSION:
                return VCDToken.text(VCDTokenKind.VERSION, readSectionText(word), getByteOffset());
            case TIMESCALE:
                return VCDToken.text(VCDTokenKind.TIMESCALE, readSectionText(word), getByteOffset());
            case SCOPE: {
                List<String> params = readSectionWords(word);
                if (params.size() != 2) {
                    throw error("Invalid parameter count in scope definition: " + params);
                }
                return VCDToken.scope(new VCDScopeDecl(params.get(0), params.get(1)), getByteOffset());
            }
            case UPSCOPE:
                expectEmptySection(word);
                return VCDToken.text(VCDTokenKind.UPSCOPE, null, getByteOffset());
            case VAR:
                return VCDToken.var(parseVarDecl(readSectionWords(word)), getByteOffset());
            case ENDDEFINITIONS:
                expectEmptySection(word);
                return VCDToken.text(VCDTokenKind.ENDDEFINITIONS, null, getByteOffset());
            case DUMPVARS:
                inDumpSection = true;
                return VCDToken.text(VCDTokenKind.DUMPVARS, null, getByteOffset());
            case DUMPALL:
            case DUMPON:
            case DUMPOFF:
                inDumpSection = true;
                return VCDToken.text(VCDTokenKind.DUMP_CONTROL, word.substring(1), getByteOffset());
            case END:
                if (inDumpSection) {
                    inDumpSection = false;
                    return null;
                }
                throw error("Unexpected " + END);
            default:
                throw error("Unrecognized keyword '" + word + "'");
        }
    }

    private VCDVarDecl parseVarDecl(List<String> params) {
        if (params.size() < 4) {
            throw error("Invalid parameter count in variable definition: " + params);
        }
        int size;
        try {
            size = Integer.parseInt(params.get(1));
        } catch (NumberFormatException e) {
            throw new VCDParseException("Invalid variable size '" + params.get(1) + "' before byte offset "
                    + getByteOffset(), e);
        }
        if (size < 1) {
            throw error("Invalid variable size " + size);
        }
        String bitIndex = null;
        if (params.size() > 4) {
            bitIndex = String.join("", params.subList(4, params.size()));
        }
        return new VCDVarDecl(params.get(0), size, params.get(2), params.get(3), bitIndex);
    }

    private long parseTime(String word) {
        try {
            long time = Long.parseLong(word.substring(1));
            if (time < 0) {
                throw error("Negative simulation time '" + word + "'");
            }
            return time;
        } catch (NumberFormatException e) {
            throw new VCDParseException("Invalid simulation time '" + word + "' before byte offset "
                    + getByteOffset(), e);
        }
    }

    private void checkBinaryDigits(String bits) {
        if (bits.isEmpty()) {
            throw error("Empty vector value");
        }
        for (int i = 0; i < bits.length(); i++) {
            switch (bits.charAt(i)) {
                case '0':
                case '1':
                case 'x':
                case 'X':
                case 'z':
                case 'Z':
                    break;
                default:
                    throw error("Invalid digit in vector value 'b" + bits + "'");
            }
        }
    }

    private String requireWord(String context) {
        String word = tokenizer.getOptionalNextTokenString();
        if (word == null) {
            throw VCDParseException.unexpectedEOF(context);
        }
        return word;
    }

    private List<String> readSectionWords(String section) {
        List<String> words = new ArrayList<>();
        String word;
        while (!END.equals(word = requireWord(section))) {
            words.add(word);
        }
        return words;
    }

    private String readSectionText(String section) {
        return String.join(" ", readSectionWords(section));
    }

    private void expectEmptySection(String section) {
        List<String> words = readSectionWords(section);
        if (!words.isEmpty()) {
            throw error("Unexpected parameters in " + section + ": " + words);
        }
    }

    private VCDParseException error(String message) {
        return new VCDParseException("Parsing Error: " + message + " before byte offset " + getByteOffset() + ".");
    }

    @Override
    public void close() throws IOException {
        tokenizer.close();
    }
}
