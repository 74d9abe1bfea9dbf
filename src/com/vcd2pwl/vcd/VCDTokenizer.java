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
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Splits an InputStream containing a VCD trace into whitespace separated words. This
 * class buffers its input internally, so wrapping the stream in a
 * {@link java.io.BufferedInputStream} is not needed.
 */
public class VCDTokenizer implements AutoCloseable {

    private final Path fileName;

    private final InputStream in;

    private final byte[] buffer;

    private final byte[] tokenBuffer;

    private static final Charset charset = StandardCharsets.UTF_8;

    public static final int DEFAULT_MAX_TOKEN_LENGTH = 8192*16;

    private static final int BUFFER_SIZE = 8192*8;

    protected long byteOffset;

    protected final int maxTokenLength;

    private int offset = 0;

    private int available = 0;

    public VCDTokenizer(Path fileName, InputStream in, int maxTokenLength) {
        if (maxTokenLength < 1) {
            throw new IllegalStateException("max token length must be positive but is " + maxTokenLength);
        }
        this.fileName = fileName;
        this.in = in;
        this.maxTokenLength = maxTokenLength;
        this.buffer = new byte[BUFFER_SIZE];
        this.tokenBuffer = new byte[maxTokenLength];
    }

    public VCDTokenizer(Path fileName, InputStream in) {
        this(fileName, in, DEFAULT_MAX_TOKEN_LENGTH);
    }

    /**
     * Check if a character separates words. Hardcoded using switch
     */
    private static boolean isSeparator(int c) {
        switch (c) {
            case ' ':
            case '\n':
            case '\r':
            case '\t':
            case '\f':
            case 0x0b:
                return true;
            default:
                return false;
        }
    }

    private int readByte() throws IOException {
        if (offset == available) {
            available = in.read(buffer, 0, buffer.length);
            offset = 0;
            if (available <= 0) {
                available = 0;
                return -1;
            }
        }
        byteOffset++;
        return buffer[offset++] & 0xff;
    }

    /**
     * Get the next word of the trace
     * @return word text, or null if at end of file
     */
    public String getOptionalNextTokenString() {
        try {
            int ch;
            while ((ch = readByte()) != -1 && isSeparator(ch)) {
                // skip
            }
            if (ch == -1) {
                return null;
            }
            int length = 0;
            do {
                if (length == maxTokenLength) {
                    throw new VCDParseException("ERROR: String buffer overflow on byte offset " + byteOffset
                            + " parsing token starting with " + new String(tokenBuffer, 0, Math.min(length, 150), charset)
                            + "...\n\t Please revisit why this VCD token is so long or increase the buffer in "
                            + getClass().getCanonicalName());
                }
                tokenBuffer[length++] = (byte) ch;
            } while ((ch = readByte()) != -1 && !isSeparator(ch));
            return new String(tokenBuffer, 0, length, charset);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: IOException while reading VCD file: " + fileName, e);
        }
    }

    public Path getFileName() {
        return fileName;
    }

    public long getByteOffset() {
        return byteOffset;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
