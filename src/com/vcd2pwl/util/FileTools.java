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

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A collection of file and process helpers used by the conversion tools.
 */
public class FileTools {

    private static final Logger logger = LogManager.getLogger();

    //===================================================================================//
    /* Stream Helpers                                                                    */
    //===================================================================================//

    /**
     * Gets an InputStream for the provided file. If the file is gzipped (*.gz extension),
     * it is decompressed on the fly.
     * @param fileName Path to the file or gzipped file.
     * @return A buffered InputStream of the (decompressed) file contents.
     */
    public static InputStream getInputStream(Path fileName) {
        InputStream in = null;
        try {
            in = Files.newInputStream(fileName);
            if (isGzipped(fileName)) {
                in = new GZIPInputStream(in);
            }
            return new BufferedInputStream(in);
        } catch (NoSuchFileException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        } catch (IOException e) {
            close(in);
            throw new UncheckedIOException("ERROR: Problem reading file: " + fileName, e);
        }
    }

    /**
     * Creates a new BufferedWriter that will either write out text or a gzipped
     * compressed version of text based on the file extension (*.gz {@code ->} gzipped, all
     * others target an uncompressed output).
     * @param fileName Name of the output file.
     * @return The opened BufferedWriter to the named file.
     */
    public static BufferedWriter getProperOutputStream(Path fileName) {
        try {
            if (isGzipped(fileName)) {
                return new BufferedWriter(new OutputStreamWriter(
                        new GZIPOutputStream(Files.newOutputStream(fileName)), StandardCharsets.UTF_8));
            }
            return Files.newBufferedWriter(fileName, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem opening file for writing: " + fileName, e);
        }
    }

    private static boolean isGzipped(Path fileName) {
        return "gz".equalsIgnoreCase(FilenameUtils.getExtension(fileName.toString()));
    }

    private static void close(InputStream in) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            logger.warn("Problem closing stream: " + e.getMessage());
        }
    }

    //===================================================================================//
    /* Text File Helpers                                                                 */
    //===================================================================================//

    /**
     * This is a simple method that will read in a text file and put each line in a
     * string and put all the lines in an ArrayList.  The user is cautioned not
     * to open extremely large files with this method.
     * @param fileName Name of the text file to load.
     * @return An ArrayList containing strings of each line in the file.
     */
    public static ArrayList<String> getLinesFromTextFile(Path fileName) {
        String line;
        ArrayList<String> lines = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(fileName, StandardCharsets.UTF_8)) {
            while ((line = br.readLine()) != null) {
                lines.add(line);
            }
        }
        catch (NoSuchFileException | FileNotFoundException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        }
        catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + fileName, e);
        }
        return lines;
    }

    /**
     * This is a simple method that writes a String to a file as is.
     * @param text the String to write to the file
     * @param fileName Name of the text file to write
     */
    public static void writeStringToTextFile(String text, Path fileName) {
        try (BufferedWriter bw = getProperOutputStream(fileName)) {
            bw.write(text);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " +
                fileName + File.separator + e.getMessage(), e);
        }
    }

    /**
     * Checks that the file exists and throws an exception naming it otherwise.
     * @param fileName The file to check.
     */
    public static void errorIfFileDoesNotExist(Path fileName) {
        if (!Files.isRegularFile(fileName)) {
            throw new UncheckedIOException(new FileNotFoundException("ERROR: Couldn't find file: " + fileName));
        }
    }

    /**
     * Gets the file name of the path without its directory and last extension, e.g.
     * "sim/pattern.vcd" {@code ->} "pattern".
     * @param fileName The file path.
     * @return The base name.
     */
    public static String getBaseName(Path fileName) {
        return FilenameUtils.getBaseName(fileName.toString());
    }

    /**
     * Checks the extension of a file name, ignoring case.
     * @param fileName The file path.
     * @param extension Extension without the dot, e.g. "vcd".
     * @return True if the last extension matches.
     */
    public static boolean hasExtension(Path fileName, String extension) {
        return extension.equalsIgnoreCase(FilenameUtils.getExtension(fileName.toString()));
    }

    //===================================================================================//
    /* Process Helpers                                                                   */
    //===================================================================================//

    /**
     * A generic method to run a command from the system command line.
     * @param command The command to execute.  This method blocks until the command finishes.
     * @param logFileName Name of the log file to produce that will capture stderr and stdout.
     * @return The return value of the process if it terminated, if there was a problem it returns null.
     */
    public static Integer runCommand(List<String> command, Path logFileName) {
        return runCommand(command, logFileName, null);
    }

    /**
     * A generic method to run a command from the system command line.
     * @param command The command to execute.  This method blocks until the command finishes.
     * @param logFileName Name of the log file to produce that will capture stderr and stdout.
     * @param runDir the working directory of the subprocess, or null if the subprocess
     * should inherit the working directory of the current process.
     * @return The return value of the process if it terminated, if there was a problem it returns null.
     */
    public static Integer runCommand(List<String> command, Path logFileName, File runDir) {
        logger.info("External Command: " + command);
        logger.info("Log File: " + logFileName);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(logFileName.toFile());
        if (runDir != null) {
            pb.directory(runDir);
        }
        Process p = null;
        try {
            p = pb.start();
            return p.waitFor();
        } catch (IOException e) {
            logger.error("ERROR: In running the command \"" + command + "\"", e);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("ERROR: The command was interrupted: \"" + command + "\"", e);
            return null;
        } finally {
            if (p != null) p.destroyForcibly();
        }
    }
}
