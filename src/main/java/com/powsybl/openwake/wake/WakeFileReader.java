/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.WakeFileParseException;
import gnu.trove.list.array.TDoubleArrayList;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Reads whitespace delimited numeric columns written by the electromagnetic solvers.
 * <p>
 * A fixed number of header lines is skipped, then every non blank line must hold at least two numbers. Text after
 * a '#' or a '%' is a comment.
 *
 * @author Open Wake Impedance developers
 */
public final class WakeFileReader {

    private static final Pattern SEPARATOR = Pattern.compile("\\s+");

    private WakeFileReader() {
    }

    public static WakeTable read(Path file, int headerLineCount) {
        TDoubleArrayList positions = new TDoubleArrayList();
        TDoubleArrayList values = new TDoubleArrayList();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber <= headerLineCount) {
                    continue;
                }
                int commentStart = commentStart(line);
                String content = (commentStart >= 0 ? line.substring(0, commentStart) : line).trim();
                if (content.isEmpty()) {
                    continue;
                }
                String[] tokens = SEPARATOR.split(content);
                if (tokens.length < 2) {
                    throw new WakeFileParseException("Expected 2 columns at line " + lineNumber + " of '" + file + "'");
                }
                positions.add(parseNumber(tokens[0], file, lineNumber));
                values.add(parseNumber(tokens[1], file, lineNumber));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read wake file '" + file + "'", e);
        }
        return new WakeTable(file, positions.toArray(), values.toArray());
    }

    private static int commentStart(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '#' || c == '%') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the given 1-based line of a file.
     */
    public static String readLine(Path file, int lineNumber) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line = null;
            for (int i = 0; i < lineNumber; i++) {
                line = reader.readLine();
                if (line == null) {
                    throw new WakeFileParseException("'" + file + "' has less than " + lineNumber + " lines");
                }
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read wake file '" + file + "'", e);
        }
    }

    public static void checkReadable(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new UncheckedIOException("Wake file not found: '" + file + "'", new NoSuchFileException(file.toString()));
        }
    }

    private static double parseNumber(String token, Path file, int lineNumber) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new WakeFileParseException("Invalid number '" + token + "' at line " + lineNumber + " of '" + file + "'", e);
        }
    }
}
