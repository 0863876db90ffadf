/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.TransverseAxis;
import com.powsybl.openwake.WakeFileParseException;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the transverse offsets written by GdfidL in the subtitle line of its wake files.
 *
 * @author Open Wake Impedance developers
 */
public final class GdfidlHeaderParser {

    /**
     * GdfidL writes the subtitle on the third line of the file.
     */
    public static final int SUBTITLE_LINE_NUMBER = 3;

    private static final String NUMBER = "([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eEdD][-+]?\\d+)?)";

    private static final Pattern DIPOLE_SUBTITLE = Pattern.compile(
            "%\\s*subtitle=\\s*\"W_l \\(x,y\\)=\\s*\\(\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*\\)\\s*\\[m\\]\"");

    private static final Pattern QUADRUPOLE_SUBTITLE = Pattern.compile(
            "%\\s*subtitle=\\s*\"integral d/d([xy]) W\\(z\\) dz,\\s*\\(x,y\\)=\\s*\\(\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*\\)\"");

    private GdfidlHeaderParser() {
    }

    /**
     * Parses a subtitle of the form {@code % subtitle= "W_l (x,y)= ( <x>, <y> ) [m]"}.
     */
    public static ProbeCoordinates parseDipoleSubtitle(String line) {
        Objects.requireNonNull(line);
        Matcher matcher = DIPOLE_SUBTITLE.matcher(line.trim());
        if (!matcher.matches()) {
            throw new WakeFileParseException("Not a dipole wake subtitle: '" + line + "'");
        }
        return new ProbeCoordinates(parseNumber(matcher.group(1)), parseNumber(matcher.group(2)));
    }

    /**
     * Parses a subtitle of the form {@code % subtitle= "integral d/d<axis> W(z) dz, (x,y)=( <x>, <y> )"}, the
     * derivative axis having to match the requested one.
     */
    public static ProbeCoordinates parseQuadrupoleSubtitle(String line, TransverseAxis axis) {
        Objects.requireNonNull(line);
        Objects.requireNonNull(axis);
        Matcher matcher = QUADRUPOLE_SUBTITLE.matcher(line.trim());
        if (!matcher.matches()) {
            throw new WakeFileParseException("Not a quadrupole wake subtitle: '" + line + "'");
        }
        if (!matcher.group(1).equals(axis.getLowerCaseName())) {
            throw new WakeFileParseException("Quadrupole wake subtitle is a d/d" + matcher.group(1)
                    + " integral whereas axis " + axis + " is requested: '" + line + "'");
        }
        return new ProbeCoordinates(parseNumber(matcher.group(2)), parseNumber(matcher.group(3)));
    }

    /**
     * Reads the dipole subtitle of a file and returns the offset along the requested axis.
     */
    public static double readDipoleOffset(Path file, TransverseAxis axis) {
        ProbeCoordinates coordinates = parseDipoleSubtitle(WakeFileReader.readLine(file, SUBTITLE_LINE_NUMBER));
        return checkOffset(coordinates.get(axis), file, axis);
    }

    public static double readQuadrupoleOffset(Path file, TransverseAxis axis) {
        ProbeCoordinates coordinates = parseQuadrupoleSubtitle(WakeFileReader.readLine(file, SUBTITLE_LINE_NUMBER), axis);
        return checkOffset(coordinates.get(axis), file, axis);
    }

    private static double checkOffset(double offset, Path file, TransverseAxis axis) {
        if (offset == 0 || !Double.isFinite(offset)) {
            throw new WakeFileParseException("Invalid " + axis + " offset " + offset + " in '" + file + "'");
        }
        return offset;
    }

    private static double parseNumber(String token) {
        // Fortran double precision exponent
        return Double.parseDouble(token.replace('d', 'e').replace('D', 'e'));
    }
}
