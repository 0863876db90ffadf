/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.TransverseAxis;
import com.powsybl.openwake.WakeConfigurationException;
import com.powsybl.openwake.WakeMode;
import com.powsybl.openwake.WakeSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * GdfidL writes one file per probe. Transverse wakes are rebuilt by finite differences of the probe wakes and
 * normalized by the transverse offset written in the subtitle of a companion file.
 * <p>
 * Without mirror symmetry, a dipole wake needs a run with the beam displaced on the plus side
 * ({@code d<axis>dpl} directory) and one on the minus side ({@code d<axis>dmi} directory).
 *
 * @author Open Wake Impedance developers
 */
final class GdfidlWakeSourceFormat implements WakeSourceFormat {

    static final GdfidlWakeSourceFormat INSTANCE = new GdfidlWakeSourceFormat();

    static final String LONGITUDINAL_WAKE_FILE_NAME = "Results-Wq_AT_XY.0001";

    private static final int HEADER_LINE_COUNT = 11;

    private GdfidlWakeSourceFormat() {
    }

    static String getTransverseWakeFileName(TransverseAxis axis, int probe) {
        return String.format(Locale.ROOT, "Results-W%s_AT_XY.%04d", axis.name(), probe);
    }

    static String getPlusDisplacementDirName(TransverseAxis axis) {
        return "d" + axis.getLowerCaseName() + "dpl";
    }

    static String getMinusDisplacementDirName(TransverseAxis axis) {
        return "d" + axis.getLowerCaseName() + "dmi";
    }

    @Override
    public WakeSource getSource() {
        return WakeSource.GDFIDL;
    }

    @Override
    public int getHeaderLineCount() {
        return HEADER_LINE_COUNT;
    }

    @Override
    public List<Path> getWakeFiles(Path wakeDir, SimulationParameters parameters) {
        TransverseAxis axis = parameters.getAxis();
        return switch (parameters.getMode()) {
            case LONGITUDINAL -> List.of(wakeDir.resolve(LONGITUDINAL_WAKE_FILE_NAME));
            case DIPOLE -> {
                if (parameters.isSymmetric()) {
                    yield probePair(wakeDir, axis);
                }
                Path plusDir = wakeDir.resolve(getPlusDisplacementDirName(axis));
                Path minusDir = wakeDir.resolve(getMinusDisplacementDirName(axis));
                yield List.of(plusDir.resolve(getTransverseWakeFileName(axis, 1)),
                              plusDir.resolve(getTransverseWakeFileName(axis, 2)),
                              minusDir.resolve(getTransverseWakeFileName(axis, 1)),
                              minusDir.resolve(getTransverseWakeFileName(axis, 2)));
            }
            case QUADRUPOLE -> parameters.isSymmetric()
                    ? List.of(wakeDir.resolve(getTransverseWakeFileName(axis, 1)))
                    : probePair(wakeDir, axis);
        };
    }

    private static List<Path> probePair(Path dir, TransverseAxis axis) {
        return List.of(dir.resolve(getTransverseWakeFileName(axis, 1)),
                       dir.resolve(getTransverseWakeFileName(axis, 2)));
    }

    /**
     * The dipole offset is read from the longitudinal wake file of the same run. The quadrupole one is read from
     * the first wake file itself.
     */
    @Override
    public List<Path> getHeaderFiles(Path wakeDir, SimulationParameters parameters) {
        if (parameters.getMode() != WakeMode.DIPOLE) {
            return List.of();
        }
        Path runDir = parameters.isSymmetric() ? wakeDir : wakeDir.resolve(getPlusDisplacementDirName(parameters.getAxis()));
        return List.of(runDir.resolve(LONGITUDINAL_WAKE_FILE_NAME));
    }

    @Override
    public void checkFiles(List<Path> files, SimulationParameters parameters) {
        if (parameters.getMode() == WakeMode.DIPOLE && !parameters.isSymmetric()) {
            List<Path> missingFiles = files.stream().filter(file -> !Files.isRegularFile(file)).toList();
            if (!missingFiles.isEmpty()) {
                throw new WakeConfigurationException("Non symmetric GdfidL dipole wake needs plus and minus displacement runs, missing files: "
                        + missingFiles.stream().map(Path::toString).collect(Collectors.joining(", ")));
            }
        } else {
            files.forEach(WakeFileReader::checkReadable);
        }
    }

    @Override
    public WakePotential toWakePotential(List<WakeTable> tables, Path wakeDir, SimulationParameters parameters) {
        WakeTable first = tables.get(0);
        for (WakeTable table : tables) {
            first.checkSameAxis(table);
        }
        double[] positions = first.positions().clone();
        double[] values = new double[first.size()];
        TransverseAxis axis = parameters.getAxis();
        switch (parameters.getMode()) {
            case LONGITUDINAL -> {
                for (int i = 0; i < values.length; i++) {
                    values[i] = -first.values()[i];
                }
            }
            case DIPOLE -> {
                double offset = GdfidlHeaderParser.readDipoleOffset(getHeaderFiles(wakeDir, parameters).get(0), axis);
                for (int i = 0; i < values.length; i++) {
                    double plusSide = (tables.get(0).values()[i] + tables.get(1).values()[i]) / 2;
                    if (!parameters.isSymmetric()) {
                        double minusSide = (tables.get(2).values()[i] + tables.get(3).values()[i]) / 2;
                        plusSide = (plusSide - minusSide) / 2;
                    }
                    values[i] = plusSide / offset;
                }
            }
            case QUADRUPOLE -> {
                double offset = GdfidlHeaderParser.readQuadrupoleOffset(first.file(), axis);
                for (int i = 0; i < values.length; i++) {
                    double wake = first.values()[i];
                    if (!parameters.isSymmetric()) {
                        wake = (wake - tables.get(1).values()[i]) / 2;
                    }
                    values[i] = -wake / offset;
                }
            }
        }
        return new WakePotential(positions, values);
    }
}
