/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.io;

import com.powsybl.openwake.RingParameters;
import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.WakeAnalysisResult;
import com.powsybl.openwake.factor.LossKickCurve;
import com.powsybl.openwake.impedance.ImpedanceSpectrum;
import com.powsybl.openwake.util.PhysicalConstants;
import com.powsybl.openwake.wake.WakePotential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes the results of a wake analysis as text tables, a text summary and an archive.
 * <p>
 * File names are built from the wake type ({@code long}, {@code xdip}, {@code ydip}, {@code xquad} or {@code yquad})
 * and the display name of the wake source, for instance {@code ReZlongECHO.txt}.
 *
 * @author Open Wake Impedance developers
 */
public final class WakeResultExporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(WakeResultExporter.class);

    private static final String PRECISE_COLUMN_FORMAT = "%30.16g";

    private static final String SCAN_COLUMN_FORMAT = "%12.8g";

    /**
     * Transverse impedances are exported in kOhm/m.
     */
    private static final double TRANSVERSE_IMPEDANCE_SCALE = 1e-3;

    private WakeResultExporter() {
    }

    public static void export(WakeAnalysisResult result, Path dir) {
        Objects.requireNonNull(result);
        Objects.requireNonNull(dir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory '" + dir + "'", e);
        }

        SimulationParameters simulation = result.simulationParameters();
        String wakeType = simulation.getWakeTypeName();
        String source = simulation.getSource().getDisplayName();

        WakePotential wake = result.wake();
        writeColumns(dir.resolve("W" + wakeType + source + ".txt"), wake.getPositions(), wake.getValues(), PRECISE_COLUMN_FORMAT);

        ImpedanceSpectrum spectrum = result.spectrum();
        double scale = simulation.getMode().isTransverse() ? TRANSVERSE_IMPEDANCE_SCALE : 1;
        writeColumns(dir.resolve("ReZ" + wakeType + source + ".txt"), spectrum.getFrequencies(), scaled(spectrum.getRealParts(), scale), PRECISE_COLUMN_FORMAT);
        writeColumns(dir.resolve("ImZ" + wakeType + source + ".txt"), spectrum.getFrequencies(), scaled(spectrum.getImagParts(), scale), PRECISE_COLUMN_FORMAT);

        LossKickCurve curve = result.curve();
        double[] bunchLengthsMm = scaled(curve.getBunchLengths(), 1e3);
        if (curve.isLoss()) {
            writeColumns(dir.resolve("ImZoN" + wakeType + source + ".txt"), spectrum.getHarmonics(), spectrum.getImagPartsOverHarmonic(), PRECISE_COLUMN_FORMAT);
            writeLossSummary(dir.resolve("Loss info_" + source + ".txt"), curve, result.ringParameters());
            writeColumns(dir.resolve("Kloss" + source + ".txt"), bunchLengthsMm, curve.getFactors(), SCAN_COLUMN_FORMAT);
        } else {
            writeKickSummary(dir.resolve("Kick info_" + wakeType + source + ".txt"), curve);
            writeColumns(dir.resolve("K" + wakeType + source + ".txt"), bunchLengthsMm, curve.getFactors(), SCAN_COLUMN_FORMAT);
        }

        WakeAnalysisArchive.write(result, dir.resolve(getArchiveFileName(simulation)));

        LOGGER.info("{} {} wake analysis results exported to '{}'", source, wakeType, dir);
    }

    public static String getArchiveFileName(SimulationParameters simulation) {
        return "globdata" + simulation.getWakeTypeName() + simulation.getSource().getDisplayName() + ".json.gz";
    }

    static String formatRow(double x, double y, String columnFormat) {
        return String.format(Locale.ROOT, columnFormat + " " + columnFormat, x, y);
    }

    private static double[] scaled(double[] values, double scale) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] * scale;
        }
        return result;
    }

    private static void writeColumns(Path file, double[] x, double[] y, String columnFormat) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (int i = 0; i < x.length; i++) {
                writer.write(formatRow(x[i], y[i], columnFormat));
                writer.write('\n');
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write '" + file + "'", e);
        }
    }

    private static void writeLossSummary(Path file, LossKickCurve curve, RingParameters ring) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(String.format(Locale.ROOT, "Loss factor Z = %10.6f mV/pC  \n", curve.getFrequencyDomainFactor() * 1e3));
            writer.write(String.format(Locale.ROOT, "Loss factor W = %10.6f mV/pC  \n", curve.getTimeDomainFactor() * 1e3));
            writer.write(String.format(Locale.ROOT, "Power Loss = %10.5f W \n", curve.getPowerLoss().orElseThrow()));
            writer.write(String.format(Locale.ROOT, "for I = %9.4f mA  h = %5d  T0 = %8.4f ns ", ring.getAverageCurrent() * 1e3,
                    ring.getHarmonicNumber(), PhysicalConstants.toNanoseconds(ring.getRevolutionPeriod())));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write '" + file + "'", e);
        }
    }

    private static void writeKickSummary(Path file, LossKickCurve curve) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(String.format(Locale.ROOT, "Kick Z = %10.6f V/pC/m  \n", curve.getFrequencyDomainFactor()));
            writer.write(String.format(Locale.ROOT, "Kick W = %10.6f V/pC/m  \n", curve.getTimeDomainFactor()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write '" + file + "'", e);
        }
    }
}
