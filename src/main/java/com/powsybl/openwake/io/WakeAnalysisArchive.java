/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.json.JsonUtil;
import com.powsybl.openwake.RingParameters;
import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.TransverseAxis;
import com.powsybl.openwake.WakeAnalysisResult;
import com.powsybl.openwake.WakeMode;
import com.powsybl.openwake.WakeSource;
import com.powsybl.openwake.factor.LossKickCurve;
import com.powsybl.openwake.impedance.ImpedanceSpectrum;
import com.powsybl.openwake.wake.WakePotential;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip compressed JSON archive of a wake analysis: parameters, wake, impedance and factor curve.
 *
 * @author Open Wake Impedance developers
 */
public final class WakeAnalysisArchive {

    public static final String VERSION = "1.0";

    record RingData(double circumference, double bunchLength, double maxBunchLength, double averageCurrent,
                    int harmonicNumber) {
    }

    record SimulationData(WakeSource source, WakeMode mode, TransverseAxis axis, boolean symmetric, double bunchLength,
                          double cutoffMultiplier) {
    }

    record WakeData(double[] positions, double[] values) {
    }

    record SpectrumData(double[] frequencies, double[] realParts, double[] imagParts, double[] harmonics,
                        double[] imagPartsOverHarmonic) {
    }

    record CurveData(double[] bunchLengths, double[] factors, double timeDomainFactor, Double powerLoss,
                     double[] scenarioPowerLosses) {
    }

    record ArchiveData(String version, RingData ring, SimulationData simulation, WakeData wake, SpectrumData spectrum,
                       CurveData curve) {
    }

    private WakeAnalysisArchive() {
    }

    private static ObjectMapper createMapper() {
        return JsonUtil.createObjectMapper();
    }

    public static void write(WakeAnalysisResult result, Path file) {
        Objects.requireNonNull(result);
        Objects.requireNonNull(file);
        try (OutputStream os = new GZIPOutputStream(Files.newOutputStream(file))) {
            createMapper().writeValue(os, toData(result));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write wake analysis archive '" + file + "'", e);
        }
    }

    public static WakeAnalysisResult read(Path file) {
        Objects.requireNonNull(file);
        ArchiveData data;
        try (InputStream is = new GZIPInputStream(Files.newInputStream(file))) {
            data = createMapper().readValue(is, ArchiveData.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read wake analysis archive '" + file + "'", e);
        }
        if (!VERSION.equals(data.version())) {
            throw new PowsyblException("Unsupported wake analysis archive version '" + data.version() + "' in '" + file + "', expected " + VERSION);
        }
        return fromData(data);
    }

    private static ArchiveData toData(WakeAnalysisResult result) {
        RingParameters ring = result.ringParameters();
        SimulationParameters simulation = result.simulationParameters();
        WakePotential wake = result.wake();
        ImpedanceSpectrum spectrum = result.spectrum();
        LossKickCurve curve = result.curve();
        return new ArchiveData(VERSION,
                new RingData(ring.getCircumference(), ring.getBunchLength(), ring.getMaxBunchLength(), ring.getAverageCurrent(),
                        ring.getHarmonicNumber()),
                new SimulationData(simulation.getSource(), simulation.getMode(), simulation.getAxis(), simulation.isSymmetric(),
                        simulation.getBunchLength(), simulation.getCutoffMultiplier()),
                new WakeData(wake.getPositions(), wake.getValues()),
                new SpectrumData(spectrum.getFrequencies(), spectrum.getRealParts(), spectrum.getImagParts(),
                        spectrum.getHarmonics(), spectrum.getImagPartsOverHarmonic()),
                new CurveData(curve.getBunchLengths(), curve.getFactors(), curve.getTimeDomainFactor(),
                        curve.getPowerLoss().isPresent() ? curve.getPowerLoss().getAsDouble() : null,
                        curve.getScenarioPowerLosses()));
    }

    private static WakeAnalysisResult fromData(ArchiveData data) {
        RingData ringData = Objects.requireNonNull(data.ring(), "Missing ring parameters");
        SimulationData simulationData = Objects.requireNonNull(data.simulation(), "Missing simulation parameters");
        RingParameters ring = RingParameters.builder()
                .setCircumference(ringData.circumference())
                .setBunchLength(ringData.bunchLength())
                .setMaxBunchLength(ringData.maxBunchLength())
                .setAverageCurrent(ringData.averageCurrent())
                .setHarmonicNumber(ringData.harmonicNumber())
                .build();
        SimulationParameters simulation = SimulationParameters.builder()
                .setSource(simulationData.source())
                .setMode(simulationData.mode())
                .setAxis(simulationData.axis())
                .setSymmetric(simulationData.symmetric())
                .setBunchLength(simulationData.bunchLength())
                .setCutoffMultiplier(simulationData.cutoffMultiplier())
                .build();
        WakePotential wake = new WakePotential(data.wake().positions(), data.wake().values());
        SpectrumData spectrumData = data.spectrum();
        ImpedanceSpectrum spectrum = new ImpedanceSpectrum(simulation.getMode(), spectrumData.frequencies(),
                spectrumData.realParts(), spectrumData.imagParts(), spectrumData.harmonics(), spectrumData.imagPartsOverHarmonic());
        CurveData curveData = data.curve();
        LossKickCurve curve;
        if (simulation.getMode().isTransverse()) {
            curve = LossKickCurve.kick(simulation.getMode(), curveData.bunchLengths(), curveData.factors(), curveData.timeDomainFactor());
        } else {
            if (curveData.powerLoss() == null) {
                throw new PowsyblException("Missing power loss in longitudinal wake analysis archive");
            }
            curve = LossKickCurve.loss(curveData.bunchLengths(), curveData.factors(), curveData.timeDomainFactor(),
                    curveData.powerLoss(), curveData.scenarioPowerLosses());
        }
        return new WakeAnalysisResult(ring, simulation, wake, spectrum, curve);
    }
}
