/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.openwake.factor.LossKickCurve;
import com.powsybl.openwake.factor.LossKickFactorEngine;
import com.powsybl.openwake.impedance.ImpedanceSpectrum;
import com.powsybl.openwake.impedance.ImpedanceTransform;
import com.powsybl.openwake.wake.WakeFileCopier;
import com.powsybl.openwake.wake.WakeLoader;
import com.powsybl.openwake.wake.WakePotential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Loads a simulated wake, computes its impedance and the loss or kick factors of the ring bunches.
 *
 * @author Open Wake Impedance developers
 */
public class WakeAnalysis {

    private static final Logger LOGGER = LoggerFactory.getLogger(WakeAnalysis.class);

    private final RingParameters ringParameters;

    private final SimulationParameters simulationParameters;

    private final WakeAnalysisParameters analysisParameters;

    private final WakeLoader loader;

    private final LossKickFactorEngine factorEngine;

    public WakeAnalysis(RingParameters ringParameters, SimulationParameters simulationParameters) {
        this(ringParameters, simulationParameters, new WakeAnalysisParameters());
    }

    public WakeAnalysis(RingParameters ringParameters, SimulationParameters simulationParameters,
                        WakeAnalysisParameters analysisParameters) {
        this(ringParameters, simulationParameters, analysisParameters, ForkJoinPool.commonPool(), WakeFileCopier.DEFAULT);
    }

    public WakeAnalysis(RingParameters ringParameters, SimulationParameters simulationParameters,
                        WakeAnalysisParameters analysisParameters, Executor executor, WakeFileCopier copier) {
        this.ringParameters = Objects.requireNonNull(ringParameters);
        this.simulationParameters = Objects.requireNonNull(simulationParameters);
        this.analysisParameters = Objects.requireNonNull(analysisParameters);
        if (!(ringParameters.getMaxBunchLength() > simulationParameters.getBunchLength())) {
            throw new WakeConfigurationException("Maximum bunch length (" + ringParameters.getMaxBunchLength()
                    + ") should be greater than simulated bunch length (" + simulationParameters.getBunchLength() + ")");
        }
        loader = new WakeLoader(executor, analysisParameters.getThreadCount() > 1, copier);
        factorEngine = new LossKickFactorEngine(analysisParameters, executor);
    }

    public static WakeAnalysis load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static WakeAnalysis load(PlatformConfig platformConfig) {
        return new WakeAnalysis(RingParameters.load(platformConfig), SimulationParameters.load(platformConfig),
                WakeAnalysisParameters.load(platformConfig));
    }

    public RingParameters getRingParameters() {
        return ringParameters;
    }

    public SimulationParameters getSimulationParameters() {
        return simulationParameters;
    }

    public WakeAnalysisParameters getAnalysisParameters() {
        return analysisParameters;
    }

    public WakeAnalysisResult run(Path wakeDir) {
        return run(wakeDir, wakeDir);
    }

    /**
     * Runs the analysis on the wake files of {@code wakeDir}, copying them to {@code targetDir} when it is another
     * directory.
     */
    public WakeAnalysisResult run(Path wakeDir, Path targetDir) {
        WakePotential wake = loader.load(wakeDir, targetDir, simulationParameters);
        return analyze(wake);
    }

    public WakeAnalysisResult analyze(WakePotential wake) {
        Objects.requireNonNull(wake);
        Stopwatch stopwatch = Stopwatch.createStarted();

        ImpedanceSpectrum spectrum = ImpedanceTransform.compute(wake, simulationParameters, ringParameters);
        LossKickCurve curve = factorEngine.compute(wake, spectrum, simulationParameters, ringParameters);

        stopwatch.stop();
        if (curve.isLoss()) {
            LOGGER.info("Loss factor: {} mV/pC from impedance, {} mV/pC from wake, power loss {} W ({} ms)",
                    curve.getFrequencyDomainFactor() * 1e3, curve.getTimeDomainFactor() * 1e3,
                    curve.getPowerLoss().orElseThrow(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        } else {
            LOGGER.info("{} kick factor: {} V/pC/m from impedance, {} V/pC/m from wake ({} ms)",
                    simulationParameters.getWakeTypeName(), curve.getFrequencyDomainFactor(), curve.getTimeDomainFactor(),
                    stopwatch.elapsed(TimeUnit.MILLISECONDS));
        }

        return new WakeAnalysisResult(ringParameters, simulationParameters, wake, spectrum, curve);
    }
}
