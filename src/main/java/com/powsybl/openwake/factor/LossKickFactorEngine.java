/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.factor;

import com.google.common.base.Stopwatch;
import com.powsybl.computation.CompletableFutureTask;
import com.powsybl.openwake.RingParameters;
import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.WakeAnalysisParameters;
import com.powsybl.openwake.impedance.ImpedanceSpectrum;
import com.powsybl.openwake.util.GaussianBunch;
import com.powsybl.openwake.util.IndexRanges;
import com.powsybl.openwake.util.ParallelTasks;
import com.powsybl.openwake.util.PhysicalConstants;
import com.powsybl.openwake.util.Trapezoid;
import com.powsybl.openwake.wake.WakePotential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Computes loss or kick factors of a Gaussian bunch from the impedance, over a range of bunch lengths, and from the
 * wake potential at the simulated bunch length.
 * <p>
 * The impedance based factor for a bunch length {@code sigma} is
 * <pre>
 * c / 2pi * 1e-12 * integral F(k) exp(-k^2 sigma^2) dk
 * </pre>
 * on the wavenumber axis {@code k = omega / c}, {@code F} being the real impedance for the loss factor and the
 * imaginary transverse impedance for the kick factor.
 *
 * @author Open Wake Impedance developers
 */
public class LossKickFactorEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(LossKickFactorEngine.class);

    private final WakeAnalysisParameters parameters;

    private final Executor executor;

    public LossKickFactorEngine(WakeAnalysisParameters parameters, Executor executor) {
        this.parameters = Objects.requireNonNull(parameters);
        this.executor = Objects.requireNonNull(executor);
    }

    public LossKickCurve compute(WakePotential wake, ImpedanceSpectrum spectrum, SimulationParameters simulationParameters,
                                 RingParameters ringParameters) {
        Objects.requireNonNull(wake);
        Objects.requireNonNull(spectrum);
        Objects.requireNonNull(simulationParameters);
        Objects.requireNonNull(ringParameters);

        Stopwatch stopwatch = Stopwatch.createStarted();

        double simulatedBunchLength = simulationParameters.getBunchLength();
        double[] bunchLengths = BunchLengthScan.linear(simulatedBunchLength, ringParameters.getMaxBunchLength(),
                parameters.getScanPointCount());
        double[] wavenumbers = toWavenumbers(spectrum.getAngularFrequencies());
        double[] integrand = spectrum.getFactorIntegrand();
        Trapezoid.checkSameLength(wavenumbers, integrand);

        double[] factors = scan(wavenumbers, integrand, bunchLengths);
        double timeDomainFactor = timeDomainFactor(wake, simulatedBunchLength);

        LossKickCurve curve;
        if (spectrum.getMode().isTransverse()) {
            curve = LossKickCurve.kick(spectrum.getMode(), bunchLengths, factors, timeDomainFactor);
        } else {
            double powerLoss = powerLoss(timeDomainFactor, ringParameters.getAverageCurrent(), ringParameters);
            List<PowerLossScenario> scenarios = PowerLossScenario.REFERENCE_SCENARIOS;
            double[] scenarioPowerLosses = new double[scenarios.size()];
            for (int i = 0; i < scenarios.size(); i++) {
                PowerLossScenario scenario = scenarios.get(i);
                double factor = frequencyDomainFactor(wavenumbers, integrand, scenario.bunchLength());
                scenarioPowerLosses[i] = powerLoss(factor, scenario.averageCurrent(), ringParameters);
            }
            curve = LossKickCurve.loss(bunchLengths, factors, timeDomainFactor, powerLoss, scenarioPowerLosses);
        }

        if (!curve.isConsistent(parameters.getCrossCheckTolerance())) {
            LOGGER.warn("{} factor from impedance ({}) and from wake ({}) differ by {} % at bunch length {} m, wake or impedance data may be inconsistent",
                    curve.isLoss() ? "Loss" : "Kick", curve.getFrequencyDomainFactor(), timeDomainFactor,
                    curve.getRelativeDeviation() * 100, simulatedBunchLength);
        }

        stopwatch.stop();
        LOGGER.info("{} factor scan of {} bunch lengths done in {} ms", curve.isLoss() ? "Loss" : "Kick",
                bunchLengths.length, stopwatch.elapsed(TimeUnit.MILLISECONDS));

        return curve;
    }

    private double[] scan(double[] wavenumbers, double[] integrand, double[] bunchLengths) {
        double[] factors = new double[bunchLengths.length];
        int threadCount = Math.min(parameters.getThreadCount(), bunchLengths.length);
        if (threadCount == 1) {
            for (int i = 0; i < bunchLengths.length; i++) {
                factors[i] = frequencyDomainFactor(wavenumbers, integrand, bunchLengths[i]);
            }
            return factors;
        }

        List<IndexRanges.IndexRange> ranges = IndexRanges.partition(bunchLengths.length, threadCount);
        List<CompletableFuture<Void>> futures = new ArrayList<>(ranges.size());
        for (IndexRanges.IndexRange range : ranges) {
            futures.add(CompletableFutureTask.runAsync(() -> {
                for (int i = range.start(); i < range.end(); i++) {
                    factors[i] = frequencyDomainFactor(wavenumbers, integrand, bunchLengths[i]);
                }
                return null;
            }, executor));
        }
        ParallelTasks.await(futures, "bunch length scan");
        return factors;
    }

    /**
     * Impedance based factor [V/pC or V/pC/m] of a Gaussian bunch of RMS length {@code bunchLength} [m].
     */
    public static double frequencyDomainFactor(double[] wavenumbers, double[] integrand, double bunchLength) {
        Trapezoid.checkSameLength(wavenumbers, integrand);
        double sigma2 = bunchLength * bunchLength;
        double integral = Trapezoid.integrate(wavenumbers, i -> integrand[i] * Math.exp(-wavenumbers[i] * wavenumbers[i] * sigma2));
        return PhysicalConstants.C / PhysicalConstants.TWO_PI * integral / PhysicalConstants.PER_PICO_COULOMB;
    }

    /**
     * Wake based factor [V/pC or V/pC/m]: the wake potential weighted by the normalized density of the bunch
     * that excited it.
     */
    public static double timeDomainFactor(WakePotential wake, double bunchLength) {
        double[] positions = wake.getPositions();
        double[] values = wake.getValues();
        return Trapezoid.integrate(positions, i -> values[i] * GaussianBunch.density(positions[i], bunchLength));
    }

    /**
     * Power [W] lost by a beam of average current {@code averageCurrent} [A] evenly spread over the ring buckets.
     */
    public static double powerLoss(double lossFactor, double averageCurrent, RingParameters ringParameters) {
        return lossFactor * PhysicalConstants.PER_PICO_COULOMB * averageCurrent * averageCurrent
                * ringParameters.getRevolutionPeriod() / ringParameters.getHarmonicNumber();
    }

    private static double[] toWavenumbers(double[] angularFrequencies) {
        double[] wavenumbers = new double[angularFrequencies.length];
        for (int i = 0; i < angularFrequencies.length; i++) {
            wavenumbers[i] = angularFrequencies[i] / PhysicalConstants.C;
        }
        return wavenumbers;
    }
}
