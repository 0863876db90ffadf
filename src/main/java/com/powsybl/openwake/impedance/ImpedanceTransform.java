/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.impedance;

import com.google.common.base.Stopwatch;
import com.powsybl.openwake.DataConsistencyException;
import com.powsybl.openwake.RingParameters;
import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.WakeMode;
import com.powsybl.openwake.util.ComplexVector;
import com.powsybl.openwake.util.GaussianBunch;
import com.powsybl.openwake.util.PhysicalConstants;
import com.powsybl.openwake.wake.WakePotential;
import gnu.trove.list.array.TDoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Computes the impedance of a wake potential excited by a Gaussian bunch.
 * <p>
 * The wake is tapered by the falling half of a Hanning window, Fourier transformed, shifted back to the position of
 * its first sample, divided by the bunch spectrum and finally truncated where the bunch spectrum becomes too small
 * for the division to be meaningful.
 *
 * @see ImpedanceConvention
 *
 * @author Open Wake Impedance developers
 */
public final class ImpedanceTransform {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImpedanceTransform.class);

    /**
     * Upper bound of the angular frequency range of the longitudinal impedance over harmonic [rad/s].
     */
    public static final double HARMONIC_ANGULAR_FREQUENCY_LIMIT = PhysicalConstants.TWO_PI * 20e9;

    private ImpedanceTransform() {
    }

    public static ImpedanceSpectrum compute(double[] positions, double[] values, SimulationParameters simulationParameters,
                                            RingParameters ringParameters) {
        return compute(new WakePotential(positions, values), simulationParameters, ringParameters);
    }

    public static ImpedanceSpectrum compute(WakePotential wake, SimulationParameters simulationParameters,
                                            RingParameters ringParameters) {
        Objects.requireNonNull(wake);
        Objects.requireNonNull(simulationParameters);
        Objects.requireNonNull(ringParameters);

        Stopwatch stopwatch = Stopwatch.createStarted();

        int n = wake.size();
        double[] positions = wake.getPositions();
        double[] values = wake.getValues();
        double firstPosition = positions[0];
        double dt = (positions[n - 1] - firstPosition) / (n - 1) / PhysicalConstants.C;

        double[] windowed = new double[n];
        for (int k = 0; k < n; k++) {
            windowed[k] = values[k] * PhysicalConstants.PER_PICO_COULOMB * window(k, n);
        }
        ComplexVector transform = DiscreteFourierTransform.forward(windowed);

        WakeMode mode = simulationParameters.getMode();
        ImpedanceConvention convention = ImpedanceConvention.of(mode);
        double sigmaT = simulationParameters.getBunchLength() / PhysicalConstants.C;
        double maxAngularFrequency = simulationParameters.getCutoffMultiplier() / sigmaT;
        double revolutionFrequency = ringParameters.getRevolutionFrequency();

        TDoubleArrayList frequencies = new TDoubleArrayList(n);
        TDoubleArrayList realParts = new TDoubleArrayList(n);
        TDoubleArrayList imagParts = new TDoubleArrayList(n);
        TDoubleArrayList harmonics = new TDoubleArrayList();
        TDoubleArrayList imagPartsOverHarmonic = new TDoubleArrayList();

        // bins reordered from the most negative to the most positive frequency
        int firstBin = -(n / 2);
        for (int j = 0; j < n; j++) {
            int bin = firstBin + j;
            double frequency = bin / (n * dt);
            double omega = PhysicalConstants.TWO_PI * frequency;
            if (Math.abs(omega) > maxAngularFrequency) {
                continue;
            }
            int index = bin < 0 ? bin + n : bin;

            // shift to the first sample position and scale by the time step
            double phase = -omega * firstPosition / PhysicalConstants.C;
            double shiftRe = dt * Math.cos(phase);
            double shiftIm = dt * Math.sin(phase);
            double xRe = transform.getReal(index);
            double xIm = transform.getImaginary(index);
            double bunchSpectrum = GaussianBunch.spectrum(omega, sigmaT);
            double rawRe = (shiftRe * xRe - shiftIm * xIm) / bunchSpectrum;
            double rawIm = (shiftRe * xIm + shiftIm * xRe) / bunchSpectrum;

            double real = convention.toReal(rawRe, rawIm);
            double imag = convention.toImaginary(rawRe, rawIm);
            if (!Double.isFinite(real) || !Double.isFinite(imag)) {
                throw new DataConsistencyException("Non finite impedance at frequency " + frequency + " Hz");
            }
            frequencies.add(frequency);
            realParts.add(real);
            imagParts.add(imag);

            if (!mode.isTransverse() && bin != 0 && Math.abs(omega) < HARMONIC_ANGULAR_FREQUENCY_LIMIT) {
                double harmonic = frequency / revolutionFrequency;
                harmonics.add(harmonic);
                imagPartsOverHarmonic.add(imag / harmonic);
            }
        }

        stopwatch.stop();
        LOGGER.info("Impedance of {} samples computed in {} ms ({} frequencies kept below {} rad/s)", n,
                stopwatch.elapsed(TimeUnit.MILLISECONDS), frequencies.size(), maxAngularFrequency);

        return new ImpedanceSpectrum(mode, frequencies.toArray(), realParts.toArray(), imagParts.toArray(),
                harmonics.toArray(), imagPartsOverHarmonic.toArray());
    }

    /**
     * Sample {@code k} of the falling half of a Hanning window of length {@code 2n - 1}: close to 1 at the wake
     * onset and decreasing to 0 at its tail.
     */
    static double window(int k, int n) {
        return 0.5 - 0.5 * Math.cos(PhysicalConstants.TWO_PI * (n - 1 + k) / (2 * n - 1));
    }
}
