/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.impedance;

import com.powsybl.openwake.DataConsistencyException;
import com.powsybl.openwake.WakeMode;
import com.powsybl.openwake.util.PhysicalConstants;
import com.powsybl.openwake.util.Trapezoid;

import java.util.Objects;

/**
 * Beam coupling impedance on an ascending frequency axis, in Ohm for the longitudinal mode and in Ohm/m for the
 * transverse ones.
 * <p>
 * Longitudinal spectra also carry the imaginary impedance divided by the revolution harmonic {@code n = f / f0},
 * restricted to the non zero frequencies below {@link ImpedanceTransform#HARMONIC_ANGULAR_FREQUENCY_LIMIT}.
 *
 * @author Open Wake Impedance developers
 */
public final class ImpedanceSpectrum {

    private static final double[] EMPTY = new double[0];

    private final WakeMode mode;

    private final double[] frequencies;

    private final double[] realParts;

    private final double[] imagParts;

    private final double[] harmonics;

    private final double[] imagPartsOverHarmonic;

    public ImpedanceSpectrum(WakeMode mode, double[] frequencies, double[] realParts, double[] imagParts) {
        this(mode, frequencies, realParts, imagParts, EMPTY, EMPTY);
    }

    public ImpedanceSpectrum(WakeMode mode, double[] frequencies, double[] realParts, double[] imagParts,
                             double[] harmonics, double[] imagPartsOverHarmonic) {
        this.mode = Objects.requireNonNull(mode);
        Trapezoid.checkSameLength(frequencies, realParts);
        Trapezoid.checkSameLength(frequencies, imagParts);
        Trapezoid.checkSameLength(harmonics, imagPartsOverHarmonic);
        if (mode.isTransverse() && harmonics.length > 0) {
            throw new DataConsistencyException("Impedance over harmonic is only defined for the longitudinal mode");
        }
        this.frequencies = frequencies.clone();
        this.realParts = realParts.clone();
        this.imagParts = imagParts.clone();
        this.harmonics = harmonics.clone();
        this.imagPartsOverHarmonic = imagPartsOverHarmonic.clone();
    }

    public WakeMode getMode() {
        return mode;
    }

    public int size() {
        return frequencies.length;
    }

    /**
     * Frequencies [Hz], ascending.
     */
    public double[] getFrequencies() {
        return frequencies.clone();
    }

    public double[] getAngularFrequencies() {
        double[] omegas = new double[frequencies.length];
        for (int i = 0; i < frequencies.length; i++) {
            omegas[i] = PhysicalConstants.TWO_PI * frequencies[i];
        }
        return omegas;
    }

    public double[] getRealParts() {
        return realParts.clone();
    }

    public double[] getImagParts() {
        return imagParts.clone();
    }

    public double[] getHarmonics() {
        return harmonics.clone();
    }

    public double[] getImagPartsOverHarmonic() {
        return imagPartsOverHarmonic.clone();
    }

    /**
     * Impedance part entering the loss factor (longitudinal) or kick factor (transverse) integral.
     */
    public double[] getFactorIntegrand() {
        ImpedanceConvention convention = ImpedanceConvention.of(mode);
        double[] integrand = new double[frequencies.length];
        for (int i = 0; i < frequencies.length; i++) {
            integrand[i] = convention.getFactorIntegrand(realParts[i], imagParts[i]);
        }
        return integrand;
    }
}
