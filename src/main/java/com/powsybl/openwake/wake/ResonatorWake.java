/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.WakeConfigurationException;
import com.powsybl.openwake.util.GaussianBunch;
import com.powsybl.openwake.util.PhysicalConstants;
import com.powsybl.openwake.util.Trapezoid;

/**
 * Longitudinal wake of a resonator of angular frequency {@code wr} [rad/s], shunt impedance {@code rs} [Ohm] and
 * quality factor {@code q}.
 * <p>
 * The wake function, in V/C, is
 * <pre>
 * w(s) = wr rs / q exp(-kr s / 2q) (cos(kr ql s / q) - sin(kr ql s / q) / 2ql)
 * </pre>
 * with {@code kr = wr / c} and {@code ql = sqrt(q^2 - 1/4)}. It is zero before the source particle and takes half
 * of its amplitude at the source position.
 *
 * @author Open Wake Impedance developers
 */
public class ResonatorWake {

    private static final double ONSET_TOLERANCE = 1e-10;

    /**
     * Half width of the bunch density support, in bunch lengths.
     */
    private static final double DENSITY_SUPPORT = 8;

    private static final int SAMPLES_PER_BUNCH_LENGTH = 50;

    private final double angularFrequency;

    private final double shuntImpedance;

    private final double qualityFactor;

    private final double amplitude;

    private final double decayRate;

    private final double oscillationRate;

    private final double loadedQ;

    public ResonatorWake(double angularFrequency, double shuntImpedance, double qualityFactor) {
        if (!(angularFrequency > 0)) {
            throw new WakeConfigurationException("Resonator angular frequency should be > 0: " + angularFrequency);
        }
        if (!Double.isFinite(shuntImpedance)) {
            throw new WakeConfigurationException("Invalid resonator shunt impedance: " + shuntImpedance);
        }
        if (!(qualityFactor > 0.5)) {
            throw new WakeConfigurationException("Resonator quality factor should be > 0.5: " + qualityFactor);
        }
        this.angularFrequency = angularFrequency;
        this.shuntImpedance = shuntImpedance;
        this.qualityFactor = qualityFactor;
        double kr = angularFrequency / PhysicalConstants.C;
        loadedQ = Math.sqrt(qualityFactor * qualityFactor - 0.25);
        amplitude = angularFrequency * shuntImpedance / qualityFactor;
        decayRate = kr / (2 * qualityFactor);
        oscillationRate = kr * loadedQ / qualityFactor;
    }

    public double getAngularFrequency() {
        return angularFrequency;
    }

    public double getShuntImpedance() {
        return shuntImpedance;
    }

    public double getQualityFactor() {
        return qualityFactor;
    }

    /**
     * Wake function in V/C at distance {@code s} [m] behind the source particle.
     */
    public double wakeFunction(double s) {
        if (s < -ONSET_TOLERANCE) {
            return 0;
        }
        if (s < ONSET_TOLERANCE) {
            return 0.5 * amplitude * (Math.cos(oscillationRate * s) - Math.sin(oscillationRate * s) / (2 * loadedQ))
                    * Math.exp(-decayRate * s);
        }
        return wakeAfterSource(s);
    }

    public double[] wakeFunction(double[] positions) {
        double[] values = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            values[i] = wakeFunction(positions[i]);
        }
        return values;
    }

    private double wakeAfterSource(double s) {
        return amplitude * Math.exp(-decayRate * s) * (Math.cos(oscillationRate * s) - Math.sin(oscillationRate * s) / (2 * loadedQ));
    }

    /**
     * Wake potential in V/pC of a Gaussian bunch of rms length {@code bunchLength} [m], sampled at
     * {@code positions} measured from the bunch centre. The convolution of the wake function with the bunch density
     * is integrated with the trapezoidal rule.
     */
    public WakePotential potential(double[] positions, double bunchLength) {
        if (!(bunchLength > 0)) {
            throw new WakeConfigurationException("Bunch length should be > 0: " + bunchLength);
        }
        double step = bunchLength / SAMPLES_PER_BUNCH_LENGTH;
        double[] values = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            double s = positions[i];
            // the source particles contributing to s lie within the density support around s
            double zMin = Math.max(0, s - DENSITY_SUPPORT * bunchLength);
            double zMax = s + DENSITY_SUPPORT * bunchLength;
            if (zMax <= zMin) {
                continue;
            }
            int sampleCount = Math.max(2, (int) Math.ceil((zMax - zMin) / step) + 1);
            double[] z = new double[sampleCount];
            for (int j = 0; j < sampleCount; j++) {
                z[j] = zMin + (zMax - zMin) * j / (sampleCount - 1);
            }
            values[i] = Trapezoid.integrate(z, j -> wakeAfterSource(z[j]) * GaussianBunch.density(s - z[j], bunchLength))
                    / PhysicalConstants.PER_PICO_COULOMB;
        }
        return new WakePotential(positions, values);
    }
}
