/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.factor;

import com.powsybl.openwake.DataConsistencyException;
import com.powsybl.openwake.WakeMode;
import com.powsybl.openwake.util.Trapezoid;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Loss factor (longitudinal mode, V/pC) or kick factor (transverse modes, V/pC/m) as a function of the bunch length.
 *
 * @author Open Wake Impedance developers
 */
public final class LossKickCurve {

    private static final double[] EMPTY = new double[0];

    private final WakeMode mode;

    private final double[] bunchLengths;

    private final double[] factors;

    private final double timeDomainFactor;

    private final double powerLoss;

    private final double[] scenarioPowerLosses;

    private LossKickCurve(WakeMode mode, double[] bunchLengths, double[] factors, double timeDomainFactor,
                          double powerLoss, double[] scenarioPowerLosses) {
        this.mode = Objects.requireNonNull(mode);
        Trapezoid.checkSameLength(bunchLengths, factors);
        if (bunchLengths.length == 0) {
            throw new DataConsistencyException("Empty bunch length scan");
        }
        this.bunchLengths = bunchLengths.clone();
        this.factors = factors.clone();
        this.timeDomainFactor = timeDomainFactor;
        this.powerLoss = powerLoss;
        this.scenarioPowerLosses = scenarioPowerLosses.clone();
    }

    public static LossKickCurve loss(double[] bunchLengths, double[] factors, double timeDomainFactor, double powerLoss,
                                     double[] scenarioPowerLosses) {
        if (scenarioPowerLosses.length != PowerLossScenario.REFERENCE_SCENARIOS.size()) {
            throw new DataConsistencyException("Expected " + PowerLossScenario.REFERENCE_SCENARIOS.size()
                    + " scenario power losses, got " + scenarioPowerLosses.length);
        }
        return new LossKickCurve(WakeMode.LONGITUDINAL, bunchLengths, factors, timeDomainFactor, powerLoss, scenarioPowerLosses);
    }

    public static LossKickCurve kick(WakeMode mode, double[] bunchLengths, double[] factors, double timeDomainFactor) {
        if (!mode.isTransverse()) {
            throw new DataConsistencyException("Kick factors are only defined for transverse modes, got " + mode);
        }
        return new LossKickCurve(mode, bunchLengths, factors, timeDomainFactor, Double.NaN, EMPTY);
    }

    public WakeMode getMode() {
        return mode;
    }

    public boolean isLoss() {
        return !mode.isTransverse();
    }

    public double[] getBunchLengths() {
        return bunchLengths.clone();
    }

    /**
     * Impedance based factor for each bunch length of the scan.
     */
    public double[] getFactors() {
        return factors.clone();
    }

    /**
     * Impedance based factor at the simulated bunch length, first point of the scan.
     */
    public double getFrequencyDomainFactor() {
        return factors[0];
    }

    /**
     * Wake based factor at the simulated bunch length.
     */
    public double getTimeDomainFactor() {
        return timeDomainFactor;
    }

    /**
     * Power lost by the beam at the ring current [W], loss curves only.
     */
    public OptionalDouble getPowerLoss() {
        return isLoss() ? OptionalDouble.of(powerLoss) : OptionalDouble.empty();
    }

    /**
     * Power lost for each of {@link PowerLossScenario#REFERENCE_SCENARIOS} [W], empty for kick curves.
     */
    public double[] getScenarioPowerLosses() {
        return scenarioPowerLosses.clone();
    }

    public double getRelativeDeviation() {
        return relativeDeviation(getFrequencyDomainFactor(), timeDomainFactor);
    }

    /**
     * True if the impedance and wake based factors at the simulated bunch length agree within {@code tolerance}.
     */
    public boolean isConsistent(double tolerance) {
        return getRelativeDeviation() <= tolerance;
    }

    static double relativeDeviation(double frequencyDomainFactor, double timeDomainFactor) {
        double difference = Math.abs(frequencyDomainFactor - timeDomainFactor);
        if (difference == 0) {
            return 0;
        }
        return difference / Math.max(Math.abs(timeDomainFactor), Double.MIN_NORMAL);
    }
}
