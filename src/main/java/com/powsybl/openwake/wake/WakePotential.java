/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.DataConsistencyException;
import com.powsybl.openwake.util.Trapezoid;

import java.util.Arrays;

/**
 * Wake potential sampled along the distance s behind the driving bunch centre.
 * <p>
 * Positions are in meters and strictly ascending, values are in V/pC for a longitudinal wake and in V/pC/m for a
 * transverse one. The sign convention is such that loss and kick factors of a passive lossy structure are positive.
 * The impedance computation additionally expects a uniform sampling step, which is not checked here.
 *
 * @author Open Wake Impedance developers
 */
public final class WakePotential {

    private final double[] positions;

    private final double[] values;

    public WakePotential(double[] positions, double[] values) {
        Trapezoid.checkSameLength(positions, values);
        if (positions.length < 2) {
            throw new DataConsistencyException("A wake potential needs at least 2 samples, got " + positions.length);
        }
        for (int i = 1; i < positions.length; i++) {
            if (!(positions[i] > positions[i - 1])) {
                throw new DataConsistencyException("Wake positions are not strictly ascending at index " + i
                        + " (" + positions[i - 1] + ", " + positions[i] + ")");
            }
        }
        this.positions = positions.clone();
        this.values = values.clone();
    }

    public int size() {
        return positions.length;
    }

    public double[] getPositions() {
        return positions.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public double getFirstPosition() {
        return positions[0];
    }

    public double getLastPosition() {
        return positions[positions.length - 1];
    }

    /**
     * Mean sampling step [m].
     */
    public double getStep() {
        return (getLastPosition() - getFirstPosition()) / (positions.length - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WakePotential other)) {
            return false;
        }
        return Arrays.equals(positions, other.positions) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(positions) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "WakePotential(size=" + positions.length + ", s=[" + getFirstPosition() + ", " + getLastPosition() + "])";
    }
}
