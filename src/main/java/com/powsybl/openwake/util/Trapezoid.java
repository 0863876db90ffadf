/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.util;

import com.powsybl.openwake.DataConsistencyException;

import java.util.function.IntToDoubleFunction;

/**
 * Trapezoidal rule over a sampled, possibly non uniform, axis.
 *
 * @author Open Wake Impedance developers
 */
public final class Trapezoid {

    private Trapezoid() {
    }

    public static double integrate(double[] x, double[] y) {
        checkSameLength(x, y);
        return integrate(x, i -> y[i]);
    }

    /**
     * Integrates y(i) over x, the integrand being evaluated lazily for each sample index.
     */
    public static double integrate(double[] x, IntToDoubleFunction y) {
        if (x.length < 2) {
            throw new DataConsistencyException("At least 2 samples are needed to integrate, got " + x.length);
        }
        double sum = 0;
        double previous = y.applyAsDouble(0);
        for (int i = 1; i < x.length; i++) {
            double current = y.applyAsDouble(i);
            sum += (x[i] - x[i - 1]) * (previous + current);
            previous = current;
        }
        return sum / 2;
    }

    public static void checkSameLength(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new DataConsistencyException("Inconsistent array lengths: " + x.length + " abscissas, " + y.length + " values");
        }
    }
}
