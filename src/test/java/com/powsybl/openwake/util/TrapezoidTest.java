/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.util;

import com.powsybl.openwake.DataConsistencyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Wake Impedance developers
 */
class TrapezoidTest {

    @Test
    void testLinearIsExact() {
        double[] x = {0, 0.5, 2, 3};
        double[] y = {1, 2, 5, 7};
        // y = 2x + 1 on [0, 3]
        assertEquals(12, Trapezoid.integrate(x, y), 1e-12);
    }

    @Test
    void testGaussianDensity() {
        int n = 2001;
        double sigma = 1e-3;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = -10 * sigma + 20 * sigma * i / (n - 1);
        }
        assertEquals(1, Trapezoid.integrate(x, i -> GaussianBunch.density(x[i], sigma)), 1e-10);
    }

    @Test
    void testErrors() {
        double[] x = {0, 1, 2};
        double[] y = {0, 1};
        var e = assertThrows(DataConsistencyException.class, () -> Trapezoid.integrate(x, y));
        assertEquals("Inconsistent array lengths: 3 abscissas, 2 values", e.getMessage());
        double[] single = {1};
        e = assertThrows(DataConsistencyException.class, () -> Trapezoid.integrate(single, single));
        assertEquals("At least 2 samples are needed to integrate, got 1", e.getMessage());
    }
}
