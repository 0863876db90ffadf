/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.util;

/**
 * Longitudinal Gaussian charge distribution of a bunch.
 *
 * @author Open Wake Impedance developers
 */
public final class GaussianBunch {

    private static final double SQRT_TWO_PI = Math.sqrt(2 * Math.PI);

    private GaussianBunch() {
    }

    /**
     * Normalized line density [1/m] at distance {@code s} from the bunch centre.
     */
    public static double density(double s, double sigma) {
        double u = s / sigma;
        return Math.exp(-u * u / 2) / (SQRT_TWO_PI * sigma);
    }

    /**
     * Fourier transform of the normalized time profile of rms duration {@code sigmaT} [s] at angular frequency
     * {@code omega} [rad/s].
     */
    public static double spectrum(double omega, double sigmaT) {
        double u = omega * sigmaT;
        return Math.exp(-u * u / 2);
    }
}
