/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.impedance;

import com.powsybl.openwake.WakeMode;

/**
 * Mapping from the raw transform of a wake potential to the physics sign convention of the impedance.
 * <p>
 * The longitudinal impedance is the complex conjugate of the raw transform. The transverse impedance is the raw
 * transform multiplied by {@code -i} and conjugated, so that its imaginary part carries the kick.
 *
 * @author Open Wake Impedance developers
 */
public enum ImpedanceConvention {
    LONGITUDINAL {
        @Override
        public double toReal(double rawReal, double rawImaginary) {
            return rawReal;
        }

        @Override
        public double toImaginary(double rawReal, double rawImaginary) {
            return -rawImaginary;
        }

        @Override
        public double getFactorIntegrand(double real, double imaginary) {
            return real;
        }
    },
    TRANSVERSE {
        @Override
        public double toReal(double rawReal, double rawImaginary) {
            return rawImaginary;
        }

        @Override
        public double toImaginary(double rawReal, double rawImaginary) {
            return rawReal;
        }

        @Override
        public double getFactorIntegrand(double real, double imaginary) {
            return imaginary;
        }
    };

    public abstract double toReal(double rawReal, double rawImaginary);

    public abstract double toImaginary(double rawReal, double rawImaginary);

    /**
     * Part of the impedance whose Gaussian weighted integral gives the loss factor (real part) or the kick factor
     * (imaginary part).
     */
    public abstract double getFactorIntegrand(double real, double imaginary);

    public static ImpedanceConvention of(WakeMode mode) {
        return mode.isTransverse() ? TRANSVERSE : LONGITUDINAL;
    }
}
