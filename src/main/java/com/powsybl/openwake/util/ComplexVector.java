/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.util;

import org.apache.commons.math3.complex.Complex;

/**
 * Vector of complex numbers stored as separate real and imaginary part arrays.
 *
 * @author Open Wake Impedance developers
 */
public class ComplexVector {

    private final double[] realParts;
    private final double[] imagParts;

    public ComplexVector(int size) {
        realParts = new double[size];
        imagParts = new double[size];
    }

    public int size() {
        return realParts.length;
    }

    public double getReal(int i) {
        return realParts[i];
    }

    public double getImaginary(int i) {
        return imagParts[i];
    }

    public Complex get(int i) {
        return new Complex(realParts[i], imagParts[i]);
    }

    public void set(int i, double real, double imaginary) {
        realParts[i] = real;
        imagParts[i] = imaginary;
    }
}
