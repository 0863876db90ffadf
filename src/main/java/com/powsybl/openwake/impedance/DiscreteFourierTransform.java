/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.impedance;

import com.powsybl.openwake.util.ComplexVector;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Forward discrete Fourier transform {@code X[k] = sum x[n] exp(-2 i pi k n / N)} of a real sequence of any length.
 * <p>
 * Power of two lengths are transformed directly by the commons-math radix-2 FFT, other lengths are rewritten as a
 * circular convolution with a chirp (Bluestein's algorithm) evaluated with power of two FFTs.
 *
 * @author Open Wake Impedance developers
 */
public final class DiscreteFourierTransform {

    private DiscreteFourierTransform() {
    }

    public static ComplexVector forward(double[] values) {
        int n = values.length;
        if (n == 0) {
            return new ComplexVector(0);
        }
        if (isPowerOfTwo(n)) {
            double[][] data = new double[][] {values.clone(), new double[n]};
            FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.FORWARD);
            return toVector(data[0], data[1], n);
        }
        return bluestein(values);
    }

    static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    private static ComplexVector bluestein(double[] values) {
        int n = values.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) {
            m <<= 1;
        }

        // chirp w[j] = exp(-i pi j^2 / n), j^2 reduced modulo 2n to keep the angle accurate
        double[] chirpCos = new double[n];
        double[] chirpSin = new double[n];
        for (int j = 0; j < n; j++) {
            long square = (long) j * j % (2L * n);
            double angle = Math.PI * square / n;
            chirpCos[j] = Math.cos(angle);
            chirpSin[j] = -Math.sin(angle);
        }

        double[][] a = new double[2][m];
        for (int j = 0; j < n; j++) {
            a[0][j] = values[j] * chirpCos[j];
            a[1][j] = values[j] * chirpSin[j];
        }

        // conjugated chirp, wrapped around for negative indices
        double[][] b = new double[2][m];
        b[0][0] = chirpCos[0];
        b[1][0] = -chirpSin[0];
        for (int j = 1; j < n; j++) {
            b[0][j] = chirpCos[j];
            b[1][j] = -chirpSin[j];
            b[0][m - j] = chirpCos[j];
            b[1][m - j] = -chirpSin[j];
        }

        FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.FORWARD);
        FastFourierTransformer.transformInPlace(b, DftNormalization.STANDARD, TransformType.FORWARD);
        for (int j = 0; j < m; j++) {
            double re = a[0][j] * b[0][j] - a[1][j] * b[1][j];
            double im = a[0][j] * b[1][j] + a[1][j] * b[0][j];
            a[0][j] = re;
            a[1][j] = im;
        }
        FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.INVERSE);

        ComplexVector result = new ComplexVector(n);
        for (int k = 0; k < n; k++) {
            double re = a[0][k] * chirpCos[k] - a[1][k] * chirpSin[k];
            double im = a[0][k] * chirpSin[k] + a[1][k] * chirpCos[k];
            result.set(k, re, im);
        }
        return result;
    }

    private static ComplexVector toVector(double[] real, double[] imag, int n) {
        ComplexVector result = new ComplexVector(n);
        for (int k = 0; k < n; k++) {
            result.set(k, real[k], imag[k]);
        }
        return result;
    }
}
