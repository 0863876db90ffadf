/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.factor;

import com.powsybl.openwake.WakeConfigurationException;

/**
 * Bunch lengths at which the loss or kick factor is evaluated.
 *
 * @author Open Wake Impedance developers
 */
public final class BunchLengthScan {

    private BunchLengthScan() {
    }

    /**
     * {@code pointCount} evenly spaced bunch lengths, the first one being exactly {@code first} and the last one
     * exactly {@code last}.
     */
    public static double[] linear(double first, double last, int pointCount) {
        if (!(first > 0)) {
            throw new WakeConfigurationException("Bunch length scan should start at a positive value: " + first);
        }
        if (!(last > first)) {
            throw new WakeConfigurationException("Degenerate bunch length scan: maximum bunch length (" + last
                    + ") should be greater than simulated bunch length (" + first + ")");
        }
        if (pointCount < 2) {
            throw new WakeConfigurationException("Bunch length scan needs at least 2 points: " + pointCount);
        }
        double[] scan = new double[pointCount];
        double step = (last - first) / (pointCount - 1);
        for (int i = 0; i < pointCount - 1; i++) {
            scan[i] = first + i * step;
        }
        scan[pointCount - 1] = last;
        return scan;
    }
}
