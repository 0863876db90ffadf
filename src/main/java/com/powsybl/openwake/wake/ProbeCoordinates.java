/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.TransverseAxis;

/**
 * Transverse position [m] of the probe or of the driving beam of a wake simulation.
 *
 * @author Open Wake Impedance developers
 */
public record ProbeCoordinates(double x, double y) {

    public double get(TransverseAxis axis) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
        };
    }
}
