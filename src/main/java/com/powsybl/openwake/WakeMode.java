/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake;

/**
 * Multipole order of the wake: longitudinal monopole, transverse dipole or transverse quadrupole.
 *
 * @author Open Wake Impedance developers
 */
public enum WakeMode {
    LONGITUDINAL(0),
    DIPOLE(1),
    QUADRUPOLE(2);

    private final int order;

    WakeMode(int order) {
        this.order = order;
    }

    public int getOrder() {
        return order;
    }

    public boolean isTransverse() {
        return order > 0;
    }

    public static WakeMode fromOrder(int order) {
        for (WakeMode mode : values()) {
            if (mode.order == order) {
                return mode;
            }
        }
        throw new WakeConfigurationException("Unsupported wake mode: " + order);
    }
}
