/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.util;

/**
 * Physical constants and unit factors shared by the wake processing chain.
 *
 * @author Open Wake Impedance developers
 */
public final class PhysicalConstants {

    /**
     * Speed of light in vacuum [m/s].
     */
    public static final double C = 299792458d;

    public static final double TWO_PI = 2 * Math.PI;

    /**
     * Wake potentials are given per picocoulomb, impedances and power losses need per coulomb values.
     */
    public static final double PER_PICO_COULOMB = 1e12;

    public static double toNanoseconds(double seconds) {
        return seconds * 1e9;
    }

    private PhysicalConstants() {
    }
}
