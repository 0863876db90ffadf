/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.factor;

import java.util.List;

/**
 * Machine operating point used to estimate the power deposited by the beam.
 *
 * @param bunchLength    RMS bunch length [m]
 * @param averageCurrent average beam current [A]
 *
 * @author Open Wake Impedance developers
 */
public record PowerLossScenario(double bunchLength, double averageCurrent) {

    /**
     * Reference operating points. The order is the one of the power loss vector of {@link LossKickCurve}.
     */
    public static final List<PowerLossScenario> REFERENCE_SCENARIOS = List.of(
            new PowerLossScenario(2.65e-3, 500e-3),
            new PowerLossScenario(5.3e-3, 500e-3),
            new PowerLossScenario(2.65e-3, 10e-3),
            new PowerLossScenario(4e-3, 110e-3),
            new PowerLossScenario(10e-3, 110e-3),
            new PowerLossScenario(10e-3, 500e-3));
}
