/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake;

import com.powsybl.openwake.factor.LossKickCurve;
import com.powsybl.openwake.impedance.ImpedanceSpectrum;
import com.powsybl.openwake.wake.WakePotential;

import java.util.Objects;

/**
 * Outcome of a wake analysis with the parameters it was computed with.
 *
 * @author Open Wake Impedance developers
 */
public record WakeAnalysisResult(RingParameters ringParameters, SimulationParameters simulationParameters,
                                 WakePotential wake, ImpedanceSpectrum spectrum, LossKickCurve curve) {

    public WakeAnalysisResult {
        Objects.requireNonNull(ringParameters);
        Objects.requireNonNull(simulationParameters);
        Objects.requireNonNull(wake);
        Objects.requireNonNull(spectrum);
        Objects.requireNonNull(curve);
    }
}
