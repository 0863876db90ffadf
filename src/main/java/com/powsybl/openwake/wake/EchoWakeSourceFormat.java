/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.WakeConfigurationException;
import com.powsybl.openwake.WakeSource;

/**
 * ECHO writes {@code wake.dat} (longitudinal) or {@code wakeT.dat} (transverse) with positions in centimeters.
 * Transverse wakes are only available for symmetric structures.
 *
 * @author Open Wake Impedance developers
 */
final class EchoWakeSourceFormat extends AbstractSingleFileWakeSourceFormat {

    static final EchoWakeSourceFormat INSTANCE = new EchoWakeSourceFormat();

    static final String LONGITUDINAL_WAKE_FILE_NAME = "wake.dat";

    static final String TRANSVERSE_WAKE_FILE_NAME = "wakeT.dat";

    private EchoWakeSourceFormat() {
        super(0);
    }

    @Override
    public WakeSource getSource() {
        return WakeSource.ECHO;
    }

    @Override
    protected String getWakeFileName(SimulationParameters parameters) {
        if (!parameters.getMode().isTransverse()) {
            return LONGITUDINAL_WAKE_FILE_NAME;
        }
        if (!parameters.isSymmetric()) {
            throw new WakeConfigurationException("ECHO transverse wakes require a symmetric structure");
        }
        return TRANSVERSE_WAKE_FILE_NAME;
    }

    @Override
    protected double toMeters(double position, SimulationParameters parameters) {
        return position / 100;
    }
}
