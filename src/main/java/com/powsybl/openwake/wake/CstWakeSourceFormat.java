/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.WakeSource;

/**
 * CST writes {@code wake.txt} with positions in millimeters and wakes of the opposite sign in every plane.
 *
 * @author Open Wake Impedance developers
 */
final class CstWakeSourceFormat extends AbstractSingleFileWakeSourceFormat {

    static final CstWakeSourceFormat INSTANCE = new CstWakeSourceFormat();

    static final String WAKE_FILE_NAME = "wake.txt";

    private CstWakeSourceFormat() {
        super(2);
    }

    @Override
    public WakeSource getSource() {
        return WakeSource.CST;
    }

    @Override
    protected String getWakeFileName(SimulationParameters parameters) {
        return WAKE_FILE_NAME;
    }

    @Override
    protected double toMeters(double position, SimulationParameters parameters) {
        return position / 1000;
    }

    @Override
    protected double getSign(SimulationParameters parameters) {
        return -1;
    }
}
