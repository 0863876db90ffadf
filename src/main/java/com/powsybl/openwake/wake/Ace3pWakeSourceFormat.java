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
 * ACE3P writes {@code wakefield.out} with positions measured from a reference point located 5 sigma ahead of
 * the bunch centre.
 *
 * @author Open Wake Impedance developers
 */
final class Ace3pWakeSourceFormat extends AbstractSingleFileWakeSourceFormat {

    static final Ace3pWakeSourceFormat INSTANCE = new Ace3pWakeSourceFormat();

    static final String WAKE_FILE_NAME = "wakefield.out";

    static final int REFERENCE_POINT_SIGMAS = 5;

    private Ace3pWakeSourceFormat() {
        super(3);
    }

    @Override
    public WakeSource getSource() {
        return WakeSource.ACE3P;
    }

    @Override
    protected String getWakeFileName(SimulationParameters parameters) {
        return WAKE_FILE_NAME;
    }

    @Override
    protected double toMeters(double position, SimulationParameters parameters) {
        return position - REFERENCE_POINT_SIGMAS * parameters.getBunchLength();
    }
}
