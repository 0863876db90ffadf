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

import java.nio.file.Path;
import java.util.List;

/**
 * File layout, units and sign rules of the wake files of one electromagnetic solver.
 * <p>
 * Implementations are stateless; the one matching a {@link WakeSource} is selected once with {@link #of(WakeSource)}.
 *
 * @author Open Wake Impedance developers
 */
public interface WakeSourceFormat {

    static WakeSourceFormat of(WakeSource source) {
        return switch (source) {
            case ACE3P -> Ace3pWakeSourceFormat.INSTANCE;
            case GDFIDL -> GdfidlWakeSourceFormat.INSTANCE;
            case CST -> CstWakeSourceFormat.INSTANCE;
            case ECHO -> EchoWakeSourceFormat.INSTANCE;
        };
    }

    WakeSource getSource();

    /**
     * Number of lines preceding the numeric columns.
     */
    int getHeaderLineCount();

    /**
     * Files holding the wake columns, in the order expected by {@link #toWakePotential}. Fails with a
     * {@link com.powsybl.openwake.WakeConfigurationException} when the mode and symmetry combination is not supported.
     */
    List<Path> getWakeFiles(Path wakeDir, SimulationParameters parameters);

    /**
     * Files only read for their header.
     */
    default List<Path> getHeaderFiles(Path wakeDir, SimulationParameters parameters) {
        return List.of();
    }

    /**
     * Checks that the files exist before any of them is read.
     */
    void checkFiles(List<Path> files, SimulationParameters parameters);

    /**
     * Converts the raw tables read from {@link #getWakeFiles} to the canonical units and sign convention.
     */
    WakePotential toWakePotential(List<WakeTable> tables, Path wakeDir, SimulationParameters parameters);
}
