/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.SimulationParameters;

import java.nio.file.Path;
import java.util.List;

/**
 * Solvers writing the whole wake potential in a single file, with a position rescaling or offset and a sign rule.
 *
 * @author Open Wake Impedance developers
 */
abstract class AbstractSingleFileWakeSourceFormat implements WakeSourceFormat {

    private final int headerLineCount;

    protected AbstractSingleFileWakeSourceFormat(int headerLineCount) {
        this.headerLineCount = headerLineCount;
    }

    @Override
    public int getHeaderLineCount() {
        return headerLineCount;
    }

    protected abstract String getWakeFileName(SimulationParameters parameters);

    /**
     * Converts a position read from the file to meters.
     */
    protected abstract double toMeters(double position, SimulationParameters parameters);

    /**
     * All single file solvers write longitudinal wakes with the opposite sign.
     */
    protected double getSign(SimulationParameters parameters) {
        return parameters.getMode().isTransverse() ? 1 : -1;
    }

    @Override
    public List<Path> getWakeFiles(Path wakeDir, SimulationParameters parameters) {
        return List.of(wakeDir.resolve(getWakeFileName(parameters)));
    }

    @Override
    public void checkFiles(List<Path> files, SimulationParameters parameters) {
        files.forEach(WakeFileReader::checkReadable);
    }

    @Override
    public WakePotential toWakePotential(List<WakeTable> tables, Path wakeDir, SimulationParameters parameters) {
        WakeTable table = tables.get(0);
        double sign = getSign(parameters);
        double[] positions = new double[table.size()];
        double[] values = new double[table.size()];
        for (int i = 0; i < table.size(); i++) {
            positions[i] = toMeters(table.positions()[i], parameters);
            values[i] = sign * table.values()[i];
        }
        return new WakePotential(positions, values);
    }
}
