/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.DataConsistencyException;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raw content of a wake file: first column is the position, second column the wake amplitude, both in the
 * units of the solver that wrote it.
 *
 * @author Open Wake Impedance developers
 */
public record WakeTable(Path file, double[] positions, double[] values) {

    public WakeTable {
        Objects.requireNonNull(file);
        Objects.requireNonNull(positions);
        Objects.requireNonNull(values);
        if (positions.length != values.length) {
            throw new DataConsistencyException("Inconsistent column lengths in '" + file + "'");
        }
    }

    public int size() {
        return positions.length;
    }

    void checkSameAxis(WakeTable other) {
        if (other.size() != size()) {
            throw new DataConsistencyException("Wake files '" + file + "' (" + size() + " rows) and '"
                    + other.file + "' (" + other.size() + " rows) cannot be combined");
        }
    }
}
