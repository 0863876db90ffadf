/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.powsybl.openwake.DataConsistencyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Wake Impedance developers
 */
class WakePotentialTest {

    @Test
    void test() {
        double[] positions = {0, 1e-4, 2e-4};
        double[] values = {1, 2, 3};
        WakePotential wake = new WakePotential(positions, values);
        positions[0] = 5;
        values[0] = 5;
        assertEquals(3, wake.size());
        assertEquals(0, wake.getFirstPosition());
        assertEquals(2e-4, wake.getLastPosition());
        assertEquals(1e-4, wake.getStep(), 1e-18);
        assertArrayEquals(new double[] {1, 2, 3}, wake.getValues());
        wake.getPositions()[1] = 7;
        assertEquals(1e-4, wake.getPositions()[1]);
        assertEquals(new WakePotential(new double[] {0, 1e-4, 2e-4}, new double[] {1, 2, 3}), wake);
    }

    @Test
    void testInconsistentData() {
        double[] three = {0, 1, 2};
        double[] two = {0, 1};
        var e = assertThrows(DataConsistencyException.class, () -> new WakePotential(three, two));
        assertEquals("Inconsistent array lengths: 3 abscissas, 2 values", e.getMessage());
        double[] one = {0};
        e = assertThrows(DataConsistencyException.class, () -> new WakePotential(one, one));
        assertEquals("A wake potential needs at least 2 samples, got 1", e.getMessage());
        double[] unordered = {0, 2, 1};
        e = assertThrows(DataConsistencyException.class, () -> new WakePotential(unordered, three));
        assertEquals("Wake positions are not strictly ascending at index 2 (2.0, 1.0)", e.getMessage());
    }
}
