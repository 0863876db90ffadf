/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an index interval into contiguous ranges, one per worker.
 *
 * @author Open Wake Impedance developers
 */
public final class IndexRanges {

    public record IndexRange(int start, int end) {

        public int size() {
            return end - start;
        }
    }

    private IndexRanges() {
    }

    /**
     * Unlike a size based split, the number of ranges is fixed and the first ranges take one more index when
     * the size is not a multiple of the range count.
     */
    public static List<IndexRange> partition(int size, int rangeCount) {
        if (rangeCount <= 0) {
            throw new IllegalArgumentException("Range count should be > 0");
        }
        if (size < 0) {
            throw new IllegalArgumentException("Size should be >= 0");
        }
        List<IndexRange> ranges = new ArrayList<>(rangeCount);
        int rangeSize = size / rangeCount;
        int remainder = size % rangeCount;
        int start = 0;
        for (int range = 0; range < rangeCount; range++) {
            int adjustedRangeSize = range < remainder ? rangeSize + 1 : rangeSize;
            ranges.add(new IndexRange(start, start + adjustedRangeSize));
            start += adjustedRangeSize;
        }
        return ranges;
    }
}
