/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake;

import com.powsybl.commons.PowsyblException;

/**
 * Raised when a wake file row or a header line cannot be interpreted.
 *
 * @author Open Wake Impedance developers
 */
public class WakeFileParseException extends PowsyblException {

    public WakeFileParseException(String msg) {
        super(msg);
    }

    public WakeFileParseException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
