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
 * Raised when the requested analysis cannot be set up: unsupported source, mode and symmetry
 * combination, missing companion files or degenerate bunch length bounds.
 *
 * @author Open Wake Impedance developers
 */
public class WakeConfigurationException extends PowsyblException {

    public WakeConfigurationException(String msg) {
        super(msg);
    }

    public WakeConfigurationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
