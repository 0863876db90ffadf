/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake;

/**
 * Electromagnetic solver that produced the wake files.
 *
 * @author Open Wake Impedance developers
 */
public enum WakeSource {
    ACE3P("ACE3P"),
    GDFIDL("GdfidL"),
    CST("CST"),
    ECHO("ECHO");

    private final String displayName;

    WakeSource(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Name as spelled by the solver authors, used in exported file names.
     */
    public String getDisplayName() {
        return displayName;
    }
}
