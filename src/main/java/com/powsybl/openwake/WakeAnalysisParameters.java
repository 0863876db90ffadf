/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake;

import com.powsybl.commons.config.PlatformConfig;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Execution options of a wake analysis, independent of the physics inputs.
 *
 * @author Open Wake Impedance developers
 */
public class WakeAnalysisParameters {

    public static final String THREAD_COUNT_PARAM_NAME = "threadCount";
    public static final int THREAD_COUNT_DEFAULT_VALUE = 1;
    public static final String CROSS_CHECK_TOLERANCE_PARAM_NAME = "crossCheckTolerance";
    public static final double CROSS_CHECK_TOLERANCE_DEFAULT_VALUE = 0.05;
    public static final String SCAN_POINT_COUNT_PARAM_NAME = "scanPointCount";
    public static final int SCAN_POINT_COUNT_DEFAULT_VALUE = 100;
    public static final List<String> SPECIFIC_PARAMETERS_NAMES = List.of(THREAD_COUNT_PARAM_NAME, CROSS_CHECK_TOLERANCE_PARAM_NAME, SCAN_POINT_COUNT_PARAM_NAME);

    static final String MODULE_NAME = "open-wake-analysis-parameters";

    private int threadCount = THREAD_COUNT_DEFAULT_VALUE;

    private double crossCheckTolerance = CROSS_CHECK_TOLERANCE_DEFAULT_VALUE;

    private int scanPointCount = SCAN_POINT_COUNT_DEFAULT_VALUE;

    public int getThreadCount() {
        return threadCount;
    }

    public WakeAnalysisParameters setThreadCount(int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Invalid thread count value: " + threadCount);
        }
        this.threadCount = threadCount;
        return this;
    }

    /**
     * Maximum relative difference accepted between the wake and impedance based factors at the simulated
     * bunch length before a warning is issued.
     */
    public double getCrossCheckTolerance() {
        return crossCheckTolerance;
    }

    public WakeAnalysisParameters setCrossCheckTolerance(double crossCheckTolerance) {
        if (!(crossCheckTolerance > 0)) {
            throw new IllegalArgumentException("Invalid cross check tolerance value: " + crossCheckTolerance);
        }
        this.crossCheckTolerance = crossCheckTolerance;
        return this;
    }

    public int getScanPointCount() {
        return scanPointCount;
    }

    public WakeAnalysisParameters setScanPointCount(int scanPointCount) {
        if (scanPointCount < 2) {
            throw new IllegalArgumentException("Invalid scan point count value: " + scanPointCount);
        }
        this.scanPointCount = scanPointCount;
        return this;
    }

    public static WakeAnalysisParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static WakeAnalysisParameters load(PlatformConfig platformConfig) {
        WakeAnalysisParameters parameters = new WakeAnalysisParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
                .ifPresent(config -> parameters
                        .setThreadCount(config.getIntProperty(THREAD_COUNT_PARAM_NAME, THREAD_COUNT_DEFAULT_VALUE))
                        .setCrossCheckTolerance(config.getDoubleProperty(CROSS_CHECK_TOLERANCE_PARAM_NAME, CROSS_CHECK_TOLERANCE_DEFAULT_VALUE))
                        .setScanPointCount(config.getIntProperty(SCAN_POINT_COUNT_PARAM_NAME, SCAN_POINT_COUNT_DEFAULT_VALUE)));
        return parameters;
    }

    public static WakeAnalysisParameters load(Map<String, String> properties) {
        return new WakeAnalysisParameters()
                .update(properties);
    }

    public WakeAnalysisParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(THREAD_COUNT_PARAM_NAME))
                .ifPresent(value -> this.setThreadCount(Integer.parseInt(value)));
        Optional.ofNullable(properties.get(CROSS_CHECK_TOLERANCE_PARAM_NAME))
                .ifPresent(value -> this.setCrossCheckTolerance(Double.parseDouble(value)));
        Optional.ofNullable(properties.get(SCAN_POINT_COUNT_PARAM_NAME))
                .ifPresent(value -> this.setScanPointCount(Integer.parseInt(value)));
        return this;
    }
}
