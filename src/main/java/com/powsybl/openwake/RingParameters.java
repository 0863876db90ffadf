/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.openwake.util.PhysicalConstants;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Storage ring description used to scale the wake analysis results. Immutable, built once per analysis.
 *
 * @author Open Wake Impedance developers
 */
public final class RingParameters {

    public static final String CIRCUMFERENCE_PARAM_NAME = "circumference";
    public static final double CIRCUMFERENCE_DEFAULT_VALUE = 518.396;
    public static final String BUNCH_LENGTH_PARAM_NAME = "bunchLength";
    public static final double BUNCH_LENGTH_DEFAULT_VALUE = 2.5e-3;
    public static final String MAX_BUNCH_LENGTH_PARAM_NAME = "maxBunchLength";
    public static final double MAX_BUNCH_LENGTH_DEFAULT_VALUE = 15e-3;
    public static final String AVERAGE_CURRENT_PARAM_NAME = "averageCurrent";
    public static final double AVERAGE_CURRENT_DEFAULT_VALUE = 500e-3;
    public static final String HARMONIC_NUMBER_PARAM_NAME = "harmonicNumber";
    public static final int HARMONIC_NUMBER_DEFAULT_VALUE = 864;

    static final String MODULE_NAME = "open-wake-ring-parameters";

    private final double circumference;

    private final double bunchLength;

    private final double maxBunchLength;

    private final double averageCurrent;

    private final int harmonicNumber;

    private RingParameters(Builder builder) {
        if (!(builder.circumference > 0)) {
            throw new WakeConfigurationException("Invalid ring circumference: " + builder.circumference);
        }
        if (!(builder.bunchLength > 0)) {
            throw new WakeConfigurationException("Invalid nominal bunch length: " + builder.bunchLength);
        }
        if (!(builder.maxBunchLength > builder.bunchLength)) {
            throw new WakeConfigurationException("Maximum bunch length (" + builder.maxBunchLength
                    + ") should be greater than nominal bunch length (" + builder.bunchLength + ")");
        }
        if (builder.averageCurrent < 0) {
            throw new WakeConfigurationException("Invalid average current: " + builder.averageCurrent);
        }
        if (builder.harmonicNumber <= 0) {
            throw new WakeConfigurationException("Invalid harmonic number: " + builder.harmonicNumber);
        }
        this.circumference = builder.circumference;
        this.bunchLength = builder.bunchLength;
        this.maxBunchLength = builder.maxBunchLength;
        this.averageCurrent = builder.averageCurrent;
        this.harmonicNumber = builder.harmonicNumber;
    }

    /**
     * Ring circumference [m].
     */
    public double getCircumference() {
        return circumference;
    }

    /**
     * Revolution angular frequency [rad/s].
     */
    public double getRevolutionAngularFrequency() {
        return PhysicalConstants.TWO_PI * PhysicalConstants.C / circumference;
    }

    /**
     * Revolution frequency [Hz].
     */
    public double getRevolutionFrequency() {
        return getRevolutionAngularFrequency() / PhysicalConstants.TWO_PI;
    }

    /**
     * Revolution period [s].
     */
    public double getRevolutionPeriod() {
        return PhysicalConstants.TWO_PI / getRevolutionAngularFrequency();
    }

    /**
     * Nominal RMS bunch length [m].
     */
    public double getBunchLength() {
        return bunchLength;
    }

    /**
     * Largest bunch length of interest [m], upper bound of the bunch length scan.
     */
    public double getMaxBunchLength() {
        return maxBunchLength;
    }

    /**
     * Average beam current [A].
     */
    public double getAverageCurrent() {
        return averageCurrent;
    }

    public int getHarmonicNumber() {
        return harmonicNumber;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RingParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static RingParameters load(PlatformConfig platformConfig) {
        Builder builder = builder();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
                .ifPresent(config -> builder
                        .setCircumference(config.getDoubleProperty(CIRCUMFERENCE_PARAM_NAME, CIRCUMFERENCE_DEFAULT_VALUE))
                        .setBunchLength(config.getDoubleProperty(BUNCH_LENGTH_PARAM_NAME, BUNCH_LENGTH_DEFAULT_VALUE))
                        .setMaxBunchLength(config.getDoubleProperty(MAX_BUNCH_LENGTH_PARAM_NAME, MAX_BUNCH_LENGTH_DEFAULT_VALUE))
                        .setAverageCurrent(config.getDoubleProperty(AVERAGE_CURRENT_PARAM_NAME, AVERAGE_CURRENT_DEFAULT_VALUE))
                        .setHarmonicNumber(config.getIntProperty(HARMONIC_NUMBER_PARAM_NAME, HARMONIC_NUMBER_DEFAULT_VALUE)));
        return builder.build();
    }

    public static RingParameters load(Map<String, String> properties) {
        return builder().update(properties).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RingParameters other)) {
            return false;
        }
        return Double.compare(circumference, other.circumference) == 0
                && Double.compare(bunchLength, other.bunchLength) == 0
                && Double.compare(maxBunchLength, other.maxBunchLength) == 0
                && Double.compare(averageCurrent, other.averageCurrent) == 0
                && harmonicNumber == other.harmonicNumber;
    }

    @Override
    public int hashCode() {
        return Objects.hash(circumference, bunchLength, maxBunchLength, averageCurrent, harmonicNumber);
    }

    @Override
    public String toString() {
        return "RingParameters(circumference=" + circumference
                + ", bunchLength=" + bunchLength
                + ", maxBunchLength=" + maxBunchLength
                + ", averageCurrent=" + averageCurrent
                + ", harmonicNumber=" + harmonicNumber
                + ")";
    }

    public static final class Builder {

        private double circumference = CIRCUMFERENCE_DEFAULT_VALUE;

        private double bunchLength = BUNCH_LENGTH_DEFAULT_VALUE;

        private double maxBunchLength = MAX_BUNCH_LENGTH_DEFAULT_VALUE;

        private double averageCurrent = AVERAGE_CURRENT_DEFAULT_VALUE;

        private int harmonicNumber = HARMONIC_NUMBER_DEFAULT_VALUE;

        private Builder() {
        }

        public Builder setCircumference(double circumference) {
            this.circumference = circumference;
            return this;
        }

        public Builder setBunchLength(double bunchLength) {
            this.bunchLength = bunchLength;
            return this;
        }

        public Builder setMaxBunchLength(double maxBunchLength) {
            this.maxBunchLength = maxBunchLength;
            return this;
        }

        public Builder setAverageCurrent(double averageCurrent) {
            this.averageCurrent = averageCurrent;
            return this;
        }

        public Builder setHarmonicNumber(int harmonicNumber) {
            this.harmonicNumber = harmonicNumber;
            return this;
        }

        public Builder update(Map<String, String> properties) {
            Optional.ofNullable(properties.get(CIRCUMFERENCE_PARAM_NAME))
                    .ifPresent(value -> setCircumference(Double.parseDouble(value)));
            Optional.ofNullable(properties.get(BUNCH_LENGTH_PARAM_NAME))
                    .ifPresent(value -> setBunchLength(Double.parseDouble(value)));
            Optional.ofNullable(properties.get(MAX_BUNCH_LENGTH_PARAM_NAME))
                    .ifPresent(value -> setMaxBunchLength(Double.parseDouble(value)));
            Optional.ofNullable(properties.get(AVERAGE_CURRENT_PARAM_NAME))
                    .ifPresent(value -> setAverageCurrent(Double.parseDouble(value)));
            Optional.ofNullable(properties.get(HARMONIC_NUMBER_PARAM_NAME))
                    .ifPresent(value -> setHarmonicNumber(Integer.parseInt(value)));
            return this;
        }

        public RingParameters build() {
            return new RingParameters(this);
        }
    }
}
