/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake;

import com.powsybl.commons.config.PlatformConfig;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes how the wake was simulated and which part of it has to be analysed. Set once before loading.
 *
 * @author Open Wake Impedance developers
 */
public final class SimulationParameters {

    public static final String SOURCE_PARAM_NAME = "source";
    public static final WakeSource SOURCE_DEFAULT_VALUE = WakeSource.ECHO;
    public static final String MODE_PARAM_NAME = "mode";
    public static final WakeMode MODE_DEFAULT_VALUE = WakeMode.LONGITUDINAL;
    public static final String AXIS_PARAM_NAME = "axis";
    public static final TransverseAxis AXIS_DEFAULT_VALUE = TransverseAxis.Y;
    public static final String SYMMETRIC_PARAM_NAME = "symmetric";
    public static final boolean SYMMETRIC_DEFAULT_VALUE = true;
    public static final String BUNCH_LENGTH_PARAM_NAME = "bunchLength";
    public static final double BUNCH_LENGTH_DEFAULT_VALUE = 0.5e-3;
    public static final String CUTOFF_MULTIPLIER_PARAM_NAME = "cutoffMultiplier";
    public static final double CUTOFF_MULTIPLIER_DEFAULT_VALUE = 2;

    static final String MODULE_NAME = "open-wake-simulation-parameters";

    private final WakeSource source;

    private final WakeMode mode;

    private final TransverseAxis axis;

    private final boolean symmetric;

    private final double bunchLength;

    private final double cutoffMultiplier;

    private SimulationParameters(Builder builder) {
        this.source = Objects.requireNonNull(builder.source);
        this.mode = Objects.requireNonNull(builder.mode);
        this.axis = Objects.requireNonNull(builder.axis);
        if (!(builder.bunchLength > 0)) {
            throw new WakeConfigurationException("Invalid simulated bunch length: " + builder.bunchLength);
        }
        if (!(builder.cutoffMultiplier > 0)) {
            throw new WakeConfigurationException("Invalid cutoff multiplier: " + builder.cutoffMultiplier);
        }
        this.symmetric = builder.symmetric;
        this.bunchLength = builder.bunchLength;
        this.cutoffMultiplier = builder.cutoffMultiplier;
    }

    public WakeSource getSource() {
        return source;
    }

    public WakeMode getMode() {
        return mode;
    }

    /**
     * Plane of the transverse wake, ignored for longitudinal analyses.
     */
    public TransverseAxis getAxis() {
        return axis;
    }

    /**
     * True when the simulated structure has a mirror symmetry, so that a single probe run is enough.
     */
    public boolean isSymmetric() {
        return symmetric;
    }

    /**
     * RMS length of the bunch used in the simulation [m].
     */
    public double getBunchLength() {
        return bunchLength;
    }

    /**
     * Impedance is kept up to this multiple of the bunch angular frequency c / sigma.
     */
    public double getCutoffMultiplier() {
        return cutoffMultiplier;
    }

    /**
     * Name of the wake type in exported file names: long, xdip, ydip, xquad or yquad.
     */
    public String getWakeTypeName() {
        return switch (mode) {
            case LONGITUDINAL -> "long";
            case DIPOLE -> axis.getLowerCaseName() + "dip";
            case QUADRUPOLE -> axis.getLowerCaseName() + "quad";
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static SimulationParameters load(PlatformConfig platformConfig) {
        Builder builder = builder();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
                .ifPresent(config -> builder
                        .setSource(config.getEnumProperty(SOURCE_PARAM_NAME, WakeSource.class, SOURCE_DEFAULT_VALUE))
                        .setMode(config.getEnumProperty(MODE_PARAM_NAME, WakeMode.class, MODE_DEFAULT_VALUE))
                        .setAxis(config.getEnumProperty(AXIS_PARAM_NAME, TransverseAxis.class, AXIS_DEFAULT_VALUE))
                        .setSymmetric(config.getBooleanProperty(SYMMETRIC_PARAM_NAME, SYMMETRIC_DEFAULT_VALUE))
                        .setBunchLength(config.getDoubleProperty(BUNCH_LENGTH_PARAM_NAME, BUNCH_LENGTH_DEFAULT_VALUE))
                        .setCutoffMultiplier(config.getDoubleProperty(CUTOFF_MULTIPLIER_PARAM_NAME, CUTOFF_MULTIPLIER_DEFAULT_VALUE)));
        return builder.build();
    }

    public static SimulationParameters load(Map<String, String> properties) {
        return builder().update(properties).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimulationParameters other)) {
            return false;
        }
        return source == other.source
                && mode == other.mode
                && axis == other.axis
                && symmetric == other.symmetric
                && Double.compare(bunchLength, other.bunchLength) == 0
                && Double.compare(cutoffMultiplier, other.cutoffMultiplier) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, mode, axis, symmetric, bunchLength, cutoffMultiplier);
    }

    @Override
    public String toString() {
        return "SimulationParameters(source=" + source
                + ", mode=" + mode
                + ", axis=" + axis
                + ", symmetric=" + symmetric
                + ", bunchLength=" + bunchLength
                + ", cutoffMultiplier=" + cutoffMultiplier
                + ")";
    }

    public static final class Builder {

        private WakeSource source = SOURCE_DEFAULT_VALUE;

        private WakeMode mode = MODE_DEFAULT_VALUE;

        private TransverseAxis axis = AXIS_DEFAULT_VALUE;

        private boolean symmetric = SYMMETRIC_DEFAULT_VALUE;

        private double bunchLength = BUNCH_LENGTH_DEFAULT_VALUE;

        private double cutoffMultiplier = CUTOFF_MULTIPLIER_DEFAULT_VALUE;

        private Builder() {
        }

        public Builder setSource(WakeSource source) {
            this.source = Objects.requireNonNull(source);
            return this;
        }

        public Builder setMode(WakeMode mode) {
            this.mode = Objects.requireNonNull(mode);
            return this;
        }

        public Builder setAxis(TransverseAxis axis) {
            this.axis = Objects.requireNonNull(axis);
            return this;
        }

        public Builder setSymmetric(boolean symmetric) {
            this.symmetric = symmetric;
            return this;
        }

        public Builder setBunchLength(double bunchLength) {
            this.bunchLength = bunchLength;
            return this;
        }

        public Builder setCutoffMultiplier(double cutoffMultiplier) {
            this.cutoffMultiplier = cutoffMultiplier;
            return this;
        }

        public Builder update(Map<String, String> properties) {
            Optional.ofNullable(properties.get(SOURCE_PARAM_NAME))
                    .ifPresent(value -> setSource(WakeSource.valueOf(value.toUpperCase(Locale.ROOT))));
            Optional.ofNullable(properties.get(MODE_PARAM_NAME))
                    .ifPresent(value -> setMode(parseMode(value)));
            Optional.ofNullable(properties.get(AXIS_PARAM_NAME))
                    .ifPresent(value -> setAxis(TransverseAxis.valueOf(value.toUpperCase(Locale.ROOT))));
            Optional.ofNullable(properties.get(SYMMETRIC_PARAM_NAME))
                    .ifPresent(value -> setSymmetric(Boolean.parseBoolean(value)));
            Optional.ofNullable(properties.get(BUNCH_LENGTH_PARAM_NAME))
                    .ifPresent(value -> setBunchLength(Double.parseDouble(value)));
            Optional.ofNullable(properties.get(CUTOFF_MULTIPLIER_PARAM_NAME))
                    .ifPresent(value -> setCutoffMultiplier(Double.parseDouble(value)));
            return this;
        }

        private static WakeMode parseMode(String value) {
            if (value.chars().allMatch(Character::isDigit)) {
                return WakeMode.fromOrder(Integer.parseInt(value));
            }
            return WakeMode.valueOf(value.toUpperCase(Locale.ROOT));
        }

        public SimulationParameters build() {
            return new SimulationParameters(this);
        }
    }
}
