/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import java.util.Objects;

/**
 * A converter rule: every arc from a node of class {@code upstreamClass} to a node of class
 * {@code downstreamClass} is routed through a converter of this technology.
 */
public class ConversionTechnology {

    /**
     * Class key disabling a rule.
     */
    public static final String PASS = "pass";

    private final String name;

    private final String upstreamClass;

    private final String downstreamClass;

    private double capitalCost; // USD per ton/day

    private double fixedCost;

    private double variableCost; // USD per ton

    private double electricityCost; // USD per ton at base electricity price

    private double utilization = 1;

    public ConversionTechnology(String name, String upstreamClass, String downstreamClass) {
        this.name = Objects.requireNonNull(name);
        this.upstreamClass = Objects.requireNonNull(upstreamClass);
        this.downstreamClass = Objects.requireNonNull(downstreamClass);
    }

    public String getName() {
        return name;
    }

    public String getUpstreamClass() {
        return upstreamClass;
    }

    public String getDownstreamClass() {
        return downstreamClass;
    }

    public boolean isPassed() {
        return PASS.equals(upstreamClass) || PASS.equals(downstreamClass);
    }

    public double getCapitalCost() {
        return capitalCost;
    }

    public ConversionTechnology setCapitalCost(double capitalCost) {
        this.capitalCost = capitalCost;
        return this;
    }

    public double getFixedCost() {
        return fixedCost;
    }

    public ConversionTechnology setFixedCost(double fixedCost) {
        this.fixedCost = fixedCost;
        return this;
    }

    public double getVariableCost() {
        return variableCost;
    }

    public ConversionTechnology setVariableCost(double variableCost) {
        this.variableCost = variableCost;
        return this;
    }

    public double getElectricityCost() {
        return electricityCost;
    }

    public ConversionTechnology setElectricityCost(double electricityCost) {
        this.electricityCost = electricityCost;
        return this;
    }

    public double getUtilization() {
        return utilization;
    }

    public ConversionTechnology setUtilization(double utilization) {
        if (utilization <= 0 || utilization > 1) {
            throw new IllegalArgumentException("Utilization of converter '" + name + "' must be in ]0, 1]: " + utilization);
        }
        this.utilization = utilization;
        return this;
    }

    @Override
    public String toString() {
        return "ConversionTechnology(name=" + name + ", " + upstreamClass + " -> " + downstreamClass + ")";
    }
}
