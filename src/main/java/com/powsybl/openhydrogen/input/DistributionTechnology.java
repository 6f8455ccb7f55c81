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
 * A pipeline or truck technology. For pipelines costs are given per kilometer, for trucks per vehicle.
 */
public class DistributionTechnology {

    private final String name;

    private final DistributionKind kind;

    private double capitalCost;

    private double fixedCost;

    private double variableCost; // USD per kilometer ton

    private double flowLimit; // ton per day per unit

    public DistributionTechnology(String name) {
        this(name, DistributionKind.fromTechnologyName(name));
    }

    public DistributionTechnology(String name, DistributionKind kind) {
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
    }

    public String getName() {
        return name;
    }

    public DistributionKind getKind() {
        return kind;
    }

    public double getCapitalCost() {
        return capitalCost;
    }

    public DistributionTechnology setCapitalCost(double capitalCost) {
        this.capitalCost = capitalCost;
        return this;
    }

    public double getFixedCost() {
        return fixedCost;
    }

    public DistributionTechnology setFixedCost(double fixedCost) {
        this.fixedCost = fixedCost;
        return this;
    }

    public double getVariableCost() {
        return variableCost;
    }

    public DistributionTechnology setVariableCost(double variableCost) {
        this.variableCost = variableCost;
        return this;
    }

    public double getFlowLimit() {
        return flowLimit;
    }

    public DistributionTechnology setFlowLimit(double flowLimit) {
        if (flowLimit <= 0) {
            throw new IllegalArgumentException("Flow limit of '" + name + "' must be strictly positive: " + flowLimit);
        }
        this.flowLimit = flowLimit;
        return this;
    }

    @Override
    public String toString() {
        return "DistributionTechnology(name=" + name + ", kind=" + kind + ")";
    }
}
