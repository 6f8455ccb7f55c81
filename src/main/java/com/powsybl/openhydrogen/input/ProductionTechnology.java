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
 * Candidate new production technology. Costs are given for a hub with unit regional multipliers.
 */
public class ProductionTechnology {

    /**
     * Default maximum build size in ton per day, far above any real plant.
     */
    public static final double MAX_SIZE_DEFAULT_VALUE = 1e6;

    private final String name;

    private final ProductionKind kind;

    private final Purity purity;

    private double capitalCost; // USD per ton/day of capacity

    private double fixedCost; // USD per ton/day of capacity per day

    private double variableCost; // USD per ton

    private double electricityCost; // USD per ton at base electricity price

    private double naturalGasCost; // USD per ton at base natural gas price

    private double utilization = 1;

    private double minSize;

    private double maxSize = MAX_SIZE_DEFAULT_VALUE;

    private double ccsCaptureRate;

    private double gridIntensity; // ton CO2 per ton H2

    private double h2TaxCredit; // USD per ton

    public ProductionTechnology(String name, ProductionKind kind, Purity purity) {
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.purity = Objects.requireNonNull(purity);
    }

    public String getName() {
        return name;
    }

    public ProductionKind getKind() {
        return kind;
    }

    public Purity getPurity() {
        return purity;
    }

    public double getCapitalCost() {
        return capitalCost;
    }

    public ProductionTechnology setCapitalCost(double capitalCost) {
        this.capitalCost = capitalCost;
        return this;
    }

    public double getFixedCost() {
        return fixedCost;
    }

    public ProductionTechnology setFixedCost(double fixedCost) {
        this.fixedCost = fixedCost;
        return this;
    }

    public double getVariableCost() {
        return variableCost;
    }

    public ProductionTechnology setVariableCost(double variableCost) {
        this.variableCost = variableCost;
        return this;
    }

    public double getElectricityCost() {
        return electricityCost;
    }

    public ProductionTechnology setElectricityCost(double electricityCost) {
        this.electricityCost = electricityCost;
        return this;
    }

    public double getNaturalGasCost() {
        return naturalGasCost;
    }

    public ProductionTechnology setNaturalGasCost(double naturalGasCost) {
        this.naturalGasCost = naturalGasCost;
        return this;
    }

    public double getUtilization() {
        return utilization;
    }

    public ProductionTechnology setUtilization(double utilization) {
        if (utilization < 0 || utilization > 1) {
            throw new IllegalArgumentException("Utilization of '" + name + "' must be between 0 and 1: " + utilization);
        }
        this.utilization = utilization;
        return this;
    }

    public double getMinSize() {
        return minSize;
    }

    public ProductionTechnology setMinSize(double minSize) {
        this.minSize = minSize;
        return this;
    }

    public double getMaxSize() {
        return maxSize;
    }

    public ProductionTechnology setMaxSize(double maxSize) {
        this.maxSize = maxSize;
        return this;
    }

    public double getCcsCaptureRate() {
        return ccsCaptureRate;
    }

    public ProductionTechnology setCcsCaptureRate(double ccsCaptureRate) {
        if (ccsCaptureRate < 0 || ccsCaptureRate > 1) {
            throw new IllegalArgumentException("CCS capture rate of '" + name + "' must be between 0 and 1: " + ccsCaptureRate);
        }
        this.ccsCaptureRate = ccsCaptureRate;
        return this;
    }

    public double getGridIntensity() {
        return gridIntensity;
    }

    public ProductionTechnology setGridIntensity(double gridIntensity) {
        this.gridIntensity = gridIntensity;
        return this;
    }

    public double getH2TaxCredit() {
        return h2TaxCredit;
    }

    public ProductionTechnology setH2TaxCredit(double h2TaxCredit) {
        this.h2TaxCredit = h2TaxCredit;
        return this;
    }

    @Override
    public String toString() {
        return "ProductionTechnology(name=" + name + ", kind=" + kind + ", purity=" + purity + ")";
    }
}
