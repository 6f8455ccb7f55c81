/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import java.util.*;

/**
 * An already built producer. Its technology must be declared in the production technology table.
 */
public class ExistingProducer {

    private final String hub;

    private final String technology;

    private final double capacity; // ton per day

    private double utilization = 1;

    private double variableCost;

    private double electricityCost;

    private double naturalGasCost;

    private double co2EmissionsRate; // ton CO2 per ton H2

    private final Set<String> eligibleCcsTechnologies = new LinkedHashSet<>();

    public ExistingProducer(String hub, String technology, double capacity) {
        this.hub = Objects.requireNonNull(hub);
        this.technology = Objects.requireNonNull(technology);
        if (capacity < 0) {
            throw new IllegalArgumentException("Negative capacity for existing producer '" + technology + "' at hub '" + hub + "'");
        }
        this.capacity = capacity;
    }

    public String getHub() {
        return hub;
    }

    public String getTechnology() {
        return technology;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getUtilization() {
        return utilization;
    }

    public ExistingProducer setUtilization(double utilization) {
        if (utilization < 0 || utilization > 1) {
            throw new IllegalArgumentException("Utilization must be between 0 and 1: " + utilization);
        }
        this.utilization = utilization;
        return this;
    }

    public double getVariableCost() {
        return variableCost;
    }

    public ExistingProducer setVariableCost(double variableCost) {
        this.variableCost = variableCost;
        return this;
    }

    public double getElectricityCost() {
        return electricityCost;
    }

    public ExistingProducer setElectricityCost(double electricityCost) {
        this.electricityCost = electricityCost;
        return this;
    }

    public double getNaturalGasCost() {
        return naturalGasCost;
    }

    public ExistingProducer setNaturalGasCost(double naturalGasCost) {
        this.naturalGasCost = naturalGasCost;
        return this;
    }

    public double getCo2EmissionsRate() {
        return co2EmissionsRate;
    }

    public ExistingProducer setCo2EmissionsRate(double co2EmissionsRate) {
        this.co2EmissionsRate = co2EmissionsRate;
        return this;
    }

    public Set<String> getEligibleCcsTechnologies() {
        return Collections.unmodifiableSet(eligibleCcsTechnologies);
    }

    public boolean isCcsEligible(String ccsTechnology) {
        return eligibleCcsTechnologies.contains(ccsTechnology);
    }

    public ExistingProducer addEligibleCcsTechnology(String ccsTechnology) {
        eligibleCcsTechnologies.add(Objects.requireNonNull(ccsTechnology));
        return this;
    }
}
