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
 * A geographic site hosting production, conversion, distribution and demand.
 */
public class Hub {

    private final String id;

    private HubStatus status = HubStatus.REGULAR;

    private double capitalMultiplier = 1;

    private double electricityMultiplier = 1;

    private double naturalGasMultiplier = 1;

    private final Set<String> enabledProductionTechnologies = new LinkedHashSet<>();

    private final Map<String, Double> sectorDemands = new LinkedHashMap<>();

    public Hub(String id) {
        this.id = Objects.requireNonNull(id);
    }

    public String getId() {
        return id;
    }

    public HubStatus getStatus() {
        return status;
    }

    public Hub setStatus(HubStatus status) {
        this.status = Objects.requireNonNull(status);
        return this;
    }

    public double getCapitalMultiplier() {
        return capitalMultiplier;
    }

    public Hub setCapitalMultiplier(double capitalMultiplier) {
        this.capitalMultiplier = checkMultiplier(capitalMultiplier);
        return this;
    }

    public double getElectricityMultiplier() {
        return electricityMultiplier;
    }

    public Hub setElectricityMultiplier(double electricityMultiplier) {
        this.electricityMultiplier = checkMultiplier(electricityMultiplier);
        return this;
    }

    public double getNaturalGasMultiplier() {
        return naturalGasMultiplier;
    }

    public Hub setNaturalGasMultiplier(double naturalGasMultiplier) {
        this.naturalGasMultiplier = checkMultiplier(naturalGasMultiplier);
        return this;
    }

    public Set<String> getEnabledProductionTechnologies() {
        return Collections.unmodifiableSet(enabledProductionTechnologies);
    }

    public boolean isProductionEnabled(String technology) {
        return enabledProductionTechnologies.contains(technology);
    }

    public Hub enableProduction(String technology) {
        enabledProductionTechnologies.add(Objects.requireNonNull(technology));
        return this;
    }

    public Map<String, Double> getSectorDemands() {
        return Collections.unmodifiableMap(sectorDemands);
    }

    /**
     * Demand of a sector in tons per day, 0 if the hub has no demand for it.
     */
    public double getSectorDemand(String sector) {
        return sectorDemands.getOrDefault(sector, 0.0);
    }

    public Hub setSectorDemand(String sector, double tonsPerDay) {
        Objects.requireNonNull(sector);
        if (tonsPerDay < 0) {
            throw new IllegalArgumentException("Negative demand for sector '" + sector + "' at hub '" + id + "'");
        }
        sectorDemands.put(sector, tonsPerDay);
        return this;
    }

    private double checkMultiplier(double multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("Regional multiplier of hub '" + id + "' must be positive: " + multiplier);
        }
        return multiplier;
    }

    @Override
    public String toString() {
        return "Hub(id=" + id + ", status=" + status + ")";
    }
}
