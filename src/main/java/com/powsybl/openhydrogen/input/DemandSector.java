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
 * A demand sector. Hub demand for the sector is split between a carbon indifferent and a
 * carbon sensitive consumer.
 */
public class DemandSector {

    /**
     * Ton of CO2 avoided per ton of H2 for each g/MJ of carbon intensity.
     */
    public static final double CARBON_G_MJ_TO_T_T_H2 = 120000.0 / 1e6;

    private final String name;

    private final DemandCategory category;

    private double carbonSensitiveFraction;

    private double breakevenPrice; // USD per ton

    private double breakevenCarbonIntensity; // g CO2 per MJ

    public DemandSector(String name, DemandCategory category) {
        this.name = Objects.requireNonNull(name);
        this.category = Objects.requireNonNull(category);
    }

    public String getName() {
        return name;
    }

    public DemandCategory getCategory() {
        return category;
    }

    public double getCarbonSensitiveFraction() {
        return carbonSensitiveFraction;
    }

    public DemandSector setCarbonSensitiveFraction(double carbonSensitiveFraction) {
        if (carbonSensitiveFraction < 0 || carbonSensitiveFraction > 1) {
            throw new IllegalArgumentException("Carbon sensitive fraction of sector '" + name + "' must be between 0 and 1: "
                    + carbonSensitiveFraction);
        }
        this.carbonSensitiveFraction = carbonSensitiveFraction;
        return this;
    }

    public double getBreakevenPrice() {
        return breakevenPrice;
    }

    public DemandSector setBreakevenPrice(double breakevenPrice) {
        this.breakevenPrice = breakevenPrice;
        return this;
    }

    public double getBreakevenCarbonIntensity() {
        return breakevenCarbonIntensity;
    }

    public DemandSector setBreakevenCarbonIntensity(double breakevenCarbonIntensity) {
        this.breakevenCarbonIntensity = breakevenCarbonIntensity;
        return this;
    }

    public double getAvoidedEmissions() {
        return breakevenCarbonIntensity * CARBON_G_MJ_TO_T_T_H2;
    }

    @Override
    public String toString() {
        return "DemandSector(name=" + name + ", category=" + category + ")";
    }
}
