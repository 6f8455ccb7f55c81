/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

/**
 * Terms of the total surplus objective. Benefits are added, costs are subtracted.
 */
public enum ObjectiveTerm {
    CONSUMPTION_UTILITY("consumptionUtility", 1),
    AVOIDED_CARBON_TAX("avoidedCarbonTax", 1),
    CARBON_CAPTURE_CREDIT("carbonCaptureCredit", 1),
    H2_TAX_CREDIT("h2TaxCredit", 1),
    FUEL_STATION_SUBSIDY("fuelStationSubsidy", 1),
    PRODUCTION_VARIABLE("productionVariableCost", -1),
    PRODUCTION_ELECTRICITY("productionElectricityCost", -1),
    PRODUCTION_NATURAL_GAS("productionNaturalGasCost", -1),
    PRODUCTION_CAPITAL("productionCapitalCost", -1),
    CARBON_TAX("carbonTax", -1),
    CCS_VARIABLE("ccsVariableCost", -1),
    DISTRIBUTION_VARIABLE("distributionVariableCost", -1),
    DISTRIBUTION_CAPITAL("distributionCapitalCost", -1),
    CONVERSION_VARIABLE("conversionVariableCost", -1),
    CONVERSION_ELECTRICITY("conversionElectricityCost", -1),
    CONVERSION_CAPITAL("conversionCapitalCost", -1);

    private final String label;

    private final int sign;

    ObjectiveTerm(String label, int sign) {
        this.label = label;
        this.sign = sign;
    }

    public String getLabel() {
        return label;
    }

    public int getSign() {
        return sign;
    }

    public boolean isBenefit() {
        return sign > 0;
    }
}
