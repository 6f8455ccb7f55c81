/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import com.powsybl.openhydrogen.network.ElementType;

public enum H2ConstraintType implements Quantity {
    FLOW_BALANCE("flowBalance", ElementType.NODE),
    FLOW_CAPACITY("flowCapacity", ElementType.ARC),
    CONVERTER_CAPACITY("flowCapacityConverters", ElementType.NODE),
    PRODUCTION_CAPACITY("productionCapacity", ElementType.NODE),
    EXISTING_PIPELINE("existingPipeline", ElementType.ARC),
    EXISTING_PRODUCER_EXISTS("existingProducerExists", ElementType.NODE),
    EXISTING_PRODUCER_CAPACITY("existingProducerCapacity", ElementType.NODE),
    MIN_PRODUCTION("minProduction", ElementType.NODE),
    MAX_PRODUCTION("maxProduction", ElementType.NODE),
    TRUCK_CONSISTENCY("truckConsistency", ElementType.NODE),
    ONLY_ONE_CCS("onlyOneCCS", ElementType.NODE),
    CCS_ELIGIBILITY("ccsEligibility", ElementType.NODE),
    CCS_CAPTURE("ccsCapture", ElementType.NODE),
    CCS_THROUGHPUT_IF_BUILT("ccsThroughputIfBuilt", ElementType.NODE),
    CCS_THROUGHPUT_MAX_OUTPUT("ccsThroughputMaxOutput", ElementType.NODE),
    CCS_MUST_BUILD_ALL("ccsMustBuildAll", ElementType.NODE),
    CCS_CHECS("ccsChecs", ElementType.NODE),
    PRODUCTION_CHECS("productionChecs", ElementType.NODE),
    CONSUMER_CHECS("consumerChecs", ElementType.NODE),
    CHEC_BALANCE("checBalance", ElementType.NETWORK),
    CONSUMER_SIZE("consumerSize", ElementType.NODE),
    FUEL_STATION_SUBSIDY("fuelStationSubsidy", ElementType.NODE),
    SUBSIDY_BUDGET("subsidyBudget", ElementType.NETWORK);

    private final String symbol;

    private final ElementType elementType;

    H2ConstraintType(String symbol, ElementType elementType) {
        this.symbol = symbol;
        this.elementType = elementType;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public ElementType getElementType() {
        return elementType;
    }
}
