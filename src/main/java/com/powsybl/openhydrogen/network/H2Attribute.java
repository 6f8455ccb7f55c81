/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

/**
 * Technology specific numeric attributes of nodes and arcs. An absent attribute reads as 0.
 */
public enum H2Attribute {
    CAPITAL_COST, // USD per unit of capacity
    FIXED_COST, // USD per unit of capacity per day
    VARIABLE_COST, // USD per ton
    ELECTRICITY_COST, // USD per ton
    NATURAL_GAS_COST, // USD per ton
    FLOW_LIMIT, // ton per day per unit of capacity
    UTILIZATION,
    MIN_SIZE,
    MAX_SIZE,
    CAPACITY, // recorded capacity of existing producers, ton per day
    CO2_EMISSIONS_RATE, // ton CO2 per ton H2
    CCS_CAPTURE_RATE,
    CHEC_PER_TON,
    H2_TAX_CREDIT, // USD per ton
    BREAKEVEN_PRICE, // USD per ton
    SIZE, // ton per day
    CARBON_SENSITIVE,
    AVOIDED_EMISSIONS, // ton CO2 per ton H2
    LENGTH // km
}
