/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ConversionRecord(String converter,
                               String hub,
                               String technology,
                               double capacity,
                               double capitalCost,
                               double fixedCost,
                               double variableCost,
                               double electricityCost,
                               double utilization,
                               double subsidy) implements TableRow {

    public static final List<String> COLUMNS = List.of("converter", "hub", "technology", "conv_capacity", "conv_cost_capital",
            "conv_cost_fixed", "conv_cost_variable", "conv_e_price", "conv_utilization", "fuelStation_cost_capital_subsidy");

    @Override
    public String getId() {
        return converter;
    }

    @Override
    public String getHub() {
        return hub;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("converter", converter);
        map.put("hub", hub);
        map.put("technology", technology);
        map.put("conv_capacity", capacity);
        map.put("conv_cost_capital", capitalCost);
        map.put("conv_cost_fixed", fixedCost);
        map.put("conv_cost_variable", variableCost);
        map.put("conv_e_price", electricityCost);
        map.put("conv_utilization", utilization);
        map.put("fuelStation_cost_capital_subsidy", subsidy);
        return map;
    }
}
