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

/**
 * A built producer. Costs and credits are per ton of hydrogen, except the derived columns which are daily totals.
 *
 * @param ccsTechnology the retrofit technology chosen for an existing producer, null if none
 */
public record ProductionRecord(String producer,
                               String hub,
                               String technology,
                               boolean existing,
                               double capacity,
                               double utilization,
                               double output,
                               double capitalCost,
                               double fixedCost,
                               double variableCost,
                               double electricityCost,
                               double naturalGasCost,
                               double h2TaxCredit,
                               double co2EmissionsRate,
                               double ccsCaptureRate,
                               double checPerTon,
                               double checs,
                               String ccsTechnology,
                               double ccsRetrofitVariableCost,
                               double co2Emitted,
                               double carbonTax,
                               double co2Captured,
                               double carbonCaptureTaxCredit,
                               double totalCost) implements TableRow {

    public static final List<String> COLUMNS = List.of("producer", "hub", "technology", "existing", "prod_capacity",
            "prod_utilization", "prod_h", "prod_cost_capital", "prod_cost_fixed", "prod_cost_variable", "prod_e_price",
            "prod_ng_price", "h2_tax_credit", "co2_emissions_rate", "ccs_capture_rate", "chec_per_ton", "prod_checs",
            "ccs_technology", "ccs_retrofit_variable_costs", "co2_emitted", "carbon_tax", "co2_captured",
            "carbon_capture_tax_credit", "total_cost");

    @Override
    public String getId() {
        return producer;
    }

    @Override
    public String getHub() {
        return hub;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("producer", producer);
        map.put("hub", hub);
        map.put("technology", technology);
        map.put("existing", existing);
        map.put("prod_capacity", capacity);
        map.put("prod_utilization", utilization);
        map.put("prod_h", output);
        map.put("prod_cost_capital", capitalCost);
        map.put("prod_cost_fixed", fixedCost);
        map.put("prod_cost_variable", variableCost);
        map.put("prod_e_price", electricityCost);
        map.put("prod_ng_price", naturalGasCost);
        map.put("h2_tax_credit", h2TaxCredit);
        map.put("co2_emissions_rate", co2EmissionsRate);
        map.put("ccs_capture_rate", ccsCaptureRate);
        map.put("chec_per_ton", checPerTon);
        map.put("prod_checs", checs);
        map.put("ccs_technology", ccsTechnology != null ? ccsTechnology : "");
        map.put("ccs_retrofit_variable_costs", ccsRetrofitVariableCost);
        map.put("co2_emitted", co2Emitted);
        map.put("carbon_tax", carbonTax);
        map.put("co2_captured", co2Captured);
        map.put("carbon_capture_tax_credit", carbonCaptureTaxCredit);
        map.put("total_cost", totalCost);
        return map;
    }
}
