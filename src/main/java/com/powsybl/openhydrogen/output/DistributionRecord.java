/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import com.powsybl.openhydrogen.network.H2ArcType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DistributionRecord(String arcStart,
                                 String arcEnd,
                                 String startHub,
                                 String endHub,
                                 H2ArcType arcType,
                                 String technology,
                                 double capacity,
                                 double capitalCost,
                                 double fixedCost,
                                 double variableCost,
                                 double flowLimit,
                                 double flow) implements TableRow {

    public static final List<String> COLUMNS = List.of("arc_start", "arc_end", "start_hub", "end_hub", "arc_type",
            "technology", "dist_capacity", "dist_cost_capital", "dist_cost_fixed", "dist_cost_variable", "dist_flowLimit", "dist_h");

    @Override
    public String getId() {
        return arcStart + " -> " + arcEnd;
    }

    @Override
    public String getHub() {
        return startHub;
    }

    public boolean isLocal() {
        return startHub.equals(endHub);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("arc_start", arcStart);
        map.put("arc_end", arcEnd);
        map.put("start_hub", startHub);
        map.put("end_hub", endHub);
        map.put("arc_type", arcType.name());
        map.put("technology", technology != null ? technology : "");
        map.put("dist_capacity", capacity);
        map.put("dist_cost_capital", capitalCost);
        map.put("dist_cost_fixed", fixedCost);
        map.put("dist_cost_variable", variableCost);
        map.put("dist_flowLimit", flowLimit);
        map.put("dist_h", flow);
        return map;
    }
}
