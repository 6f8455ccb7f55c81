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
 * @param sector demand sector, or the demand category for a price probe
 * @param price breakeven price in USD per ton
 */
public record ConsumptionRecord(String consumer,
                                String hub,
                                String sector,
                                boolean priceProbe,
                                boolean carbonSensitive,
                                double consumption,
                                double checs,
                                double price,
                                double size) implements TableRow {

    public static final List<String> COLUMNS = List.of("consumer", "hub", "sector", "price_probe", "cons_carbonSensitive",
            "cons_h", "cons_checs", "cons_price", "cons_size");

    @Override
    public String getId() {
        return consumer;
    }

    @Override
    public String getHub() {
        return hub;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("consumer", consumer);
        map.put("hub", hub);
        map.put("sector", sector);
        map.put("price_probe", priceProbe);
        map.put("cons_carbonSensitive", carbonSensitive ? 1 : 0);
        map.put("cons_h", consumption);
        map.put("cons_checs", checs);
        map.put("cons_price", price);
        map.put("cons_size", size);
        return map;
    }
}
