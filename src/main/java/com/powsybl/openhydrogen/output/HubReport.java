/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output tables restricted to one hub, rows keyed by identifier without the hub prefix. Distribution is
 * split between arcs inside the hub, arcs leaving it and arcs entering it.
 */
public record HubReport(String hub,
                        Map<String, Map<String, Object>> production,
                        Map<String, Map<String, Object>> conversion,
                        Map<String, Map<String, Object>> consumption,
                        Map<String, Map<String, Object>> localDistribution,
                        Map<String, Map<String, Object>> outgoingDistribution,
                        Map<String, Map<String, Object>> incomingDistribution) {

    public Map<String, Object> toMap() {
        Map<String, Object> distribution = new LinkedHashMap<>();
        distribution.put("local", localDistribution);
        distribution.put("outgoing", outgoingDistribution);
        distribution.put("incoming", incomingDistribution);
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("production", production);
        map.put("conversion", conversion);
        map.put("consumption", consumption);
        map.put("distribution", distribution);
        return map;
    }
}
