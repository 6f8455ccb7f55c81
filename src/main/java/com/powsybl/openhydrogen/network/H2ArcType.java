/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

public enum H2ArcType {
    INTRA_HUB, // hub center to pipeline terminal
    INTRA_HUB_REVERSE, // pipeline terminal to hub center
    PURIFICATION, // low purity center to high purity center
    HUB_TO_DEPOT, // hub center to truck depot, carries the truck fleet investment
    PIPELINE,
    TRUCK_ROUTE,
    FLOW_TO_DEMAND,
    FLOW_FROM_PRODUCER,
    FLOW_TO_DEMAND_SECTOR,
    FLOW_THROUGH_CONVERTER,
    PRICE_PROBE_LINK;

    /**
     * Distribution arcs have capacity and cost. Price probe links only carry the synthetic probe demand.
     */
    public boolean isDistribution() {
        return this != PRICE_PROBE_LINK;
    }
}
