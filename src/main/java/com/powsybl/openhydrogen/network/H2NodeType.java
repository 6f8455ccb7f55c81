/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

public enum H2NodeType {
    PRODUCER,
    CONVERTER,
    HUB_CENTER,
    PIPELINE_TERMINAL,
    TRUCK_DEPOT,
    DEMAND_HUB,
    DEMAND_SECTOR,
    PRICE_PROBE;

    public boolean isConsumer() {
        return this == DEMAND_SECTOR || this == PRICE_PROBE;
    }

    public boolean isDistribution() {
        return this == PIPELINE_TERMINAL || this == TRUCK_DEPOT;
    }
}
