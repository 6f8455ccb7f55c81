/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import java.util.Objects;

/**
 * Class tag of a node: a type and, depending on the type, a qualifier (purity, technology, sector...).
 * The class key is the name converter rules refer to, e.g. {@code center_lowPurity} or {@code dist_truckLiquid}.
 */
public record NodeClass(H2NodeType type, String qualifier) {

    public NodeClass {
        Objects.requireNonNull(type);
        if (qualifier == null && type != H2NodeType.PRODUCER && type != H2NodeType.PRICE_PROBE) {
            throw new IllegalArgumentException("Node class " + type + " requires a qualifier");
        }
    }

    public static NodeClass of(H2NodeType type) {
        return new NodeClass(type, null);
    }

    public static NodeClass of(H2NodeType type, String qualifier) {
        return new NodeClass(type, Objects.requireNonNull(qualifier));
    }

    public String key() {
        return switch (type) {
            case PRODUCER -> "producer";
            case CONVERTER -> "converter_" + qualifier;
            case HUB_CENTER -> "center_" + qualifier;
            case PIPELINE_TERMINAL, TRUCK_DEPOT -> "dist_" + qualifier;
            case DEMAND_HUB -> "demand_" + qualifier;
            case DEMAND_SECTOR -> "demandSector_" + qualifier;
            case PRICE_PROBE -> "price";
        };
    }

    @Override
    public String toString() {
        return key();
    }
}
