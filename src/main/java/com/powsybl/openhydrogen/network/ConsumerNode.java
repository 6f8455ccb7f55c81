/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import com.powsybl.openhydrogen.input.DemandCategory;

import java.util.Objects;

/**
 * A consumer: either a demand sector share of a hub or a synthetic price probe.
 */
public class ConsumerNode extends H2Node {

    private final DemandCategory category;

    private final boolean carbonSensitive;

    public ConsumerNode(H2Network network, String hub, String id, NodeClass nodeClass, DemandCategory category,
                        boolean carbonSensitive) {
        super(network, hub, nodeClass, id);
        if (!nodeClass.type().isConsumer()) {
            throw new IllegalArgumentException("Not a consumer class: " + nodeClass);
        }
        this.category = Objects.requireNonNull(category);
        this.carbonSensitive = carbonSensitive;
    }

    public DemandCategory getCategory() {
        return category;
    }

    public boolean isCarbonSensitive() {
        return carbonSensitive;
    }

    public boolean isPriceProbe() {
        return getType() == H2NodeType.PRICE_PROBE;
    }

    /**
     * Sector name, {@code null} for price probes.
     */
    public String getSector() {
        return isPriceProbe() ? null : getNodeClass().qualifier();
    }
}
