/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import java.util.Objects;

public class ConverterNode extends H2Node {

    private final String technology;

    private final ConverterKind kind;

    public ConverterNode(H2Network network, String hub, String id, String technology) {
        super(network, hub, NodeClass.of(H2NodeType.CONVERTER, technology), id);
        this.technology = Objects.requireNonNull(technology);
        this.kind = ConverterKind.fromTechnologyName(technology);
    }

    public String getTechnology() {
        return technology;
    }

    public ConverterKind getKind() {
        return kind;
    }

    public boolean isFuelDispenser() {
        return kind == ConverterKind.FUEL_DISPENSER;
    }
}
