/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import com.powsybl.openhydrogen.input.ProductionKind;
import com.powsybl.openhydrogen.input.Purity;

import java.util.*;

public class ProducerNode extends H2Node {

    private final String technology;

    private final ProductionKind kind;

    private final Purity purity;

    private final boolean existing;

    private final Set<String> eligibleCcsTechnologies;

    public ProducerNode(H2Network network, String hub, String id, String technology, ProductionKind kind, Purity purity,
                        boolean existing, Set<String> eligibleCcsTechnologies) {
        super(network, hub, NodeClass.of(H2NodeType.PRODUCER), id);
        this.technology = Objects.requireNonNull(technology);
        this.kind = Objects.requireNonNull(kind);
        this.purity = Objects.requireNonNull(purity);
        this.existing = existing;
        this.eligibleCcsTechnologies = Collections.unmodifiableSet(new LinkedHashSet<>(eligibleCcsTechnologies));
    }

    public String getTechnology() {
        return technology;
    }

    public ProductionKind getKind() {
        return kind;
    }

    public Purity getPurity() {
        return purity;
    }

    public boolean isExisting() {
        return existing;
    }

    public boolean isThermal() {
        return kind == ProductionKind.THERMAL;
    }

    public Set<String> getEligibleCcsTechnologies() {
        return eligibleCcsTechnologies;
    }

    public boolean isCcsEligible(String ccsTechnology) {
        return eligibleCcsTechnologies.contains(ccsTechnology);
    }
}
