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
 * A vertex of the hydrogen flow network, owned by a hub.
 */
public class H2Node extends AbstractH2Element {

    private final String id;

    private final String hub;

    private final NodeClass nodeClass;

    public H2Node(H2Network network, String hub, NodeClass nodeClass, String id) {
        super(network);
        this.hub = Objects.requireNonNull(hub);
        this.nodeClass = Objects.requireNonNull(nodeClass);
        this.id = Objects.requireNonNull(id);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public ElementType getElementType() {
        return ElementType.NODE;
    }

    public String getHub() {
        return hub;
    }

    public NodeClass getNodeClass() {
        return nodeClass;
    }

    public H2NodeType getType() {
        return nodeClass.type();
    }

    /**
     * Identifier without the owning hub prefix.
     */
    public String getLocalId() {
        String prefix = hub + "_";
        return id.startsWith(prefix) ? id.substring(prefix.length()) : id;
    }
}
