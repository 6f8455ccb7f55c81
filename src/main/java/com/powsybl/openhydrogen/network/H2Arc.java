/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import java.util.Objects;
import java.util.Optional;

/**
 * A directed arc between two nodes of the same network.
 */
public class H2Arc extends AbstractH2Element {

    private final H2Node start;

    private final H2Node end;

    private final H2ArcType type;

    private final String technology;

    private final boolean existing;

    public H2Arc(H2Network network, H2Node start, H2Node end, H2ArcType type, String technology, boolean existing) {
        super(network);
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
        this.type = Objects.requireNonNull(type);
        this.technology = technology;
        this.existing = existing;
    }

    public H2Arc(H2Network network, H2Node start, H2Node end, H2ArcType type) {
        this(network, start, end, type, null, false);
    }

    public static String createId(H2Node start, H2Node end) {
        return start.getId() + " -> " + end.getId();
    }

    @Override
    public String getId() {
        return createId(start, end);
    }

    @Override
    public ElementType getElementType() {
        return ElementType.ARC;
    }

    public H2Node getStart() {
        return start;
    }

    public H2Node getEnd() {
        return end;
    }

    public H2ArcType getType() {
        return type;
    }

    public Optional<String> getTechnology() {
        return Optional.ofNullable(technology);
    }

    public boolean isExisting() {
        return existing;
    }
}
