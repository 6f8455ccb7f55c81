/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

public abstract class AbstractAttributeBag {

    protected Map<H2Attribute, Double> attributes;

    public double getAttribute(H2Attribute attribute) {
        Objects.requireNonNull(attribute);
        if (attributes == null) {
            return 0;
        }
        return attributes.getOrDefault(attribute, 0.0);
    }

    public boolean hasAttribute(H2Attribute attribute) {
        Objects.requireNonNull(attribute);
        return attributes != null && attributes.containsKey(attribute);
    }

    public void setAttribute(H2Attribute attribute, double value) {
        Objects.requireNonNull(attribute);
        checkModifiable();
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Attribute " + attribute + " cannot be NaN");
        }
        if (attributes == null) {
            attributes = new EnumMap<>(H2Attribute.class);
        }
        attributes.put(attribute, value);
    }

    public void copyAttributesFrom(AbstractAttributeBag other) {
        Objects.requireNonNull(other);
        if (other.attributes != null) {
            other.attributes.forEach(this::setAttribute);
        }
    }

    public Map<H2Attribute, Double> getAttributes() {
        return attributes == null ? Collections.emptyMap() : Collections.unmodifiableMap(attributes);
    }

    protected void checkModifiable() {
        // modifiable by default
    }
}
