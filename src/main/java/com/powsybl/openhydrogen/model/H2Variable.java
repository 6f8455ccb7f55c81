/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import java.util.Objects;

/**
 * A decision variable attached to a network element, optionally qualified (e.g. by a CCS technology).
 */
public class H2Variable {

    private final H2VariableType type;

    private final String elementId;

    private final String qualifier;

    private final int num;

    H2Variable(H2VariableType type, String elementId, String qualifier, int num) {
        this.type = Objects.requireNonNull(type);
        this.elementId = Objects.requireNonNull(elementId);
        this.qualifier = qualifier;
        this.num = num;
    }

    public H2VariableType getType() {
        return type;
    }

    public String getElementId() {
        return elementId;
    }

    public String getQualifier() {
        return qualifier;
    }

    /**
     * Column index of the variable in its model.
     */
    public int getNum() {
        return num;
    }

    public double getLowerBound() {
        return 0;
    }

    public double getUpperBound() {
        return type.getDomain() == VariableDomain.BINARY ? 1 : Double.POSITIVE_INFINITY;
    }

    public boolean isIntegral() {
        return type.getDomain() != VariableDomain.CONTINUOUS;
    }

    public String getName() {
        return createName(type, elementId, qualifier);
    }

    static String createName(H2VariableType type, String elementId, String qualifier) {
        return type.getSymbol() + "[" + elementId + (qualifier != null ? "," + qualifier : "") + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof H2Variable other) {
            return type == other.type && elementId.equals(other.elementId) && Objects.equals(qualifier, other.qualifier);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, elementId, qualifier);
    }

    @Override
    public String toString() {
        return getName();
    }
}
