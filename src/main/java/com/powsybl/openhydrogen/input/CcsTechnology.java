/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import java.util.Objects;

/**
 * Carbon capture retrofit technology for existing thermal producers.
 */
public class CcsTechnology {

    private final String name;

    private final double captureFraction;

    private double h2TaxCredit; // USD per ton H2

    private double variableCost; // USD per ton CO2

    public CcsTechnology(String name, double captureFraction) {
        this.name = Objects.requireNonNull(name);
        if (captureFraction < 0 || captureFraction > 1) {
            throw new IllegalArgumentException("Capture fraction of '" + name + "' must be between 0 and 1: " + captureFraction);
        }
        this.captureFraction = captureFraction;
    }

    public String getName() {
        return name;
    }

    public double getCaptureFraction() {
        return captureFraction;
    }

    public double getH2TaxCredit() {
        return h2TaxCredit;
    }

    public CcsTechnology setH2TaxCredit(double h2TaxCredit) {
        this.h2TaxCredit = h2TaxCredit;
        return this;
    }

    public double getVariableCost() {
        return variableCost;
    }

    public CcsTechnology setVariableCost(double variableCost) {
        this.variableCost = variableCost;
        return this;
    }

    @Override
    public String toString() {
        return "CcsTechnology(name=" + name + ", captureFraction=" + captureFraction + ")";
    }
}
