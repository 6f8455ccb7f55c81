/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import java.util.Objects;

public class DecomposerParameters {

    public static final double TOLERANCE_DEFAULT_VALUE = 1e-3;
    public static final PriceTieBreak PRICE_TIE_BREAK_DEFAULT_VALUE = PriceTieBreak.MINIMUM_PRICE;

    private double tolerance = TOLERANCE_DEFAULT_VALUE;

    private PriceTieBreak priceTieBreak = PRICE_TIE_BREAK_DEFAULT_VALUE;

    /**
     * Rows whose capacity or flow is not above this value are dropped.
     */
    public double getTolerance() {
        return tolerance;
    }

    public DecomposerParameters setTolerance(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must be positive or zero");
        }
        this.tolerance = tolerance;
        return this;
    }

    public PriceTieBreak getPriceTieBreak() {
        return priceTieBreak;
    }

    public DecomposerParameters setPriceTieBreak(PriceTieBreak priceTieBreak) {
        this.priceTieBreak = Objects.requireNonNull(priceTieBreak);
        return this;
    }

    @Override
    public String toString() {
        return "DecomposerParameters(" +
                "tolerance=" + tolerance +
                ", priceTieBreak=" + priceTieBreak +
                ')';
    }
}
