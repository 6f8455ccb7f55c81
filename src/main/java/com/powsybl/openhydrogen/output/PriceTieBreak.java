/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

/**
 * Selection among the price probes that consumed their whole demand.
 */
public enum PriceTieBreak {
    /**
     * Lowest breakeven price.
     */
    MINIMUM_PRICE,
    /**
     * First probe in ladder order.
     */
    FIRST_MATCH
}
