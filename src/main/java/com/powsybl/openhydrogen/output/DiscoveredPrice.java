/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import com.powsybl.openhydrogen.input.DemandCategory;

/**
 * Market price found at a hub for a demand category.
 *
 * @param price USD per ton
 * @param consumer the price probe that set the price
 */
public record DiscoveredPrice(String hub, DemandCategory category, double price, String consumer) {
}
