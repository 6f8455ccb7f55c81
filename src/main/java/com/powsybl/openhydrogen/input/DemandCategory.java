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
 * Category of a hub demand node. Demand sectors and price probes are attached to one of them.
 */
public enum DemandCategory {
    FUEL_STATION("fuelStation", Purity.HIGH),
    LOW_PURITY("lowPurity", Purity.LOW),
    HIGH_PURITY("highPurity", Purity.HIGH);

    private final String tag;

    private final Purity minimumPurity;

    DemandCategory(String tag, Purity minimumPurity) {
        this.tag = tag;
        this.minimumPurity = minimumPurity;
    }

    public String getTag() {
        return tag;
    }

    public String getSuffix() {
        return Character.toUpperCase(tag.charAt(0)) + tag.substring(1);
    }

    /**
     * A category can be served by a distribution layer of at least this purity.
     */
    public boolean canBeServedBy(Purity purity) {
        return minimumPurity == Purity.LOW || purity == Purity.HIGH;
    }

    public static DemandCategory fromTag(String tag) {
        Objects.requireNonNull(tag);
        for (DemandCategory category : values()) {
            if (category.tag.equalsIgnoreCase(tag) || category.name().equalsIgnoreCase(tag)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown demand category: '" + tag + "'");
    }
}
