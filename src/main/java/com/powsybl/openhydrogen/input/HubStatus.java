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
 * Hub status, driving how aggressively a hub is connected to its neighbours.
 */
public enum HubStatus {
    MAJOR(1),
    REGULAR(0),
    MINOR(-1);

    private final int value;

    HubStatus(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Accepts either the enum name or the numeric form (1 major, 0 regular, -1 minor).
     */
    public static HubStatus parse(String s) {
        Objects.requireNonNull(s);
        String trimmed = s.trim();
        for (HubStatus status : values()) {
            if (status.name().equalsIgnoreCase(trimmed)) {
                return status;
            }
        }
        int v = (int) Double.parseDouble(trimmed);
        for (HubStatus status : values()) {
            if (status.value == v) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown hub status: '" + s + "'");
    }
}
