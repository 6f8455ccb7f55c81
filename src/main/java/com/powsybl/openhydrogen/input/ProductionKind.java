/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import java.util.Objects;

public enum ProductionKind {
    THERMAL,
    ELECTRIC;

    public static ProductionKind fromTag(String tag) {
        Objects.requireNonNull(tag);
        return valueOf(tag.trim().toUpperCase());
    }
}
