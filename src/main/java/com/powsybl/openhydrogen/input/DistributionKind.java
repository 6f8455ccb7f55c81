/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import java.util.Objects;

public enum DistributionKind {
    PIPELINE,
    TRUCK;

    public static DistributionKind fromTechnologyName(String name) {
        Objects.requireNonNull(name);
        if (name.startsWith("pipeline")) {
            return PIPELINE;
        }
        if (name.startsWith("truck")) {
            return TRUCK;
        }
        throw new IllegalArgumentException("Cannot infer distribution kind of technology '" + name + "'");
    }
}
