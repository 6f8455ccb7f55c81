/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import java.util.Locale;
import java.util.Objects;

public enum ConverterKind {
    PURIFIER,
    COMPRESSOR,
    LIQUEFIER,
    FUEL_DISPENSER,
    OTHER;

    public static ConverterKind fromTechnologyName(String name) {
        Objects.requireNonNull(name);
        String lowerCaseName = name.toLowerCase(Locale.ROOT);
        if (lowerCaseName.contains("dispenser")) {
            return FUEL_DISPENSER;
        }
        if (lowerCaseName.contains("purif")) {
            return PURIFIER;
        }
        if (lowerCaseName.contains("liquef")) {
            return LIQUEFIER;
        }
        if (lowerCaseName.contains("compress")) {
            return COMPRESSOR;
        }
        return OTHER;
    }
}
