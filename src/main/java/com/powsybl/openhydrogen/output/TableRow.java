/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import java.util.Map;

/**
 * A row of an output table.
 */
public interface TableRow {

    /**
     * Element identifier the row is keyed by.
     */
    String getId();

    /**
     * Hub the row belongs to.
     */
    String getHub();

    /**
     * Column name to value, in column order.
     */
    Map<String, Object> toMap();
}
