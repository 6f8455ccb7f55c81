/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import com.powsybl.commons.PowsyblException;

/**
 * A table or a row required to build the network is missing.
 */
public class H2InputException extends PowsyblException {

    public H2InputException(String msg) {
        super(msg);
    }

    public H2InputException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
