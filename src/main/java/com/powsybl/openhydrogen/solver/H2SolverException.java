/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.solver;

import com.powsybl.commons.PowsyblException;

public class H2SolverException extends PowsyblException {

    public H2SolverException(String msg) {
        super(msg);
    }

    public H2SolverException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
