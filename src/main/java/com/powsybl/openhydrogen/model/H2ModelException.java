/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import com.powsybl.commons.PowsyblException;

/**
 * A model rule refers to an identifier which is not part of its declared set.
 */
public class H2ModelException extends PowsyblException {

    public H2ModelException(String msg) {
        super(msg);
    }
}
