/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

/**
 * A group of constraints that can be added to or left out of a model independently of the others.
 */
public interface ConstraintFamily {

    String getName();

    void build(H2OptimizationModel model);
}
