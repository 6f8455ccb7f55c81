/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.solver;

import com.powsybl.openhydrogen.model.H2OptimizationModel;

/**
 * Blocking resolution of a compiled model. Infeasible, unbounded and timed out runs are reported through
 * the solution status, never as an empty solution.
 */
public interface H2Solver {

    String getName();

    H2Solution solve(H2OptimizationModel model, H2SolverParameters parameters);
}
