/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen;

import com.powsybl.openhydrogen.network.H2Network;
import com.powsybl.openhydrogen.output.OutputTables;
import com.powsybl.openhydrogen.solver.H2Solution;
import com.powsybl.openhydrogen.solver.H2SolverStatus;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a planning run. Output tables are only present when the solver succeeded.
 */
public class HydrogenPlanningResult {

    private final H2Network network;

    private final H2Solution solution;

    private final OutputTables outputTables;

    public HydrogenPlanningResult(H2Network network, H2Solution solution, OutputTables outputTables) {
        this.network = Objects.requireNonNull(network);
        this.solution = Objects.requireNonNull(solution);
        if (solution.isSuccess() == (outputTables == null)) {
            throw new IllegalArgumentException("Output tables must be present if and only if the solve succeeded");
        }
        this.outputTables = outputTables;
    }

    public H2Network getNetwork() {
        return network;
    }

    public H2Solution getSolution() {
        return solution;
    }

    public H2SolverStatus getStatus() {
        return solution.getStatus();
    }

    public boolean isSuccess() {
        return solution.isSuccess();
    }

    public Optional<OutputTables> getOutputTables() {
        return Optional.ofNullable(outputTables);
    }
}
