/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen;

import com.powsybl.openhydrogen.input.H2InputTables;
import com.powsybl.openhydrogen.model.H2ModelCompiler;
import com.powsybl.openhydrogen.model.H2OptimizationModel;
import com.powsybl.openhydrogen.network.H2Network;
import com.powsybl.openhydrogen.network.H2NetworkBuilder;
import com.powsybl.openhydrogen.output.OutputTables;
import com.powsybl.openhydrogen.output.SolutionDecomposer;
import com.powsybl.openhydrogen.solver.H2Solution;
import com.powsybl.openhydrogen.solver.H2Solver;
import com.powsybl.openhydrogen.solver.OrToolsH2Solver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs one scenario: network synthesis, model compilation, solve and decomposition.
 */
public class OpenHydrogenPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenHydrogenPlanner.class);

    private final H2Solver solver;

    private final H2ModelCompiler compiler;

    public OpenHydrogenPlanner() {
        this(new OrToolsH2Solver());
    }

    public OpenHydrogenPlanner(H2Solver solver) {
        this(solver, new H2ModelCompiler());
    }

    public OpenHydrogenPlanner(H2Solver solver, H2ModelCompiler compiler) {
        this.solver = Objects.requireNonNull(solver);
        this.compiler = Objects.requireNonNull(compiler);
    }

    public HydrogenPlanningResult run(H2InputTables tables, OpenHydrogenParameters parameters) {
        Objects.requireNonNull(tables);
        Objects.requireNonNull(parameters);

        LOGGER.info("Hydrogen planning with {}", parameters);

        H2Network network = new H2NetworkBuilder(parameters.getNetworkParameters()).synthesize(tables);
        H2OptimizationModel model = compiler.compile(network, tables.getCcsTechnologies(), parameters.getModelParameters());
        H2Solution solution = solver.solve(model, parameters.getSolverParameters());

        if (!solution.isSuccess()) {
            LOGGER.error("Hydrogen planning failed with solver status {}", solution.getStatus());
            return new HydrogenPlanningResult(network, solution, null);
        }

        OutputTables outputTables = new SolutionDecomposer(parameters.getDecomposerParameters()).decompose(solution, model);
        return new HydrogenPlanningResult(network, solution, outputTables);
    }
}
