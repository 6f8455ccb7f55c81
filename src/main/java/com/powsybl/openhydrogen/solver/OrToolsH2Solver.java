/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.solver;

import com.google.common.base.Stopwatch;
import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.*;
import com.powsybl.openhydrogen.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openhydrogen.util.Markers.PERFORMANCE_MARKER;
import static com.powsybl.openhydrogen.util.Markers.SOLVER_MARKER;

/**
 * Solves the model with a Google OR-Tools linear solver backend (SCIP by default).
 */
public class OrToolsH2Solver implements H2Solver {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrToolsH2Solver.class);

    public static final String NAME = "OR-Tools";

    private static final String SCIP = "scip";

    @Override
    public String getName() {
        return NAME;
    }

    private static void loadNativeLibraries() {
        try {
            Loader.loadNativeLibraries();
        } catch (UnsatisfiedLinkError e) {
            throw new H2SolverException("Cannot load OR-Tools native libraries", e);
        }
    }

    static ModelBuilder createModelBuilder(H2OptimizationModel model, List<Variable> columns) {
        ModelBuilder modelBuilder = new ModelBuilder();

        for (H2Variable variable : model.getVariables().getVariables()) {
            columns.add(modelBuilder.newVar(variable.getLowerBound(), variable.getUpperBound(), variable.isIntegral(), variable.getName()));
        }

        for (H2Constraint constraint : model.getConstraints()) {
            LinearConstraint linearConstraint = modelBuilder.addLinearConstraint(toLinearExpr(constraint.getExpression(), columns, false),
                    constraint.getLowerBound(), constraint.getUpperBound());
            linearConstraint.setName(constraint.getName());
        }

        modelBuilder.maximize(toLinearExpr(model.getObjective(), columns, true));

        LOGGER.debug("Model built with {} variables and {} constraints", modelBuilder.numVariables(), modelBuilder.numConstraints());

        return modelBuilder;
    }

    private static LinearExpr toLinearExpr(LinearExpression expression, List<Variable> columns, boolean withConstant) {
        LinearExprBuilder builder = LinearExpr.newBuilder();
        for (Map.Entry<H2Variable, Double> term : expression.getTerms().entrySet()) {
            builder.addTerm(columns.get(term.getKey().getNum()), term.getValue());
        }
        if (withConstant) {
            builder.add(expression.getConstant());
        }
        return builder.build();
    }

    private static ModelSolver createModelSolver(H2SolverParameters parameters) {
        ModelSolver solver = new ModelSolver(parameters.getSolverName());
        if (!solver.solverIsSupported()) {
            throw new H2SolverException("Solver '" + parameters.getSolverName() + "' is not supported by OR-Tools");
        }
        solver.enableOutput(parameters.isVerbose());
        if (parameters.getTimeLimit() > 0) {
            solver.setTimeLimit(Duration.ofSeconds(parameters.getTimeLimit()));
        }
        if (SCIP.equalsIgnoreCase(parameters.getSolverName())) {
            solver.setSolverSpecificParameters("limits/gap = " + parameters.getMipGap());
        } else {
            LOGGER.warn(SOLVER_MARKER, "MIP gap {} is not passed to solver '{}'", parameters.getMipGap(), parameters.getSolverName());
        }
        return solver;
    }

    static H2SolverStatus convertStatus(SolveStatus status, boolean timeLimitReached) {
        return switch (status) {
            case OPTIMAL -> H2SolverStatus.OPTIMAL;
            case FEASIBLE -> H2SolverStatus.FEASIBLE;
            case INFEASIBLE -> H2SolverStatus.INFEASIBLE;
            case UNBOUNDED -> H2SolverStatus.UNBOUNDED;
            case NOT_SOLVED -> timeLimitReached ? H2SolverStatus.TIMEOUT : H2SolverStatus.ERROR;
            default -> H2SolverStatus.ERROR;
        };
    }

    @Override
    public H2Solution solve(H2OptimizationModel model, H2SolverParameters parameters) {
        Objects.requireNonNull(model);
        Objects.requireNonNull(parameters);

        loadNativeLibraries();

        List<Variable> columns = new ArrayList<>(model.getVariables().size());
        ModelBuilder modelBuilder = createModelBuilder(model, columns);
        ModelSolver solver = createModelSolver(parameters);

        LOGGER.info(SOLVER_MARKER, "Solving model with {}", parameters);
        Stopwatch stopwatch = Stopwatch.createStarted();
        SolveStatus solveStatus = solver.solve(modelBuilder);
        stopwatch.stop();
        LOGGER.info(PERFORMANCE_MARKER, "Model solved with status {} in {} ms", solveStatus, stopwatch.elapsed(TimeUnit.MILLISECONDS));

        boolean timeLimitReached = parameters.getTimeLimit() > 0
                && stopwatch.elapsed(TimeUnit.SECONDS) >= parameters.getTimeLimit();
        H2SolverStatus status = convertStatus(solveStatus, timeLimitReached);
        if (!status.isSuccess()) {
            LOGGER.warn(SOLVER_MARKER, "Solver failed: {}", solveStatus);
            return H2Solution.failed(status);
        }

        Map<String, Double> values = new LinkedHashMap<>();
        for (H2Variable variable : model.getVariables().getVariables()) {
            values.put(variable.getName(), solver.getValue(columns.get(variable.getNum())));
        }
        return new H2Solution(status, solver.getObjectiveValue(), values);
    }
}
