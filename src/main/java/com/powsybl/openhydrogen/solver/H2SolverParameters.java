/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.solver;

import java.util.Objects;

public class H2SolverParameters {

    public static final String SOLVER_NAME_DEFAULT_VALUE = "scip";
    public static final double MIP_GAP_DEFAULT_VALUE = 0.01;
    public static final boolean VERBOSE_DEFAULT_VALUE = false;
    public static final int TIME_LIMIT_DEFAULT_VALUE = 0; // no limit

    private String solverName = SOLVER_NAME_DEFAULT_VALUE;

    private double mipGap = MIP_GAP_DEFAULT_VALUE;

    private boolean verbose = VERBOSE_DEFAULT_VALUE;

    private int timeLimit = TIME_LIMIT_DEFAULT_VALUE;

    public String getSolverName() {
        return solverName;
    }

    public H2SolverParameters setSolverName(String solverName) {
        Objects.requireNonNull(solverName);
        if (solverName.isBlank()) {
            throw new IllegalArgumentException("Solver name cannot be empty");
        }
        this.solverName = solverName;
        return this;
    }

    /**
     * Relative optimality gap at which a mixed integer search stops.
     */
    public double getMipGap() {
        return mipGap;
    }

    public H2SolverParameters setMipGap(double mipGap) {
        if (mipGap < 0 || mipGap >= 1) {
            throw new IllegalArgumentException("MIP gap must be in [0, 1[");
        }
        this.mipGap = mipGap;
        return this;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public H2SolverParameters setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    /**
     * Time limit in seconds, 0 means no limit.
     */
    public int getTimeLimit() {
        return timeLimit;
    }

    public H2SolverParameters setTimeLimit(int timeLimit) {
        if (timeLimit < 0) {
            throw new IllegalArgumentException("Time limit must be positive or zero");
        }
        this.timeLimit = timeLimit;
        return this;
    }

    @Override
    public String toString() {
        return "H2SolverParameters(" +
                "solverName=" + solverName +
                ", mipGap=" + mipGap +
                ", verbose=" + verbose +
                ", timeLimit=" + timeLimit +
                ')';
    }
}
