/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.solver;

import com.powsybl.openhydrogen.model.H2Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of a solve: the status and, on success, the value of every variable keyed by name.
 */
public class H2Solution {

    private final H2SolverStatus status;

    private final double objectiveValue;

    private final Map<String, Double> values;

    public H2Solution(H2SolverStatus status, double objectiveValue, Map<String, Double> values) {
        this.status = Objects.requireNonNull(status);
        this.objectiveValue = objectiveValue;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values)));
    }

    public static H2Solution failed(H2SolverStatus status) {
        if (status.isSuccess()) {
            throw new IllegalArgumentException("Status " + status + " is not a failure");
        }
        return new H2Solution(status, Double.NaN, Collections.emptyMap());
    }

    public H2SolverStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public Map<String, Double> getValues() {
        return values;
    }

    /**
     * @return the variable value, 0 if the variable is not part of the solution
     */
    public double getValue(H2Variable variable) {
        return getValue(variable.getName());
    }

    public double getValue(String variableName) {
        return values.getOrDefault(variableName, 0.0);
    }

    @Override
    public String toString() {
        return "H2Solution(status=" + status + ", objectiveValue=" + objectiveValue + ", values=" + values.size() + ')';
    }
}
