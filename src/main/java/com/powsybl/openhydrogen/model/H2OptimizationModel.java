/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import com.powsybl.openhydrogen.network.H2Network;

import java.util.*;
import java.util.function.ToDoubleFunction;

/**
 * A solver independent mixed integer linear program: sets, parameters, variables, constraints and
 * a maximized objective kept as one expression per {@link ObjectiveTerm}.
 */
public class H2OptimizationModel {

    private final H2Network network;

    private final ModelSets sets;

    private final ModelParameters parameters;

    private final H2VariableSet variables = new H2VariableSet();

    private final List<H2Constraint> constraints = new ArrayList<>();

    private final Map<String, H2Constraint> constraintsByName = new HashMap<>();

    private final Map<ObjectiveTerm, LinearExpression> objectiveTerms = new EnumMap<>(ObjectiveTerm.class);

    public H2OptimizationModel(H2Network network, ModelSets sets, ModelParameters parameters) {
        this.network = Objects.requireNonNull(network);
        this.sets = Objects.requireNonNull(sets);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public H2Network getNetwork() {
        return network;
    }

    public ModelSets getSets() {
        return sets;
    }

    public ModelParameters getParameters() {
        return parameters;
    }

    public H2VariableSet getVariables() {
        return variables;
    }

    public H2Variable getVariable(H2VariableType type, String elementId) {
        return variables.getVariable(type, elementId);
    }

    public H2Variable getVariable(H2VariableType type, String elementId, String qualifier) {
        return variables.getVariable(type, elementId, qualifier);
    }

    public H2Constraint addConstraint(H2Constraint constraint) {
        Objects.requireNonNull(constraint);
        if (constraintsByName.putIfAbsent(constraint.getName(), constraint) != null) {
            throw new H2ModelException("Constraint " + constraint.getName() + " already exists");
        }
        constraints.add(constraint);
        return constraint;
    }

    public List<H2Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public List<H2Constraint> getConstraints(H2ConstraintType type) {
        return constraints.stream().filter(c -> c.getType() == type).toList();
    }

    public Optional<H2Constraint> findConstraint(String name) {
        return Optional.ofNullable(constraintsByName.get(name));
    }

    public void setObjectiveTerm(ObjectiveTerm term, LinearExpression expression) {
        objectiveTerms.put(Objects.requireNonNull(term), Objects.requireNonNull(expression));
    }

    public LinearExpression getObjectiveTerm(ObjectiveTerm term) {
        return objectiveTerms.getOrDefault(term, LinearExpression.ZERO);
    }

    public Map<ObjectiveTerm, LinearExpression> getObjectiveTerms() {
        return Collections.unmodifiableMap(objectiveTerms);
    }

    /**
     * Total surplus: benefits minus costs.
     */
    public LinearExpression getObjective() {
        LinearExpression.Builder builder = LinearExpression.builder();
        objectiveTerms.forEach((term, expression) -> builder.add(expression, term.getSign()));
        return builder.build();
    }

    /**
     * Value of each objective term, unsigned.
     */
    public Map<ObjectiveTerm, Double> evaluateObjectiveTerms(ToDoubleFunction<H2Variable> values) {
        Map<ObjectiveTerm, Double> result = new EnumMap<>(ObjectiveTerm.class);
        objectiveTerms.forEach((term, expression) -> result.put(term, expression.evaluate(values)));
        return result;
    }

    @Override
    public String toString() {
        return "H2OptimizationModel(network=" + network.getId()
                + ", variables=" + variables.size()
                + ", constraints=" + constraints.size() + ')';
    }
}
