/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * A linear constraint {@code lowerBound <= expression <= upperBound}.
 */
public class H2Constraint {

    private final H2ConstraintType type;

    private final String elementId;

    private final LinearExpression expression;

    private final double lowerBound;

    private final double upperBound;

    public H2Constraint(H2ConstraintType type, String elementId, LinearExpression expression, double lowerBound, double upperBound) {
        this.type = Objects.requireNonNull(type);
        this.elementId = Objects.requireNonNull(elementId);
        this.expression = Objects.requireNonNull(expression);
        if (lowerBound > upperBound) {
            throw new H2ModelException("Constraint " + type.getSymbol() + "[" + elementId + "] has inconsistent bounds: ["
                    + lowerBound + ", " + upperBound + "]");
        }
        // constants are moved to the bounds
        this.lowerBound = lowerBound - expression.getConstant();
        this.upperBound = upperBound - expression.getConstant();
    }

    public static H2Constraint equal(H2ConstraintType type, String elementId, LinearExpression expression, double value) {
        return new H2Constraint(type, elementId, expression, value, value);
    }

    public static H2Constraint lessOrEqual(H2ConstraintType type, String elementId, LinearExpression expression, double value) {
        return new H2Constraint(type, elementId, expression, Double.NEGATIVE_INFINITY, value);
    }

    public static H2Constraint greaterOrEqual(H2ConstraintType type, String elementId, LinearExpression expression, double value) {
        return new H2Constraint(type, elementId, expression, value, Double.POSITIVE_INFINITY);
    }

    public H2ConstraintType getType() {
        return type;
    }

    public String getElementId() {
        return elementId;
    }

    public String getName() {
        return type.getSymbol() + "[" + elementId + "]";
    }

    /**
     * Expression terms; the expression constant is already folded into the bounds.
     */
    public LinearExpression getExpression() {
        return expression;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    /**
     * @return true if the constraint holds for the given variable values, within the tolerance
     */
    public boolean isSatisfied(ToDoubleFunction<H2Variable> values, double tolerance) {
        double activity = expression.evaluate(values) - expression.getConstant();
        return activity >= lowerBound - tolerance && activity <= upperBound + tolerance;
    }

    @Override
    public String toString() {
        return getName() + ": " + lowerBound + " <= " + expression + " <= " + upperBound;
    }
}
