/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Immutable affine expression: sum of coefficient * variable plus a constant.
 */
public final class LinearExpression {

    public static final LinearExpression ZERO = new LinearExpression(Collections.emptyMap(), 0);

    private final Map<H2Variable, Double> terms;

    private final double constant;

    private LinearExpression(Map<H2Variable, Double> terms, double constant) {
        this.terms = terms;
        this.constant = constant;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LinearExpression of(H2Variable variable) {
        return builder().addTerm(variable, 1).build();
    }

    public static final class Builder {

        private final Map<H2Variable, Double> terms = new LinkedHashMap<>();

        private double constant = 0;

        private Builder() {
        }

        public Builder addTerm(H2Variable variable, double coefficient) {
            Objects.requireNonNull(variable);
            if (Double.isNaN(coefficient) || Double.isInfinite(coefficient)) {
                throw new H2ModelException("Invalid coefficient " + coefficient + " for variable " + variable);
            }
            if (coefficient != 0) {
                terms.merge(variable, coefficient, Double::sum);
            }
            return this;
        }

        public Builder add(LinearExpression expression, double factor) {
            Objects.requireNonNull(expression);
            expression.terms.forEach((v, c) -> addTerm(v, c * factor));
            constant += expression.constant * factor;
            return this;
        }

        public Builder add(double value) {
            constant += value;
            return this;
        }

        public LinearExpression build() {
            return new LinearExpression(Collections.unmodifiableMap(new LinkedHashMap<>(terms)), constant);
        }
    }

    public Map<H2Variable, Double> getTerms() {
        return terms;
    }

    public double getCoefficient(H2Variable variable) {
        return terms.getOrDefault(variable, 0.0);
    }

    public double getConstant() {
        return constant;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public double evaluate(ToDoubleFunction<H2Variable> values) {
        double value = constant;
        for (Map.Entry<H2Variable, Double> e : terms.entrySet()) {
            value += e.getValue() * values.applyAsDouble(e.getKey());
        }
        return value;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        terms.forEach((v, c) -> {
            if (builder.length() > 0) {
                builder.append(" + ");
            }
            builder.append(c).append(" * ").append(v.getName());
        });
        if (constant != 0 || builder.length() == 0) {
            if (builder.length() > 0) {
                builder.append(" + ");
            }
            builder.append(constant);
        }
        return builder.toString();
    }
}
