/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model.constraints;

import com.powsybl.openhydrogen.model.*;
import com.powsybl.openhydrogen.network.*;

/**
 * Flow on a distribution arc is bounded by built units times the per unit flow limit, converter and
 * production outputs are bounded by capacity times utilization.
 */
public class CapacityFlowCouplingConstraints implements ConstraintFamily {

    public static final String NAME = "CapacityFlowCoupling";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        ModelSets sets = model.getSets();
        ModelParameters parameters = model.getParameters();

        for (H2Arc arc : sets.getDistributionArcs()) {
            LinearExpression expression = LinearExpression.builder()
                    .addTerm(model.getVariable(H2VariableType.DIST_H, arc.getId()), 1)
                    .addTerm(model.getVariable(H2VariableType.DIST_CAPACITY, arc.getId()), -parameters.get(H2Attribute.FLOW_LIMIT, arc))
                    .build();
            model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.FLOW_CAPACITY, arc.getId(), expression, 0));
        }

        H2Network network = model.getNetwork();
        for (ConverterNode converter : sets.getConverters()) {
            LinearExpression.Builder expression = LinearExpression.builder();
            for (H2Arc arc : network.getOutgoingArcs(converter)) {
                expression.addTerm(model.getVariable(H2VariableType.DIST_H, arc.getId()), 1);
            }
            expression.addTerm(model.getVariable(H2VariableType.CONV_CAPACITY, converter.getId()),
                    -parameters.get(H2Attribute.UTILIZATION, converter));
            model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.CONVERTER_CAPACITY, converter.getId(), expression.build(), 0));
        }

        for (ProducerNode producer : sets.getProducers()) {
            LinearExpression expression = LinearExpression.builder()
                    .addTerm(model.getVariable(H2VariableType.PROD_H, producer.getId()), 1)
                    .addTerm(model.getVariable(H2VariableType.PROD_CAPACITY, producer.getId()), -parameters.get(H2Attribute.UTILIZATION, producer))
                    .build();
            model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.PRODUCTION_CAPACITY, producer.getId(), expression, 0));
        }
    }
}
