/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model.constraints;

import com.powsybl.openhydrogen.model.*;
import com.powsybl.openhydrogen.network.H2Arc;
import com.powsybl.openhydrogen.network.H2Attribute;
import com.powsybl.openhydrogen.network.ProducerNode;

/**
 * Pins existing infrastructure to its recorded state.
 */
public class ExistingInfrastructureConstraints implements ConstraintFamily {

    public static final String NAME = "ExistingInfrastructure";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        ModelSets sets = model.getSets();
        for (H2Arc arc : sets.getExistingDistributionArcs()) {
            model.addConstraint(H2Constraint.greaterOrEqual(H2ConstraintType.EXISTING_PIPELINE, arc.getId(),
                    LinearExpression.of(model.getVariable(H2VariableType.DIST_CAPACITY, arc.getId())), 1));
        }
        for (ProducerNode producer : sets.getExistingProducers()) {
            model.addConstraint(H2Constraint.equal(H2ConstraintType.EXISTING_PRODUCER_EXISTS, producer.getId(),
                    LinearExpression.of(model.getVariable(H2VariableType.PROD_EXISTS, producer.getId())), 1));
            model.addConstraint(H2Constraint.equal(H2ConstraintType.EXISTING_PRODUCER_CAPACITY, producer.getId(),
                    LinearExpression.of(model.getVariable(H2VariableType.PROD_CAPACITY, producer.getId())),
                    model.getParameters().get(H2Attribute.CAPACITY, producer)));
        }
    }
}
