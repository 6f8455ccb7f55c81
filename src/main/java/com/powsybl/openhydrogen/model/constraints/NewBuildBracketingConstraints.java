/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model.constraints;

import com.powsybl.openhydrogen.model.*;
import com.powsybl.openhydrogen.network.H2Attribute;
import com.powsybl.openhydrogen.network.ProducerNode;

/**
 * min * exists <= capacity <= max * exists for new producers.
 */
public class NewBuildBracketingConstraints implements ConstraintFamily {

    public static final String NAME = "NewBuildBracketing";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        ModelParameters parameters = model.getParameters();
        for (ProducerNode producer : model.getSets().getNewProducers()) {
            H2Variable capacity = model.getVariable(H2VariableType.PROD_CAPACITY, producer.getId());
            H2Variable exists = model.getVariable(H2VariableType.PROD_EXISTS, producer.getId());
            model.addConstraint(H2Constraint.greaterOrEqual(H2ConstraintType.MIN_PRODUCTION, producer.getId(),
                    LinearExpression.builder()
                            .addTerm(capacity, 1)
                            .addTerm(exists, -parameters.get(H2Attribute.MIN_SIZE, producer))
                            .build(), 0));
            model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.MAX_PRODUCTION, producer.getId(),
                    LinearExpression.builder()
                            .addTerm(capacity, 1)
                            .addTerm(exists, -parameters.get(H2Attribute.MAX_SIZE, producer))
                            .build(), 0));
        }
    }
}
