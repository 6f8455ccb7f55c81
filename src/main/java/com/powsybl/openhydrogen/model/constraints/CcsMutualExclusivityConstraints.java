/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model.constraints;

import com.powsybl.openhydrogen.input.CcsTechnology;
import com.powsybl.openhydrogen.model.*;
import com.powsybl.openhydrogen.network.ProducerNode;

/**
 * At most one retrofit technology per existing producer.
 */
public class CcsMutualExclusivityConstraints implements ConstraintFamily {

    public static final String NAME = "CcsMutualExclusivity";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        if (model.getSets().getCcsTechnologies().isEmpty()) {
            return;
        }
        for (ProducerNode producer : model.getSets().getExistingProducers()) {
            LinearExpression.Builder expression = LinearExpression.builder();
            for (CcsTechnology ccs : model.getSets().getCcsTechnologies()) {
                expression.addTerm(model.getVariable(H2VariableType.CCS_BUILT, producer.getId(), ccs.getName()), 1);
            }
            model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.ONLY_ONE_CCS, producer.getId(), expression.build(), 1));
        }
    }
}
