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
import com.powsybl.openhydrogen.network.H2Attribute;
import com.powsybl.openhydrogen.network.ProducerNode;

/**
 * ccs_h = built * prod_h, linearized with the producer maximum output as big-M:
 * <ul>
 *     <li>ccs_h <= M * built</li>
 *     <li>ccs_h <= prod_h</li>
 *     <li>ccs_h >= prod_h - M * (1 - built)</li>
 * </ul>
 */
public class CcsAllOrNothingConstraints implements ConstraintFamily {

    public static final String NAME = "CcsAllOrNothing";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        ModelParameters parameters = model.getParameters();
        for (ProducerNode producer : model.getSets().getExistingProducers()) {
            double bigM = parameters.get(H2Attribute.CAPACITY, producer) * parameters.get(H2Attribute.UTILIZATION, producer);
            H2Variable prodH = model.getVariable(H2VariableType.PROD_H, producer.getId());
            for (CcsTechnology ccs : model.getSets().getCcsTechnologies()) {
                String id = CcsCapacityConstraints.retrofitId(producer, ccs);
                H2Variable ccsH = model.getVariable(H2VariableType.CCS_CAPACITY_H2, producer.getId(), ccs.getName());
                H2Variable built = model.getVariable(H2VariableType.CCS_BUILT, producer.getId(), ccs.getName());
                model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.CCS_THROUGHPUT_IF_BUILT, id,
                        LinearExpression.builder().addTerm(ccsH, 1).addTerm(built, -bigM).build(), 0));
                model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.CCS_THROUGHPUT_MAX_OUTPUT, id,
                        LinearExpression.builder().addTerm(ccsH, 1).addTerm(prodH, -1).build(), 0));
                model.addConstraint(H2Constraint.greaterOrEqual(H2ConstraintType.CCS_MUST_BUILD_ALL, id,
                        LinearExpression.builder().addTerm(ccsH, 1).addTerm(prodH, -1).addTerm(built, -bigM).build(), -bigM));
            }
        }
    }
}
