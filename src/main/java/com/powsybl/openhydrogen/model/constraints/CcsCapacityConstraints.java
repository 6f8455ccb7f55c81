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
 * Captured CO2 = retrofitted H2 throughput * emission rate * captured fraction. A retrofit technology the
 * producer is not eligible for cannot be built.
 */
public class CcsCapacityConstraints implements ConstraintFamily {

    public static final String NAME = "CcsCapacity";

    @Override
    public String getName() {
        return NAME;
    }

    static String retrofitId(ProducerNode producer, CcsTechnology ccs) {
        return producer.getId() + "," + ccs.getName();
    }

    @Override
    public void build(H2OptimizationModel model) {
        ModelParameters parameters = model.getParameters();
        for (ProducerNode producer : model.getSets().getExistingProducers()) {
            double co2EmissionsRate = parameters.get(H2Attribute.CO2_EMISSIONS_RATE, producer);
            for (CcsTechnology ccs : model.getSets().getCcsTechnologies()) {
                String id = retrofitId(producer, ccs);
                LinearExpression capture = LinearExpression.builder()
                        .addTerm(model.getVariable(H2VariableType.CCS_CO2_CAPTURED, producer.getId(), ccs.getName()), 1)
                        .addTerm(model.getVariable(H2VariableType.CCS_CAPACITY_H2, producer.getId(), ccs.getName()),
                                -co2EmissionsRate * ccs.getCaptureFraction())
                        .build();
                model.addConstraint(H2Constraint.equal(H2ConstraintType.CCS_CAPTURE, id, capture, 0));
                model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.CCS_ELIGIBILITY, id,
                        LinearExpression.of(model.getVariable(H2VariableType.CCS_BUILT, producer.getId(), ccs.getName())),
                        producer.isCcsEligible(ccs.getName()) ? 1 : 0));
            }
        }
    }
}
