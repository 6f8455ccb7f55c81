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
import com.powsybl.openhydrogen.network.ConsumerNode;
import com.powsybl.openhydrogen.network.H2Attribute;
import com.powsybl.openhydrogen.network.ProducerNode;

/**
 * Clean hydrogen credits: the credits consumed by carbon sensitive demand cannot exceed the credits
 * generated by producers and retrofits.
 */
public class ChecAccountingConstraints implements ConstraintFamily {

    public static final String NAME = "ChecAccounting";

    static final String NETWORK_ELEMENT_ID = "network";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        ModelSets sets = model.getSets();
        ModelParameters parameters = model.getParameters();
        LinearExpression.Builder balance = LinearExpression.builder();

        for (ProducerNode producer : sets.getProducers()) {
            H2Variable checs = model.getVariable(H2VariableType.PROD_CHECS, producer.getId());
            model.addConstraint(H2Constraint.equal(H2ConstraintType.PRODUCTION_CHECS, producer.getId(),
                    LinearExpression.builder()
                            .addTerm(checs, 1)
                            .addTerm(model.getVariable(H2VariableType.PROD_H, producer.getId()), -parameters.get(H2Attribute.CHEC_PER_TON, producer))
                            .build(), 0));
            balance.addTerm(checs, -1);
        }

        for (ProducerNode producer : sets.getExistingProducers()) {
            for (CcsTechnology ccs : sets.getCcsTechnologies()) {
                H2Variable checs = model.getVariable(H2VariableType.CCS_CHECS, producer.getId(), ccs.getName());
                model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.CCS_CHECS, CcsCapacityConstraints.retrofitId(producer, ccs),
                        LinearExpression.builder()
                                .addTerm(checs, 1)
                                .addTerm(model.getVariable(H2VariableType.CCS_CAPACITY_H2, producer.getId(), ccs.getName()),
                                        -parameters.getCcsChecPerTon(ccs.getName()))
                                .build(), 0));
                balance.addTerm(checs, -1);
            }
        }

        for (ConsumerNode consumer : sets.getConsumers()) {
            H2Variable checs = model.getVariable(H2VariableType.CONS_CHECS, consumer.getId());
            model.addConstraint(H2Constraint.equal(H2ConstraintType.CONSUMER_CHECS, consumer.getId(),
                    LinearExpression.builder()
                            .addTerm(checs, 1)
                            .addTerm(model.getVariable(H2VariableType.CONS_H, consumer.getId()), -parameters.get(H2Attribute.CARBON_SENSITIVE, consumer))
                            .build(), 0));
            balance.addTerm(checs, 1);
        }

        model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.CHEC_BALANCE, NETWORK_ELEMENT_ID, balance.build(), 0));
    }
}
