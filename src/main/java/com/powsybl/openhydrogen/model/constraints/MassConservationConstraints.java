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
import com.powsybl.openhydrogen.network.H2Network;
import com.powsybl.openhydrogen.network.H2Node;
import com.powsybl.openhydrogen.network.H2NodeType;

/**
 * Per node: inflow - outflow + production - consumption = 0.
 */
public class MassConservationConstraints implements ConstraintFamily {

    public static final String NAME = "MassConservation";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        H2Network network = model.getNetwork();
        for (H2Node node : model.getSets().getNodes()) {
            LinearExpression.Builder balance = LinearExpression.builder();
            for (H2Arc arc : network.getIncomingArcs(node)) {
                balance.addTerm(model.getVariable(H2VariableType.DIST_H, arc.getId()), 1);
            }
            for (H2Arc arc : network.getOutgoingArcs(node)) {
                balance.addTerm(model.getVariable(H2VariableType.DIST_H, arc.getId()), -1);
            }
            if (node.getType() == H2NodeType.PRODUCER) {
                balance.addTerm(model.getVariable(H2VariableType.PROD_H, node.getId()), 1);
            } else if (node.getType().isConsumer()) {
                balance.addTerm(model.getVariable(H2VariableType.CONS_H, node.getId()), -1);
            }
            model.addConstraint(H2Constraint.equal(H2ConstraintType.FLOW_BALANCE, node.getId(), balance.build(), 0));
        }
    }
}
