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
import com.powsybl.openhydrogen.network.H2ArcType;
import com.powsybl.openhydrogen.network.H2Network;
import com.powsybl.openhydrogen.network.H2Node;

/**
 * At each truck depot, the fleet bought on the arcs feeding the depot equals the fleet dispatched on the
 * outgoing routes. Incoming routes from other hubs are not counted: the fleet is owned by the sending depot.
 */
public class TruckFleetConsistencyConstraints implements ConstraintFamily {

    public static final String NAME = "TruckFleetConsistency";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        H2Network network = model.getNetwork();
        for (H2Node depot : model.getSets().getTruckDepots()) {
            LinearExpression.Builder expression = LinearExpression.builder();
            for (H2Arc arc : network.getIncomingArcs(depot)) {
                if (arc.getType().isDistribution() && arc.getType() != H2ArcType.TRUCK_ROUTE) {
                    expression.addTerm(model.getVariable(H2VariableType.DIST_CAPACITY, arc.getId()), 1);
                }
            }
            for (H2Arc arc : network.getOutgoingArcs(depot)) {
                if (arc.getType().isDistribution()) {
                    expression.addTerm(model.getVariable(H2VariableType.DIST_CAPACITY, arc.getId()), -1);
                }
            }
            model.addConstraint(H2Constraint.equal(H2ConstraintType.TRUCK_CONSISTENCY, depot.getId(), expression.build(), 0));
        }
    }
}
