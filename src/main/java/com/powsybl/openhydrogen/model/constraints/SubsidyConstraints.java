/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model.constraints;

import com.powsybl.openhydrogen.model.*;
import com.powsybl.openhydrogen.network.ConverterNode;
import com.powsybl.openhydrogen.network.H2Attribute;

/**
 * Fuel station subsidy = capital cost * (1 - industry cost share). With a positive budget, the total
 * subsidy is bounded by the budget.
 */
public class SubsidyConstraints implements ConstraintFamily {

    public static final String NAME = "Subsidy";

    /**
     * Budgets are given in billion USD.
     */
    public static final double BUDGET_UNIT = 1e9;

    static final String NETWORK_ELEMENT_ID = "network";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        ModelParameters parameters = model.getParameters();
        H2ModelParameters settings = parameters.getSettings();
        double publicShare = 1 - settings.getSubsidyCostShareFraction();
        LinearExpression.Builder total = LinearExpression.builder();
        for (ConverterNode dispenser : model.getSets().getFuelDispensers()) {
            H2Variable subsidy = model.getVariable(H2VariableType.FUEL_STATION_SUBSIDY, dispenser.getId());
            model.addConstraint(H2Constraint.equal(H2ConstraintType.FUEL_STATION_SUBSIDY, dispenser.getId(),
                    LinearExpression.builder()
                            .addTerm(subsidy, 1)
                            .addTerm(model.getVariable(H2VariableType.CONV_CAPACITY, dispenser.getId()),
                                    -parameters.get(H2Attribute.CAPITAL_COST, dispenser) * publicShare)
                            .build(), 0));
            total.addTerm(subsidy, 1);
        }
        if (settings.getSubsidyBudget() > 0) {
            model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.SUBSIDY_BUDGET, NETWORK_ELEMENT_ID, total.build(),
                    settings.getSubsidyBudget() * BUDGET_UNIT));
        }
    }
}
