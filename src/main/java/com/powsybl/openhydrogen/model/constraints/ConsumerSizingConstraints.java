/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model.constraints;

import com.powsybl.openhydrogen.model.*;
import com.powsybl.openhydrogen.network.ConsumerNode;
import com.powsybl.openhydrogen.network.H2Attribute;

public class ConsumerSizingConstraints implements ConstraintFamily {

    public static final String NAME = "ConsumerSizing";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void build(H2OptimizationModel model) {
        for (ConsumerNode consumer : model.getSets().getConsumers()) {
            model.addConstraint(H2Constraint.lessOrEqual(H2ConstraintType.CONSUMER_SIZE, consumer.getId(),
                    LinearExpression.of(model.getVariable(H2VariableType.CONS_H, consumer.getId())),
                    model.getParameters().get(H2Attribute.SIZE, consumer)));
        }
    }
}
