/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import com.google.common.base.Stopwatch;
import com.powsybl.openhydrogen.input.CcsTechnology;
import com.powsybl.openhydrogen.model.constraints.*;
import com.powsybl.openhydrogen.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openhydrogen.util.Markers.PERFORMANCE_MARKER;

/**
 * Compiles a frozen network into a mixed integer linear program maximizing the total surplus.
 */
public class H2ModelCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(H2ModelCompiler.class);

    private final List<ConstraintFamily> constraintFamilies;

    public H2ModelCompiler() {
        this(createDefaultConstraintFamilies());
    }

    public H2ModelCompiler(List<ConstraintFamily> constraintFamilies) {
        this.constraintFamilies = List.copyOf(Objects.requireNonNull(constraintFamilies));
    }

    public static List<ConstraintFamily> createDefaultConstraintFamilies() {
        return List.of(new MassConservationConstraints(),
                       new CapacityFlowCouplingConstraints(),
                       new ExistingInfrastructureConstraints(),
                       new NewBuildBracketingConstraints(),
                       new TruckFleetConsistencyConstraints(),
                       new CcsMutualExclusivityConstraints(),
                       new CcsCapacityConstraints(),
                       new CcsAllOrNothingConstraints(),
                       new ChecAccountingConstraints(),
                       new ConsumerSizingConstraints(),
                       new SubsidyConstraints());
    }

    public List<ConstraintFamily> getConstraintFamilies() {
        return constraintFamilies;
    }

    public H2OptimizationModel compile(H2Network network, H2ModelParameters parameters) {
        return compile(network, Collections.emptyList(), parameters);
    }

    public H2OptimizationModel compile(H2Network network, Collection<CcsTechnology> ccsTechnologies, H2ModelParameters parameters) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(ccsTechnologies);
        Objects.requireNonNull(parameters);
        if (!network.isFrozen()) {
            throw new H2ModelException("Network '" + network.getId() + "' has to be frozen before compilation");
        }

        Stopwatch stopwatch = Stopwatch.createStarted();

        ModelSets sets = ModelSets.create(network, ccsTechnologies);
        LOGGER.debug("Model sets: {}", sets);
        H2OptimizationModel model = new H2OptimizationModel(network, sets, new ModelParameters(network, ccsTechnologies, parameters));

        createVariables(model);
        for (ConstraintFamily family : constraintFamilies) {
            int before = model.getConstraints().size();
            family.build(model);
            LOGGER.trace("Constraint family '{}' added {} constraints", family.getName(), model.getConstraints().size() - before);
        }
        new TotalSurplusObjective(model).build();

        stopwatch.stop();
        LOGGER.info(PERFORMANCE_MARKER, "Model compiled in {} ms: {} variables, {} constraints",
                stopwatch.elapsed(TimeUnit.MILLISECONDS), model.getVariables().size(), model.getConstraints().size());

        return model;
    }

    private static void createVariables(H2OptimizationModel model) {
        ModelSets sets = model.getSets();
        H2VariableSet variables = model.getVariables();
        for (H2Arc arc : sets.getArcs()) {
            variables.create(H2VariableType.DIST_H, arc.getId());
        }
        for (H2Arc arc : sets.getDistributionArcs()) {
            variables.create(H2VariableType.DIST_CAPACITY, arc.getId());
        }
        for (ProducerNode producer : sets.getProducers()) {
            variables.create(H2VariableType.PROD_EXISTS, producer.getId());
            variables.create(H2VariableType.PROD_CAPACITY, producer.getId());
            variables.create(H2VariableType.PROD_H, producer.getId());
            variables.create(H2VariableType.PROD_CHECS, producer.getId());
        }
        for (ProducerNode producer : sets.getExistingProducers()) {
            for (CcsTechnology ccs : sets.getCcsTechnologies()) {
                variables.create(H2VariableType.CCS_BUILT, producer.getId(), ccs.getName());
                variables.create(H2VariableType.CCS_CAPACITY_H2, producer.getId(), ccs.getName());
                variables.create(H2VariableType.CCS_CO2_CAPTURED, producer.getId(), ccs.getName());
                variables.create(H2VariableType.CCS_CHECS, producer.getId(), ccs.getName());
            }
        }
        for (ConverterNode converter : sets.getConverters()) {
            variables.create(H2VariableType.CONV_CAPACITY, converter.getId());
        }
        for (ConverterNode dispenser : sets.getFuelDispensers()) {
            variables.create(H2VariableType.FUEL_STATION_SUBSIDY, dispenser.getId());
        }
        for (ConsumerNode consumer : sets.getConsumers()) {
            variables.create(H2VariableType.CONS_H, consumer.getId());
            variables.create(H2VariableType.CONS_CHECS, consumer.getId());
        }
    }
}
