/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import com.powsybl.openhydrogen.input.CcsTechnology;
import com.powsybl.openhydrogen.network.*;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds the terms of the total surplus objective. All capital costs are converted to a daily
 * equivalent with the annuity factor, the number of time slices and the fixed cost markup.
 */
public class TotalSurplusObjective {

    private final H2OptimizationModel model;

    private final ModelSets sets;

    private final ModelParameters parameters;

    private final H2ModelParameters settings;

    private final Map<ObjectiveTerm, LinearExpression.Builder> builders = new EnumMap<>(ObjectiveTerm.class);

    public TotalSurplusObjective(H2OptimizationModel model) {
        this.model = model;
        this.sets = model.getSets();
        this.parameters = model.getParameters();
        this.settings = parameters.getSettings();
    }

    private LinearExpression.Builder term(ObjectiveTerm term) {
        return builders.computeIfAbsent(term, t -> LinearExpression.builder());
    }

    public void build() {
        addConsumerTerms();
        addProductionTerms();
        addRetrofitTerms();
        addDistributionTerms();
        addConversionTerms();
        addSubsidyTerm();
        builders.forEach((term, builder) -> model.setObjectiveTerm(term, builder.build()));
    }

    private void addConsumerTerms() {
        for (ConsumerNode consumer : sets.getConsumers()) {
            H2Variable consH = model.getVariable(H2VariableType.CONS_H, consumer.getId());
            term(ObjectiveTerm.CONSUMPTION_UTILITY).addTerm(consH, parameters.get(H2Attribute.BREAKEVEN_PRICE, consumer));
            term(ObjectiveTerm.AVOIDED_CARBON_TAX).addTerm(consH,
                    parameters.get(H2Attribute.AVOIDED_EMISSIONS, consumer) * settings.getCarbonPrice());
        }
    }

    private void addProductionTerms() {
        double dailyCapitalCostFactor = parameters.getDailyCapitalCostFactor();
        for (ProducerNode producer : sets.getProducers()) {
            H2Variable prodH = model.getVariable(H2VariableType.PROD_H, producer.getId());
            term(ObjectiveTerm.PRODUCTION_VARIABLE).addTerm(prodH, parameters.get(H2Attribute.VARIABLE_COST, producer));
            term(ObjectiveTerm.PRODUCTION_ELECTRICITY).addTerm(prodH, parameters.get(H2Attribute.ELECTRICITY_COST, producer));
            term(ObjectiveTerm.PRODUCTION_NATURAL_GAS).addTerm(prodH, parameters.get(H2Attribute.NATURAL_GAS_COST, producer));
            term(ObjectiveTerm.PRODUCTION_CAPITAL).addTerm(model.getVariable(H2VariableType.PROD_CAPACITY, producer.getId()),
                    parameters.get(H2Attribute.CAPITAL_COST, producer) * dailyCapitalCostFactor);
            term(ObjectiveTerm.CARBON_TAX).addTerm(prodH, parameters.get(H2Attribute.CO2_EMISSIONS_RATE, producer) * settings.getCarbonPrice());
        }
        for (ProducerNode producer : sets.getNewProducers()) {
            term(ObjectiveTerm.H2_TAX_CREDIT).addTerm(model.getVariable(H2VariableType.PROD_H, producer.getId()),
                    parameters.get(H2Attribute.H2_TAX_CREDIT, producer));
        }
        for (ProducerNode producer : sets.getNewThermalProducers()) {
            term(ObjectiveTerm.CARBON_CAPTURE_CREDIT).addTerm(model.getVariable(H2VariableType.PROD_H, producer.getId()),
                    settings.getBaseSmrCo2PerH2() * parameters.get(H2Attribute.CCS_CAPTURE_RATE, producer) * settings.getCarbonCaptureCredit());
        }
    }

    private void addRetrofitTerms() {
        for (ProducerNode producer : sets.getExistingProducers()) {
            for (CcsTechnology ccs : sets.getCcsTechnologies()) {
                H2Variable captured = model.getVariable(H2VariableType.CCS_CO2_CAPTURED, producer.getId(), ccs.getName());
                H2Variable ccsH = model.getVariable(H2VariableType.CCS_CAPACITY_H2, producer.getId(), ccs.getName());
                term(ObjectiveTerm.CARBON_CAPTURE_CREDIT).addTerm(captured, settings.getCarbonCaptureCredit());
                term(ObjectiveTerm.H2_TAX_CREDIT).addTerm(ccsH, ccs.getH2TaxCredit());
                term(ObjectiveTerm.CCS_VARIABLE).addTerm(captured, ccs.getVariableCost());
                // captured CO2 is not taxed
                term(ObjectiveTerm.CARBON_TAX).addTerm(captured, -settings.getCarbonPrice());
            }
        }
    }

    private void addDistributionTerms() {
        double dailyCapitalCostFactor = parameters.getDailyCapitalCostFactor();
        for (H2Arc arc : sets.getDistributionArcs()) {
            term(ObjectiveTerm.DISTRIBUTION_VARIABLE).addTerm(model.getVariable(H2VariableType.DIST_H, arc.getId()),
                    parameters.get(H2Attribute.VARIABLE_COST, arc));
            term(ObjectiveTerm.DISTRIBUTION_CAPITAL).addTerm(model.getVariable(H2VariableType.DIST_CAPACITY, arc.getId()),
                    parameters.get(H2Attribute.CAPITAL_COST, arc) * dailyCapitalCostFactor);
        }
    }

    private void addConversionTerms() {
        double dailyCapitalCostFactor = parameters.getDailyCapitalCostFactor();
        for (ConverterNode converter : sets.getConverters()) {
            H2Variable capacity = model.getVariable(H2VariableType.CONV_CAPACITY, converter.getId());
            double utilization = parameters.get(H2Attribute.UTILIZATION, converter);
            term(ObjectiveTerm.CONVERSION_VARIABLE).addTerm(capacity, utilization * parameters.get(H2Attribute.VARIABLE_COST, converter));
            term(ObjectiveTerm.CONVERSION_ELECTRICITY).addTerm(capacity, utilization * parameters.get(H2Attribute.ELECTRICITY_COST, converter));
            term(ObjectiveTerm.CONVERSION_CAPITAL).addTerm(capacity, parameters.get(H2Attribute.CAPITAL_COST, converter) * dailyCapitalCostFactor);
        }
    }

    private void addSubsidyTerm() {
        if (settings.getSubsidyBudget() <= 0) {
            return;
        }
        double dailyCapitalCostFactor = parameters.getDailyCapitalCostFactor();
        for (ConverterNode dispenser : sets.getFuelDispensers()) {
            term(ObjectiveTerm.FUEL_STATION_SUBSIDY).addTerm(model.getVariable(H2VariableType.FUEL_STATION_SUBSIDY, dispenser.getId()),
                    dailyCapitalCostFactor);
        }
    }
}
