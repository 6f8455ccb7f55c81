/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import com.powsybl.openhydrogen.input.CcsTechnology;
import com.powsybl.openhydrogen.input.ConversionTechnology;
import com.powsybl.openhydrogen.input.H2InputTables;
import com.powsybl.openhydrogen.model.constraints.CcsMutualExclusivityConstraints;
import com.powsybl.openhydrogen.model.constraints.MassConservationConstraints;
import com.powsybl.openhydrogen.network.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.powsybl.openhydrogen.input.H2InputTablesFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class H2ModelCompilerTest {

    private static final double DELTA = 1e-9;

    private static H2Network synthesize(H2InputTables tables) {
        return new H2NetworkBuilder(new H2NetworkParameters()).synthesize(tables);
    }

    private static H2Constraint getConstraint(H2OptimizationModel model, String name) {
        return model.findConstraint(name).orElseThrow(() -> new AssertionError("Constraint " + name + " not found"));
    }

    @Test
    void testTwoHubPipeline() {
        H2Network network = synthesize(createTwoHubPipeline());
        H2OptimizationModel model = new H2ModelCompiler().compile(network, new H2ModelParameters());

        ModelSets sets = model.getSets();
        assertEquals(1, sets.getProducers().size());
        assertEquals(1, sets.getNewThermalProducers().size());
        assertTrue(sets.getExistingProducers().isEmpty());
        assertEquals(1, sets.getConsumers().size());
        assertEquals(24, sets.getDistributionArcs().size());
        assertEquals(1, sets.getConsumerArcs().size());
        assertTrue(sets.getTruckDepots().isEmpty());

        assertEquals(54, model.getVariables().size());
        assertEquals(24, model.getVariables().getVariables(H2VariableType.DIST_CAPACITY).size());
        assertEquals(47, model.getConstraints().size());
        assertEquals(16, model.getConstraints(H2ConstraintType.FLOW_BALANCE).size());
        assertEquals(24, model.getConstraints(H2ConstraintType.FLOW_CAPACITY).size());
        assertTrue(model.getConstraints(H2ConstraintType.ONLY_ONE_CCS).isEmpty());
        assertTrue(model.getConstraints(H2ConstraintType.SUBSIDY_BUDGET).isEmpty());

        H2Variable prodExists = model.getVariable(H2VariableType.PROD_EXISTS, "A_production_smr");
        H2Variable prodCapacity = model.getVariable(H2VariableType.PROD_CAPACITY, "A_production_smr");
        H2Constraint maxProduction = getConstraint(model, "maxProduction[A_production_smr]");
        assertEquals(1, maxProduction.getExpression().getCoefficient(prodCapacity));
        assertEquals(-50, maxProduction.getExpression().getCoefficient(prodExists));
        assertEquals(0, maxProduction.getUpperBound());

        String pipelineId = "A_dist_pipelineHighPurity -> B_dist_pipelineHighPurity";
        H2Constraint flowCapacity = getConstraint(model, "flowCapacity[" + pipelineId + "]");
        assertEquals(-1000, flowCapacity.getExpression().getCoefficient(model.getVariable(H2VariableType.DIST_CAPACITY, pipelineId)));

        // the producer injects its production in the center
        H2Constraint producerBalance = getConstraint(model, "flowBalance[A_production_smr]");
        assertEquals(1, producerBalance.getExpression().getCoefficient(model.getVariable(H2VariableType.PROD_H, "A_production_smr")));
        assertEquals(-1, producerBalance.getExpression().getCoefficient(
                model.getVariable(H2VariableType.DIST_H, "A_production_smr -> A_center_highPurity")));
        H2Constraint consumerBalance = getConstraint(model, "flowBalance[B_demandSector_refinery]");
        assertEquals(-1, consumerBalance.getExpression().getCoefficient(model.getVariable(H2VariableType.CONS_H, "B_demandSector_refinery")));

        assertEquals(20, getConstraint(model, "consumerSize[B_demandSector_refinery]").getUpperBound());
    }

    @Test
    void testObjective() {
        H2Network network = synthesize(createTwoHubPipeline());
        H2ModelParameters parameters = new H2ModelParameters().setCarbonPrice(50);
        H2OptimizationModel model = new H2ModelCompiler().compile(network, parameters);

        H2Variable consH = model.getVariable(H2VariableType.CONS_H, "B_demandSector_refinery");
        H2Variable prodH = model.getVariable(H2VariableType.PROD_H, "A_production_smr");
        H2Variable prodCapacity = model.getVariable(H2VariableType.PROD_CAPACITY, "A_production_smr");
        String pipelineId = "A_dist_pipelineHighPurity -> B_dist_pipelineHighPurity";
        H2Variable pipelineCapacity = model.getVariable(H2VariableType.DIST_CAPACITY, pipelineId);
        H2Variable pipelineFlow = model.getVariable(H2VariableType.DIST_H, pipelineId);
        double dailyFactor = model.getParameters().getDailyCapitalCostFactor();

        assertEquals(5000, model.getObjectiveTerm(ObjectiveTerm.CONSUMPTION_UTILITY).getCoefficient(consH), DELTA);
        assertEquals(450, model.getObjectiveTerm(ObjectiveTerm.CARBON_TAX).getCoefficient(prodH), DELTA);
        assertEquals(1000 * dailyFactor, model.getObjectiveTerm(ObjectiveTerm.PRODUCTION_CAPITAL).getCoefficient(prodCapacity), DELTA);
        assertTrue(model.getObjectiveTerm(ObjectiveTerm.FUEL_STATION_SUBSIDY).isEmpty());

        LinearExpression objective = model.getObjective();
        assertEquals(5000, objective.getCoefficient(consH), DELTA);
        assertEquals(-500 - 450, objective.getCoefficient(prodH), DELTA);
        assertEquals(-1000 * dailyFactor, objective.getCoefficient(pipelineCapacity), DELTA);
        assertEquals(-10, objective.getCoefficient(pipelineFlow), 1e-6);

        Map<ObjectiveTerm, Double> values = model.evaluateObjectiveTerms(v -> v.equals(prodH) || v.equals(consH) ? 20 : 0);
        assertEquals(100000, values.get(ObjectiveTerm.CONSUMPTION_UTILITY), DELTA);
        assertEquals(10000, values.get(ObjectiveTerm.PRODUCTION_VARIABLE), DELTA);
        assertEquals(9000, values.get(ObjectiveTerm.CARBON_TAX), DELTA);
    }

    @Test
    void testExistingProducerWithCcs() {
        H2InputTables tables = createExistingProducerWithCcs();
        H2Network network = synthesize(tables);
        H2OptimizationModel model = new H2ModelCompiler().compile(network, tables.getCcsTechnologies(),
                new H2ModelParameters().setCarbonPrice(50).setCarbonCaptureCredit(20));

        assertEquals(32, model.getVariables().size());
        assertEquals(34, model.getConstraints().size());

        String producerId = "A_production_smrExisting";
        H2Variable built = model.getVariable(H2VariableType.CCS_BUILT, producerId, CCS);
        H2Variable ccsH = model.getVariable(H2VariableType.CCS_CAPACITY_H2, producerId, CCS);
        H2Variable captured = model.getVariable(H2VariableType.CCS_CO2_CAPTURED, producerId, CCS);
        H2Variable prodH = model.getVariable(H2VariableType.PROD_H, producerId);
        String retrofitId = producerId + "," + CCS;

        assertEquals(100, getConstraint(model, "existingProducerCapacity[" + producerId + "]").getLowerBound());
        assertEquals(1, getConstraint(model, "existingProducerExists[" + producerId + "]").getUpperBound());
        assertEquals(1, getConstraint(model, "onlyOneCCS[" + producerId + "]").getUpperBound());
        assertEquals(1, getConstraint(model, "ccsEligibility[" + retrofitId + "]").getUpperBound());
        assertEquals(-8.1, getConstraint(model, "ccsCapture[" + retrofitId + "]").getExpression().getCoefficient(ccsH), DELTA);
        assertEquals(-0.9, getConstraint(model, "ccsChecs[" + retrofitId + "]").getExpression().getCoefficient(ccsH), DELTA);

        H2Constraint ifBuilt = getConstraint(model, "ccsThroughputIfBuilt[" + retrofitId + "]");
        assertEquals(-100, ifBuilt.getExpression().getCoefficient(built));
        H2Constraint mustBuildAll = getConstraint(model, "ccsMustBuildAll[" + retrofitId + "]");
        assertEquals(-100, mustBuildAll.getLowerBound());
        assertEquals(-1, mustBuildAll.getExpression().getCoefficient(prodH));

        // built retrofit: the whole output goes through the capture unit
        assertTrue(mustBuildAll.isSatisfied(v -> v.equals(built) ? 1 : v.equals(ccsH) || v.equals(prodH) ? 80 : 0, 1e-9));
        assertFalse(mustBuildAll.isSatisfied(v -> v.equals(built) ? 1 : v.equals(prodH) ? 80 : v.equals(ccsH) ? 40 : 0, 1e-9));
        assertTrue(mustBuildAll.isSatisfied(v -> v.equals(prodH) ? 80 : 0, 1e-9));
        assertFalse(ifBuilt.isSatisfied(v -> v.equals(ccsH) ? 1 : 0, 1e-9));

        // all producers are covered by the credit accounting, existing ones generate none
        H2Constraint productionChecs = getConstraint(model, "productionChecs[" + producerId + "]");
        assertEquals(0, productionChecs.getExpression().getCoefficient(prodH));
        H2Constraint balance = getConstraint(model, "checBalance[network]");
        assertEquals(-1, balance.getExpression().getCoefficient(model.getVariable(H2VariableType.CCS_CHECS, producerId, CCS)));
        assertEquals(1, balance.getExpression().getCoefficient(model.getVariable(H2VariableType.CONS_CHECS, "A_demandSector_refinery")));

        assertEquals(20, model.getObjectiveTerm(ObjectiveTerm.CARBON_CAPTURE_CREDIT).getCoefficient(captured), DELTA);
        assertEquals(10, model.getObjectiveTerm(ObjectiveTerm.CCS_VARIABLE).getCoefficient(captured), DELTA);
        assertEquals(100, model.getObjectiveTerm(ObjectiveTerm.H2_TAX_CREDIT).getCoefficient(ccsH), DELTA);
        assertEquals(-50, model.getObjectiveTerm(ObjectiveTerm.CARBON_TAX).getCoefficient(captured), DELTA);
        assertEquals(450, model.getObjectiveTerm(ObjectiveTerm.CARBON_TAX).getCoefficient(prodH), DELTA);
    }

    @Test
    void testIneligibleRetrofit() {
        H2InputTables tables = createExistingProducerWithCcs();
        tables.addCcsTechnology(new CcsTechnology("ccs2", 0.5));
        H2OptimizationModel model = new H2ModelCompiler().compile(synthesize(tables), tables.getCcsTechnologies(),
                new H2ModelParameters().setFractionalChec(false));

        H2Constraint onlyOne = getConstraint(model, "onlyOneCCS[A_production_smrExisting]");
        assertEquals(2, onlyOne.getExpression().getTerms().size());
        assertEquals(0, getConstraint(model, "ccsEligibility[A_production_smrExisting,ccs2]").getUpperBound());
        H2Variable ccsH = model.getVariable(H2VariableType.CCS_CAPACITY_H2, "A_production_smrExisting", "ccs2");
        assertEquals(-1, getConstraint(model, "ccsChecs[A_production_smrExisting,ccs2]").getExpression().getCoefficient(ccsH));
    }

    @Test
    void testTruckFleetConsistency() {
        H2OptimizationModel model = new H2ModelCompiler().compile(synthesize(createTwoHubTruck()), new H2ModelParameters());
        assertEquals(2, model.getSets().getTruckDepots().size());
        assertEquals(2, model.getSets().getConsumers().size());

        H2Constraint consistency = getConstraint(model, "truckConsistency[A_dist_truckCompressed]");
        LinearExpression expression = consistency.getExpression();
        assertEquals(5, expression.getTerms().size());
        assertEquals(1, expression.getCoefficient(model.getVariable(H2VariableType.DIST_CAPACITY, "A_center_highPurity -> A_dist_truckCompressed")));
        assertEquals(-1, expression.getCoefficient(model.getVariable(H2VariableType.DIST_CAPACITY, "A_dist_truckCompressed -> B_dist_truckCompressed")));
        assertEquals(-1, expression.getCoefficient(model.getVariable(H2VariableType.DIST_CAPACITY, "A_dist_truckCompressed -> A_demand_fuelStation")));
        assertEquals(0, expression.getCoefficient(model.getVariable(H2VariableType.DIST_CAPACITY, "B_dist_truckCompressed -> A_dist_truckCompressed")));
        assertEquals(0, consistency.getLowerBound());
        assertEquals(0, consistency.getUpperBound());

        H2Variable sensitive = model.getVariable(H2VariableType.CONS_H, "B_demandSector_fuelCell_carbonSensitive");
        assertEquals(-1, getConstraint(model, "consumerChecs[B_demandSector_fuelCell_carbonSensitive]").getExpression().getCoefficient(sensitive));
        H2Variable regular = model.getVariable(H2VariableType.CONS_H, "B_demandSector_fuelCell");
        assertEquals(0, getConstraint(model, "consumerChecs[B_demandSector_fuelCell]").getExpression().getCoefficient(regular));
    }

    @Test
    void testFuelStationSubsidy() {
        H2InputTables tables = createTwoHubTruck()
                .addConversionTechnology(new ConversionTechnology("fuelDispenser", "dist_truckCompressed", "demand_fuelStation")
                        .setCapitalCost(1000));
        H2Network network = synthesize(tables);
        H2ModelParameters parameters = new H2ModelParameters()
                .setSubsidyCostShareFraction(0.5)
                .setSubsidyBudget(2);
        H2OptimizationModel model = new H2ModelCompiler().compile(network, parameters);

        assertEquals(2, model.getSets().getFuelDispensers().size());
        H2Variable subsidy = model.getVariable(H2VariableType.FUEL_STATION_SUBSIDY, "B_converter_fuelDispenser");
        H2Variable capacity = model.getVariable(H2VariableType.CONV_CAPACITY, "B_converter_fuelDispenser");
        H2Constraint definition = getConstraint(model, "fuelStationSubsidy[B_converter_fuelDispenser]");
        assertEquals(1, definition.getExpression().getCoefficient(subsidy));
        assertEquals(-500, definition.getExpression().getCoefficient(capacity), DELTA);
        assertEquals(-1000, getConstraint(model, "fuelStationSubsidy[A_converter_fuelDispenser]").getExpression()
                .getCoefficient(model.getVariable(H2VariableType.CONV_CAPACITY, "A_converter_fuelDispenser")), DELTA);

        H2Constraint budget = getConstraint(model, "subsidyBudget[network]");
        assertEquals(2e9, budget.getUpperBound(), DELTA);
        assertEquals(2, budget.getExpression().getTerms().size());
        assertEquals(model.getParameters().getDailyCapitalCostFactor(),
                model.getObjectiveTerm(ObjectiveTerm.FUEL_STATION_SUBSIDY).getCoefficient(subsidy), DELTA);

        // without budget the subsidy is still defined but neither bounded nor credited
        H2OptimizationModel noBudgetModel = new H2ModelCompiler().compile(network, new H2ModelParameters());
        assertTrue(noBudgetModel.findConstraint("fuelStationSubsidy[B_converter_fuelDispenser]").isPresent());
        assertTrue(noBudgetModel.findConstraint("subsidyBudget[network]").isEmpty());
        assertTrue(noBudgetModel.getObjectiveTerm(ObjectiveTerm.FUEL_STATION_SUBSIDY).isEmpty());
    }

    @Test
    void testCustomConstraintFamilies() {
        H2ModelCompiler compiler = new H2ModelCompiler(List.of(new MassConservationConstraints(), new CcsMutualExclusivityConstraints()));
        H2OptimizationModel model = compiler.compile(synthesize(createTwoHubPipeline()), new H2ModelParameters());
        assertEquals(16, model.getConstraints().size());
        assertEquals(11, H2ModelCompiler.createDefaultConstraintFamilies().size());
        assertEquals(2, compiler.getConstraintFamilies().size());
    }

    @Test
    void testErrors() {
        H2Network network = new H2Network("unfrozen");
        H2ModelCompiler compiler = new H2ModelCompiler();
        H2ModelParameters parameters = new H2ModelParameters();
        H2ModelException e = assertThrows(H2ModelException.class, () -> compiler.compile(network, parameters));
        assertEquals("Network 'unfrozen' has to be frozen before compilation", e.getMessage());

        H2OptimizationModel model = compiler.compile(synthesize(createTwoHubPipeline()), parameters);
        e = assertThrows(H2ModelException.class, () -> model.getVariable(H2VariableType.PROD_H, "B_demandSector_refinery"));
        assertEquals("Element 'B_demandSector_refinery' is not in the domain of variable prod_h", e.getMessage());

        H2Constraint duplicate = model.getConstraints().get(0);
        e = assertThrows(H2ModelException.class, () -> model.addConstraint(duplicate));
        assertEquals("Constraint " + duplicate.getName() + " already exists", e.getMessage());

        H2Node foreignNode = synthesize(createTwoHubPipeline()).getNodeById("A_production_smr");
        e = assertThrows(H2ModelException.class, () -> model.getParameters().get(H2Attribute.CAPITAL_COST, foreignNode));
        assertEquals("Element 'A_production_smr' does not belong to network 'h2-network'", e.getMessage());

        e = assertThrows(H2ModelException.class, () -> model.getParameters().getCcsTechnology("ccs9"));
        assertEquals("CCS technology 'ccs9' is not part of the model", e.getMessage());
    }
}
