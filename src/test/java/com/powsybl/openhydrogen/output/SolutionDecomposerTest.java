/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openhydrogen.input.DemandCategory;
import com.powsybl.openhydrogen.input.H2InputTables;
import com.powsybl.openhydrogen.model.H2ModelCompiler;
import com.powsybl.openhydrogen.model.H2ModelParameters;
import com.powsybl.openhydrogen.model.H2OptimizationModel;
import com.powsybl.openhydrogen.model.H2VariableType;
import com.powsybl.openhydrogen.network.H2ArcType;
import com.powsybl.openhydrogen.network.H2Network;
import com.powsybl.openhydrogen.network.H2NetworkBuilder;
import com.powsybl.openhydrogen.network.H2NetworkParameters;
import com.powsybl.openhydrogen.solver.H2Solution;
import com.powsybl.openhydrogen.solver.H2SolverStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.powsybl.openhydrogen.input.H2InputTablesFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class SolutionDecomposerTest {

    private static final double DELTA = 1e-9;

    private H2OptimizationModel model;

    private Map<String, Double> values;

    @BeforeEach
    void setUp() {
        H2NetworkParameters networkParameters = new H2NetworkParameters()
                .setFindPrices(true)
                .setPriceTrackingStart(4)
                .setPriceTrackingStop(6)
                .setPriceTrackingStep(1)
                .setPriceHubs(List.of("B"));
        H2Network network = new H2NetworkBuilder(networkParameters).synthesize(createTwoHubPipeline());
        model = new H2ModelCompiler().compile(network, new H2ModelParameters());

        values = new HashMap<>();
        set(H2VariableType.PROD_EXISTS, "A_production_smr", 1);
        set(H2VariableType.PROD_CAPACITY, "A_production_smr", 21);
        set(H2VariableType.PROD_H, "A_production_smr", 20.3);
        set(H2VariableType.CONS_H, "B_demandSector_refinery", 20);
        setArc("A_production_smr -> A_center_highPurity", 20.3, 1);
        setArc("A_center_highPurity -> A_dist_pipelineHighPurity", 20.3, 1);
        setArc("A_dist_pipelineHighPurity -> B_dist_pipelineHighPurity", 20.3, 1);
        setArc("B_dist_pipelineHighPurity -> B_demand_highPurity", 20.1, 1);
        setArc("B_dist_pipelineHighPurity -> B_demand_fuelStation", 0.2, 1);
        setArc("B_demand_highPurity -> B_demandSector_refinery", 20, 1);
        // below tolerance
        setArc("A_dist_pipelineLowPurity -> B_dist_pipelineLowPurity", 1e-4, 0);
        // probes buying their whole demand, except the partially served low purity one
        setProbe("B_demand_highPurity", "B_priceHighPurity_5", 0.1);
        setProbe("B_demand_fuelStation", "B_priceFuelStation_4", 0.1);
        setProbe("B_demand_fuelStation", "B_priceFuelStation_5", 0.1);
        setProbe("B_demand_lowPurity", "B_priceLowPurity_5", 0.05);
    }

    private void set(H2VariableType type, String elementId, double value) {
        values.put(model.getVariable(type, elementId).getName(), value);
    }

    private void setArc(String arcId, double flow, double capacity) {
        set(H2VariableType.DIST_H, arcId, flow);
        set(H2VariableType.DIST_CAPACITY, arcId, capacity);
    }

    private void setProbe(String demandId, String probeId, double consumption) {
        set(H2VariableType.DIST_H, demandId + " -> " + probeId, consumption);
        set(H2VariableType.CONS_H, probeId, consumption);
    }

    private static <R extends TableRow> R getRow(List<R> rows, String id) {
        return rows.stream().filter(r -> r.getId().equals(id)).findFirst()
                .orElseThrow(() -> new AssertionError("Row " + id + " not found"));
    }

    @Test
    void testDecompose() {
        OutputTables tables = new SolutionDecomposer().decompose(new H2Solution(H2SolverStatus.OPTIMAL, 1234, values), model);

        assertEquals(List.of("A", "B"), tables.getHubs());
        assertEquals(1, tables.getProduction().size());
        ProductionRecord production = tables.getProduction().get(0);
        assertEquals("A_production_smr", production.producer());
        assertEquals("A", production.hub());
        assertEquals("smr", production.technology());
        assertFalse(production.existing());
        assertEquals(21, production.capacity(), DELTA);
        assertEquals(20.3, production.output(), DELTA);
        assertEquals(9 * 20.3, production.co2Emitted(), 1e-6);
        assertEquals(0, production.co2Captured(), DELTA);
        assertNull(production.ccsTechnology());
        double dailyFactor = model.getParameters().getDailyCapitalCostFactor();
        assertEquals(21 * 1000 * dailyFactor + 20.3 * 500, production.totalCost(), 1e-6);

        assertTrue(tables.getConversion().isEmpty());

        // the refinery and the cheapest fully served probe of each category
        assertEquals(3, tables.getConsumption().size());
        ConsumptionRecord refinery = getRow(tables.getConsumption(), "B_demandSector_refinery");
        assertFalse(refinery.priceProbe());
        assertEquals("refinery", refinery.sector());
        assertEquals(20, refinery.consumption(), DELTA);
        assertEquals(5000, refinery.price(), DELTA);
        ConsumptionRecord fuelStationProbe = getRow(tables.getConsumption(), "B_priceFuelStation_4");
        assertTrue(fuelStationProbe.priceProbe());
        assertEquals("fuelStation", fuelStationProbe.sector());
        getRow(tables.getConsumption(), "B_priceHighPurity_5");

        assertEquals(2, tables.getPrices().size());
        assertEquals(new DiscoveredPrice("B", DemandCategory.FUEL_STATION, 4000, "B_priceFuelStation_4"), tables.getPrices().get(0));
        assertEquals(new DiscoveredPrice("B", DemandCategory.HIGH_PURITY, 5000, "B_priceHighPurity_5"), tables.getPrices().get(1));

        // probe links are not distribution arcs
        assertEquals(6, tables.getDistribution().size());
        DistributionRecord pipeline = getRow(tables.getDistribution(), "A_dist_pipelineHighPurity -> B_dist_pipelineHighPurity");
        assertEquals(H2ArcType.PIPELINE, pipeline.arcType());
        assertEquals("pipeline", pipeline.technology());
        assertEquals(1, pipeline.capacity(), DELTA);
        assertEquals(1000, pipeline.capitalCost(), DELTA);
        assertEquals(20.3, pipeline.flow(), DELTA);
        assertFalse(pipeline.isLocal());
        assertTrue(tables.getDistribution().stream().noneMatch(r -> r.arcType() == H2ArcType.PRICE_PROBE_LINK));

        assertEquals(1234, tables.getSummaryValue(SolutionDecomposer.OBJECTIVE), DELTA);
        assertEquals(20.3, tables.getSummaryValue(SolutionDecomposer.TOTAL_PRODUCTION), DELTA);
        assertEquals(20, tables.getSummaryValue(SolutionDecomposer.TOTAL_CONSUMPTION), DELTA);
        assertEquals(20 * 5000 + 0.1 * 5000 + 0.1 * 4000 + 0.1 * 5000 + 0.05 * 5000, tables.getSummaryValue("consumptionUtility"), 1e-6);
        assertEquals(20.3 * 500, tables.getSummaryValue("productionVariableCost"), 1e-6);
        assertEquals(SolutionDecomposer.OBJECTIVE, tables.getSummary().keySet().iterator().next());
    }

    @Test
    void testTolerance() {
        DecomposerParameters parameters = new DecomposerParameters().setTolerance(0.5);
        OutputTables tables = new SolutionDecomposer(parameters).decompose(new H2Solution(H2SolverStatus.OPTIMAL, 0, values), model);
        assertEquals(5, tables.getDistribution().size());
        assertTrue(tables.getDistribution().stream().noneMatch(r -> r.getId().equals("B_dist_pipelineHighPurity -> B_demand_fuelStation")));

        parameters.setTolerance(50);
        tables = new SolutionDecomposer(parameters).decompose(new H2Solution(H2SolverStatus.OPTIMAL, 0, values), model);
        assertTrue(tables.getProduction().isEmpty());
        assertTrue(tables.getDistribution().isEmpty());
        // price setters are kept whatever their size
        assertEquals(2, tables.getConsumption().size());
        assertEquals(0, tables.getSummaryValue(SolutionDecomposer.TOTAL_CONSUMPTION), DELTA);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parameters.setTolerance(-1));
        assertEquals("Tolerance must be positive or zero", e.getMessage());
    }

    @Test
    void testFailedSolution() {
        SolutionDecomposer decomposer = new SolutionDecomposer();
        H2Solution solution = H2Solution.failed(H2SolverStatus.INFEASIBLE);
        PowsyblException e = assertThrows(PowsyblException.class, () -> decomposer.decompose(solution, model));
        assertEquals("Cannot decompose a solution with status INFEASIBLE", e.getMessage());
    }

    @Test
    void testPerSite() {
        OutputTables tables = new SolutionDecomposer().decompose(new H2Solution(H2SolverStatus.OPTIMAL, 0, values), model);

        HubReport a = SolutionDecomposer.perSite(tables, "A");
        assertEquals(Set.of("production_smr"), a.production().keySet());
        assertTrue(a.consumption().isEmpty());
        assertEquals(Set.of("production_smr_TO_center_highPurity", "center_highPurity_TO_dist_pipelineHighPurity"),
                a.localDistribution().keySet());
        assertEquals(Set.of("dist_pipelineHighPurity_TO_B_dist_pipelineHighPurity"), a.outgoingDistribution().keySet());
        assertTrue(a.incomingDistribution().isEmpty());
        assertEquals(20.3, a.production().get("production_smr").get("prod_h"));

        HubReport b = SolutionDecomposer.perSite(tables, "B");
        assertTrue(b.production().isEmpty());
        assertEquals(Set.of("demandSector_refinery", "priceFuelStation_4", "priceHighPurity_5"), b.consumption().keySet());
        assertEquals(Set.of("A_dist_pipelineHighPurity_TO_dist_pipelineHighPurity"), b.incomingDistribution().keySet());
        assertEquals(3, b.localDistribution().size());
        assertTrue(b.outgoingDistribution().isEmpty());

        // every row lands in exactly one site, and splitting twice gives the same result
        Map<String, HubReport> reports = SolutionDecomposer.perSite(tables);
        assertEquals(List.of("A", "B"), List.copyOf(reports.keySet()));
        assertEquals(tables.getProduction().size(), reports.values().stream().mapToInt(r -> r.production().size()).sum());
        assertEquals(tables.getConsumption().size(), reports.values().stream().mapToInt(r -> r.consumption().size()).sum());
        assertEquals(tables.getDistribution().size(), reports.values().stream()
                .mapToInt(r -> r.localDistribution().size() + r.outgoingDistribution().size()).sum());
        assertEquals(b, SolutionDecomposer.perSite(tables, "B"));
        assertEquals(b.toMap(), reports.get("B").toMap());
    }

    @Test
    void testRetrofitMerge() {
        H2InputTables inputTables = createExistingProducerWithCcs();
        H2Network network = new H2NetworkBuilder(new H2NetworkParameters()).synthesize(inputTables);
        H2OptimizationModel ccsModel = new H2ModelCompiler().compile(network, inputTables.getCcsTechnologies(),
                new H2ModelParameters().setCarbonPrice(50));
        String producerId = "A_production_smrExisting";
        Map<String, Double> ccsValues = new HashMap<>();
        ccsValues.put(ccsModel.getVariable(H2VariableType.PROD_EXISTS, producerId).getName(), 1.0);
        ccsValues.put(ccsModel.getVariable(H2VariableType.PROD_CAPACITY, producerId).getName(), 100.0);
        ccsValues.put(ccsModel.getVariable(H2VariableType.PROD_H, producerId).getName(), 50.0);
        ccsValues.put(ccsModel.getVariable(H2VariableType.CCS_BUILT, producerId, CCS).getName(), 1.0);
        ccsValues.put(ccsModel.getVariable(H2VariableType.CCS_CAPACITY_H2, producerId, CCS).getName(), 50.0);
        ccsValues.put(ccsModel.getVariable(H2VariableType.CCS_CO2_CAPTURED, producerId, CCS).getName(), 405.0);
        ccsValues.put(ccsModel.getVariable(H2VariableType.CCS_CHECS, producerId, CCS).getName(), 45.0);

        OutputTables tables = new SolutionDecomposer().decompose(new H2Solution(H2SolverStatus.OPTIMAL, 0, ccsValues), ccsModel);

        assertEquals(1, tables.getProduction().size());
        ProductionRecord row = tables.getProduction().get(0);
        assertTrue(row.existing());
        assertEquals(CCS, row.ccsTechnology());
        assertEquals(405, row.co2Captured(), DELTA);
        assertEquals(45, row.checs(), DELTA);
        assertEquals(0.9, row.ccsCaptureRate(), DELTA);
        assertEquals(0.9, row.checPerTon(), DELTA);
        assertEquals(0.9, row.co2EmissionsRate(), 1e-9);
        assertEquals(45, row.co2Emitted(), 1e-9);
        assertEquals(2250, row.carbonTax(), 1e-6);
        assertEquals(4050, row.ccsRetrofitVariableCost(), DELTA);
        assertEquals(100, row.h2TaxCredit(), DELTA);
        assertEquals(50 * 300 + 4050 + 2250 - 50 * 100, row.totalCost(), 1e-6);
        assertEquals(CCS, row.toMap().get("ccs_technology"));
        assertEquals(ProductionRecord.COLUMNS, List.copyOf(row.toMap().keySet()));

        // without retrofit the producer keeps its own emissions
        ccsValues.put(ccsModel.getVariable(H2VariableType.CCS_BUILT, producerId, CCS).getName(), 0.0);
        ProductionRecord noRetrofit = new SolutionDecomposer().decompose(new H2Solution(H2SolverStatus.OPTIMAL, 0, ccsValues), ccsModel)
                .getProduction().get(0);
        assertNull(noRetrofit.ccsTechnology());
        assertEquals("", noRetrofit.toMap().get("ccs_technology"));
        assertEquals(450, noRetrofit.co2Emitted(), DELTA);
        assertEquals(0, noRetrofit.co2Captured(), DELTA);
    }
}
