/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import com.powsybl.openhydrogen.input.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.openhydrogen.input.H2InputTablesFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class H2NetworkBuilderTest {

    private static final double DELTA = 1e-9;

    private static H2Network synthesize(H2InputTables tables) {
        return new H2NetworkBuilder(new H2NetworkParameters()).synthesize(tables);
    }

    private static H2Arc getArc(H2Network network, String startId, String endId) {
        H2Arc arc = network.getArcById(startId + " -> " + endId);
        assertNotNull(arc, "Arc " + startId + " -> " + endId + " not found");
        return arc;
    }

    @Test
    void testTwoHubPipeline() {
        H2Network network = synthesize(createTwoHubPipeline());
        assertEquals("h2-network", network.getId());
        assertTrue(network.isFrozen());
        assertEquals(List.of("A", "B"), network.getHubs());
        assertEquals(16, network.getNodeCount());
        assertEquals(24, network.getArcCount());

        for (String hub : List.of("A", "B")) {
            assertNotNull(network.getNodeById(hub + "_center_lowPurity"));
            assertNotNull(network.getNodeById(hub + "_center_highPurity"));
            assertNotNull(network.getNodeById(hub + "_demand_fuelStation"));
            assertNotNull(network.getNodeById(hub + "_demand_lowPurity"));
            assertNotNull(network.getNodeById(hub + "_demand_highPurity"));
            assertEquals(H2ArcType.PURIFICATION, getArc(network, hub + "_center_lowPurity", hub + "_center_highPurity").getType());
            assertEquals(H2ArcType.INTRA_HUB, getArc(network, hub + "_center_highPurity", hub + "_dist_pipelineHighPurity").getType());
            assertEquals(H2ArcType.INTRA_HUB_REVERSE, getArc(network, hub + "_dist_pipelineHighPurity", hub + "_center_highPurity").getType());
        }

        // low purity terminals only serve low purity demand
        assertNotNull(network.getArcById("A_dist_pipelineLowPurity -> A_demand_lowPurity"));
        assertNull(network.getArcById("A_dist_pipelineLowPurity -> A_demand_highPurity"));
        assertNull(network.getArcById("A_dist_pipelineLowPurity -> A_demand_fuelStation"));
        assertEquals(1000, getArc(network, "A_dist_pipelineHighPurity", "A_demand_fuelStation").getAttribute(H2Attribute.FLOW_LIMIT), DELTA);

        ProducerNode producer = (ProducerNode) network.getNodeById("A_production_smr");
        assertNotNull(producer);
        assertFalse(producer.isExisting());
        assertTrue(producer.isThermal());
        assertEquals(Purity.HIGH, producer.getPurity());
        assertEquals(50, producer.getAttribute(H2Attribute.MAX_SIZE), DELTA);
        assertEquals(9, producer.getAttribute(H2Attribute.CO2_EMISSIONS_RATE), DELTA);
        assertEquals(0, producer.getAttribute(H2Attribute.CHEC_PER_TON), DELTA);
        assertEquals(H2ArcType.FLOW_FROM_PRODUCER, getArc(network, "A_production_smr", "A_center_highPurity").getType());

        ConsumerNode consumer = (ConsumerNode) network.getNodeById("B_demandSector_refinery");
        assertNotNull(consumer);
        assertEquals("refinery", consumer.getSector());
        assertEquals("demandSector_refinery", consumer.getLocalId());
        assertEquals(20, consumer.getAttribute(H2Attribute.SIZE), DELTA);
        assertEquals(5000, consumer.getAttribute(H2Attribute.BREAKEVEN_PRICE), DELTA);
        assertNull(network.getNodeById("B_demandSector_refinery_carbonSensitive"));
        assertEquals(H2ArcType.FLOW_TO_DEMAND_SECTOR, getArc(network, "B_demand_highPurity", "B_demandSector_refinery").getType());
    }

    @Test
    void testPipelinesAreBidirectional() {
        H2Network network = synthesize(createTwoHubPipeline());
        for (String purity : List.of("LowPurity", "HighPurity")) {
            H2Arc forward = getArc(network, "A_dist_pipeline" + purity, "B_dist_pipeline" + purity);
            H2Arc backward = getArc(network, "B_dist_pipeline" + purity, "A_dist_pipeline" + purity);
            for (H2Arc arc : List.of(forward, backward)) {
                assertEquals(H2ArcType.PIPELINE, arc.getType());
                assertEquals("pipeline", arc.getTechnology().orElseThrow());
                assertFalse(arc.isExisting());
                assertEquals(1000, arc.getAttribute(H2Attribute.CAPITAL_COST), DELTA);
                assertEquals(10, arc.getAttribute(H2Attribute.VARIABLE_COST), 1e-6);
                assertEquals(100, arc.getAttribute(H2Attribute.LENGTH), DELTA);
                assertEquals(1000, arc.getAttribute(H2Attribute.FLOW_LIMIT), DELTA);
            }
        }
    }

    @Test
    void testExistingPipelineCarriesLowPurityOnly() {
        H2InputTables tables = new H2InputTables()
                .addHub(new Hub("A"))
                .addHub(new Hub("B"))
                .addDistributionTechnology(new DistributionTechnology(PIPELINE).setFlowLimit(10))
                .addHubConnection(new HubConnection("A", "B", 10, 12, true));
        H2Network network = synthesize(tables);
        assertTrue(getArc(network, "A_dist_pipelineLowPurity", "B_dist_pipelineLowPurity").isExisting());
        assertTrue(getArc(network, "B_dist_pipelineLowPurity", "A_dist_pipelineLowPurity").isExisting());
        assertFalse(getArc(network, "A_dist_pipelineHighPurity", "B_dist_pipelineHighPurity").isExisting());
    }

    @Test
    void testTwoHubTruck() {
        H2Network network = synthesize(createTwoHubTruck());

        H2Arc depotArc = getArc(network, "A_center_highPurity", "A_dist_truckCompressed");
        assertEquals(H2ArcType.HUB_TO_DEPOT, depotArc.getType());
        assertEquals(600000, depotArc.getAttribute(H2Attribute.CAPITAL_COST), DELTA);
        assertEquals(20, depotArc.getAttribute(H2Attribute.FIXED_COST), DELTA);
        assertEquals(5, depotArc.getAttribute(H2Attribute.FLOW_LIMIT), DELTA);
        assertEquals(300000, getArc(network, "B_center_highPurity", "B_dist_truckCompressed").getAttribute(H2Attribute.CAPITAL_COST), DELTA);

        H2Arc route = getArc(network, "A_dist_truckCompressed", "B_dist_truckCompressed");
        assertEquals(H2ArcType.TRUCK_ROUTE, route.getType());
        assertEquals(50, route.getAttribute(H2Attribute.VARIABLE_COST), DELTA);
        assertFalse(route.hasAttribute(H2Attribute.CAPITAL_COST));
        assertEquals(H2ArcType.TRUCK_ROUTE, getArc(network, "B_dist_truckCompressed", "A_dist_truckCompressed").getType());
        for (String demand : List.of("fuelStation", "lowPurity", "highPurity")) {
            assertEquals(H2ArcType.FLOW_TO_DEMAND, getArc(network, "B_dist_truckCompressed", "B_demand_" + demand).getType());
        }

        ConsumerNode consumer = (ConsumerNode) network.getNodeById("B_demandSector_fuelCell");
        ConsumerNode sensitiveConsumer = (ConsumerNode) network.getNodeById("B_demandSector_fuelCell_carbonSensitive");
        assertFalse(consumer.isCarbonSensitive());
        assertTrue(sensitiveConsumer.isCarbonSensitive());
        assertEquals(7.5, consumer.getAttribute(H2Attribute.SIZE), DELTA);
        assertEquals(2.5, sensitiveConsumer.getAttribute(H2Attribute.SIZE), DELTA);
        assertEquals(1, sensitiveConsumer.getAttribute(H2Attribute.CARBON_SENSITIVE), DELTA);
        assertEquals(6, sensitiveConsumer.getAttribute(H2Attribute.AVOIDED_EMISSIONS), 1e-9);

        ProducerNode electrolyzer = (ProducerNode) network.getNodeById("A_production_electrolyzer");
        assertFalse(electrolyzer.isThermal());
        assertEquals(4000, electrolyzer.getAttribute(H2Attribute.CAPITAL_COST), DELTA);
        assertEquals(0, electrolyzer.getAttribute(H2Attribute.CO2_EMISSIONS_RATE), DELTA);
        assertEquals(1, electrolyzer.getAttribute(H2Attribute.CHEC_PER_TON), DELTA);
    }

    @Test
    void testChecPerTonOfCleanerThermalProducer() {
        H2InputTables tables = createTwoHubPipeline();
        tables.getProductionTechnology(SMR).setCcsCaptureRate(0.5);

        ProducerNode producer = (ProducerNode) synthesize(tables).getNodeById("A_production_smr");
        assertEquals(4.5, producer.getAttribute(H2Attribute.CO2_EMISSIONS_RATE), DELTA);
        assertEquals(0.5, producer.getAttribute(H2Attribute.CHEC_PER_TON), DELTA);

        H2Network network = new H2NetworkBuilder(new H2NetworkParameters().setFractionalChec(false)).synthesize(tables);
        assertEquals(1, network.getNodeById("A_production_smr").getAttribute(H2Attribute.CHEC_PER_TON), DELTA);
    }

    @Test
    void testExistingProducer() {
        H2Network network = synthesize(createExistingProducerWithCcs());
        ProducerNode producer = (ProducerNode) network.getNodeById("A_production_smrExisting");
        assertNotNull(producer);
        assertTrue(producer.isExisting());
        assertTrue(producer.isCcsEligible(CCS));
        assertEquals(100, producer.getAttribute(H2Attribute.CAPACITY), DELTA);
        assertEquals(1, producer.getAttribute(H2Attribute.UTILIZATION), DELTA);
        assertEquals(300, producer.getAttribute(H2Attribute.VARIABLE_COST), DELTA);
        assertEquals(9, producer.getAttribute(H2Attribute.CO2_EMISSIONS_RATE), DELTA);
        assertEquals(H2ArcType.FLOW_FROM_PRODUCER, getArc(network, "A_production_smrExisting", "A_center_highPurity").getType());
    }

    @Test
    void testZeroDemandIsSkipped() {
        H2InputTables tables = createTwoHubPipeline();
        tables.getHub("A").setSectorDemand(REFINERY, 0);
        H2Network network = synthesize(tables);
        assertNull(network.getNodeById("A_demandSector_refinery"));
        assertNotNull(network.getNodeById("B_demandSector_refinery"));
    }

    @Test
    void testInvalidInputs() {
        H2InputTables missingRoad = createTwoHubPipeline()
                .addHub(new Hub("C"))
                .addHubConnection(new HubConnection("A", "C", 10, Double.NaN, false));
        H2InputException e = assertThrows(H2InputException.class, () -> synthesize(missingRoad));
        assertEquals("Road length of hub connection between 'A' and 'C' is missing", e.getMessage());

        H2InputTables duplicatedConnection = createTwoHubPipeline()
                .addHubConnection(new HubConnection("B", "A", 80, 100, false));
        e = assertThrows(H2InputException.class, () -> synthesize(duplicatedConnection));
        assertEquals("Hub connection between 'B' and 'A' is defined twice", e.getMessage());

        H2InputTables unknownHub = createTwoHubPipeline()
                .addHubConnection(new HubConnection("A", "Z", 10, 10, false));
        e = assertThrows(H2InputException.class, () -> synthesize(unknownHub));
        assertEquals("Hub 'Z' not found", e.getMessage());

        H2InputTables unknownTechnology = createTwoHubPipeline();
        unknownTechnology.getHub("B").enableProduction("unknown");
        e = assertThrows(H2InputException.class, () -> synthesize(unknownTechnology));
        assertEquals("Production technology 'unknown' not found", e.getMessage());

        H2InputTables unknownSector = createTwoHubPipeline();
        unknownSector.getHub("A").setSectorDemand("steel", 3);
        e = assertThrows(H2InputException.class, () -> synthesize(unknownSector));
        assertEquals("Demand sector 'steel' not found", e.getMessage());

        H2InputTables unknownCcs = createExistingProducerWithCcs();
        unknownCcs.getExistingProducers().get(0).addEligibleCcsTechnology("ccs2");
        e = assertThrows(H2InputException.class, () -> synthesize(unknownCcs));
        assertEquals("CCS technology 'ccs2' not found", e.getMessage());
    }

    @Test
    void testFrozenNetwork() {
        H2Network network = synthesize(createTwoHubPipeline());
        H2Node node = new H2Node(network, "A", NodeClass.of(H2NodeType.HUB_CENTER, "lowPurity"), "A_extra");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> network.addNode(node));
        assertEquals("Network 'h2-network' is frozen", e.getMessage());
    }

    @Test
    void testPriceProbes() {
        H2NetworkParameters parameters = new H2NetworkParameters()
                .setFindPrices(true)
                .setPriceTrackingStart(1)
                .setPriceTrackingStop(2)
                .setPriceTrackingStep(0.5)
                .setPriceHubs(List.of("B"));
        H2Network network = new H2NetworkBuilder(parameters).synthesize(createTwoHubPipeline());

        assertEquals(6, network.getNodes(H2NodeType.PRICE_PROBE).count());
        assertNull(network.getNodeById("A_priceHighPurity_1"));
        ConsumerNode probe = (ConsumerNode) network.getNodeById("B_priceHighPurity_1.5");
        assertNotNull(probe);
        assertTrue(probe.isPriceProbe());
        assertNull(probe.getSector());
        assertEquals(DemandCategory.HIGH_PURITY, probe.getCategory());
        assertEquals(1500, probe.getAttribute(H2Attribute.BREAKEVEN_PRICE), DELTA);
        assertEquals(0.1, probe.getAttribute(H2Attribute.SIZE), DELTA);
        assertEquals(H2ArcType.PRICE_PROBE_LINK, getArc(network, "B_demand_highPurity", "B_priceHighPurity_1.5").getType());
        assertNotNull(network.getNodeById("B_priceFuelStation_1"));
        assertNotNull(network.getNodeById("B_priceLowPurity_1"));

        parameters.setPriceHubs(List.of("Z"));
        H2InputException e = assertThrows(H2InputException.class, () -> new H2NetworkBuilder(parameters).synthesize(createTwoHubPipeline()));
        assertEquals("Price hub 'Z' not found", e.getMessage());
    }

    @Test
    void testPriceProbesOnAllHubs() {
        H2NetworkParameters parameters = new H2NetworkParameters()
                .setFindPrices(true)
                .setPriceTrackingStart(2)
                .setPriceTrackingStop(3)
                .setPriceTrackingStep(1);
        H2Network network = new H2NetworkBuilder(parameters).synthesize(createTwoHubPipeline());
        assertEquals(6, network.getNodes(H2NodeType.PRICE_PROBE).count());
        assertNotNull(network.getNodeById("A_priceLowPurity_2"));
        assertNotNull(network.getNodeById("B_priceLowPurity_2"));
    }

    @Test
    void testFormatPrice() {
        assertEquals("1", H2NetworkBuilder.formatPrice(1.0));
        assertEquals("1.5", H2NetworkBuilder.formatPrice(1.5));
        assertEquals("0.25", H2NetworkBuilder.formatPrice(0.25));
    }
}
