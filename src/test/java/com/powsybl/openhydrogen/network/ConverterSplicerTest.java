/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import com.powsybl.openhydrogen.input.ConversionTechnology;
import com.powsybl.openhydrogen.input.H2InputTables;
import com.powsybl.openhydrogen.input.Hub;
import org.junit.jupiter.api.Test;

import static com.powsybl.openhydrogen.input.H2InputTablesFactory.createTwoHubPipeline;
import static org.junit.jupiter.api.Assertions.*;

class ConverterSplicerTest {

    private static final double DELTA = 1e-9;

    @Test
    void testSpliceOnSynthesizedNetwork() {
        H2InputTables tables = createTwoHubPipeline()
                .addConversionTechnology(new ConversionTechnology("compressor", "center_highPurity", "dist_pipelineHighPurity")
                        .setCapitalCost(100)
                        .setElectricityCost(20)
                        .setUtilization(0.9));
        tables.getHub("B").setCapitalMultiplier(1.5);
        H2Network network = new H2NetworkBuilder(new H2NetworkParameters()).synthesize(tables);

        assertNull(network.getArcById("A_center_highPurity -> A_dist_pipelineHighPurity"));
        ConverterNode converter = (ConverterNode) network.getNodeById("B_converter_compressor");
        assertNotNull(converter);
        assertEquals(ConverterKind.COMPRESSOR, converter.getKind());
        assertEquals("converter_compressor", converter.getNodeClass().key());
        assertEquals(150, converter.getAttribute(H2Attribute.CAPITAL_COST), DELTA);
        assertEquals(20, converter.getAttribute(H2Attribute.ELECTRICITY_COST), DELTA);
        assertEquals(0.9, converter.getAttribute(H2Attribute.UTILIZATION), DELTA);

        H2Arc toConverter = network.getArcById("B_center_highPurity -> B_converter_compressor");
        assertEquals(H2ArcType.FLOW_THROUGH_CONVERTER, toConverter.getType());
        assertEquals(H2NetworkBuilder.FREE_FLOW_LIMIT, toConverter.getAttribute(H2Attribute.FLOW_LIMIT), DELTA);
        H2Arc fromConverter = network.getArcById("B_converter_compressor -> B_dist_pipelineHighPurity");
        assertEquals(H2ArcType.INTRA_HUB, fromConverter.getType());
        assertEquals("pipeline", fromConverter.getTechnology().orElseThrow());
        // the reverse arc does not match the rule
        assertNotNull(network.getArcById("B_dist_pipelineHighPurity -> B_center_highPurity"));
    }

    @Test
    void testRulesAreAppliedInOrder() {
        H2InputTables tables = createTwoHubPipeline()
                .addConversionTechnology(new ConversionTechnology("compressor", "center_highPurity", "dist_pipelineHighPurity"))
                .addConversionTechnology(new ConversionTechnology("fuelDispenser", "converter_compressor", "dist_pipelineHighPurity"));
        H2Network network = new H2NetworkBuilder(new H2NetworkParameters()).synthesize(tables);

        assertNull(network.getArcById("A_converter_compressor -> A_dist_pipelineHighPurity"));
        assertEquals(H2ArcType.FLOW_THROUGH_CONVERTER, network.getArcById("A_center_highPurity -> A_converter_compressor").getType());
        assertEquals(H2ArcType.FLOW_THROUGH_CONVERTER, network.getArcById("A_converter_compressor -> A_converter_fuelDispenser").getType());
        assertEquals(H2ArcType.INTRA_HUB, network.getArcById("A_converter_fuelDispenser -> A_dist_pipelineHighPurity").getType());
        assertTrue(((ConverterNode) network.getNodeById("A_converter_fuelDispenser")).isFuelDispenser());
    }

    @Test
    void testPassedRule() {
        H2InputTables tables = createTwoHubPipeline()
                .addConversionTechnology(new ConversionTechnology("compressor", ConversionTechnology.PASS, "dist_pipelineHighPurity"));
        H2Network network = new H2NetworkBuilder(new H2NetworkParameters()).synthesize(tables);
        assertEquals(0, network.getNodes(H2NodeType.CONVERTER).count());
        assertNotNull(network.getArcById("A_center_highPurity -> A_dist_pipelineHighPurity"));
    }

    @Test
    void testConverterInputKeepsLargestFlowLimit() {
        H2Network network = new H2Network("test");
        network.addHub("A");
        H2Node center = network.addNode(new H2Node(network, "A", NodeClass.of(H2NodeType.HUB_CENTER, "highPurity"), "A_center"));
        H2Node depot1 = network.addNode(new H2Node(network, "A", NodeClass.of(H2NodeType.TRUCK_DEPOT, "truck"), "A_depot1"));
        H2Node depot2 = network.addNode(new H2Node(network, "A", NodeClass.of(H2NodeType.TRUCK_DEPOT, "truck"), "A_depot2"));
        network.addArc(new H2Arc(network, center, depot1, H2ArcType.HUB_TO_DEPOT)).setAttribute(H2Attribute.FLOW_LIMIT, 3);
        network.addArc(new H2Arc(network, center, depot2, H2ArcType.HUB_TO_DEPOT)).setAttribute(H2Attribute.FLOW_LIMIT, 7);
        H2InputTables tables = new H2InputTables()
                .addHub(new Hub("A"))
                .addConversionTechnology(new ConversionTechnology("liquefier", "center_highPurity", "dist_truck"));

        new ConverterSplicer().splice(network, tables);

        assertEquals(7, network.getArcById("A_center -> A_converter_liquefier").getAttribute(H2Attribute.FLOW_LIMIT), DELTA);
        assertEquals(3, network.getArcById("A_converter_liquefier -> A_depot1").getAttribute(H2Attribute.FLOW_LIMIT), DELTA);
        assertEquals(7, network.getArcById("A_converter_liquefier -> A_depot2").getAttribute(H2Attribute.FLOW_LIMIT), DELTA);
        assertEquals(3, network.getArcCount());
    }
}
