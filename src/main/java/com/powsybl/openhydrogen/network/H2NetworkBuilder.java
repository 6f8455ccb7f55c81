/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import com.google.common.base.Stopwatch;
import com.powsybl.openhydrogen.input.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openhydrogen.util.Markers.PERFORMANCE_MARKER;

/**
 * Synthesizes the typed hydrogen flow network from the scenario input tables.
 *
 * <p>Each hub gets a scaffold made of one center node per purity, one pipeline terminal per pipeline
 * technology and purity, one depot per truck technology and one demand node per demand category.
 * Hub connections then add pipelines and truck routes in both directions, demand sectors, producers
 * and converters are grafted on the scaffold and, if requested, price probes are attached to the
 * demand nodes. The returned network is frozen.</p>
 */
public class H2NetworkBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(H2NetworkBuilder.class);

    public static final double FREE_FLOW_LIMIT = 99999999.9;

    public static final String CARBON_SENSITIVE_SUFFIX = "_carbonSensitive";

    public static final String EXISTING_SUFFIX = "Existing";

    private final H2NetworkParameters parameters;

    public H2NetworkBuilder(H2NetworkParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public H2Network synthesize(H2InputTables tables) {
        Objects.requireNonNull(tables);
        Stopwatch stopwatch = Stopwatch.createStarted();

        H2Network network = new H2Network("h2-network");
        for (Hub hub : tables.getHubs()) {
            network.addHub(hub.getId());
            createHubScaffold(network, hub, tables);
        }
        createHubConnections(network, tables);
        for (Hub hub : tables.getHubs()) {
            createConsumers(network, hub, tables);
            createProducers(network, hub, tables);
        }
        createExistingProducers(network, tables);
        new ConverterSplicer().splice(network, tables);
        if (parameters.isFindPrices()) {
            createPriceProbes(network);
        }
        network.freeze();

        stopwatch.stop();
        LOGGER.info(PERFORMANCE_MARKER, "Network '{}' synthesized in {} ms: {} nodes, {} arcs", network.getId(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS), network.getNodeCount(), network.getArcCount());
        return network;
    }

    static String centerId(String hub, Purity purity) {
        return hub + "_center_" + purity.getTag();
    }

    static String pipelineTerminalQualifier(DistributionTechnology pipeline, Purity purity) {
        return pipeline.getName() + purity.getSuffix();
    }

    static String distributionId(String hub, String qualifier) {
        return hub + "_dist_" + qualifier;
    }

    static String demandId(String hub, DemandCategory category) {
        return hub + "_demand_" + category.getTag();
    }

    private static H2Arc addFreeFlowArc(H2Network network, H2Node start, H2Node end, H2ArcType type, String technology) {
        H2Arc arc = network.addArc(new H2Arc(network, start, end, type, technology, false));
        arc.setAttribute(H2Attribute.FLOW_LIMIT, FREE_FLOW_LIMIT);
        return arc;
    }

    private static H2Node getNode(H2Network network, String id) {
        H2Node node = network.getNodeById(id);
        if (node == null) {
            throw new H2InputException("Node '" + id + "' not found");
        }
        return node;
    }

    private static void createHubScaffold(H2Network network, Hub hub, H2InputTables tables) {
        String hubId = hub.getId();
        Map<Purity, H2Node> centers = new EnumMap<>(Purity.class);
        for (Purity purity : Purity.values()) {
            centers.put(purity, network.addNode(new H2Node(network, hubId, NodeClass.of(H2NodeType.HUB_CENTER, purity.getTag()),
                    centerId(hubId, purity))));
        }
        Map<DemandCategory, H2Node> demands = new EnumMap<>(DemandCategory.class);
        for (DemandCategory category : DemandCategory.values()) {
            demands.put(category, network.addNode(new H2Node(network, hubId, NodeClass.of(H2NodeType.DEMAND_HUB, category.getTag()),
                    demandId(hubId, category))));
        }

        for (DistributionTechnology pipeline : tables.getDistributionTechnologies(DistributionKind.PIPELINE)) {
            for (Purity purity : Purity.values()) {
                String qualifier = pipelineTerminalQualifier(pipeline, purity);
                H2Node terminal = network.addNode(new H2Node(network, hubId, NodeClass.of(H2NodeType.PIPELINE_TERMINAL, qualifier),
                        distributionId(hubId, qualifier)));
                H2Node center = centers.get(purity);
                addFreeFlowArc(network, center, terminal, H2ArcType.INTRA_HUB, pipeline.getName());
                addFreeFlowArc(network, terminal, center, H2ArcType.INTRA_HUB_REVERSE, pipeline.getName());
                for (DemandCategory category : DemandCategory.values()) {
                    if (category.canBeServedBy(purity)) {
                        H2Arc arc = network.addArc(new H2Arc(network, terminal, demands.get(category), H2ArcType.FLOW_TO_DEMAND,
                                pipeline.getName(), false));
                        arc.setAttribute(H2Attribute.FLOW_LIMIT, pipeline.getFlowLimit());
                    }
                }
            }
        }

        // trucks are loaded with high purity hydrogen only
        for (DistributionTechnology truck : tables.getDistributionTechnologies(DistributionKind.TRUCK)) {
            H2Node depot = network.addNode(new H2Node(network, hubId, NodeClass.of(H2NodeType.TRUCK_DEPOT, truck.getName()),
                    distributionId(hubId, truck.getName())));
            H2Arc depotArc = network.addArc(new H2Arc(network, centers.get(Purity.HIGH), depot, H2ArcType.HUB_TO_DEPOT,
                    truck.getName(), false));
            depotArc.setAttribute(H2Attribute.CAPITAL_COST, truck.getCapitalCost() * hub.getCapitalMultiplier());
            depotArc.setAttribute(H2Attribute.FIXED_COST, truck.getFixedCost() * hub.getCapitalMultiplier());
            depotArc.setAttribute(H2Attribute.FLOW_LIMIT, truck.getFlowLimit());
            for (DemandCategory category : DemandCategory.values()) {
                H2Arc arc = network.addArc(new H2Arc(network, depot, demands.get(category), H2ArcType.FLOW_TO_DEMAND,
                        truck.getName(), false));
                arc.setAttribute(H2Attribute.FLOW_LIMIT, truck.getFlowLimit());
            }
        }

        addFreeFlowArc(network, centers.get(Purity.LOW), centers.get(Purity.HIGH), H2ArcType.PURIFICATION, null);
    }

    private static void createHubConnections(H2Network network, H2InputTables tables) {
        Set<String> connected = new HashSet<>();
        for (HubConnection connection : tables.getHubConnections()) {
            Hub startHub = tables.getHub(connection.startHub());
            Hub endHub = tables.getHub(connection.endHub());
            String key = startHub.getId().compareTo(endHub.getId()) < 0
                    ? startHub.getId() + "|" + endHub.getId()
                    : endHub.getId() + "|" + startHub.getId();
            if (!connected.add(key)) {
                throw new H2InputException("Hub connection between '" + startHub.getId() + "' and '" + endHub.getId() + "' is defined twice");
            }
            if (!connection.hasRoadLength()) {
                throw new H2InputException("Road length of hub connection between '" + startHub.getId() + "' and '"
                        + endHub.getId() + "' is missing");
            }
            double length = connection.roadLength();
            double capitalMultiplier = (startHub.getCapitalMultiplier() + endHub.getCapitalMultiplier()) / 2;

            for (DistributionTechnology pipeline : tables.getDistributionTechnologies(DistributionKind.PIPELINE)) {
                for (Purity purity : Purity.values()) {
                    String qualifier = pipelineTerminalQualifier(pipeline, purity);
                    H2Node terminal1 = getNode(network, distributionId(startHub.getId(), qualifier));
                    H2Node terminal2 = getNode(network, distributionId(endHub.getId(), qualifier));
                    // existing pipelines carry low purity hydrogen
                    boolean existing = connection.existingPipeline() && purity == Purity.LOW;
                    for (H2Node[] ends : List.of(new H2Node[] {terminal1, terminal2}, new H2Node[] {terminal2, terminal1})) {
                        H2Arc arc = network.addArc(new H2Arc(network, ends[0], ends[1], H2ArcType.PIPELINE, pipeline.getName(), existing));
                        arc.setAttribute(H2Attribute.CAPITAL_COST, pipeline.getCapitalCost() * length * capitalMultiplier);
                        arc.setAttribute(H2Attribute.FIXED_COST, pipeline.getFixedCost() * length);
                        arc.setAttribute(H2Attribute.VARIABLE_COST, pipeline.getVariableCost() * length);
                        arc.setAttribute(H2Attribute.FLOW_LIMIT, pipeline.getFlowLimit());
                        arc.setAttribute(H2Attribute.LENGTH, length);
                    }
                }
            }

            for (DistributionTechnology truck : tables.getDistributionTechnologies(DistributionKind.TRUCK)) {
                H2Node depot1 = getNode(network, distributionId(startHub.getId(), truck.getName()));
                H2Node depot2 = getNode(network, distributionId(endHub.getId(), truck.getName()));
                for (H2Node[] ends : List.of(new H2Node[] {depot1, depot2}, new H2Node[] {depot2, depot1})) {
                    // fleet capital is carried by the hub to depot arc
                    H2Arc arc = network.addArc(new H2Arc(network, ends[0], ends[1], H2ArcType.TRUCK_ROUTE, truck.getName(), false));
                    arc.setAttribute(H2Attribute.VARIABLE_COST, truck.getVariableCost() * length);
                    arc.setAttribute(H2Attribute.FLOW_LIMIT, truck.getFlowLimit());
                    arc.setAttribute(H2Attribute.LENGTH, length);
                }
            }
        }
        LOGGER.debug("{} hub connections created", connected.size());
    }

    private static void createConsumers(H2Network network, Hub hub, H2InputTables tables) {
        for (Map.Entry<String, Double> e : hub.getSectorDemands().entrySet()) {
            double size = e.getValue();
            if (size <= 0) {
                continue;
            }
            DemandSector sector = tables.getDemandSector(e.getKey());
            H2Node demandNode = getNode(network, demandId(hub.getId(), sector.getCategory()));
            String id = hub.getId() + "_demandSector_" + sector.getName();
            double sensitiveFraction = sector.getCarbonSensitiveFraction();
            createConsumer(network, hub, sector, demandNode, id, size * (1 - sensitiveFraction), false);
            createConsumer(network, hub, sector, demandNode, id + CARBON_SENSITIVE_SUFFIX, size * sensitiveFraction, true);
        }
    }

    private static void createConsumer(H2Network network, Hub hub, DemandSector sector, H2Node demandNode, String id,
                                       double size, boolean carbonSensitive) {
        if (size <= 0) {
            return;
        }
        ConsumerNode consumer = network.addNode(new ConsumerNode(network, hub.getId(), id,
                NodeClass.of(H2NodeType.DEMAND_SECTOR, sector.getName()), sector.getCategory(), carbonSensitive));
        consumer.setAttribute(H2Attribute.SIZE, size);
        consumer.setAttribute(H2Attribute.BREAKEVEN_PRICE, sector.getBreakevenPrice());
        consumer.setAttribute(H2Attribute.CARBON_SENSITIVE, carbonSensitive ? 1 : 0);
        consumer.setAttribute(H2Attribute.AVOIDED_EMISSIONS, sector.getAvoidedEmissions());
        addFreeFlowArc(network, demandNode, consumer, H2ArcType.FLOW_TO_DEMAND_SECTOR, null);
    }

    private double getChecPerTon(double co2EmissionsRate) {
        double displacement = 1 - co2EmissionsRate / parameters.getBaseSmrCo2PerH2();
        if (parameters.isFractionalChec()) {
            return Math.max(0, displacement);
        }
        return displacement > 0 ? 1 : 0;
    }

    private void createProducers(H2Network network, Hub hub, H2InputTables tables) {
        for (String technologyName : hub.getEnabledProductionTechnologies()) {
            ProductionTechnology technology = tables.getProductionTechnology(technologyName);
            ProducerNode producer = network.addNode(new ProducerNode(network, hub.getId(), hub.getId() + "_production_" + technologyName,
                    technologyName, technology.getKind(), technology.getPurity(), false, Collections.emptySet()));
            double co2EmissionsRate = technology.getKind() == ProductionKind.THERMAL
                    ? parameters.getBaseSmrCo2PerH2() * (1 - technology.getCcsCaptureRate())
                    : technology.getGridIntensity();
            producer.setAttribute(H2Attribute.CAPITAL_COST, technology.getCapitalCost() * hub.getCapitalMultiplier());
            producer.setAttribute(H2Attribute.FIXED_COST, technology.getFixedCost());
            producer.setAttribute(H2Attribute.VARIABLE_COST, technology.getVariableCost());
            producer.setAttribute(H2Attribute.ELECTRICITY_COST, technology.getElectricityCost() * hub.getElectricityMultiplier());
            producer.setAttribute(H2Attribute.NATURAL_GAS_COST, technology.getNaturalGasCost() * hub.getNaturalGasMultiplier());
            producer.setAttribute(H2Attribute.UTILIZATION, technology.getUtilization());
            producer.setAttribute(H2Attribute.MIN_SIZE, technology.getMinSize());
            producer.setAttribute(H2Attribute.MAX_SIZE, technology.getMaxSize());
            producer.setAttribute(H2Attribute.CCS_CAPTURE_RATE, technology.getCcsCaptureRate());
            producer.setAttribute(H2Attribute.CO2_EMISSIONS_RATE, co2EmissionsRate);
            producer.setAttribute(H2Attribute.CHEC_PER_TON, getChecPerTon(co2EmissionsRate));
            producer.setAttribute(H2Attribute.H2_TAX_CREDIT, technology.getH2TaxCredit());
            addFreeFlowArc(network, producer, getNode(network, centerId(hub.getId(), technology.getPurity())),
                    H2ArcType.FLOW_FROM_PRODUCER, technologyName);
        }
    }

    private static void createExistingProducers(H2Network network, H2InputTables tables) {
        for (ExistingProducer existingProducer : tables.getExistingProducers()) {
            Hub hub = tables.getHub(existingProducer.getHub());
            ProductionTechnology technology = tables.getProductionTechnology(existingProducer.getTechnology());
            for (String ccsTechnology : existingProducer.getEligibleCcsTechnologies()) {
                tables.getCcsTechnology(ccsTechnology);
            }
            ProducerNode producer = network.addNode(new ProducerNode(network, hub.getId(),
                    hub.getId() + "_production_" + technology.getName() + EXISTING_SUFFIX, technology.getName(),
                    technology.getKind(), technology.getPurity(), true, existingProducer.getEligibleCcsTechnologies()));
            producer.setAttribute(H2Attribute.CAPACITY, existingProducer.getCapacity());
            producer.setAttribute(H2Attribute.UTILIZATION, existingProducer.getUtilization());
            producer.setAttribute(H2Attribute.VARIABLE_COST, existingProducer.getVariableCost());
            producer.setAttribute(H2Attribute.ELECTRICITY_COST, existingProducer.getElectricityCost() * hub.getElectricityMultiplier());
            producer.setAttribute(H2Attribute.NATURAL_GAS_COST, existingProducer.getNaturalGasCost() * hub.getNaturalGasMultiplier());
            producer.setAttribute(H2Attribute.CO2_EMISSIONS_RATE, existingProducer.getCo2EmissionsRate());
            addFreeFlowArc(network, producer, getNode(network, centerId(hub.getId(), technology.getPurity())),
                    H2ArcType.FLOW_FROM_PRODUCER, technology.getName());
        }
    }

    static String formatPrice(double price) {
        return BigDecimal.valueOf(price).stripTrailingZeros().toPlainString();
    }

    private void createPriceProbes(H2Network network) {
        List<String> hubs = parameters.getPriceHubs().isEmpty() ? network.getHubs() : parameters.getPriceHubs();
        List<Double> ladder = parameters.getPriceLadder();
        int count = 0;
        for (String hub : hubs) {
            if (!network.getHubs().contains(hub)) {
                throw new H2InputException("Price hub '" + hub + "' not found");
            }
            for (double price : ladder) {
                for (DemandCategory category : DemandCategory.values()) {
                    ConsumerNode probe = network.addNode(new ConsumerNode(network, hub,
                            hub + "_price" + category.getSuffix() + "_" + formatPrice(price),
                            NodeClass.of(H2NodeType.PRICE_PROBE), category, false));
                    probe.setAttribute(H2Attribute.BREAKEVEN_PRICE, price * 1000);
                    probe.setAttribute(H2Attribute.SIZE, parameters.getPriceDemand());
                    network.addArc(new H2Arc(network, getNode(network, demandId(hub, category)), probe, H2ArcType.PRICE_PROBE_LINK));
                    count++;
                }
            }
        }
        LOGGER.debug("{} price probes created", count);
    }
}
