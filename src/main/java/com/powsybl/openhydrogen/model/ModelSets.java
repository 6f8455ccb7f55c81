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

import java.util.*;
import java.util.function.Predicate;

/**
 * Named partitions of the network nodes and arcs, derived from their class tags only.
 */
public final class ModelSets {

    private final List<H2Node> nodes;
    private final List<H2Arc> arcs;
    private final List<ProducerNode> producers;
    private final List<ProducerNode> existingProducers;
    private final List<ProducerNode> newProducers;
    private final List<ProducerNode> thermalProducers;
    private final List<ProducerNode> newThermalProducers;
    private final List<ProducerNode> newElectricProducers;
    private final List<ConverterNode> converters;
    private final List<ConverterNode> fuelDispensers;
    private final List<ConsumerNode> consumers;
    private final List<H2Node> truckDepots;
    private final List<H2Arc> distributionArcs;
    private final List<H2Arc> existingDistributionArcs;
    private final List<H2Arc> converterArcs;
    private final List<H2Arc> consumerArcs;
    private final List<CcsTechnology> ccsTechnologies;

    private ModelSets(H2Network network, Collection<CcsTechnology> ccsTechnologies) {
        nodes = network.getNodes();
        arcs = List.copyOf(network.getArcs());
        producers = network.getNodes(ProducerNode.class).toList();
        existingProducers = filter(producers, ProducerNode::isExisting);
        newProducers = filter(producers, p -> !p.isExisting());
        thermalProducers = filter(producers, ProducerNode::isThermal);
        newThermalProducers = filter(newProducers, ProducerNode::isThermal);
        newElectricProducers = filter(newProducers, p -> !p.isThermal());
        converters = network.getNodes(ConverterNode.class).toList();
        fuelDispensers = filter(converters, ConverterNode::isFuelDispenser);
        consumers = network.getNodes(ConsumerNode.class).toList();
        truckDepots = network.getNodes(H2NodeType.TRUCK_DEPOT).toList();
        distributionArcs = filter(arcs, a -> a.getType().isDistribution());
        existingDistributionArcs = filter(distributionArcs, H2Arc::isExisting);
        converterArcs = filter(arcs, a -> a.getStart().getType() == H2NodeType.CONVERTER || a.getEnd().getType() == H2NodeType.CONVERTER);
        consumerArcs = filter(arcs, a -> a.getType() == H2ArcType.FLOW_TO_DEMAND_SECTOR);
        this.ccsTechnologies = List.copyOf(ccsTechnologies);
    }

    public static ModelSets create(H2Network network, Collection<CcsTechnology> ccsTechnologies) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(ccsTechnologies);
        return new ModelSets(network, ccsTechnologies);
    }

    private static <T> List<T> filter(List<T> elements, Predicate<T> predicate) {
        return elements.stream().filter(predicate).toList();
    }

    public List<H2Node> getNodes() {
        return nodes;
    }

    public List<H2Arc> getArcs() {
        return arcs;
    }

    public List<ProducerNode> getProducers() {
        return producers;
    }

    public List<ProducerNode> getExistingProducers() {
        return existingProducers;
    }

    public List<ProducerNode> getNewProducers() {
        return newProducers;
    }

    public List<ProducerNode> getThermalProducers() {
        return thermalProducers;
    }

    public List<ProducerNode> getNewThermalProducers() {
        return newThermalProducers;
    }

    public List<ProducerNode> getNewElectricProducers() {
        return newElectricProducers;
    }

    public List<ConverterNode> getConverters() {
        return converters;
    }

    public List<ConverterNode> getFuelDispensers() {
        return fuelDispensers;
    }

    public List<ConsumerNode> getConsumers() {
        return consumers;
    }

    public List<H2Node> getTruckDepots() {
        return truckDepots;
    }

    public List<H2Arc> getDistributionArcs() {
        return distributionArcs;
    }

    public List<H2Arc> getExistingDistributionArcs() {
        return existingDistributionArcs;
    }

    public List<H2Arc> getConverterArcs() {
        return converterArcs;
    }

    public List<H2Arc> getConsumerArcs() {
        return consumerArcs;
    }

    public List<CcsTechnology> getCcsTechnologies() {
        return ccsTechnologies;
    }

    @Override
    public String toString() {
        return "ModelSets(" +
                "producers=" + producers.size() +
                ", existingProducers=" + existingProducers.size() +
                ", converters=" + converters.size() +
                ", consumers=" + consumers.size() +
                ", truckDepots=" + truckDepots.size() +
                ", distributionArcs=" + distributionArcs.size() +
                ", ccsTechnologies=" + ccsTechnologies.size() +
                ')';
    }
}
