/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openhydrogen.graph.GraphModel;
import com.powsybl.openhydrogen.graph.JGraphTModel;

import java.util.*;
import java.util.stream.Stream;

/**
 * The hydrogen flow network of one scenario. Nodes are indexed by insertion order, arcs are kept in an
 * adjacency graph. The network is built incrementally then frozen; a frozen network cannot be modified.
 */
public class H2Network {

    private final String id;

    private final List<String> hubs = new ArrayList<>();

    private final List<H2Node> nodesByIndex = new ArrayList<>();

    private final Map<String, H2Node> nodesById = new HashMap<>();

    private final Map<String, H2Arc> arcsById = new LinkedHashMap<>();

    private final GraphModel<H2Node, H2Arc> graph = new JGraphTModel<>();

    private int arcCount = 0;

    private boolean frozen = false;

    public H2Network(String id) {
        this.id = Objects.requireNonNull(id);
    }

    public String getId() {
        return id;
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Network '" + id + "' is frozen");
        }
    }

    public void addHub(String hub) {
        Objects.requireNonNull(hub);
        checkNotFrozen();
        if (!hubs.contains(hub)) {
            hubs.add(hub);
        }
    }

    public List<String> getHubs() {
        return Collections.unmodifiableList(hubs);
    }

    public <N extends H2Node> N addNode(N node) {
        Objects.requireNonNull(node);
        checkNotFrozen();
        if (node.getNetwork() != this) {
            throw new PowsyblException("Node '" + node.getId() + "' belongs to another network");
        }
        if (nodesById.containsKey(node.getId())) {
            throw new PowsyblException("Node '" + node.getId() + "' already exists");
        }
        node.setNum(nodesByIndex.size());
        nodesByIndex.add(node);
        nodesById.put(node.getId(), node);
        graph.addVertex(node);
        return node;
    }

    public List<H2Node> getNodes() {
        return Collections.unmodifiableList(nodesByIndex);
    }

    public H2Node getNode(int num) {
        return nodesByIndex.get(num);
    }

    public H2Node getNodeById(String id) {
        Objects.requireNonNull(id);
        return nodesById.get(id);
    }

    public Stream<H2Node> getNodes(H2NodeType type) {
        return nodesByIndex.stream().filter(n -> n.getType() == type);
    }

    public <N extends H2Node> Stream<N> getNodes(Class<N> nodeClass) {
        return nodesByIndex.stream().filter(nodeClass::isInstance).map(nodeClass::cast);
    }

    public H2Arc addArc(H2Arc arc) {
        Objects.requireNonNull(arc);
        checkNotFrozen();
        if (!graph.containsVertex(arc.getStart()) || !graph.containsVertex(arc.getEnd())) {
            throw new PowsyblException("Arc '" + arc.getId() + "' has an endpoint outside of network '" + id + "'");
        }
        if (arcsById.containsKey(arc.getId())) {
            throw new PowsyblException("Arc '" + arc.getId() + "' already exists");
        }
        arc.setNum(arcCount++);
        arcsById.put(arc.getId(), arc);
        graph.addEdge(arc.getStart(), arc.getEnd(), arc);
        return arc;
    }

    public void removeArc(H2Arc arc) {
        Objects.requireNonNull(arc);
        checkNotFrozen();
        if (arcsById.remove(arc.getId()) == null) {
            throw new PowsyblException("Arc '" + arc.getId() + "' not found");
        }
        graph.removeEdge(arc);
    }

    public Collection<H2Arc> getArcs() {
        return Collections.unmodifiableCollection(arcsById.values());
    }

    public H2Arc getArcById(String id) {
        Objects.requireNonNull(id);
        return arcsById.get(id);
    }

    public Optional<H2Arc> getArc(H2Node start, H2Node end) {
        return Optional.ofNullable(graph.getEdge(start, end));
    }

    public List<H2Arc> getIncomingArcs(H2Node node) {
        return sorted(graph.getIncomingEdgesOf(node));
    }

    public List<H2Arc> getOutgoingArcs(H2Node node) {
        return sorted(graph.getOutgoingEdgesOf(node));
    }

    private static List<H2Arc> sorted(Set<H2Arc> arcs) {
        return arcs.stream().sorted(Comparator.comparingInt(H2Arc::getNum)).toList();
    }

    public int getNodeCount() {
        return nodesByIndex.size();
    }

    public int getArcCount() {
        return arcsById.size();
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public String toString() {
        return "H2Network(id=" + id + ", nodes=" + nodesByIndex.size() + ", arcs=" + arcsById.size() + ")";
    }
}
