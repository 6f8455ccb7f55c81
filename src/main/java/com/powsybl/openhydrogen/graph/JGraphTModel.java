/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.graph;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;

import java.util.Set;

/**
 * JGraphT backed graph model. At most one edge is allowed per ordered pair of vertices and
 * self loops are rejected.
 */
public class JGraphTModel<V, E> implements GraphModel<V, E> {

    private final Graph<V, E> graph = new DefaultDirectedGraph<>(null, null, false);

    @Override
    public void addVertex(V v) {
        graph.addVertex(v);
    }

    @Override
    public boolean containsVertex(V vertex) {
        return graph.containsVertex(vertex);
    }

    @Override
    public void addEdge(V source, V target, E e) {
        if (!graph.addEdge(source, target, e)) {
            throw new IllegalStateException("An edge already exists between " + source + " and " + target);
        }
    }

    @Override
    public void removeEdge(E e) {
        graph.removeEdge(e);
    }

    @Override
    public boolean containsEdge(E edge) {
        return graph.containsEdge(edge);
    }

    @Override
    public V getEdgeSource(E edge) {
        return graph.getEdgeSource(edge);
    }

    @Override
    public V getEdgeTarget(E edge) {
        return graph.getEdgeTarget(edge);
    }

    @Override
    public E getEdge(V source, V target) {
        return graph.getEdge(source, target);
    }

    @Override
    public Set<E> getEdges() {
        return graph.edgeSet();
    }

    @Override
    public Set<V> getVertices() {
        return graph.vertexSet();
    }

    @Override
    public Set<E> getIncomingEdgesOf(V v) {
        return graph.incomingEdgesOf(v);
    }

    @Override
    public Set<E> getOutgoingEdgesOf(V v) {
        return graph.outgoingEdgesOf(v);
    }
}
