/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.graph;

import java.util.Set;

/**
 * Directed graph abstraction used to store the hydrogen flow network adjacency.
 */
public interface GraphModel<V, E> {

    void addVertex(V v);

    boolean containsVertex(V vertex);

    void addEdge(V source, V target, E e);

    void removeEdge(E e);

    boolean containsEdge(E edge);

    V getEdgeSource(E edge);

    V getEdgeTarget(E edge);

    E getEdge(V source, V target);

    Set<E> getEdges();

    Set<V> getVertices();

    Set<E> getIncomingEdgesOf(V v);

    Set<E> getOutgoingEdgesOf(V v);
}
