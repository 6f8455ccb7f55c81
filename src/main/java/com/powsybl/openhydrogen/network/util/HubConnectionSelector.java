/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network.util;

import com.powsybl.openhydrogen.input.H2InputException;
import com.powsybl.openhydrogen.input.Hub;
import com.powsybl.openhydrogen.input.HubConnection;
import com.powsybl.openhydrogen.input.HubStatus;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Prunes the candidate connections between hubs.
 *
 * <p>A connection is dropped when both of its hubs still have at least {@code minHubs} connections shorter
 * than the connection length times a length factor (the major factor if one of the hubs is major, the
 * regular factor otherwise). Minor hubs then lose every connection longer than the minor factor times
 * their shortest connection. Blacklisted connections are removed, whitelisted ones are forced and flagged
 * as existing pipelines. Missing road lengths are finally fetched from a {@link RoadDistanceClient}.</p>
 */
public class HubConnectionSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(HubConnectionSelector.class);

    public static final double MINOR_LENGTH_FACTOR_DEFAULT_VALUE = 5;
    public static final double MAJOR_LENGTH_FACTOR_DEFAULT_VALUE = 0.8;
    public static final double REGULAR_LENGTH_FACTOR_DEFAULT_VALUE = 0.9;
    public static final int MIN_HUBS_DEFAULT_VALUE = 3;

    private final RoadDistanceClient roadDistanceClient;

    private double minorLengthFactor = MINOR_LENGTH_FACTOR_DEFAULT_VALUE;

    private double majorLengthFactor = MAJOR_LENGTH_FACTOR_DEFAULT_VALUE;

    private double regularLengthFactor = REGULAR_LENGTH_FACTOR_DEFAULT_VALUE;

    private int minHubs = MIN_HUBS_DEFAULT_VALUE;

    public HubConnectionSelector(RoadDistanceClient roadDistanceClient) {
        this.roadDistanceClient = Objects.requireNonNull(roadDistanceClient);
    }

    public HubConnectionSelector setMinorLengthFactor(double minorLengthFactor) {
        this.minorLengthFactor = checkLengthFactor(minorLengthFactor);
        return this;
    }

    public HubConnectionSelector setMajorLengthFactor(double majorLengthFactor) {
        this.majorLengthFactor = checkLengthFactor(majorLengthFactor);
        return this;
    }

    public HubConnectionSelector setRegularLengthFactor(double regularLengthFactor) {
        this.regularLengthFactor = checkLengthFactor(regularLengthFactor);
        return this;
    }

    public HubConnectionSelector setMinHubs(int minHubs) {
        if (minHubs < 1) {
            throw new IllegalArgumentException("Minimum number of connected hubs must be at least 1: " + minHubs);
        }
        this.minHubs = minHubs;
        return this;
    }

    private static double checkLengthFactor(double lengthFactor) {
        if (lengthFactor <= 0) {
            throw new IllegalArgumentException("Length factor must be strictly positive: " + lengthFactor);
        }
        return lengthFactor;
    }

    /**
     * Remaining connections of one hub, keyed by destination hub.
     */
    private static final class HubConnections {

        private final Hub hub;

        private final Map<String, Double> lengths = new LinkedHashMap<>();

        private HubConnections(Hub hub) {
            this.hub = hub;
        }

        private boolean isMajor() {
            return hub.getStatus() == HubStatus.MAJOR;
        }

        private boolean isMinor() {
            return hub.getStatus() == HubStatus.MINOR;
        }

        private boolean hasRemainingValidConnections(double currentLength, double lengthFactor, int minHubs) {
            return lengths.values().stream().filter(l -> l < lengthFactor * currentLength).count() >= minHubs;
        }
    }

    private static Pair<String, String> key(String hub1, String hub2) {
        return hub1.compareTo(hub2) < 0 ? Pair.of(hub1, hub2) : Pair.of(hub2, hub1);
    }

    private static void remove(HubConnections connections1, HubConnections connections2) {
        if (connections1.lengths.remove(connections2.hub.getId()) == null) {
            LOGGER.warn("Connection between '{}' and '{}' cannot be removed, it does not exist",
                    connections1.hub.getId(), connections2.hub.getId());
            return;
        }
        connections2.lengths.remove(connections1.hub.getId());
    }

    public List<HubConnection> select(Collection<Hub> hubs, List<HubConnection> candidates,
                                      Collection<Pair<String, String>> blacklist,
                                      Collection<Pair<String, String>> whitelist) {
        Objects.requireNonNull(hubs);
        Objects.requireNonNull(candidates);
        Objects.requireNonNull(blacklist);
        Objects.requireNonNull(whitelist);

        // minor hubs first, major hubs last
        List<Hub> sortedHubs = hubs.stream().sorted(Comparator.comparingInt(h -> h.getStatus().getValue())).toList();
        Map<String, HubConnections> connectionsByHub = new LinkedHashMap<>();
        for (Hub hub : sortedHubs) {
            connectionsByHub.put(hub.getId(), new HubConnections(hub));
        }
        Map<Pair<String, String>, HubConnection> candidatesByKey = new LinkedHashMap<>();
        for (HubConnection candidate : candidates) {
            HubConnections connections1 = getConnections(connectionsByHub, candidate.startHub());
            HubConnections connections2 = getConnections(connectionsByHub, candidate.endHub());
            if (Double.isNaN(candidate.euclideanLength())) {
                throw new H2InputException("Euclidean length between '" + candidate.startHub() + "' and '" + candidate.endHub() + "' is missing");
            }
            candidatesByKey.put(key(candidate.startHub(), candidate.endHub()), candidate);
            connections1.lengths.put(candidate.endHub(), candidate.euclideanLength());
            connections2.lengths.put(candidate.startHub(), candidate.euclideanLength());
        }

        for (HubConnections connectionsA : connectionsByHub.values()) {
            for (String hubB : new ArrayList<>(connectionsA.lengths.keySet())) {
                HubConnections connectionsB = connectionsByHub.get(hubB);
                Double currentLength = connectionsA.lengths.get(hubB);
                if (currentLength == null) {
                    continue;
                }
                double lengthFactor = connectionsA.isMajor() || connectionsB.isMajor() ? majorLengthFactor : regularLengthFactor;
                if (connectionsB.hasRemainingValidConnections(currentLength, lengthFactor, minHubs)
                        && connectionsA.hasRemainingValidConnections(currentLength, lengthFactor, minHubs)) {
                    remove(connectionsA, connectionsB);
                }
            }
        }

        for (HubConnections connectionsA : connectionsByHub.values()) {
            if (connectionsA.isMinor() && !connectionsA.lengths.isEmpty()) {
                double maxLength = minorLengthFactor * Collections.min(connectionsA.lengths.values());
                for (Map.Entry<String, Double> e : new ArrayList<>(connectionsA.lengths.entrySet())) {
                    if (e.getValue() > maxLength) {
                        remove(connectionsA, connectionsByHub.get(e.getKey()));
                    }
                }
            }
        }

        for (Pair<String, String> pair : blacklist) {
            remove(getConnections(connectionsByHub, pair.getLeft()), getConnections(connectionsByHub, pair.getRight()));
        }

        Set<Pair<String, String>> selectedKeys = new HashSet<>();
        for (HubConnections connections : connectionsByHub.values()) {
            for (String other : connections.lengths.keySet()) {
                selectedKeys.add(key(connections.hub.getId(), other));
            }
        }
        Set<Pair<String, String>> existingKeys = new HashSet<>();
        for (Pair<String, String> pair : whitelist) {
            Pair<String, String> key = key(pair.getLeft(), pair.getRight());
            if (!candidatesByKey.containsKey(key)) {
                throw new H2InputException("Whitelisted connection between '" + pair.getLeft() + "' and '" + pair.getRight()
                        + "' is not a candidate connection");
            }
            selectedKeys.add(key);
            existingKeys.add(key);
        }

        List<HubConnection> selected = new ArrayList<>();
        for (Map.Entry<Pair<String, String>, HubConnection> e : candidatesByKey.entrySet()) {
            if (selectedKeys.contains(e.getKey())) {
                HubConnection connection = e.getValue();
                if (existingKeys.contains(e.getKey())) {
                    connection = connection.withExistingPipeline(true);
                }
                if (!connection.hasRoadLength()) {
                    connection = connection.withRoadLength(roadDistanceClient.getRoadLength(connection.startHub(), connection.endHub()));
                }
                selected.add(connection);
            }
        }
        LOGGER.info("{} hub connections selected out of {} candidates", selected.size(), candidates.size());
        return selected;
    }

    private static HubConnections getConnections(Map<String, HubConnections> connectionsByHub, String hub) {
        HubConnections connections = connectionsByHub.get(hub);
        if (connections == null) {
            throw new H2InputException("Hub '" + hub + "' not found");
        }
        return connections;
    }
}
