/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import java.util.Objects;

/**
 * Candidate connection between two hubs.
 *
 * @param euclideanLength straight line length in kilometers
 * @param roadLength road length in kilometers, {@code NaN} if not yet known
 */
public record HubConnection(String startHub, String endHub, double euclideanLength, double roadLength,
                            boolean existingPipeline) {

    public HubConnection {
        Objects.requireNonNull(startHub);
        Objects.requireNonNull(endHub);
        if (startHub.equals(endHub)) {
            throw new IllegalArgumentException("Hub connection must link two different hubs: " + startHub);
        }
    }

    public boolean hasRoadLength() {
        return !Double.isNaN(roadLength);
    }

    public HubConnection withRoadLength(double length) {
        return new HubConnection(startHub, endHub, euclideanLength, length, existingPipeline);
    }

    public HubConnection withExistingPipeline(boolean existing) {
        return new HubConnection(startHub, endHub, euclideanLength, roadLength, existing);
    }

    public boolean connects(String hub1, String hub2) {
        return startHub.equals(hub1) && endHub.equals(hub2) || startHub.equals(hub2) && endHub.equals(hub1);
    }
}
