/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class H2NetworkParametersTest {

    @Test
    void testPriceLadder() {
        H2NetworkParameters parameters = new H2NetworkParameters();
        assertEquals(18, parameters.getPriceLadder().size());
        assertEquals(1.0, parameters.getPriceLadder().get(0));
        assertEquals(9.5, parameters.getPriceLadder().get(17));

        parameters.setPriceTrackingStart(0.1).setPriceTrackingStop(0.4).setPriceTrackingStep(0.1);
        assertEquals(List.of(0.1, 0.2, 0.3), parameters.getPriceLadder());

        parameters.setPriceTrackingStart(5).setPriceTrackingStop(5);
        assertTrue(parameters.getPriceLadder().isEmpty());
    }

    @Test
    void testValidation() {
        H2NetworkParameters parameters = new H2NetworkParameters();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parameters.setPriceTrackingStep(0));
        assertEquals("Price tracking step must be strictly positive: 0.0", e.getMessage());
        e = assertThrows(IllegalArgumentException.class, () -> parameters.setPriceTrackingStart(-1));
        assertEquals("Price tracking start must be positive: -1.0", e.getMessage());
        e = assertThrows(IllegalArgumentException.class, () -> parameters.setPriceDemand(0));
        assertEquals("Price probe demand must be strictly positive: 0.0", e.getMessage());
        e = assertThrows(IllegalArgumentException.class, () -> parameters.setBaseSmrCo2PerH2(-9));
        assertEquals("Base SMR CO2 rate must be strictly positive: -9.0", e.getMessage());
    }

    @Test
    void testToString() {
        assertEquals("H2NetworkParameters(findPrices=false, priceTrackingStart=1.0, priceTrackingStop=10.0, priceTrackingStep=0.5, "
                + "priceHubs=[], priceDemand=0.1, baseSmrCo2PerH2=9.0, fractionalChec=true)", new H2NetworkParameters().toString());
    }
}
