/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FinancialParametersTest {

    @Test
    void testAnnuityFactor() {
        assertEquals(9.818147, new FinancialParameters(0.08, 20, 365, 0.02).getAnnuityFactor(), 1e-6);
        assertEquals(20, new FinancialParameters(0, 20, 365, 0.02).getAnnuityFactor(), 0);
    }

    @Test
    void testDailyCapitalCostFactor() {
        assertEquals(2.846281e-4, new FinancialParameters(0.08, 20, 365, 0.02).getDailyCapitalCostFactor(), 1e-9);
        assertEquals(1.0 / 3650, new FinancialParameters(0, 10, 365, 0).getDailyCapitalCostFactor(), 1e-12);
        assertEquals(new FinancialParameters(0.08, 20, 365, 0.02), new H2ModelParameters().getFinancialParameters());
    }
}
