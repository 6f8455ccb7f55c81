/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import net.jafama.FastMath;

/**
 * Conversion of a one time capital outlay into a daily equivalent cost.
 *
 * @param interest yearly interest rate
 * @param period amortization period in years
 * @param timeSlices number of days per year
 * @param fixedCostPercent yearly operation and maintenance cost, as a fraction of capital
 */
public record FinancialParameters(double interest, int period, int timeSlices, double fixedCostPercent) {

    /**
     * Present value of an annuity of 1 paid every year of the period.
     */
    public double getAnnuityFactor() {
        if (interest == 0) {
            return period;
        }
        double compound = FastMath.pow(1 + interest, period);
        return (compound - 1) / (interest * compound);
    }

    /**
     * Factor to apply to a capital cost to get the daily equivalent cost, operation and maintenance included.
     */
    public double getDailyCapitalCostFactor() {
        return (1 + fixedCostPercent) / (getAnnuityFactor() * timeSlices);
    }
}
