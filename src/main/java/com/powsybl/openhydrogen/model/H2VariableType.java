/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import com.powsybl.openhydrogen.network.ElementType;

public enum H2VariableType implements Quantity {
    DIST_CAPACITY("dist_capacity", ElementType.ARC, VariableDomain.INTEGER), // number of built units
    DIST_H("dist_h", ElementType.ARC, VariableDomain.CONTINUOUS), // flow, ton per day
    PROD_EXISTS("prod_exists", ElementType.NODE, VariableDomain.BINARY),
    PROD_CAPACITY("prod_capacity", ElementType.NODE, VariableDomain.CONTINUOUS),
    PROD_H("prod_h", ElementType.NODE, VariableDomain.CONTINUOUS),
    PROD_CHECS("prod_checs", ElementType.NODE, VariableDomain.CONTINUOUS),
    CONV_CAPACITY("conv_capacity", ElementType.NODE, VariableDomain.CONTINUOUS),
    CONS_H("cons_h", ElementType.NODE, VariableDomain.CONTINUOUS),
    CONS_CHECS("cons_checs", ElementType.NODE, VariableDomain.CONTINUOUS),
    CCS_BUILT("ccs_built", ElementType.NODE, VariableDomain.BINARY), // per existing producer and CCS technology
    CCS_CAPACITY_H2("ccs_capacity_h2", ElementType.NODE, VariableDomain.CONTINUOUS),
    CCS_CO2_CAPTURED("ccs_co2_captured", ElementType.NODE, VariableDomain.CONTINUOUS),
    CCS_CHECS("ccs_checs", ElementType.NODE, VariableDomain.CONTINUOUS),
    FUEL_STATION_SUBSIDY("fuelStation_cost_capital_subsidy", ElementType.NODE, VariableDomain.CONTINUOUS);

    private final String symbol;

    private final ElementType elementType;

    private final VariableDomain domain;

    H2VariableType(String symbol, ElementType elementType, VariableDomain domain) {
        this.symbol = symbol;
        this.elementType = elementType;
        this.domain = domain;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public ElementType getElementType() {
        return elementType;
    }

    public VariableDomain getDomain() {
        return domain;
    }
}
