/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import com.powsybl.openhydrogen.input.CcsTechnology;
import com.powsybl.openhydrogen.network.H2Attribute;
import com.powsybl.openhydrogen.network.H2Element;
import com.powsybl.openhydrogen.network.H2Network;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Numeric coefficients of the model. Element coefficients are read from the element attributes and
 * default to 0 when absent.
 */
public class ModelParameters {

    private final H2Network network;

    private final Map<String, CcsTechnology> ccsTechnologies = new LinkedHashMap<>();

    private final H2ModelParameters settings;

    private final double dailyCapitalCostFactor;

    public ModelParameters(H2Network network, Collection<CcsTechnology> ccsTechnologies, H2ModelParameters settings) {
        this.network = Objects.requireNonNull(network);
        this.settings = Objects.requireNonNull(settings);
        for (CcsTechnology technology : ccsTechnologies) {
            this.ccsTechnologies.put(technology.getName(), technology);
        }
        this.dailyCapitalCostFactor = settings.getFinancialParameters().getDailyCapitalCostFactor();
    }

    public double get(H2Attribute attribute, H2Element element) {
        Objects.requireNonNull(element);
        if (element.getNetwork() != network) {
            throw new H2ModelException("Element '" + element.getId() + "' does not belong to network '" + network.getId() + "'");
        }
        return element.getAttribute(attribute);
    }

    public CcsTechnology getCcsTechnology(String name) {
        CcsTechnology technology = ccsTechnologies.get(name);
        if (technology == null) {
            throw new H2ModelException("CCS technology '" + name + "' is not part of the model");
        }
        return technology;
    }

    /**
     * Capture ratio giving the number of credits per ton of retrofitted hydrogen.
     */
    public double getCcsChecPerTon(String ccsTechnology) {
        return settings.isFractionalChec() ? getCcsTechnology(ccsTechnology).getCaptureFraction() : 1;
    }

    public H2ModelParameters getSettings() {
        return settings;
    }

    public double getDailyCapitalCostFactor() {
        return dailyCapitalCostFactor;
    }
}
