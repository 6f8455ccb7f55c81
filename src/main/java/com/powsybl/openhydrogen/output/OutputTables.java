/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import java.util.*;

/**
 * Tolerance filtered solution of a scenario, as four canonical tables plus the discovered prices and a
 * summary of the objective.
 */
public class OutputTables {

    public static final String PRODUCTION = "production";
    public static final String CONVERSION = "conversion";
    public static final String CONSUMPTION = "consumption";
    public static final String DISTRIBUTION = "distribution";

    private final List<String> hubs;

    private final List<ProductionRecord> production;

    private final List<ConversionRecord> conversion;

    private final List<ConsumptionRecord> consumption;

    private final List<DistributionRecord> distribution;

    private final List<DiscoveredPrice> prices;

    private final Map<String, Double> summary;

    public OutputTables(List<String> hubs, List<ProductionRecord> production, List<ConversionRecord> conversion,
                        List<ConsumptionRecord> consumption, List<DistributionRecord> distribution,
                        List<DiscoveredPrice> prices, Map<String, Double> summary) {
        this.hubs = List.copyOf(Objects.requireNonNull(hubs));
        this.production = List.copyOf(Objects.requireNonNull(production));
        this.conversion = List.copyOf(Objects.requireNonNull(conversion));
        this.consumption = List.copyOf(Objects.requireNonNull(consumption));
        this.distribution = List.copyOf(Objects.requireNonNull(distribution));
        this.prices = List.copyOf(Objects.requireNonNull(prices));
        this.summary = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(summary)));
    }

    public List<String> getHubs() {
        return hubs;
    }

    public List<ProductionRecord> getProduction() {
        return production;
    }

    public List<ConversionRecord> getConversion() {
        return conversion;
    }

    public List<ConsumptionRecord> getConsumption() {
        return consumption;
    }

    public List<DistributionRecord> getDistribution() {
        return distribution;
    }

    public List<DiscoveredPrice> getPrices() {
        return prices;
    }

    public Map<String, Double> getSummary() {
        return summary;
    }

    public double getSummaryValue(String key) {
        return summary.getOrDefault(key, 0.0);
    }
}
