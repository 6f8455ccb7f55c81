/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import com.powsybl.openhydrogen.input.DemandCategory;

import java.util.*;

/**
 * Finds the market price of each tracked hub and demand category from the price probes: the price is the
 * breakeven price of a probe that consumed its whole demand.
 */
public class PriceDiscovery {

    private static final double RELATIVE_TOLERANCE = 1e-5;
    private static final double ABSOLUTE_TOLERANCE = 1e-8;

    private final PriceTieBreak tieBreak;

    public PriceDiscovery(PriceTieBreak tieBreak) {
        this.tieBreak = Objects.requireNonNull(tieBreak);
    }

    static boolean isClose(double a, double b) {
        return Math.abs(a - b) <= ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * Math.abs(b);
    }

    /**
     * @param probes price probe rows, in ladder order, the sector of a probe row being its demand category tag
     * @return the probe row setting the price, per hub and demand category
     */
    public List<ConsumptionRecord> findPriceSetters(List<ConsumptionRecord> probes) {
        Map<String, Map<String, List<ConsumptionRecord>>> probesByHubAndCategory = new LinkedHashMap<>();
        for (ConsumptionRecord probe : probes) {
            probesByHubAndCategory.computeIfAbsent(probe.hub(), h -> new LinkedHashMap<>())
                    .computeIfAbsent(probe.sector(), c -> new ArrayList<>())
                    .add(probe);
        }
        List<ConsumptionRecord> priceSetters = new ArrayList<>();
        probesByHubAndCategory.values().forEach(byCategory -> byCategory.values()
                .forEach(ladder -> select(ladder).ifPresent(priceSetters::add)));
        return priceSetters;
    }

    private Optional<ConsumptionRecord> select(List<ConsumptionRecord> ladder) {
        var buying = ladder.stream().filter(probe -> isClose(probe.consumption(), probe.size()));
        return switch (tieBreak) {
            case MINIMUM_PRICE -> buying.min(Comparator.comparingDouble(ConsumptionRecord::price));
            case FIRST_MATCH -> buying.findFirst();
        };
    }

    public List<DiscoveredPrice> discover(List<ConsumptionRecord> probes) {
        return findPriceSetters(probes).stream()
                .map(probe -> new DiscoveredPrice(probe.hub(), DemandCategory.fromTag(probe.sector()), probe.price(), probe.consumer()))
                .toList();
    }
}
