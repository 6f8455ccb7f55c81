/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Settings of the network synthesis.
 */
public class H2NetworkParameters {

    public static final boolean FIND_PRICES_DEFAULT_VALUE = false;
    public static final double PRICE_TRACKING_START_DEFAULT_VALUE = 1;
    public static final double PRICE_TRACKING_STOP_DEFAULT_VALUE = 10;
    public static final double PRICE_TRACKING_STEP_DEFAULT_VALUE = 0.5;
    public static final double PRICE_DEMAND_DEFAULT_VALUE = 0.1;
    public static final double BASE_SMR_CO2_PER_H2_DEFAULT_VALUE = 9.0;
    public static final boolean FRACTIONAL_CHEC_DEFAULT_VALUE = true;

    private boolean findPrices = FIND_PRICES_DEFAULT_VALUE;

    private double priceTrackingStart = PRICE_TRACKING_START_DEFAULT_VALUE; // USD per kg

    private double priceTrackingStop = PRICE_TRACKING_STOP_DEFAULT_VALUE; // USD per kg, excluded

    private double priceTrackingStep = PRICE_TRACKING_STEP_DEFAULT_VALUE;

    private List<String> priceHubs = Collections.emptyList(); // empty means all hubs

    private double priceDemand = PRICE_DEMAND_DEFAULT_VALUE;

    private double baseSmrCo2PerH2 = BASE_SMR_CO2_PER_H2_DEFAULT_VALUE;

    private boolean fractionalChec = FRACTIONAL_CHEC_DEFAULT_VALUE;

    public boolean isFindPrices() {
        return findPrices;
    }

    public H2NetworkParameters setFindPrices(boolean findPrices) {
        this.findPrices = findPrices;
        return this;
    }

    public double getPriceTrackingStart() {
        return priceTrackingStart;
    }

    public H2NetworkParameters setPriceTrackingStart(double priceTrackingStart) {
        if (priceTrackingStart < 0) {
            throw new IllegalArgumentException("Price tracking start must be positive: " + priceTrackingStart);
        }
        this.priceTrackingStart = priceTrackingStart;
        return this;
    }

    public double getPriceTrackingStop() {
        return priceTrackingStop;
    }

    public H2NetworkParameters setPriceTrackingStop(double priceTrackingStop) {
        this.priceTrackingStop = priceTrackingStop;
        return this;
    }

    public double getPriceTrackingStep() {
        return priceTrackingStep;
    }

    public H2NetworkParameters setPriceTrackingStep(double priceTrackingStep) {
        if (priceTrackingStep <= 0) {
            throw new IllegalArgumentException("Price tracking step must be strictly positive: " + priceTrackingStep);
        }
        this.priceTrackingStep = priceTrackingStep;
        return this;
    }

    public List<String> getPriceHubs() {
        return priceHubs;
    }

    public H2NetworkParameters setPriceHubs(List<String> priceHubs) {
        this.priceHubs = List.copyOf(Objects.requireNonNull(priceHubs));
        return this;
    }

    public double getPriceDemand() {
        return priceDemand;
    }

    public H2NetworkParameters setPriceDemand(double priceDemand) {
        if (priceDemand <= 0) {
            throw new IllegalArgumentException("Price probe demand must be strictly positive: " + priceDemand);
        }
        this.priceDemand = priceDemand;
        return this;
    }

    public double getBaseSmrCo2PerH2() {
        return baseSmrCo2PerH2;
    }

    public H2NetworkParameters setBaseSmrCo2PerH2(double baseSmrCo2PerH2) {
        if (baseSmrCo2PerH2 <= 0) {
            throw new IllegalArgumentException("Base SMR CO2 rate must be strictly positive: " + baseSmrCo2PerH2);
        }
        this.baseSmrCo2PerH2 = baseSmrCo2PerH2;
        return this;
    }

    public boolean isFractionalChec() {
        return fractionalChec;
    }

    public H2NetworkParameters setFractionalChec(boolean fractionalChec) {
        this.fractionalChec = fractionalChec;
        return this;
    }

    /**
     * Probe prices in USD per kg: start, start + step, ... strictly below stop.
     */
    public List<Double> getPriceLadder() {
        List<Double> prices = new ArrayList<>();
        for (int i = 0;; i++) {
            double price = BigDecimal.valueOf(priceTrackingStart)
                    .add(BigDecimal.valueOf(priceTrackingStep).multiply(BigDecimal.valueOf(i)))
                    .doubleValue();
            if (price >= priceTrackingStop) {
                break;
            }
            prices.add(price);
        }
        return prices;
    }

    @Override
    public String toString() {
        return "H2NetworkParameters(" +
                "findPrices=" + findPrices +
                ", priceTrackingStart=" + priceTrackingStart +
                ", priceTrackingStop=" + priceTrackingStop +
                ", priceTrackingStep=" + priceTrackingStep +
                ", priceHubs=" + priceHubs +
                ", priceDemand=" + priceDemand +
                ", baseSmrCo2PerH2=" + baseSmrCo2PerH2 +
                ", fractionalChec=" + fractionalChec +
                ')';
    }
}
