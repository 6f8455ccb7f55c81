/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

/**
 * Settings of the model compilation: economic data and credit accounting options.
 */
public class H2ModelParameters {

    public static final double CARBON_PRICE_DEFAULT_VALUE = 0;
    public static final double CARBON_CAPTURE_CREDIT_DEFAULT_VALUE = 0;
    public static final double BASE_SMR_CO2_PER_H2_DEFAULT_VALUE = 9.0;
    public static final boolean FRACTIONAL_CHEC_DEFAULT_VALUE = true;
    public static final double INVESTMENT_INTEREST_DEFAULT_VALUE = 0.08;
    public static final int INVESTMENT_PERIOD_DEFAULT_VALUE = 20;
    public static final int TIME_SLICES_DEFAULT_VALUE = 365;
    public static final double FIXED_COST_PERCENT_DEFAULT_VALUE = 0.02;
    public static final double SUBSIDY_BUDGET_DEFAULT_VALUE = 0;
    public static final double SUBSIDY_COST_SHARE_FRACTION_DEFAULT_VALUE = 1;

    private double carbonPrice = CARBON_PRICE_DEFAULT_VALUE; // USD per ton CO2

    private double carbonCaptureCredit = CARBON_CAPTURE_CREDIT_DEFAULT_VALUE; // USD per ton CO2

    private double baseSmrCo2PerH2 = BASE_SMR_CO2_PER_H2_DEFAULT_VALUE;

    private boolean fractionalChec = FRACTIONAL_CHEC_DEFAULT_VALUE;

    private double investmentInterest = INVESTMENT_INTEREST_DEFAULT_VALUE;

    private int investmentPeriod = INVESTMENT_PERIOD_DEFAULT_VALUE; // years

    private int timeSlices = TIME_SLICES_DEFAULT_VALUE; // days per year

    private double fixedCostPercent = FIXED_COST_PERCENT_DEFAULT_VALUE;

    private double subsidyBudget = SUBSIDY_BUDGET_DEFAULT_VALUE; // billion USD

    private double subsidyCostShareFraction = SUBSIDY_COST_SHARE_FRACTION_DEFAULT_VALUE;

    public double getCarbonPrice() {
        return carbonPrice;
    }

    public H2ModelParameters setCarbonPrice(double carbonPrice) {
        this.carbonPrice = carbonPrice;
        return this;
    }

    public double getCarbonCaptureCredit() {
        return carbonCaptureCredit;
    }

    public H2ModelParameters setCarbonCaptureCredit(double carbonCaptureCredit) {
        this.carbonCaptureCredit = carbonCaptureCredit;
        return this;
    }

    public double getBaseSmrCo2PerH2() {
        return baseSmrCo2PerH2;
    }

    public H2ModelParameters setBaseSmrCo2PerH2(double baseSmrCo2PerH2) {
        if (baseSmrCo2PerH2 <= 0) {
            throw new IllegalArgumentException("Base SMR CO2 rate must be strictly positive: " + baseSmrCo2PerH2);
        }
        this.baseSmrCo2PerH2 = baseSmrCo2PerH2;
        return this;
    }

    public boolean isFractionalChec() {
        return fractionalChec;
    }

    public H2ModelParameters setFractionalChec(boolean fractionalChec) {
        this.fractionalChec = fractionalChec;
        return this;
    }

    public double getInvestmentInterest() {
        return investmentInterest;
    }

    public H2ModelParameters setInvestmentInterest(double investmentInterest) {
        if (investmentInterest < 0) {
            throw new IllegalArgumentException("Investment interest must be positive: " + investmentInterest);
        }
        this.investmentInterest = investmentInterest;
        return this;
    }

    public int getInvestmentPeriod() {
        return investmentPeriod;
    }

    public H2ModelParameters setInvestmentPeriod(int investmentPeriod) {
        if (investmentPeriod < 1) {
            throw new IllegalArgumentException("Investment period must be at least one year: " + investmentPeriod);
        }
        this.investmentPeriod = investmentPeriod;
        return this;
    }

    public int getTimeSlices() {
        return timeSlices;
    }

    public H2ModelParameters setTimeSlices(int timeSlices) {
        if (timeSlices < 1) {
            throw new IllegalArgumentException("Time slices must be at least 1: " + timeSlices);
        }
        this.timeSlices = timeSlices;
        return this;
    }

    public double getFixedCostPercent() {
        return fixedCostPercent;
    }

    public H2ModelParameters setFixedCostPercent(double fixedCostPercent) {
        if (fixedCostPercent < 0) {
            throw new IllegalArgumentException("Fixed cost percent must be positive: " + fixedCostPercent);
        }
        this.fixedCostPercent = fixedCostPercent;
        return this;
    }

    public double getSubsidyBudget() {
        return subsidyBudget;
    }

    public H2ModelParameters setSubsidyBudget(double subsidyBudget) {
        if (subsidyBudget < 0) {
            throw new IllegalArgumentException("Subsidy budget must be positive: " + subsidyBudget);
        }
        this.subsidyBudget = subsidyBudget;
        return this;
    }

    public double getSubsidyCostShareFraction() {
        return subsidyCostShareFraction;
    }

    public H2ModelParameters setSubsidyCostShareFraction(double subsidyCostShareFraction) {
        if (subsidyCostShareFraction < 0 || subsidyCostShareFraction > 1) {
            throw new IllegalArgumentException("Subsidy cost share fraction must be between 0 and 1: " + subsidyCostShareFraction);
        }
        this.subsidyCostShareFraction = subsidyCostShareFraction;
        return this;
    }

    public FinancialParameters getFinancialParameters() {
        return new FinancialParameters(investmentInterest, investmentPeriod, timeSlices, fixedCostPercent);
    }

    @Override
    public String toString() {
        return "H2ModelParameters(" +
                "carbonPrice=" + carbonPrice +
                ", carbonCaptureCredit=" + carbonCaptureCredit +
                ", baseSmrCo2PerH2=" + baseSmrCo2PerH2 +
                ", fractionalChec=" + fractionalChec +
                ", investmentInterest=" + investmentInterest +
                ", investmentPeriod=" + investmentPeriod +
                ", timeSlices=" + timeSlices +
                ", fixedCostPercent=" + fixedCostPercent +
                ", subsidyBudget=" + subsidyBudget +
                ", subsidyCostShareFraction=" + subsidyCostShareFraction +
                ')';
    }
}
