/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.openhydrogen.model.H2ModelParameters;
import com.powsybl.openhydrogen.network.H2NetworkParameters;
import com.powsybl.openhydrogen.output.DecomposerParameters;
import com.powsybl.openhydrogen.output.PriceTieBreak;
import com.powsybl.openhydrogen.solver.H2SolverParameters;

import java.util.*;

/**
 * Scenario settings, loaded from the {@code open-hydrogen-default-parameters} platform config module or from
 * a property map, and dispatched to the synthesizer, compiler, solver and decomposer.
 */
public class OpenHydrogenParameters {

    public static final String MODULE_NAME = "open-hydrogen-default-parameters";

    public static final String FIND_PRICES_PARAM_NAME = "findPrices";
    public static final String PRICE_TRACKING_START_PARAM_NAME = "priceTrackingStart";
    public static final String PRICE_TRACKING_STOP_PARAM_NAME = "priceTrackingStop";
    public static final String PRICE_TRACKING_STEP_PARAM_NAME = "priceTrackingStep";
    public static final String PRICE_HUBS_PARAM_NAME = "priceHubs";
    public static final String PRICE_DEMAND_PARAM_NAME = "priceDemand";
    public static final String CARBON_PRICE_PARAM_NAME = "carbonPrice";
    public static final String CARBON_CAPTURE_CREDIT_PARAM_NAME = "carbonCaptureCredit";
    public static final String BASE_SMR_CO2_PER_H2_PARAM_NAME = "baseSmrCo2PerH2";
    public static final String FRACTIONAL_CHEC_PARAM_NAME = "fractionalChec";
    public static final String INVESTMENT_INTEREST_PARAM_NAME = "investmentInterest";
    public static final String INVESTMENT_PERIOD_PARAM_NAME = "investmentPeriod";
    public static final String TIME_SLICES_PARAM_NAME = "timeSlices";
    public static final String FIXED_COST_PERCENT_PARAM_NAME = "fixedCostPercent";
    public static final String SUBSIDY_BUDGET_PARAM_NAME = "subsidyBudget";
    public static final String SUBSIDY_COST_SHARE_FRACTION_PARAM_NAME = "subsidyCostShareFraction";
    public static final String SOLVER_NAME_PARAM_NAME = "solver";
    public static final String MIP_GAP_PARAM_NAME = "mipGap";
    public static final String SOLVER_VERBOSE_PARAM_NAME = "solverVerbose";
    public static final String TIME_LIMIT_PARAM_NAME = "timeLimit";
    public static final String TOLERANCE_PARAM_NAME = "tolerance";
    public static final String PRICE_TIE_BREAK_PARAM_NAME = "priceTieBreak";

    public static final List<String> SPECIFIC_PARAMETERS_NAMES = List.of(FIND_PRICES_PARAM_NAME,
            PRICE_TRACKING_START_PARAM_NAME,
            PRICE_TRACKING_STOP_PARAM_NAME,
            PRICE_TRACKING_STEP_PARAM_NAME,
            PRICE_HUBS_PARAM_NAME,
            PRICE_DEMAND_PARAM_NAME,
            CARBON_PRICE_PARAM_NAME,
            CARBON_CAPTURE_CREDIT_PARAM_NAME,
            BASE_SMR_CO2_PER_H2_PARAM_NAME,
            FRACTIONAL_CHEC_PARAM_NAME,
            INVESTMENT_INTEREST_PARAM_NAME,
            INVESTMENT_PERIOD_PARAM_NAME,
            TIME_SLICES_PARAM_NAME,
            FIXED_COST_PERCENT_PARAM_NAME,
            SUBSIDY_BUDGET_PARAM_NAME,
            SUBSIDY_COST_SHARE_FRACTION_PARAM_NAME,
            SOLVER_NAME_PARAM_NAME,
            MIP_GAP_PARAM_NAME,
            SOLVER_VERBOSE_PARAM_NAME,
            TIME_LIMIT_PARAM_NAME,
            TOLERANCE_PARAM_NAME,
            PRICE_TIE_BREAK_PARAM_NAME);

    private final H2NetworkParameters networkParameters = new H2NetworkParameters();

    private final H2ModelParameters modelParameters = new H2ModelParameters();

    private final H2SolverParameters solverParameters = new H2SolverParameters();

    private final DecomposerParameters decomposerParameters = new DecomposerParameters();

    public H2NetworkParameters getNetworkParameters() {
        return networkParameters;
    }

    public H2ModelParameters getModelParameters() {
        return modelParameters;
    }

    public H2SolverParameters getSolverParameters() {
        return solverParameters;
    }

    public DecomposerParameters getDecomposerParameters() {
        return decomposerParameters;
    }

    /**
     * The SMR emission baseline is shared by the synthesizer and the compiler.
     */
    public OpenHydrogenParameters setBaseSmrCo2PerH2(double baseSmrCo2PerH2) {
        networkParameters.setBaseSmrCo2PerH2(baseSmrCo2PerH2);
        modelParameters.setBaseSmrCo2PerH2(baseSmrCo2PerH2);
        return this;
    }

    public OpenHydrogenParameters setFractionalChec(boolean fractionalChec) {
        networkParameters.setFractionalChec(fractionalChec);
        modelParameters.setFractionalChec(fractionalChec);
        return this;
    }

    public static OpenHydrogenParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OpenHydrogenParameters load(PlatformConfig platformConfig) {
        OpenHydrogenParameters parameters = new OpenHydrogenParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> {
                parameters.getNetworkParameters()
                    .setFindPrices(config.getBooleanProperty(FIND_PRICES_PARAM_NAME, H2NetworkParameters.FIND_PRICES_DEFAULT_VALUE))
                    .setPriceTrackingStart(config.getDoubleProperty(PRICE_TRACKING_START_PARAM_NAME, H2NetworkParameters.PRICE_TRACKING_START_DEFAULT_VALUE))
                    .setPriceTrackingStop(config.getDoubleProperty(PRICE_TRACKING_STOP_PARAM_NAME, H2NetworkParameters.PRICE_TRACKING_STOP_DEFAULT_VALUE))
                    .setPriceTrackingStep(config.getDoubleProperty(PRICE_TRACKING_STEP_PARAM_NAME, H2NetworkParameters.PRICE_TRACKING_STEP_DEFAULT_VALUE))
                    .setPriceHubs(config.getStringListProperty(PRICE_HUBS_PARAM_NAME, Collections.emptyList()))
                    .setPriceDemand(config.getDoubleProperty(PRICE_DEMAND_PARAM_NAME, H2NetworkParameters.PRICE_DEMAND_DEFAULT_VALUE));
                parameters.getModelParameters()
                    .setCarbonPrice(config.getDoubleProperty(CARBON_PRICE_PARAM_NAME, H2ModelParameters.CARBON_PRICE_DEFAULT_VALUE))
                    .setCarbonCaptureCredit(config.getDoubleProperty(CARBON_CAPTURE_CREDIT_PARAM_NAME, H2ModelParameters.CARBON_CAPTURE_CREDIT_DEFAULT_VALUE))
                    .setInvestmentInterest(config.getDoubleProperty(INVESTMENT_INTEREST_PARAM_NAME, H2ModelParameters.INVESTMENT_INTEREST_DEFAULT_VALUE))
                    .setInvestmentPeriod(config.getIntProperty(INVESTMENT_PERIOD_PARAM_NAME, H2ModelParameters.INVESTMENT_PERIOD_DEFAULT_VALUE))
                    .setTimeSlices(config.getIntProperty(TIME_SLICES_PARAM_NAME, H2ModelParameters.TIME_SLICES_DEFAULT_VALUE))
                    .setFixedCostPercent(config.getDoubleProperty(FIXED_COST_PERCENT_PARAM_NAME, H2ModelParameters.FIXED_COST_PERCENT_DEFAULT_VALUE))
                    .setSubsidyBudget(config.getDoubleProperty(SUBSIDY_BUDGET_PARAM_NAME, H2ModelParameters.SUBSIDY_BUDGET_DEFAULT_VALUE))
                    .setSubsidyCostShareFraction(config.getDoubleProperty(SUBSIDY_COST_SHARE_FRACTION_PARAM_NAME, H2ModelParameters.SUBSIDY_COST_SHARE_FRACTION_DEFAULT_VALUE));
                parameters.setBaseSmrCo2PerH2(config.getDoubleProperty(BASE_SMR_CO2_PER_H2_PARAM_NAME, H2ModelParameters.BASE_SMR_CO2_PER_H2_DEFAULT_VALUE))
                    .setFractionalChec(config.getBooleanProperty(FRACTIONAL_CHEC_PARAM_NAME, H2ModelParameters.FRACTIONAL_CHEC_DEFAULT_VALUE));
                parameters.getSolverParameters()
                    .setSolverName(config.getStringProperty(SOLVER_NAME_PARAM_NAME, H2SolverParameters.SOLVER_NAME_DEFAULT_VALUE))
                    .setMipGap(config.getDoubleProperty(MIP_GAP_PARAM_NAME, H2SolverParameters.MIP_GAP_DEFAULT_VALUE))
                    .setVerbose(config.getBooleanProperty(SOLVER_VERBOSE_PARAM_NAME, H2SolverParameters.VERBOSE_DEFAULT_VALUE))
                    .setTimeLimit(config.getIntProperty(TIME_LIMIT_PARAM_NAME, H2SolverParameters.TIME_LIMIT_DEFAULT_VALUE));
                parameters.getDecomposerParameters()
                    .setTolerance(config.getDoubleProperty(TOLERANCE_PARAM_NAME, DecomposerParameters.TOLERANCE_DEFAULT_VALUE))
                    .setPriceTieBreak(config.getEnumProperty(PRICE_TIE_BREAK_PARAM_NAME, PriceTieBreak.class, DecomposerParameters.PRICE_TIE_BREAK_DEFAULT_VALUE));
            });
        return parameters;
    }

    public static OpenHydrogenParameters load(Map<String, String> properties) {
        return new OpenHydrogenParameters().update(properties);
    }

    private static List<String> parseStringListProp(String prop) {
        if (prop.trim().isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(prop.split("[:,]"));
    }

    public OpenHydrogenParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(FIND_PRICES_PARAM_NAME))
                .ifPresent(prop -> networkParameters.setFindPrices(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(PRICE_TRACKING_START_PARAM_NAME))
                .ifPresent(prop -> networkParameters.setPriceTrackingStart(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(PRICE_TRACKING_STOP_PARAM_NAME))
                .ifPresent(prop -> networkParameters.setPriceTrackingStop(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(PRICE_TRACKING_STEP_PARAM_NAME))
                .ifPresent(prop -> networkParameters.setPriceTrackingStep(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(PRICE_HUBS_PARAM_NAME))
                .ifPresent(prop -> networkParameters.setPriceHubs(parseStringListProp(prop)));
        Optional.ofNullable(properties.get(PRICE_DEMAND_PARAM_NAME))
                .ifPresent(prop -> networkParameters.setPriceDemand(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(CARBON_PRICE_PARAM_NAME))
                .ifPresent(prop -> modelParameters.setCarbonPrice(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(CARBON_CAPTURE_CREDIT_PARAM_NAME))
                .ifPresent(prop -> modelParameters.setCarbonCaptureCredit(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(BASE_SMR_CO2_PER_H2_PARAM_NAME))
                .ifPresent(prop -> this.setBaseSmrCo2PerH2(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(FRACTIONAL_CHEC_PARAM_NAME))
                .ifPresent(prop -> this.setFractionalChec(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(INVESTMENT_INTEREST_PARAM_NAME))
                .ifPresent(prop -> modelParameters.setInvestmentInterest(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(INVESTMENT_PERIOD_PARAM_NAME))
                .ifPresent(prop -> modelParameters.setInvestmentPeriod(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(TIME_SLICES_PARAM_NAME))
                .ifPresent(prop -> modelParameters.setTimeSlices(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(FIXED_COST_PERCENT_PARAM_NAME))
                .ifPresent(prop -> modelParameters.setFixedCostPercent(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SUBSIDY_BUDGET_PARAM_NAME))
                .ifPresent(prop -> modelParameters.setSubsidyBudget(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SUBSIDY_COST_SHARE_FRACTION_PARAM_NAME))
                .ifPresent(prop -> modelParameters.setSubsidyCostShareFraction(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SOLVER_NAME_PARAM_NAME))
                .ifPresent(solverParameters::setSolverName);
        Optional.ofNullable(properties.get(MIP_GAP_PARAM_NAME))
                .ifPresent(prop -> solverParameters.setMipGap(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SOLVER_VERBOSE_PARAM_NAME))
                .ifPresent(prop -> solverParameters.setVerbose(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(TIME_LIMIT_PARAM_NAME))
                .ifPresent(prop -> solverParameters.setTimeLimit(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> decomposerParameters.setTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(PRICE_TIE_BREAK_PARAM_NAME))
                .ifPresent(prop -> decomposerParameters.setPriceTieBreak(PriceTieBreak.valueOf(prop)));
        return this;
    }

    @Override
    public String toString() {
        return "OpenHydrogenParameters(" +
                "networkParameters=" + networkParameters +
                ", modelParameters=" + modelParameters +
                ", solverParameters=" + solverParameters +
                ", decomposerParameters=" + decomposerParameters +
                ')';
    }
}
