/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.openhydrogen.input.CcsTechnology;
import com.powsybl.openhydrogen.model.*;
import com.powsybl.openhydrogen.network.*;
import com.powsybl.openhydrogen.solver.H2Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openhydrogen.util.Markers.PERFORMANCE_MARKER;

/**
 * Joins the solved variables into production, conversion, consumption and distribution tables.
 */
public class SolutionDecomposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SolutionDecomposer.class);

    public static final String OBJECTIVE = "objective";
    public static final String TOTAL_PRODUCTION = "totalProduction";
    public static final String TOTAL_CONSUMPTION = "totalConsumption";

    private static final String ARC_KEY_SEPARATOR = "_TO_";

    private final DecomposerParameters parameters;

    public SolutionDecomposer() {
        this(new DecomposerParameters());
    }

    public SolutionDecomposer(DecomposerParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public OutputTables decompose(H2Solution solution, H2OptimizationModel model) {
        Objects.requireNonNull(solution);
        Objects.requireNonNull(model);
        if (!solution.isSuccess()) {
            throw new PowsyblException("Cannot decompose a solution with status " + solution.getStatus());
        }

        Stopwatch stopwatch = Stopwatch.createStarted();

        List<ProductionRecord> production = createProductionRecords(solution, model);
        List<ConversionRecord> conversion = createConversionRecords(solution, model);

        List<ConsumptionRecord> consumption = new ArrayList<>();
        List<ConsumptionRecord> probes = new ArrayList<>();
        for (ConsumerNode consumer : model.getSets().getConsumers()) {
            ConsumptionRecord row = createConsumptionRecord(solution, model, consumer);
            if (consumer.isPriceProbe()) {
                probes.add(row);
            } else if (row.consumption() > parameters.getTolerance()) {
                consumption.add(row);
            }
        }
        double totalConsumption = consumption.stream().mapToDouble(ConsumptionRecord::consumption).sum();

        PriceDiscovery priceDiscovery = new PriceDiscovery(parameters.getPriceTieBreak());
        List<ConsumptionRecord> priceSetters = priceDiscovery.findPriceSetters(probes);
        consumption.addAll(priceSetters);
        List<DiscoveredPrice> prices = priceDiscovery.discover(probes);

        List<DistributionRecord> distribution = createDistributionRecords(solution, model);

        Map<String, Double> summary = new LinkedHashMap<>();
        summary.put(OBJECTIVE, solution.getObjectiveValue());
        model.evaluateObjectiveTerms(solution::getValue).forEach((term, value) -> summary.put(term.getLabel(), value));
        summary.put(TOTAL_PRODUCTION, production.stream().mapToDouble(ProductionRecord::output).sum());
        summary.put(TOTAL_CONSUMPTION, totalConsumption);

        stopwatch.stop();
        LOGGER.info(PERFORMANCE_MARKER, "Solution decomposed in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOGGER.info("Hydrogen consumed (tons/day): {}", summary.get(TOTAL_CONSUMPTION));
        LOGGER.info("Hydrogen produced (tons/day): {}", summary.get(TOTAL_PRODUCTION));
        for (DiscoveredPrice price : prices) {
            LOGGER.info("Price at hub '{}' for {}: {} USD/ton", price.hub(), price.category().getTag(), price.price());
        }

        return new OutputTables(model.getNetwork().getHubs(), production, conversion, consumption, distribution, prices, summary);
    }

    private static double value(H2Solution solution, H2OptimizationModel model, H2VariableType type, String elementId) {
        return solution.getValue(model.getVariable(type, elementId));
    }

    private static double value(H2Solution solution, H2OptimizationModel model, H2VariableType type, String elementId, String qualifier) {
        return solution.getValue(model.getVariable(type, elementId, qualifier));
    }

    private List<ProductionRecord> createProductionRecords(H2Solution solution, H2OptimizationModel model) {
        ModelParameters modelParameters = model.getParameters();
        H2ModelParameters settings = modelParameters.getSettings();
        List<ProductionRecord> records = new ArrayList<>();
        for (ProducerNode producer : model.getSets().getProducers()) {
            double capacity = value(solution, model, H2VariableType.PROD_CAPACITY, producer.getId());
            if (capacity <= parameters.getTolerance()) {
                continue;
            }
            double output = value(solution, model, H2VariableType.PROD_H, producer.getId());
            double co2EmissionsRate = modelParameters.get(H2Attribute.CO2_EMISSIONS_RATE, producer);
            double ccsCaptureRate = modelParameters.get(H2Attribute.CCS_CAPTURE_RATE, producer);
            double checPerTon = modelParameters.get(H2Attribute.CHEC_PER_TON, producer);
            double checs = value(solution, model, H2VariableType.PROD_CHECS, producer.getId());
            double h2TaxCredit = modelParameters.get(H2Attribute.H2_TAX_CREDIT, producer);
            double co2Captured = producer.isThermal() && !producer.isExisting()
                    ? settings.getBaseSmrCo2PerH2() * ccsCaptureRate * output
                    : 0;
            double ccsRetrofitVariableCost = 0;
            String ccsTechnology = null;

            // at most one retrofit is built, its values replace the producer ones
            if (producer.isExisting()) {
                for (CcsTechnology ccs : model.getSets().getCcsTechnologies()) {
                    if (value(solution, model, H2VariableType.CCS_BUILT, producer.getId(), ccs.getName()) > 0.5) {
                        ccsTechnology = ccs.getName();
                        co2Captured = value(solution, model, H2VariableType.CCS_CO2_CAPTURED, producer.getId(), ccs.getName());
                        checs = value(solution, model, H2VariableType.CCS_CHECS, producer.getId(), ccs.getName());
                        ccsRetrofitVariableCost = co2Captured * ccs.getVariableCost();
                        co2EmissionsRate *= 1 - ccs.getCaptureFraction();
                        checPerTon = modelParameters.getCcsChecPerTon(ccs.getName());
                        ccsCaptureRate = ccs.getCaptureFraction();
                        h2TaxCredit = ccs.getH2TaxCredit();
                        break;
                    }
                }
            }

            double capitalCost = modelParameters.get(H2Attribute.CAPITAL_COST, producer);
            double variableCost = modelParameters.get(H2Attribute.VARIABLE_COST, producer);
            double electricityCost = modelParameters.get(H2Attribute.ELECTRICITY_COST, producer);
            double naturalGasCost = modelParameters.get(H2Attribute.NATURAL_GAS_COST, producer);
            double co2Emitted = co2EmissionsRate * output;
            double carbonTax = co2Emitted * settings.getCarbonPrice();
            double carbonCaptureTaxCredit = co2Captured * settings.getCarbonCaptureCredit();
            double totalCost = capacity * capitalCost * modelParameters.getDailyCapitalCostFactor()
                    + output * (variableCost + electricityCost + naturalGasCost)
                    + ccsRetrofitVariableCost
                    + carbonTax
                    - carbonCaptureTaxCredit
                    - output * h2TaxCredit;

            records.add(new ProductionRecord(producer.getId(), producer.getHub(), producer.getTechnology(), producer.isExisting(),
                    capacity, modelParameters.get(H2Attribute.UTILIZATION, producer), output, capitalCost,
                    modelParameters.get(H2Attribute.FIXED_COST, producer), variableCost, electricityCost, naturalGasCost,
                    h2TaxCredit, co2EmissionsRate, ccsCaptureRate, checPerTon, checs, ccsTechnology, ccsRetrofitVariableCost,
                    co2Emitted, carbonTax, co2Captured, carbonCaptureTaxCredit, totalCost));
        }
        return records;
    }

    private List<ConversionRecord> createConversionRecords(H2Solution solution, H2OptimizationModel model) {
        ModelParameters modelParameters = model.getParameters();
        List<ConversionRecord> records = new ArrayList<>();
        for (ConverterNode converter : model.getSets().getConverters()) {
            double capacity = value(solution, model, H2VariableType.CONV_CAPACITY, converter.getId());
            if (capacity <= parameters.getTolerance()) {
                continue;
            }
            double subsidy = converter.isFuelDispenser()
                    ? value(solution, model, H2VariableType.FUEL_STATION_SUBSIDY, converter.getId())
                    : 0;
            records.add(new ConversionRecord(converter.getId(), converter.getHub(), converter.getTechnology(), capacity,
                    modelParameters.get(H2Attribute.CAPITAL_COST, converter),
                    modelParameters.get(H2Attribute.FIXED_COST, converter),
                    modelParameters.get(H2Attribute.VARIABLE_COST, converter),
                    modelParameters.get(H2Attribute.ELECTRICITY_COST, converter),
                    modelParameters.get(H2Attribute.UTILIZATION, converter),
                    subsidy));
        }
        return records;
    }

    private static ConsumptionRecord createConsumptionRecord(H2Solution solution, H2OptimizationModel model, ConsumerNode consumer) {
        ModelParameters modelParameters = model.getParameters();
        String sector = consumer.isPriceProbe() ? consumer.getCategory().getTag() : consumer.getSector();
        return new ConsumptionRecord(consumer.getId(), consumer.getHub(), sector, consumer.isPriceProbe(),
                consumer.isCarbonSensitive(),
                value(solution, model, H2VariableType.CONS_H, consumer.getId()),
                value(solution, model, H2VariableType.CONS_CHECS, consumer.getId()),
                modelParameters.get(H2Attribute.BREAKEVEN_PRICE, consumer),
                modelParameters.get(H2Attribute.SIZE, consumer));
    }

    private List<DistributionRecord> createDistributionRecords(H2Solution solution, H2OptimizationModel model) {
        ModelParameters modelParameters = model.getParameters();
        List<DistributionRecord> records = new ArrayList<>();
        for (H2Arc arc : model.getSets().getDistributionArcs()) {
            double flow = value(solution, model, H2VariableType.DIST_H, arc.getId());
            if (flow <= parameters.getTolerance()) {
                continue;
            }
            records.add(new DistributionRecord(arc.getStart().getId(), arc.getEnd().getId(),
                    arc.getStart().getHub(), arc.getEnd().getHub(), arc.getType(), arc.getTechnology().orElse(null),
                    value(solution, model, H2VariableType.DIST_CAPACITY, arc.getId()),
                    modelParameters.get(H2Attribute.CAPITAL_COST, arc),
                    modelParameters.get(H2Attribute.FIXED_COST, arc),
                    modelParameters.get(H2Attribute.VARIABLE_COST, arc),
                    modelParameters.get(H2Attribute.FLOW_LIMIT, arc),
                    flow));
        }
        return records;
    }

    private static String localId(String id, String hub) {
        String prefix = hub + "_";
        return id.startsWith(prefix) ? id.substring(prefix.length()) : id;
    }

    private static <R extends TableRow> Map<String, Map<String, Object>> rowsOf(List<R> rows, String hub) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (R row : rows) {
            if (row.getHub().equals(hub)) {
                result.put(localId(row.getId(), hub), row.toMap());
            }
        }
        return result;
    }

    /**
     * Restricts the output tables to one hub.
     */
    public static HubReport perSite(OutputTables tables, String hub) {
        Objects.requireNonNull(tables);
        Objects.requireNonNull(hub);
        Map<String, Map<String, Object>> local = new LinkedHashMap<>();
        Map<String, Map<String, Object>> outgoing = new LinkedHashMap<>();
        Map<String, Map<String, Object>> incoming = new LinkedHashMap<>();
        for (DistributionRecord row : tables.getDistribution()) {
            boolean fromHub = row.startHub().equals(hub);
            boolean toHub = row.endHub().equals(hub);
            if (fromHub && toHub) {
                local.put(localId(row.arcStart(), hub) + ARC_KEY_SEPARATOR + localId(row.arcEnd(), hub), row.toMap());
            } else if (fromHub) {
                outgoing.put(localId(row.arcStart(), hub) + ARC_KEY_SEPARATOR + row.arcEnd(), row.toMap());
            } else if (toHub) {
                incoming.put(row.arcStart() + ARC_KEY_SEPARATOR + localId(row.arcEnd(), hub), row.toMap());
            }
        }
        return new HubReport(hub,
                rowsOf(tables.getProduction(), hub),
                rowsOf(tables.getConversion(), hub),
                rowsOf(tables.getConsumption(), hub),
                local,
                outgoing,
                incoming);
    }

    public static Map<String, HubReport> perSite(OutputTables tables) {
        Objects.requireNonNull(tables);
        Map<String, HubReport> reports = new LinkedHashMap<>();
        for (String hub : tables.getHubs()) {
            reports.put(hub, perSite(tables, hub));
        }
        return reports;
    }
}
