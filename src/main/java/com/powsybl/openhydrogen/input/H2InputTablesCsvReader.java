/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads scenario input tables from a directory containing one CSV file per table.
 *
 * <p>Required files: {@code hubs.csv}, {@code distribution.csv}, {@code demand.csv}, {@code arcs.csv}.
 * Optional files: {@code production_thermal.csv}, {@code production_electric.csv},
 * {@code production_existing.csv}, {@code conversion.csv}, {@code ccs.csv}.</p>
 */
public final class H2InputTablesCsvReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(H2InputTablesCsvReader.class);

    private static final String BUILD_PREFIX = "build_";
    private static final String CCS_ELIGIBILITY_PREFIX = "can_";
    private static final String DEMAND_SUFFIX = "_tonnesperday";

    private H2InputTablesCsvReader() {
    }

    /**
     * One parsed CSV line, with access by column name.
     */
    private record Row(String file, int line, Map<String, String> values) {

        boolean has(String column) {
            String value = values.get(column);
            return value != null && !value.isBlank();
        }

        String getString(String column) {
            if (!has(column)) {
                throw new H2InputException("Missing value for column '" + column + "' in " + file + " line " + line);
            }
            return values.get(column).trim();
        }

        double getDouble(String column, double defaultValue) {
            if (!has(column)) {
                return defaultValue;
            }
            String value = values.get(column).trim();
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new H2InputException("Invalid number '" + value + "' for column '" + column + "' in " + file + " line " + line, e);
            }
        }

        double getDouble(String column) {
            getString(column);
            return getDouble(column, Double.NaN);
        }

        boolean getBoolean(String column) {
            if (!has(column)) {
                return false;
            }
            String value = values.get(column).trim();
            if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes")) {
                return true;
            }
            if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no")) {
                return false;
            }
            return getDouble(column, 0) != 0;
        }
    }

    private static List<Row> parseCsv(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            CsvParserSettings settings = new CsvParserSettings();
            settings.setHeaderExtractionEnabled(false);
            settings.setLineSeparatorDetectionEnabled(true);
            CsvParser parser = new CsvParser(settings);
            List<String[]> lines = parser.parseAll(reader);
            if (lines.isEmpty()) {
                return Collections.emptyList();
            }
            String[] headers = lines.get(0);
            List<Row> rows = new ArrayList<>(lines.size() - 1);
            for (int i = 1; i < lines.size(); i++) {
                String[] line = lines.get(i);
                Map<String, String> values = new LinkedHashMap<>();
                for (int j = 0; j < headers.length; j++) {
                    if (headers[j] != null) {
                        values.put(headers[j].trim(), j < line.length ? line[j] : null);
                    }
                }
                rows.add(new Row(file.getFileName().toString(), i + 1, values));
            }
            LOGGER.debug("{} rows read from {}", rows.size(), file);
            return rows;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<Row> parseRequired(Path directory, String fileName) {
        Path file = directory.resolve(fileName);
        if (!Files.exists(file)) {
            throw new H2InputException("Required input table '" + fileName + "' not found in " + directory);
        }
        return parseCsv(file);
    }

    private static List<Row> parseOptional(Path directory, String fileName) {
        Path file = directory.resolve(fileName);
        return Files.exists(file) ? parseCsv(file) : Collections.emptyList();
    }

    public static H2InputTables read(Path directory) {
        Objects.requireNonNull(directory);
        H2InputTables tables = new H2InputTables();
        for (Row row : parseRequired(directory, "hubs.csv")) {
            tables.addHub(readHub(row));
        }
        for (Row row : parseOptional(directory, "production_thermal.csv")) {
            tables.addProductionTechnology(readProductionTechnology(row, ProductionKind.THERMAL));
        }
        for (Row row : parseOptional(directory, "production_electric.csv")) {
            tables.addProductionTechnology(readProductionTechnology(row, ProductionKind.ELECTRIC));
        }
        for (Row row : parseOptional(directory, "production_existing.csv")) {
            tables.addExistingProducer(readExistingProducer(row));
        }
        for (Row row : parseRequired(directory, "distribution.csv")) {
            tables.addDistributionTechnology(new DistributionTechnology(row.getString("distributor"))
                    .setCapitalCost(row.getDouble("capital_usdPerUnit", 0))
                    .setFixedCost(row.getDouble("fixed_usdPerUnitPerDay", 0))
                    .setVariableCost(row.getDouble("variable_usdPerKilometer-Ton", 0))
                    .setFlowLimit(row.getDouble("flowLimit_tonsPerDay")));
        }
        for (Row row : parseOptional(directory, "conversion.csv")) {
            tables.addConversionTechnology(new ConversionTechnology(row.getString("converter"),
                    row.getString("arc_start_class"), row.getString("arc_end_class"))
                    .setCapitalCost(row.getDouble("capital_usdPerTonPerDay", 0))
                    .setFixedCost(row.getDouble("fixed_usdPerTonPerDay", 0))
                    .setVariableCost(row.getDouble("variable_usdPerTon", 0))
                    .setElectricityCost(row.getDouble("electricity_usdPerTon", 0))
                    .setUtilization(row.getDouble("utilization", 1)));
        }
        for (Row row : parseRequired(directory, "demand.csv")) {
            tables.addDemandSector(new DemandSector(row.getString("sector"), DemandCategory.fromTag(row.getString("demandType")))
                    .setCarbonSensitiveFraction(row.getDouble("carbonSensitiveFraction", 0))
                    .setBreakevenPrice(row.getDouble("breakevenPrice"))
                    .setBreakevenCarbonIntensity(row.getDouble("breakevenCarbon_g_MJ", 0)));
        }
        for (Row row : parseRequired(directory, "arcs.csv")) {
            tables.addHubConnection(new HubConnection(row.getString("startHub"), row.getString("endHub"),
                    row.getDouble("kmLength_euclid", Double.NaN), row.getDouble("kmLength_road", Double.NaN),
                    row.getBoolean("exist_pipeline")));
        }
        for (Row row : parseOptional(directory, "ccs.csv")) {
            tables.addCcsTechnology(new CcsTechnology(row.getString("type"), row.getDouble("percent_CO2_captured"))
                    .setH2TaxCredit(row.getDouble("h2_tax_credit", 0))
                    .setVariableCost(row.getDouble("variable_usdPerTonCO2", 0)));
        }
        return tables;
    }

    private static Hub readHub(Row row) {
        Hub hub = new Hub(row.getString("hub"))
                .setStatus(row.has("status") ? HubStatus.parse(row.getString("status")) : HubStatus.REGULAR)
                .setCapitalMultiplier(row.getDouble("capital_pm", 1))
                .setElectricityMultiplier(row.getDouble("e_pm", 1))
                .setNaturalGasMultiplier(row.getDouble("ng_pm", 1));
        for (String column : row.values().keySet()) {
            if (column.startsWith(BUILD_PREFIX) && row.getBoolean(column)) {
                hub.enableProduction(column.substring(BUILD_PREFIX.length()));
            } else if (column.endsWith(DEMAND_SUFFIX)) {
                hub.setSectorDemand(column.substring(0, column.length() - DEMAND_SUFFIX.length()), row.getDouble(column, 0));
            }
        }
        return hub;
    }

    private static ProductionTechnology readProductionTechnology(Row row, ProductionKind kind) {
        return new ProductionTechnology(row.getString("type"), kind, Purity.fromTag(row.getString("purity")))
                .setCapitalCost(row.getDouble("capital_usdPerTonPerDay", 0))
                .setFixedCost(row.getDouble("fixed_usdPerTonPerDay", 0))
                .setVariableCost(row.getDouble("variable_usdPerTon", 0))
                .setElectricityCost(row.getDouble("electricity_usdPerTon", 0))
                .setNaturalGasCost(row.getDouble("naturalGas_usdPerTon", 0))
                .setUtilization(row.getDouble("utilization", 1))
                .setMinSize(row.getDouble("min_h2", 0))
                .setMaxSize(row.getDouble("max_h2", ProductionTechnology.MAX_SIZE_DEFAULT_VALUE))
                .setCcsCaptureRate(row.getDouble("ccs_capture_rate", 0))
                .setGridIntensity(row.getDouble("grid_intensity_tonsCO2_per_h2", 0))
                .setH2TaxCredit(row.getDouble("h2_tax_credit", 0));
    }

    private static ExistingProducer readExistingProducer(Row row) {
        ExistingProducer producer = new ExistingProducer(row.getString("hub"), row.getString("type"), row.getDouble("capacity_tonPerDay"))
                .setUtilization(row.getDouble("utilization", 1))
                .setVariableCost(row.getDouble("variable_usdPerTon", 0))
                .setElectricityCost(row.getDouble("electricity_usdPerTon", 0))
                .setNaturalGasCost(row.getDouble("naturalGas_usdPerTon", 0))
                .setCo2EmissionsRate(row.getDouble("co2_emissions_per_h2_tons", 0));
        for (String column : row.values().keySet()) {
            if (column.startsWith(CCS_ELIGIBILITY_PREFIX) && row.getBoolean(column)) {
                producer.addEligibleCcsTechnology(column.substring(CCS_ELIGIBILITY_PREFIX.length()));
            }
        }
        return producer;
    }
}
