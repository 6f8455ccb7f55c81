/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes one CSV file per output table.
 */
public final class OutputTablesCsvWriter {

    private static final String EXTENSION = ".csv";

    private OutputTablesCsvWriter() {
    }

    public static void write(OutputTables tables, Path directory) {
        Objects.requireNonNull(tables);
        Objects.requireNonNull(directory);
        try {
            Files.createDirectories(directory);
            writeTable(directory.resolve(OutputTables.PRODUCTION + EXTENSION), ProductionRecord.COLUMNS, tables.getProduction());
            writeTable(directory.resolve(OutputTables.CONVERSION + EXTENSION), ConversionRecord.COLUMNS, tables.getConversion());
            writeTable(directory.resolve(OutputTables.CONSUMPTION + EXTENSION), ConsumptionRecord.COLUMNS, tables.getConsumption());
            writeTable(directory.resolve(OutputTables.DISTRIBUTION + EXTENSION), DistributionRecord.COLUMNS, tables.getDistribution());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeTable(Path file, List<String> columns, List<? extends TableRow> rows) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            csvWriter.writeHeaders(columns);
            for (TableRow row : rows) {
                csvWriter.writeRow(row.toMap().values());
            }
            csvWriter.flush();
        }
    }
}
