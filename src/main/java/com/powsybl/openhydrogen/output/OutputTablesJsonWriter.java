/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.powsybl.commons.json.JsonUtil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the output tables as one document keyed by hub.
 */
public final class OutputTablesJsonWriter {

    private OutputTablesJsonWriter() {
    }

    public static void write(OutputTables tables, Path file) {
        Objects.requireNonNull(tables);
        Objects.requireNonNull(file);
        JsonUtil.writeJson(file, jsonGenerator -> write(tables, jsonGenerator));
    }

    public static void write(OutputTables tables, Writer writer) {
        Objects.requireNonNull(tables);
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = JsonUtil.createObjectMapper().getFactory().createGenerator(writer)) {
            jsonGenerator.useDefaultPrettyPrinter();
            write(tables, jsonGenerator);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void write(OutputTables tables, JsonGenerator jsonGenerator) {
        try {
            writeObject(jsonGenerator, SolutionDecomposer.perSite(tables));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeObject(JsonGenerator jsonGenerator, Map<String, ?> map) throws IOException {
        jsonGenerator.writeStartObject();
        for (Map.Entry<String, ?> e : map.entrySet()) {
            jsonGenerator.writeFieldName(e.getKey());
            writeValue(jsonGenerator, e.getValue());
        }
        jsonGenerator.writeEndObject();
    }

    @SuppressWarnings("unchecked")
    private static void writeValue(JsonGenerator jsonGenerator, Object value) throws IOException {
        if (value == null) {
            jsonGenerator.writeNull();
        } else if (value instanceof HubReport report) {
            writeObject(jsonGenerator, report.toMap());
        } else if (value instanceof Map<?, ?> map) {
            writeObject(jsonGenerator, (Map<String, ?>) map);
        } else if (value instanceof Double d) {
            jsonGenerator.writeNumber(d);
        } else if (value instanceof Integer i) {
            jsonGenerator.writeNumber(i);
        } else if (value instanceof Boolean b) {
            jsonGenerator.writeBoolean(b);
        } else {
            jsonGenerator.writeString(value.toString());
        }
    }
}
