/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.output;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputTablesCsvWriterTest {

    private FileSystem fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testWrite() throws IOException {
        Path directory = fileSystem.getPath("/work/results");
        OutputTablesCsvWriter.write(OutputTablesFactory.create(), directory);

        List<String> production = Files.readAllLines(directory.resolve("production.csv"));
        assertEquals(2, production.size());
        assertEquals(String.join(",", ProductionRecord.COLUMNS), production.get(0));
        assertTrue(production.get(1).startsWith("A_production_smr,A,smr,false,21.0,1.0,20.0"));

        List<String> conversion = Files.readAllLines(directory.resolve("conversion.csv"));
        assertEquals(List.of(String.join(",", ConversionRecord.COLUMNS)), conversion);

        List<String> consumption = Files.readAllLines(directory.resolve("consumption.csv"));
        assertEquals(3, consumption.size());
        assertEquals("B_demandSector_refinery,B,refinery,false,1,20.0,0.0,5000.0,20.0", consumption.get(1));
        assertEquals("B_priceHighPurity_5,B,highPurity,true,0,0.1,0.0,5000.0,0.1", consumption.get(2));

        List<String> distribution = Files.readAllLines(directory.resolve("distribution.csv"));
        assertEquals(3, distribution.size());
        assertEquals("A_dist_pipelineHighPurity,B_dist_pipelineHighPurity,A,B,PIPELINE,pipeline,1.0,1000.0,0.0,10.0,1000.0,20.0",
                distribution.get(2));
    }
}
