/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.io;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.openwake.RingParameters;
import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.SyntheticWakes;
import com.powsybl.openwake.WakeAnalysis;
import com.powsybl.openwake.WakeAnalysisResult;
import com.powsybl.openwake.WakeMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Wake Impedance developers
 */
class WakeResultExporterTest {

    private FileSystem fileSystem;

    private Path outputDir;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        outputDir = fileSystem.getPath("/results");
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    private static WakeAnalysisResult analyze(WakeMode mode) {
        SimulationParameters simulationParameters = SimulationParameters.builder()
                .setMode(mode)
                .setBunchLength(1e-3)
                .build();
        return new WakeAnalysis(RingParameters.builder().build(), simulationParameters)
                .analyze(SyntheticWakes.resistive(100, 1e-3, -5e-3, 0.1, 1e-4));
    }

    private static double[][] readColumns(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file);
        double[][] columns = new double[2][lines.size()];
        for (int i = 0; i < lines.size(); i++) {
            String[] tokens = lines.get(i).trim().split("\\s+");
            assertEquals(2, tokens.length);
            columns[0][i] = Double.parseDouble(tokens[0]);
            columns[1][i] = Double.parseDouble(tokens[1]);
        }
        return columns;
    }

    @Test
    void testFormatRow() {
        String row = WakeResultExporter.formatRow(1.5, -2.25e-7, "%30.16g");
        assertEquals(61, row.length());
        String[] tokens = row.trim().split("\\s+");
        assertEquals(1.5, Double.parseDouble(tokens[0]));
        assertEquals(-2.25e-7, Double.parseDouble(tokens[1]));
        assertEquals(25, WakeResultExporter.formatRow(12.5, 0.001, "%12.8g").length());
    }

    @Test
    void testLossExport() throws IOException {
        WakeAnalysisResult result = analyze(WakeMode.LONGITUDINAL);
        WakeResultExporter.export(result, outputDir);

        double[][] wake = readColumns(outputDir.resolve("WlongECHO.txt"));
        double[] positions = result.wake().getPositions();
        for (int i = 0; i < positions.length; i++) {
            // 16 significant digits
            assertEquals(positions[i], wake[0][i], Math.abs(positions[i]) * 1e-15);
        }
        assertArrayEquals(result.wake().getValues(), wake[1], 1e-12);

        double[][] realImpedance = readColumns(outputDir.resolve("ReZlongECHO.txt"));
        assertArrayEquals(result.spectrum().getFrequencies(), realImpedance[0], 1e-3);
        assertArrayEquals(result.spectrum().getRealParts(), realImpedance[1], 1e-10);
        assertEquals(result.spectrum().size(), readColumns(outputDir.resolve("ImZlongECHO.txt"))[1].length);
        assertEquals(result.spectrum().getHarmonics().length, readColumns(outputDir.resolve("ImZoNlongECHO.txt"))[0].length);

        double[][] scan = readColumns(outputDir.resolve("KlossECHO.txt"));
        assertEquals(100, scan[0].length);
        assertEquals(1, scan[0][0], 1e-7);
        assertEquals(15, scan[0][99], 1e-6);
        assertEquals(result.curve().getFactors()[0], scan[1][0], Math.abs(result.curve().getFactors()[0]) * 1e-7);

        List<String> summary = Files.readAllLines(outputDir.resolve("Loss info_ECHO.txt"));
        assertEquals(4, summary.size());
        assertTrue(summary.get(0).startsWith("Loss factor Z = "));
        assertTrue(summary.get(1).startsWith("Loss factor W = "));
        assertTrue(summary.get(2).startsWith("Power Loss = "));
        assertTrue(summary.get(3).startsWith("for I =  500.0000 mA  h =   864  T0 = "));

        assertTrue(Files.isRegularFile(outputDir.resolve("globdatalongECHO.json.gz")));
        assertFalse(Files.exists(outputDir.resolve("Kick info_longECHO.txt")));
    }

    @Test
    void testKickExport() throws IOException {
        WakeAnalysisResult result = analyze(WakeMode.DIPOLE);
        WakeResultExporter.export(result, outputDir);

        double[][] imaginaryImpedance = readColumns(outputDir.resolve("ImZydipECHO.txt"));
        double[] imagParts = result.spectrum().getImagParts();
        for (int i = 0; i < imagParts.length; i++) {
            // kOhm/m
            assertEquals(imagParts[i] / 1000, imaginaryImpedance[1][i], Math.abs(imagParts[i]) * 1e-12 + 1e-15);
        }
        List<String> summary = Files.readAllLines(outputDir.resolve("Kick info_ydipECHO.txt"));
        assertEquals(2, summary.size());
        assertTrue(summary.get(0).startsWith("Kick Z = "));
        assertTrue(summary.get(1).startsWith("Kick W = "));
        assertEquals(100, readColumns(outputDir.resolve("KydipECHO.txt"))[0].length);
        assertTrue(Files.isRegularFile(outputDir.resolve("globdataydipECHO.json.gz")));
        assertFalse(Files.exists(outputDir.resolve("ImZoNydipECHO.txt")));
        assertFalse(Files.exists(outputDir.resolve("Loss info_ECHO.txt")));
    }
}
