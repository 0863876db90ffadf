/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.openwake.DataConsistencyException;
import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.TransverseAxis;
import com.powsybl.openwake.WakeConfigurationException;
import com.powsybl.openwake.WakeFileParseException;
import com.powsybl.openwake.WakeMode;
import com.powsybl.openwake.WakeSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Wake Impedance developers
 */
class WakeLoaderTest {

    private static final double DELTA = 1e-12;

    private FileSystem fileSystem;

    private Path wakeDir;

    private WakeLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        wakeDir = Files.createDirectories(fileSystem.getPath("/work/wakes"));
        loader = new WakeLoader();
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    private static void write(Path file, String... lines) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    }

    private static String[] gdfidlFile(String subtitle, String... rows) {
        List<String> lines = new ArrayList<>();
        lines.add("# gdfidl");
        lines.add("% title= \"wake potential\"");
        lines.add(subtitle);
        for (int i = 4; i <= 11; i++) {
            lines.add("% header line " + i);
        }
        Collections.addAll(lines, rows);
        return lines.toArray(new String[0]);
    }

    private static String dipoleSubtitle(double x, double y) {
        return "% subtitle= \"W_l (x,y)= ( " + x + ", " + y + " ) [m]\"";
    }

    private static SimulationParameters parameters(WakeSource source, WakeMode mode, TransverseAxis axis, boolean symmetric) {
        return SimulationParameters.builder()
                .setSource(source)
                .setMode(mode)
                .setAxis(axis)
                .setSymmetric(symmetric)
                .setBunchLength(1e-3)
                .build();
    }

    @Test
    void testEchoLongitudinal() throws IOException {
        write(wakeDir.resolve("wake.dat"), "0.0 1.5", "0.1 2.0  # comment", "", "0.2 -3.0 7.0");
        WakePotential wake = loader.load(wakeDir, parameters(WakeSource.ECHO, WakeMode.LONGITUDINAL, TransverseAxis.Y, true));
        assertArrayEquals(new double[] {0, 1e-3, 2e-3}, wake.getPositions(), DELTA);
        assertArrayEquals(new double[] {-1.5, -2.0, 3.0}, wake.getValues(), DELTA);
    }

    @Test
    void testEchoTransverse() throws IOException {
        write(wakeDir.resolve("wakeT.dat"), "0.0 1.5", "0.1 2.0");
        WakePotential wake = loader.load(wakeDir, parameters(WakeSource.ECHO, WakeMode.DIPOLE, TransverseAxis.Y, true));
        assertArrayEquals(new double[] {1.5, 2.0}, wake.getValues(), DELTA);

        SimulationParameters nonSymmetric = parameters(WakeSource.ECHO, WakeMode.DIPOLE, TransverseAxis.Y, false);
        var e = assertThrows(WakeConfigurationException.class, () -> loader.load(wakeDir, nonSymmetric));
        assertEquals("ECHO transverse wakes require a symmetric structure", e.getMessage());
    }

    @Test
    void testCst() throws IOException {
        write(wakeDir.resolve("wake.txt"), "s [mm]  W [V/pC]", "-----", "-1.0 4.0", "1.0 8.0");
        WakePotential longitudinal = loader.load(wakeDir, parameters(WakeSource.CST, WakeMode.LONGITUDINAL, TransverseAxis.Y, true));
        assertArrayEquals(new double[] {-1e-3, 1e-3}, longitudinal.getPositions(), DELTA);
        assertArrayEquals(new double[] {-4.0, -8.0}, longitudinal.getValues(), DELTA);
        WakePotential dipole = loader.load(wakeDir, parameters(WakeSource.CST, WakeMode.DIPOLE, TransverseAxis.X, true));
        assertArrayEquals(new double[] {-4.0, -8.0}, dipole.getValues(), DELTA);
    }

    @Test
    void testAce3p() throws IOException {
        write(wakeDir.resolve("wakefield.out"), "header 1", "header 2", "header 3", "0.0 1.0", "0.001 2.0", "0.002 3.0");
        WakePotential longitudinal = loader.load(wakeDir, parameters(WakeSource.ACE3P, WakeMode.LONGITUDINAL, TransverseAxis.Y, true));
        assertArrayEquals(new double[] {-5e-3, -4e-3, -3e-3}, longitudinal.getPositions(), DELTA);
        assertArrayEquals(new double[] {-1.0, -2.0, -3.0}, longitudinal.getValues(), DELTA);
        WakePotential quadrupole = loader.load(wakeDir, parameters(WakeSource.ACE3P, WakeMode.QUADRUPOLE, TransverseAxis.Y, true));
        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, quadrupole.getValues(), DELTA);
    }

    @Test
    void testGdfidlLongitudinal() throws IOException {
        write(wakeDir.resolve("Results-Wq_AT_XY.0001"), gdfidlFile(dipoleSubtitle(0, 0), "0.0 1.0", "1e-4 -2.0"));
        WakePotential wake = loader.load(wakeDir, parameters(WakeSource.GDFIDL, WakeMode.LONGITUDINAL, TransverseAxis.Y, true));
        assertArrayEquals(new double[] {0, 1e-4}, wake.getPositions(), DELTA);
        assertArrayEquals(new double[] {-1.0, 2.0}, wake.getValues(), DELTA);
    }

    @Test
    void testGdfidlSymmetricDipole() throws IOException {
        write(wakeDir.resolve("Results-Wq_AT_XY.0001"), gdfidlFile(dipoleSubtitle(2e-3, 0), "0.0 1.0", "1e-4 -2.0"));
        write(wakeDir.resolve("Results-WX_AT_XY.0001"), gdfidlFile("% subtitle= \"probe 1\"", "0.0 1.0", "1e-4 3.0"));
        write(wakeDir.resolve("Results-WX_AT_XY.0002"), gdfidlFile("% subtitle= \"probe 2\"", "0.0 3.0", "1e-4 5.0"));
        WakePotential wake = loader.load(wakeDir, parameters(WakeSource.GDFIDL, WakeMode.DIPOLE, TransverseAxis.X, true));
        assertArrayEquals(new double[] {2.0 / 2e-3, 4.0 / 2e-3}, wake.getValues(), 1e-9);
    }

    @Test
    void testGdfidlNonSymmetricDipole() throws IOException {
        Path plusDir = wakeDir.resolve("dydpl");
        Path minusDir = wakeDir.resolve("dydmi");
        write(plusDir.resolve("Results-Wq_AT_XY.0001"), gdfidlFile(dipoleSubtitle(0, 1e-3), "0.0 0.0", "1e-4 0.0"));
        write(plusDir.resolve("Results-WY_AT_XY.0001"), gdfidlFile("% subtitle= \"probe 1\"", "0.0 4.0", "1e-4 8.0"));
        write(plusDir.resolve("Results-WY_AT_XY.0002"), gdfidlFile("% subtitle= \"probe 2\"", "0.0 6.0", "1e-4 10.0"));
        write(minusDir.resolve("Results-WY_AT_XY.0001"), gdfidlFile("% subtitle= \"probe 1\"", "0.0 -4.0", "1e-4 -8.0"));
        SimulationParameters parameters = parameters(WakeSource.GDFIDL, WakeMode.DIPOLE, TransverseAxis.Y, false);

        var e = assertThrows(WakeConfigurationException.class, () -> loader.load(wakeDir, parameters));
        assertEquals("Non symmetric GdfidL dipole wake needs plus and minus displacement runs, missing files: /work/wakes/dydmi/Results-WY_AT_XY.0002",
                e.getMessage());

        write(minusDir.resolve("Results-WY_AT_XY.0002"), gdfidlFile("% subtitle= \"probe 2\"", "0.0 -6.0", "1e-4 -10.0"));
        WakePotential wake = loader.load(wakeDir, parameters);
        // ((plus average) - (minus average)) / 2 / offset
        assertArrayEquals(new double[] {5.0 / 1e-3, 9.0 / 1e-3}, wake.getValues(), 1e-9);
    }

    @Test
    void testGdfidlQuadrupole() throws IOException {
        String subtitle = "% subtitle= \"integral d/dy W(z) dz, (x,y)=( 0.0, 4.0e-3 )\"";
        write(wakeDir.resolve("Results-WY_AT_XY.0001"), gdfidlFile(subtitle, "0.0 2.0", "1e-4 6.0"));
        write(wakeDir.resolve("Results-WY_AT_XY.0002"), gdfidlFile(subtitle, "0.0 -2.0", "1e-4 2.0"));

        WakePotential symmetric = loader.load(wakeDir, parameters(WakeSource.GDFIDL, WakeMode.QUADRUPOLE, TransverseAxis.Y, true));
        assertArrayEquals(new double[] {-2.0 / 4e-3, -6.0 / 4e-3}, symmetric.getValues(), 1e-9);

        WakePotential nonSymmetric = loader.load(wakeDir, parameters(WakeSource.GDFIDL, WakeMode.QUADRUPOLE, TransverseAxis.Y, false));
        assertArrayEquals(new double[] {-2.0 / 4e-3, -2.0 / 4e-3}, nonSymmetric.getValues(), 1e-9);
    }

    @Test
    void testGdfidlInconsistentProbes() throws IOException {
        write(wakeDir.resolve("Results-Wq_AT_XY.0001"), gdfidlFile(dipoleSubtitle(1e-3, 1e-3), "0.0 1.0", "1e-4 -2.0"));
        write(wakeDir.resolve("Results-WY_AT_XY.0001"), gdfidlFile("% subtitle= \"probe 1\"", "0.0 1.0", "1e-4 3.0"));
        write(wakeDir.resolve("Results-WY_AT_XY.0002"), gdfidlFile("% subtitle= \"probe 2\"", "0.0 3.0"));
        SimulationParameters parameters = parameters(WakeSource.GDFIDL, WakeMode.DIPOLE, TransverseAxis.Y, true);
        var e = assertThrows(DataConsistencyException.class, () -> loader.load(wakeDir, parameters));
        assertEquals("Wake files '/work/wakes/Results-WY_AT_XY.0001' (2 rows) and '/work/wakes/Results-WY_AT_XY.0002' (1 rows) cannot be combined",
                e.getMessage());
    }

    @Test
    void testGdfidlInvalidOffset() throws IOException {
        write(wakeDir.resolve("Results-Wq_AT_XY.0001"), gdfidlFile(dipoleSubtitle(1e-3, 0), "0.0 1.0", "1e-4 -2.0"));
        write(wakeDir.resolve("Results-WY_AT_XY.0001"), gdfidlFile("% subtitle= \"probe 1\"", "0.0 1.0", "1e-4 3.0"));
        write(wakeDir.resolve("Results-WY_AT_XY.0002"), gdfidlFile("% subtitle= \"probe 2\"", "0.0 3.0", "1e-4 3.0"));
        SimulationParameters parameters = parameters(WakeSource.GDFIDL, WakeMode.DIPOLE, TransverseAxis.Y, true);
        var e = assertThrows(WakeFileParseException.class, () -> loader.load(wakeDir, parameters));
        assertEquals("Invalid Y offset 0.0 in '/work/wakes/Results-Wq_AT_XY.0001'", e.getMessage());
    }

    @Test
    void testMissingFile() {
        SimulationParameters parameters = parameters(WakeSource.ECHO, WakeMode.LONGITUDINAL, TransverseAxis.Y, true);
        var e = assertThrows(UncheckedIOException.class, () -> loader.load(wakeDir, parameters));
        assertEquals("Wake file not found: '/work/wakes/wake.dat'", e.getMessage());
    }

    @Test
    void testMalformedRow() throws IOException {
        write(wakeDir.resolve("wake.dat"), "0.0 1.5", "0.1 abc");
        SimulationParameters parameters = parameters(WakeSource.ECHO, WakeMode.LONGITUDINAL, TransverseAxis.Y, true);
        var e = assertThrows(WakeFileParseException.class, () -> loader.load(wakeDir, parameters));
        assertEquals("Invalid number 'abc' at line 2 of '/work/wakes/wake.dat'", e.getMessage());

        write(wakeDir.resolve("wake.dat"), "0.0 1.5", "0.1");
        e = assertThrows(WakeFileParseException.class, () -> loader.load(wakeDir, parameters));
        assertEquals("Expected 2 columns at line 2 of '/work/wakes/wake.dat'", e.getMessage());
    }

    @Test
    void testCopyToTargetDirectory() throws IOException {
        Path plusDir = wakeDir.resolve("dxdpl");
        Path minusDir = wakeDir.resolve("dxdmi");
        write(plusDir.resolve("Results-Wq_AT_XY.0001"), gdfidlFile(dipoleSubtitle(1e-3, 0), "0.0 0.0", "1e-4 0.0"));
        write(plusDir.resolve("Results-WX_AT_XY.0001"), gdfidlFile("% subtitle= \"probe 1\"", "0.0 1.0", "1e-4 1.0"));
        write(plusDir.resolve("Results-WX_AT_XY.0002"), gdfidlFile("% subtitle= \"probe 2\"", "0.0 1.0", "1e-4 1.0"));
        write(minusDir.resolve("Results-WX_AT_XY.0001"), gdfidlFile("% subtitle= \"probe 1\"", "0.0 -1.0", "1e-4 -1.0"));
        write(minusDir.resolve("Results-WX_AT_XY.0002"), gdfidlFile("% subtitle= \"probe 2\"", "0.0 -1.0", "1e-4 -1.0"));
        SimulationParameters parameters = parameters(WakeSource.GDFIDL, WakeMode.DIPOLE, TransverseAxis.X, false);

        Path targetDir = fileSystem.getPath("/work/results");
        WakePotential wake = loader.load(wakeDir, targetDir, parameters);
        assertArrayEquals(new double[] {1e3, 1e3}, wake.getValues(), 1e-9);
        assertTrue(Files.isRegularFile(targetDir.resolve("dxdpl/Results-Wq_AT_XY.0001")));
        assertTrue(Files.isRegularFile(targetDir.resolve("dxdpl/Results-WX_AT_XY.0001")));
        assertTrue(Files.isRegularFile(targetDir.resolve("dxdpl/Results-WX_AT_XY.0002")));
        assertTrue(Files.isRegularFile(targetDir.resolve("dxdmi/Results-WX_AT_XY.0001")));
        assertTrue(Files.isRegularFile(targetDir.resolve("dxdmi/Results-WX_AT_XY.0002")));
        assertEquals(Files.readString(minusDir.resolve("Results-WX_AT_XY.0002")), Files.readString(targetDir.resolve("dxdmi/Results-WX_AT_XY.0002")));
    }

    @Test
    void testNoCopyWhenWakeDirectoryIsInsideTarget() throws IOException {
        write(wakeDir.resolve("wake.dat"), "0.0 1.5", "0.1 2.0");
        SimulationParameters parameters = parameters(WakeSource.ECHO, WakeMode.LONGITUDINAL, TransverseAxis.Y, true);
        List<Path> copied = new ArrayList<>();
        WakeLoader recordingLoader = new WakeLoader(Runnable::run, false, (source, target) -> copied.add(target));

        recordingLoader.load(wakeDir, wakeDir, parameters);
        recordingLoader.load(wakeDir, fileSystem.getPath("/work"), parameters);
        assertTrue(copied.isEmpty());

        recordingLoader.load(wakeDir, fileSystem.getPath("/elsewhere"), parameters);
        assertEquals(List.of(fileSystem.getPath("/elsewhere/wake.dat")), copied);
    }

    @Test
    void testParallelRead() throws IOException {
        String subtitle = "% subtitle= \"integral d/dx W(z) dz, (x,y)=( 1.0e-3, 0.0 )\"";
        write(wakeDir.resolve("Results-WX_AT_XY.0001"), gdfidlFile(subtitle, "0.0 2.0", "1e-4 6.0", "2e-4 1.0"));
        write(wakeDir.resolve("Results-WX_AT_XY.0002"), gdfidlFile(subtitle, "0.0 -2.0", "1e-4 2.0", "2e-4 3.0"));
        SimulationParameters parameters = parameters(WakeSource.GDFIDL, WakeMode.QUADRUPOLE, TransverseAxis.X, false);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            WakePotential parallel = new WakeLoader(executor, true, WakeFileCopier.DEFAULT).load(wakeDir, parameters);
            assertEquals(loader.load(wakeDir, parameters), parallel);
        } finally {
            executor.shutdownNow();
        }
    }
}
