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
class WakeFileReaderTest {

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
    void testComments() throws IOException {
        Path file = fileSystem.getPath("/wake.txt");
        Files.write(file, List.of("header", "% gdfidl style comment", "0.0 1.5 % trailing", "# full line", "0.1 2.0 # trailing", "  "));
        WakeTable table = WakeFileReader.read(file, 1);
        assertEquals(2, table.size());
        assertArrayEquals(new double[] {0.0, 0.1}, table.positions());
        assertArrayEquals(new double[] {1.5, 2.0}, table.values());
    }

    @Test
    void testReadLine() throws IOException {
        Path file = fileSystem.getPath("/header.txt");
        Files.write(file, List.of("first", "second", "third"));
        assertEquals("second", WakeFileReader.readLine(file, 2));
    }
}
