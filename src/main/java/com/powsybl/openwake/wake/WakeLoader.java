/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.wake;

import com.google.common.base.Stopwatch;
import com.powsybl.computation.CompletableFutureTask;
import com.powsybl.openwake.SimulationParameters;
import com.powsybl.openwake.util.ParallelTasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Loads the wake files of a simulation and normalizes them to a {@link WakePotential}.
 *
 * @author Open Wake Impedance developers
 */
public class WakeLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(WakeLoader.class);

    private final Executor executor;

    private final boolean parallel;

    private final WakeFileCopier copier;

    public WakeLoader() {
        this(Runnable::run, false, WakeFileCopier.DEFAULT);
    }

    /**
     * @param executor executor used to read the files of multi file layouts concurrently
     * @param parallel if false, files are read one after the other in the calling thread
     * @param copier   collaborator copying the consumed files to the target directory
     */
    public WakeLoader(Executor executor, boolean parallel, WakeFileCopier copier) {
        this.executor = Objects.requireNonNull(executor);
        this.parallel = parallel;
        this.copier = Objects.requireNonNull(copier);
    }

    public WakePotential load(Path wakeDir, SimulationParameters parameters) {
        return load(wakeDir, wakeDir, parameters);
    }

    /**
     * Loads the wake from {@code wakeDir}. When {@code targetDir} is not {@code wakeDir} nor one of its parents,
     * every consumed file is also copied to {@code targetDir}, at the same relative path.
     */
    public WakePotential load(Path wakeDir, Path targetDir, SimulationParameters parameters) {
        Objects.requireNonNull(wakeDir);
        Objects.requireNonNull(targetDir);
        Objects.requireNonNull(parameters);

        Stopwatch stopwatch = Stopwatch.createStarted();

        WakeSourceFormat format = WakeSourceFormat.of(parameters.getSource());
        List<Path> wakeFiles = format.getWakeFiles(wakeDir, parameters);
        List<Path> headerFiles = format.getHeaderFiles(wakeDir, parameters);
        Set<Path> consumedFiles = new LinkedHashSet<>(wakeFiles);
        consumedFiles.addAll(headerFiles);
        format.checkFiles(new ArrayList<>(consumedFiles), parameters);

        List<WakeTable> tables = readTables(wakeFiles, format.getHeaderLineCount());
        WakePotential wake = format.toWakePotential(tables, wakeDir, parameters);

        if (isCopyNeeded(wakeDir, targetDir)) {
            for (Path file : consumedFiles) {
                // displacement runs have identical file names, keep them in their own sub directory
                copier.copy(file, targetDir.resolve(wakeDir.relativize(file).toString()));
            }
        }

        stopwatch.stop();
        LOGGER.info("{} {} wake loaded from '{}' ({} samples) in {} ms", parameters.getSource().getDisplayName(),
                parameters.getWakeTypeName(), wakeDir, wake.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));

        return wake;
    }

    static boolean isCopyNeeded(Path wakeDir, Path targetDir) {
        Path normalizedWakeDir = wakeDir.toAbsolutePath().normalize();
        Path normalizedTargetDir = targetDir.toAbsolutePath().normalize();
        return !normalizedWakeDir.startsWith(normalizedTargetDir);
    }

    private List<WakeTable> readTables(List<Path> files, int headerLineCount) {
        if (!parallel || files.size() == 1) {
            return files.stream().map(file -> readTable(file, headerLineCount)).toList();
        }

        // tables are stored by file index so that the combination order does not depend on completion order
        WakeTable[] tables = new WakeTable[files.size()];
        List<CompletableFuture<Void>> futures = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            final int fileNum = i;
            futures.add(CompletableFutureTask.runAsync(() -> {
                tables[fileNum] = readTable(files.get(fileNum), headerLineCount);
                return null;
            }, executor));
        }
        ParallelTasks.await(futures, "wake files reading");
        return Arrays.asList(tables);
    }

    private static WakeTable readTable(Path file, int headerLineCount) {
        LOGGER.debug("Reading wake file '{}'", file);
        return WakeFileReader.read(file, headerLineCount);
    }
}
