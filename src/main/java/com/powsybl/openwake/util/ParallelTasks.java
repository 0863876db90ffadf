/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openwake.util;

import com.powsybl.commons.PowsyblException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Joins a batch of tasks submitted with {@link com.powsybl.computation.CompletableFutureTask}.
 *
 * @author Open Wake Impedance developers
 */
public final class ParallelTasks {

    private ParallelTasks() {
    }

    /**
     * Waits for all the futures. A failure of one task is rethrown unwrapped when unchecked. On interruption the
     * remaining tasks are cancelled, the interrupt flag is restored and a {@link PowsyblException} is thrown since
     * the results are incomplete.
     */
    public static void await(List<? extends CompletableFuture<?>> futures, String taskName) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(); // get instead of join to be notified of the interruption
        } catch (InterruptedException e) {
            // also interrupt worker threads
            for (var future : futures) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new PowsyblException("Interrupted during " + taskName, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new PowsyblException("Failure during " + taskName, cause);
        }
    }
}
