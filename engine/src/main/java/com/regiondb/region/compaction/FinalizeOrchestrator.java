/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.regiondb.region.compaction;

import com.regiondb.exception.RegionDBException;
import com.regiondb.log.LogManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * Finalizes many scopes in parallel on a fixed pool of daemon threads. Scopes are independent: each one is finalized by exactly one
 * worker and a failure is confined to its scope, reported in the {@link FinalizeReport} next to the scopes that succeeded.
 */
public final class FinalizeOrchestrator implements AutoCloseable {
  private final ScopeFinalizer  finalizer;
  private final int             workerThreads;
  private final ExecutorService executor;

  public FinalizeOrchestrator(final ScopeFinalizer finalizer, final int configuredThreads) {
    this.finalizer = finalizer;
    this.workerThreads = resolveWorkerThreads(configuredThreads);

    final AtomicInteger threadCounter = new AtomicInteger(0);
    this.executor = Executors.newFixedThreadPool(workerThreads, r -> {
      final Thread t = new Thread(r, "RegionDB-Finalizer-" + threadCounter.getAndIncrement());
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Returns the number of workers to use: {@code configured} if positive, otherwise the available cores minus one, at least 1.
   */
  public static int resolveWorkerThreads(final int configured) {
    if (configured > 0)
      return configured;
    return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
  }

  public FinalizeReport finalizeAll(final Collection<Integer> scopes) {
    final long beginTime = System.currentTimeMillis();

    final List<Integer> pending = new ArrayList<>(scopes);
    final List<CompletableFuture<FinalizeResult>> futures = new ArrayList<>(pending.size());
    for (final Integer scope : pending)
      futures.add(CompletableFuture.supplyAsync(() -> finalizer.execute(scope), executor));

    final List<FinalizeResult> results = new ArrayList<>(pending.size());
    for (int i = 0; i < futures.size(); ++i) {
      try {
        results.add(futures.get(i).join());
      } catch (final CompletionException e) {
        final int scope = pending.get(i);
        final FinalizeMetrics metrics = new FinalizeMetrics();
        metrics.stop();
        results.add(FinalizeResult.failure(scope, metrics,
            new RegionDBException("Error on finalizing scope " + Integer.toUnsignedString(scope), e.getCause())));
      }
    }

    final FinalizeReport report = new FinalizeReport(results, System.currentTimeMillis() - beginTime);
    LogManager.instance().log(this, report.isSuccess() ? Level.FINE : Level.WARNING, "Finalized %d scope(s) with %d worker(s): %s",
        null, pending.size(), workerThreads, report);
    return report;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS))
        executor.shutdownNow();
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
