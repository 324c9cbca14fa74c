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

import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.RegionDBException;
import com.regiondb.index.ReferenceIndex;
import com.regiondb.index.RegionIndex;
import com.regiondb.log.LogManager;
import com.regiondb.region.BoundaryEventReader;
import com.regiondb.region.MarkStore;
import com.regiondb.region.RegionEntry;
import com.regiondb.region.ScopeRegistry;
import com.regiondb.region.ScopeState;
import com.regiondb.region.SweepEngine;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;

/**
 * Consolidates the marks of one scope and publishes the resulting partition.
 * <p>
 * The steps are:
 * <ol>
 *   <li>flag the scope as {@link ScopeState#FINALIZING}, hiding it from queries</li>
 *   <li>remove the partition published by a previous finalization, if any</li>
 *   <li>sweep the boundary records of the scope, writing every entry into the {@link RegionIndex} and, once per label, into the
 *   {@link ReferenceIndex}</li>
 *   <li>flag the scope as {@link ScopeState#FINALIZED}</li>
 * </ol>
 * On failure whatever was written for the scope is removed again and the scope is flagged {@link ScopeState#FAILED}: a scope is
 * either fully published or not at all. Finalizing the same marks again writes byte-identical records.
 * </p>
 * <p>
 * Different scopes can be finalized concurrently by the same instance. Inserting marks into a scope while it is being finalized is
 * not supported.
 * </p>
 */
public class ScopeFinalizer {
  private final MarkStore      markStore;
  private final ScopeRegistry  scopes;
  private final RegionIndex    regions;
  private final ReferenceIndex references;
  private final boolean        debug;
  private final Set<Integer>   inProgress = ConcurrentHashMap.newKeySet();

  public ScopeFinalizer(final MarkStore markStore, final ScopeRegistry scopes, final RegionIndex regions,
      final ReferenceIndex references, final boolean debug) {
    this.markStore = markStore;
    this.scopes = scopes;
    this.regions = regions;
    this.references = references;
    this.debug = debug;
  }

  /**
   * Finalizes a scope.
   *
   * @param scope the scope to finalize
   *
   * @return the result with the finalization metrics
   *
   * @throws RegionDBException if the scope cannot be finalized. The exception carries the error code of the failure, for example
   *                           {@link ErrorCode#REFCOUNT_UNDERFLOW} for a malformed event stream
   */
  public FinalizeResult finalizeScope(final int scope) {
    final FinalizeResult result = execute(scope);
    if (!result.success())
      throw result.error();
    return result;
  }

  /**
   * Finalizes a scope reporting any failure in the returned result instead of throwing it.
   *
   * @param scope the scope to finalize
   *
   * @return the result, successful or not
   */
  public FinalizeResult execute(final int scope) {
    final FinalizeMetrics metrics = new FinalizeMetrics();

    if (!inProgress.add(scope)) {
      metrics.stop();
      return FinalizeResult.failure(scope, metrics, new RegionDBException(ErrorCode.FINALIZATION_IN_PROGRESS,
          "Scope " + Integer.toUnsignedString(scope) + " is already being finalized").addContext("scope",
          Integer.toUnsignedString(scope)));
    }

    final LogManager logManager = LogManager.instance();
    final String previousContext = logManager.getContext();
    logManager.setContext("scope=" + Integer.toUnsignedString(scope));
    try {
      publish(scope, metrics);
      metrics.stop();

      logManager.log(this, Level.INFO, "Finalized scope: %d entries from %d boundary records in %dms", null,
          metrics.getEntriesWritten(), metrics.getRecordsRead(), metrics.getElapsedTime());

      if (debug)
        regions.printScope(scope, System.out);

      return FinalizeResult.success(scope, metrics);

    } catch (final RuntimeException e) {
      metrics.stop();
      logManager.log(this, Level.SEVERE, "Error on finalizing scope, its partition has been unpublished", e);
      rollback(scope, e);
      return FinalizeResult.failure(scope, metrics, e);

    } finally {
      logManager.setContext(previousContext);
      inProgress.remove(scope);
    }
  }

  private void publish(final int scope, final FinalizeMetrics metrics) {
    scopes.setState(scope, ScopeState.FINALIZING);
    metrics.addEntriesRemoved(unpublish(scope));

    final BoundaryEventReader reader = markStore.events(scope);
    final SweepEngine sweep = new SweepEngine(scope, reader);
    try {
      while (sweep.hasNext()) {
        final RegionEntry entry = sweep.next();
        regions.write(entry);
        references.write(entry);
        metrics.addEntry(entry.labels().length);
      }
    } finally {
      metrics.addSweep(reader.getRecordsRead(), sweep.getEventsApplied(), reader.getCancelled(), sweep.getGaps());
    }

    scopes.setState(scope, ScopeState.FINALIZED);
  }

  /**
   * Removes every published entry of the scope together with its references.
   *
   * @return the number of entries removed
   */
  private long unpublish(final int scope) {
    final List<RegionEntry> previous = regions.list(scope);
    for (final RegionEntry entry : previous) {
      references.remove(entry);
      regions.remove(entry);
    }
    return previous.size();
  }

  private void rollback(final int scope, final RuntimeException cause) {
    try {
      unpublish(scope);
    } catch (final RuntimeException e) {
      cause.addSuppressed(e);
    }
    try {
      scopes.setState(scope, ScopeState.FAILED);
    } catch (final RuntimeException e) {
      cause.addSuppressed(e);
    }
  }
}
