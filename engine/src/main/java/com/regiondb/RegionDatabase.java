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
package com.regiondb;

import com.regiondb.engine.AppendLogStore;
import com.regiondb.engine.MergeOperator;
import com.regiondb.engine.OrderedStore;
import com.regiondb.engine.StoreFactory;
import com.regiondb.exception.DatabaseIsClosedException;
import com.regiondb.exception.ScopeNotFinalizedException;
import com.regiondb.index.ReferenceIndex;
import com.regiondb.index.RegionIndex;
import com.regiondb.label.LabelRegistry;
import com.regiondb.log.LogManager;
import com.regiondb.region.MarkStore;
import com.regiondb.region.RegionEntry;
import com.regiondb.region.ScopeRegistry;
import com.regiondb.region.ScopeState;
import com.regiondb.region.compaction.FinalizeOrchestrator;
import com.regiondb.region.compaction.FinalizeReport;
import com.regiondb.region.compaction.FinalizeResult;
import com.regiondb.region.compaction.ScopeFinalizer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;

/**
 * Region consolidation database. Producers {@link #insert} labeled ranges into scopes concurrently and in any order; once a scope
 * is complete it is finalized into a partition of maximal non-overlapping entries that can be queried by label
 * ({@link #references(int)}) or by scope ({@link #regions(int)}).
 * <p>
 * Inserting is thread-safe and lock-free. Finalizing a scope must not overlap with inserts into the same scope; different scopes can
 * be finalized concurrently, which is what {@link #finalizeAll()} does.
 */
public class RegionDatabase implements AutoCloseable {
  public static final String MARKERS_TREE    = "markers";
  public static final String SCOPES_TREE     = "scopes";
  public static final String REFERENCES_TREE = "references";
  public static final String REGIONS_TREE    = "regions";
  public static final String LABELS_TREE     = "labels";

  private final    ContextConfiguration configuration;
  private final    StoreFactory         storeFactory;
  private final    List<OrderedStore>   stores = new ArrayList<>();
  private final    ScopeRegistry        scopes;
  private final    MarkStore            markStore;
  private final    ReferenceIndex       referenceIndex;
  private final    RegionIndex          regionIndex;
  private final    LabelRegistry        labels;
  private final    ScopeFinalizer       finalizer;
  private final    FinalizeOrchestrator orchestrator;
  private volatile boolean              open   = true;

  public RegionDatabase() {
    this(new ContextConfiguration());
  }

  public RegionDatabase(final ContextConfiguration configuration) {
    this.configuration = configuration;
    this.storeFactory = new StoreFactory(configuration);

    try {
      this.scopes = new ScopeRegistry(openStore(SCOPES_TREE, MergeOperator.REPLACE));
      this.markStore = new MarkStore(openStore(MARKERS_TREE, MergeOperator.CONCATENATE), scopes);
      this.referenceIndex = new ReferenceIndex(openStore(REFERENCES_TREE, MergeOperator.REPLACE));
      this.regionIndex = new RegionIndex(openStore(REGIONS_TREE, MergeOperator.REPLACE));
      this.labels = new LabelRegistry(openStore(LABELS_TREE, MergeOperator.REPLACE));
    } catch (final RuntimeException e) {
      try {
        closeStores();
      } catch (final RuntimeException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }

    this.finalizer = new ScopeFinalizer(markStore, scopes, regionIndex, referenceIndex,
        configuration.getValueAsBoolean(GlobalConfiguration.FINALIZE_DEBUG));
    this.orchestrator = new FinalizeOrchestrator(finalizer, configuration.getValueAsInteger(GlobalConfiguration.FINALIZE_WORKER_THREADS));

    LogManager.instance().log(this, Level.FINE, "%s %s database opened (mode=%s)", null, Constants.PRODUCT, Constants.getRawVersion(),
        storeFactory.getMode());
  }

  /**
   * Records that {@code label} covers {@code [start, end)} of {@code scope}. Empty and inverted ranges are ignored.
   *
   * @return true if the mark was recorded
   */
  public boolean insert(final int scope, final int start, final int end, final int label) {
    checkOpen();
    return markStore.insert(scope, start, end, label);
  }

  /**
   * Interns {@code labelName} and records the mark under its id.
   */
  public boolean insert(final int scope, final int start, final int end, final String labelName) {
    checkOpen();
    return markStore.insert(scope, start, end, labels.intern(labelName));
  }

  /**
   * Consolidates the marks of {@code scope} and publishes its partition.
   *
   * @throws com.regiondb.exception.InvariantViolationException if the boundary records of the scope are inconsistent
   * @throws com.regiondb.exception.StorageException            on storage failures
   */
  public FinalizeResult finalizeScope(final int scope) {
    checkOpen();
    return finalizer.finalizeScope(scope);
  }

  /**
   * Finalizes every scope that received at least one mark, in parallel. Failures are reported per scope.
   */
  public FinalizeReport finalizeAll() {
    checkOpen();
    return orchestrator.finalizeAll(scopes.getScopes());
  }

  /**
   * Returns every published entry carrying {@code label}, in ascending (scope, start) order. Entries of scopes that are not currently
   * finalized are skipped.
   */
  public Iterator<RegionEntry> references(final int label) {
    checkOpen();
    return new FinalizedScopeFilter(referenceIndex.references(label));
  }

  /**
   * Returns the published entries of {@code scope} carrying {@code label}, in ascending start order.
   *
   * @throws ScopeNotFinalizedException if the scope is not finalized
   */
  public Iterator<RegionEntry> references(final int label, final int scope) {
    checkOpen();
    checkFinalized(scope);
    return referenceIndex.references(label, scope);
  }

  /**
   * Returns the whole partition of {@code scope}, in ascending start order.
   *
   * @throws ScopeNotFinalizedException if the scope is not finalized
   */
  public Iterator<RegionEntry> regions(final int scope) {
    checkOpen();
    checkFinalized(scope);
    return regionIndex.regions(scope);
  }

  /**
   * @return the state of the scope or null if it never received a mark
   */
  public ScopeState getScopeState(final int scope) {
    checkOpen();
    return scopes.getState(scope);
  }

  public List<Integer> getScopes() {
    checkOpen();
    return scopes.getScopes();
  }

  public LabelRegistry getLabels() {
    return labels;
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  public StoreFactory getStoreFactory() {
    return storeFactory;
  }

  /**
   * Rewrites the log of every persistent tree keeping only the live entries. No-op in memory mode.
   */
  public void compactLogs() {
    checkOpen();
    for (final OrderedStore store : stores)
      if (store instanceof AppendLogStore)
        ((AppendLogStore) store).compactLog();
  }

  public boolean isOpen() {
    return open;
  }

  @Override
  public synchronized void close() {
    if (!open)
      return;
    open = false;
    orchestrator.close();
    closeStores();
    LogManager.instance().log(this, Level.FINE, "Database closed");
  }

  private OrderedStore openStore(final String name, final MergeOperator mergeOperator) {
    final OrderedStore store = storeFactory.open(name, mergeOperator);
    stores.add(store);
    return store;
  }

  private void closeStores() {
    RuntimeException error = null;
    for (final OrderedStore store : stores) {
      try {
        store.close();
      } catch (final RuntimeException e) {
        LogManager.instance().log(this, Level.WARNING, "Error on closing tree '%s'", e, store.getName());
        if (error == null)
          error = e;
      }
    }
    stores.clear();
    if (error != null)
      throw error;
  }

  private void checkFinalized(final int scope) {
    final ScopeState state = scopes.getState(scope);
    if (state != ScopeState.FINALIZED)
      throw (ScopeNotFinalizedException) new ScopeNotFinalizedException(
          "Scope " + Integer.toUnsignedString(scope) + " is not finalized (state=" + (state != null ? state : "UNKNOWN") + ")")//
          .addContext("scope", Integer.toUnsignedString(scope));
  }

  private void checkOpen() {
    if (!open)
      throw new DatabaseIsClosedException("Database is closed");
  }

  /**
   * Skips the references of scopes that are not finalized, checking the state once per run of entries of the same scope.
   */
  private class FinalizedScopeFilter implements Iterator<RegionEntry> {
    private final Iterator<RegionEntry> entries;
    private       RegionEntry           next;
    private       int                   lastScope;
    private       boolean               lastScopeFinalized;
    private       boolean               checked = false;

    private FinalizedScopeFilter(final Iterator<RegionEntry> entries) {
      this.entries = entries;
    }

    @Override
    public boolean hasNext() {
      while (next == null && entries.hasNext()) {
        final RegionEntry candidate = entries.next();
        if (!checked || candidate.scope() != lastScope) {
          lastScope = candidate.scope();
          lastScopeFinalized = scopes.isFinalized(lastScope);
          checked = true;
        }
        if (lastScopeFinalized)
          next = candidate;
      }
      return next != null;
    }

    @Override
    public RegionEntry next() {
      if (!hasNext())
        throw new NoSuchElementException();
      final RegionEntry result = next;
      next = null;
      return result;
    }
  }
}
