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

import com.regiondb.engine.MemoryOrderedStore;
import com.regiondb.engine.MergeOperator;
import com.regiondb.engine.StoreEntry;
import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.InvariantViolationException;
import com.regiondb.exception.RegionDBException;
import com.regiondb.index.ReferenceIndex;
import com.regiondb.index.RegionIndex;
import com.regiondb.region.BoundaryRecord;
import com.regiondb.region.MarkStore;
import com.regiondb.region.RegionEntry;
import com.regiondb.region.ScopeRegistry;
import com.regiondb.region.ScopeState;
import com.regiondb.serializer.KeySerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeFinalizerTest {
  private MemoryOrderedStore markers;
  private MemoryOrderedStore references;
  private MemoryOrderedStore regions;
  private ScopeRegistry      scopes;
  private MarkStore          markStore;
  private ReferenceIndex     referenceIndex;
  private RegionIndex        regionIndex;
  private ScopeFinalizer     finalizer;

  @BeforeEach
  void setUp() {
    markers = new MemoryOrderedStore("markers", MergeOperator.CONCATENATE);
    references = new MemoryOrderedStore("references", MergeOperator.REPLACE);
    regions = new MemoryOrderedStore("regions", MergeOperator.REPLACE);
    scopes = new ScopeRegistry(new MemoryOrderedStore("scopes", MergeOperator.REPLACE));
    markStore = new MarkStore(markers, scopes);
    referenceIndex = new ReferenceIndex(references);
    regionIndex = new RegionIndex(regions);
    finalizer = new ScopeFinalizer(markStore, scopes, regionIndex, referenceIndex, false);
  }

  @Test
  void publishesOneReferencePerLabel() {
    markStore.insert(1, 0, 10, 100);
    markStore.insert(1, 4, 5, 200);

    final FinalizeResult result = finalizer.finalizeScope(1);

    assertThat(result.success()).isTrue();
    assertThat(result.metrics().getEntriesWritten()).isEqualTo(3);
    assertThat(result.metrics().getReferencesWritten()).isEqualTo(4);
    assertThat(result.metrics().getRecordsRead()).isEqualTo(4);
    assertThat(scopes.getState(1)).isEqualTo(ScopeState.FINALIZED);

    assertThat(regions.size()).isEqualTo(3);
    assertThat(references.size()).isEqualTo(4);

    assertThat(toList(referenceIndex.references(200))).containsExactly(new RegionEntry(1, 4, 5, new int[] { 100, 200 }));
    assertThat(toList(referenceIndex.references(100))).containsExactly(new RegionEntry(1, 0, 4, new int[] { 100 }),
        new RegionEntry(1, 4, 5, new int[] { 100, 200 }), new RegionEntry(1, 5, 10, new int[] { 100 }));
  }

  @Test
  void referenceRecordLayout() {
    markStore.insert(3, 2, 8, 9);
    finalizer.finalizeScope(3);

    final byte[] value = references.get(KeySerializer.key(9, 3, 2, 8));
    assertThat(value).isEqualTo(new byte[] { 0, 0, 0, 9 });
    assertThat(regions.get(KeySerializer.key(3, 2, 8))).isEqualTo(new byte[] { 0, 0, 0, 9 });
  }

  @Test
  void finalizingTwiceIsByteIdentical() {
    markStore.insert(1, 0, 10, 1);
    markStore.insert(1, 3, 12, 2);
    markStore.insert(1, 20, 30, 1);

    finalizer.finalizeScope(1);
    final List<String> firstReferences = dump(references);
    final List<String> firstRegions = dump(regions);

    final FinalizeResult second = finalizer.finalizeScope(1);
    assertThat(dump(references)).isEqualTo(firstReferences);
    assertThat(dump(regions)).isEqualTo(firstRegions);
    assertThat(second.metrics().getEntriesRemoved()).isEqualTo(firstRegions.size());
  }

  @Test
  void refinalizeReplacesThePreviousPartition() {
    markStore.insert(1, 0, 10, 1);
    finalizer.finalizeScope(1);

    markStore.insert(1, 5, 15, 2);
    assertThat(scopes.getState(1)).isEqualTo(ScopeState.OPEN);
    finalizer.finalizeScope(1);

    assertThat(toList(regionIndex.regions(1))).containsExactly(new RegionEntry(1, 0, 5, new int[] { 1 }),
        new RegionEntry(1, 5, 10, new int[] { 1, 2 }), new RegionEntry(1, 10, 15, new int[] { 2 }));
    // THE OLD 0..10 ENTRY IS GONE FROM THE LABEL INDEX TOO
    assertThat(toList(referenceIndex.references(1))).containsExactly(new RegionEntry(1, 0, 5, new int[] { 1 }),
        new RegionEntry(1, 5, 10, new int[] { 1, 2 }));
  }

  @Test
  void underflowFailsTheScopeAndUnpublishesIt() {
    markStore.insert(1, 0, 10, 1);
    // A CLOSE OF LABEL 2 WITHOUT ANY OPEN
    markers.merge(KeySerializer.key(1, 20), BoundaryRecord.serialize(2, 20));

    assertThatThrownBy(() -> finalizer.finalizeScope(1)).isInstanceOf(InvariantViolationException.class)
        .satisfies(e -> assertThat(((InvariantViolationException) e).getErrorCode()).isEqualTo(ErrorCode.REFCOUNT_UNDERFLOW));

    assertThat(scopes.getState(1)).isEqualTo(ScopeState.FAILED);
    assertThat(regions.size()).isZero();
    assertThat(references.size()).isZero();
  }

  @Test
  void leakFailsTheScope() {
    // AN OPEN OF LABEL 4 UNTIL 9 WHOSE CLOSE WAS NEVER WRITTEN
    markers.merge(KeySerializer.key(2, 3), BoundaryRecord.serialize(4, 9));
    scopes.markOpen(2);

    final FinalizeResult result = finalizer.execute(2);
    assertThat(result.success()).isFalse();
    assertThat(result.error()).isInstanceOf(InvariantViolationException.class);
    assertThat(((RegionDBException) result.error()).getErrorCode()).isEqualTo(ErrorCode.ACTIVE_SET_LEAK);
    assertThat(scopes.getState(2)).isEqualTo(ScopeState.FAILED);
  }

  @Test
  void failedScopeCanBeRepairedAndFinalizedAgain() {
    markers.merge(KeySerializer.key(2, 3), BoundaryRecord.serialize(4, 9));
    assertThat(finalizer.execute(2).success()).isFalse();

    markers.merge(KeySerializer.key(2, 9), BoundaryRecord.serialize(4, 9));
    final FinalizeResult result = finalizer.finalizeScope(2);
    assertThat(result.success()).isTrue();
    assertThat(toList(regionIndex.regions(2))).containsExactly(new RegionEntry(2, 3, 9, new int[] { 4 }));
  }

  @Test
  void emptyScopeFinalizesToAnEmptyPartition() {
    final FinalizeResult result = finalizer.finalizeScope(77);
    assertThat(result.success()).isTrue();
    assertThat(result.getEntries()).isZero();
    assertThat(scopes.getState(77)).isEqualTo(ScopeState.FINALIZED);
  }

  @Test
  void otherScopesAreUntouched() {
    markStore.insert(1, 0, 10, 1);
    markStore.insert(2, 0, 10, 1);
    finalizer.finalizeScope(1);
    finalizer.finalizeScope(2);

    markers.merge(KeySerializer.key(2, 50), BoundaryRecord.serialize(1, 50));
    assertThat(finalizer.execute(2).success()).isFalse();

    assertThat(toList(referenceIndex.references(1))).containsExactly(new RegionEntry(1, 0, 10, new int[] { 1 }));
    assertThat(scopes.getState(1)).isEqualTo(ScopeState.FINALIZED);
  }

  @Test
  void concurrentFinalizeOfTheSameScopeIsRejected() throws Exception {
    final CountDownLatch writing = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final MemoryOrderedStore blockingRegions = new MemoryOrderedStore("regions", MergeOperator.REPLACE) {
      @Override
      public void put(final byte[] key, final byte[] value) {
        writing.countDown();
        try {
          release.await(10, TimeUnit.SECONDS);
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        super.put(key, value);
      }
    };
    final ScopeFinalizer blocking = new ScopeFinalizer(markStore, scopes, new RegionIndex(blockingRegions), referenceIndex, false);
    markStore.insert(4, 0, 10, 1);

    final CompletableFuture<FinalizeResult> first = CompletableFuture.supplyAsync(() -> blocking.execute(4));
    assertThat(writing.await(10, TimeUnit.SECONDS)).isTrue();

    final FinalizeResult second = blocking.execute(4);
    release.countDown();

    assertThat(second.success()).isFalse();
    assertThat(((RegionDBException) second.error()).getErrorCode()).isEqualTo(ErrorCode.FINALIZATION_IN_PROGRESS);
    assertThat(first.get(10, TimeUnit.SECONDS).success()).isTrue();
    assertThat(scopes.getState(4)).isEqualTo(ScopeState.FINALIZED);
  }

  private static List<String> dump(final MemoryOrderedStore store) {
    final List<String> result = new ArrayList<>();
    for (final Iterator<StoreEntry> it = store.range(null, null); it.hasNext(); ) {
      final StoreEntry entry = it.next();
      result.add(HexFormat.of().formatHex(entry.key()) + "=" + HexFormat.of().formatHex(entry.value()));
    }
    return result;
  }

  private static List<RegionEntry> toList(final Iterator<RegionEntry> iterator) {
    final List<RegionEntry> list = new ArrayList<>();
    iterator.forEachRemaining(list::add);
    return list;
  }
}
