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
package com.regiondb.region;

import com.regiondb.engine.MemoryOrderedStore;
import com.regiondb.engine.MergeOperator;
import com.regiondb.engine.StoreEntry;
import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.InvariantViolationException;
import com.regiondb.serializer.KeySerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarkStoreTest {
  private MemoryOrderedStore markers;
  private ScopeRegistry      scopes;
  private MarkStore          markStore;

  @BeforeEach
  void setUp() {
    markers = new MemoryOrderedStore("markers", MergeOperator.CONCATENATE);
    scopes = new ScopeRegistry(new MemoryOrderedStore("scopes", MergeOperator.REPLACE));
    markStore = new MarkStore(markers, scopes);
  }

  @Test
  void insertWritesOneRecordAtEachBoundary() {
    assertThat(markStore.insert(1, 10, 20, 7)).isTrue();

    final byte[] expected = { 0, 0, 0, 7, 0, 0, 0, 20 };
    assertThat(markers.get(KeySerializer.key(1, 10))).isEqualTo(expected);
    assertThat(markers.get(KeySerializer.key(1, 20))).isEqualTo(expected);
    assertThat(markers.size()).isEqualTo(2);
    assertThat(scopes.getState(1)).isEqualTo(ScopeState.OPEN);
  }

  @Test
  void recordsOnTheSameKeyAreConcatenated() {
    markStore.insert(1, 10, 20, 7);
    markStore.insert(1, 10, 30, 8);

    final byte[] value = markers.get(KeySerializer.key(1, 10));
    assertThat(BoundaryRecord.count(value)).isEqualTo(2);
    assertThat(BoundaryRecord.label(value, 0)).isEqualTo(7);
    assertThat(BoundaryRecord.end(value, 0)).isEqualTo(20);
    assertThat(BoundaryRecord.label(value, 1)).isEqualTo(8);
    assertThat(BoundaryRecord.end(value, 1)).isEqualTo(30);
  }

  @Test
  void emptyAndInvertedRangesAreNotStored() {
    assertThat(markStore.insert(1, 10, 10, 7)).isFalse();
    assertThat(markStore.insert(1, 10, 5, 7)).isFalse();
    // UNSIGNED: 0xFFFFFFFF IS THE LARGEST OFFSET
    assertThat(markStore.insert(1, 0xFFFFFFFF, 5, 7)).isFalse();

    assertThat(markers.size()).isZero();
    assertThat(scopes.getState(1)).isNull();
  }

  @Test
  void boundariesAreScopedAndOrdered() {
    markStore.insert(2, 0x80000000, 0x90000000, 1);
    markStore.insert(2, 5, 9, 1);
    markStore.insert(3, 0, 1, 1);

    final List<Integer> offsets = new ArrayList<>();
    for (final Iterator<StoreEntry> it = markStore.boundaries(2); it.hasNext(); )
      offsets.add(KeySerializer.component(it.next().key(), 1));
    assertThat(offsets).containsExactly(5, 9, 0x80000000, 0x90000000);
    assertThat(scopes.getScopes()).containsExactly(2, 3);
  }

  @Test
  void coincidingCloseAndOpenCancel() {
    markStore.insert(1, 0, 4, 1);
    markStore.insert(1, 4, 10, 1);
    markStore.insert(1, 4, 6, 2);

    final BoundaryEventReader reader = markStore.events(1);
    final List<BoundaryEvent> events = new ArrayList<>();
    reader.forEachRemaining(events::add);

    assertThat(events).containsExactly(new BoundaryEvent(0, 1, 1), new BoundaryEvent(4, 2, 1), new BoundaryEvent(6, 2, -1),
        new BoundaryEvent(10, 1, -1));
    assertThat(reader.getRecordsRead()).isEqualTo(6);
    assertThat(reader.getCancelled()).isEqualTo(1);
  }

  @Test
  void sweepReadsTheStoredMarks() {
    markStore.insert(5, 0, 10, 0);
    markStore.insert(5, 4, 5, 1);

    final List<RegionEntry> entries = new ArrayList<>();
    markStore.sweep(5).forEachRemaining(entries::add);
    assertThat(entries).containsExactly(new RegionEntry(5, 0, 4, new int[] { 0 }), new RegionEntry(5, 4, 5, new int[] { 0, 1 }),
        new RegionEntry(5, 5, 10, new int[] { 0 }));
  }

  @Test
  void truncatedRecordIsMalformed() {
    markers.put(KeySerializer.key(1, 3), new byte[] { 0, 0, 0, 1, 0, 0, 0 });
    assertThatThrownBy(() -> markStore.events(1).hasNext()).isInstanceOf(InvariantViolationException.class)
        .satisfies(e -> assertThat(((InvariantViolationException) e).getErrorCode()).isEqualTo(ErrorCode.MALFORMED_RECORD));
  }

  @Test
  void recordEndingBeforeItsOffsetIsMalformed() {
    markers.put(KeySerializer.key(1, 30), BoundaryRecord.serialize(1, 20));
    assertThatThrownBy(() -> markStore.events(1).hasNext()).isInstanceOf(InvariantViolationException.class)
        .satisfies(e -> assertThat(((InvariantViolationException) e).getErrorCode()).isEqualTo(ErrorCode.MALFORMED_RECORD));
  }
}
