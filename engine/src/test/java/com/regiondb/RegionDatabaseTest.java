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

import com.regiondb.engine.StorageMode;
import com.regiondb.exception.DatabaseIsClosedException;
import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.ScopeNotFinalizedException;
import com.regiondb.region.RangeMap;
import com.regiondb.region.RegionEntry;
import com.regiondb.region.ScopeState;
import com.regiondb.region.compaction.FinalizeReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegionDatabaseTest {
  private RegionDatabase database;

  @BeforeEach
  void setUp() {
    database = new RegionDatabase();
  }

  @AfterEach
  void tearDown() {
    database.close();
  }

  @Test
  void referencesAreOrderedByScopeThenStart() {
    database.insert(0xFFFFFFFF, 0, 5, 1);
    database.insert(2, 50, 60, 1);
    database.insert(2, 0, 10, 1);
    database.insert(2, 5, 20, 2);
    database.insert(1, 7, 8, 1);

    assertThat(database.finalizeAll().isSuccess()).isTrue();

    final List<RegionEntry> references = toList(database.references(1));
    assertThat(references).containsExactly(//
        new RegionEntry(1, 7, 8, new int[] { 1 }),//
        new RegionEntry(2, 0, 5, new int[] { 1 }),//
        new RegionEntry(2, 5, 10, new int[] { 1, 2 }),//
        new RegionEntry(2, 50, 60, new int[] { 1 }),//
        new RegionEntry(0xFFFFFFFF, 0, 5, new int[] { 1 }));
    assertThat(references).allMatch(e -> e.contains(1));

    assertThat(toList(database.references(2, 2))).containsExactly(new RegionEntry(2, 5, 10, new int[] { 1, 2 }),
        new RegionEntry(2, 10, 20, new int[] { 2 }));
    assertThat(toList(database.references(3))).isEmpty();
  }

  @Test
  void scopeQueriesRequireAFinalizedScope() {
    database.insert(4, 0, 10, 1);

    assertThatThrownBy(() -> database.regions(4)).isInstanceOf(ScopeNotFinalizedException.class)
        .satisfies(e -> assertThat(((ScopeNotFinalizedException) e).getErrorCode()).isEqualTo(ErrorCode.SCOPE_NOT_FINALIZED));
    assertThatThrownBy(() -> database.references(1, 4)).isInstanceOf(ScopeNotFinalizedException.class);
    assertThatThrownBy(() -> database.regions(99)).isInstanceOf(ScopeNotFinalizedException.class);
    assertThat(toList(database.references(1))).isEmpty();

    database.finalizeScope(4);
    assertThat(toList(database.regions(4))).containsExactly(new RegionEntry(4, 0, 10, new int[] { 1 }));
  }

  @Test
  void insertAfterFinalizeHidesTheStalePartition() {
    database.insert(4, 0, 10, 1);
    database.insert(5, 0, 10, 1);
    database.finalizeAll();

    database.insert(4, 20, 30, 1);
    assertThat(database.getScopeState(4)).isEqualTo(ScopeState.OPEN);
    assertThat(toList(database.references(1))).containsExactly(new RegionEntry(5, 0, 10, new int[] { 1 }));
    assertThatThrownBy(() -> database.regions(4)).isInstanceOf(ScopeNotFinalizedException.class);

    database.finalizeScope(4);
    assertThat(toList(database.regions(4))).containsExactly(new RegionEntry(4, 0, 10, new int[] { 1 }),
        new RegionEntry(4, 20, 30, new int[] { 1 }));
  }

  @Test
  void finalizeAllReportsEveryScope() {
    for (int scope = 1; scope <= 5; ++scope)
      database.insert(scope, 0, scope * 10, scope);

    final FinalizeReport report = database.finalizeAll();
    assertThat(report.getResults().keySet()).containsExactly(1, 2, 3, 4, 5);
    assertThat(report.getTotalEntries()).isEqualTo(5);
    assertThat(database.getScopes()).containsExactly(1, 2, 3, 4, 5);
  }

  @Test
  void concurrentInsertsProduceTheSamePartition() throws Exception {
    final int threads = 8;
    final int marksPerThread = 500;
    final Random random = new Random(1234);
    final int[][][] marks = new int[threads][marksPerThread][];
    final RangeMap expected = new RangeMap(3);
    for (int t = 0; t < threads; ++t)
      for (int i = 0; i < marksPerThread; ++i) {
        final int start = random.nextInt(1000);
        final int end = start + 1 + random.nextInt(50);
        final int label = random.nextInt(10);
        marks[t][i] = new int[] { start, end, label };
        expected.insert(start, end, label);
      }

    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final CountDownLatch startSignal = new CountDownLatch(1);
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; ++t) {
        final int[][] own = marks[t];
        futures.add(executor.submit(() -> {
          startSignal.await();
          for (final int[] m : own)
            database.insert(3, m[0], m[1], m[2]);
          return null;
        }));
      }
      startSignal.countDown();
      for (final Future<?> future : futures)
        future.get();
    } finally {
      executor.shutdownNow();
    }

    database.finalizeScope(3);

    final List<RegionEntry> expectedEntries = new ArrayList<>();
    expected.forEach(expectedEntries::add);
    assertThat(toList(database.regions(3))).isEqualTo(expectedEntries);
  }

  @Test
  void labelNamesAreInterned() {
    database.insert(1, 0, 10, "REQ-1");
    database.insert(1, 5, 15, "REQ-2");
    database.insert(2, 0, 3, "REQ-1");
    database.finalizeAll();

    final int req1 = database.getLabels().lookup("REQ-1");
    assertThat(toList(database.references(req1))).hasSize(3);
    assertThat(database.getLabels().getName(req1)).isEqualTo("REQ-1");
  }

  @Test
  void closedDatabaseRejectsOperations() {
    database.close();
    assertThat(database.isOpen()).isFalse();
    assertThatThrownBy(() -> database.insert(1, 0, 1, 1)).isInstanceOf(DatabaseIsClosedException.class);
    assertThatThrownBy(() -> database.references(1)).isInstanceOf(DatabaseIsClosedException.class);
  }

  @Test
  void logModeSurvivesReopen(@TempDir final File directory) {
    final ContextConfiguration configuration = new ContextConfiguration()//
        .setValue(GlobalConfiguration.STORAGE_MODE, StorageMode.LOG)//
        .setValue(GlobalConfiguration.DATABASE_DIRECTORY, directory.getAbsolutePath());

    final List<RegionEntry> published;
    try (final RegionDatabase db = new RegionDatabase(configuration)) {
      db.insert(1, 0, 10, 1);
      db.insert(1, 4, 5, 2);
      db.insert(1, 4, 5, "LABEL");
      db.finalizeScope(1);
      published = toList(db.regions(1));
    }

    assertThat(new File(directory, RegionDatabase.MARKERS_TREE + ".rlog")).exists();

    try (final RegionDatabase db = new RegionDatabase(configuration)) {
      assertThat(db.getScopeState(1)).isEqualTo(ScopeState.FINALIZED);
      assertThat(toList(db.regions(1))).isEqualTo(published);
      assertThat(db.getLabels().lookup("LABEL")).isEqualTo(0);

      // MARKS ARE REPLAYED TOO: REFINALIZING GIVES THE SAME PARTITION
      db.finalizeScope(1);
      assertThat(toList(db.regions(1))).isEqualTo(published);

      db.compactLogs();
      assertThat(db.getLabels().intern("OTHER")).isEqualTo(1);
    }

    try (final RegionDatabase db = new RegionDatabase(configuration)) {
      assertThat(toList(db.regions(1))).isEqualTo(published);
      assertThat(db.getLabels().intern("THIRD")).isEqualTo(2);
    }
  }

  private static List<RegionEntry> toList(final Iterator<RegionEntry> iterator) {
    final List<RegionEntry> list = new ArrayList<>();
    iterator.forEachRemaining(list::add);
    return list;
  }
}
