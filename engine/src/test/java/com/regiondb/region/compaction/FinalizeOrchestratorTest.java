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
import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.RegionDBException;
import com.regiondb.index.ReferenceIndex;
import com.regiondb.index.RegionIndex;
import com.regiondb.region.BoundaryRecord;
import com.regiondb.region.MarkStore;
import com.regiondb.region.ScopeRegistry;
import com.regiondb.region.ScopeState;
import com.regiondb.serializer.KeySerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FinalizeOrchestratorTest {
  private MemoryOrderedStore   markers;
  private ScopeRegistry        scopes;
  private MarkStore            markStore;
  private RegionIndex          regionIndex;
  private FinalizeOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    markers = new MemoryOrderedStore("markers", MergeOperator.CONCATENATE);
    scopes = new ScopeRegistry(new MemoryOrderedStore("scopes", MergeOperator.REPLACE));
    markStore = new MarkStore(markers, scopes);
    regionIndex = new RegionIndex(new MemoryOrderedStore("regions", MergeOperator.REPLACE));
    final ScopeFinalizer finalizer = new ScopeFinalizer(markStore, scopes, regionIndex,
        new ReferenceIndex(new MemoryOrderedStore("references", MergeOperator.REPLACE)), false);
    orchestrator = new FinalizeOrchestrator(finalizer, 3);
  }

  @AfterEach
  void tearDown() {
    orchestrator.close();
  }

  @Test
  void finalizesEveryScope() {
    for (int scope = 0; scope < 20; ++scope)
      for (int i = 0; i < 10; ++i)
        markStore.insert(scope, i * 10, i * 10 + 15, i % 3);

    final FinalizeReport report = orchestrator.finalizeAll(scopes.getScopes());

    assertThat(report.isSuccess()).isTrue();
    assertThat(report.getResults()).hasSize(20);
    assertThat(report.getFinalizedScopes()).isEqualTo(20);
    assertThat(report.getFailures()).isEmpty();
    for (int scope = 0; scope < 20; ++scope) {
      assertThat(scopes.getState(scope)).isEqualTo(ScopeState.FINALIZED);
      assertThat(regionIndex.list(scope)).isNotEmpty();
    }
  }

  @Test
  void failureIsConfinedToItsScope() {
    markStore.insert(1, 0, 10, 1);
    markStore.insert(2, 0, 10, 1);
    markStore.insert(3, 0, 10, 1);
    markers.merge(KeySerializer.key(2, 40), BoundaryRecord.serialize(1, 40));

    final FinalizeReport report = orchestrator.finalizeAll(List.of(1, 2, 3));

    assertThat(report.isSuccess()).isFalse();
    assertThat(report.getFinalizedScopes()).isEqualTo(2);
    assertThat(report.getFailures()).extracting(FinalizeResult::scope).containsExactly(2);
    assertThat(((RegionDBException) report.getResult(2).error()).getErrorCode()).isEqualTo(ErrorCode.REFCOUNT_UNDERFLOW);
    assertThat(report.getTotalEntries()).isEqualTo(2);

    assertThat(scopes.getState(1)).isEqualTo(ScopeState.FINALIZED);
    assertThat(scopes.getState(2)).isEqualTo(ScopeState.FAILED);
    assertThat(scopes.getState(3)).isEqualTo(ScopeState.FINALIZED);
    assertThat(regionIndex.list(2)).isEmpty();
  }

  @Test
  void workerThreadsDefaultToCoresMinusOne() {
    assertThat(FinalizeOrchestrator.resolveWorkerThreads(4)).isEqualTo(4);
    assertThat(FinalizeOrchestrator.resolveWorkerThreads(0)).isEqualTo(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
    assertThat(orchestrator.getWorkerThreads()).isEqualTo(3);
  }
}
