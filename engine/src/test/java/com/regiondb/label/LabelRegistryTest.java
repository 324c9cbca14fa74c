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
package com.regiondb.label;

import com.regiondb.engine.AppendLogStore;
import com.regiondb.engine.MemoryOrderedStore;
import com.regiondb.engine.MergeOperator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelRegistryTest {

  @Test
  void idsAreDenseAndStable() {
    final LabelRegistry registry = new LabelRegistry(new MemoryOrderedStore("labels", MergeOperator.REPLACE));

    assertThat(registry.intern("src/lib.rs#fn main")).isEqualTo(0);
    assertThat(registry.intern("REQ-2.1")).isEqualTo(1);
    assertThat(registry.intern("src/lib.rs#fn main")).isEqualTo(0);
    assertThat(registry.size()).isEqualTo(2);

    assertThat(registry.lookup("REQ-2.1")).isEqualTo(1);
    assertThat(registry.lookup("missing")).isNull();
    assertThat(registry.getName(1)).isEqualTo("REQ-2.1");
    assertThat(registry.getName(5)).isNull();
  }

  @Test
  void unicodeNames() {
    final LabelRegistry registry = new LabelRegistry(new MemoryOrderedStore("labels", MergeOperator.REPLACE));
    final int id = registry.intern("exigence-é-漢字");
    assertThat(registry.getName(id)).isEqualTo("exigence-é-漢字");
  }

  @Test
  void interruptedInternNeverReusesItsId() {
    // CRASH ON EACH OF THE WRITES OF AN INTERN IN TURN
    for (int failingPut = 1; failingPut <= 3; ++failingPut) {
      final CrashingStore store = new CrashingStore();
      new LabelRegistry(store).intern("a");

      store.failAfter = failingPut;
      assertThatThrownBy(() -> new LabelRegistry(store).intern("b")).isInstanceOf(IllegalStateException.class);
      store.failAfter = -1;

      final LabelRegistry reopened = new LabelRegistry(store);
      final int c = reopened.intern("c");
      assertThat(reopened.getName(c)).isEqualTo("c");
      assertThat(reopened.lookup("a")).isEqualTo(0);
      if (reopened.lookup("b") != null)
        assertThat(reopened.lookup("b")).isNotEqualTo(c);
    }
  }

  @Test
  void counterSurvivesReopen(@TempDir final File directory) {
    final File file = new File(directory, "labels.rlog");
    try (final AppendLogStore store = new AppendLogStore(file, "labels", MergeOperator.REPLACE, false)) {
      final LabelRegistry registry = new LabelRegistry(store);
      registry.intern("a");
      registry.intern("b");
    }

    try (final AppendLogStore store = new AppendLogStore(file, "labels", MergeOperator.REPLACE, false)) {
      final LabelRegistry registry = new LabelRegistry(store);
      assertThat(registry.size()).isEqualTo(2);
      assertThat(registry.intern("b")).isEqualTo(1);
      assertThat(registry.intern("c")).isEqualTo(2);
    }
  }

  /**
   * Memory store that stops accepting puts after {@code failAfter - 1} of them, like a process dying between two writes.
   */
  private static class CrashingStore extends MemoryOrderedStore {
    private int failAfter = -1;

    CrashingStore() {
      super("labels", MergeOperator.REPLACE);
    }

    @Override
    public void put(final byte[] key, final byte[] value) {
      if (failAfter > 0 && --failAfter == 0)
        throw new IllegalStateException("crash");
      super.put(key, value);
    }
  }
}
