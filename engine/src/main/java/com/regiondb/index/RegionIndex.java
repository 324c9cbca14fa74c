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
package com.regiondb.index;

import com.regiondb.engine.OrderedStore;
import com.regiondb.engine.StoreEntry;
import com.regiondb.region.RegionEntry;
import com.regiondb.serializer.KeySerializer;
import com.regiondb.serializer.LabelSetSerializer;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Published partition of each finalized scope, keyed {@code (scope, start, end)} with the sorted label set as value.
 */
public class RegionIndex {
  private final OrderedStore store;

  public RegionIndex(final OrderedStore store) {
    this.store = store;
  }

  public void write(final RegionEntry entry) {
    store.put(KeySerializer.key(entry.scope(), entry.start(), entry.end()), LabelSetSerializer.serialize(entry.labels()));
  }

  public void remove(final RegionEntry entry) {
    store.remove(KeySerializer.key(entry.scope(), entry.start(), entry.end()));
  }

  public Iterator<RegionEntry> regions(final int scope) {
    final Iterator<StoreEntry> entries = store.prefix(KeySerializer.key(scope));
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return entries.hasNext();
      }

      @Override
      public RegionEntry next() {
        if (!entries.hasNext())
          throw new NoSuchElementException();
        final StoreEntry entry = entries.next();
        final byte[] key = entry.key();
        return new RegionEntry(KeySerializer.component(key, 0), KeySerializer.component(key, 1), KeySerializer.component(key, 2),
            LabelSetSerializer.deserialize(entry.value()));
      }
    };
  }

  /**
   * Materializes the partition of a scope. Used to unpublish it before a new finalization.
   */
  public List<RegionEntry> list(final int scope) {
    final List<RegionEntry> result = new ArrayList<>();
    for (final Iterator<RegionEntry> it = regions(scope); it.hasNext(); )
      result.add(it.next());
    return result;
  }

  public void printScope(final int scope, final PrintStream out) {
    out.printf("%nPARTITION OF SCOPE %s:%n", Integer.toUnsignedString(scope));
    int count = 0;
    for (final Iterator<RegionEntry> it = regions(scope); it.hasNext(); ++count)
      out.printf("- %s%n", it.next());
    out.printf("TOTAL %d ENTRIES%n", count);
  }

  public OrderedStore getStore() {
    return store;
  }
}
