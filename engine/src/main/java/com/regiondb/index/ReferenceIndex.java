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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Label-to-regions inverted index. A consolidated entry carrying labels {@code {a, b}} is written once under each of its labels, with
 * key {@code (label, scope, start, end)} and the full sorted label set as value, so a prefix scan on a label or on {@code (label,
 * scope)} returns that label's entries in ascending {@code (scope, start)} order, each with its complete co-occurring label set.
 */
public class ReferenceIndex {
  private final OrderedStore store;

  public ReferenceIndex(final OrderedStore store) {
    this.store = store;
  }

  /**
   * Writes one reference per label of the entry. Rewriting the same entry produces the same keys and values.
   */
  public void write(final RegionEntry entry) {
    final byte[] value = LabelSetSerializer.serialize(entry.labels());
    for (final int label : entry.labels())
      store.put(KeySerializer.key(label, entry.scope(), entry.start(), entry.end()), value);
  }

  public void remove(final RegionEntry entry) {
    for (final int label : entry.labels())
      store.remove(KeySerializer.key(label, entry.scope(), entry.start(), entry.end()));
  }

  public Iterator<RegionEntry> references(final int label) {
    return new ReferenceIterator(store.prefix(KeySerializer.key(label)));
  }

  public Iterator<RegionEntry> references(final int label, final int scope) {
    return new ReferenceIterator(store.prefix(KeySerializer.key(label, scope)));
  }

  public OrderedStore getStore() {
    return store;
  }

  private static class ReferenceIterator implements Iterator<RegionEntry> {
    private final Iterator<StoreEntry> entries;

    private ReferenceIterator(final Iterator<StoreEntry> entries) {
      this.entries = entries;
    }

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
      return new RegionEntry(KeySerializer.component(key, 1), KeySerializer.component(key, 2), KeySerializer.component(key, 3),
          LabelSetSerializer.deserialize(entry.value()));
    }
  }
}
