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
package com.regiondb.engine;

import com.regiondb.exception.DatabaseIsClosedException;
import com.regiondb.serializer.KeySerializer;
import com.regiondb.serializer.UnsignedBytesComparator;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory {@link OrderedStore} backed by a {@link ConcurrentSkipListMap}. Merges use the map's atomic compute, which retries on
 * contention instead of locking. Arrays are copied in and out, callers never share the stored ones.
 */
public class MemoryOrderedStore implements OrderedStore {
  private final    String                                name;
  private final    MergeOperator                         mergeOperator;
  private final    ConcurrentSkipListMap<byte[], byte[]> map  = new ConcurrentSkipListMap<>(UnsignedBytesComparator.BEST_COMPARATOR);
  private volatile boolean                               open = true;

  public MemoryOrderedStore(final String name, final MergeOperator mergeOperator) {
    this.name = name;
    this.mergeOperator = mergeOperator != null ? mergeOperator : MergeOperator.REPLACE;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public MergeOperator getMergeOperator() {
    return mergeOperator;
  }

  @Override
  public void merge(final byte[] key, final byte[] operand) {
    checkOpen();
    map.compute(key.clone(), (k, existing) -> mergeOperator.merge(k, existing, operand));
  }

  @Override
  public void put(final byte[] key, final byte[] value) {
    checkOpen();
    map.put(key.clone(), value.clone());
  }

  @Override
  public byte[] get(final byte[] key) {
    checkOpen();
    final byte[] value = map.get(key);
    return value != null ? value.clone() : null;
  }

  @Override
  public boolean remove(final byte[] key) {
    checkOpen();
    return map.remove(key) != null;
  }

  @Override
  public Iterator<StoreEntry> range(final byte[] fromInclusive, final byte[] toExclusive) {
    checkOpen();

    final NavigableMap<byte[], byte[]> view;
    if (fromInclusive == null && toExclusive == null)
      view = map;
    else if (fromInclusive == null)
      view = map.headMap(toExclusive, false);
    else if (toExclusive == null)
      view = map.tailMap(fromInclusive, true);
    else if (UnsignedBytesComparator.BEST_COMPARATOR.compare(fromInclusive, toExclusive) >= 0)
      return Collections.emptyIterator();
    else
      view = map.subMap(fromInclusive, true, toExclusive, false);

    final Iterator<Map.Entry<byte[], byte[]>> it = view.entrySet().iterator();
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return it.hasNext();
      }

      @Override
      public StoreEntry next() {
        final Map.Entry<byte[], byte[]> entry = it.next();
        return new StoreEntry(entry.getKey().clone(), entry.getValue().clone());
      }
    };
  }

  @Override
  public Iterator<StoreEntry> prefix(final byte[] prefix) {
    return range(prefix, KeySerializer.prefixUpperBound(prefix));
  }

  @Override
  public long size() {
    return map.size();
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    open = false;
  }

  protected void checkOpen() {
    if (!open)
      throw new DatabaseIsClosedException("Store '" + name + "' is closed");
  }

  @Override
  public String toString() {
    return name;
  }
}
