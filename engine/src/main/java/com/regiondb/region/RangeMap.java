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

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory consolidation of the marks of a single scope, for callers that hold all their marks at once and do not need the
 * persistent stores. Marks are folded into net deltas per {@code (offset, label)} on insertion and {@link #iterator()} runs the same
 * {@link SweepEngine} used by finalization.
 */
public class RangeMap implements Iterable<RegionEntry> {
  private final int                    scope;
  private final TreeMap<Long, Integer> deltas = new TreeMap<>(Long::compareUnsigned);

  public RangeMap() {
    this(0);
  }

  public RangeMap(final int scope) {
    this.scope = scope;
  }

  public RangeMap insert(final int start, final int end, final int label) {
    if (Integer.compareUnsigned(start, end) >= 0)
      return this;

    addDelta(start, label, 1);
    addDelta(end, label, -1);
    return this;
  }

  @Override
  public Iterator<RegionEntry> iterator() {
    final Iterator<Map.Entry<Long, Integer>> it = deltas.entrySet().iterator();
    return new SweepEngine(scope, new Iterator<>() {
      @Override
      public boolean hasNext() {
        return it.hasNext();
      }

      @Override
      public BoundaryEvent next() {
        final Map.Entry<Long, Integer> entry = it.next();
        final long key = entry.getKey();
        return new BoundaryEvent((int) (key >>> 32), (int) key, entry.getValue());
      }
    });
  }

  private void addDelta(final int offset, final int label, final int delta) {
    final long key = (Integer.toUnsignedLong(offset) << 32) | Integer.toUnsignedLong(label);
    deltas.merge(key, delta, (a, b) -> a + b == 0 ? null : a + b);
  }
}
