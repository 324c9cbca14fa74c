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

import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.InvariantViolationException;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily consolidates the boundary events of one scope into its partition: a sequence of non-overlapping, non-empty, maximal
 * {@link RegionEntry} instances in ascending offset order.
 * <p>
 * Each entry starts at the offset of the first uncommitted event. Every event at that same offset is applied unconditionally. The
 * following offsets are absorbed while their events leave the set of active labels unchanged (a label going from 2 to 1 marks, for
 * instance) and the entry ends at the first offset whose event adds or removes a label. Offsets reached while no label is active
 * produce no entry (gaps).
 * <p>
 * The engine is single-use and holds only the active set and one look-ahead event. Running a new engine on the same events produces
 * the same entries.
 */
public class SweepEngine implements Iterator<RegionEntry> {
  private final int            scope;
  private final BoundaryCursor cursor;
  private       RegionEntry    next;
  private       long           entries;
  private       long           gaps;

  public SweepEngine(final int scope, final Iterator<BoundaryEvent> events) {
    this.scope = scope;
    this.cursor = new BoundaryCursor(scope, events, new ActiveSet());
  }

  @Override
  public boolean hasNext() {
    if (next == null)
      next = computeNext();
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

  private RegionEntry computeNext() {
    final ActiveSet active = cursor.getActiveSet();

    while (cursor.hasNext()) {
      final int start = cursor.commit().offset();
      int end = start;

      while (cursor.hasNext()) {
        final BoundaryEvent event = cursor.peek();
        end = event.offset();
        if (event.offset() == start || !cursor.wouldChangeMembership())
          cursor.commit();
        else
          break;
      }

      if (!cursor.hasNext()) {
        if (!active.isEmpty())
          throw (InvariantViolationException) new InvariantViolationException(ErrorCode.ACTIVE_SET_LEAK,
              "Labels " + active + " are still open at the end of the scope")//
              .addContext("scope", Integer.toUnsignedString(scope))//
              .addContext("offset", Integer.toUnsignedString(end));
        // LAST EVENTS CLOSED EVERYTHING: NOTHING TO EMIT
        return null;
      }

      if (active.isEmpty()) {
        ++gaps;
        continue;
      }

      ++entries;
      return new RegionEntry(scope, start, end, active.labels());
    }
    return null;
  }

  public int getScope() {
    return scope;
  }

  public long getEntries() {
    return entries;
  }

  public long getGaps() {
    return gaps;
  }

  public long getEventsApplied() {
    return cursor.getCommitted();
  }
}
