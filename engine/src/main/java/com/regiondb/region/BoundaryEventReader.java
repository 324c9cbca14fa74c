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

import com.regiondb.engine.StoreEntry;
import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.InvariantViolationException;
import com.regiondb.serializer.KeySerializer;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Decodes the boundary records of one scope, read in ascending {@code (scope, offset)} key order, into {@link BoundaryEvent}s. All
 * the records of one offset are folded into one event per label carrying the net delta (opens minus closes); labels whose opens and
 * closes cancel out produce no event. Events of one offset come out in ascending unsigned label order.
 */
public class BoundaryEventReader implements Iterator<BoundaryEvent> {
  private final int                  scope;
  private final Iterator<StoreEntry> entries;
  private       BoundaryEvent[]      buffer   = new BoundaryEvent[8];
  private       int                  buffered = 0;
  private       int                  position = 0;
  private       long[]               work     = new long[16];
  private       long                 recordsRead;
  private       long                 cancelled;

  public BoundaryEventReader(final int scope, final Iterator<StoreEntry> entries) {
    this.scope = scope;
    this.entries = entries;
  }

  @Override
  public boolean hasNext() {
    while (position >= buffered) {
      if (!entries.hasNext())
        return false;
      decode(entries.next());
    }
    return true;
  }

  @Override
  public BoundaryEvent next() {
    if (!hasNext())
      throw new NoSuchElementException();
    return buffer[position++];
  }

  private void decode(final StoreEntry entry) {
    final int offset = KeySerializer.component(entry.key(), 1);
    final byte[] value = entry.value();
    final int records = BoundaryRecord.count(value);
    recordsRead += records;

    if (work.length < records)
      work = new long[Math.max(records, work.length * 2)];

    // PACK (UNSIGNED LABEL, OPENING BIT) IN A LONG SO THAT A PLAIN SORT GROUPS THE RECORDS BY LABEL
    for (int i = 0; i < records; ++i) {
      final int label = BoundaryRecord.label(value, i);
      final int end = BoundaryRecord.end(value, i);

      final int cmp = Integer.compareUnsigned(end, offset);
      if (cmp < 0)
        throw (InvariantViolationException) new InvariantViolationException(ErrorCode.MALFORMED_RECORD,
            "Boundary record of label " + Integer.toUnsignedString(label) + " stored at offset " + Integer.toUnsignedString(offset)
                + " ends before it (" + Integer.toUnsignedString(end) + ")")//
            .addContext("scope", Integer.toUnsignedString(scope))//
            .addContext("offset", Integer.toUnsignedString(offset));

      work[i] = (Integer.toUnsignedLong(label) << 1) | (cmp > 0 ? 1L : 0L);
    }
    Arrays.sort(work, 0, records);

    buffered = 0;
    position = 0;
    int i = 0;
    while (i < records) {
      final long label = work[i] >>> 1;
      int delta = 0;
      for (; i < records && (work[i] >>> 1) == label; ++i)
        delta += (work[i] & 1L) == 1L ? 1 : -1;

      if (delta == 0) {
        ++cancelled;
        continue;
      }

      if (buffered == buffer.length)
        buffer = Arrays.copyOf(buffer, buffer.length * 2);
      buffer[buffered++] = new BoundaryEvent(offset, (int) label, delta);
    }
  }

  public long getRecordsRead() {
    return recordsRead;
  }

  /**
   * @return number of (offset, label) pairs whose opens and closes cancelled out
   */
  public long getCancelled() {
    return cancelled;
  }
}
