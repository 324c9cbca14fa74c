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

import java.util.Map;
import java.util.TreeMap;

/**
 * Labels currently covering the sweep position with their reference count. A label is present while its count is positive and is
 * removed as soon as the count drops back to zero, so the key set is always the exact set of active labels, kept in unsigned order.
 */
public class ActiveSet {
  private final TreeMap<Integer, Integer> counts = new TreeMap<>(Integer::compareUnsigned);

  public int count(final int label) {
    final Integer current = counts.get(label);
    return current != null ? current : 0;
  }

  /**
   * Tells whether applying {@code event} would add or remove its label. An event that would drive the count negative also answers
   * true, so the sweep stops in front of it and the violation is raised when the event is applied.
   */
  public boolean wouldChangeMembership(final BoundaryEvent event) {
    final int current = count(event.label());
    final int next = current + event.delta();
    return next < 0 || (current > 0) != (next > 0);
  }

  public void apply(final int scope, final BoundaryEvent event) {
    final int current = count(event.label());
    final int next = current + event.delta();
    if (next < 0)
      throw (InvariantViolationException) new InvariantViolationException(ErrorCode.REFCOUNT_UNDERFLOW,
          "Label " + Integer.toUnsignedString(event.label()) + " closed " + (-event.delta()) + " time(s) at offset "
              + Integer.toUnsignedString(event.offset()) + " with only " + current + " open mark(s)")//
          .addContext("scope", Integer.toUnsignedString(scope))//
          .addContext("offset", Integer.toUnsignedString(event.offset()))//
          .addContext("label", Integer.toUnsignedString(event.label()));

    if (next == 0)
      counts.remove(event.label());
    else
      counts.put(event.label(), next);
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }

  /**
   * Returns a snapshot of the active labels in ascending unsigned order.
   */
  public int[] labels() {
    final int[] result = new int[counts.size()];
    int i = 0;
    for (final Integer label : counts.keySet())
      result[i++] = label;
    return result;
  }

  @Override
  public String toString() {
    final StringBuilder buffer = new StringBuilder("{");
    for (final Map.Entry<Integer, Integer> entry : counts.entrySet()) {
      if (buffer.length() > 1)
        buffer.append(", ");
      buffer.append(Integer.toUnsignedString(entry.getKey())).append('=').append(entry.getValue());
    }
    return buffer.append('}').toString();
  }
}
