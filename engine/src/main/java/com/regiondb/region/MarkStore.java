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

import com.regiondb.engine.OrderedStore;
import com.regiondb.engine.StoreEntry;
import com.regiondb.log.LogManager;
import com.regiondb.serializer.KeySerializer;

import java.util.Iterator;
import java.util.logging.Level;

/**
 * Write side of the engine. Each {@link #insert} appends one boundary record under the start key and one under the end key of the
 * mark through the concatenating merge operator of the markers tree: no read, no lock, so any number of threads can insert into the
 * same scope concurrently. The scope is also flagged {@link ScopeState#OPEN} with a blind write, which invalidates a previously
 * published partition until the scope is finalized again.
 */
public class MarkStore {
  private final OrderedStore  markers;
  private final ScopeRegistry scopes;

  public MarkStore(final OrderedStore markers, final ScopeRegistry scopes) {
    this.markers = markers;
    this.scopes = scopes;
  }

  /**
   * Records that {@code label} covers {@code [start, end)} of {@code scope}. Empty or inverted ranges (unsigned comparison) are
   * ignored.
   *
   * @return true if the mark was recorded
   */
  public boolean insert(final int scope, final int start, final int end, final int label) {
    if (Integer.compareUnsigned(start, end) >= 0) {
      LogManager.instance().log(this, Level.FINE, "Ignored empty range %s..%s of label %s in scope %s", null,
          Integer.toUnsignedString(start), Integer.toUnsignedString(end), Integer.toUnsignedString(label),
          Integer.toUnsignedString(scope));
      return false;
    }

    final byte[] record = BoundaryRecord.serialize(label, end);
    markers.merge(KeySerializer.key(scope, start), record);
    markers.merge(KeySerializer.key(scope, end), record);
    scopes.markOpen(scope);
    return true;
  }

  /**
   * Raw boundary entries of a scope in ascending offset order.
   */
  public Iterator<StoreEntry> boundaries(final int scope) {
    return markers.prefix(KeySerializer.key(scope));
  }

  public BoundaryEventReader events(final int scope) {
    return new BoundaryEventReader(scope, boundaries(scope));
  }

  /**
   * Starts a new sweep over the current boundaries of {@code scope}.
   */
  public SweepEngine sweep(final int scope) {
    return new SweepEngine(scope, events(scope));
  }

  public OrderedStore getStore() {
    return markers;
  }
}
