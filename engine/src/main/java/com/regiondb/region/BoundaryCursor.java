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
import java.util.NoSuchElementException;

/**
 * One-event look-ahead over an ordered stream of {@link BoundaryEvent}s. The sweep inspects the next event with {@link #peek()} and
 * decides whether to {@link #commit()} it into the {@link ActiveSet} or to leave it for the next entry: an uncommitted event is never
 * lost and never applied twice.
 */
public class BoundaryCursor {
  private final int                     scope;
  private final Iterator<BoundaryEvent> events;
  private final ActiveSet               activeSet;
  private       BoundaryEvent           pending;
  private       long                    committed;

  public BoundaryCursor(final int scope, final Iterator<BoundaryEvent> events, final ActiveSet activeSet) {
    this.scope = scope;
    this.events = events;
    this.activeSet = activeSet;
  }

  public boolean hasNext() {
    return pending != null || events.hasNext();
  }

  public BoundaryEvent peek() {
    if (pending == null) {
      if (!events.hasNext())
        throw new NoSuchElementException();
      pending = events.next();
    }
    return pending;
  }

  /**
   * @return true if committing the peeked event would add its label to, or remove it from, the active set
   */
  public boolean wouldChangeMembership() {
    return activeSet.wouldChangeMembership(peek());
  }

  /**
   * Applies the peeked event to the active set and advances past it.
   */
  public BoundaryEvent commit() {
    final BoundaryEvent event = peek();
    activeSet.apply(scope, event);
    pending = null;
    ++committed;
    return event;
  }

  public ActiveSet getActiveSet() {
    return activeSet;
  }

  public long getCommitted() {
    return committed;
  }
}
