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
import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.StorageException;
import com.regiondb.serializer.KeySerializer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Known scopes and their {@link ScopeState}, one single-byte value per scope key. Every write is a blind put.
 */
public class ScopeRegistry {
  private static final byte[] OPEN_VALUE = { ScopeState.OPEN.getCode() };

  private final OrderedStore store;

  public ScopeRegistry(final OrderedStore store) {
    this.store = store;
  }

  public void markOpen(final int scope) {
    store.put(KeySerializer.key(scope), OPEN_VALUE);
  }

  public void setState(final int scope, final ScopeState state) {
    store.put(KeySerializer.key(scope), new byte[] { state.getCode() });
  }

  /**
   * @return the state of the scope or null if no mark was ever inserted into it
   */
  public ScopeState getState(final int scope) {
    final byte[] value = store.get(KeySerializer.key(scope));
    return value != null ? decode(scope, value) : null;
  }

  public boolean isFinalized(final int scope) {
    return getState(scope) == ScopeState.FINALIZED;
  }

  /**
   * Returns the ids of all the known scopes in ascending unsigned order.
   */
  public List<Integer> getScopes() {
    final List<Integer> scopes = new ArrayList<>();
    for (final Iterator<StoreEntry> it = store.range(null, null); it.hasNext(); )
      scopes.add(KeySerializer.component(it.next().key(), 0));
    return scopes;
  }

  private static ScopeState decode(final int scope, final byte[] value) {
    if (value.length != 1)
      throw (StorageException) new StorageException(ErrorCode.CORRUPTION_DETECTED, "Invalid state value for scope")//
          .addContext("scope", Integer.toUnsignedString(scope));
    try {
      return ScopeState.fromCode(value[0]);
    } catch (final IllegalArgumentException e) {
      throw new StorageException(ErrorCode.CORRUPTION_DETECTED, "Invalid state for scope " + Integer.toUnsignedString(scope), e);
    }
  }
}
