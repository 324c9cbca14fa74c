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
package com.regiondb.label;

import com.regiondb.engine.OrderedStore;
import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.StorageException;
import com.regiondb.serializer.KeySerializer;

import java.nio.charset.StandardCharsets;

/**
 * Interns external label names (entity, requirement or test identifiers) into dense {@code u32} ids. Ids are assigned in order of
 * first interning, starting from 0, from a counter persisted with the mappings, so a reopened database keeps handing out new ids
 * after the existing ones.
 */
public class LabelRegistry {
  private static final byte   NAME_PREFIX = 'N';
  private static final byte   ID_PREFIX   = 'I';
  private static final byte[] COUNTER_KEY = { 'C' };

  private final OrderedStore store;
  private       long         nextId;

  public LabelRegistry(final OrderedStore store) {
    this.store = store;
    final byte[] counter = store.get(COUNTER_KEY);
    this.nextId = counter != null ? Integer.toUnsignedLong(KeySerializer.getInt(counter, 0)) + 1 : 0;
  }

  /**
   * Returns the id of {@code name}, assigning the next free one the first time the name is seen.
   */
  public synchronized int intern(final String name) {
    final byte[] nameKey = nameKey(name);
    final byte[] existing = store.get(nameKey);
    if (existing != null)
      return KeySerializer.getInt(existing, 0);

    if (nextId > 0xFFFFFFFFL)
      throw new StorageException(ErrorCode.INTERNAL_ERROR, "Label ids exhausted");

    final int id = (int) nextId++;
    final byte[] idValue = KeySerializer.key(id);
    // COUNTER FIRST: AN INTERRUPTED INTERN MAY WASTE AN ID BUT NEVER HANDS IT OUT TWICE
    store.put(COUNTER_KEY, idValue);
    store.put(idKey(id), name.getBytes(StandardCharsets.UTF_8));
    store.put(nameKey, idValue);
    return id;
  }

  /**
   * @return the id of {@code name} or null if it was never interned
   */
  public Integer lookup(final String name) {
    final byte[] value = store.get(nameKey(name));
    return value != null ? KeySerializer.getInt(value, 0) : null;
  }

  /**
   * @return the name of label {@code id} or null if no name was interned with that id
   */
  public String getName(final int id) {
    final byte[] value = store.get(idKey(id));
    return value != null ? new String(value, StandardCharsets.UTF_8) : null;
  }

  public synchronized long size() {
    return nextId;
  }

  private static byte[] nameKey(final String name) {
    final byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
    final byte[] key = new byte[bytes.length + 1];
    key[0] = NAME_PREFIX;
    System.arraycopy(bytes, 0, key, 1, bytes.length);
    return key;
  }

  private static byte[] idKey(final int id) {
    final byte[] key = new byte[1 + KeySerializer.INT_SIZE];
    key[0] = ID_PREFIX;
    KeySerializer.putInt(key, 1, id);
    return key;
  }
}
