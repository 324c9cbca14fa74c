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

import java.util.Iterator;

/**
 * Ordered key/value tree. Keys are compared as unsigned byte strings. Writers never need to read before writing: {@link #merge}
 * hands the combination of the new operand with the current value to the store's {@link MergeOperator}, so any number of threads
 * can write the same key without coordinating with each other.
 */
public interface OrderedStore extends AutoCloseable {
  String getName();

  MergeOperator getMergeOperator();

  /**
   * Combines {@code operand} with the current value of {@code key} through the merge operator of this store.
   */
  void merge(byte[] key, byte[] operand);

  void put(byte[] key, byte[] value);

  /**
   * @return the current value or null if the key is absent
   */
  byte[] get(byte[] key);

  /**
   * @return true if the key was present
   */
  boolean remove(byte[] key);

  /**
   * Lazy ascending scan of the keys in {@code [fromInclusive, toExclusive)}. A null bound means unbounded. The iterator is weakly
   * consistent: it never fails because of concurrent writes and may or may not reflect them.
   */
  Iterator<StoreEntry> range(byte[] fromInclusive, byte[] toExclusive);

  /**
   * Lazy ascending scan of every key starting with {@code prefix}.
   */
  Iterator<StoreEntry> prefix(byte[] prefix);

  long size();

  boolean isOpen();

  @Override
  void close();
}
