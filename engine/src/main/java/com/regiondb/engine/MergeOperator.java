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

/**
 * Combine function applied by {@link OrderedStore#merge(byte[], byte[])}. Implementations must be pure: concurrent stores may call
 * them more than once for the same write and keep only one result.
 */
@FunctionalInterface
public interface MergeOperator {
  /**
   * Appends every operand to the current value. Never overwrites and never interprets the bytes, so writes to the same key are
   * associative and, for consumers that treat the value as a multiset of fixed-size records, commutative.
   */
  MergeOperator CONCATENATE = (key, existing, operand) -> {
    if (existing == null || existing.length == 0)
      return operand.clone();

    final byte[] merged = new byte[existing.length + operand.length];
    System.arraycopy(existing, 0, merged, 0, existing.length);
    System.arraycopy(operand, 0, merged, existing.length, operand.length);
    return merged;
  };

  /**
   * Last write wins. This is the behavior of a plain put and the default of stores opened without a merge operator.
   */
  MergeOperator REPLACE = (key, existing, operand) -> operand.clone();

  /**
   * @param key      the key being written
   * @param existing the current value, or null if the key is absent
   * @param operand  the value passed to merge
   *
   * @return the new value, or null to remove the key
   */
  byte[] merge(byte[] key, byte[] existing, byte[] operand);
}
