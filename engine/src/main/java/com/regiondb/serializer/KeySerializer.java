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
package com.regiondb.serializer;

import com.regiondb.exception.ErrorCode;
import com.regiondb.exception.StorageException;

/**
 * Builds and parses the composite keys of the ordered trees. Every component is an unsigned 32-bit value written big-endian, so the
 * unsigned lexicographic order of the keys equals the numeric order of the tuples: {@code (scope, offset)} keys iterate a scope's
 * offsets in ascending order and {@code (label, scope, start, end)} keys iterate a label's entries by scope then start.
 */
public final class KeySerializer {
  public static final int INT_SIZE = 4;

  private KeySerializer() {
  }

  public static byte[] key(final int first) {
    final byte[] key = new byte[INT_SIZE];
    putInt(key, 0, first);
    return key;
  }

  public static byte[] key(final int first, final int second) {
    final byte[] key = new byte[INT_SIZE * 2];
    putInt(key, 0, first);
    putInt(key, INT_SIZE, second);
    return key;
  }

  public static byte[] key(final int first, final int second, final int third) {
    final byte[] key = new byte[INT_SIZE * 3];
    putInt(key, 0, first);
    putInt(key, INT_SIZE, second);
    putInt(key, INT_SIZE * 2, third);
    return key;
  }

  public static byte[] key(final int first, final int second, final int third, final int fourth) {
    final byte[] key = new byte[INT_SIZE * 4];
    putInt(key, 0, first);
    putInt(key, INT_SIZE, second);
    putInt(key, INT_SIZE * 2, third);
    putInt(key, INT_SIZE * 3, fourth);
    return key;
  }

  /**
   * Returns the smallest key strictly greater than every key starting with {@code prefix}, or null when no such key exists (the
   * prefix is made of 0xFF bytes only). Used as exclusive upper bound of prefix scans.
   */
  public static byte[] prefixUpperBound(final byte[] prefix) {
    for (int i = prefix.length - 1; i >= 0; --i) {
      if (prefix[i] != (byte) 0xFF) {
        final byte[] bound = new byte[i + 1];
        System.arraycopy(prefix, 0, bound, 0, i + 1);
        bound[i]++;
        return bound;
      }
    }
    return null;
  }

  public static void putInt(final byte[] buffer, final int position, final int value) {
    buffer[position] = (byte) (value >>> 24);
    buffer[position + 1] = (byte) (value >>> 16);
    buffer[position + 2] = (byte) (value >>> 8);
    buffer[position + 3] = (byte) value;
  }

  public static int getInt(final byte[] buffer, final int position) {
    if (position < 0 || position + INT_SIZE > buffer.length)
      throw new StorageException(ErrorCode.SERIALIZATION_ERROR,
          "Cannot read a 4-byte integer at position " + position + " of a " + buffer.length + "-byte buffer");

    return ((buffer[position] & 0xFF) << 24) | ((buffer[position + 1] & 0xFF) << 16) | ((buffer[position + 2] & 0xFF) << 8) | (
        buffer[position + 3] & 0xFF);
  }

  /**
   * Reads the key component at {@code index} (0-based) of a composite key.
   */
  public static int component(final byte[] key, final int index) {
    return getInt(key, index * INT_SIZE);
  }
}
