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

import java.util.Arrays;

/**
 * Lexicographical comparison of byte arrays where every byte is treated as unsigned. With big-endian integer encoding this order
 * equals the numeric order of the encoded values, which is what every ordered tree of the engine relies on.
 * <p>
 * This class was inspired by Guava's UnsignedBytes, under Apache 2 license.
 *
 * @author Louis Wasserman
 * @author Brian Milch
 * @author Colin Evans
 */
public final class UnsignedBytesComparator {
  private static final int                 UNSIGNED_MASK        = 0xFF;
  public static final  PureJavaComparator  PURE_JAVA_COMPARATOR = new PureJavaComparator();
  public static final  ByteArrayComparator BEST_COMPARATOR      = new ArraysComparator();

  private UnsignedBytesComparator() {
  }

  /**
   * Delegates to the JDK's vectorized {@link Arrays#compareUnsigned(byte[], byte[])}.
   */
  public static class ArraysComparator implements ByteArrayComparator {
    @Override
    public int compare(final byte[] left, final byte[] right) {
      return Arrays.compareUnsigned(left, right);
    }

    @Override
    public boolean equals(final byte[] left, final byte[] right, final int length) {
      if (left.length < length || right.length < length)
        return false;
      return Arrays.equals(left, 0, length, right, 0, length);
    }

    @Override
    public String toString() {
      return "UnsignedBytes.lexicographicalComparator() (java.util.Arrays version)";
    }
  }

  public static class PureJavaComparator implements ByteArrayComparator {
    @Override
    public int compare(final byte[] left, final byte[] right) {
      final int minLength = Math.min(left.length, right.length);
      for (int i = 0; i < minLength; i++) {
        final int result = UnsignedBytesComparator.compare(left[i], right[i]);
        if (result != 0)
          return result;
      }
      return left.length - right.length;
    }

    @Override
    public boolean equals(final byte[] left, final byte[] right, final int length) {
      if (left.length < length || right.length < length)
        return false;

      for (int i = 0; i < length; i++) {
        if (left[i] != right[i])
          return false;
      }
      return true;
    }

    @Override
    public String toString() {
      return "UnsignedBytes.lexicographicalComparator() (pure Java version)";
    }
  }

  public static int compare(final byte a, final byte b) {
    return (a & UNSIGNED_MASK) - (b & UNSIGNED_MASK);
  }
}
