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
import com.regiondb.serializer.KeySerializer;

/**
 * Fixed-size boundary record {@code {label: u32 BE, end: u32 BE}}. A mark {@code [start, end)} writes the same record under the
 * keys {@code (scope, start)} and {@code (scope, end)}: stored under offset {@code o}, the record opens the label when
 * {@code end > o} and closes it when {@code end == o}. Values of a key are the concatenation of all the records written there, in
 * arrival order.
 */
public final class BoundaryRecord {
  public static final int SIZE = 8;

  private BoundaryRecord() {
  }

  public static byte[] serialize(final int label, final int end) {
    final byte[] record = new byte[SIZE];
    KeySerializer.putInt(record, 0, label);
    KeySerializer.putInt(record, 4, end);
    return record;
  }

  /**
   * Returns the number of records concatenated in {@code value}.
   *
   * @throws InvariantViolationException if the value is not a whole number of records
   */
  public static int count(final byte[] value) {
    if (value.length == 0 || value.length % SIZE != 0)
      throw new InvariantViolationException(ErrorCode.MALFORMED_RECORD,
          "Boundary value of " + value.length + " bytes is not a sequence of " + SIZE + "-byte records");
    return value.length / SIZE;
  }

  public static int label(final byte[] value, final int index) {
    return KeySerializer.getInt(value, index * SIZE);
  }

  public static int end(final byte[] value, final int index) {
    return KeySerializer.getInt(value, index * SIZE + 4);
  }
}
