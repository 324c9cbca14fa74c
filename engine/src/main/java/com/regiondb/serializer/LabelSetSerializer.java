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
 * Serializes the label set of a consolidated entry as a sorted, deduplicated array of big-endian {@code u32} label ids.
 */
public final class LabelSetSerializer {
  private LabelSetSerializer() {
  }

  public static byte[] serialize(final int[] labels) {
    final byte[] buffer = new byte[KeySerializer.INT_SIZE * labels.length];
    for (int i = 0; i < labels.length; ++i)
      KeySerializer.putInt(buffer, KeySerializer.INT_SIZE * i, labels[i]);
    return buffer;
  }

  public static int[] deserialize(final byte[] buffer) {
    if (buffer.length == 0 || buffer.length % KeySerializer.INT_SIZE != 0)
      throw new StorageException(ErrorCode.SERIALIZATION_ERROR, "Invalid label set value of " + buffer.length + " bytes");

    final int[] labels = new int[buffer.length / KeySerializer.INT_SIZE];
    for (int i = 0; i < labels.length; ++i)
      labels[i] = KeySerializer.getInt(buffer, KeySerializer.INT_SIZE * i);
    return labels;
  }
}
