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

import com.regiondb.exception.StorageException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelSetSerializerTest {

  @Test
  void serializesSortedLabelsBigEndian() {
    final byte[] buffer = LabelSetSerializer.serialize(new int[] { 1, 0x80000000 });
    assertThat(buffer).containsExactly(0, 0, 0, 1, 0x80, 0, 0, 0);
    assertThat(LabelSetSerializer.deserialize(buffer)).containsExactly(1, 0x80000000);
  }

  @Test
  void invalidLengthIsRejected() {
    assertThatThrownBy(() -> LabelSetSerializer.deserialize(new byte[0])).isInstanceOf(StorageException.class);
    assertThatThrownBy(() -> LabelSetSerializer.deserialize(new byte[5])).isInstanceOf(StorageException.class);
  }
}
