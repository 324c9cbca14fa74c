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

import java.util.Arrays;

/**
 * Consolidated entry of a scope's partition: the maximal range {@code [start, end)} over which exactly {@code labels} are active.
 * Labels are sorted in ascending unsigned order, unique and never empty. Offsets and ids are unsigned 32-bit values.
 */
public record RegionEntry(int scope, int start, int end, int[] labels) {

  public boolean contains(final int label) {
    for (final int l : labels)
      if (l == label)
        return true;
    return false;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof RegionEntry))
      return false;
    final RegionEntry other = (RegionEntry) o;
    return scope == other.scope && start == other.start && end == other.end && Arrays.equals(labels, other.labels);
  }

  @Override
  public int hashCode() {
    int result = scope;
    result = 31 * result + start;
    result = 31 * result + end;
    result = 31 * result + Arrays.hashCode(labels);
    return result;
  }

  @Override
  public String toString() {
    final StringBuilder buffer = new StringBuilder();
    buffer.append(Integer.toUnsignedString(scope)).append('@').append(Integer.toUnsignedString(start)).append("..")
        .append(Integer.toUnsignedString(end)).append(" {");
    for (int i = 0; i < labels.length; ++i) {
      if (i > 0)
        buffer.append(',');
      buffer.append(Integer.toUnsignedString(labels[i]));
    }
    return buffer.append('}').toString();
  }
}
