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

/**
 * Net change of a label's reference count at one offset. {@code delta} is the number of marks of {@code label} opening at
 * {@code offset} minus the number closing there, never 0: coinciding opens and closes cancel out before an event is created.
 */
public record BoundaryEvent(int offset, int label, int delta) {
  @Override
  public String toString() {
    return Integer.toUnsignedString(offset) + ":" + Integer.toUnsignedString(label) + (delta > 0 ? "+" : "") + delta;
  }
}
