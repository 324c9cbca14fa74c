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
 * Lifecycle of a scope. A scope is {@link #OPEN} from its first mark, and again after any mark inserted once it was finalized.
 */
public enum ScopeState {
  OPEN((byte) 0), FINALIZING((byte) 1), FINALIZED((byte) 2), FAILED((byte) 3);

  private final byte code;

  ScopeState(final byte code) {
    this.code = code;
  }

  public byte getCode() {
    return code;
  }

  public static ScopeState fromCode(final byte code) {
    for (final ScopeState state : values())
      if (state.code == code)
        return state;
    throw new IllegalArgumentException("Unknown scope state " + code);
  }
}
