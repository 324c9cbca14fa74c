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
package com.regiondb.exception;

/**
 * Signals a malformed boundary event stream: a label closed more times than it was opened, labels left active at the end of a
 * scope, or a record that cannot be decoded. This is a data-corruption signal for the scope being finalized, not a transient
 * error: retrying without fixing the producers yields the same failure.
 */
public class InvariantViolationException extends RegionDBException {
  public InvariantViolationException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }
}
