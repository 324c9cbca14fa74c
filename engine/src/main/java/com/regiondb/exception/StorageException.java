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
 * Exception thrown when the underlying ordered store fails.
 * <p>
 * This exception category covers:
 * <ul>
 *   <li>File system I/O errors (read/write failures)</li>
 *   <li>Data corruption detected while replaying a log</li>
 *   <li>Serialization/deserialization errors</li>
 * </ul>
 * It is propagated verbatim to the caller of insert, finalize and query operations and never retried internally.
 */
public class StorageException extends RegionDBException {
  public StorageException(final String message) {
    super(ErrorCode.IO_ERROR, message);
  }

  public StorageException(final String message, final Throwable cause) {
    super(ErrorCode.IO_ERROR, message, cause);
  }

  public StorageException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public StorageException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }
}
