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

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for RegionDB exceptions.
 * Error codes are organized in categories based on the first digit:
 * <ul>
 *   <li>1xxx - Database errors (lifecycle, configuration)</li>
 *   <li>5xxx - Storage errors (I/O, serialization, corruption)</li>
 *   <li>8xxx - Region errors (finalization, invariants, queries)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see RegionDBException
 */
public enum ErrorCode {

  // ========== Database Errors (1xxx) ==========
  /** Operation attempted on a closed database */
  DATABASE_IS_CLOSED(1003, "Database is closed"),

  /** Database configuration error */
  CONFIGURATION_ERROR(1008, "Configuration error"),

  // ========== Storage Errors (5xxx) ==========
  /** File system I/O operation failed */
  IO_ERROR(5001, "I/O error"),

  /** Data corruption detected in storage files */
  CORRUPTION_DETECTED(5002, "Data corruption detected"),

  /** Binary serialization/deserialization failed */
  SERIALIZATION_ERROR(5004, "Serialization error"),

  // ========== Region Errors (8xxx) ==========
  /** More closing than opening boundary events observed for a label */
  REFCOUNT_UNDERFLOW(8101, "Active-set reference count underflow"),

  /** Labels still active once every boundary event of a scope was consumed */
  ACTIVE_SET_LEAK(8102, "Active-set reference count leak"),

  /** A boundary record does not respect the fixed-size layout or its end precedes its offset */
  MALFORMED_RECORD(8103, "Malformed boundary record"),

  /** Scope-qualified query on a scope that was never finalized or is being finalized */
  SCOPE_NOT_FINALIZED(8104, "Scope not finalized"),

  /** Finalization requested for a scope that is already being finalized */
  FINALIZATION_IN_PROGRESS(8105, "Finalization already in progress"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values()).collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  /**
   * Returns the numeric error code.
   */
  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   *
   * @return the error category name
   */
  public String getCategory() {
    final int category = code / 1000;
    return switch (category) {
      case 1 -> "Database";
      case 5 -> "Storage";
      case 8 -> "Region";
      case 99 -> "Internal";
      default -> "Unknown";
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @param code the numeric error code to look up
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
