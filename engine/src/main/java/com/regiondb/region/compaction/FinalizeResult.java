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
package com.regiondb.region.compaction;

/**
 * Outcome of the finalization of one scope.
 *
 * @param scope   the finalized scope
 * @param success whether the partition of the scope was published
 * @param metrics the metrics collected, up to the failure if any
 * @param error   the cause of the failure, null on success
 */
public record FinalizeResult(int scope, boolean success, FinalizeMetrics metrics, RuntimeException error) {

  /**
   * Creates a successful result.
   *
   * @param scope   the finalized scope
   * @param metrics the final metrics
   *
   * @return a successful FinalizeResult
   */
  public static FinalizeResult success(final int scope, final FinalizeMetrics metrics) {
    return new FinalizeResult(scope, true, metrics, null);
  }

  /**
   * Creates a failed result.
   *
   * @param scope   the scope that failed
   * @param metrics the metrics collected before the failure
   * @param error   the cause
   *
   * @return a failed FinalizeResult
   */
  public static FinalizeResult failure(final int scope, final FinalizeMetrics metrics, final RuntimeException error) {
    return new FinalizeResult(scope, false, metrics, error);
  }

  public long getEntries() {
    return metrics != null ? metrics.getEntriesWritten() : 0;
  }

  public long getElapsedTime() {
    return metrics != null ? metrics.getElapsedTime() : 0;
  }

  @Override
  public String toString() {
    return "FinalizeResult{scope=" + Integer.toUnsignedString(scope) + ", success=" + success + ", metrics=" + metrics + (error != null ?
        ", error=" + error :
        "") + '}';
  }
}
