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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-scope outcome of a batch finalization. One scope failing does not prevent the others from being published: the report lists
 * both.
 */
public class FinalizeReport {
  private final Map<Integer, FinalizeResult> results = new TreeMap<>(Integer::compareUnsigned);
  private final long                         elapsedTime;

  public FinalizeReport(final List<FinalizeResult> results, final long elapsedTime) {
    for (final FinalizeResult result : results)
      this.results.put(result.scope(), result);
    this.elapsedTime = elapsedTime;
  }

  public boolean isSuccess() {
    for (final FinalizeResult result : results.values())
      if (!result.success())
        return false;
    return true;
  }

  public FinalizeResult getResult(final int scope) {
    return results.get(scope);
  }

  /**
   * @return all the results, in ascending scope order
   */
  public Map<Integer, FinalizeResult> getResults() {
    return Collections.unmodifiableMap(results);
  }

  public List<FinalizeResult> getFailures() {
    final List<FinalizeResult> failures = new ArrayList<>();
    for (final FinalizeResult result : results.values())
      if (!result.success())
        failures.add(result);
    return failures;
  }

  public int getFinalizedScopes() {
    return results.size() - getFailures().size();
  }

  public long getTotalEntries() {
    long total = 0;
    for (final FinalizeResult result : results.values())
      if (result.success())
        total += result.getEntries();
    return total;
  }

  public long getElapsedTime() {
    return elapsedTime;
  }

  @Override
  public String toString() {
    return "FinalizeReport{scopes=" + results.size() + ", failed=" + getFailures().size() + ", entries=" + getTotalEntries()
        + ", elapsedTime=" + elapsedTime + "ms}";
  }
}
