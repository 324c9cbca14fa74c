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
 * Statistics of the finalization of one scope.
 * <p>
 * An instance is filled by the single thread finalizing the scope and read once the finalization is over.
 * </p>
 */
public final class FinalizeMetrics {
  private final long startTime;
  private       long endTime;
  private       long recordsRead;
  private       long eventsApplied;
  private       long cancelledEvents;
  private       long entriesWritten;
  private       long referencesWritten;
  private       long gaps;
  private       long entriesRemoved;

  /**
   * Creates a new instance with the start time set to the current system time.
   */
  public FinalizeMetrics() {
    this.startTime = System.currentTimeMillis();
  }

  /**
   * Records one consolidated entry published with {@code labels} references.
   *
   * @param labels number of labels of the entry, that is the number of reference keys written for it
   */
  public void addEntry(final int labels) {
    ++entriesWritten;
    referencesWritten += labels;
  }

  /**
   * Adds the counters of the sweep that produced the entries.
   *
   * @param recordsRead     boundary records decoded from the markers tree
   * @param eventsApplied   events committed into the active set
   * @param cancelledEvents (offset, label) pairs whose opens and closes cancelled out
   * @param gaps            ranges not covered by any label
   */
  public void addSweep(final long recordsRead, final long eventsApplied, final long cancelledEvents, final long gaps) {
    this.recordsRead += recordsRead;
    this.eventsApplied += eventsApplied;
    this.cancelledEvents += cancelledEvents;
    this.gaps += gaps;
  }

  /**
   * Adds the number of entries of a previous finalization removed before publishing the new partition.
   */
  public void addEntriesRemoved(final long count) {
    entriesRemoved += count;
  }

  /**
   * Stops the clock.
   */
  public void stop() {
    endTime = System.currentTimeMillis();
  }

  public long getRecordsRead() {
    return recordsRead;
  }

  public long getEventsApplied() {
    return eventsApplied;
  }

  public long getCancelledEvents() {
    return cancelledEvents;
  }

  public long getEntriesWritten() {
    return entriesWritten;
  }

  public long getReferencesWritten() {
    return referencesWritten;
  }

  public long getGaps() {
    return gaps;
  }

  public long getEntriesRemoved() {
    return entriesRemoved;
  }

  public long getStartTime() {
    return startTime;
  }

  /**
   * Returns the elapsed time in milliseconds, up to now if the finalization is still running.
   *
   * @return the elapsed time in milliseconds
   */
  public long getElapsedTime() {
    return (endTime > 0 ? endTime : System.currentTimeMillis()) - startTime;
  }

  @Override
  public String toString() {
    return "FinalizeMetrics{" +
        "recordsRead=" + recordsRead +
        ", eventsApplied=" + eventsApplied +
        ", cancelledEvents=" + cancelledEvents +
        ", entriesWritten=" + entriesWritten +
        ", referencesWritten=" + referencesWritten +
        ", gaps=" + gaps +
        ", entriesRemoved=" + entriesRemoved +
        ", elapsedTime=" + getElapsedTime() + "ms" +
        '}';
  }
}
