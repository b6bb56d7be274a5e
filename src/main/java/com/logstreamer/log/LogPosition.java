/*
 * Copyright 2025 Couchbase, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.logstreamer.log;

/**
 * A point in the transaction log, identified by the commit counter
 * of a transaction.
 * <p>
 * The commit id is an unsigned 64-bit value. Positions are compared
 * using unsigned arithmetic, so commit ids past {@code Long.MAX_VALUE}
 * still sort after smaller ones.
 */
public final class LogPosition implements Comparable<LogPosition> {
  /**
   * The position before the first transaction in the log.
   */
  public static final LogPosition START = new LogPosition(0);

  private final long commitId;

  public static LogPosition ofCommitId(long commitId) {
    return commitId == 0 ? START : new LogPosition(commitId);
  }

  private LogPosition(long commitId) {
    this.commitId = commitId;
  }

  /**
   * Returns the commit id, to be interpreted as unsigned.
   */
  public long commitId() {
    return commitId;
  }

  public boolean isAfter(LogPosition other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(LogPosition o) {
    return Long.compareUnsigned(commitId, o.commitId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    LogPosition that = (LogPosition) o;
    return commitId == that.commitId;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(commitId);
  }

  @Override
  public String toString() {
    return Long.toUnsignedString(commitId);
  }
}
