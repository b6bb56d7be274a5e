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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A committed transaction together with its position in the log.
 */
public final class LogReadResult {
  private final LogPosition continuationPosition;
  private final TransactionData transactionData;

  public LogReadResult(LogPosition continuationPosition, TransactionData transactionData) {
    this.continuationPosition = requireNonNull(continuationPosition);
    this.transactionData = requireNonNull(transactionData);
  }

  /**
   * The commit position of this transaction. Reading the log from this
   * position resumes after the transaction.
   */
  public LogPosition continuationPosition() {
    return continuationPosition;
  }

  public TransactionData transactionData() {
    return transactionData;
  }

  public LogReadResult withTransactionData(TransactionData transactionData) {
    return new LogReadResult(continuationPosition, transactionData);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    LogReadResult that = (LogReadResult) o;
    return continuationPosition.equals(that.continuationPosition) &&
        transactionData.equals(that.transactionData);
  }

  @Override
  public int hashCode() {
    return Objects.hash(continuationPosition, transactionData);
  }

  @Override
  public String toString() {
    return "LogReadResult{" +
        "position=" + continuationPosition +
        ", transaction=" + transactionData +
        '}';
  }
}
