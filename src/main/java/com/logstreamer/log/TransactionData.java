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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

/**
 * The changes made by one committed transaction, in commit order,
 * grouped by operation type.
 * <p>
 * Instances are immutable. Filtering produces a new instance
 * via {@link #withRecords(List, List, List)}.
 */
public final class TransactionData {
  public static final TransactionData EMPTY = new TransactionData(emptyList(), emptyList(), emptyList());

  private final List<CreateRecordEntry> creates;
  private final List<UpdateRecordEntry> updates;
  private final List<DeleteRecordEntry> deletes;

  public TransactionData(
      List<CreateRecordEntry> creates,
      List<UpdateRecordEntry> updates,
      List<DeleteRecordEntry> deletes
  ) {
    this.creates = unmodifiableList(new ArrayList<>(creates));
    this.updates = unmodifiableList(new ArrayList<>(updates));
    this.deletes = unmodifiableList(new ArrayList<>(deletes));
  }

  public List<CreateRecordEntry> creates() {
    return creates;
  }

  public List<UpdateRecordEntry> updates() {
    return updates;
  }

  public List<DeleteRecordEntry> deletes() {
    return deletes;
  }

  public TransactionData withRecords(
      List<CreateRecordEntry> creates,
      List<UpdateRecordEntry> updates,
      List<DeleteRecordEntry> deletes
  ) {
    return new TransactionData(creates, updates, deletes);
  }

  public boolean isEmpty() {
    return creates.isEmpty() && updates.isEmpty() && deletes.isEmpty();
  }

  public int size() {
    return creates.size() + updates.size() + deletes.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TransactionData that = (TransactionData) o;
    return creates.equals(that.creates) &&
        updates.equals(that.updates) &&
        deletes.equals(that.deletes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(creates, updates, deletes);
  }

  @Override
  public String toString() {
    return "TransactionData{" +
        "creates=" + creates +
        ", updates=" + updates +
        ", deletes=" + deletes +
        '}';
  }
}
