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

import static java.util.Objects.requireNonNull;

/**
 * An operation on one record of one table, as read from the transaction log.
 * <p>
 * Entries are immutable. Filtering removes whole entries from a transaction;
 * it never changes an entry.
 */
public abstract class RecordEntry {
  private final String table;
  private final long key;

  protected RecordEntry(String table, long key) {
    this.table = requireNonNull(table);
    this.key = key;
  }

  /**
   * Qualified name of the table the record belongs to.
   */
  public String table() {
    return table;
  }

  /**
   * Record key (object id), to be interpreted as unsigned.
   */
  public long key() {
    return key;
  }

  /**
   * Returns a short description like "create", "update" or "delete".
   */
  public abstract String operation();

  @Override
  public String toString() {
    return operation() + "{" +
        "table='" + table + '\'' +
        ", key=" + Long.toUnsignedString(key) +
        '}';
  }
}
