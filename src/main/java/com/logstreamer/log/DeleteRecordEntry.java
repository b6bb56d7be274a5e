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

/**
 * Removes a record. Carries only the table and the key.
 */
public final class DeleteRecordEntry extends RecordEntry {
  public DeleteRecordEntry(String table, long key) {
    super(table, key);
  }

  @Override
  public String operation() {
    return "delete";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DeleteRecordEntry that = (DeleteRecordEntry) o;
    return key() == that.key() &&
        table().equals(that.table());
  }

  @Override
  public int hashCode() {
    return Objects.hash(table(), key());
  }
}
