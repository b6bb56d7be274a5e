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

import static java.util.Collections.unmodifiableList;

/**
 * A record entry that carries column values (a create or an update).
 */
public abstract class ColumnRecordEntry extends RecordEntry {
  private final List<ColumnUpdate> columns;

  protected ColumnRecordEntry(String table, long key, List<ColumnUpdate> columns) {
    super(table, key);
    this.columns = unmodifiableList(new ArrayList<>(columns));
  }

  public List<ColumnUpdate> columns() {
    return columns;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ColumnRecordEntry that = (ColumnRecordEntry) o;
    return key() == that.key() &&
        table().equals(that.table()) &&
        columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), table(), key(), columns);
  }
}
