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

package com.logstreamer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static java.util.Collections.emptySet;
import static java.util.Collections.unmodifiableSet;

/**
 * The set of tables a peer asked for.
 * <p>
 * An unrestricted filter ({@link #ALL}) includes every table.
 */
public final class TableFilter {
  private static final Logger log = LoggerFactory.getLogger(TableFilter.class);

  public static final TableFilter ALL = new TableFilter(null);

  private final @Nullable Set<String> tables;

  /**
   * Copies the table filter sent by a peer, removing the peer's prefix from
   * table names and ids.
   * <p>
   * Entries that are empty after the prefix is removed are silently dropped.
   * A null set means the peer wants all tables. A set with no usable entries
   * includes no tables at all.
   */
  public static TableFilter of(@Nullable Set<String> tableNamesOrIds, PeerIdentity peer) {
    if (tableNamesOrIds == null) {
      return ALL;
    }

    Set<String> tables = new LinkedHashSet<>();
    for (String tableNameOrId : tableNamesOrIds) {
      String table = tableNameOrId == null ? "" : peer.stripDatabasePrefix(tableNameOrId);
      if (table.isEmpty()) {
        log.debug("Ignoring table filter entry with no table name: '{}'", tableNameOrId);
        continue;
      }
      tables.add(table);
    }
    return new TableFilter(tables);
  }

  private TableFilter(@Nullable Set<String> tables) {
    this.tables = tables == null ? null : unmodifiableSet(tables);
  }

  public boolean isRestricted() {
    return tables != null;
  }

  public boolean includes(String table) {
    return tables == null || tables.contains(table);
  }

  /**
   * Returns the included tables, or an empty set if the filter is unrestricted.
   */
  public Set<String> tables() {
    return tables == null ? emptySet() : tables;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TableFilter that = (TableFilter) o;
    return Objects.equals(tables, that.tables);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(tables);
  }

  @Override
  public String toString() {
    return tables == null ? "ALL" : tables.toString();
  }
}
