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

import com.logstreamer.log.LogPosition;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

/**
 * The positions a peer has already seen, per table.
 * <p>
 * The entry with the empty key ({@link #DATABASE_KEY}) is the last position
 * the peer has seen for the whole database.
 * <p>
 * Instances are immutable. As tables catch up during a session, the reader
 * replaces its instance with a smaller one returned by {@link #without(String)}.
 */
public final class TablePositions {
  private static final Logger log = LoggerFactory.getLogger(TablePositions.class);

  public static final String DATABASE_KEY = "";

  public static final TablePositions EMPTY = new TablePositions(emptyMap());

  private final Map<String, LogPosition> positions;

  /**
   * Copies the positions sent by a peer, removing the peer's prefix from
   * table names and ids.
   * <p>
   * A key that is empty only after the prefix is removed names no table and is ignored.
   * If several keys name the same table, the lowest position wins.
   * Null values are ignored.
   */
  public static TablePositions normalize(@Nullable Map<String, Long> tablePositions, PeerIdentity peer) {
    if (tablePositions == null || tablePositions.isEmpty()) {
      return EMPTY;
    }

    Map<String, LogPosition> result = new LinkedHashMap<>();
    tablePositions.forEach((tableNameOrId, commitId) -> {
      if (tableNameOrId == null || commitId == null) {
        log.debug("Ignoring incomplete table position entry: {}={}", tableNameOrId, commitId);
        return;
      }

      String key;
      if (tableNameOrId.trim().isEmpty()) {
        key = DATABASE_KEY;
      } else {
        key = peer.stripDatabasePrefix(tableNameOrId);
        if (key.isEmpty()) {
          log.debug("Ignoring table position with no table name: '{}'", tableNameOrId);
          return;
        }
      }

      LogPosition position = LogPosition.ofCommitId(commitId);
      result.merge(key, position, (a, b) -> a.compareTo(b) <= 0 ? a : b);
    });

    return of(result);
  }

  static TablePositions of(Map<String, LogPosition> positions) {
    return positions.isEmpty() ? EMPTY : new TablePositions(positions);
  }

  private TablePositions(Map<String, LogPosition> positions) {
    this.positions = unmodifiableMap(new LinkedHashMap<>(positions));
  }

  /**
   * Returns the position for the given table, or null if there is none.
   */
  public @Nullable LogPosition get(String table) {
    return positions.get(table);
  }

  public boolean contains(String table) {
    return positions.containsKey(table);
  }

  /**
   * Returns the database-wide position, or null if the peer did not send one.
   */
  public @Nullable LogPosition databasePosition() {
    return positions.get(DATABASE_KEY);
  }

  /**
   * Returns the lowest table position, ignoring the database-wide position.
   * Returns null if there are no table positions.
   */
  public @Nullable LogPosition minTablePosition() {
    LogPosition min = null;
    for (Map.Entry<String, LogPosition> entry : positions.entrySet()) {
      if (entry.getKey().equals(DATABASE_KEY)) {
        continue;
      }
      if (min == null || entry.getValue().compareTo(min) < 0) {
        min = entry.getValue();
      }
    }
    return min;
  }

  /**
   * Returns positions without the given table, or this instance if the table has no position.
   */
  public TablePositions without(String table) {
    if (!positions.containsKey(table)) {
      return this;
    }
    Map<String, LogPosition> smaller = new LinkedHashMap<>(positions);
    smaller.remove(table);
    return of(smaller);
  }

  public boolean isEmpty() {
    return positions.isEmpty();
  }

  public int size() {
    return positions.size();
  }

  public Set<String> tables() {
    return positions.keySet();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TablePositions that = (TablePositions) o;
    return positions.equals(that.positions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(positions);
  }

  @Override
  public String toString() {
    return positions.toString();
  }
}
