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

import static java.util.Objects.requireNonNull;

/**
 * Decides where in the log a session starts reading, given the positions
 * the peer has already seen.
 * <p>
 * Table positions are only precise enough to use when the peer also sent
 * a table filter, and the filter names no table without a position. In every
 * other case reading starts at the database-wide position, which is always safe.
 * Table positions below the database-wide position are stale, since the peer
 * has seen the whole database up to that point.
 */
public class StartPositionResolver {
  private static final Logger log = LoggerFactory.getLogger(StartPositionResolver.class);

  public enum Reason {
    NO_TABLE_FILTER,
    NO_TABLE_POSITIONS,
    TABLE_WITHOUT_POSITION,
    DATABASE_POSITION_AHEAD,
    LOWEST_TABLE_POSITION,
  }

  public static class Resolution {
    private final LogPosition startPosition;
    private final TablePositions remaining;
    private final Reason reason;

    Resolution(LogPosition startPosition, TablePositions remaining, Reason reason) {
      this.startPosition = requireNonNull(startPosition);
      this.remaining = requireNonNull(remaining);
      this.reason = requireNonNull(reason);
    }

    /**
     * Where the log should be opened.
     */
    public LogPosition startPosition() {
      return startPosition;
    }

    /**
     * The table positions still to be checked while streaming.
     * Never includes the database-wide position.
     */
    public TablePositions remaining() {
      return remaining;
    }

    public Reason reason() {
      return reason;
    }

    @Override
    public String toString() {
      return "Resolution{" +
          "startPosition=" + startPosition +
          ", reason=" + reason +
          ", remaining=" + remaining +
          '}';
    }
  }

  public Resolution resolve(TablePositions positions, TableFilter tableFilter) {
    requireNonNull(positions);
    requireNonNull(tableFilter);

    LogPosition databasePosition = positions.databasePosition();
    if (databasePosition == null) {
      databasePosition = LogPosition.START;
    }
    LogPosition minTablePosition = positions.minTablePosition();
    TablePositions remaining = positions.without(TablePositions.DATABASE_KEY);

    Resolution resolution = resolve(databasePosition, minTablePosition, remaining, tableFilter);
    log.info("Starting at log position {} ({}); database position {}, lowest table position {}, table filter {}",
        resolution.startPosition(),
        resolution.reason(),
        databasePosition,
        minTablePosition,
        tableFilter);
    return resolution;
  }

  private static Resolution resolve(
      LogPosition databasePosition,
      @Nullable LogPosition minTablePosition,
      TablePositions remaining,
      TableFilter tableFilter
  ) {
    if (!tableFilter.isRestricted()) {
      return new Resolution(databasePosition, remaining, Reason.NO_TABLE_FILTER);
    }
    if (remaining.isEmpty()) {
      return new Resolution(databasePosition, remaining, Reason.NO_TABLE_POSITIONS);
    }

    for (String table : tableFilter.tables()) {
      if (!remaining.contains(table)) {
        log.debug("Table '{}' is in the table filter but has no position", table);
        return new Resolution(databasePosition, remaining, Reason.TABLE_WITHOUT_POSITION);
      }
    }

    // remaining is not empty, so there is a lowest table position
    if (requireNonNull(minTablePosition).compareTo(databasePosition) < 0) {
      return new Resolution(databasePosition, remaining, Reason.DATABASE_POSITION_AHEAD);
    }

    return new Resolution(minTablePosition, remaining, Reason.LOWEST_TABLE_POSITION);
  }
}
