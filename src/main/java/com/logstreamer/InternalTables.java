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

/**
 * Names of the bookkeeping tables LogStreamer keeps in the replicated database.
 * <p>
 * These names are shared with the peer and must not change.
 */
public final class InternalTables {
  private InternalTables() {
    throw new AssertionError("not instantiable");
  }

  /**
   * Every internal table name starts with this prefix.
   */
  public static final String PREFIX = "LogStreamer.";

  /**
   * Records, per peer table, the last position received from a peer.
   */
  public static final String LAST_POSITION = PREFIX + "LastPosition";

  /**
   * Column of {@link #LAST_POSITION} holding the peer-scoped table id
   * ({@code "<peer guid>/<table>"}).
   */
  public static final String TABLE_ID_COLUMN = "TableId";

  public static boolean isInternal(String table) {
    return table.startsWith(PREFIX);
  }
}
