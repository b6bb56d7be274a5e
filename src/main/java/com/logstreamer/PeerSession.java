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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * What the handshake with a peer negotiated for one replication session.
 */
public final class PeerSession {
  private final PeerIdentity peer;
  private final @Nullable Map<String, Long> tablePositions;
  private final @Nullable Set<String> tableFilter;

  /**
   * @param peer the destination of the stream.
   * @param tablePositions map from table name or id to the last commit id the peer
   * has seen for that table. The empty key holds the last commit id the peer has
   * seen for the whole database. Null if the peer sent no positions.
   * @param tableFilter names or ids of the tables to send, or null to send all tables.
   */
  public PeerSession(
      PeerIdentity peer,
      @Nullable Map<String, Long> tablePositions,
      @Nullable Set<String> tableFilter
  ) {
    this.peer = requireNonNull(peer);
    this.tablePositions = tablePositions == null ? null : unmodifiableMap(new LinkedHashMap<>(tablePositions));
    this.tableFilter = tableFilter == null ? null : unmodifiableSet(new LinkedHashSet<>(tableFilter));
  }

  public PeerIdentity peer() {
    return peer;
  }

  public @Nullable Map<String, Long> tablePositions() {
    return tablePositions;
  }

  public @Nullable Set<String> tableFilter() {
    return tableFilter;
  }

  @Override
  public String toString() {
    return "PeerSession{" +
        "peer=" + peer +
        ", tablePositions=" + tablePositions +
        ", tableFilter=" + tableFilter +
        '}';
  }
}
