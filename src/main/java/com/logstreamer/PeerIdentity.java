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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Identifies the peer database a filtered stream is sent to.
 * <p>
 * Table names and ids exchanged with a peer may be prefixed with the
 * peer's database GUID followed by a slash ({@code "<guid>/Sales.Order"}).
 * The same prefix marks loop bookkeeping records written on behalf of this peer.
 */
public final class PeerIdentity {
  private final String destination;
  private final String databaseGuid;
  private final String tableIdPrefix;

  /**
   * @param destination name of the peer, as passed to the operation filter.
   * @param databaseGuid unique id of the peer database.
   */
  public PeerIdentity(String destination, String databaseGuid) {
    this.destination = requireNonNull(destination);
    this.databaseGuid = requireNonNull(databaseGuid).trim();
    if (this.databaseGuid.isEmpty()) {
      throw new IllegalArgumentException("Peer database GUID must not be blank.");
    }
    this.tableIdPrefix = this.databaseGuid + "/";
  }

  public String destination() {
    return destination;
  }

  public String databaseGuid() {
    return databaseGuid;
  }

  /**
   * The prefix of table ids that belong to this peer.
   */
  public String tableIdPrefix() {
    return tableIdPrefix;
  }

  /**
   * Returns the given table name or id without this peer's prefix.
   * Surrounding whitespace is removed. The result may be empty.
   */
  public String stripDatabasePrefix(String tableNameOrId) {
    String s = tableNameOrId.trim();
    return s.startsWith(tableIdPrefix) ? s.substring(tableIdPrefix.length()).trim() : s;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PeerIdentity that = (PeerIdentity) o;
    return destination.equals(that.destination) &&
        databaseGuid.equals(that.databaseGuid);
  }

  @Override
  public int hashCode() {
    return Objects.hash(destination, databaseGuid);
  }

  @Override
  public String toString() {
    return destination + " (" + databaseGuid + ")";
  }
}
