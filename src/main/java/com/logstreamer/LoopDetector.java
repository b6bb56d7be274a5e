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

import com.logstreamer.log.ColumnRecordEntry;
import com.logstreamer.log.ColumnUpdate;

import static java.util.Objects.requireNonNull;

/**
 * Recognizes transactions that would send a peer's own changes back to it.
 * <p>
 * When this database applies a transaction received from a peer, it also
 * writes a {@code LogStreamer.LastPosition} record whose {@code TableId}
 * starts with that peer's table id prefix. Finding such a record in a
 * transaction means the transaction came from the peer, and sending it
 * back would start a replication loop.
 */
public class LoopDetector {
  private final String peerTableIdPrefix;

  public LoopDetector(PeerIdentity peer) {
    this.peerTableIdPrefix = requireNonNull(peer).tableIdPrefix();
  }

  /**
   * Returns true if the record is a last-position marker written
   * for the peer.
   */
  public boolean isEcho(ColumnRecordEntry record) {
    if (!InternalTables.LAST_POSITION.equals(record.table())) {
      return false;
    }
    for (ColumnUpdate column : record.columns()) {
      if (InternalTables.TABLE_ID_COLUMN.equals(column.name())
          && column.value() instanceof String
          && ((String) column.value()).startsWith(peerTableIdPrefix)) {
        return true;
      }
    }
    return false;
  }
}
