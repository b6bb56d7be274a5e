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

import com.logstreamer.log.ColumnUpdate;
import com.logstreamer.log.CreateRecordEntry;
import com.logstreamer.log.DeleteRecordEntry;
import com.logstreamer.log.LogPosition;
import com.logstreamer.log.LogReadResult;
import com.logstreamer.log.RecordEntry;
import com.logstreamer.log.TransactionData;
import com.logstreamer.log.UpdateRecordEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for log records used by the tests.
 */
final class Transactions {
  private Transactions() {
  }

  static CreateRecordEntry create(String table, long key, ColumnUpdate... columns) {
    return new CreateRecordEntry(table, key, Arrays.asList(columns));
  }

  static UpdateRecordEntry update(String table, long key, ColumnUpdate... columns) {
    return new UpdateRecordEntry(table, key, Arrays.asList(columns));
  }

  static DeleteRecordEntry delete(String table, long key) {
    return new DeleteRecordEntry(table, key);
  }

  static ColumnUpdate column(String name, Object value) {
    return new ColumnUpdate(name, value);
  }

  /**
   * A last-position marker, as written when a transaction from the peer
   * with the given table id prefix is applied.
   */
  static UpdateRecordEntry lastPositionMarker(String tableId) {
    return update(InternalTables.LAST_POSITION, 1,
        column(InternalTables.TABLE_ID_COLUMN, tableId),
        column("CommitId", 42L));
  }

  static LogReadResult transaction(long commitId, RecordEntry... records) {
    List<CreateRecordEntry> creates = new ArrayList<>();
    List<UpdateRecordEntry> updates = new ArrayList<>();
    List<DeleteRecordEntry> deletes = new ArrayList<>();
    for (RecordEntry record : records) {
      if (record instanceof CreateRecordEntry) {
        creates.add((CreateRecordEntry) record);
      } else if (record instanceof UpdateRecordEntry) {
        updates.add((UpdateRecordEntry) record);
      } else {
        deletes.add((DeleteRecordEntry) record);
      }
    }
    return new LogReadResult(LogPosition.ofCommitId(commitId), new TransactionData(creates, updates, deletes));
  }
}
