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

import com.logstreamer.filter.OperationFilter;
import com.logstreamer.log.ColumnRecordEntry;
import com.logstreamer.log.CreateRecordEntry;
import com.logstreamer.log.DeleteRecordEntry;
import com.logstreamer.log.LogPosition;
import com.logstreamer.log.LogReadResult;
import com.logstreamer.log.RecordEntry;
import com.logstreamer.log.TransactionData;
import com.logstreamer.log.UpdateRecordEntry;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Removes the operations of a transaction that must not be sent to the peer,
 * and decides whether what remains is worth sending.
 * <p>
 * An operation is removed if any of these is true:
 * <ul>
 *   <li>it touches an internal LogStreamer table
 *   <li>its table is not in the table filter
 *   <li>the peer has already seen its table at the transaction's position
 *   <li>the operation filter says so
 * </ul>
 * A transaction containing a last-position marker for the peer is a replication
 * echo and is suppressed as a whole. A transaction left with no operations is
 * suppressed too.
 * <p>
 * Filtering never modifies its inputs. The table positions are threaded through
 * {@link #filter(LogReadResult, TablePositions)}: once an operation on a table is
 * newer than the table's position, the table has caught up, and the returned
 * positions no longer contain it.
 */
public class TransactionFilter {

  public enum Verdict {
    FORWARDED,
    SUPPRESSED_EMPTY,
    SUPPRESSED_LOOP,
  }

  public static class FilterResult {
    private final Verdict verdict;
    private final @Nullable LogReadResult forwarded;
    private final TablePositions positions;
    private final int droppedRecords;

    private FilterResult(Verdict verdict, @Nullable LogReadResult forwarded, TablePositions positions, int droppedRecords) {
      this.verdict = verdict;
      this.forwarded = forwarded;
      this.positions = positions;
      this.droppedRecords = droppedRecords;
    }

    public Verdict verdict() {
      return verdict;
    }

    public boolean isSuppressed() {
      return verdict != Verdict.FORWARDED;
    }

    /**
     * The filtered transaction, or null if the transaction was suppressed.
     */
    public @Nullable LogReadResult forwarded() {
      return forwarded;
    }

    /**
     * Table positions to use for the next transaction.
     */
    public TablePositions positions() {
      return positions;
    }

    /**
     * Number of operations removed from a forwarded or empty transaction.
     * Zero for a loop, since nothing is inspected after the loop marker.
     */
    public int droppedRecords() {
      return droppedRecords;
    }

    @Override
    public String toString() {
      return "FilterResult{" +
          "verdict=" + verdict +
          ", droppedRecords=" + droppedRecords +
          ", positions=" + positions +
          '}';
    }
  }

  private final TableFilter tableFilter;
  private final LoopDetector loopDetector;
  private final OperationFilter operationFilter;
  private final String destination;

  public TransactionFilter(PeerIdentity peer, TableFilter tableFilter, OperationFilter operationFilter) {
    this.tableFilter = requireNonNull(tableFilter);
    this.operationFilter = requireNonNull(operationFilter);
    this.loopDetector = new LoopDetector(peer);
    this.destination = peer.destination();
  }

  public FilterResult filter(LogReadResult result, TablePositions positions) {
    TransactionData tran = result.transactionData();
    FilterPass pass = new FilterPass(result.continuationPosition(), positions);

    List<CreateRecordEntry> creates = filterColumnRecords(tran.creates(), pass, operationFilter::filterCreate);
    if (creates == null) {
      return new FilterResult(Verdict.SUPPRESSED_LOOP, null, positions, 0);
    }

    List<UpdateRecordEntry> updates = filterColumnRecords(tran.updates(), pass, operationFilter::filterUpdate);
    if (updates == null) {
      return new FilterResult(Verdict.SUPPRESSED_LOOP, null, positions, 0);
    }

    List<DeleteRecordEntry> deletes = new ArrayList<>(tran.deletes().size());
    for (DeleteRecordEntry record : tran.deletes()) {
      if (InternalTables.isInternal(record.table())
          || !pass.keepTable(record)
          || operationFilter.filterDelete(destination, record)) {
        pass.dropped++;
        continue;
      }
      deletes.add(record);
    }

    if (creates.isEmpty() && updates.isEmpty() && deletes.isEmpty()) {
      return new FilterResult(Verdict.SUPPRESSED_EMPTY, null, pass.positions, pass.dropped);
    }

    LogReadResult filtered = pass.dropped == 0
        ? result
        : result.withTransactionData(tran.withRecords(creates, updates, deletes));
    return new FilterResult(Verdict.FORWARDED, filtered, pass.positions, pass.dropped);
  }

  private interface OperationVeto<T extends RecordEntry> {
    boolean drop(String destination, T record);
  }

  /**
   * Returns the records to keep, or null if one of them is a loop marker for the peer.
   */
  private <T extends ColumnRecordEntry> @Nullable List<T> filterColumnRecords(
      List<T> records,
      FilterPass pass,
      OperationVeto<T> veto
  ) {
    List<T> kept = new ArrayList<>(records.size());
    for (T record : records) {
      if (InternalTables.isInternal(record.table())) {
        // The loop marker is internal, but must be inspected before it's dropped.
        if (loopDetector.isEcho(record)) {
          return null;
        }
        pass.dropped++;
        continue;
      }
      if (!pass.keepTable(record) || veto.drop(destination, record)) {
        pass.dropped++;
        continue;
      }
      kept.add(record);
    }
    return kept;
  }

  /**
   * State of filtering one transaction.
   */
  private final class FilterPass {
    private final LogPosition commitPosition;
    private TablePositions positions;
    private int dropped;

    FilterPass(LogPosition commitPosition, TablePositions positions) {
      this.commitPosition = commitPosition;
      this.positions = positions;
    }

    /**
     * Applies the table filter and the table's position.
     * Removes the table's position once the table has caught up.
     */
    boolean keepTable(RecordEntry record) {
      String table = record.table();
      if (!tableFilter.includes(table)) {
        return false;
      }

      LogPosition seen = positions.get(table);
      if (seen != null) {
        if (!commitPosition.isAfter(seen)) {
          // peer has already seen this transaction for this table
          return false;
        }
        positions = positions.without(table);
      }
      return true;
    }
  }
}
