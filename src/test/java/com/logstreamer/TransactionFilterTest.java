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

import com.logstreamer.TransactionFilter.FilterResult;
import com.logstreamer.TransactionFilter.Verdict;
import com.logstreamer.filter.AllPassOperationFilter;
import com.logstreamer.filter.OperationFilter;
import com.logstreamer.log.CreateRecordEntry;
import com.logstreamer.log.DeleteRecordEntry;
import com.logstreamer.log.LogReadResult;
import com.logstreamer.log.TransactionData;
import com.logstreamer.log.UpdateRecordEntry;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static com.logstreamer.Transactions.column;
import static com.logstreamer.Transactions.create;
import static com.logstreamer.Transactions.delete;
import static com.logstreamer.Transactions.lastPositionMarker;
import static com.logstreamer.Transactions.transaction;
import static com.logstreamer.Transactions.update;
import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TransactionFilterTest {
  private static final PeerIdentity PEER = new PeerIdentity("peer-b", "guid-b");

  private static TransactionFilter filter(TableFilter tableFilter) {
    return new TransactionFilter(PEER, tableFilter, new AllPassOperationFilter());
  }

  private static TransactionFilter allTables() {
    return filter(TableFilter.ALL);
  }

  private static TablePositions positions(Map<String, Long> raw) {
    return TablePositions.normalize(raw, PEER);
  }

  private static TransactionData forwardedData(FilterResult result) {
    assertEquals(Verdict.FORWARDED, result.verdict());
    LogReadResult forwarded = result.forwarded();
    assertNotNull(forwarded);
    return forwarded.transactionData();
  }

  @Test
  public void transactionWithNothingToFilterIsForwardedAsIs() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1, column("Total", 5)),
        update("Sales.Customer", 2, column("Name", "Ann")),
        delete("Sales.Invoice", 3));

    FilterResult result = allTables().filter(tran, TablePositions.EMPTY);

    assertEquals(Verdict.FORWARDED, result.verdict());
    assertSame(tran, result.forwarded());
    assertEquals(0, result.droppedRecords());
    assertSame(TablePositions.EMPTY, result.positions());
  }

  @Test
  public void internalTablesAreDropped() {
    LogReadResult tran = transaction(10,
        create("LogStreamer.Settings", 1, column("Value", "x")),
        create("Sales.Order", 2),
        update("LogStreamer.Peers", 3),
        delete("LogStreamer.Peers", 4));

    FilterResult result = allTables().filter(tran, TablePositions.EMPTY);

    TransactionData data = forwardedData(result);
    assertEquals(singletonList(create("Sales.Order", 2)), data.creates());
    assertEquals(emptyList(), data.updates());
    assertEquals(emptyList(), data.deletes());
    assertEquals(3, result.droppedRecords());
    assertEquals(tran.continuationPosition(), result.forwarded().continuationPosition());
  }

  @Test
  public void onlyInternalRecordsIsSuppressedAsEmpty() {
    LogReadResult tran = transaction(10,
        create("LogStreamer.Settings", 1),
        lastPositionMarker("guid-c/Sales.Order"));

    FilterResult result = allTables().filter(tran, TablePositions.EMPTY);

    assertEquals(Verdict.SUPPRESSED_EMPTY, result.verdict());
    assertTrue(result.isSuppressed());
    assertNull(result.forwarded());
    assertEquals(2, result.droppedRecords());
  }

  @Test
  public void markerForAnotherPeerIsDroppedNotSuppressed() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        lastPositionMarker("guid-c/Sales.Order"));

    FilterResult result = allTables().filter(tran, TablePositions.EMPTY);

    TransactionData data = forwardedData(result);
    assertEquals(singletonList(create("Sales.Order", 1)), data.creates());
    assertEquals(emptyList(), data.updates());
  }

  @Test
  public void markerForPeerSuppressesWholeTransaction() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        lastPositionMarker("guid-b/Sales.Order"),
        delete("Sales.Invoice", 2));
    TablePositions positions = positions(Map.of("Sales.Order", 5L));

    FilterResult result = allTables().filter(tran, positions);

    assertEquals(Verdict.SUPPRESSED_LOOP, result.verdict());
    assertNull(result.forwarded());
    // the create caught up Sales.Order, but a suppressed loop doesn't count
    assertSame(positions, result.positions());
    assertEquals(0, result.droppedRecords());
  }

  @Test
  public void markerInCreatesSuppressesWholeTransaction() {
    LogReadResult tran = transaction(10,
        create(InternalTables.LAST_POSITION, 1, column(InternalTables.TABLE_ID_COLUMN, "guid-b/12")),
        update("Sales.Order", 2));

    assertEquals(Verdict.SUPPRESSED_LOOP, allTables().filter(tran, TablePositions.EMPTY).verdict());
  }

  @Test
  public void markerIsDetectedEvenWhenTableFilterExcludesEverything() {
    LogReadResult tran = transaction(10, lastPositionMarker("guid-b/Sales.Order"));

    FilterResult result = filter(TableFilter.of(Set.of(), PEER)).filter(tran, TablePositions.EMPTY);

    assertEquals(Verdict.SUPPRESSED_LOOP, result.verdict());
  }

  @Test
  public void deletesAreNotCheckedForMarkers() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        delete(InternalTables.LAST_POSITION, 7));

    FilterResult result = allTables().filter(tran, TablePositions.EMPTY);

    TransactionData data = forwardedData(result);
    assertEquals(emptyList(), data.deletes());
    assertEquals(1, result.droppedRecords());
  }

  @Test
  public void nonStringTableIdIsNotAMarker() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        update(InternalTables.LAST_POSITION, 1, column(InternalTables.TABLE_ID_COLUMN, 42L)));

    assertEquals(Verdict.FORWARDED, allTables().filter(tran, TablePositions.EMPTY).verdict());
  }

  @Test
  public void tableIdInOtherColumnIsNotAMarker() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        update(InternalTables.LAST_POSITION, 1, column("Comment", "guid-b/Sales.Order")));

    assertEquals(Verdict.FORWARDED, allTables().filter(tran, TablePositions.EMPTY).verdict());
  }

  @Test
  public void tableFilterDropsOtherTables() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        create("Hr.Employee", 2),
        update("Hr.Employee", 2),
        delete("Sales.Order", 3));

    FilterResult result = filter(TableFilter.of(Set.of("guid-b/Sales.Order"), PEER))
        .filter(tran, TablePositions.EMPTY);

    TransactionData data = forwardedData(result);
    assertEquals(singletonList(create("Sales.Order", 1)), data.creates());
    assertEquals(emptyList(), data.updates());
    assertEquals(singletonList(delete("Sales.Order", 3)), data.deletes());
    assertEquals(2, result.droppedRecords());
  }

  @Test
  public void emptyTableFilterSuppressesEverything() {
    LogReadResult tran = transaction(10, create("Sales.Order", 1));

    FilterResult result = filter(TableFilter.of(Set.of(" ", "guid-b/"), PEER)).filter(tran, TablePositions.EMPTY);

    assertEquals(Verdict.SUPPRESSED_EMPTY, result.verdict());
  }

  @Test
  public void tableAlreadySeenIsDropped() {
    TablePositions positions = positions(Map.of("Sales.Order", 10L));

    FilterResult result = allTables().filter(transaction(10, create("Sales.Order", 1)), positions);
    assertEquals(Verdict.SUPPRESSED_EMPTY, result.verdict());
    assertSame(positions, result.positions());

    result = allTables().filter(transaction(9, create("Sales.Order", 1)), positions);
    assertEquals(Verdict.SUPPRESSED_EMPTY, result.verdict());
    assertSame(positions, result.positions());
  }

  @Test
  public void tableCatchesUpOnFirstNewerTransaction() {
    TablePositions positions = positions(Map.of("Sales.Order", 10L, "Sales.Customer", 20L));

    FilterResult result = allTables().filter(transaction(11,
        create("Sales.Order", 1),
        create("Sales.Customer", 2),
        update("Sales.Order", 1)), positions);

    TransactionData data = forwardedData(result);
    assertEquals(singletonList(create("Sales.Order", 1)), data.creates());
    assertEquals(singletonList(update("Sales.Order", 1)), data.updates());
    assertEquals(1, result.droppedRecords());
    assertEquals(positions(Map.of("Sales.Customer", 20L)), result.positions());

    // original positions are untouched
    assertEquals(2, positions.size());
  }

  @Test
  public void caughtUpTablesAreNotCheckedAgain() {
    TablePositions positions = positions(Map.of("Sales.Order", 10L));

    FilterResult first = allTables().filter(transaction(11, create("Sales.Order", 1)), positions);
    assertSame(TablePositions.EMPTY, first.positions());

    // positions are not consulted for tables that caught up
    FilterResult second = allTables().filter(transaction(5, create("Sales.Order", 2)), first.positions());
    assertEquals(Verdict.FORWARDED, second.verdict());
  }

  @Test
  public void positionsCompareUnsigned() {
    FilterResult result = allTables().filter(
        transaction(5, create("Sales.Order", 1)),
        positions(Map.of("Sales.Order", -1L)));
    assertEquals(Verdict.SUPPRESSED_EMPTY, result.verdict());

    result = allTables().filter(
        transaction(-1L, create("Sales.Order", 1)),
        positions(Map.of("Sales.Order", 5L)));
    assertEquals(Verdict.FORWARDED, result.verdict());
    assertTrue(result.positions().isEmpty());
  }

  @Test
  public void operationFilterCanVetoRecords() {
    OperationFilter operationFilter = mock(OperationFilter.class);
    when(operationFilter.filterUpdate(eq("peer-b"), any(UpdateRecordEntry.class))).thenReturn(true);

    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        update("Sales.Order", 1),
        delete("Sales.Order", 2));

    FilterResult result = new TransactionFilter(PEER, TableFilter.ALL, operationFilter)
        .filter(tran, TablePositions.EMPTY);

    TransactionData data = forwardedData(result);
    assertEquals(1, data.creates().size());
    assertEquals(emptyList(), data.updates());
    assertEquals(1, data.deletes().size());
    assertEquals(1, result.droppedRecords());

    verify(operationFilter).filterCreate("peer-b", create("Sales.Order", 1));
    verify(operationFilter).filterDelete("peer-b", delete("Sales.Order", 2));
  }

  @Test
  public void operationFilterOnlySeesSurvivors() {
    OperationFilter operationFilter = mock(OperationFilter.class);

    LogReadResult tran = transaction(10,
        create("LogStreamer.Settings", 1),
        create("Hr.Employee", 2),
        delete("Sales.Order", 3));

    new TransactionFilter(PEER, TableFilter.of(Set.of("Hr.Employee"), PEER), operationFilter)
        .filter(tran, TablePositions.EMPTY);

    verify(operationFilter).filterCreate("peer-b", create("Hr.Employee", 2));
    verify(operationFilter, never()).filterCreate(any(), eq(create("LogStreamer.Settings", 1)));
    verify(operationFilter, never()).filterDelete(any(), any(DeleteRecordEntry.class));
  }

  @Test
  public void vetoingEverythingSuppressesTransaction() {
    OperationFilter operationFilter = mock(OperationFilter.class);
    when(operationFilter.filterCreate(any(), any(CreateRecordEntry.class))).thenReturn(true);

    FilterResult result = new TransactionFilter(PEER, TableFilter.ALL, operationFilter)
        .filter(transaction(10, create("Sales.Order", 1)), TablePositions.EMPTY);

    assertEquals(Verdict.SUPPRESSED_EMPTY, result.verdict());
    assertEquals(1, result.droppedRecords());
  }

  @Test
  public void orderIsPreserved() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        create("Hr.Employee", 2),
        create("Sales.Order", 3),
        create("Sales.Order", 4),
        delete("Sales.Order", 9),
        delete("Hr.Employee", 8),
        delete("Sales.Order", 7));

    TransactionData data = forwardedData(
        filter(TableFilter.of(Set.of("Sales.Order"), PEER)).filter(tran, TablePositions.EMPTY));

    assertEquals(asList(create("Sales.Order", 1), create("Sales.Order", 3), create("Sales.Order", 4)), data.creates());
    assertEquals(asList(delete("Sales.Order", 9), delete("Sales.Order", 7)), data.deletes());
  }

  @Test
  public void filteringDoesNotModifyInput() {
    LogReadResult tran = transaction(10,
        create("Sales.Order", 1),
        create("LogStreamer.Settings", 2),
        delete("Hr.Employee", 3));
    TransactionData before = new TransactionData(
        tran.transactionData().creates(),
        tran.transactionData().updates(),
        tran.transactionData().deletes());

    filter(TableFilter.of(Set.of("Sales.Order"), PEER)).filter(tran, TablePositions.EMPTY);

    assertEquals(before, tran.transactionData());
    assertEquals(2, tran.transactionData().creates().size());
  }

  @Test
  public void filteringForwardedResultAgainIsNoOp() {
    TransactionFilter filter = filter(TableFilter.of(Set.of("Sales.Order", "Sales.Customer"), PEER));
    LogReadResult tran = transaction(11,
        create("Sales.Order", 1),
        create("Hr.Employee", 2),
        update("Sales.Customer", 3),
        update("LogStreamer.Settings", 4),
        delete("Sales.Order", 5));

    FilterResult first = filter.filter(tran, positions(Map.of("Sales.Order", 10L, "Sales.Customer", 11L)));
    LogReadResult forwarded = first.forwarded();
    assertNotNull(forwarded);

    FilterResult second = filter.filter(forwarded, first.positions());
    assertEquals(Verdict.FORWARDED, second.verdict());
    assertEquals(forwarded, second.forwarded());
    assertEquals(0, second.droppedRecords());
    assertEquals(first.positions(), second.positions());
  }
}
