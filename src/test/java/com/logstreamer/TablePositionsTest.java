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
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.emptyMap;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TablePositionsTest {
  private static final PeerIdentity PEER = new PeerIdentity("peer-b", "guid-b");

  @Test
  public void nullOrEmptyIsEmpty() {
    assertSame(TablePositions.EMPTY, TablePositions.normalize(null, PEER));
    assertSame(TablePositions.EMPTY, TablePositions.normalize(emptyMap(), PEER));
  }

  @Test
  public void prefixIsRemoved() {
    TablePositions positions = TablePositions.normalize(Map.of(
        "guid-b/Sales.Order", 5L,
        " Sales.Customer ", 7L,
        "guid-c/Hr.Employee", 9L
    ), PEER);

    assertEquals(LogPosition.ofCommitId(5), positions.get("Sales.Order"));
    assertEquals(LogPosition.ofCommitId(7), positions.get("Sales.Customer"));
    // another peer's prefix is part of the table name
    assertEquals(LogPosition.ofCommitId(9), positions.get("guid-c/Hr.Employee"));
    assertNull(positions.databasePosition());
  }

  @Test
  public void blankKeyIsDatabasePosition() {
    TablePositions positions = TablePositions.normalize(Map.of("  ", 10L, "A", 5L), PEER);
    assertEquals(LogPosition.ofCommitId(10), positions.databasePosition());
    assertEquals(LogPosition.ofCommitId(5), positions.minTablePosition());
  }

  @Test
  public void prefixWithoutTableIsIgnored() {
    TablePositions positions = TablePositions.normalize(Map.of("guid-b/", 10L, "guid-b/ ", 11L), PEER);
    assertSame(TablePositions.EMPTY, positions);
  }

  @Test
  public void nullEntriesAreIgnored() {
    Map<String, Long> raw = new HashMap<>();
    raw.put("A", null);
    raw.put(null, 3L);
    raw.put("B", 4L);
    assertEquals(Set.of("B"), TablePositions.normalize(raw, PEER).tables());
  }

  @Test
  public void lowestPositionWinsForSameTable() {
    TablePositions positions = TablePositions.normalize(Map.of("A", 7L, "guid-b/A", 5L, " A", 6L), PEER);
    assertEquals(1, positions.size());
    assertEquals(LogPosition.ofCommitId(5), positions.get("A"));

    // unsigned: -1 is the largest commit id
    positions = TablePositions.normalize(Map.of("B", -1L, "guid-b/B", 3L), PEER);
    assertEquals(LogPosition.ofCommitId(3), positions.get("B"));
  }

  @Test
  public void minTablePositionIgnoresDatabasePosition() {
    TablePositions positions = TablePositions.normalize(Map.of("", 1L, "A", 5L, "B", -1L), PEER);
    assertEquals(LogPosition.ofCommitId(5), positions.minTablePosition());
    assertNull(TablePositions.normalize(Map.of("", 1L), PEER).minTablePosition());
  }

  @Test
  public void without() {
    TablePositions positions = TablePositions.normalize(Map.of("A", 5L, "B", 7L), PEER);

    assertSame(positions, positions.without("C"));

    TablePositions smaller = positions.without("A");
    assertFalse(smaller.contains("A"));
    assertTrue(smaller.contains("B"));
    assertTrue(positions.contains("A"));

    assertSame(TablePositions.EMPTY, smaller.without("B"));
  }

  @Test
  public void tablesAreUnmodifiable() {
    TablePositions positions = TablePositions.normalize(Map.of("A", 5L), PEER);
    assertThrows(UnsupportedOperationException.class, () -> positions.tables().remove("A"));
  }
}
