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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logstreamer.config.LoggingConfig;
import com.logstreamer.log.LogPosition;
import com.logstreamer.log.LogReadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Logs transaction lifecycle events.
 */
public class TransactionLifecycle {

  public enum Milestone {
    STARTED_AT_POSITION,
    RECEIVED_FROM_LOG,
    SUPPRESSED_EMPTY,
    SUPPRESSED_LOOP,
    FORWARDED,
    CANCELLED,
    END_OF_LOG,
    ;
  }

  private static final Logger log = LoggerFactory.getLogger(TransactionLifecycle.class);
  private static final ObjectMapper mapper = new ObjectMapper();

  private final String destination;
  private final boolean infoLevel;

  public static TransactionLifecycle create(LoggingConfig config, PeerIdentity peer) {
    return new TransactionLifecycle(config.logTransactionLifecycle(), peer);
  }

  TransactionLifecycle(boolean infoLevel, PeerIdentity peer) {
    this.infoLevel = infoLevel;
    this.destination = requireNonNull(peer).destination();
    log.info("Logging transaction lifecycle milestones to this category at {} level", infoLevel ? "INFO" : "DEBUG");
  }

  public boolean enabled() {
    return infoLevel ? log.isInfoEnabled() : log.isDebugEnabled();
  }

  public void logStartedAtPosition(StartPositionResolver.Resolution resolution) {
    if (enabled()) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("position", resolution.startPosition().toString());
      details.put("reason", resolution.reason());
      details.put("pendingTablePositions", resolution.remaining().size());
      logMilestone(Milestone.STARTED_AT_POSITION, details);
    }
  }

  public void logReceivedFromLog(LogReadResult result) {
    if (enabled()) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("position", result.continuationPosition().toString());
      details.put("creates", result.transactionData().creates().size());
      details.put("updates", result.transactionData().updates().size());
      details.put("deletes", result.transactionData().deletes().size());
      logMilestone(Milestone.RECEIVED_FROM_LOG, details);
    }
  }

  public void logFiltered(LogReadResult received, TransactionFilter.FilterResult result) {
    if (!enabled()) {
      return;
    }
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("position", received.continuationPosition().toString());
    details.put("droppedOperations", result.droppedRecords());
    switch (result.verdict()) {
      case FORWARDED:
        details.put("operations", requireNonNull(result.forwarded()).transactionData().size());
        logMilestone(Milestone.FORWARDED, details);
        break;
      case SUPPRESSED_EMPTY:
        logMilestone(Milestone.SUPPRESSED_EMPTY, details);
        break;
      case SUPPRESSED_LOOP:
        logMilestone(Milestone.SUPPRESSED_LOOP, details);
        break;
      default:
        throw new AssertionError("unexpected verdict: " + result.verdict());
    }
  }

  public void logCancelled(LogPosition lastPosition) {
    logMilestone(Milestone.CANCELLED, mapOfPosition(lastPosition));
  }

  public void logEndOfLog(LogPosition lastPosition) {
    logMilestone(Milestone.END_OF_LOG, mapOfPosition(lastPosition));
  }

  private static Map<String, Object> mapOfPosition(LogPosition position) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("lastPosition", position.toString());
    return details;
  }

  private void logMilestone(Milestone milestone, Map<String, Object> milestoneDetails) {
    if (enabled()) {
      LinkedHashMap<String, Object> message = new LinkedHashMap<>();
      message.put("milestone", milestone);
      message.put("destination", destination);
      message.putAll(milestoneDetails);
      doLog(message);
    }
  }

  private void doLog(Object message) {
    String encoded;
    try {
      encoded = mapper.writeValueAsString(message);
    } catch (Exception e) {
      encoded = message.toString();
    }
    if (infoLevel) {
      log.info(encoded);
    } else {
      log.debug(encoded);
    }
  }
}
