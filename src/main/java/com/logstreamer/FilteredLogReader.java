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

import com.logstreamer.config.FilterConfig;
import com.logstreamer.config.FilteredReaderConfig;
import com.logstreamer.filter.OperationFilter;
import com.logstreamer.log.CancellationToken;
import com.logstreamer.log.LogManager;
import com.logstreamer.log.LogPosition;
import com.logstreamer.log.LogReadResult;
import com.logstreamer.log.LogReader;
import com.logstreamer.util.config.ConfigHelper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Reads the transaction log for one peer, returning only what the peer
 * should receive.
 * <p>
 * On construction, the reader works out where the peer left off
 * (see {@link StartPositionResolver}) and opens the log there.
 * Each call to {@link #pullNext(CancellationToken)} then reads transactions
 * until one survives the {@link TransactionFilter}, and returns it with the
 * filtered operations removed. Transactions are returned in log order;
 * suppressed ones are skipped.
 * <p>
 * A reader serves a single session and is not thread-safe. Only the
 * cancellation token may be used from another thread.
 */
public class FilteredLogReader implements Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(FilteredLogReader.class);

  private final PeerIdentity peer;
  private final LogReader reader;
  private final TransactionFilter transactionFilter;
  private final TransactionLifecycle lifecycle;
  private final LogPosition startPosition;
  private final AtomicBoolean pulling = new AtomicBoolean();

  private TablePositions tablePositions;
  private LogPosition lastReadPosition;
  private volatile ReaderState state = ReaderState.CONSTRUCTING;

  private final Counter readCounter;
  private final Counter forwardedCounter;
  private final Counter suppressedEmptyCounter;
  private final Counter suppressedLoopCounter;
  private final Counter droppedCounter;
  private final Timer filterTimer;

  /**
   * Creates a reader from config properties, instantiating the configured
   * operation filter.
   *
   * @throws ConfigException if the properties are invalid.
   * @throws IOException if the log could not be opened.
   */
  public static FilteredLogReader create(
      Map<String, String> properties,
      LogManager logManager,
      PeerSession session,
      MeterRegistry meterRegistry
  ) throws IOException {
    FilteredReaderConfig config = ConfigHelper.parse(FilteredReaderConfig.class, properties);

    OperationFilter operationFilter;
    try {
      operationFilter = Utils.newInstance(config.operationFilter());
    } catch (KafkaException e) {
      String key = ConfigHelper.keyName(FilterConfig.class, FilterConfig::operationFilter);
      throw new ConfigException(key, config.operationFilter().getName(), "Could not instantiate operation filter: " + e.getMessage());
    }
    operationFilter.init(unmodifiableMap(properties));

    return new FilteredLogReader(config, logManager, session, operationFilter, meterRegistry);
  }

  /**
   * @throws IOException if the log could not be opened.
   */
  public FilteredLogReader(
      FilteredReaderConfig config,
      LogManager logManager,
      PeerSession session,
      OperationFilter operationFilter,
      MeterRegistry meterRegistry
  ) throws IOException {
    this(config, logManager, session, operationFilter, meterRegistry,
        TransactionLifecycle.create(config, session.peer()));
  }

  FilteredLogReader(
      FilteredReaderConfig config,
      LogManager logManager,
      PeerSession session,
      OperationFilter operationFilter,
      MeterRegistry meterRegistry,
      TransactionLifecycle lifecycle
  ) throws IOException {
    requireNonNull(logManager);
    this.peer = session.peer();
    this.lifecycle = requireNonNull(lifecycle);

    TableFilter tableFilter = TableFilter.of(session.tableFilter(), peer);
    TablePositions positions = TablePositions.normalize(session.tablePositions(), peer);

    StartPositionResolver.Resolution resolution = new StartPositionResolver().resolve(positions, tableFilter);
    this.startPosition = resolution.startPosition();
    this.tablePositions = resolution.remaining();
    this.lastReadPosition = startPosition;
    this.transactionFilter = new TransactionFilter(peer, tableFilter, operationFilter);

    this.readCounter = meterRegistry.counter("transactions.read");
    this.forwardedCounter = meterRegistry.counter("transactions.forwarded");
    this.suppressedEmptyCounter = meterRegistry.counter("transactions.suppressed", "reason", "empty");
    this.suppressedLoopCounter = meterRegistry.counter("transactions.suppressed", "reason", "loop");
    this.droppedCounter = meterRegistry.counter("records.dropped");
    this.filterTimer = meterRegistry.timer("filter");

    lifecycle.logStartedAtPosition(resolution);

    // keep last; nothing closes the reader if the constructor fails after opening it
    LOGGER.info("Opening log of database '{}' in '{}' at position {} for peer {}",
        config.databaseName(), config.logDirectory(), startPosition, peer);
    this.reader = logManager.openLog(config.databaseName(), config.logDirectory(), startPosition);
    this.state = ReaderState.STREAMING;
  }

  /**
   * Returns the next transaction the peer should receive, blocking until
   * one is available.
   * <p>
   * Cancellation is checked before each read and passed to the log reader,
   * so a read waiting for new transactions returns promptly. A transaction
   * read after cancellation is never returned.
   *
   * @return the filtered transaction, or null if the log is exhausted or the
   * token was cancelled. Use {@link #state()} to tell which.
   * @throws IOException if the log could not be read. The reader is then unusable;
   * create a new one to resume.
   * @throws InterruptedException if the calling thread was interrupted while waiting.
   * @throws IllegalStateException if the reader previously failed, or another pull is in progress.
   */
  public @Nullable LogReadResult pullNext(CancellationToken cancellationToken) throws IOException, InterruptedException {
    requireNonNull(cancellationToken);

    if (!pulling.compareAndSet(false, true)) {
      throw new IllegalStateException("Another pull is already in progress; a reader supports only one pull at a time.");
    }
    try {
      if (state == ReaderState.FAILED) {
        throw new IllegalStateException("Reader for peer " + peer + " failed earlier; create a new reader to resume.");
      }
      if (state.isTerminal()) {
        return null;
      }

      try {
        return readUntilForwarded(cancellationToken);
      } catch (IOException | RuntimeException e) {
        state = ReaderState.FAILED;
        LOGGER.error("Reading the log for peer {} failed after position {}", peer, lastReadPosition, e);
        throw e;
      }

    } finally {
      pulling.set(false);
    }
  }

  private @Nullable LogReadResult readUntilForwarded(CancellationToken cancellationToken) throws IOException, InterruptedException {
    while (true) {
      if (cancellationToken.isCancellationRequested()) {
        return stop(ReaderState.CANCELLED);
      }

      LogReadResult received = reader.read(cancellationToken);

      if (cancellationToken.isCancellationRequested()) {
        return stop(ReaderState.CANCELLED);
      }
      if (received == null) {
        return stop(ReaderState.EXHAUSTED);
      }

      readCounter.increment();
      lastReadPosition = received.continuationPosition();
      lifecycle.logReceivedFromLog(received);

      TransactionFilter.FilterResult result = filterTimer.record(() -> transactionFilter.filter(received, tablePositions));
      tablePositions = result.positions();
      droppedCounter.increment(result.droppedRecords());
      lifecycle.logFiltered(received, result);

      switch (result.verdict()) {
        case FORWARDED:
          forwardedCounter.increment();
          return result.forwarded();
        case SUPPRESSED_EMPTY:
          suppressedEmptyCounter.increment();
          break;
        case SUPPRESSED_LOOP:
          suppressedLoopCounter.increment();
          break;
        default:
          throw new AssertionError("unexpected verdict: " + result.verdict());
      }
    }
  }

  private @Nullable LogReadResult stop(ReaderState terminalState) {
    state = terminalState;
    if (terminalState == ReaderState.CANCELLED) {
      LOGGER.info("Stopped reading for peer {} at position {}; cancelled", peer, lastReadPosition);
      lifecycle.logCancelled(lastReadPosition);
    } else {
      LOGGER.info("Stopped reading for peer {} at position {}; end of log", peer, lastReadPosition);
      lifecycle.logEndOfLog(lastReadPosition);
    }
    return null;
  }

  public ReaderState state() {
    return state;
  }

  /**
   * The position the log was opened at.
   */
  public LogPosition startPosition() {
    return startPosition;
  }

  /**
   * Position of the last transaction read from the log, whether or not it was
   * returned. Before the first read, this is the start position.
   */
  public LogPosition lastReadPosition() {
    return lastReadPosition;
  }

  /**
   * Table positions of tables that have not yet caught up.
   */
  public TablePositions remainingTablePositions() {
    return tablePositions;
  }

  public PeerIdentity peer() {
    return peer;
  }

  @Override
  public void close() throws IOException {
    if (!state.isTerminal()) {
      state = ReaderState.CANCELLED;
    }
    reader.close();
  }
}
