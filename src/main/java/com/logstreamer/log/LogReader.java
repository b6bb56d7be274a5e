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

package com.logstreamer.log;

import org.jspecify.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sequential reader of committed transactions.
 * <p>
 * A reader has a single cursor, and at most one read may be in flight at a time.
 */
public interface LogReader extends Closeable {

  /**
   * Returns the next committed transaction after the reader's current position,
   * blocking until one is available.
   * <p>
   * Implementations must register with the token so a cancellation
   * unblocks a read that is waiting for new transactions.
   *
   * @return the next transaction, or null if the log is exhausted
   * or the token was cancelled.
   * @throws IOException if the log could not be read.
   * @throws InterruptedException if the calling thread was interrupted while waiting.
   */
  @Nullable
  LogReadResult read(CancellationToken cancellationToken) throws IOException, InterruptedException;
}
