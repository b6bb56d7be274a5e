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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Cooperative cancellation signal shared between the thread pulling from
 * the log and whoever decides the pull should stop.
 * <p>
 * Cancelling is idempotent. Callbacks registered with {@link #register(Runnable)}
 * run once, on the cancelling thread; a callback registered after cancellation
 * runs immediately on the registering thread.
 */
public class CancellationToken {
  private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

  /**
   * A token that is never cancelled.
   */
  public static final CancellationToken NONE = new CancellationToken() {
    @Override
    public void cancel() {
      throw new UnsupportedOperationException("CancellationToken.NONE can't be cancelled.");
    }

    @Override
    public Registration register(Runnable callback) {
      return () -> {
      };
    }
  };

  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
  private volatile boolean cancelled;

  /**
   * Handle for removing a callback that is no longer needed.
   */
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  public boolean isCancellationRequested() {
    return cancelled;
  }

  public void cancel() {
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
    }
    for (Runnable callback : callbacks) {
      runCallback(callback);
    }
    callbacks.clear();
  }

  public Registration register(Runnable callback) {
    requireNonNull(callback);
    synchronized (this) {
      if (!cancelled) {
        callbacks.add(callback);
        return () -> callbacks.remove(callback);
      }
    }
    runCallback(callback);
    return () -> {
    };
  }

  private static void runCallback(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      log.warn("Cancellation callback failed", e);
    }
  }

  @Override
  public String toString() {
    return "CancellationToken{cancelled=" + cancelled + '}';
  }
}
