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

package com.logstreamer.config;

import com.logstreamer.util.config.annotation.Default;

public interface LoggingConfig {
  /**
   * If true, transaction lifecycle milestones will be logged at INFO level
   * instead of DEBUG. Enabling this feature lets you watch transactions
   * flow through the reader, including the ones that are suppressed.
   * Disabled by default because it generates many log messages.
   */
  @Default("false")
  boolean logTransactionLifecycle();
}
