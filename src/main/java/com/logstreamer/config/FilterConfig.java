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

import com.logstreamer.filter.OperationFilter;
import com.logstreamer.util.config.annotation.Default;
import org.apache.kafka.common.config.ConfigDef;

import static com.logstreamer.util.config.ConfigHelper.validate;

public interface FilterConfig {
  /**
   * The class name of the operation filter to use.
   * The operation filter can veto individual creates, updates and deletes
   * before a transaction is sent to the peer.
   * <p>
   * Operations on internal LogStreamer tables, tables outside the table filter
   * negotiated with the peer, and tables the peer has already seen are removed
   * before the operation filter is consulted.
   * <p>
   * To send only tables whose names match a regular expression, use
   * `com.logstreamer.filter.TableRegexOperationFilter`.
   */
  @Default("com.logstreamer.filter.AllPassOperationFilter")
  Class<? extends OperationFilter> operationFilter();

  @SuppressWarnings("unused")
  static ConfigDef.Validator operationFilterValidator() {
    return validate((Class<?> value) -> {
      if (!OperationFilter.class.isAssignableFrom(value)) {
        throw new IllegalArgumentException("Class " + value.getName() + " does not implement " + OperationFilter.class.getName());
      }
    }, "class implementing " + OperationFilter.class.getName());
  }
}
