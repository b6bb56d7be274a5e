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

import com.logstreamer.util.config.annotation.EnvironmentVariable;
import com.logstreamer.util.config.annotation.Importance;
import org.apache.kafka.common.config.ConfigDef;

import static com.logstreamer.util.config.ConfigHelper.nonBlank;

public interface LogSourceConfig {
  /**
   * Name of the database whose transaction log is read.
   */
  @Importance(ConfigDef.Importance.HIGH)
  String databaseName();

  @SuppressWarnings("unused")
  static ConfigDef.Validator databaseNameValidator() {
    return nonBlank();
  }

  /**
   * Directory containing the transaction log files.
   */
  @Importance(ConfigDef.Importance.HIGH)
  @EnvironmentVariable("LOGSTREAMER_LOG_DIRECTORY")
  String logDirectory();

  @SuppressWarnings("unused")
  static ConfigDef.Validator logDirectoryValidator() {
    return nonBlank();
  }
}
