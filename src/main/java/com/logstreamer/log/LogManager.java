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

import java.io.IOException;

/**
 * Opens readers over the transaction log of a database.
 */
public interface LogManager {

  /**
   * Opens the log of the named database, positioned so the first
   * transaction returned is the one committed after {@code position}.
   *
   * @param databaseName name of the database whose log should be read.
   * @param logDirectory directory holding the log files.
   * @param position where to start reading.
   * @throws IOException if the log could not be opened.
   */
  LogReader openLog(String databaseName, String logDirectory, LogPosition position) throws IOException;
}
