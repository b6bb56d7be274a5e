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

import java.util.List;

/**
 * Updates some columns of an existing record.
 */
public final class UpdateRecordEntry extends ColumnRecordEntry {
  public UpdateRecordEntry(String table, long key, List<ColumnUpdate> columns) {
    super(table, key, columns);
  }

  @Override
  public String operation() {
    return "update";
  }
}
