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

package com.logstreamer.filter;

import com.logstreamer.log.CreateRecordEntry;
import com.logstreamer.log.DeleteRecordEntry;
import com.logstreamer.log.UpdateRecordEntry;

/**
 * Allows every operation.
 * <p>
 * Internal LogStreamer tables are removed by the reader itself,
 * so this filter does not need to handle them.
 */
public class AllPassOperationFilter implements OperationFilter {

  @Override
  public boolean filterCreate(String destination, CreateRecordEntry record) {
    return false;
  }

  @Override
  public boolean filterUpdate(String destination, UpdateRecordEntry record) {
    return false;
  }

  @Override
  public boolean filterDelete(String destination, DeleteRecordEntry record) {
    return false;
  }
}
