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

import java.util.Map;

/**
 * Vetoes individual operations of a transaction before it is sent to a peer.
 * <p>
 * Each method returns true to filter out the operation, or false to allow
 * sending it. The filter must not modify the record entry.
 * <p>
 * A single instance sees every record of the session, so implementations
 * must be stateless or internally synchronized.
 */
public interface OperationFilter {

  /**
   * Called one time when the filter is instantiated.
   *
   * @param configProperties the reader configuration properties.
   */
  default void init(Map<String, String> configProperties) {
  }

  /**
   * @param destination name of the peer the transaction is being sent to.
   * @param record the create operation being considered.
   * @return true if the operation should be dropped.
   */
  boolean filterCreate(String destination, CreateRecordEntry record);

  /**
   * @param destination name of the peer the transaction is being sent to.
   * @param record the update operation being considered.
   * @return true if the operation should be dropped.
   */
  boolean filterUpdate(String destination, UpdateRecordEntry record);

  /**
   * @param destination name of the peer the transaction is being sent to.
   * @param record the delete operation being considered.
   * @return true if the operation should be dropped.
   */
  boolean filterDelete(String destination, DeleteRecordEntry record);
}
