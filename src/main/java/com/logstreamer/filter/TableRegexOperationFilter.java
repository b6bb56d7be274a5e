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
import com.logstreamer.log.RecordEntry;
import com.logstreamer.log.UpdateRecordEntry;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Drops operations on tables whose qualified name does not match
 * a regular expression. Creates, updates and deletes are treated alike.
 * <p>
 * Example config for sending only tables in the "Sales" namespace:
 * <pre>
 * logstreamer.operation.filter=com.logstreamer.filter.TableRegexOperationFilter
 * logstreamer.operation.filter.table.regex=Sales\..*
 * </pre>
 */
public class TableRegexOperationFilter implements OperationFilter {
  private static final Logger LOGGER = LoggerFactory.getLogger(TableRegexOperationFilter.class);

  static final String REGEX_CONFIG = "logstreamer.operation.filter.table.regex";
  static final String REGEX_CASE_INSENSITIVE_CONFIG = "logstreamer.operation.filter.table.regex.case.insensitive";

  private static final ConfigDef configDef = new ConfigDef()
      .define(REGEX_CONFIG,
          ConfigDef.Type.STRING,
          ConfigDef.Importance.HIGH,
          "Regular expression matched against the qualified table name. Operations on tables that don't match are not sent.")
      .define(REGEX_CASE_INSENSITIVE_CONFIG,
          ConfigDef.Type.BOOLEAN,
          false,
          ConfigDef.Importance.MEDIUM,
          "Whether the table name regex ignores case.");

  private volatile Pattern pattern;

  @Override
  public void init(Map<String, String> configProperties) {
    AbstractConfig config = new AbstractConfig(configDef, configProperties, false);
    String regex = config.getString(REGEX_CONFIG);
    boolean caseInsensitive = config.getBoolean(REGEX_CASE_INSENSITIVE_CONFIG);

    if (regex == null || regex.trim().isEmpty()) {
      throw new ConfigException(REGEX_CONFIG, regex, "TableRegexOperationFilter requires a non-empty regex");
    }

    try {
      this.pattern = Pattern.compile(regex, caseInsensitive ? Pattern.CASE_INSENSITIVE : 0);
    } catch (PatternSyntaxException e) {
      throw new ConfigException(REGEX_CONFIG, regex, "Invalid regex: " + e.getDescription());
    }

    LOGGER.info("Initialized TableRegexOperationFilter with pattern: {} (case insensitive: {})", regex, caseInsensitive);
  }

  @Override
  public boolean filterCreate(String destination, CreateRecordEntry record) {
    return rejects(record);
  }

  @Override
  public boolean filterUpdate(String destination, UpdateRecordEntry record) {
    return rejects(record);
  }

  @Override
  public boolean filterDelete(String destination, DeleteRecordEntry record) {
    return rejects(record);
  }

  private boolean rejects(RecordEntry record) {
    Pattern p = pattern;
    if (p == null) {
      throw new IllegalStateException("Filter was not initialized.");
    }
    boolean matches = p.matcher(record.table()).matches();
    LOGGER.debug("Table '{}' {} regex filter", record.table(), matches ? "passed" : "did not pass");
    return !matches;
  }
}
