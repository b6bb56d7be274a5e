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

package com.logstreamer.util.config;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Static access to the config proxy factory used for all "logstreamer." properties.
 */
public class ConfigHelper {
  private static final KafkaConfigProxyFactory factory =
      new KafkaConfigProxyFactory("logstreamer");

  private ConfigHelper() {
    throw new AssertionError("not instantiable");
  }

  public static ConfigDef define(Class<?> configClass) {
    return factory.define(configClass);
  }

  /**
   * Parses and logs the given properties.
   *
   * @throws ConfigException if a required property is missing or a value is invalid.
   */
  public static <T> T parse(Class<T> configClass, Map<String, String> props) {
    return factory.newProxy(configClass, props, true);
  }

  public static <T> String keyName(Class<T> configClass, Consumer<T> methodInvoker) {
    return factory.keyName(configClass, methodInvoker);
  }

  public interface SimpleValidator<T> {
    void validate(T value) throws Exception;
  }

  /**
   * Adapts a validator that signals failure by throwing any exception.
   *
   * @param description shown in the generated documentation, for example "table=commitId,..."
   */
  @SuppressWarnings("unchecked")
  public static <T> ConfigDef.Validator validate(SimpleValidator<T> validator, String description) {
    return new ConfigDef.Validator() {
      @Override
      public String toString() {
        return description;
      }

      @Override
      public void ensureValid(String name, Object value) {
        try {
          validator.validate((T) value);
        } catch (Exception e) {
          throw new ConfigException(name, value, e.getMessage());
        }
      }
    };
  }

  public static ConfigDef.Validator nonBlank() {
    return validate((String value) -> {
      if (value == null || value.trim().isEmpty()) {
        throw new IllegalArgumentException("Value must not be blank.");
      }
    }, "non-blank string");
  }
}
