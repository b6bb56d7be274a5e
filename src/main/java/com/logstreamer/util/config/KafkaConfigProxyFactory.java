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

import com.github.therapi.runtimejavadoc.ClassJavadoc;
import com.github.therapi.runtimejavadoc.MethodJavadoc;
import com.github.therapi.runtimejavadoc.OtherJavadoc;
import com.github.therapi.runtimejavadoc.RuntimeJavadoc;
import com.logstreamer.util.config.annotation.Default;
import com.logstreamer.util.config.annotation.EnvironmentVariable;
import com.logstreamer.util.config.annotation.Importance;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import static java.util.Collections.emptyList;
import static java.util.Objects.requireNonNull;

/**
 * Given a config interface, generates a matching Kafka ConfigDef.
 * <p>
 * Given a config interface and a set of config properties, returns an
 * implementation of the interface that can be used to access the
 * config properties in a type-safe way.
 * <p>
 * A "config interface" is any interface containing only zero-arg methods
 * whose return type is one of:
 * <ul>
 *   <li>String
 *   <li>boolean
 *   <li>int
 *   <li>long
 *   <li>Class
 *   <li>List&lt;String&gt;
 * </ul>
 * Each interface method corresponds to a Kafka config key. The name of the key
 * is the method name converted from lowerCamelCase to dotted.lower.case, with the
 * factory prefix in front. Other config key attributes are inferred from the method,
 * or can be made explicit by annotating the method with one of the annotations in
 * {@link com.logstreamer.util.config.annotation}.
 * <p>
 * A static zero-arg method named like the config method plus "Validator"
 * (for example {@code databaseNameValidator()}) supplies a validator for the key.
 */
public class KafkaConfigProxyFactory {
  private static final Logger log = LoggerFactory.getLogger(KafkaConfigProxyFactory.class);

  private static final Map<Class<?>, ConfigDef.Type> javaClassToKafkaType = new HashMap<>();

  static {
    javaClassToKafkaType.put(Boolean.class, ConfigDef.Type.BOOLEAN);
    javaClassToKafkaType.put(Boolean.TYPE, ConfigDef.Type.BOOLEAN);
    javaClassToKafkaType.put(String.class, ConfigDef.Type.STRING);
    javaClassToKafkaType.put(Integer.class, ConfigDef.Type.INT);
    javaClassToKafkaType.put(Integer.TYPE, ConfigDef.Type.INT);
    javaClassToKafkaType.put(Long.class, ConfigDef.Type.LONG);
    javaClassToKafkaType.put(Long.TYPE, ConfigDef.Type.LONG);
    javaClassToKafkaType.put(List.class, ConfigDef.Type.LIST);
    javaClassToKafkaType.put(Class.class, ConfigDef.Type.CLASS);
  }

  protected final String prefix;

  // visible for testing
  Function<String, String> environmentVariableAccessor = System::getenv;

  /**
   * @param prefix The string to prepend to all generated config property names.
   */
  public KafkaConfigProxyFactory(String prefix) {
    // make sure prefix is either empty, or ends with dot.
    this.prefix = prefix.isEmpty()
        ? ""
        : (prefix.endsWith(".") ? prefix : prefix + ".");
  }

  /**
   * Returns a Kafka ConfigDef whose config keys match the methods of the
   * given interface.
   */
  public <T> ConfigDef define(Class<T> configInterface) {
    return define(configInterface, new ConfigDef());
  }

  /**
   * Returns the given Kafka ConfigDef, augmented with config keys from
   * the given interface.
   */
  public <T> ConfigDef define(Class<T> configInterface, ConfigDef def) {
    for (Method method : configInterface.getMethods()) {
      if (Modifier.isStatic(method.getModifiers())) {
        continue;
      }

      def.define(
          new ConfigDef.ConfigKey(
              getConfigKeyName(method),
              getKafkaType(method),
              getDefaultValue(method),
              getValidator(method),
              getImportance(method),
              getDocumentation(method),
              getGroup(method),
              getOrderInGroup(method),
              ConfigDef.Width.NONE,
              getDisplayName(method),
              emptyList(),
              null,
              false
          )
      );
    }
    return def;
  }

  /**
   * Returns in implementation of the given config interface
   * backed by the given properties.
   *
   * @param doLog whether to log the config.
   * @throws ConfigException if a required property is missing or a value is invalid.
   */
  public <T> T newProxy(Class<T> configInterface, Map<String, String> properties, boolean doLog) {
    ConcreteKafkaConfig kafkaConfig = new ConcreteKafkaConfig(define(configInterface), properties, doLog);

    return newProxy(configInterface, method -> {
      String configKeyName = getConfigKeyName(method);
      return getValueFromEnvironmentVariable(configKeyName, method)
          .orElseGet(() -> kafkaConfig.get(configKeyName));
    });
  }

  /**
   * Returns the name of the config key associated with the method invoked
   * by the given consumer.
   * <p>
   * Example usage:
   * <pre>
   * String name = proxyFactory.keyName(MyConfig.class, MyConfig::myProperty);
   * </pre>
   *
   * @param configInterface the config interface to inspect
   * @param methodInvoker accepts an implementation of the specified interface
   * and calls the method whose name you want to know
   */
  public <T> String keyName(Class<T> configInterface, Consumer<T> methodInvoker) {
    try {
      methodInvoker.accept(newProxy(configInterface, method -> {
        throw new KeyNameHolderException(getConfigKeyName(method));
      }));
      throw new IllegalArgumentException("Consumer should have invoked a method of the config interface.");

    } catch (KeyNameHolderException e) {
      return e.name;
    }
  }

  private static <T> T newProxy(Class<T> configInterface, Function<Method, Object> valueForMethod) {
    String toStringPrefix = configInterface.getName();

    InvocationHandler handler = (proxy, method, argsMaybeNull) -> {
      int argCount = argsMaybeNull == null ? 0 : argsMaybeNull.length;
      switch (method.getName()) {
        case "equals":
          if (argCount == 1 && method.getParameterTypes()[0].equals(Object.class)) {
            return proxy == argsMaybeNull[0];
          }
          break;
        case "hashCode":
          if (argCount == 0) {
            return System.identityHashCode(proxy);
          }
          break;
        case "toString":
          if (argCount == 0) {
            return toStringPrefix + "@" + Integer.toHexString(System.identityHashCode(proxy));
          }
          break;
        default:
          break;
      }
      return valueForMethod.apply(method);
    };

    return configInterface.cast(
        Proxy.newProxyInstance(
            configInterface.getClassLoader(),
            new Class<?>[]{configInterface},
            handler));
  }

  private static class KeyNameHolderException extends RuntimeException {
    private final String name;

    public KeyNameHolderException(String name) {
      super(name);
      this.name = requireNonNull(name);
    }
  }

  protected Optional<Object> getValueFromEnvironmentVariable(String configKeyName, Method method) {
    String envarName = getAnnotation(method, EnvironmentVariable.class)
        .map(EnvironmentVariable::value)
        .orElse(null);
    if (envarName == null) {
      return Optional.empty();
    }

    String envarValue = environmentVariableAccessor.apply(envarName);
    if (envarValue == null) {
      log.debug("Environment variable '{}' not set.", envarName);
      return Optional.empty();
    }

    log.info("Reading value for '{}' from environment variable '{}'", configKeyName, envarName);
    return Optional.of(ConfigDef.parseType(configKeyName, envarValue, getKafkaType(method)));
  }

  protected ConfigDef.Type getKafkaType(Method method) {
    Class<?> returnType = method.getReturnType();
    if (returnType.equals(List.class) && !hasParameters(method.getGenericReturnType(), String.class)) {
      throw new RuntimeException("Method " + method + " has unsupported return type; For lists, only List<String> is supported.");
    }

    ConfigDef.Type kafkaType = javaClassToKafkaType.get(returnType);
    if (kafkaType == null) {
      throw new RuntimeException("Method " + method + " has unsupported return type: " + method.getGenericReturnType());
    }
    return kafkaType;
  }

  protected Object getDefaultValue(Method method) {
    return getAnnotation(method, Default.class)
        .map(a -> (Object) a.value())
        .orElse(ConfigDef.NO_DEFAULT_VALUE);
  }

  protected ConfigDef.Importance getImportance(Method method) {
    return getAnnotation(method, Importance.class)
        .map(Importance::value)
        .orElse(ConfigDef.Importance.MEDIUM);
  }

  protected ConfigDef.Validator getValidator(Method method) {
    try {
      Method companion = method.getDeclaringClass().getDeclaredMethod(method.getName() + "Validator");
      if (!Modifier.isStatic(companion.getModifiers())) {
        throw new RuntimeException("Companion method " + companion.getName() + "() must be static.");
      }
      return (ConfigDef.Validator) companion.invoke(null);

    } catch (NoSuchMethodException e) {
      return null;

    } catch (IllegalAccessException | InvocationTargetException e) {
      throw new RuntimeException("Failed to invoke validator companion method for " + method, e);
    }
  }

  protected String getDocumentation(Method method) {
    MethodJavadoc methodJavadoc = RuntimeJavadoc.getJavadoc(method);
    StringBuilder doc = new StringBuilder(methodJavadoc.getComment().toString());

    getAnnotation(method, EnvironmentVariable.class).ifPresent(envar ->
        doc.append(" May be overridden with the ").append(envar.value()).append(" environment variable."));

    for (OtherJavadoc other : methodJavadoc.getOther()) {
      if ("since".equals(other.getName())) {
        doc.append(" Since: ").append(other.getComment());
      }
    }

    // Javadoc may contain simple HTML; the ConfigDef documentation is plain text.
    return doc.toString()
        .replaceAll("<p>", " ")
        .replaceAll("<[^>]+>", "")
        .replaceAll("\\s+", " ")
        .trim();
  }

  protected String getGroup(Method method) {
    return insertSpacesBeforeCapitals(
        removeSuffix(method.getDeclaringClass().getSimpleName(), "Config"));
  }

  protected int getOrderInGroup(Method method) {
    // The Reflection API doesn't tell you the order methods are declared in.
    //
    // If the methods have Javadoc and were compiled using the
    // "therapi-runtime-javadoc-scribe" annotation processor,
    // the order of the Javadoc *does* match declaration order.
    ClassJavadoc doc = RuntimeJavadoc.getJavadoc(method.getDeclaringClass());
    int i = 0;
    for (MethodJavadoc methodJavadoc : doc.getMethods()) {
      i++;
      if (methodJavadoc.matches(method)) {
        return i;
      }
    }
    return -1;
  }

  protected String getDisplayName(Method method) {
    String name = insertSpacesBeforeCapitals(method.getName());
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }

  protected String getConfigKeyName(Method method) {
    return prefix + lowerCamelCaseToDottedLowerCase(method.getName());
  }

  /**
   * Exposes the {@link AbstractConfig#get(String)} method so the dynamic proxy
   * doesn't need to call the type-specific methods (like getString, getBoolean, etc).
   */
  private static class ConcreteKafkaConfig extends AbstractConfig {
    public ConcreteKafkaConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
      super(definition, originals, doLog);
    }

    @Override
    public Object get(String key) {
      return super.get(key);
    }
  }

  protected static <T extends Annotation> Optional<T> getAnnotation(Method method, Class<T> annotationClass) {
    T annotation = method.getAnnotation(annotationClass);
    if (annotation != null) {
      return Optional.of(annotation);
    }
    return Optional.ofNullable(
        method.getDeclaringClass()
            .getAnnotation(annotationClass));
  }

  protected static String lowerCamelCaseToDottedLowerCase(String name) {
    return name.replaceAll("(\\p{javaUpperCase})", ".$1")
        .toLowerCase(Locale.ROOT);
  }

  protected static String insertSpacesBeforeCapitals(String s) {
    return s.replaceAll("(\\p{javaUpperCase})", " $1").trim();
  }

  protected static String removeSuffix(String s, String suffix) {
    if (s.endsWith(suffix)) {
      s = s.substring(0, s.length() - suffix.length());
    }
    return s;
  }

  protected static boolean hasParameters(Type t, Type... paramTypes) {
    if (!(t instanceof ParameterizedType)) {
      return false;
    }
    return Arrays.equals(((ParameterizedType) t).getActualTypeArguments(), paramTypes);
  }
}
