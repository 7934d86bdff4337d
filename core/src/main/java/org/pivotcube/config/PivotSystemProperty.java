/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pivotcube.config;

import com.google.common.base.MoreObjects;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.IntPredicate;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A PivotCube specific system property that is used to configure the engine.
 *
 * <p>PivotCube system properties must always be in the "pivotcube" root
 * namespace. Values are read from the system properties, merged over the
 * contents of the file "pivotcube.properties" if it exists in the classpath.
 *
 * @param <T> the type of the property value
 */
public final class PivotSystemProperty<T> {
  /** Holds all system properties related with PivotCube. */
  private static final Properties PROPERTIES = loadProperties();

  /**
   * Whether to run PivotCube in debug mode.
   *
   * <p>When debug mode is activated every {@link org.pivotcube.runtime.PivotException}
   * is logged at ERROR level as it is created.</p>
   */
  public static final PivotSystemProperty<Boolean> DEBUG =
      booleanProperty("pivotcube.debug", false);

  /**
   * The maximum number of cuboids held by a
   * {@link org.pivotcube.cache.DynamicCube}.
   *
   * <p>The property can take any value between [0, {@link Integer#MAX_VALUE}]
   * inclusive. If the value is not valid (or not specified) then the default
   * value 256 is used. Setting the property to 0 disables caching: every
   * request computes its cuboid anew.</p>
   */
  public static final PivotSystemProperty<Integer> CACHE_MAXIMUM_SIZE =
      intProperty("pivotcube.cache.maximum.size", 256, v -> v >= 0);

  /**
   * The label of the root node of every {@link org.pivotcube.tree.NestTree}.
   */
  public static final PivotSystemProperty<String> TREE_ROOT_LABEL =
      stringProperty("pivotcube.tree.root.label", "All");

  private static PivotSystemProperty<Boolean> booleanProperty(String key,
      boolean defaultValue) {
    // Note that "" -> true (convenient for command-lines flags like '-Dflag')
    return new PivotSystemProperty<>(key,
        v -> v == null ? defaultValue
            : "".equals(v) || Boolean.parseBoolean(v));
  }

  /**
   * Returns the value of the system property with the specified name as {@code
   * int}. If any of the conditions below hold, returns the
   * <code>defaultValue</code>:
   *
   * <ol>
   * <li>the property is not defined;
   * <li>the property value cannot be transformed to an int;
   * <li>the property value does not satisfy the checker.
   * </ol>
   */
  private static PivotSystemProperty<Integer> intProperty(String key,
      int defaultValue, IntPredicate valueChecker) {
    return new PivotSystemProperty<>(key, v -> {
      if (v == null) {
        return defaultValue;
      }
      try {
        int intVal = Integer.parseInt(v.trim());
        return valueChecker.test(intVal) ? intVal : defaultValue;
      } catch (NumberFormatException nfe) {
        return defaultValue;
      }
    });
  }

  private static PivotSystemProperty<String> stringProperty(String key,
      String defaultValue) {
    return new PivotSystemProperty<>(key, v -> v == null ? defaultValue : v);
  }

  private static Properties loadProperties() {
    Properties fileProperties = new Properties();
    ClassLoader classLoader = MoreObjects.firstNonNull(
        Thread.currentThread().getContextClassLoader(),
        PivotSystemProperty.class.getClassLoader());
    try (InputStream stream = requireNonNull(classLoader, "classLoader")
        .getResourceAsStream("pivotcube.properties")) {
      if (stream != null) {
        fileProperties.load(stream);
      }
    } catch (IOException e) {
      throw new RuntimeException("while reading from pivotcube.properties file", e);
    }

    // System properties override the file
    final Properties allProperties = new Properties();
    Stream.concat(
        fileProperties.entrySet().stream(),
        System.getProperties().entrySet().stream())
        .forEach(prop -> {
          String key = (String) prop.getKey();
          if (key.startsWith("pivotcube.")) {
            allProperties.setProperty(key, (String) prop.getValue());
          }
        });
    return allProperties;
  }

  private final String key;
  private final T value;

  private PivotSystemProperty(String key,
      Function<? super @Nullable String, ? extends T> valueParser) {
    this.key = key;
    this.value = valueParser.apply(PROPERTIES.getProperty(key));
  }

  /** Returns the name of this property, for example
   * "pivotcube.cache.maximum.size". */
  public String key() {
    return key;
  }

  /**
   * Returns the value of this property.
   *
   * @return the value of this property, or its default value if the property
   * is not set or its value is invalid
   */
  public T value() {
    return value;
  }

  @Override public String toString() {
    return key + "=" + value;
  }
}

// End PivotSystemProperty.java
