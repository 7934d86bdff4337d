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
package org.pivotcube.data;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Restricts the values of one field to a set of allowed values.
 *
 * <p>Membership is tested by {@link Values#key canonical key}, so a filter
 * that allows the number {@code 3} accepts a row whose value is the string
 * {@code "3"}. A row whose value is null is never accepted.
 */
public class Filter implements Predicate<Row> {
  public final String id;
  public final ImmutableList<Object> values;
  private final ImmutableSet<String> keys;

  private Filter(String id, ImmutableList<Object> values) {
    this.id = requireNonNull(id, "id");
    this.values = values;
    final ImmutableSet.Builder<String> keys = ImmutableSet.builder();
    for (Object value : values) {
      keys.add(requireNonNull(Values.key(value)));
    }
    this.keys = keys.build();
  }

  public static Filter of(String id, Object... values) {
    return new Filter(id, ImmutableList.copyOf(values));
  }

  public static Filter of(String id, List<?> values) {
    return new Filter(id, ImmutableList.copyOf(values));
  }

  /** Returns whether the filter allows a value. */
  public boolean allows(@Nullable Object value) {
    final String key = Values.key(value);
    return key != null && keys.contains(key);
  }

  @Override public boolean test(Row row) {
    return allows(row.get(id));
  }

  @Override public String toString() {
    return id + " IN " + values;
  }
}

// End Filter.java
