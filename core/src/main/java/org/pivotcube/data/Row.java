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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A record: one row of a data source, mapping field ids to scalar values.
 *
 * <p>It is immutable. A field that is absent reads as null; null values are
 * never stored. Two rows are equal if they have the same field ids and, for
 * each field, values with the same {@link Values#key canonical key}.
 */
public class Row {
  public static final Row EMPTY = new Row(ImmutableMap.of());

  private final ImmutableMap<String, Object> values;

  private Row(ImmutableMap<String, Object> values) {
    this.values = values;
  }

  /** Creates a row from alternating field ids and values.
   *
   * <p>For example, {@code Row.of("g", "a", "x", 1)}. A null value means
   * that the field is absent. */
  public static Row of(@Nullable Object... idValuePairs) {
    Preconditions.checkArgument(idValuePairs.length % 2 == 0,
        "expected (id, value) pairs, got %s arguments", idValuePairs.length);
    final Builder builder = builder();
    for (int i = 0; i < idValuePairs.length; i += 2) {
      final Object id = idValuePairs[i];
      Preconditions.checkArgument(id instanceof String,
          "field id must be a string: %s", id);
      builder.set((String) id, idValuePairs[i + 1]);
    }
    return builder.build();
  }

  /** Creates a row from a map. Null values are dropped. */
  public static Row copyOf(Map<String, ? extends @Nullable Object> map) {
    return builder().setAll(map).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value of a field, or null if the field is absent. */
  public @Nullable Object get(String fieldId) {
    return values.get(fieldId);
  }

  /** Returns whether this row has a value for a field. */
  public boolean containsField(String fieldId) {
    return values.containsKey(fieldId);
  }

  /** Returns the ids of the fields in this row, in insertion order. */
  public Set<String> fieldIds() {
    return values.keySet();
  }

  public ImmutableMap<String, Object> asMap() {
    return values;
  }

  /** Returns a builder initialized with the contents of this row. */
  public Builder toBuilder() {
    return builder().setAll(values);
  }

  @Override public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof Row)) {
      return false;
    }
    final Row that = (Row) obj;
    if (!values.keySet().equals(that.values.keySet())) {
      return false;
    }
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      if (!Values.equal(entry.getValue(), that.values.get(entry.getKey()))) {
        return false;
      }
    }
    return true;
  }

  @Override public int hashCode() {
    int h = 0;
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      h += entry.getKey().hashCode()
          ^ Objects.hashCode(Values.key(entry.getValue()));
    }
    return h;
  }

  @Override public String toString() {
    return values.toString();
  }

  /** Builder for {@link Row}. */
  public static class Builder {
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder() {
    }

    /** Sets the value of a field. A null value removes the field. */
    public Builder set(String fieldId, @Nullable Object value) {
      Objects.requireNonNull(fieldId, "fieldId");
      if (value == null) {
        values.remove(fieldId);
      } else {
        values.put(fieldId, value);
      }
      return this;
    }

    public Builder setAll(Map<String, ? extends @Nullable Object> map) {
      for (Map.Entry<String, ? extends @Nullable Object> entry
          : map.entrySet()) {
        set(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Builder setAll(Row row) {
      return setAll(row.values);
    }

    public Row build() {
      return values.isEmpty() ? EMPTY : new Row(ImmutableMap.copyOf(values));
    }
  }
}

// End Row.java
