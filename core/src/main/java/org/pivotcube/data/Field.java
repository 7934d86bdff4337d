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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A dimension field, optionally with a comparator that orders its values
 * on a pivot axis.
 */
public class Field {
  public final String id;
  private final @Nullable Comparator<@Nullable Object> comparator;

  private Field(String id, @Nullable Comparator<@Nullable Object> comparator) {
    this.id = requireNonNull(id, "id");
    this.comparator = comparator;
  }

  /** Creates a field whose values sort in {@link Values#ORDERING}. */
  public static Field of(String id) {
    return new Field(id, null);
  }

  /** Creates a field with a comparator for its values. */
  public static Field of(String id, Comparator<@Nullable Object> comparator) {
    return new Field(id, requireNonNull(comparator, "comparator"));
  }

  /** Returns the comparator for this field's values; the default ordering
   * if none was given. */
  public Comparator<@Nullable Object> ordering() {
    return comparator != null ? comparator : Values.ORDERING;
  }

  /** Returns whether this field has its own comparator. */
  public boolean hasComparator() {
    return comparator != null;
  }

  /** Returns the ids of a list of fields. */
  public static ImmutableList<String> ids(List<Field> fields) {
    final ImmutableList.Builder<String> ids = ImmutableList.builder();
    for (Field field : fields) {
      ids.add(field.id);
    }
    return ids.build();
  }

  /** Creates a list of fields, without comparators, from ids. */
  public static ImmutableList<Field> of(List<String> ids) {
    final ImmutableList.Builder<Field> fields = ImmutableList.builder();
    for (String id : ids) {
      fields.add(of(id));
    }
    return fields.build();
  }

  @Override public int hashCode() {
    return Objects.hash(id, comparator);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof Field
        && id.equals(((Field) obj).id)
        && Objects.equals(comparator, ((Field) obj).comparator);
  }

  @Override public String toString() {
    return id;
  }
}

// End Field.java
