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
package org.pivotcube.aggregate;

import org.pivotcube.data.Measure;
import org.pivotcube.data.Row;
import org.pivotcube.data.Values;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utilities that apply {@link Measure measures} to data sources.
 */
public final class Aggregations {
  private Aggregations() {}

  /** Aggregates every measure over the whole data source.
   *
   * <p>For example, summing "x" over {@code [{x:1}, {x:2}, {x:3}]} gives
   * {@code {x:6}}. An exception thrown by an aggregator propagates to the
   * caller. */
  public static Row aggregateAll(List<Row> dataSource, List<Measure> measures) {
    final Row.Builder builder = Row.builder();
    for (Measure measure : measures) {
      final Row partial =
          measure.aggregator.aggregate(dataSource, ImmutableList.of(measure.id));
      builder.set(measure.id, partial.get(measure.id));
    }
    return builder.build();
  }

  /** Groups a data source by one field and aggregates each group.
   *
   * <p>Groups are emitted in the order their key was first seen. Each output
   * row holds the group's value of {@code field} (the first raw value seen
   * with that canonical key) and one value per measure. Rows with no value
   * for {@code field} form one group whose output row lacks the field. */
  public static List<Row> aggregateOnGroupBy(List<Row> dataSource,
      String field, List<Measure> measures) {
    final Map<@Nullable String, Group> groups = new LinkedHashMap<>();
    for (Row row : dataSource) {
      final Object value = row.get(field);
      groups.computeIfAbsent(Values.key(value), k -> new Group(value))
          .rows.add(row);
    }
    final ImmutableList.Builder<Row> result = ImmutableList.builder();
    for (Group group : groups.values()) {
      result.add(
          Row.builder()
              .set(field, group.value)
              .setAll(aggregateAll(group.rows, measures))
              .build());
    }
    return result.build();
  }

  /** As {@link #aggregateOnGroupBy(List, String, List)}, for callers that
   * hold a list of fields. Grouping is by one field only; the list must have
   * exactly one element. */
  public static List<Row> aggregateOnGroupBy(List<Row> dataSource,
      List<String> fields, List<Measure> measures) {
    Preconditions.checkArgument(fields.size() == 1,
        "group by supports exactly one field, got %s", fields);
    return aggregateOnGroupBy(dataSource, fields.get(0), measures);
  }

  /** Rows that share a group key. */
  private static class Group {
    final @Nullable Object value;
    final List<Row> rows = new ArrayList<>();

    Group(@Nullable Object value) {
      this.value = value;
    }
  }
}

// End Aggregations.java
