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
package org.pivotcube.cuboid;

import org.pivotcube.aggregate.Aggregations;
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
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Materialized view of a data source over one set of dimensions.
 *
 * <p>Records are indexed by a tree with one level per dimension of the
 * {@link #key}, in key order. Each level is keyed by the canonical key of the
 * dimension value, and keeps children in the order their value was first
 * seen. Leaves hold either raw records or aggregate records; see
 * {@link #isAggregated()}.
 *
 * <p>A cuboid is immutable once built, and may be shared between threads.
 */
public class Cuboid {
  public final CuboidKey key;
  private final boolean aggregated;
  private final ImmutableList<Row> rows;
  private final Node root;

  private Cuboid(CuboidKey key, boolean aggregated, List<Row> rows) {
    this.key = requireNonNull(key, "key");
    this.aggregated = aggregated;
    this.rows = ImmutableList.copyOf(rows);
    this.root = new Node();
    for (Row row : this.rows) {
      Node node = root;
      for (String dimension : key.dimensions) {
        node = node.children.computeIfAbsent(Values.key(row.get(dimension)),
            k -> new Node());
      }
      node.rows.add(row);
    }
  }

  /** Creates a cuboid that holds raw records. */
  public static Cuboid ofRows(CuboidKey key, List<Row> rows) {
    return new Cuboid(key, false, rows);
  }

  /** Creates a cuboid from records that are already aggregated, one per
   * combination of dimension values; for example, the result of a
   * {@code GROUP BY} query on a remote store. */
  public static Cuboid ofAggregates(CuboidKey key, List<Row> aggregates) {
    return new Cuboid(key, true, aggregates);
  }

  /** Creates a cuboid by scanning raw records, grouping them by the key's
   * dimensions and aggregating each group.
   *
   * <p>Each aggregate record holds the dimension values of the first record
   * in its group, plus one value per measure. */
  public static Cuboid aggregate(CuboidKey key, List<Row> rows,
      List<Measure> measures) {
    final Cuboid raw = ofRows(key, rows);
    final List<Row> aggregates = new ArrayList<>();
    raw.root.forEachLeaf(leaf -> {
      final Row first = leaf.rows.get(0);
      final Row.Builder builder = Row.builder();
      for (String dimension : key.dimensions) {
        builder.set(dimension, first.get(dimension));
      }
      builder.setAll(Aggregations.aggregateAll(leaf.rows, measures));
      aggregates.add(builder.build());
    });
    return ofAggregates(key, aggregates);
  }

  /** Returns whether the records of this cuboid are aggregates. */
  public boolean isAggregated() {
    return aggregated;
  }

  /** Returns all records of this cuboid, in the order they were given. */
  public ImmutableList<Row> rows() {
    return rows;
  }

  /** Resolves a path to records.
   *
   * <p>Step i of the path must be for dimension i of the key; the path may
   * be shorter than the key. A wildcard step fans out to every child, any
   * other step to the child whose key matches. Returns the records under
   * every node reached, in the order of this cuboid's children. Returns an
   * empty list if nothing matches.
   *
   * @see Queries#queryCube
   */
  public List<Row> resolve(QueryPath path) {
    Preconditions.checkArgument(path.size() <= key.dimensions.size(),
        "path %s is longer than cuboid dimensions %s", path, key.dimensions);
    for (int i = 0; i < path.size(); i++) {
      Preconditions.checkArgument(
          path.steps.get(i).dimension.equals(key.dimensions.get(i)),
          "path %s is not aligned with cuboid dimensions %s", path,
          key.dimensions);
    }
    final ImmutableList.Builder<Row> result = ImmutableList.builder();
    resolve(root, path, 0, result);
    return result.build();
  }

  private static void resolve(Node node, QueryPath path, int depth,
      ImmutableList.Builder<Row> result) {
    if (depth == path.size()) {
      node.collect(result);
      return;
    }
    final QueryPath.Step step = path.steps.get(depth);
    if (step.wildcard) {
      for (Node child : node.children.values()) {
        resolve(child, path, depth + 1, result);
      }
    } else {
      final Node child = node.children.get(step.key());
      if (child != null) {
        resolve(child, path, depth + 1, result);
      }
    }
  }

  @Override public String toString() {
    return "Cuboid(" + key + (aggregated ? ", aggregated" : ", raw")
        + ", rows: " + rows.size() + ")";
  }

  /** Node in the index of a cuboid. Populated only by the constructor. */
  private static class Node {
    final Map<@Nullable String, Node> children = new LinkedHashMap<>();
    final List<Row> rows = new ArrayList<>();

    void collect(ImmutableList.Builder<Row> result) {
      result.addAll(rows);
      for (Node child : children.values()) {
        child.collect(result);
      }
    }

    void forEachLeaf(Consumer<Node> consumer) {
      if (!rows.isEmpty()) {
        consumer.accept(this);
      }
      for (Node child : children.values()) {
        child.forEachLeaf(consumer);
      }
    }
  }
}

// End Cuboid.java
