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

import org.pivotcube.data.Values;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Ordered list of (dimension, value-or-wildcard) steps that addresses a
 * subset of a {@link Cuboid}.
 *
 * <p>It is immutable.
 */
public class QueryPath {
  public static final QueryPath EMPTY = new QueryPath(ImmutableList.of());

  public final ImmutableList<Step> steps;

  private QueryPath(ImmutableList<Step> steps) {
    this.steps = steps;
  }

  public static QueryPath of(List<Step> steps) {
    return steps.isEmpty() ? EMPTY : new QueryPath(ImmutableList.copyOf(steps));
  }

  public static QueryPath of(Step... steps) {
    return of(ImmutableList.copyOf(steps));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Creates a step that matches one value. */
  public static Step step(String dimension, @Nullable Object value) {
    return new Step(dimension, value, false);
  }

  /** Creates a step that matches every value of a dimension. */
  public static Step wildcard(String dimension) {
    return new Step(dimension, null, true);
  }

  public int size() {
    return steps.size();
  }

  /** Returns the dimension of each step. */
  public ImmutableList<String> dimensions() {
    final ImmutableList.Builder<String> list = ImmutableList.builder();
    for (Step step : steps) {
      list.add(step.dimension);
    }
    return list.build();
  }

  /** Returns the first step for a given dimension, or null. */
  public @Nullable Step find(String dimension) {
    for (Step step : steps) {
      if (step.dimension.equals(dimension)) {
        return step;
      }
    }
    return null;
  }

  /** Returns a copy of this path with its steps sorted by dimension. The
   * sort is stable. */
  public QueryPath sort(Comparator<String> dimensionOrder) {
    return of(
        Ordering.from(dimensionOrder).<Step>onResultOf(step -> step.dimension)
            .immutableSortedCopy(steps));
  }

  /** Re-projects this path onto a list of dimensions.
   *
   * <p>The result has one step per element of {@code dimensions}, in that
   * order: the first step of this path for that dimension, or a wildcard if
   * there is none. Steps of this path whose dimension is not in the list are
   * dropped. */
  public QueryPath project(List<String> dimensions) {
    final List<Step> list = new ArrayList<>(dimensions.size());
    for (String dimension : dimensions) {
      final Step step = find(dimension);
      list.add(step != null ? step : wildcard(dimension));
    }
    return of(list);
  }

  @Override public int hashCode() {
    return steps.hashCode();
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof QueryPath
        && steps.equals(((QueryPath) obj).steps);
  }

  @Override public String toString() {
    return steps.toString();
  }

  /** Step in a {@link QueryPath}. */
  public static class Step {
    public final String dimension;
    public final @Nullable Object value;
    public final boolean wildcard;

    private Step(String dimension, @Nullable Object value, boolean wildcard) {
      this.dimension = requireNonNull(dimension, "dimension");
      this.value = value;
      this.wildcard = wildcard;
    }

    /** Returns the canonical key of the value; null for a wildcard. */
    public @Nullable String key() {
      return wildcard ? null : Values.key(value);
    }

    @Override public int hashCode() {
      return Objects.hash(dimension, key(), wildcard);
    }

    @Override public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof Step
          && dimension.equals(((Step) obj).dimension)
          && wildcard == ((Step) obj).wildcard
          && Objects.equals(key(), ((Step) obj).key());
    }

    @Override public String toString() {
      return dimension + "=" + (wildcard ? "*" : value);
    }
  }

  /** Builder for {@link QueryPath}. */
  public static class Builder {
    private final List<Step> steps = new ArrayList<>();

    private Builder() {
    }

    public Builder add(String dimension, @Nullable Object value) {
      steps.add(step(dimension, value));
      return this;
    }

    public Builder addWildcard(String dimension) {
      steps.add(wildcard(dimension));
      return this;
    }

    /** Adds one step per value, binding {@code values[i]} to
     * {@code dimensions[i]}. There may be fewer values than dimensions,
     * as for the path of a collapsed node in a tree. */
    public Builder addAll(List<String> dimensions,
        List<? extends @Nullable Object> values) {
      Preconditions.checkArgument(values.size() <= dimensions.size(),
          "path %s is longer than dimensions %s", values, dimensions);
      for (int i = 0; i < values.size(); i++) {
        add(dimensions.get(i), values.get(i));
      }
      return this;
    }

    public QueryPath build() {
      return of(steps);
    }
  }
}

// End QueryPath.java
