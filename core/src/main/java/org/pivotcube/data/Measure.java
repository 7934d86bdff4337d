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

import org.pivotcube.aggregate.Aggregator;
import org.pivotcube.aggregate.Aggregators;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A numeric field together with the function that aggregates it.
 *
 * <p>It is immutable.
 *
 * <p>Examples: {@code Measure.of("sales")} sums "sales";
 * {@code Measure.of("price", Aggregators.MEAN)} averages "price".
 */
public class Measure {
  public final String id;
  public final Aggregator aggregator;

  private Measure(String id, Aggregator aggregator) {
    this.id = requireNonNull(id, "id");
    this.aggregator = requireNonNull(aggregator, "aggregator");
  }

  /** Creates a measure that is aggregated using {@link Aggregators#SUM}. */
  public static Measure of(String id) {
    return new Measure(id, Aggregators.SUM);
  }

  public static Measure of(String id, Aggregator aggregator) {
    return new Measure(id, aggregator);
  }

  /** Returns the ids of a list of measures. */
  public static ImmutableList<String> ids(List<Measure> measures) {
    final ImmutableList.Builder<String> ids = ImmutableList.builder();
    for (Measure measure : measures) {
      ids.add(measure.id);
    }
    return ids.build();
  }

  @Override public int hashCode() {
    return Objects.hash(id, aggregator);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof Measure
        && id.equals(((Measure) obj).id)
        && aggregator.equals(((Measure) obj).aggregator);
  }

  @Override public String toString() {
    return aggregator.name() + "(" + id + ")";
  }
}

// End Measure.java
