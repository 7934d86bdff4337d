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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;

/** Definition of a particular combination of dimensions and measures that
 * is the basis of a {@link Cuboid}.
 *
 * <p>Dimensions are held in canonical order, so that two requests that name
 * the same dimensions in a different order share a key. Measures are sorted
 * and de-duplicated. A key with no measures denotes a raw cuboid, which
 * holds records rather than aggregates. */
public class CuboidKey {
  public final ImmutableList<String> dimensions;
  public final ImmutableList<String> measures;

  private CuboidKey(ImmutableList<String> dimensions,
      ImmutableList<String> measures) {
    this.dimensions = dimensions;
    this.measures = measures;
  }

  /** Creates a CuboidKey whose dimensions are in natural order. */
  public static CuboidKey of(Collection<String> dimensions,
      Collection<String> measures) {
    return of(dimensions, measures, Ordering.natural());
  }

  /** Creates a CuboidKey whose dimensions are in the given total order.
   * Duplicate dimensions are removed. */
  public static CuboidKey of(Collection<String> dimensions,
      Collection<String> measures, Comparator<String> dimensionOrder) {
    return new CuboidKey(
        ImmutableSortedSet.copyOf(dimensionOrder, dimensions).asList(),
        ImmutableSortedSet.copyOf(measures).asList());
  }

  /** Returns whether this key denotes a raw cuboid. */
  public boolean isRaw() {
    return measures.isEmpty();
  }

  @Override public int hashCode() {
    return Objects.hash(dimensions, measures);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof CuboidKey
        && dimensions.equals(((CuboidKey) obj).dimensions)
        && measures.equals(((CuboidKey) obj).measures);
  }

  @Override public String toString() {
    return "dimensions: " + dimensions + ", measures: " + measures;
  }
}

// End CuboidKey.java
