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

import org.pivotcube.data.Row;

import java.util.List;

/**
 * Utilities for querying {@link Cuboid}s.
 */
public final class Queries {
  private Queries() {}

  /** Queries a cuboid, using its own dimension order. */
  public static List<Row> queryCube(Cuboid cuboid, QueryPath path) {
    return queryCube(cuboid, path, cuboid.key.dimensions);
  }

  /** Queries a cuboid.
   *
   * <p>Re-projects {@code path} onto {@code cubeDimensionOrder}: a dimension
   * with no step in the path becomes a wildcard, and a step whose dimension
   * is not in the order is ignored. The order must be the cuboid's dimension
   * order, or a prefix of it.
   *
   * <p>For example, on a cuboid over [a, b], the path [b=y] selects the same
   * records as [a=*, b=y]. */
  public static List<Row> queryCube(Cuboid cuboid, QueryPath path,
      List<String> cubeDimensionOrder) {
    return cuboid.resolve(path.project(cubeDimensionOrder));
  }
}

// End Queries.java
