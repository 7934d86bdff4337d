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
package org.pivotcube.cache;

import org.pivotcube.aggregate.Aggregators;
import org.pivotcube.cuboid.Cuboid;
import org.pivotcube.cuboid.CuboidKey;
import org.pivotcube.data.Measure;
import org.pivotcube.data.Row;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Unit tests for {@link LocalCuboidComputer}.
 */
class LocalCuboidComputerTest {
  private static final List<Row> ROWS =
      ImmutableList.of(Row.of("g", "a", "x", 1, "y", 10),
          Row.of("g", "b", "x", 5, "y", 20),
          Row.of("g", "a", "x", 2, "y", 30));

  private static final CuboidKey G =
      CuboidKey.of(ImmutableList.of("g"), ImmutableList.of());

  @Test void testRaw() throws Exception {
    final LocalCuboidComputer computer =
        new LocalCuboidComputer(ROWS, ImmutableList.of());
    final Cuboid cuboid = computer.computeCuboid(G, ImmutableList.of()).get();
    assertThat(cuboid.isAggregated(), is(false));
    assertThat(cuboid.rows(), is(ROWS));
  }

  @Test void testAggregated() throws Exception {
    final LocalCuboidComputer computer =
        new LocalCuboidComputer(ROWS,
            ImmutableList.of(Measure.of("y", Aggregators.MEAN)));
    final CuboidKey key =
        CuboidKey.of(ImmutableList.of("g"), ImmutableList.of("x", "y"));
    // "x" has no definition, so is summed
    final Cuboid cuboid =
        computer.computeCuboid(key, ImmutableList.of("x", "y")).get();
    assertThat(cuboid.isAggregated(), is(true));
    assertThat(cuboid.rows(),
        is(Arrays.asList(Row.of("g", "a", "x", 3, "y", 20.0d),
            Row.of("g", "b", "x", 5, "y", 20.0d))));
  }

  @Test void testExecutor() throws Exception {
    final ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(Executors.newSingleThreadExecutor());
    try {
      final LocalCuboidComputer computer =
          new LocalCuboidComputer(ROWS, ImmutableList.of(), executor);
      final Cuboid cuboid =
          computer.computeCuboid(G, ImmutableList.of())
              .get(10, TimeUnit.SECONDS);
      assertThat(cuboid.rows().size(), is(3));
    } finally {
      executor.shutdownNow();
    }
  }
}

// End LocalCuboidComputerTest.java
