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

import org.pivotcube.cuboid.Cuboid;
import org.pivotcube.cuboid.CuboidKey;
import org.pivotcube.data.Measure;
import org.pivotcube.data.Row;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Implementation of {@link CuboidComputer} that scans an in-memory data
 * source.
 *
 * <p>A request with no measures gives a raw cuboid. Otherwise the data
 * source is grouped by the key's dimensions and each measure is aggregated
 * with the aggregator of the measure definition of the same id; a measure
 * with no definition is summed.
 */
public class LocalCuboidComputer implements CuboidComputer {
  private final ImmutableList<Row> dataSource;
  private final ImmutableMap<String, Measure> measures;
  private final ListeningExecutorService executor;

  /** Creates a LocalCuboidComputer that scans in the calling thread. */
  public LocalCuboidComputer(List<Row> dataSource, List<Measure> measures) {
    this(dataSource, measures, MoreExecutors.newDirectExecutorService());
  }

  public LocalCuboidComputer(List<Row> dataSource, List<Measure> measures,
      ListeningExecutorService executor) {
    this.dataSource = ImmutableList.copyOf(dataSource);
    this.measures = Maps.uniqueIndex(measures, measure -> measure.id);
    this.executor = requireNonNull(executor, "executor");
  }

  @Override public ListenableFuture<Cuboid> computeCuboid(CuboidKey key,
      List<String> measureIds) {
    return executor.submit(() -> compute(key, measureIds));
  }

  private Cuboid compute(CuboidKey key, List<String> measureIds) {
    if (measureIds.isEmpty()) {
      return Cuboid.ofRows(key, dataSource);
    }
    final List<Measure> list = new ArrayList<>();
    for (String measureId : ImmutableSet.copyOf(measureIds)) {
      final Measure measure = measures.get(measureId);
      list.add(measure != null ? measure : Measure.of(measureId));
    }
    return Cuboid.aggregate(key, dataSource, list);
  }
}

// End LocalCuboidComputer.java
