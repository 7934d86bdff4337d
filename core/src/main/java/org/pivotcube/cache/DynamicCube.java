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

import org.pivotcube.config.PivotSystemProperty;
import org.pivotcube.cuboid.Cuboid;
import org.pivotcube.cuboid.CuboidKey;
import org.pivotcube.runtime.CuboidComputeException;
import org.pivotcube.runtime.PivotException;
import org.pivotcube.util.CancelFlag;

import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Cache of {@link Cuboid}s, computed on demand.
 *
 * <p>Each entry is the future result of one call to a {@link CuboidComputer}.
 * Concurrent requests for the same {@link CuboidKey} share one computation,
 * whether it is complete or still in flight. If a computation fails, its
 * entry is removed, so that the next request computes again; every caller
 * already waiting sees the failure.
 *
 * <p>The cache holds at most a fixed number of entries, and evicts those
 * least recently used. A maximum size of 0 disables caching.
 *
 * <p>It is thread-safe.
 */
public class DynamicCube {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DynamicCube.class);

  private final CuboidComputer computer;
  private final Comparator<String> dimensionOrder;
  private final Cache<CuboidKey, ListenableFuture<Cuboid>> cache;

  /** Creates a DynamicCube with natural dimension order and the maximum size
   * from {@link PivotSystemProperty#CACHE_MAXIMUM_SIZE}. */
  public DynamicCube(CuboidComputer computer) {
    this(computer, Ordering.natural(),
        PivotSystemProperty.CACHE_MAXIMUM_SIZE.value());
  }

  public DynamicCube(CuboidComputer computer,
      Comparator<String> dimensionOrder, long maximumSize) {
    Preconditions.checkArgument(maximumSize >= 0,
        "maximum size must not be negative: %s", maximumSize);
    this.computer = requireNonNull(computer, "computer");
    this.dimensionOrder = requireNonNull(dimensionOrder, "dimensionOrder");
    this.cache = CacheBuilder.newBuilder()
        .maximumSize(maximumSize)
        .recordStats()
        .build();
  }

  /** Returns the canonical key for a combination of dimensions and
   * measures. */
  public CuboidKey key(Collection<String> dimensionIds,
      Collection<String> measureIds) {
    return CuboidKey.of(dimensionIds, measureIds, dimensionOrder);
  }

  /** Returns a cuboid, computing it if it is not cached.
   *
   * <p>Cancelling the returned future stops this caller waiting; it does
   * not cancel the computation, which other callers may share.
   *
   * @param dimensionIds Dimensions, in any order
   * @param measureIds Measures; empty for a raw cuboid
   */
  public ListenableFuture<Cuboid> getCuboid(List<String> dimensionIds,
      List<String> measureIds) {
    return Futures.nonCancellationPropagating(
        getShared(key(dimensionIds, measureIds), measureIds));
  }

  /** As {@link #getCuboid(List, List)}; the returned future is also
   * cancelled when cancel is requested on {@code cancelFlag}. */
  public ListenableFuture<Cuboid> getCuboid(List<String> dimensionIds,
      List<String> measureIds, CancelFlag cancelFlag) {
    return cancelFlag.register(getCuboid(dimensionIds, measureIds));
  }

  private ListenableFuture<Cuboid> getShared(CuboidKey key,
      List<String> measureIds) {
    final AtomicBoolean loaded = new AtomicBoolean();
    final ListenableFuture<Cuboid> future;
    try {
      future = cache.get(key, () -> {
        loaded.set(true);
        return compute(key, ImmutableList.copyOf(measureIds));
      });
    } catch (ExecutionException e) {
      // compute reports failure in the future it returns, so this does not
      // happen
      throw new PivotException("Error while loading cuboid [" + key + "]",
          e.getCause());
    }
    if (!loaded.get()) {
      LOGGER.trace("Cuboid cache hit [{}]", key);
      return future;
    }
    LOGGER.debug("Cuboid cache miss; computing [{}]", key);
    Futures.addCallback(future, new FutureCallback<Cuboid>() {
      @Override public void onSuccess(@Nullable Cuboid result) {
        LOGGER.debug("Computed cuboid [{}]", key);
      }

      @Override public void onFailure(Throwable t) {
        if (cache.asMap().remove(key, future)) {
          LOGGER.warn("Evicted cuboid [{}] after failure", key, t);
        }
      }
    }, MoreExecutors.directExecutor());
    return future;
  }

  private ListenableFuture<Cuboid> compute(CuboidKey key,
      List<String> measureIds) {
    try {
      return requireNonNull(computer.computeCuboid(key, measureIds),
          "computeCuboid returned null");
    } catch (RuntimeException e) {
      return Futures.immediateFailedFuture(new CuboidComputeException(key, e));
    }
  }

  /** Removes every entry. Computations in flight continue, and their
   * callers still receive the result. */
  public void invalidateAll() {
    cache.invalidateAll();
  }

  /** Returns the approximate number of entries, including computations in
   * flight. */
  public long size() {
    return cache.size();
  }

  public CacheStats stats() {
    return cache.stats();
  }
}

// End DynamicCube.java
