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
import org.pivotcube.runtime.CuboidComputeException;
import org.pivotcube.util.CancelFlag;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link DynamicCube}.
 */
class DynamicCubeTest {
  private static final List<String> AB = ImmutableList.of("a", "b");
  private static final List<String> X = ImmutableList.of("x");

  /** Computer that counts its calls and returns empty cuboids. */
  private static class CountingComputer implements CuboidComputer {
    final AtomicInteger count = new AtomicInteger();

    @Override public ListenableFuture<Cuboid> computeCuboid(CuboidKey key,
        List<String> measureIds) {
      count.incrementAndGet();
      return Futures.immediateFuture(Cuboid.ofRows(key, ImmutableList.of()));
    }
  }

  private static DynamicCube cube(CuboidComputer computer) {
    return new DynamicCube(computer, Ordering.natural(), 16);
  }

  @Test void testSingleFlight() throws Exception {
    final SettableFuture<Cuboid> pending = SettableFuture.create();
    final AtomicInteger count = new AtomicInteger();
    final DynamicCube cube = cube((key, measureIds) -> {
      count.incrementAndGet();
      return pending;
    });
    final List<ListenableFuture<Cuboid>> futures = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      futures.add(cube.getCuboid(AB, X));
    }
    assertThat(count.get(), is(1));
    for (ListenableFuture<Cuboid> future : futures) {
      assertThat(future.isDone(), is(false));
    }
    final Cuboid cuboid =
        Cuboid.ofRows(cube.key(AB, X), ImmutableList.of());
    pending.set(cuboid);
    for (ListenableFuture<Cuboid> future : futures) {
      assertThat(future.get(), sameInstance(cuboid));
    }
    assertThat(cube.getCuboid(AB, X).get(), sameInstance(cuboid));
    assertThat(count.get(), is(1));
    assertThat(cube.stats().missCount(), is(1L));
    assertThat(cube.stats().hitCount(), is(5L));
  }

  @Test void testSingleFlightConcurrent() throws Exception {
    final SettableFuture<Cuboid> pending = SettableFuture.create();
    final AtomicInteger count = new AtomicInteger();
    final DynamicCube cube = cube((key, measureIds) -> {
      count.incrementAndGet();
      return pending;
    });
    final int threadCount = 8;
    final ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(threadCount));
    try {
      final CountDownLatch start = new CountDownLatch(1);
      final List<ListenableFuture<ListenableFuture<Cuboid>>> calls =
          new ArrayList<>();
      for (int i = 0; i < threadCount; i++) {
        calls.add(
            executor.submit(() -> {
              start.await();
              return cube.getCuboid(ImmutableList.of("b", "a"), X);
            }));
      }
      start.countDown();
      final List<ListenableFuture<Cuboid>> futures =
          Futures.allAsList(calls).get(10, TimeUnit.SECONDS);
      pending.set(Cuboid.ofRows(cube.key(AB, X), ImmutableList.of()));
      for (ListenableFuture<Cuboid> future : futures) {
        assertThat(future.get(10, TimeUnit.SECONDS).key,
            is(cube.key(AB, X)));
      }
      assertThat(count.get(), is(1));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test void testCanonicalKey() {
    final CountingComputer computer = new CountingComputer();
    final DynamicCube cube = cube(computer);
    cube.getCuboid(ImmutableList.of("b", "a"), ImmutableList.of("y", "x"));
    cube.getCuboid(AB, ImmutableList.of("x", "y"));
    assertThat(computer.count.get(), is(1));
    // a raw cuboid over the same dimensions is a different entry
    cube.getCuboid(AB, ImmutableList.of());
    assertThat(computer.count.get(), is(2));
    assertThat(cube.size(), is(2L));
  }

  @Test void testFailureIsEvicted() throws Exception {
    final AtomicInteger count = new AtomicInteger();
    final DynamicCube cube = cube((key, measureIds) -> {
      if (count.incrementAndGet() == 1) {
        return Futures.immediateFailedFuture(
            new IllegalStateException("store unavailable"));
      }
      return Futures.immediateFuture(Cuboid.ofRows(key, ImmutableList.of()));
    });
    final ListenableFuture<Cuboid> first = cube.getCuboid(AB, X);
    final ExecutionException e =
        assertThrows(ExecutionException.class, first::get);
    assertThat(e.getCause().getMessage(), is("store unavailable"));
    assertThat(cube.size(), is(0L));

    final Cuboid cuboid = cube.getCuboid(AB, X).get();
    assertThat(cuboid.key, is(cube.key(AB, X)));
    assertThat(count.get(), is(2));
  }

  @Test void testPendingFailureReachesEveryCaller() {
    final SettableFuture<Cuboid> pending = SettableFuture.create();
    final DynamicCube cube = cube((key, measureIds) -> pending);
    final ListenableFuture<Cuboid> f1 = cube.getCuboid(AB, X);
    final ListenableFuture<Cuboid> f2 = cube.getCuboid(AB, X);
    assertThat(cube.size(), is(1L));
    pending.setException(new IllegalStateException("timeout"));
    assertThrows(ExecutionException.class, f1::get);
    assertThrows(ExecutionException.class, f2::get);
    assertThat(cube.size(), is(0L));
  }

  @Test void testSynchronousThrow() {
    final AtomicInteger count = new AtomicInteger();
    final DynamicCube cube = cube((key, measureIds) -> {
      count.incrementAndGet();
      throw new IllegalArgumentException("no such table");
    });
    final ExecutionException e =
        assertThrows(ExecutionException.class,
            () -> cube.getCuboid(AB, X).get());
    assertThat(e.getCause(), instanceOf(CuboidComputeException.class));
    assertThat(((CuboidComputeException) e.getCause()).key,
        is(cube.key(AB, X)));
    assertThat(e.getCause().getCause().getMessage(), is("no such table"));
    assertThat(cube.size(), is(0L));
    assertThrows(ExecutionException.class,
        () -> cube.getCuboid(AB, X).get());
    assertThat(count.get(), is(2));
  }

  @Test void testLeastRecentlyUsedEviction() {
    final CountingComputer computer = new CountingComputer();
    final DynamicCube cube = new DynamicCube(computer, Ordering.natural(), 2);
    final List<String> a = ImmutableList.of("a");
    final List<String> b = ImmutableList.of("b");
    final List<String> c = ImmutableList.of("c");
    cube.getCuboid(a, X);
    cube.getCuboid(b, X);
    cube.getCuboid(a, X);
    assertThat(computer.count.get(), is(2));
    // "b" is least recently used
    cube.getCuboid(c, X);
    assertThat(computer.count.get(), is(3));
    assertThat(cube.size(), is(2L));
    cube.getCuboid(a, X);
    assertThat(computer.count.get(), is(3));
    cube.getCuboid(b, X);
    assertThat(computer.count.get(), is(4));
  }

  @Test void testCancelDoesNotCancelSharedComputation() throws Exception {
    final SettableFuture<Cuboid> pending = SettableFuture.create();
    final DynamicCube cube = cube((key, measureIds) -> pending);
    final CancelFlag cancelFlag = new CancelFlag();
    final ListenableFuture<Cuboid> f1 = cube.getCuboid(AB, X, cancelFlag);
    final ListenableFuture<Cuboid> f2 = cube.getCuboid(AB, X);
    final ListenableFuture<Cuboid> f3 = cube.getCuboid(AB, X);

    cancelFlag.requestCancel();
    assertThat(f1.isCancelled(), is(true));
    f3.cancel(true);
    assertThat(f3.isCancelled(), is(true));
    assertThat(pending.isCancelled(), is(false));
    assertThat(f2.isDone(), is(false));

    final Cuboid cuboid = Cuboid.ofRows(cube.key(AB, X), ImmutableList.of());
    pending.set(cuboid);
    assertThat(f2.get(), sameInstance(cuboid));
    assertThat(cube.size(), is(1L));
  }

  @Test void testCancelledFlag() {
    final SettableFuture<Cuboid> pending = SettableFuture.create();
    final DynamicCube cube = cube((key, measureIds) -> pending);
    final CancelFlag cancelFlag = new CancelFlag();
    cancelFlag.requestCancel();
    assertThat(cube.getCuboid(AB, X, cancelFlag).isCancelled(), is(true));
    assertThat(pending.isCancelled(), is(false));
  }

  @Test void testInvalidateAll() {
    final CountingComputer computer = new CountingComputer();
    final DynamicCube cube = cube(computer);
    cube.getCuboid(AB, X);
    cube.invalidateAll();
    assertThat(cube.size(), is(0L));
    cube.getCuboid(AB, X);
    assertThat(computer.count.get(), is(2));
  }
}

// End DynamicCubeTest.java
