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
package org.pivotcube.util;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CancelFlag is used to post and check cancellation requests.
 *
 * <p>One flag is typically created per pivot reconfiguration. When the user
 * changes the axes again, the previous flag is cancelled, and every future
 * registered with it is cancelled too. Registered futures should be
 * per-caller views (see
 * {@link com.google.common.util.concurrent.Futures#nonCancellationPropagating}),
 * so that cancellation never reaches a computation shared with other callers.
 */
public class CancelFlag {
  //~ Instance fields --------------------------------------------------------

  /** The flag that holds the cancel state. */
  private final AtomicBoolean atomicBoolean;

  /** Futures to cancel when cancellation is requested. A future is removed
   * when it completes. Guarded by itself. */
  private final Set<Future<?>> futures = Sets.newIdentityHashSet();

  public CancelFlag() {
    this.atomicBoolean = new AtomicBoolean();
  }

  //~ Methods ----------------------------------------------------------------

  /**
   * Returns whether a cancellation has been requested.
   */
  public boolean isCancelRequested() {
    return atomicBoolean.get();
  }

  /**
   * Requests a cancellation, and cancels every registered future.
   */
  public void requestCancel() {
    if (atomicBoolean.compareAndSet(false, true)) {
      final List<Future<?>> toCancel;
      synchronized (futures) {
        toCancel = new ArrayList<>(futures);
        futures.clear();
      }
      for (Future<?> future : toCancel) {
        future.cancel(false);
      }
    }
  }

  /**
   * Registers a future to be cancelled when cancellation is requested.
   * If cancellation has already been requested, cancels it immediately.
   * The flag forgets the future once it completes.
   *
   * @return the future, for chaining
   */
  public <F extends ListenableFuture<?>> F register(F future) {
    final boolean registered;
    synchronized (futures) {
      registered = !atomicBoolean.get();
      if (registered) {
        futures.add(future);
      }
    }
    if (!registered) {
      future.cancel(false);
      return future;
    }
    future.addListener(() -> {
      synchronized (futures) {
        futures.remove(future);
      }
    }, MoreExecutors.directExecutor());
    return future;
  }

  /** Returns the number of registered futures that have not completed. */
  @VisibleForTesting int registeredCount() {
    synchronized (futures) {
      return futures.size();
    }
  }
}

// End CancelFlag.java
