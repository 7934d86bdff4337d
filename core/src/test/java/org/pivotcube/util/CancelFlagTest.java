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

import com.google.common.util.concurrent.SettableFuture;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Unit tests for {@link CancelFlag}.
 */
class CancelFlagTest {
  @Test void testRequestCancel() {
    final CancelFlag cancelFlag = new CancelFlag();
    final SettableFuture<String> f1 = SettableFuture.create();
    cancelFlag.register(f1);
    final SettableFuture<String> f2 = SettableFuture.create();
    f2.set("done");
    cancelFlag.register(f2);
    assertThat(cancelFlag.isCancelRequested(), is(false));
    cancelFlag.requestCancel();
    assertThat(cancelFlag.isCancelRequested(), is(true));
    assertThat(f1.isCancelled(), is(true));
    assertThat(f2.isCancelled(), is(false));
  }

  @Test void testCompletedFutureIsForgotten() {
    final CancelFlag cancelFlag = new CancelFlag();
    final SettableFuture<String> pending = SettableFuture.create();
    cancelFlag.register(pending);
    final SettableFuture<String> done = SettableFuture.create();
    cancelFlag.register(done);
    assertThat(cancelFlag.registeredCount(), is(2));
    done.set("done");
    assertThat(cancelFlag.registeredCount(), is(1));

    // a future that is already complete is never retained
    final SettableFuture<String> early = SettableFuture.create();
    early.set("early");
    cancelFlag.register(early);
    assertThat(cancelFlag.registeredCount(), is(1));

    pending.set("later");
    assertThat(cancelFlag.registeredCount(), is(0));
    cancelFlag.requestCancel();
    assertThat(pending.isCancelled(), is(false));
  }

  @Test void testRegisterAfterCancel() {
    final CancelFlag cancelFlag = new CancelFlag();
    cancelFlag.requestCancel();
    final SettableFuture<String> f = SettableFuture.create();
    assertThat(cancelFlag.register(f).isCancelled(), is(true));
  }
}

// End CancelFlagTest.java
