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

import com.google.common.util.concurrent.ListenableFuture;

import java.util.List;

/**
 * Computes a cuboid, typically by querying a remote store or by scanning a
 * local data source.
 *
 * <p>Called by {@link DynamicCube} at most once per key while the key is
 * cached, and possibly concurrently for different keys. An implementation
 * should report failure by returning a failed future; if it throws, the
 * exception is wrapped in a
 * {@link org.pivotcube.runtime.CuboidComputeException}.
 */
@FunctionalInterface
public interface CuboidComputer {
  /** Starts computing a cuboid.
   *
   * @param key Dimensions and measures of the cuboid
   * @param measureIds Measure ids as the caller requested them; empty for a
   *   raw cuboid
   * @return Future cuboid whose key is {@code key}
   */
  ListenableFuture<Cuboid> computeCuboid(CuboidKey key,
      List<String> measureIds);
}

// End CuboidComputer.java
