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
package org.pivotcube.runtime;

import org.pivotcube.cuboid.CuboidKey;

/**
 * Thrown when a {@link org.pivotcube.cache.CuboidComputer} fails
 * synchronously, instead of returning a failed future.
 */
public class CuboidComputeException extends PivotException {
  private static final long serialVersionUID = -2276187061493410928L;

  /** The key of the cuboid that could not be computed. */
  public final CuboidKey key;

  public CuboidComputeException(CuboidKey key, Throwable cause) {
    super("Error while computing cuboid [" + key + "]", cause);
    this.key = key;
  }
}

// End CuboidComputeException.java
