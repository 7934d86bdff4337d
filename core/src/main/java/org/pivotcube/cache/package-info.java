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

/**
 * Cache of cuboids, computed on demand.
 *
 * <p>{@link org.pivotcube.cache.DynamicCube} holds the future result of each
 * computation, so that concurrent requests for the same cuboid share it. The
 * computation itself is delegated to a
 * {@link org.pivotcube.cache.CuboidComputer}, which may scan local records
 * ({@link org.pivotcube.cache.LocalCuboidComputer}) or query a remote store.
 */
package org.pivotcube.cache;

// End package-info.java
