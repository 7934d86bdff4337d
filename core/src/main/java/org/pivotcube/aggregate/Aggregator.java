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
package org.pivotcube.aggregate;

import org.pivotcube.data.Row;

import java.util.List;

/**
 * Reduces a subset of records to a partial record.
 *
 * <p>The result holds one value for each of the given field ids; a field may
 * be absent if it has no defined aggregate (for example, the mean of no
 * values). Implementations are stateless, and must not modify their
 * arguments.
 *
 * <p>The set of kinds is closed; see {@link AggregatorKind}. Instances are
 * obtained from {@link Aggregators}.
 */
public interface Aggregator {
  /** Returns the kind of this aggregator. */
  AggregatorKind kind();

  /** Returns the name of this aggregator, for example "sum". */
  String name();

  /** Aggregates the given fields over a data source. */
  Row aggregate(List<Row> dataSource, List<String> fieldIds);
}

// End Aggregator.java
