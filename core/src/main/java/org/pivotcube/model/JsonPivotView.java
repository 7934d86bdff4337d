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
package org.pivotcube.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Root element of a pivot view model.
 *
 * <p>For example,
 *
 * <blockquote><pre>{
 *   visType: 'bar',
 *   rows: ['region'],
 *   columns: ['year', 'product'],
 *   measures: [{name: 'sales', agg: 'sum'}]
 * }</pre></blockquote>
 *
 * @see PivotModelHandler
 */
public class JsonPivotView {
  /** Visualization type of each cell: {@code number}, {@code bar},
   * {@code line} or {@code scatter}.
   *
   * <p>Optional; default {@code number}.
   */
  public String visType = "number";

  /** Ids of the dimensions on the row axis, outermost first. */
  public List<String> rows = new ArrayList<>();

  /** Ids of the dimensions on the column axis, outermost first. */
  public List<String> columns = new ArrayList<>();

  public List<JsonPivotMeasure> measures = new ArrayList<>();
}

// End JsonPivotView.java
