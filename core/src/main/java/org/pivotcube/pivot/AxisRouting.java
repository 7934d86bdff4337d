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
package org.pivotcube.pivot;

import org.pivotcube.data.Measure;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Assignment of the fields of a pivot view to the parts of a table: the
 * nested row and column axes, the dimensions drawn inside each cell, and
 * the measures that are queried and shown.
 *
 * @see #derive
 */
public class AxisRouting {
  public final ImmutableList<String> nestRows;
  public final ImmutableList<String> nestColumns;
  /** Dimensions drawn inside a cell; each becomes a wildcard step in the
   * cell's query. */
  public final ImmutableList<String> facetFields;
  /** Measures queried for each cell. */
  public final ImmutableList<Measure> facetMeasures;
  /** Measures drawn in each cell. */
  public final ImmutableList<Measure> viewMeasures;

  private AxisRouting(List<String> nestRows, List<String> nestColumns,
      List<String> facetFields, List<Measure> facetMeasures,
      List<Measure> viewMeasures) {
    this.nestRows = ImmutableList.copyOf(nestRows);
    this.nestColumns = ImmutableList.copyOf(nestColumns);
    this.facetFields = ImmutableList.copyOf(facetFields);
    this.facetMeasures = ImmutableList.copyOf(facetMeasures);
    this.viewMeasures = ImmutableList.copyOf(viewMeasures);
  }

  /** Routes the fields of a view.
   *
   * <ul>
   * <li>{@link VisType#NUMBER}: every column is a pivot column; there are
   *   no facet fields; every measure is shown.
   * <li>{@link VisType#BAR}, {@link VisType#LINE}: the last column is the
   *   facet field, and the others are pivot columns; every measure is shown.
   * <li>{@link VisType#SCATTER}: columns as for BAR; only the last measure
   *   is shown.
   * </ul>
   *
   * <p>Rows are always pivot rows, and every measure is always queried.
   */
  public static AxisRouting derive(VisType visType, List<String> rows,
      List<String> columns, List<Measure> measures) {
    switch (visType) {
    case NUMBER:
      return new AxisRouting(rows, columns, ImmutableList.of(), measures,
          measures);
    case BAR:
    case LINE:
      return new AxisRouting(rows, allButLast(columns), last(columns),
          measures, measures);
    case SCATTER:
      return new AxisRouting(rows, allButLast(columns), last(columns),
          measures, last(measures));
    default:
      throw new AssertionError("unknown vis type " + visType);
    }
  }

  private static <E> List<E> allButLast(List<E> list) {
    return list.isEmpty() ? list : list.subList(0, list.size() - 1);
  }

  private static <E> List<E> last(List<E> list) {
    return list.isEmpty() ? list : list.subList(list.size() - 1, list.size());
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("nestRows", nestRows)
        .add("nestColumns", nestColumns)
        .add("facetFields", facetFields)
        .add("facetMeasures", facetMeasures)
        .add("viewMeasures", viewMeasures)
        .toString();
  }
}

// End AxisRouting.java
