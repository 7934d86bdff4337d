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

import org.pivotcube.data.Row;
import org.pivotcube.runtime.PivotException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Row-major matrix of the records in each cell of a pivot table.
 *
 * <p>Cell (i, j) is the intersection of row leaf path i and column leaf path
 * j. If the visualization type draws one value per cell, each cell holds at
 * most one record, and {@link #singleRow} is the natural accessor; otherwise
 * a cell holds the list of aggregate records for its facet values.
 *
 * <p>A cell whose query failed holds no records, and reports the cause
 * through {@link #failure}; the other cells are unaffected.
 */
public class CrossMatrix {
  public final VisType visType;
  private final int rowCount;
  private final int columnCount;
  private final ImmutableList<ImmutableList<Row>> cells;
  private final List<@Nullable Throwable> failures;

  CrossMatrix(VisType visType, int rowCount, int columnCount,
      List<? extends List<Row>> cells,
      List<? extends @Nullable Throwable> failures) {
    Preconditions.checkArgument(cells.size() == rowCount * columnCount,
        "expected %s cells, got %s", rowCount * columnCount, cells.size());
    Preconditions.checkArgument(failures.size() == cells.size(),
        "expected %s failures, got %s", cells.size(), failures.size());
    this.visType = visType;
    this.rowCount = rowCount;
    this.columnCount = columnCount;
    final ImmutableList.Builder<ImmutableList<Row>> builder =
        ImmutableList.builder();
    for (List<Row> cell : cells) {
      if (!visType.isListPerCell() && cell.size() > 1) {
        builder.add(ImmutableList.of(cell.get(0)));
      } else {
        builder.add(ImmutableList.copyOf(cell));
      }
    }
    this.cells = builder.build();
    this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
  }

  public int rowCount() {
    return rowCount;
  }

  public int columnCount() {
    return columnCount;
  }

  /** Returns whether each cell holds at most one record. */
  public boolean isSingleValued() {
    return !visType.isListPerCell();
  }

  /** Returns whether the query of any cell failed. */
  public boolean hasFailures() {
    for (Throwable failure : failures) {
      if (failure != null) {
        return true;
      }
    }
    return false;
  }

  /** Returns why the query of a cell failed, or null if it succeeded. */
  public @Nullable Throwable failure(int row, int column) {
    return failures.get(index(row, column));
  }

  /** Returns the records of a cell; empty if no record matched.
   *
   * @throws PivotException if the query of the cell failed
   */
  public ImmutableList<Row> rows(int row, int column) {
    final int index = index(row, column);
    final Throwable failure = failures.get(index);
    if (failure != null) {
      throw new PivotException("Cell (" + row + ", " + column + ") failed",
          failure);
    }
    return cells.get(index);
  }

  private int index(int row, int column) {
    Preconditions.checkElementIndex(row, rowCount, "row");
    Preconditions.checkElementIndex(column, columnCount, "column");
    return row * columnCount + column;
  }

  /** Returns the first record of a cell, or null if no record matched.
   *
   * @throws PivotException if the query of the cell failed
   */
  public @Nullable Row singleRow(int row, int column) {
    final List<Row> list = rows(row, column);
    return list.isEmpty() ? null : list.get(0);
  }

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append(visType).append('[');
    for (int i = 0; i < rowCount; i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append('[');
      for (int j = 0; j < columnCount; j++) {
        if (j > 0) {
          buf.append(", ");
        }
        final int index = i * columnCount + j;
        if (failures.get(index) != null) {
          buf.append("!failed");
        } else {
          buf.append(cells.get(index));
        }
      }
      buf.append(']');
    }
    return buf.append(']').toString();
  }
}

// End CrossMatrix.java
