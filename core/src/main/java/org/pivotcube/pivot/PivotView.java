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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of a pivot table: the fields placed on each axis, the
 * measures, and how cells are drawn.
 *
 * <p>It is immutable.
 */
public class PivotView {
  public final VisType visType;
  public final ImmutableList<String> rows;
  public final ImmutableList<String> columns;
  public final ImmutableList<Measure> measures;

  public PivotView(VisType visType, List<String> rows, List<String> columns,
      List<Measure> measures) {
    this.visType = requireNonNull(visType, "visType");
    this.rows = ImmutableList.copyOf(rows);
    this.columns = ImmutableList.copyOf(columns);
    this.measures = ImmutableList.copyOf(measures);
  }

  /** Returns how the fields of this view are routed. */
  public AxisRouting routing() {
    return AxisRouting.derive(visType, rows, columns, measures);
  }

  @Override public int hashCode() {
    return Objects.hash(visType, rows, columns, measures);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof PivotView
        && visType == ((PivotView) obj).visType
        && rows.equals(((PivotView) obj).rows)
        && columns.equals(((PivotView) obj).columns)
        && measures.equals(((PivotView) obj).measures);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("visType", visType)
        .add("rows", rows)
        .add("columns", columns)
        .add("measures", measures)
        .toString();
  }
}

// End PivotView.java
