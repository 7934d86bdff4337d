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

import org.pivotcube.cache.CuboidComputer;
import org.pivotcube.cache.DynamicCube;
import org.pivotcube.config.PivotSystemProperty;
import org.pivotcube.cuboid.Cuboid;
import org.pivotcube.cuboid.Queries;
import org.pivotcube.cuboid.QueryPath;
import org.pivotcube.data.Field;
import org.pivotcube.data.Filter;
import org.pivotcube.data.Measure;
import org.pivotcube.data.Row;
import org.pivotcube.tree.NestTree;
import org.pivotcube.tree.NestTrees;
import org.pivotcube.util.CancelFlag;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * Answers the queries of a pivot table from a {@link DynamicCube}.
 *
 * <p>Each query is routed to the cuboid whose dimensions are exactly the
 * dimensions the query names. Cuboids are computed on first use by a
 * {@link CuboidComputer} and shared by later queries.
 *
 * <p>It is thread-safe.
 */
public class AsyncCacheCube {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(AsyncCacheCube.class);

  private final DynamicCube cube;
  private final Comparator<String> dimensionOrder;

  private AsyncCacheCube(CuboidComputer computer,
      Comparator<String> dimensionOrder, long maximumSize) {
    this.dimensionOrder = dimensionOrder;
    this.cube = new DynamicCube(computer, dimensionOrder, maximumSize);
  }

  public static Builder builder(CuboidComputer computer) {
    return new Builder(computer);
  }

  /** Returns the underlying cache. */
  public DynamicCube cube() {
    return cube;
  }

  //~ Queries --------------------------------------------------------------

  /** Returns the records addressed by a path.
   *
   * <p>The path's steps are sorted by the dimension order; the cuboid over
   * the path's dimensions is fetched (computed if necessary) with the given
   * measures, and the path is resolved against it. */
  public ListenableFuture<List<Row>> cacheQuery(QueryPath path,
      List<String> measureIds) {
    return cacheQuery(path, measureIds, null);
  }

  private ListenableFuture<List<Row>> cacheQuery(QueryPath originPath,
      List<String> measureIds, @Nullable CancelFlag cancelFlag) {
    final QueryPath path = originPath.sort(dimensionOrder);
    final List<String> dimensionIds = path.dimensions();
    final ListenableFuture<Cuboid> cuboid = cancelFlag == null
        ? cube.getCuboid(dimensionIds, measureIds)
        : cube.getCuboid(dimensionIds, measureIds, cancelFlag);
    return Futures.transform(cuboid,
        c -> Queries.queryCube(requireNonNull(c, "cuboid"), path),
        MoreExecutors.directExecutor());
  }

  /** Returns an index over the raw records of a set of fields, sorted by
   * the fields' comparators. */
  public ListenableFuture<NestTree> getCuboidNestTree(List<Field> fields) {
    return getCuboidNestTree(fields, ImmutableList.of());
  }

  /** Returns an index over the raw records of a set of fields, sorted by
   * the fields' comparators.
   *
   * <p>A record is indexed only if every filter on one of {@code fields}
   * allows its value. Filters on other fields are ignored. */
  public ListenableFuture<NestTree> getCuboidNestTree(List<Field> fields,
      List<Filter> filters) {
    final List<String> fieldIds = Field.ids(fields);
    final List<Filter> applicable = new ArrayList<>();
    for (Filter filter : filters) {
      if (fieldIds.contains(filter.id)) {
        applicable.add(filter);
      }
    }
    return Futures.transform(cube.getCuboid(fieldIds, ImmutableList.of()),
        cuboid -> {
          final List<Row> rows = filter(requireNonNull(cuboid, "cuboid").rows(),
              applicable);
          return NestTrees.sort(NestTrees.buildIndex(rows, fieldIds), fields);
        },
        MoreExecutors.directExecutor());
  }

  private static List<Row> filter(List<Row> rows, List<Filter> filters) {
    if (filters.isEmpty()) {
      return rows;
    }
    final List<Row> list = new ArrayList<>();
    outer:
    for (Row row : rows) {
      for (Filter filter : filters) {
        if (!filter.test(row)) {
          continue outer;
        }
      }
      list.add(row);
    }
    return list;
  }

  //~ Cross matrix ---------------------------------------------------------

  /** Assembles the cells of a pivot table.
   *
   * <p>The query for cell (i, j) binds row leaf path i to
   * {@code rowFields}, column leaf path j to {@code columnFields}, and has a
   * wildcard step for each facet field. Cells are queried concurrently. If
   * the query of a cell fails, the matrix still completes, and reports the
   * cause in {@link CrossMatrix#failure}.
   *
   * @param visType Visualization type; decides whether a cell keeps one
   *   record or all of them
   * @param rowLeafPaths Value paths of the row axis, for example from
   *   {@link NestTrees#visitPaths}
   * @param columnLeafPaths Value paths of the column axis
   * @param rowFields Dimensions of the row axis; path element k binds to
   *   field k
   * @param columnFields Dimensions of the column axis
   * @param measureIds Measures to aggregate
   * @param facetFields Dimensions drawn inside each cell
   */
  public ListenableFuture<CrossMatrix> requestCrossMatrix(VisType visType,
      List<? extends List<?>> rowLeafPaths,
      List<? extends List<?>> columnLeafPaths, List<String> rowFields,
      List<String> columnFields, List<String> measureIds,
      List<String> facetFields) {
    return requestCrossMatrix(visType, rowLeafPaths, columnLeafPaths,
        rowFields, columnFields, measureIds, facetFields, null);
  }

  /** As {@link #requestCrossMatrix(VisType, List, List, List, List, List, List)},
   * cancelling the result when cancel is requested on {@code cancelFlag}.
   * Computations that other callers share keep running. */
  public ListenableFuture<CrossMatrix> requestCrossMatrix(VisType visType,
      List<? extends List<?>> rowLeafPaths,
      List<? extends List<?>> columnLeafPaths, List<String> rowFields,
      List<String> columnFields, List<String> measureIds,
      List<String> facetFields, @Nullable CancelFlag cancelFlag) {
    LOGGER.debug("Requesting {}x{} {} matrix; rows {}, columns {}, facets {}",
        rowLeafPaths.size(), columnLeafPaths.size(), visType, rowFields,
        columnFields, facetFields);
    final List<ListenableFuture<List<Row>>> cells = new ArrayList<>();
    for (List<?> rowPath : rowLeafPaths) {
      for (List<?> columnPath : columnLeafPaths) {
        final QueryPath.Builder path = QueryPath.builder()
            .addAll(rowFields, rowPath)
            .addAll(columnFields, columnPath);
        for (String facetField : facetFields) {
          path.addWildcard(facetField);
        }
        cells.add(cacheQuery(path.build(), measureIds, cancelFlag));
      }
    }
    final ListenableFuture<CrossMatrix> matrix =
        Futures.whenAllComplete(cells)
            .callAsync(
                () -> assemble(visType, rowLeafPaths.size(),
                    columnLeafPaths.size(), cells),
                MoreExecutors.directExecutor());
    return cancelFlag == null ? matrix : cancelFlag.register(matrix);
  }

  /** Builds a matrix from cell queries that have all completed. A failed
   * query fails only its own cell; a cancelled query cancels the matrix. */
  private static ListenableFuture<CrossMatrix> assemble(VisType visType,
      int rowCount, int columnCount, List<ListenableFuture<List<Row>>> cells) {
    final List<List<Row>> rows = new ArrayList<>(cells.size());
    final List<@Nullable Throwable> failures = new ArrayList<>(cells.size());
    for (int i = 0; i < cells.size(); i++) {
      final ListenableFuture<List<Row>> cell = cells.get(i);
      if (cell.isCancelled()) {
        return Futures.immediateCancelledFuture();
      }
      try {
        rows.add(Futures.getDone(cell));
        failures.add(null);
      } catch (ExecutionException e) {
        final Throwable cause = MoreObjects.firstNonNull(e.getCause(), e);
        LOGGER.warn("Query for cell ({}, {}) failed", i / columnCount,
            i % columnCount, cause);
        rows.add(ImmutableList.of());
        failures.add(cause);
      }
    }
    return Futures.immediateFuture(
        new CrossMatrix(visType, rowCount, columnCount, rows, failures));
  }

  /** Assembles the cells of a pivot table, routing the view's fields with
   * {@link #deriveAxisRouting}. */
  public ListenableFuture<CrossMatrix> requestCrossMatrix(PivotView view,
      List<? extends List<?>> rowLeafPaths,
      List<? extends List<?>> columnLeafPaths) {
    final AxisRouting routing = view.routing();
    return requestCrossMatrix(view.visType, rowLeafPaths, columnLeafPaths,
        routing.nestRows, routing.nestColumns,
        Measure.ids(routing.facetMeasures), routing.facetFields);
  }

  /** Routes fields to the parts of a table.
   *
   * @see AxisRouting#derive */
  public static AxisRouting deriveAxisRouting(VisType visType,
      List<String> rows, List<String> columns, List<Measure> measures) {
    return AxisRouting.derive(visType, rows, columns, measures);
  }

  /** Builder for {@link AsyncCacheCube}. */
  public static class Builder {
    private final CuboidComputer computer;
    private Comparator<String> dimensionOrder = Ordering.natural();
    private long maximumSize = PivotSystemProperty.CACHE_MAXIMUM_SIZE.value();

    private Builder(CuboidComputer computer) {
      this.computer = requireNonNull(computer, "computer");
    }

    /** Sets the total order over dimension ids that decides the order of a
     * cuboid's dimensions. The default is natural string order. */
    public Builder dimensionOrder(Comparator<String> dimensionOrder) {
      this.dimensionOrder = requireNonNull(dimensionOrder, "dimensionOrder");
      return this;
    }

    /** Sets the maximum number of cuboids cached. */
    public Builder maximumSize(long maximumSize) {
      this.maximumSize = maximumSize;
      return this;
    }

    public AsyncCacheCube build() {
      return new AsyncCacheCube(computer, dimensionOrder, maximumSize);
    }
  }
}

// End AsyncCacheCube.java
