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
package org.pivotcube.tree;

import org.pivotcube.data.Field;
import org.pivotcube.data.Row;
import org.pivotcube.data.Values;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link NestTree} and {@link NestTrees}.
 */
class NestTreesTest {
  private static final List<Row> ROWS =
      ImmutableList.of(Row.of("a", "x", "b", 1),
          Row.of("a", "x", "b", 2),
          Row.of("a", "y", "b", 1),
          Row.of("a", "x", "b", 1));

  private static NestTree tree() {
    return NestTrees.buildIndex(ROWS, ImmutableList.of("a", "b"), "All");
  }

  @Test void testBuildIndex() {
    final NestTree tree = tree();
    assertThat(tree.toString(), is("All[x[1, 2], y[1]]"));
    assertThat(tree.expanded, is(false));
    assertThat(tree.highlighted, is(false));
    // one leaf per distinct tuple
    assertThat(NestTrees.leafCount(tree), is(3));
  }

  @Test void testBuildIndexEmpty() {
    assertThat(NestTrees.buildIndex(ROWS, ImmutableList.of(), "All")
        .hasChildren(), is(false));
    assertThat(NestTrees.buildIndex(ImmutableList.of(),
        ImmutableList.of("a"), "All").toString(), is("All"));
  }

  @Test void testDefaultRootLabel() {
    final NestTree tree =
        NestTrees.buildIndex(ROWS, ImmutableList.of("a"));
    assertThat(tree.id, is((Object) "All"));
  }

  @Test void testBuildIndexCanonicalValues() {
    final List<Row> rows =
        ImmutableList.of(Row.of("y", 2020), Row.of("y", "2020"),
            Row.of("y", 2020.0d), Row.of("y", 2021L));
    final NestTree tree =
        NestTrees.buildIndex(rows, ImmutableList.of("y"), "All");
    assertThat(tree.toString(), is("All[2020, 2021]"));
    assertThat(tree.children.get(0).id, is((Object) 2020));
  }

  @Test void testSort() {
    final List<Row> rows =
        ImmutableList.of(Row.of("a", "b", "b", 10),
            Row.of("a", "b", "b", 2),
            Row.of("a", "a", "b", 1));
    final NestTree tree =
        NestTrees.buildIndex(rows, ImmutableList.of("a", "b"), "All");
    assertThat(tree.toString(), is("All[b[10, 2], a[1]]"));
    final NestTree sorted =
        NestTrees.sort(tree, Field.of(ImmutableList.of("a", "b")));
    assertThat(sorted.toString(), is("All[a[1], b[2, 10]]"));
    assertThat(NestTrees.sort(sorted, Field.of(ImmutableList.of("a", "b"))),
        sameInstance(sorted));
    // original is unchanged
    assertThat(tree.toString(), is("All[b[10, 2], a[1]]"));
  }

  @Test void testSortWithComparator() {
    final List<Row> rows =
        ImmutableList.of(Row.of("a", "p", "b", 1),
            Row.of("a", "q", "b", 2),
            Row.of("a", "q", "b", 3));
    final NestTree tree =
        NestTrees.buildIndex(rows, ImmutableList.of("a", "b"), "All");
    final List<Field> fields =
        ImmutableList.of(Field.of("a", Values.ORDERING.reversed()));
    // level 1 has no field, so uses the default ordering
    assertThat(NestTrees.sort(tree, fields).toString(),
        is("All[q[2, 3], p[1]]"));
  }

  @Test void testVisitPathsCollapsed() {
    assertThat(NestTrees.visitPaths(tree(), false).toString(), is("[[]]"));
    assertThat(NestTrees.visitPaths(tree(), true).toString(), is("[[]]"));
  }

  @Test void testVisitPathsExpanded() {
    final NestTree tree = NestTrees.expandAll(tree());
    assertThat(NestTrees.visitPaths(tree, false).toString(),
        is("[[x, 1], [x, 2], [y, 1]]"));
    assertThat(NestTrees.visitPaths(tree, true).toString(),
        is("[[], [x], [x, 1], [x, 2], [y], [y, 1]]"));
  }

  @Test void testVisitPathsPartlyExpanded() {
    final NestTree tree =
        NestTrees.toggleExpanded(
            NestTrees.toggleExpanded(tree(), ImmutableList.of()),
            ImmutableList.of(1));
    assertThat(tree.toString(), is("All+[x[1, 2], y+[1]]"));
    assertThat(NestTrees.visitPaths(tree, false).toString(),
        is("[[x], [y, 1]]"));
  }

  @Test void testToggleExpandedSharesStructure() {
    final NestTree tree = NestTrees.expandAll(tree());
    final NestTree toggled =
        NestTrees.toggleExpanded(tree, ImmutableList.of(0));
    assertThat(toggled.children.get(0).expanded, is(false));
    assertThat(tree.children.get(0).expanded, is(true));
    assertThat(toggled.children.get(1), sameInstance(tree.children.get(1)));
    assertThat(toggled.children.get(0).children,
        sameInstance(tree.children.get(0).children));
    assertThat(NestTrees.toggleExpanded(toggled, ImmutableList.of(0)),
        is(tree));
  }

  @Test void testToggleExpandedOutOfRange() {
    assertThrows(IndexOutOfBoundsException.class,
        () -> NestTrees.toggleExpanded(tree(), ImmutableList.of(2)));
    assertThrows(IndexOutOfBoundsException.class,
        () -> NestTrees.toggleExpanded(tree(), ImmutableList.of(0, 0, 0)));
  }

  @Test void testSetExpanded() {
    final NestTree tree = tree();
    final NestTree expanded =
        NestTrees.setExpanded(tree, ImmutableList.of("y"), true);
    assertThat(expanded.toString(), is("All[x[1, 2], y+[1]]"));
    assertThat(NestTrees.setExpanded(tree, ImmutableList.of("z"), true),
        sameInstance(tree));
  }

  @Test void testHighlight() {
    final NestTree tree = tree();
    final NestTree highlighted =
        NestTrees.highlightPath(tree, ImmutableList.of("x", "1"));
    assertThat(highlighted.toString(), is("All*[x*[1*, 2], y[1]]"));
    assertThat(highlighted, not(tree));
    assertThat(highlighted.children.get(1), sameInstance(tree.children.get(1)));

    final NestTree cleared = NestTrees.clearHighlight(highlighted);
    assertThat(cleared, is(tree));
    assertThat(cleared.toString(), is("All[x[1, 2], y[1]]"));

    final NestTree rehighlighted =
        NestTrees.rehighlight(highlighted, ImmutableList.of("y"));
    assertThat(rehighlighted.toString(), is("All*[x[1, 2], y*[1]]"));
  }

  @Test void testHighlightOffTree() {
    final NestTree highlighted =
        NestTrees.highlightPath(tree(), ImmutableList.of("x", 7));
    assertThat(highlighted.toString(), is("All*[x*[1, 2], y[1]]"));
  }
}

// End NestTreesTest.java
