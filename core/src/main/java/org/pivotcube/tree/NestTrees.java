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

import org.pivotcube.config.PivotSystemProperty;
import org.pivotcube.data.Field;
import org.pivotcube.data.Row;
import org.pivotcube.data.Values;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Utilities that build and transform {@link NestTree}s.
 *
 * <p>Every transform returns a new tree and leaves its argument unchanged.
 * Subtrees that a transform does not touch are shared, by reference, between
 * the old and new trees.
 */
public final class NestTrees {
  private NestTrees() {}

  //~ Building -------------------------------------------------------------

  /** Builds an index of the distinct prefixes of dimension values, with the
   * root label from {@link PivotSystemProperty#TREE_ROOT_LABEL}. */
  public static NestTree buildIndex(List<Row> dataSource,
      List<String> dimensionIds) {
    return buildIndex(dataSource, dimensionIds,
        PivotSystemProperty.TREE_ROOT_LABEL.value());
  }

  /** Builds an index of the distinct prefixes of dimension values.
   *
   * <p>Inserts each record's tuple of values into a trie, in one pass.
   * Children appear in the order their value was first seen; call
   * {@link #sort} to order them. An empty data source or an empty list of
   * dimensions gives a root with no children. */
  public static NestTree buildIndex(List<Row> dataSource,
      List<String> dimensionIds, String rootLabel) {
    final TrieNode root = new TrieNode(rootLabel);
    for (Row row : dataSource) {
      TrieNode node = root;
      for (String dimensionId : dimensionIds) {
        final Object value = row.get(dimensionId);
        node = node.children.computeIfAbsent(Values.key(value),
            k -> new TrieNode(value));
      }
    }
    return root.freeze();
  }

  /** Mutable trie node; exists only while an index is being built. */
  private static class TrieNode {
    final @Nullable Object value;
    final Map<@Nullable String, TrieNode> children = new LinkedHashMap<>();

    TrieNode(@Nullable Object value) {
      this.value = value;
    }

    NestTree freeze() {
      if (children.isEmpty()) {
        return NestTree.leaf(value);
      }
      final ImmutableList.Builder<NestTree> list = ImmutableList.builder();
      for (TrieNode child : children.values()) {
        list.add(child.freeze());
      }
      return NestTree.of(value, list.build());
    }
  }

  //~ Sorting --------------------------------------------------------------

  /** Sorts each level of a tree.
   *
   * <p>The children of the root (level 0) are sorted by the ordering of
   * {@code fields[0]}, their children by {@code fields[1]}, and so forth.
   * Levels beyond the end of {@code fields} use {@link Values#ORDERING}. The
   * sort is stable; sorting a sorted tree returns the same tree. */
  public static NestTree sort(NestTree tree, List<Field> fields) {
    return sort(tree, fields, 0);
  }

  private static NestTree sort(NestTree tree, List<Field> fields, int depth) {
    if (!tree.hasChildren()) {
      return tree;
    }
    final Comparator<@Nullable Object> comparator =
        depth < fields.size() ? fields.get(depth).ordering() : Values.ORDERING;
    final List<NestTree> sorted =
        Ordering.from(comparator).<NestTree>onResultOf(child -> child.id)
            .immutableSortedCopy(tree.children);
    final List<NestTree> children = new ArrayList<>(sorted.size());
    for (NestTree child : sorted) {
      children.add(sort(child, fields, depth + 1));
    }
    return tree.withChildren(children);
  }

  //~ Traversal ------------------------------------------------------------

  /** Returns the value paths of a tree, in depth-first pre-order.
   *
   * <p>The root's path is empty. Children are visited only if their parent
   * is expanded and has children.
   *
   * @param tree Tree
   * @param includeAllVisited If true, every visited node contributes its
   *   path (so an axis can show a subtotal at every level); if false, only
   *   nodes that are collapsed or childless do
   */
  public static List<List<@Nullable Object>> visitPaths(NestTree tree,
      boolean includeAllVisited) {
    final List<List<@Nullable Object>> paths = new ArrayList<>();
    visit(tree, new ArrayList<>(), includeAllVisited, paths);
    return Collections.unmodifiableList(paths);
  }

  private static void visit(NestTree node, List<@Nullable Object> path,
      boolean includeAllVisited, List<List<@Nullable Object>> paths) {
    final boolean descend = node.expanded && node.hasChildren();
    if (includeAllVisited || !descend) {
      paths.add(Collections.unmodifiableList(new ArrayList<>(path)));
    }
    if (descend) {
      for (NestTree child : node.children) {
        path.add(child.id);
        visit(child, path, includeAllVisited, paths);
        path.remove(path.size() - 1);
      }
    }
  }

  /** Returns the number of nodes that have no children. */
  public static int leafCount(NestTree tree) {
    if (!tree.hasChildren()) {
      return 1;
    }
    int count = 0;
    for (NestTree child : tree.children) {
      count += leafCount(child);
    }
    return count;
  }

  //~ Highlighting ---------------------------------------------------------

  /** Highlights every node on the path from the root towards the node
   * identified by {@code valuePath}.
   *
   * <p>The root is always highlighted. Values are matched to node ids by
   * canonical key, so the number 3 matches a node whose id is "3". If the
   * path leaves the tree, the nodes matched so far are highlighted.
   * Highlights already in the tree are kept; use {@link #rehighlight} to
   * derive highlight state afresh. */
  public static NestTree highlightPath(NestTree tree, List<?> valuePath) {
    return highlight(tree, valuePath, 0);
  }

  private static NestTree highlight(NestTree node, List<?> valuePath,
      int depth) {
    NestTree result = node.withHighlighted(true);
    if (depth < valuePath.size() && node.hasChildren()) {
      final String key = Values.key(valuePath.get(depth));
      final List<NestTree> children = new ArrayList<>(node.children);
      for (int i = 0; i < children.size(); i++) {
        if (Objects.equals(children.get(i).key(), key)) {
          children.set(i, highlight(children.get(i), valuePath, depth + 1));
        }
      }
      result = result.withChildren(children);
    }
    return result;
  }

  /** Clears the highlight flag of every node. */
  public static NestTree clearHighlight(NestTree tree) {
    if (!tree.hasChildren()) {
      return tree.withHighlighted(false);
    }
    final List<NestTree> children = new ArrayList<>(tree.children.size());
    for (NestTree child : tree.children) {
      children.add(clearHighlight(child));
    }
    return tree.withHighlighted(false).withChildren(children);
  }

  /** Clears all highlights, then highlights one path. */
  public static NestTree rehighlight(NestTree tree, List<?> valuePath) {
    return highlightPath(clearHighlight(tree), valuePath);
  }

  //~ Expanding ------------------------------------------------------------

  /** Flips the {@code expanded} flag of the node reached by following child
   * indexes from the root. An empty index path toggles the root.
   *
   * @throws IndexOutOfBoundsException if an index is out of range
   */
  public static NestTree toggleExpanded(NestTree tree,
      List<Integer> indexPath) {
    return toggle(tree, indexPath, 0);
  }

  private static NestTree toggle(NestTree node, List<Integer> indexPath,
      int depth) {
    if (depth == indexPath.size()) {
      return node.withExpanded(!node.expanded);
    }
    final int index =
        Preconditions.checkElementIndex(indexPath.get(depth),
            node.children.size(), "child index");
    final List<NestTree> children = new ArrayList<>(node.children);
    children.set(index, toggle(children.get(index), indexPath, depth + 1));
    return node.withChildren(children);
  }

  /** Sets the {@code expanded} flag of the node identified by a value path.
   * Returns the tree unchanged if there is no such node. */
  public static NestTree setExpanded(NestTree tree, List<?> valuePath,
      boolean expanded) {
    return setExpanded(tree, valuePath, 0, expanded);
  }

  private static NestTree setExpanded(NestTree node, List<?> valuePath,
      int depth, boolean expanded) {
    if (depth == valuePath.size()) {
      return node.withExpanded(expanded);
    }
    final String key = Values.key(valuePath.get(depth));
    final List<NestTree> children = new ArrayList<>(node.children);
    for (int i = 0; i < children.size(); i++) {
      if (Objects.equals(children.get(i).key(), key)) {
        children.set(i,
            setExpanded(children.get(i), valuePath, depth + 1, expanded));
        return node.withChildren(children);
      }
    }
    return node;
  }

  /** Expands every node that has children. */
  public static NestTree expandAll(NestTree tree) {
    if (!tree.hasChildren()) {
      return tree;
    }
    final List<NestTree> children = new ArrayList<>(tree.children.size());
    for (NestTree child : tree.children) {
      children.add(expandAll(child));
    }
    return tree.withExpanded(true).withChildren(children);
  }
}

// End NestTrees.java
