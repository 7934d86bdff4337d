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

import org.pivotcube.data.Values;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Node in a hierarchical index of the distinct dimension-value prefixes of a
 * data source.
 *
 * <p>The root's id is a label; the id of a node at depth d is the value of
 * the d-th indexed dimension. The path of ids from the root (exclusive) to a
 * node at depth d is a distinct tuple of the first d dimension values.
 *
 * <p>A node is immutable. Methods such as {@link #withExpanded} return a new
 * node, or this node if nothing changed, so that trees held by other threads
 * remain valid. Use {@link NestTrees} to transform whole trees.
 */
public class NestTree {
  public final @Nullable Object id;
  public final ImmutableList<NestTree> children;
  public final boolean expanded;
  public final boolean highlighted;

  NestTree(@Nullable Object id, ImmutableList<NestTree> children,
      boolean expanded, boolean highlighted) {
    this.id = id;
    this.children = Objects.requireNonNull(children, "children");
    this.expanded = expanded;
    this.highlighted = highlighted;
  }

  /** Creates a collapsed, un-highlighted node. */
  public static NestTree of(@Nullable Object id, List<NestTree> children) {
    return new NestTree(id, ImmutableList.copyOf(children), false, false);
  }

  /** Creates a collapsed, un-highlighted node with no children. */
  public static NestTree leaf(@Nullable Object id) {
    return new NestTree(id, ImmutableList.of(), false, false);
  }

  /** Returns whether the index found further distinct values below this
   * node. */
  public boolean hasChildren() {
    return !children.isEmpty();
  }

  /** Returns the canonical key of this node's id. */
  public @Nullable String key() {
    return Values.key(id);
  }

  public NestTree withExpanded(boolean expanded) {
    if (expanded == this.expanded) {
      return this;
    }
    return new NestTree(id, children, expanded, highlighted);
  }

  public NestTree withHighlighted(boolean highlighted) {
    if (highlighted == this.highlighted) {
      return this;
    }
    return new NestTree(id, children, expanded, highlighted);
  }

  /** Returns a copy of this node with different children. Returns this node
   * if every child is the same object as before. */
  public NestTree withChildren(List<NestTree> children) {
    if (sameElements(children, this.children)) {
      return this;
    }
    return new NestTree(id, ImmutableList.copyOf(children), expanded,
        highlighted);
  }

  private static boolean sameElements(List<NestTree> list0,
      List<NestTree> list1) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }

  @Override public int hashCode() {
    return Objects.hash(key(), children, expanded, highlighted);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof NestTree
        && Values.equal(id, ((NestTree) obj).id)
        && expanded == ((NestTree) obj).expanded
        && highlighted == ((NestTree) obj).highlighted
        && children.equals(((NestTree) obj).children);
  }

  /** Returns a compact description, for example "All[a[x, y], b]". Expanded
   * nodes are marked "+", highlighted nodes "*". */
  @Override public String toString() {
    final StringBuilder buf = new StringBuilder();
    describe(buf);
    return buf.toString();
  }

  private void describe(StringBuilder buf) {
    buf.append(id);
    if (expanded) {
      buf.append('+');
    }
    if (highlighted) {
      buf.append('*');
    }
    if (hasChildren()) {
      buf.append('[');
      for (int i = 0; i < children.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        children.get(i).describe(buf);
      }
      buf.append(']');
    }
  }
}

// End NestTree.java
