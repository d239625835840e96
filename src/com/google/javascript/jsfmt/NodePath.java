/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.jsfmt;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.javascript.jsfmt.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * A cursor over an AST that remembers how it got to the current node.
 *
 * <p>Each frame records a node together with the field of its parent it was reached through (and
 * the position within that field when the field is a list). Descending pushes a frame for the
 * duration of a callback and pops it afterwards, so a path always reflects the node currently
 * being printed. A path belongs to a single print call.
 */
final class NodePath {

  /**
   * One frame of a path.
   *
   * @param node the node at this depth
   * @param field the field of the parent holding the node, null for the root
   * @param index the position of the node within a list field, or -1
   */
  record Entry(Node node, @Nullable String field, int index) {
    boolean isField(String name) {
      return name.equals(field);
    }
  }

  private final List<Entry> stack = new ArrayList<>();

  private NodePath(Node root) {
    stack.add(new Entry(checkNotNull(root), null, -1));
  }

  static NodePath of(Node root) {
    return new NodePath(root);
  }

  Node getNode() {
    return stack.get(stack.size() - 1).node();
  }

  /** The field of the parent that holds the current node, or null at the root. */
  @Nullable String getField() {
    return stack.get(stack.size() - 1).field();
  }

  int getIndex() {
    return stack.get(stack.size() - 1).index();
  }

  @Nullable Node getParentNode() {
    return getAncestor(1);
  }

  /** Returns the ancestor {@code level} frames up; level 0 is the current node. */
  @Nullable Node getAncestor(int level) {
    checkArgument(level >= 0, level);
    int i = stack.size() - 1 - level;
    return i >= 0 ? stack.get(i).node() : null;
  }

  int getDepth() {
    return stack.size();
  }

  /** The frames from the current node up to the root. */
  ImmutableList<Entry> getEntries() {
    return ImmutableList.copyOf(stack).reverse();
  }

  /** Applies {@code fn} with the path descended into the node held by {@code field}. */
  <T> T call(Function<NodePath, T> fn, String field) {
    Node child = getNode().getNode(field);
    checkState(child != null, "%s has no %s", getNode(), field);
    stack.add(new Entry(child, field, -1));
    try {
      return fn.apply(this);
    } finally {
      stack.remove(stack.size() - 1);
    }
  }

  /** Applies {@code fn} to each node of the list held by {@code field}. */
  void each(Consumer<NodePath> fn, String field) {
    ImmutableList<Node> children = getNode().getNodes(field);
    for (int i = 0; i < children.size(); i++) {
      stack.add(new Entry(children.get(i), field, i));
      try {
        fn.accept(this);
      } finally {
        stack.remove(stack.size() - 1);
      }
    }
  }

  /** Collects the results of {@code fn} over the list held by {@code field}. */
  <T> ImmutableList<T> map(Function<NodePath, T> fn, String field) {
    ImmutableList.Builder<T> results = ImmutableList.builder();
    each(path -> results.add(fn.apply(path)), field);
    return results.build();
  }

  /** Whether the current node must be wrapped in parentheses where it stands. */
  boolean needsParens() {
    return Parenthesizer.needsParens(getEntries());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Entry entry : stack) {
      if (entry.field() != null) {
        sb.append('.').append(entry.field());
        if (entry.index() >= 0) {
          sb.append('[').append(entry.index()).append(']');
        }
      }
      sb.append('(').append(entry.node().getToken()).append(')');
    }
    return sb.toString();
  }
}
