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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.javascript.jsfmt.ast.Node;

/**
 * The comments of one AST, grouped by the node that prints them. Nodes are compared by identity.
 */
public final class CommentMap {
  private static final CommentMap EMPTY = new CommentMap(ImmutableListMultimap.of());

  private final ImmutableListMultimap<Node, Comment> byHost;

  CommentMap(ImmutableListMultimap<Node, Comment> byHost) {
    this.byHost = byHost;
  }

  public static CommentMap empty() {
    return EMPTY;
  }

  /** All comments hosted by {@code node}, in source order. */
  public ImmutableList<Comment> getComments(Node node) {
    return byHost.get(node);
  }

  public ImmutableList<Comment> getLeading(Node node) {
    return filter(node, Comment.Attachment.LEADING);
  }

  public ImmutableList<Comment> getTrailing(Node node) {
    return filter(node, Comment.Attachment.TRAILING);
  }

  private ImmutableList<Comment> filter(Node node, Comment.Attachment attachment) {
    ImmutableList<Comment> comments = byHost.get(node);
    if (comments.isEmpty()) {
      return comments;
    }
    ImmutableList.Builder<Comment> result = ImmutableList.builder();
    for (Comment comment : comments) {
      if (comment.getAttachment() == attachment) {
        result.add(comment);
      }
    }
    return result.build();
  }

  public int size() {
    return byHost.size();
  }

  public boolean isEmpty() {
    return byHost.isEmpty();
  }
}
