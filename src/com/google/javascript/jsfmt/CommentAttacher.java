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

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Strings.nullToEmpty;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.javascript.jsfmt.ast.Node;
import com.google.javascript.jsfmt.ast.SourcePosition;
import com.google.javascript.jsfmt.ast.Token;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assigns every comment of an AST to the node that prints it.
 *
 * <p>Comments are read from the {@code comments} field of the root (and of its program, for a
 * {@code FILE} root). For each comment the attacher descends from the root through the child
 * whose source range encloses the comment. At the deepest level it looks at the closest child
 * ending before the comment and the closest child starting after it:
 *
 * <ul>
 *   <li>both present: trailing comment of the preceding node when it starts on the line where
 *       that node ends, otherwise leading comment of the following node. A {@code //} comment
 *       only trails a node that ends a line, such as a statement, so that it cannot swallow the
 *       separator printed after the node.
 *   <li>only a following node: leading comment of it.
 *   <li>only a preceding node: trailing comment of it.
 *   <li>neither: trailing comment of the enclosing node.
 * </ul>
 *
 * Nodes without a source range never host comments; their children are searched instead.
 */
public final class CommentAttacher {
  private static final Logger logger = Logger.getLogger(CommentAttacher.class.getName());

  private static final Comparator<Node> BY_START =
      Comparator.comparing(Node::getStart, Comparator.nullsFirst(Comparator.naturalOrder()));

  private CommentAttacher() {}

  public static CommentMap attach(Node root) {
    List<Node> comments = new ArrayList<>(collectComments(root));
    if (comments.isEmpty()) {
      return CommentMap.empty();
    }
    for (Node comment : comments) {
      checkState(comment.hasSourceRange(), "comment without a source range: %s", comment);
    }
    comments.sort(BY_START);

    ImmutableListMultimap.Builder<Node, Comment> byHost = ImmutableListMultimap.builder();
    for (Node comment : comments) {
      Comment placed = place(root, comment);
      byHost.put(placed.getHost(), placed);
    }
    CommentMap map = new CommentMap(byHost.build());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Attached " + map.size() + " comments");
    }
    return map;
  }

  private static ImmutableList<Node> collectComments(Node root) {
    ImmutableList.Builder<Node> comments = ImmutableList.builder();
    comments.addAll(root.getNodes("comments"));
    Node program = root.is(Token.FILE) ? root.getNode("program") : null;
    if (program != null) {
      comments.addAll(program.getNodes("comments"));
    }
    return comments.build();
  }

  private static Comment place(Node root, Node comment) {
    SourcePosition start = comment.getStart();
    SourcePosition end = comment.getEnd();
    Node enclosing = root;
    Node preceding;
    Node following;
    while (true) {
      preceding = null;
      following = null;
      Node enclosingChild = null;
      for (Node child : positionedChildren(enclosing)) {
        if (!start.isBefore(child.getStart()) && !child.getEnd().isBefore(end)) {
          enclosingChild = child;
          break;
        }
        if (!start.isBefore(child.getEnd())) {
          preceding = child;
        } else if (!child.getStart().isBefore(end)) {
          following = child;
          break;
        }
      }
      if (enclosingChild == null) {
        break;
      }
      enclosing = enclosingChild;
    }

    Comment.Style style =
        comment.is(Token.COMMENT_BLOCK) ? Comment.Style.BLOCK : Comment.Style.LINE;
    Node host;
    Comment.Attachment attachment;
    if (preceding != null && following != null) {
      boolean sameLine = start.getLine() == preceding.getEnd().getLine();
      boolean canTrail = style == Comment.Style.BLOCK || NodeUtil.endsLine(preceding);
      if (sameLine && canTrail) {
        host = preceding;
        attachment = Comment.Attachment.TRAILING;
      } else {
        host = following;
        attachment = Comment.Attachment.LEADING;
      }
    } else if (following != null) {
      host = following;
      attachment = Comment.Attachment.LEADING;
    } else if (preceding != null) {
      host = preceding;
      attachment = Comment.Attachment.TRAILING;
    } else {
      host = enclosing;
      attachment = Comment.Attachment.TRAILING;
    }
    return Comment.create(
        nullToEmpty(comment.getString("value")), style, start, end, attachment, host);
  }

  /**
   * The children of {@code n} that have a source range, in source order. Children without a
   * range are replaced by their own positioned children.
   */
  private static ImmutableList<Node> positionedChildren(Node n) {
    List<Node> result = new ArrayList<>();
    collectPositioned(n, result);
    result.sort(BY_START);
    return ImmutableList.copyOf(result);
  }

  private static void collectPositioned(Node n, List<Node> result) {
    for (Node child : n.getChildren()) {
      if (child.is(Token.COMMENT_BLOCK) || child.is(Token.COMMENT_LINE)) {
        continue;
      }
      if (child.hasSourceRange()) {
        result.add(child);
      } else {
        collectPositioned(child, result);
      }
    }
  }
}
