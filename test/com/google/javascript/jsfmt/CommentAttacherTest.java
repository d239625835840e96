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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.javascript.jsfmt.ast.IR;
import com.google.javascript.jsfmt.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommentAttacherTest {

  private static Node at(Node n, int startLine, int startColumn, int endLine, int endColumn) {
    return n.toBuilder().setRange(startLine, startColumn, endLine, endColumn).build();
  }

  private static Node withComments(Node root, Node... comments) {
    return root.toBuilder().setNodes("comments", ImmutableList.copyOf(comments)).build();
  }

  private static Node callStatement(String name, int line) {
    return at(IR.exprResult(IR.call(IR.name(name))), line, 0, line, 4);
  }

  @Test
  public void testNoComments() {
    CommentMap comments = CommentAttacher.attach(IR.program(callStatement("a", 1)));
    assertThat(comments.isEmpty()).isTrue();
    assertThat(comments).isSameInstanceAs(CommentMap.empty());
  }

  @Test
  public void testLeadingAndTrailing() {
    Node a = callStatement("a", 2);
    Node b = callStatement("b", 3);
    Node program =
        withComments(
            IR.program(a, b),
            at(IR.lineComment(" lead"), 1, 0, 1, 7),
            at(IR.lineComment(" trail"), 3, 5, 3, 13));

    CommentMap comments = CommentAttacher.attach(program);

    assertThat(comments.size()).isEqualTo(2);
    Comment lead = comments.getLeading(a).get(0);
    assertThat(lead.getText()).isEqualTo(" lead");
    assertThat(lead.getStyle()).isEqualTo(Comment.Style.LINE);
    assertThat(lead.isLeading()).isTrue();
    assertThat(lead.toSource()).isEqualTo("// lead");
    assertThat(comments.getTrailing(a)).isEmpty();

    Comment trail = comments.getTrailing(b).get(0);
    assertThat(trail.getHost()).isSameInstanceAs(b);
    assertThat(trail.isDangling()).isFalse();
  }

  @Test
  public void testCommentOnItsOwnLineLeadsNextNode() {
    Node a = callStatement("a", 1);
    Node b = callStatement("b", 3);
    Node program = withComments(IR.program(a, b), at(IR.blockComment(" c "), 2, 0, 2, 7));

    CommentMap comments = CommentAttacher.attach(program);

    assertThat(comments.getComments(a)).isEmpty();
    assertThat(comments.getLeading(b).get(0).toSource()).isEqualTo("/* c */");
  }

  @Test
  public void testLineCommentDoesNotTrailAnExpression() {
    // f(x, // c
    // y);
    Node x = at(IR.name("x"), 1, 2, 1, 3);
    Node y = at(IR.name("y"), 2, 0, 2, 1);
    Node call = at(IR.call(at(IR.name("f"), 1, 0, 1, 1), x, y), 1, 0, 2, 2);
    Node program =
        withComments(
            IR.program(at(IR.exprResult(call), 1, 0, 2, 3)),
            at(IR.lineComment(" c"), 1, 5, 1, 9));

    CommentMap comments = CommentAttacher.attach(program);

    assertThat(comments.getComments(x)).isEmpty();
    assertThat(comments.getLeading(y)).hasSize(1);
  }

  @Test
  public void testBlockCommentTrailsAnExpression() {
    Node x = at(IR.name("x"), 1, 2, 1, 3);
    Node y = at(IR.name("y"), 2, 0, 2, 1);
    Node call = at(IR.call(at(IR.name("f"), 1, 0, 1, 1), x, y), 1, 0, 2, 2);
    Node program =
        withComments(
            IR.program(at(IR.exprResult(call), 1, 0, 2, 3)),
            at(IR.blockComment(" c "), 1, 5, 1, 12));

    assertThat(CommentAttacher.attach(program).getTrailing(x)).hasSize(1);
  }

  @Test
  public void testCommentInsideEmptyBlockDangles() {
    Node block = at(IR.block(), 1, 0, 1, 15);
    Node program = withComments(IR.program(block), at(IR.blockComment(" empty "), 1, 2, 1, 13));

    Comment comment = CommentAttacher.attach(program).getTrailing(block).get(0);

    assertThat(comment.isDangling()).isTrue();
  }

  @Test
  public void testNodesWithoutRangeAreSearchedThrough() {
    Node call = at(IR.call(IR.name("a")), 1, 0, 1, 3);
    Node program =
        withComments(IR.program(IR.exprResult(call)), at(IR.blockComment("x"), 1, 4, 1, 9));

    assertThat(CommentAttacher.attach(program).getTrailing(call)).hasSize(1);
  }

  @Test
  public void testCommentsOfFileRoot() {
    Node a = callStatement("a", 2);
    Node file =
        IR.file(withComments(IR.program(a), at(IR.lineComment(" lead"), 1, 0, 1, 7)));

    assertThat(CommentAttacher.attach(file).getLeading(a)).hasSize(1);
  }

  @Test
  public void testCommentWithoutRange() {
    Node program = withComments(IR.program(callStatement("a", 1)), IR.lineComment(" x"));
    assertThrows(IllegalStateException.class, () -> CommentAttacher.attach(program));
  }
}
