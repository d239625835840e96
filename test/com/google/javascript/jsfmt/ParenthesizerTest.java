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
import com.google.javascript.jsfmt.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParenthesizerTest {

  private static final Node A = IR.name("a");
  private static final Node B = IR.name("b");
  private static final Node C = IR.name("c");

  /** Whether the node reached from {@code root} through {@code fields} needs parentheses. */
  private static boolean needsParens(Node root, String... fields) {
    return descend(NodePath.of(root), fields, 0);
  }

  private static boolean descend(NodePath path, String[] fields, int i) {
    if (i == fields.length) {
      return path.needsParens();
    }
    return path.call(child -> descend(child, fields, i + 1), fields[i]);
  }

  private static boolean inStatement(Node expression, String... fields) {
    String[] withExpression = new String[fields.length + 1];
    withExpression[0] = "expression";
    System.arraycopy(fields, 0, withExpression, 1, fields.length);
    return needsParens(IR.exprResult(expression), withExpression);
  }

  @Test
  public void testRootAndIdentifiers() {
    assertThat(needsParens(IR.add(A, B))).isFalse();
    assertThat(inStatement(IR.mul(A, B), "left")).isFalse();
  }

  @Test
  public void testPrecedence() {
    assertThat(inStatement(IR.mul(IR.add(A, B), C), "left")).isTrue();
    assertThat(inStatement(IR.add(A, IR.mul(B, C)), "right")).isFalse();
    assertThat(inStatement(IR.and(IR.or(A, B), C), "left")).isTrue();
    assertThat(inStatement(IR.or(IR.and(A, B), C), "left")).isFalse();
  }

  @Test
  public void testEqualPrecedenceOnTheRight() {
    assertThat(inStatement(IR.sub(A, IR.sub(B, C)), "right")).isTrue();
    assertThat(inStatement(IR.sub(IR.sub(A, B), C), "left")).isFalse();
  }

  @Test
  public void testExponentiationGroupsRight() {
    assertThat(inStatement(IR.binary("**", IR.binary("**", A, B), C), "left")).isTrue();
    assertThat(inStatement(IR.binary("**", A, IR.binary("**", B, C)), "right")).isFalse();
    assertThat(inStatement(IR.binary("**", IR.unary("-", A), B), "left")).isTrue();
  }

  @Test
  public void testNullishCoalescingDoesNotMix() {
    assertThat(inStatement(IR.or(IR.binary("??", A, B), C), "left")).isTrue();
    assertThat(inStatement(IR.binary("??", IR.or(A, B), C), "left")).isTrue();
    assertThat(inStatement(IR.binary("??", IR.binary("??", A, B), C), "left")).isFalse();
  }

  @Test
  public void testNullishCoalescingDoesNotMixWithTighterAnd() {
    assertThat(inStatement(IR.binary("??", A, IR.and(B, C)), "right")).isTrue();
    assertThat(inStatement(IR.binary("??", IR.and(A, B), C), "left")).isTrue();
    assertThat(inStatement(IR.and(IR.binary("??", A, B), C), "left")).isTrue();
    assertThat(inStatement(IR.binary("??", A, IR.binary("|", B, C)), "right")).isFalse();
  }

  @Test
  public void testExplicitParenthesesAreKept() {
    Node expression = IR.mul(IR.paren(IR.add(A, B)), C);
    assertThat(inStatement(expression, "left")).isFalse();
    assertThat(inStatement(expression, "left", "expression")).isFalse();
  }

  @Test
  public void testFunctionAtStatementStart() {
    Node function = IR.function(null, ImmutableList.of(), IR.block());
    assertThat(inStatement(function)).isTrue();
    assertThat(inStatement(IR.call(function), "callee")).isTrue();
    assertThat(inStatement(IR.getprop(IR.call(function), "x"), "object", "callee")).isTrue();
    assertThat(inStatement(IR.assign(IR.name("x"), function), "right")).isFalse();
  }

  @Test
  public void testObjectLiterals() {
    assertThat(inStatement(IR.objectlit())).isTrue();
    assertThat(inStatement(IR.arrowFunction(ImmutableList.of(), IR.objectlit()), "body")).isTrue();
    assertThat(needsParens(IR.returnNode(IR.objectlit()), "argument")).isFalse();
    assertThat(inStatement(IR.assign(IR.objectPattern(), A))).isTrue();
  }

  @Test
  public void testSequences() {
    assertThat(inStatement(IR.comma(A, B))).isFalse();
    assertThat(needsParens(IR.returnNode(IR.comma(A, B)), "argument")).isFalse();
    assertThat(inStatement(IR.assign(IR.name("x"), IR.comma(A, B)), "right")).isTrue();
  }

  @Test
  public void testYieldAndAwait() {
    assertThat(inStatement(IR.add(IR.yield(A), B), "left")).isTrue();
    assertThat(inStatement(IR.getprop(IR.await(A), "x"), "object")).isTrue();
    assertThat(inStatement(IR.call(IR.name("f"), IR.await(A)), "callee")).isFalse();
    assertThat(inStatement(IR.hook(IR.await(A), B, C), "test")).isTrue();
    assertThat(inStatement(IR.hook(A, IR.await(B), C), "consequent")).isFalse();
  }

  @Test
  public void testLooseOperators() {
    Node arrow = IR.arrowFunction(ImmutableList.of(), A);
    assertThat(inStatement(IR.hook(arrow, B, C), "test")).isTrue();
    assertThat(inStatement(IR.hook(A, arrow, C), "consequent")).isFalse();
    assertThat(inStatement(IR.call(arrow), "callee")).isTrue();
    assertThat(inStatement(IR.add(IR.hook(A, B, C), A), "left")).isTrue();
    assertThat(inStatement(IR.not(IR.assign(IR.name("x"), A)), "argument")).isTrue();
  }

  @Test
  public void testMemberObjects() {
    assertThat(inStatement(IR.getprop(IR.number(1), "toString"), "object")).isTrue();
    assertThat(inStatement(IR.getprop(IR.not(A), "x"), "object")).isTrue();
    assertThat(inStatement(IR.getprop(IR.add(A, B), "x"), "object")).isTrue();
    assertThat(inStatement(IR.getelem(A, IR.add(A, B)), "property")).isFalse();
  }

  @Test
  public void testPrefixAndPostfixOperatorsAsCalleeOrObject() {
    assertThat(inStatement(IR.call(IR.unary("-", A)), "callee")).isTrue();
    assertThat(inStatement(IR.newNode(IR.unary("typeof", A)), "callee")).isTrue();
    Node quasi = IR.templateLiteral(ImmutableList.of("x"), ImmutableList.of());
    assertThat(inStatement(IR.taggedTemplate(IR.not(A), quasi), "tag")).isTrue();
    assertThat(inStatement(IR.assign(IR.name("x"), IR.unary("-", A)), "right")).isFalse();

    assertThat(inStatement(IR.getprop(IR.update("++", A, false), "b"), "object")).isTrue();
    assertThat(inStatement(IR.call(IR.update("--", A, true)), "callee")).isTrue();
    assertThat(inStatement(IR.getelem(B, IR.update("++", A, false)), "property")).isFalse();
    assertThat(inStatement(IR.add(IR.update("++", A, false), B), "left")).isFalse();
  }

  @Test
  public void testNewWithCallInCallee() {
    assertThat(inStatement(IR.newNode(IR.call(IR.name("f"))), "callee")).isTrue();
    assertThat(inStatement(IR.newNode(IR.getprop(IR.call(A), "b")), "callee")).isTrue();
    assertThat(inStatement(IR.newNode(IR.getprop(A, "b")), "callee")).isFalse();
  }

  @Test
  public void testTypeAnnotations() {
    Node union = IR.unionType(IR.keywordType(Token.NUMBER_TYPE_ANNOTATION), IR.genericType("T"));
    Node array = Node.builder(Token.ARRAY_TYPE_ANNOTATION).set("elementType", union).build();
    assertThat(needsParens(array, "elementType")).isTrue();
    assertThat(needsParens(IR.nullableType(union), "typeAnnotation")).isTrue();
    assertThat(needsParens(IR.typeAlias("U", union), "right")).isFalse();

    Node nullable = IR.nullableType(IR.genericType("T"));
    Node arrayOfNullable =
        Node.builder(Token.ARRAY_TYPE_ANNOTATION).set("elementType", nullable).build();
    assertThat(needsParens(arrayOfNullable, "elementType")).isTrue();
  }

  @Test
  public void testEmptyChain() {
    assertThrows(
        IllegalArgumentException.class, () -> Parenthesizer.needsParens(ImmutableList.of()));
  }
}
