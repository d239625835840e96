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

import com.google.javascript.jsfmt.NodePath.Entry;
import com.google.javascript.jsfmt.ast.Node;
import com.google.javascript.jsfmt.ast.Token;
import java.util.List;

/**
 * Decides where an expression printed without its original parentheses would parse differently.
 *
 * <p>The decision depends only on the chain of path entries from the node up to the root: the
 * node's own kind and operator, its parent's kind and operator, and the field of the parent the
 * node sits in.
 */
final class Parenthesizer {

  private Parenthesizer() {}

  /**
   * @param chain path entries from the node being printed (first) to the root (last)
   */
  static boolean needsParens(List<Entry> chain) {
    checkArgument(!chain.isEmpty(), "empty path");
    if (chain.size() < 2) {
      return false;
    }
    Entry entry = chain.get(0);
    Node node = entry.node();
    Node parent = chain.get(1).node();

    if (NodeUtil.isStatement(node)
        || node.is(Token.IDENTIFIER)
        || parent.is(Token.PARENTHESIZED_EXPRESSION)) {
      return false;
    }

    if (parent.is(Token.NEW_EXPRESSION)
        && entry.isField("callee")
        && NodeUtil.containsCall(node)) {
      return true;
    }

    switch (node.getToken()) {
      case FUNCTION_EXPRESSION:
      case CLASS_EXPRESSION:
        return startsStatement(chain, false);

      case OBJECT_EXPRESSION:
        return startsStatement(chain, true);

      case UNARY_EXPRESSION:
      case SPREAD_ELEMENT:
      case SPREAD_PROPERTY:
        return isCalleeOrObject(entry, parent) || isExponentBase(entry, parent);

      case UPDATE_EXPRESSION:
        return isCalleeOrObject(entry, parent);

      case BINARY_EXPRESSION:
      case LOGICAL_EXPRESSION:
        return binaryNeedsParens(entry, node, parent);

      case SEQUENCE_EXPRESSION:
        switch (parent.getToken()) {
          case RETURN_STATEMENT:
          case FOR_STATEMENT:
            return false;
          case EXPRESSION_STATEMENT:
            return !entry.isField("expression");
          default:
            return true;
        }

      case YIELD_EXPRESSION:
      case AWAIT_EXPRESSION:
        switch (parent.getToken()) {
          case BINARY_EXPRESSION:
          case LOGICAL_EXPRESSION:
          case UNARY_EXPRESSION:
          case SPREAD_ELEMENT:
          case SPREAD_PROPERTY:
          case YIELD_EXPRESSION:
            return true;
          case CALL_EXPRESSION:
          case NEW_EXPRESSION:
            return entry.isField("callee");
          case MEMBER_EXPRESSION:
            return entry.isField("object");
          case CONDITIONAL_EXPRESSION:
            return entry.isField("test");
          default:
            return false;
        }

      case NUMERIC_LITERAL:
        return isMemberObject(entry, parent);

      case ASSIGNMENT_EXPRESSION:
        if (parent.is(Token.EXPRESSION_STATEMENT)
            && node.getNode("left") != null
            && node.getNode("left").is(Token.OBJECT_PATTERN)) {
          return true;
        }
        return loosePrecedenceNeedsParens(entry, parent);

      case CONDITIONAL_EXPRESSION:
      case ARROW_FUNCTION_EXPRESSION:
        return loosePrecedenceNeedsParens(entry, parent);

      case UNION_TYPE_ANNOTATION:
      case INTERSECTION_TYPE_ANNOTATION:
        return parent.is(Token.ARRAY_TYPE_ANNOTATION) || parent.is(Token.NULLABLE_TYPE_ANNOTATION);

      case NULLABLE_TYPE_ANNOTATION:
        return parent.is(Token.ARRAY_TYPE_ANNOTATION);

      case FUNCTION_TYPE_ANNOTATION:
        switch (parent.getToken()) {
          case UNION_TYPE_ANNOTATION:
          case INTERSECTION_TYPE_ANNOTATION:
          case ARRAY_TYPE_ANNOTATION:
          case NULLABLE_TYPE_ANNOTATION:
            return true;
          default:
            return false;
        }

      default:
        return false;
    }
  }

  private static boolean binaryNeedsParens(Entry entry, Node node, Node parent) {
    switch (parent.getToken()) {
      case CALL_EXPRESSION:
      case NEW_EXPRESSION:
        return entry.isField("callee");
      case UNARY_EXPRESSION:
      case SPREAD_ELEMENT:
      case SPREAD_PROPERTY:
      case AWAIT_EXPRESSION:
        return true;
      case MEMBER_EXPRESSION:
        return entry.isField("object");
      case BINARY_EXPRESSION:
      case LOGICAL_EXPRESSION:
        String parentOp = parent.getString("operator");
        String nodeOp = node.getString("operator");
        // ?? does not mix with && or || unparenthesized, whichever binds tighter.
        if (mixesNullishWithLogical(parentOp, nodeOp)) {
          return true;
        }
        int pp = NodeUtil.precedence(parentOp);
        int np = NodeUtil.precedence(nodeOp);
        if (pp > np) {
          return true;
        }
        // Exponentiation groups to the right.
        if (pp == np && entry.isField("right")) {
          return !parentOp.equals("**");
        }
        return pp == np && parentOp.equals("**") && entry.isField("left");
      default:
        return false;
    }
  }

  /** Rules for assignments, conditionals and arrow functions, which bind looser than operators. */
  private static boolean loosePrecedenceNeedsParens(Entry entry, Node parent) {
    switch (parent.getToken()) {
      case UNARY_EXPRESSION:
      case SPREAD_ELEMENT:
      case SPREAD_PROPERTY:
      case BINARY_EXPRESSION:
      case LOGICAL_EXPRESSION:
      case AWAIT_EXPRESSION:
        return true;
      case CALL_EXPRESSION:
      case NEW_EXPRESSION:
        return entry.isField("callee");
      case CONDITIONAL_EXPRESSION:
        return entry.isField("test");
      case MEMBER_EXPRESSION:
        return entry.isField("object");
      case TAGGED_TEMPLATE_EXPRESSION:
        return entry.isField("tag");
      default:
        return false;
    }
  }

  private static boolean mixesNullishWithLogical(String parentOp, String nodeOp) {
    return (parentOp.equals("??") && isAndOr(nodeOp)) || (nodeOp.equals("??") && isAndOr(parentOp));
  }

  private static boolean isAndOr(String operator) {
    return operator.equals("&&") || operator.equals("||");
  }

  private static boolean isMemberObject(Entry entry, Node parent) {
    return parent.is(Token.MEMBER_EXPRESSION) && entry.isField("object");
  }

  /** Whether a prefix or postfix operator would bind to the call, member or tag around it. */
  private static boolean isCalleeOrObject(Entry entry, Node parent) {
    switch (parent.getToken()) {
      case CALL_EXPRESSION:
      case NEW_EXPRESSION:
        return entry.isField("callee");
      case MEMBER_EXPRESSION:
        return entry.isField("object");
      case TAGGED_TEMPLATE_EXPRESSION:
        return entry.isField("tag");
      default:
        return false;
    }
  }

  private static boolean isExponentBase(Entry entry, Node parent) {
    return parent.is(Token.BINARY_EXPRESSION)
        && "**".equals(parent.getString("operator"))
        && entry.isField("left");
  }

  /**
   * Whether the node would be the first token of an expression statement (or, for object
   * literals, of an arrow function's expression body), where it would read as a declaration or
   * a block.
   */
  private static boolean startsStatement(List<Entry> chain, boolean arrowBodyToo) {
    for (int i = 0; i + 1 < chain.size(); i++) {
      Entry child = chain.get(i);
      Node parent = chain.get(i + 1).node();
      switch (parent.getToken()) {
        case EXPRESSION_STATEMENT:
          return child.isField("expression");
        case ARROW_FUNCTION_EXPRESSION:
          return arrowBodyToo && child.isField("body");
        case MEMBER_EXPRESSION:
          if (!child.isField("object")) {
            return false;
          }
          break;
        case CALL_EXPRESSION:
          if (!child.isField("callee")) {
            return false;
          }
          break;
        case BINARY_EXPRESSION:
        case LOGICAL_EXPRESSION:
        case ASSIGNMENT_EXPRESSION:
          if (!child.isField("left")) {
            return false;
          }
          break;
        case CONDITIONAL_EXPRESSION:
          if (!child.isField("test")) {
            return false;
          }
          break;
        case SEQUENCE_EXPRESSION:
          if (child.index() != 0) {
            return false;
          }
          break;
        case UPDATE_EXPRESSION:
          if (parent.getBoolean("prefix")) {
            return false;
          }
          break;
        case TAGGED_TEMPLATE_EXPRESSION:
          if (!child.isField("tag")) {
            return false;
          }
          break;
        default:
          return false;
      }
    }
    return false;
  }
}
