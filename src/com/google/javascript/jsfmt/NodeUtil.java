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

import com.google.common.collect.ImmutableMap;
import com.google.javascript.jsfmt.ast.Node;
import com.google.javascript.jsfmt.ast.Token;

/** Static queries over AST nodes shared by the printers. */
final class NodeUtil {

  private static final ImmutableMap<String, Integer> BINARY_PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("??", 0)
          .put("||", 0)
          .put("&&", 1)
          .put("|", 2)
          .put("^", 3)
          .put("&", 4)
          .put("==", 5)
          .put("===", 5)
          .put("!=", 5)
          .put("!==", 5)
          .put("<", 6)
          .put(">", 6)
          .put("<=", 6)
          .put(">=", 6)
          .put("in", 6)
          .put("instanceof", 6)
          .put(">>", 7)
          .put("<<", 7)
          .put(">>>", 7)
          .put("+", 8)
          .put("-", 8)
          .put("*", 9)
          .put("/", 9)
          .put("%", 9)
          .put("**", 10)
          .buildOrThrow();

  private NodeUtil() {}

  /**
   * Returns the binding power of a binary or logical operator; higher binds tighter.
   *
   * @throws IllegalStateException for an unknown operator
   */
  static int precedence(String operator) {
    Integer precedence = BINARY_PRECEDENCE.get(operator);
    if (precedence == null) {
      throw new IllegalStateException("Unknown binary operator: " + operator);
    }
    return precedence;
  }

  static boolean isBinaryLike(Node n) {
    return n.is(Token.BINARY_EXPRESSION) || n.is(Token.LOGICAL_EXPRESSION);
  }

  static boolean isStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY_STATEMENT:
      case BLOCK_STATEMENT:
      case EXPRESSION_STATEMENT:
      case RETURN_STATEMENT:
      case IF_STATEMENT:
      case FOR_STATEMENT:
      case FOR_IN_STATEMENT:
      case FOR_OF_STATEMENT:
      case FOR_AWAIT_STATEMENT:
      case WHILE_STATEMENT:
      case DO_WHILE_STATEMENT:
      case BREAK_STATEMENT:
      case CONTINUE_STATEMENT:
      case LABELED_STATEMENT:
      case TRY_STATEMENT:
      case THROW_STATEMENT:
      case SWITCH_STATEMENT:
      case DEBUGGER_STATEMENT:
      case WITH_STATEMENT:
      case VARIABLE_DECLARATION:
      case FUNCTION_DECLARATION:
      case CLASS_DECLARATION:
      case IMPORT_DECLARATION:
      case EXPORT_NAMED_DECLARATION:
      case EXPORT_DEFAULT_DECLARATION:
      case EXPORT_ALL_DECLARATION:
      case TYPE_ALIAS:
      case DECLARE_TYPE_ALIAS:
      case INTERFACE_DECLARATION:
      case DECLARE_INTERFACE:
      case DECLARE_CLASS:
      case DECLARE_FUNCTION:
      case DECLARE_VARIABLE:
      case DECLARE_MODULE:
      case DECLARE_MODULE_EXPORTS:
      case DECLARE_EXPORT_DECLARATION:
      case DECLARE_EXPORT_ALL_DECLARATION:
        return true;
      default:
        return false;
    }
  }

  /** Whether a trailing line comment can follow the node without swallowing a separator. */
  static boolean endsLine(Node n) {
    if (isStatement(n)) {
      return true;
    }
    switch (n.getToken()) {
      case CLASS_METHOD:
      case CLASS_PROPERTY:
      case METHOD_DEFINITION:
      case SWITCH_CASE:
      case DIRECTIVE:
        return true;
      default:
        return false;
    }
  }

  static boolean isExportDeclaration(Node n) {
    switch (n.getToken()) {
      case EXPORT_NAMED_DECLARATION:
      case EXPORT_DEFAULT_DECLARATION:
      case DECLARE_EXPORT_DECLARATION:
        return true;
      default:
        return false;
    }
  }

  static boolean isFunction(Node n) {
    switch (n.getToken()) {
      case FUNCTION_DECLARATION:
      case FUNCTION_EXPRESSION:
      case ARROW_FUNCTION_EXPRESSION:
      case OBJECT_METHOD:
      case CLASS_METHOD:
        return true;
      default:
        return false;
    }
  }

  /** Whether the expression contains a call outside of any nested function. */
  static boolean containsCall(Node n) {
    if (n.is(Token.CALL_EXPRESSION)) {
      return true;
    }
    if (isFunction(n)) {
      return false;
    }
    for (Node child : n.getChildren()) {
      if (containsCall(child)) {
        return true;
      }
    }
    return false;
  }
}
