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

package com.google.javascript.jsfmt.ast;

/**
 * The kind of an AST {@link Node}.
 *
 * <p>The JavaScript constants follow the ESTree/Babel node types (with the Flow and JSX
 * extensions); the template constants follow the Glimmer template AST. Every printer dispatches
 * over this enum with an exhaustive switch, so adding a constant here is a compile-time change
 * for each printer.
 */
public enum Token {
  // Program structure
  FILE,
  PROGRAM,
  DIRECTIVE,
  DIRECTIVE_LITERAL,
  NOOP,
  EMPTY_STATEMENT,
  BLOCK_STATEMENT,
  EXPRESSION_STATEMENT,
  PARENTHESIZED_EXPRESSION,

  // Statements
  RETURN_STATEMENT,
  IF_STATEMENT,
  FOR_STATEMENT,
  FOR_IN_STATEMENT,
  FOR_OF_STATEMENT,
  FOR_AWAIT_STATEMENT,
  WHILE_STATEMENT,
  DO_WHILE_STATEMENT,
  DO_EXPRESSION,
  BREAK_STATEMENT,
  CONTINUE_STATEMENT,
  LABELED_STATEMENT,
  TRY_STATEMENT,
  CATCH_CLAUSE,
  THROW_STATEMENT,
  SWITCH_STATEMENT,
  SWITCH_CASE,
  DEBUGGER_STATEMENT,
  WITH_STATEMENT,
  VARIABLE_DECLARATION,
  VARIABLE_DECLARATOR,

  // Expressions
  IDENTIFIER,
  THIS_EXPRESSION,
  SUPER,
  NULL_LITERAL,
  BOOLEAN_LITERAL,
  NUMERIC_LITERAL,
  STRING_LITERAL,
  REGEXP_LITERAL,
  ASSIGNMENT_EXPRESSION,
  BINARY_EXPRESSION,
  LOGICAL_EXPRESSION,
  ASSIGNMENT_PATTERN,
  MEMBER_EXPRESSION,
  META_PROPERTY,
  BIND_EXPRESSION,
  SPREAD_ELEMENT,
  SPREAD_PROPERTY,
  REST_ELEMENT,
  REST_PROPERTY,
  FUNCTION_DECLARATION,
  FUNCTION_EXPRESSION,
  ARROW_FUNCTION_EXPRESSION,
  YIELD_EXPRESSION,
  AWAIT_EXPRESSION,
  CALL_EXPRESSION,
  NEW_EXPRESSION,
  SEQUENCE_EXPRESSION,
  UNARY_EXPRESSION,
  UPDATE_EXPRESSION,
  CONDITIONAL_EXPRESSION,
  OBJECT_EXPRESSION,
  OBJECT_PATTERN,
  OBJECT_PROPERTY,
  PROPERTY,
  OBJECT_METHOD,
  ARRAY_EXPRESSION,
  ARRAY_PATTERN,
  TEMPLATE_LITERAL,
  TEMPLATE_ELEMENT,
  TAGGED_TEMPLATE_EXPRESSION,

  // Classes and modules
  CLASS_DECLARATION,
  CLASS_EXPRESSION,
  CLASS_BODY,
  CLASS_PROPERTY,
  CLASS_METHOD,
  METHOD_DEFINITION,
  DECORATOR,
  IMPORT_DECLARATION,
  IMPORT_SPECIFIER,
  IMPORT_DEFAULT_SPECIFIER,
  IMPORT_NAMESPACE_SPECIFIER,
  EXPORT_NAMED_DECLARATION,
  EXPORT_DEFAULT_DECLARATION,
  EXPORT_ALL_DECLARATION,
  EXPORT_SPECIFIER,
  EXPORT_DEFAULT_SPECIFIER,
  EXPORT_NAMESPACE_SPECIFIER,
  EXPORT_BATCH_SPECIFIER,

  // JSX
  JSX_ELEMENT,
  JSX_OPENING_ELEMENT,
  JSX_CLOSING_ELEMENT,
  JSX_ATTRIBUTE,
  JSX_IDENTIFIER,
  JSX_NAMESPACED_NAME,
  JSX_MEMBER_EXPRESSION,
  JSX_SPREAD_ATTRIBUTE,
  JSX_EXPRESSION_CONTAINER,
  JSX_EMPTY_EXPRESSION,
  JSX_TEXT,

  // Flow type annotations
  TYPE_ANNOTATION,
  TYPE_ALIAS,
  DECLARE_TYPE_ALIAS,
  TYPE_CAST_EXPRESSION,
  TYPE_PARAMETER_DECLARATION,
  TYPE_PARAMETER_INSTANTIATION,
  TYPE_PARAMETER,
  GENERIC_TYPE_ANNOTATION,
  QUALIFIED_TYPE_IDENTIFIER,
  UNION_TYPE_ANNOTATION,
  INTERSECTION_TYPE_ANNOTATION,
  NULLABLE_TYPE_ANNOTATION,
  TUPLE_TYPE_ANNOTATION,
  ARRAY_TYPE_ANNOTATION,
  FUNCTION_TYPE_ANNOTATION,
  FUNCTION_TYPE_PARAM,
  OBJECT_TYPE_ANNOTATION,
  OBJECT_TYPE_PROPERTY,
  OBJECT_TYPE_INDEXER,
  OBJECT_TYPE_CALL_PROPERTY,
  TYPEOF_TYPE_ANNOTATION,
  ANY_TYPE_ANNOTATION,
  MIXED_TYPE_ANNOTATION,
  EMPTY_TYPE_ANNOTATION,
  BOOLEAN_TYPE_ANNOTATION,
  NUMBER_TYPE_ANNOTATION,
  STRING_TYPE_ANNOTATION,
  VOID_TYPE_ANNOTATION,
  NULL_LITERAL_TYPE_ANNOTATION,
  THIS_TYPE_ANNOTATION,
  EXISTS_TYPE_ANNOTATION,
  STRING_LITERAL_TYPE_ANNOTATION,
  NUMBER_LITERAL_TYPE_ANNOTATION,
  BOOLEAN_LITERAL_TYPE_ANNOTATION,
  INTERFACE_DECLARATION,
  DECLARE_INTERFACE,
  INTERFACE_EXTENDS,
  CLASS_IMPLEMENTS,
  DECLARE_CLASS,
  DECLARE_FUNCTION,
  DECLARE_VARIABLE,
  DECLARE_MODULE,
  DECLARE_MODULE_EXPORTS,
  DECLARE_EXPORT_DECLARATION,
  DECLARE_EXPORT_ALL_DECLARATION,
  INFERRED_PREDICATE,
  DECLARED_PREDICATE,

  // Comments
  COMMENT_BLOCK,
  COMMENT_LINE,

  // Glimmer templates
  TEMPLATE_PROGRAM(Dialect.TEMPLATE),
  ELEMENT_NODE(Dialect.TEMPLATE),
  ATTR_NODE(Dialect.TEMPLATE),
  TEXT_NODE(Dialect.TEMPLATE),
  MUSTACHE_STATEMENT(Dialect.TEMPLATE),
  PATH_EXPRESSION(Dialect.TEMPLATE),
  MUSTACHE_COMMENT_STATEMENT(Dialect.TEMPLATE);

  /** The language family a token belongs to. */
  public enum Dialect {
    JAVASCRIPT,
    TEMPLATE
  }

  private final Dialect dialect;

  Token() {
    this(Dialect.JAVASCRIPT);
  }

  Token(Dialect dialect) {
    this.dialect = dialect;
  }

  public Dialect getDialect() {
    return dialect;
  }
}
