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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper. Field names follow ESTree/Babel, which is what the printers read.
 *
 * <p>Nodes built here carry no source range; use {@link Node#toBuilder} to add one.
 */
public class IR {

  private static final ImmutableSet<String> VARIABLE_KINDS = ImmutableSet.of("var", "let", "const");

  private IR() {}

  public static Node file(Node program) {
    checkState(program.is(Token.PROGRAM), program);
    return Node.builder(Token.FILE).set("program", program).build();
  }

  public static Node program(Node... statements) {
    return program(ImmutableList.copyOf(statements));
  }

  public static Node program(List<Node> statements) {
    for (Node statement : statements) {
      checkState(mayBeStatement(statement), "Program cannot contain %s", statement);
    }
    return Node.builder(Token.PROGRAM).setNodes("body", statements).build();
  }

  public static Node directive(String value) {
    return Node.builder(Token.DIRECTIVE)
        .set("value", Node.builder(Token.DIRECTIVE_LITERAL).set("value", value).build())
        .build();
  }

  public static Node empty() {
    return Node.builder(Token.EMPTY_STATEMENT).build();
  }

  /** An elided array element, as in {@code [a, , b]}. */
  public static Node hole() {
    return Node.builder(Token.NOOP).build();
  }

  public static Node block(Node... statements) {
    return block(ImmutableList.copyOf(statements));
  }

  public static Node block(List<Node> statements) {
    for (Node statement : statements) {
      checkState(mayBeStatement(statement), "Block cannot contain %s", statement);
    }
    return Node.builder(Token.BLOCK_STATEMENT).setNodes("body", statements).build();
  }

  public static Node exprResult(Node expression) {
    checkState(mayBeExpression(expression), expression);
    return Node.builder(Token.EXPRESSION_STATEMENT).set("expression", expression).build();
  }

  public static Node paren(Node expression) {
    checkState(mayBeExpression(expression), expression);
    return Node.builder(Token.PARENTHESIZED_EXPRESSION).set("expression", expression).build();
  }

  public static Node returnNode() {
    return Node.builder(Token.RETURN_STATEMENT).build();
  }

  public static Node returnNode(Node argument) {
    checkState(mayBeExpression(argument), argument);
    return Node.builder(Token.RETURN_STATEMENT).set("argument", argument).build();
  }

  public static Node ifNode(Node test, Node consequent) {
    return ifNode(test, consequent, null);
  }

  public static Node ifNode(Node test, Node consequent, @Nullable Node alternate) {
    checkState(mayBeExpression(test), test);
    checkState(mayBeStatement(consequent), consequent);
    checkState(alternate == null || mayBeStatement(alternate), alternate);
    return Node.builder(Token.IF_STATEMENT)
        .set("test", test)
        .set("consequent", consequent)
        .set("alternate", alternate)
        .build();
  }

  public static Node forNode(
      @Nullable Node init, @Nullable Node test, @Nullable Node update, Node body) {
    checkState(mayBeStatement(body), body);
    return Node.builder(Token.FOR_STATEMENT)
        .set("init", init)
        .set("test", test)
        .set("update", update)
        .set("body", body)
        .build();
  }

  public static Node forIn(Node left, Node right, Node body) {
    return forEach(Token.FOR_IN_STATEMENT, left, right, body);
  }

  public static Node forOf(Node left, Node right, Node body) {
    return forEach(Token.FOR_OF_STATEMENT, left, right, body);
  }

  public static Node forAwaitOf(Node left, Node right, Node body) {
    return forEach(Token.FOR_AWAIT_STATEMENT, left, right, body);
  }

  private static Node forEach(Token token, Node left, Node right, Node body) {
    checkState(mayBeExpression(right), right);
    checkState(mayBeStatement(body), body);
    return Node.builder(token).set("left", left).set("right", right).set("body", body).build();
  }

  public static Node whileNode(Node test, Node body) {
    checkState(mayBeStatement(body), body);
    return Node.builder(Token.WHILE_STATEMENT).set("test", test).set("body", body).build();
  }

  public static Node doNode(Node body, Node test) {
    checkState(mayBeStatement(body), body);
    return Node.builder(Token.DO_WHILE_STATEMENT).set("body", body).set("test", test).build();
  }

  public static Node breakNode() {
    return Node.builder(Token.BREAK_STATEMENT).build();
  }

  public static Node breakNode(Node label) {
    checkState(label.is(Token.IDENTIFIER), label);
    return Node.builder(Token.BREAK_STATEMENT).set("label", label).build();
  }

  public static Node continueNode() {
    return Node.builder(Token.CONTINUE_STATEMENT).build();
  }

  public static Node continueNode(Node label) {
    checkState(label.is(Token.IDENTIFIER), label);
    return Node.builder(Token.CONTINUE_STATEMENT).set("label", label).build();
  }

  public static Node label(Node label, Node body) {
    checkState(label.is(Token.IDENTIFIER), label);
    checkState(mayBeStatement(body), body);
    return Node.builder(Token.LABELED_STATEMENT).set("label", label).set("body", body).build();
  }

  public static Node tryCatch(Node block, Node handler) {
    return tryCatchFinally(block, handler, null);
  }

  public static Node tryFinally(Node block, Node finalizer) {
    return tryCatchFinally(block, null, finalizer);
  }

  public static Node tryCatchFinally(
      Node block, @Nullable Node handler, @Nullable Node finalizer) {
    checkState(block.is(Token.BLOCK_STATEMENT), block);
    checkState(handler == null || handler.is(Token.CATCH_CLAUSE), handler);
    checkState(finalizer == null || finalizer.is(Token.BLOCK_STATEMENT), finalizer);
    checkArgument(handler != null || finalizer != null, "try needs a catch or a finally");
    return Node.builder(Token.TRY_STATEMENT)
        .set("block", block)
        .set("handler", handler)
        .set("finalizer", finalizer)
        .build();
  }

  public static Node catchNode(@Nullable Node param, Node body) {
    checkState(body.is(Token.BLOCK_STATEMENT), body);
    return Node.builder(Token.CATCH_CLAUSE).set("param", param).set("body", body).build();
  }

  public static Node throwNode(Node argument) {
    checkState(mayBeExpression(argument), argument);
    return Node.builder(Token.THROW_STATEMENT).set("argument", argument).build();
  }

  public static Node switchNode(Node discriminant, Node... cases) {
    for (Node c : cases) {
      checkState(c.is(Token.SWITCH_CASE), c);
    }
    return Node.builder(Token.SWITCH_STATEMENT)
        .set("discriminant", discriminant)
        .setNodes("cases", ImmutableList.copyOf(cases))
        .build();
  }

  public static Node caseNode(Node test, Node... consequent) {
    return Node.builder(Token.SWITCH_CASE)
        .set("test", test)
        .setNodes("consequent", ImmutableList.copyOf(consequent))
        .build();
  }

  public static Node defaultCase(Node... consequent) {
    return Node.builder(Token.SWITCH_CASE)
        .setNodes("consequent", ImmutableList.copyOf(consequent))
        .build();
  }

  public static Node debugger() {
    return Node.builder(Token.DEBUGGER_STATEMENT).build();
  }

  public static Node with(Node object, Node body) {
    return Node.builder(Token.WITH_STATEMENT).set("object", object).set("body", body).build();
  }

  public static Node var(Node id, @Nullable Node init) {
    return declaration("var", declarator(id, init));
  }

  public static Node let(Node id, @Nullable Node init) {
    return declaration("let", declarator(id, init));
  }

  public static Node constNode(Node id, Node init) {
    return declaration("const", declarator(id, init));
  }

  public static Node declaration(String kind, Node... declarators) {
    checkArgument(VARIABLE_KINDS.contains(kind), "bad declaration kind: %s", kind);
    checkArgument(declarators.length > 0, "declaration without declarators");
    for (Node declarator : declarators) {
      checkState(declarator.is(Token.VARIABLE_DECLARATOR), declarator);
    }
    return Node.builder(Token.VARIABLE_DECLARATION)
        .set("kind", kind)
        .setNodes("declarations", ImmutableList.copyOf(declarators))
        .build();
  }

  public static Node declarator(Node id, @Nullable Node init) {
    checkState(isAssignmentTarget(id), id);
    return Node.builder(Token.VARIABLE_DECLARATOR).set("id", id).set("init", init).build();
  }

  // Expressions

  public static Node name(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return Node.builder(Token.IDENTIFIER).set("name", name).build();
  }

  public static Node thisNode() {
    return Node.builder(Token.THIS_EXPRESSION).build();
  }

  public static Node superNode() {
    return Node.builder(Token.SUPER).build();
  }

  public static Node nullNode() {
    return Node.builder(Token.NULL_LITERAL).build();
  }

  public static Node trueNode() {
    return Node.builder(Token.BOOLEAN_LITERAL).set("value", true).build();
  }

  public static Node falseNode() {
    return Node.builder(Token.BOOLEAN_LITERAL).set("value", false).build();
  }

  public static Node number(double value) {
    return Node.builder(Token.NUMERIC_LITERAL).set("value", value).build();
  }

  /** A number that prints exactly as written, such as {@code 0xFF} or {@code 1e3}. */
  public static Node number(double value, String raw) {
    return Node.builder(Token.NUMERIC_LITERAL).set("value", value).set("raw", raw).build();
  }

  public static Node string(String value) {
    return Node.builder(Token.STRING_LITERAL).set("value", value).build();
  }

  public static Node regexp(String pattern, String flags) {
    return Node.builder(Token.REGEXP_LITERAL).set("pattern", pattern).set("flags", flags).build();
  }

  public static Node assign(Node target, Node value) {
    return assign("=", target, value);
  }

  public static Node assign(String operator, Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return Node.builder(Token.ASSIGNMENT_EXPRESSION)
        .set("operator", operator)
        .set("left", target)
        .set("right", value)
        .build();
  }

  /** A binary expression; {@code &&}, {@code ||} and {@code ??} build logical expressions. */
  public static Node binary(String operator, Node left, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    Token token =
        operator.equals("&&") || operator.equals("||") || operator.equals("??")
            ? Token.LOGICAL_EXPRESSION
            : Token.BINARY_EXPRESSION;
    return Node.builder(token).set("operator", operator).set("left", left).set("right", right)
        .build();
  }

  public static Node and(Node left, Node right) {
    return binary("&&", left, right);
  }

  public static Node or(Node left, Node right) {
    return binary("||", left, right);
  }

  public static Node add(Node left, Node right) {
    return binary("+", left, right);
  }

  public static Node sub(Node left, Node right) {
    return binary("-", left, right);
  }

  public static Node mul(Node left, Node right) {
    return binary("*", left, right);
  }

  public static Node assignPattern(Node left, Node right) {
    return Node.builder(Token.ASSIGNMENT_PATTERN).set("left", left).set("right", right).build();
  }

  public static Node getprop(Node object, String property) {
    return getprop(object, name(property));
  }

  public static Node getprop(Node object, Node property) {
    checkState(mayBeExpression(object) || object.is(Token.SUPER), object);
    return Node.builder(Token.MEMBER_EXPRESSION)
        .set("object", object)
        .set("property", property)
        .build();
  }

  public static Node getelem(Node object, Node property) {
    checkState(mayBeExpression(object) || object.is(Token.SUPER), object);
    return Node.builder(Token.MEMBER_EXPRESSION)
        .set("object", object)
        .set("property", property)
        .set("computed", true)
        .build();
  }

  public static Node spread(Node argument) {
    return Node.builder(Token.SPREAD_ELEMENT).set("argument", argument).build();
  }

  public static Node rest(Node argument) {
    return Node.builder(Token.REST_ELEMENT).set("argument", argument).build();
  }

  public static Node function(@Nullable Node id, List<Node> params, Node body) {
    return function(Token.FUNCTION_EXPRESSION, id, params, body);
  }

  public static Node functionDeclaration(Node id, List<Node> params, Node body) {
    return function(Token.FUNCTION_DECLARATION, id, params, body);
  }

  private static Node function(Token token, @Nullable Node id, List<Node> params, Node body) {
    checkState(id == null || id.is(Token.IDENTIFIER), id);
    checkState(body.is(Token.BLOCK_STATEMENT), body);
    return Node.builder(token).set("id", id).setNodes("params", params).set("body", body).build();
  }

  public static Node arrowFunction(List<Node> params, Node body) {
    checkState(body.is(Token.BLOCK_STATEMENT) || mayBeExpression(body), body);
    return Node.builder(Token.ARROW_FUNCTION_EXPRESSION)
        .setNodes("params", params)
        .set("body", body)
        .build();
  }

  public static Node yield(@Nullable Node argument) {
    return Node.builder(Token.YIELD_EXPRESSION).set("argument", argument).build();
  }

  public static Node await(Node argument) {
    return Node.builder(Token.AWAIT_EXPRESSION).set("argument", argument).build();
  }

  public static Node call(Node callee, Node... arguments) {
    checkState(mayBeExpression(callee) || callee.is(Token.SUPER), callee);
    return Node.builder(Token.CALL_EXPRESSION)
        .set("callee", callee)
        .setNodes("arguments", ImmutableList.copyOf(arguments))
        .build();
  }

  public static Node newNode(Node callee, Node... arguments) {
    checkState(mayBeExpression(callee), callee);
    return Node.builder(Token.NEW_EXPRESSION)
        .set("callee", callee)
        .setNodes("arguments", ImmutableList.copyOf(arguments))
        .build();
  }

  public static Node comma(Node... expressions) {
    checkArgument(expressions.length > 1, "a sequence needs two expressions");
    return Node.builder(Token.SEQUENCE_EXPRESSION)
        .setNodes("expressions", ImmutableList.copyOf(expressions))
        .build();
  }

  public static Node unary(String operator, Node argument) {
    return Node.builder(Token.UNARY_EXPRESSION)
        .set("operator", operator)
        .set("argument", argument)
        .set("prefix", true)
        .build();
  }

  public static Node not(Node argument) {
    return unary("!", argument);
  }

  public static Node update(String operator, Node argument, boolean prefix) {
    checkArgument(operator.equals("++") || operator.equals("--"), operator);
    return Node.builder(Token.UPDATE_EXPRESSION)
        .set("operator", operator)
        .set("argument", argument)
        .set("prefix", prefix)
        .build();
  }

  public static Node hook(Node test, Node consequent, Node alternate) {
    return Node.builder(Token.CONDITIONAL_EXPRESSION)
        .set("test", test)
        .set("consequent", consequent)
        .set("alternate", alternate)
        .build();
  }

  public static Node objectlit(Node... properties) {
    for (Node property : properties) {
      checkState(
          property.is(Token.OBJECT_PROPERTY)
              || property.is(Token.OBJECT_METHOD)
              || property.is(Token.SPREAD_ELEMENT)
              || property.is(Token.SPREAD_PROPERTY)
              || property.is(Token.PROPERTY),
          property);
    }
    return Node.builder(Token.OBJECT_EXPRESSION)
        .setNodes("properties", ImmutableList.copyOf(properties))
        .build();
  }

  public static Node objectPattern(Node... properties) {
    return Node.builder(Token.OBJECT_PATTERN)
        .setNodes("properties", ImmutableList.copyOf(properties))
        .build();
  }

  public static Node property(Node key, Node value) {
    return Node.builder(Token.OBJECT_PROPERTY).set("key", key).set("value", value).build();
  }

  public static Node property(String key, Node value) {
    return property(name(key), value);
  }

  public static Node shorthandProperty(String name) {
    return Node.builder(Token.OBJECT_PROPERTY)
        .set("key", name(name))
        .set("value", name(name))
        .set("shorthand", true)
        .build();
  }

  public static Node computedProperty(Node key, Node value) {
    return Node.builder(Token.OBJECT_PROPERTY)
        .set("key", key)
        .set("value", value)
        .set("computed", true)
        .build();
  }

  public static Node objectMethod(String kind, Node key, List<Node> params, Node body) {
    checkArgument(
        kind.equals("method") || kind.equals("get") || kind.equals("set"), "bad kind: %s", kind);
    return Node.builder(Token.OBJECT_METHOD)
        .set("kind", kind)
        .set("key", key)
        .setNodes("params", params)
        .set("body", body)
        .build();
  }

  public static Node arraylit(Node... elements) {
    return Node.builder(Token.ARRAY_EXPRESSION)
        .setNodes("elements", ImmutableList.copyOf(elements))
        .build();
  }

  public static Node arrayPattern(Node... elements) {
    return Node.builder(Token.ARRAY_PATTERN)
        .setNodes("elements", ImmutableList.copyOf(elements))
        .build();
  }

  /** A template literal; {@code quasis} holds the raw text around the expressions. */
  public static Node templateLiteral(List<String> quasis, List<Node> expressions) {
    checkArgument(
        quasis.size() == expressions.size() + 1,
        "%s quasis for %s expressions",
        quasis.size(),
        expressions.size());
    ImmutableList.Builder<Node> elements = ImmutableList.builder();
    for (int i = 0; i < quasis.size(); i++) {
      elements.add(
          Node.builder(Token.TEMPLATE_ELEMENT)
              .set("raw", quasis.get(i))
              .set("tail", i == quasis.size() - 1)
              .build());
    }
    return Node.builder(Token.TEMPLATE_LITERAL)
        .setNodes("quasis", elements.build())
        .setNodes("expressions", expressions)
        .build();
  }

  public static Node taggedTemplate(Node tag, Node quasi) {
    checkState(quasi.is(Token.TEMPLATE_LITERAL), quasi);
    return Node.builder(Token.TAGGED_TEMPLATE_EXPRESSION)
        .set("tag", tag)
        .set("quasi", quasi)
        .build();
  }

  // Classes and modules

  public static Node classNode(@Nullable Node id, @Nullable Node superClass, Node body) {
    return classNode(Token.CLASS_DECLARATION, id, superClass, body);
  }

  public static Node classExpression(@Nullable Node id, @Nullable Node superClass, Node body) {
    return classNode(Token.CLASS_EXPRESSION, id, superClass, body);
  }

  private static Node classNode(
      Token token, @Nullable Node id, @Nullable Node superClass, Node body) {
    checkState(body.is(Token.CLASS_BODY), body);
    return Node.builder(token)
        .set("id", id)
        .set("superClass", superClass)
        .set("body", body)
        .build();
  }

  public static Node classBody(Node... members) {
    return Node.builder(Token.CLASS_BODY)
        .setNodes("body", ImmutableList.copyOf(members))
        .build();
  }

  public static Node classMethod(String kind, Node key, List<Node> params, Node body) {
    checkArgument(
        kind.equals("constructor")
            || kind.equals("method")
            || kind.equals("get")
            || kind.equals("set"),
        "bad kind: %s",
        kind);
    return Node.builder(Token.CLASS_METHOD)
        .set("kind", kind)
        .set("key", key)
        .setNodes("params", params)
        .set("body", body)
        .build();
  }

  public static Node classProperty(Node key, @Nullable Node value) {
    return Node.builder(Token.CLASS_PROPERTY).set("key", key).set("value", value).build();
  }

  public static Node decorator(Node expression) {
    return Node.builder(Token.DECORATOR).set("expression", expression).build();
  }

  public static Node importDeclaration(List<Node> specifiers, String source) {
    for (Node specifier : specifiers) {
      checkState(
          specifier.is(Token.IMPORT_SPECIFIER)
              || specifier.is(Token.IMPORT_DEFAULT_SPECIFIER)
              || specifier.is(Token.IMPORT_NAMESPACE_SPECIFIER),
          specifier);
    }
    return Node.builder(Token.IMPORT_DECLARATION)
        .setNodes("specifiers", specifiers)
        .set("source", string(source))
        .build();
  }

  public static Node importSpecifier(String imported, String local) {
    return Node.builder(Token.IMPORT_SPECIFIER)
        .set("imported", name(imported))
        .set("local", name(local))
        .build();
  }

  public static Node importDefaultSpecifier(String local) {
    return Node.builder(Token.IMPORT_DEFAULT_SPECIFIER).set("local", name(local)).build();
  }

  public static Node importNamespaceSpecifier(String local) {
    return Node.builder(Token.IMPORT_NAMESPACE_SPECIFIER).set("local", name(local)).build();
  }

  public static Node exportNamed(Node declaration) {
    return Node.builder(Token.EXPORT_NAMED_DECLARATION).set("declaration", declaration).build();
  }

  public static Node exportSpecifiers(List<Node> specifiers, @Nullable String source) {
    return Node.builder(Token.EXPORT_NAMED_DECLARATION)
        .setNodes("specifiers", specifiers)
        .set("source", source == null ? null : string(source))
        .build();
  }

  public static Node exportSpecifier(String local, String exported) {
    return Node.builder(Token.EXPORT_SPECIFIER)
        .set("local", name(local))
        .set("exported", name(exported))
        .build();
  }

  public static Node exportDefault(Node declaration) {
    return Node.builder(Token.EXPORT_DEFAULT_DECLARATION).set("declaration", declaration).build();
  }

  public static Node exportAll(String source) {
    return Node.builder(Token.EXPORT_ALL_DECLARATION).set("source", string(source)).build();
  }

  // JSX

  public static Node jsxElement(Node openingElement, @Nullable Node closingElement,
      List<Node> children) {
    checkState(openingElement.is(Token.JSX_OPENING_ELEMENT), openingElement);
    checkState(
        openingElement.getBoolean("selfClosing") == (closingElement == null),
        "self-closing elements have no closing element");
    return Node.builder(Token.JSX_ELEMENT)
        .set("openingElement", openingElement)
        .set("closingElement", closingElement)
        .setNodes("children", children)
        .build();
  }

  public static Node jsxOpening(String name, boolean selfClosing, Node... attributes) {
    return Node.builder(Token.JSX_OPENING_ELEMENT)
        .set("name", jsxName(name))
        .setNodes("attributes", ImmutableList.copyOf(attributes))
        .set("selfClosing", selfClosing)
        .build();
  }

  public static Node jsxClosing(String name) {
    return Node.builder(Token.JSX_CLOSING_ELEMENT).set("name", jsxName(name)).build();
  }

  public static Node jsxName(String name) {
    return Node.builder(Token.JSX_IDENTIFIER).set("name", name).build();
  }

  public static Node jsxAttribute(String name, @Nullable Node value) {
    return Node.builder(Token.JSX_ATTRIBUTE).set("name", jsxName(name)).set("value", value).build();
  }

  public static Node jsxExpression(Node expression) {
    return Node.builder(Token.JSX_EXPRESSION_CONTAINER).set("expression", expression).build();
  }

  public static Node jsxText(String value) {
    return Node.builder(Token.JSX_TEXT).set("value", value).build();
  }

  // Flow

  public static Node typeAnnotation(Node type) {
    return Node.builder(Token.TYPE_ANNOTATION).set("typeAnnotation", type).build();
  }

  /** A keyword type such as {@code number} or {@code any}. */
  public static Node keywordType(Token token) {
    checkArgument(KEYWORD_TYPES.contains(token), "not a keyword type: %s", token);
    return Node.builder(token).build();
  }

  public static Node genericType(String name, Node... typeArguments) {
    Node.Builder builder = Node.builder(Token.GENERIC_TYPE_ANNOTATION).set("id", name(name));
    if (typeArguments.length > 0) {
      builder.set(
          "typeParameters",
          Node.builder(Token.TYPE_PARAMETER_INSTANTIATION)
              .setNodes("params", ImmutableList.copyOf(typeArguments))
              .build());
    }
    return builder.build();
  }

  public static Node unionType(Node... types) {
    return Node.builder(Token.UNION_TYPE_ANNOTATION)
        .setNodes("types", ImmutableList.copyOf(types))
        .build();
  }

  public static Node intersectionType(Node... types) {
    return Node.builder(Token.INTERSECTION_TYPE_ANNOTATION)
        .setNodes("types", ImmutableList.copyOf(types))
        .build();
  }

  public static Node nullableType(Node type) {
    return Node.builder(Token.NULLABLE_TYPE_ANNOTATION).set("typeAnnotation", type).build();
  }

  public static Node typeAlias(String name, Node right) {
    return Node.builder(Token.TYPE_ALIAS).set("id", name(name)).set("right", right).build();
  }

  /** Returns {@code name} annotated with {@code type}. */
  public static Node typedName(String name, Node type) {
    return name(name).toBuilder().set("typeAnnotation", typeAnnotation(type)).build();
  }

  private static final ImmutableSet<Token> KEYWORD_TYPES =
      ImmutableSet.of(
          Token.ANY_TYPE_ANNOTATION,
          Token.MIXED_TYPE_ANNOTATION,
          Token.EMPTY_TYPE_ANNOTATION,
          Token.BOOLEAN_TYPE_ANNOTATION,
          Token.NUMBER_TYPE_ANNOTATION,
          Token.STRING_TYPE_ANNOTATION,
          Token.VOID_TYPE_ANNOTATION,
          Token.NULL_LITERAL_TYPE_ANNOTATION,
          Token.THIS_TYPE_ANNOTATION,
          Token.EXISTS_TYPE_ANNOTATION);

  // Comments

  public static Node blockComment(String value) {
    return Node.builder(Token.COMMENT_BLOCK).set("value", value).build();
  }

  public static Node lineComment(String value) {
    return Node.builder(Token.COMMENT_LINE).set("value", value).build();
  }

  // Glimmer templates

  public static Node templateProgram(Node... body) {
    return Node.builder(Token.TEMPLATE_PROGRAM)
        .setNodes("body", ImmutableList.copyOf(body))
        .build();
  }

  public static Node element(String tag, List<Node> attributes, List<Node> children) {
    for (Node attribute : attributes) {
      checkState(attribute.is(Token.ATTR_NODE), attribute);
    }
    return Node.builder(Token.ELEMENT_NODE)
        .set("tag", tag)
        .setNodes("attributes", attributes)
        .setNodes("children", children)
        .build();
  }

  public static Node attr(String name, Node value) {
    checkState(value.getToken().getDialect() == Token.Dialect.TEMPLATE, value);
    return Node.builder(Token.ATTR_NODE).set("name", name).set("value", value).build();
  }

  public static Node textNode(String chars) {
    return Node.builder(Token.TEXT_NODE).set("chars", chars).build();
  }

  public static Node mustache(String path) {
    return Node.builder(Token.MUSTACHE_STATEMENT).set("path", pathExpression(path)).build();
  }

  public static Node pathExpression(String original) {
    return Node.builder(Token.PATH_EXPRESSION)
        .set("original", original)
        .setStrings("parts", ImmutableList.copyOf(original.split("\\.", -1)))
        .build();
  }

  public static Node mustacheComment(String value) {
    return Node.builder(Token.MUSTACHE_COMMENT_STATEMENT).set("value", value).build();
  }

  // Validation helpers

  static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY_STATEMENT:
      case NOOP:
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
      case INTERFACE_DECLARATION:
      case DECLARE_TYPE_ALIAS:
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

  static boolean mayBeExpression(Node n) {
    return n.getToken().getDialect() == Token.Dialect.JAVASCRIPT
        && !mayBeStatement(n)
        && !n.is(Token.SUPER)
        && !n.is(Token.COMMENT_BLOCK)
        && !n.is(Token.COMMENT_LINE);
  }

  private static boolean isAssignmentTarget(Node n) {
    switch (n.getToken()) {
      case IDENTIFIER:
      case MEMBER_EXPRESSION:
      case OBJECT_PATTERN:
      case ARRAY_PATTERN:
      case ASSIGNMENT_PATTERN:
        return true;
      default:
        return false;
    }
  }
}
