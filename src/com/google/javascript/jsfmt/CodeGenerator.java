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
import static com.google.javascript.jsfmt.layout.Docs.BREAK_PARENT;
import static com.google.javascript.jsfmt.layout.Docs.EMPTY;
import static com.google.javascript.jsfmt.layout.Docs.HARDLINE;
import static com.google.javascript.jsfmt.layout.Docs.LINE;
import static com.google.javascript.jsfmt.layout.Docs.LITERALLINE;
import static com.google.javascript.jsfmt.layout.Docs.SOFTLINE;
import static com.google.javascript.jsfmt.layout.Docs.concat;
import static com.google.javascript.jsfmt.layout.Docs.group;
import static com.google.javascript.jsfmt.layout.Docs.ifBreak;
import static com.google.javascript.jsfmt.layout.Docs.join;
import static com.google.javascript.jsfmt.layout.Docs.multilineGroup;
import static com.google.javascript.jsfmt.layout.Docs.text;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.javascript.jsfmt.FormatOptions.QuoteStyle;
import com.google.javascript.jsfmt.FormatOptions.TrailingComma;
import com.google.javascript.jsfmt.ast.Node;
import com.google.javascript.jsfmt.ast.Token;
import com.google.javascript.jsfmt.layout.Doc;
import com.google.javascript.jsfmt.layout.Docs;
import com.google.javascript.jsfmt.layout.Docs.DocBuilder;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a JavaScript, Flow or JSX AST into a layout {@link Doc}.
 *
 * <p>Every node goes through {@link #print}, which adds the node's comments, its decorators and
 * any parentheses its position requires around the node-specific layout.
 */
class CodeGenerator {
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final Splitter NEWLINE_SPLITTER = Splitter.on('\n');

  private final FormatOptions options;
  private final CommentMap comments;
  private final int tabWidth;
  private final boolean markSourcePositions;

  CodeGenerator(FormatOptions options, CommentMap comments, boolean markSourcePositions) {
    this.options = options;
    this.comments = comments;
    this.tabWidth = options.getTabWidth();
    this.markSourcePositions = markSourcePositions;
  }

  Doc generate(Node root) {
    return print(NodePath.of(root));
  }

  /** Prints the current node with its comments, decorators and parentheses. */
  Doc print(NodePath path) {
    Node n = path.getNode();
    Doc body = printNoParens(path);
    ImmutableList<Comment> leading = comments.getLeading(n);
    ImmutableList<Comment> trailing = trailingComments(n);
    if (Docs.isEmpty(body) && leading.isEmpty() && trailing.isEmpty()) {
      return body;
    }

    DocBuilder parts = new DocBuilder();
    addLeadingComments(parts, n, leading);

    boolean needsParens = false;
    Node parent = path.getParentNode();
    if (n.has("decorators")
        && !(parent != null
            && NodeUtil.isExportDeclaration(parent)
            && "declaration".equals(path.getField()))) {
      path.each(decorator -> parts.add(print(decorator)).add(LINE), "decorators");
    } else if (NodeUtil.isExportDeclaration(n)
        && n.has("declaration")
        && n.getNode("declaration").has("decorators")) {
      // The export prints the decorators of its declaration, ahead of the export keyword.
      path.call(
          declaration -> {
            declaration.each(decorator -> parts.add(print(decorator)).add(LINE), "decorators");
            return null;
          },
          "declaration");
    } else {
      needsParens = path.needsParens();
    }

    if (needsParens) {
      parts.add("(");
    }
    if (markSourcePositions && n.getStart() != null) {
      parts.add(Docs.mark(n.getStart()));
    }
    parts.add(body);
    if (needsParens) {
      parts.add(")");
    }
    addTrailingComments(parts, n, trailing);
    return parts.build();
  }

  private Doc printNoParens(NodePath path) {
    Node n = path.getNode();
    return switch (n.getToken()) {
      case FILE -> call(path, "program");
      case PROGRAM -> printProgram(path);
      case DIRECTIVE -> call(path, "value");
      case DIRECTIVE_LITERAL -> text(nodeStr(n.getString("value")));
      case NOOP, EMPTY_STATEMENT -> EMPTY;
      case BLOCK_STATEMENT -> printBlock(path);
      case EXPRESSION_STATEMENT -> concat(call(path, "expression"), text(";"));
      case PARENTHESIZED_EXPRESSION -> concat(text("("), call(path, "expression"), text(")"));

      case RETURN_STATEMENT -> printReturn(path);
      case IF_STATEMENT -> printIf(path);
      case FOR_STATEMENT -> printFor(path);
      case FOR_IN_STATEMENT -> printForEach(path, "for (", " in ");
      case FOR_OF_STATEMENT -> printForEach(path, "for (", " of ");
      case FOR_AWAIT_STATEMENT -> printForEach(path, "for await (", " of ");
      case WHILE_STATEMENT ->
          concat(
              text("while ("),
              call(path, "test"),
              text(")"),
              adjustClause(call(path, "body")));
      case DO_WHILE_STATEMENT -> printDoWhile(path);
      case DO_EXPRESSION -> concat(text("do "), call(path, "body"));
      case BREAK_STATEMENT -> printJump("break", path);
      case CONTINUE_STATEMENT -> printJump("continue", path);
      case LABELED_STATEMENT ->
          concat(call(path, "label"), text(":"), HARDLINE, call(path, "body"));
      case TRY_STATEMENT -> printTry(path);
      case CATCH_CLAUSE -> printCatch(path);
      case THROW_STATEMENT -> concat(text("throw "), call(path, "argument"), text(";"));
      case SWITCH_STATEMENT -> printSwitch(path);
      case SWITCH_CASE -> printSwitchCase(path);
      case DEBUGGER_STATEMENT -> text("debugger;");
      case WITH_STATEMENT ->
          concat(
              text("with ("),
              call(path, "object"),
              text(")"),
              adjustClause(call(path, "body")));
      case VARIABLE_DECLARATION -> printVariableDeclaration(path);
      case VARIABLE_DECLARATOR ->
          n.has("init")
              ? concat(call(path, "id"), text(" = "), call(path, "init"))
              : call(path, "id");

      case IDENTIFIER ->
          concat(
              text(n.getString("name")),
              text(n.getBoolean("optional") ? "?" : ""),
              call(path, "typeAnnotation"));
      case THIS_EXPRESSION -> text("this");
      case SUPER -> text("super");
      case NULL_LITERAL -> text("null");
      case BOOLEAN_LITERAL -> text(n.getBoolean("value") ? "true" : "false");
      case NUMERIC_LITERAL -> text(numberToSource(n));
      case STRING_LITERAL -> printStringLiteral(path);
      case REGEXP_LITERAL ->
          text("/" + n.getString("pattern") + "/" + nullToEmpty(n.getString("flags")));
      case ASSIGNMENT_EXPRESSION ->
          group(
              concat(
                  call(path, "left"),
                  text(" " + n.getString("operator") + " "),
                  call(path, "right")));
      case BINARY_EXPRESSION, LOGICAL_EXPRESSION ->
          group(
              concat(
                  call(path, "left"),
                  text(" " + n.getString("operator")),
                  indent(concat(LINE, call(path, "right")))));
      case ASSIGNMENT_PATTERN -> concat(call(path, "left"), text(" = "), call(path, "right"));
      case MEMBER_EXPRESSION -> printMember(path);
      case META_PROPERTY -> concat(call(path, "meta"), text("."), call(path, "property"));
      case BIND_EXPRESSION -> concat(call(path, "object"), text("::"), call(path, "callee"));
      case SPREAD_ELEMENT, SPREAD_PROPERTY, REST_ELEMENT, REST_PROPERTY ->
          concat(text("..."), call(path, "argument"), call(path, "typeAnnotation"));
      case FUNCTION_DECLARATION, FUNCTION_EXPRESSION -> printFunction(path);
      case ARROW_FUNCTION_EXPRESSION -> printArrowFunction(path);
      case YIELD_EXPRESSION -> printKeywordExpression("yield", n.getBoolean("delegate"), path);
      case AWAIT_EXPRESSION -> printKeywordExpression("await", n.getBoolean("all"), path);
      case CALL_EXPRESSION -> concat(call(path, "callee"), printArgumentsList(path));
      case NEW_EXPRESSION ->
          concat(text("new "), call(path, "callee"), printArgumentsList(path));
      case SEQUENCE_EXPRESSION -> join(", ", map(path, "expressions"));
      case UNARY_EXPRESSION -> printUnary(path);
      case UPDATE_EXPRESSION ->
          n.getBoolean("prefix")
              ? concat(text(n.getString("operator")), call(path, "argument"))
              : concat(call(path, "argument"), text(n.getString("operator")));
      case CONDITIONAL_EXPRESSION ->
          group(
              concat(
                  call(path, "test"),
                  indent(
                      concat(
                          LINE,
                          text("? "),
                          call(path, "consequent"),
                          LINE,
                          text(": "),
                          call(path, "alternate")))));
      case OBJECT_EXPRESSION, OBJECT_PATTERN, OBJECT_TYPE_ANNOTATION -> printObject(path);
      case OBJECT_PROPERTY, PROPERTY -> printProperty(path);
      case OBJECT_METHOD -> printMethod(path);
      case ARRAY_EXPRESSION, ARRAY_PATTERN -> printArray(path);
      case TEMPLATE_LITERAL -> printTemplateLiteral(path);
      case TEMPLATE_ELEMENT -> printTemplateElement(n);
      case TAGGED_TEMPLATE_EXPRESSION -> concat(call(path, "tag"), call(path, "quasi"));

      case CLASS_DECLARATION, CLASS_EXPRESSION -> printClass(path);
      case CLASS_BODY -> printClassBody(path);
      case CLASS_PROPERTY -> printClassProperty(path);
      case CLASS_METHOD, METHOD_DEFINITION ->
          concat(text(n.getBoolean("static") ? "static " : ""), printMethod(path));
      case DECORATOR -> concat(text("@"), call(path, "expression"));
      case IMPORT_DECLARATION -> printImport(path);
      case IMPORT_SPECIFIER -> printSpecifier(path, "imported", "local");
      case IMPORT_DEFAULT_SPECIFIER -> call(path, "local");
      case IMPORT_NAMESPACE_SPECIFIER -> concat(text("* as "), call(path, "local"));
      case EXPORT_NAMED_DECLARATION, EXPORT_DEFAULT_DECLARATION -> printExportDeclaration(path);
      case EXPORT_ALL_DECLARATION -> printExportAll("export *", path);
      case EXPORT_SPECIFIER -> printSpecifier(path, "local", "exported");
      case EXPORT_DEFAULT_SPECIFIER -> call(path, "exported");
      case EXPORT_NAMESPACE_SPECIFIER -> concat(text("* as "), call(path, "exported"));
      case EXPORT_BATCH_SPECIFIER -> text("*");

      case JSX_ELEMENT -> printJsxElement(path);
      case JSX_OPENING_ELEMENT -> printJsxOpeningElement(path);
      case JSX_CLOSING_ELEMENT -> concat(text("</"), call(path, "name"), text(">"));
      case JSX_ATTRIBUTE ->
          n.has("value")
              ? concat(call(path, "name"), text("="), call(path, "value"))
              : call(path, "name");
      case JSX_IDENTIFIER -> text(n.getString("name"));
      case JSX_NAMESPACED_NAME -> concat(call(path, "namespace"), text(":"), call(path, "name"));
      case JSX_MEMBER_EXPRESSION ->
          concat(call(path, "object"), text("."), call(path, "property"));
      case JSX_SPREAD_ATTRIBUTE -> concat(text("{..."), call(path, "argument"), text("}"));
      case JSX_EXPRESSION_CONTAINER -> concat(text("{"), call(path, "expression"), text("}"));
      case JSX_EMPTY_EXPRESSION -> EMPTY;
      case JSX_TEXT -> text(n.getString("value"));

      case TYPE_ANNOTATION -> printTypeAnnotation(path);
      case TYPE_ALIAS, DECLARE_TYPE_ALIAS -> printTypeAlias(path);
      case TYPE_CAST_EXPRESSION ->
          concat(
              text("("), call(path, "expression"), call(path, "typeAnnotation"), text(")"));
      case TYPE_PARAMETER_DECLARATION, TYPE_PARAMETER_INSTANTIATION ->
          concat(text("<"), join(", ", map(path, "params")), text(">"));
      case TYPE_PARAMETER -> printTypeParameter(path);
      case GENERIC_TYPE_ANNOTATION, INTERFACE_EXTENDS, CLASS_IMPLEMENTS ->
          concat(call(path, "id"), call(path, "typeParameters"));
      case QUALIFIED_TYPE_IDENTIFIER ->
          concat(call(path, "qualification"), text("."), call(path, "id"));
      case UNION_TYPE_ANNOTATION -> join(" | ", map(path, "types"));
      case INTERSECTION_TYPE_ANNOTATION -> join(" & ", map(path, "types"));
      case NULLABLE_TYPE_ANNOTATION -> concat(text("?"), call(path, "typeAnnotation"));
      case TUPLE_TYPE_ANNOTATION -> concat(text("["), join(", ", map(path, "types")), text("]"));
      case ARRAY_TYPE_ANNOTATION -> concat(call(path, "elementType"), text("[]"));
      case FUNCTION_TYPE_ANNOTATION -> printFunctionType(path);
      case FUNCTION_TYPE_PARAM -> printFunctionTypeParam(path);
      case OBJECT_TYPE_PROPERTY -> printObjectTypeProperty(path);
      case OBJECT_TYPE_INDEXER ->
          concat(
              text(variance(n)),
              text("["),
              call(path, "id"),
              text(n.has("id") ? ": " : ""),
              call(path, "key"),
              text("]: "),
              call(path, "value"));
      case OBJECT_TYPE_CALL_PROPERTY ->
          concat(text(n.getBoolean("static") ? "static " : ""), call(path, "value"));
      case TYPEOF_TYPE_ANNOTATION -> concat(text("typeof "), call(path, "argument"));
      case ANY_TYPE_ANNOTATION -> text("any");
      case MIXED_TYPE_ANNOTATION -> text("mixed");
      case EMPTY_TYPE_ANNOTATION -> text("empty");
      case BOOLEAN_TYPE_ANNOTATION -> text("boolean");
      case NUMBER_TYPE_ANNOTATION -> text("number");
      case STRING_TYPE_ANNOTATION -> text("string");
      case VOID_TYPE_ANNOTATION -> text("void");
      case NULL_LITERAL_TYPE_ANNOTATION -> text("null");
      case THIS_TYPE_ANNOTATION -> text("this");
      case EXISTS_TYPE_ANNOTATION -> text("*");
      case STRING_LITERAL_TYPE_ANNOTATION -> text(nodeStr(n.getString("value")));
      case NUMBER_LITERAL_TYPE_ANNOTATION -> text(numberToSource(n));
      case BOOLEAN_LITERAL_TYPE_ANNOTATION -> text(n.getBoolean("value") ? "true" : "false");
      case INTERFACE_DECLARATION, DECLARE_INTERFACE -> printInterface(path);
      case DECLARE_CLASS -> printFlowDeclaration(path, printClass(path));
      case DECLARE_FUNCTION ->
          printFlowDeclaration(
              path,
              concat(
                  text("function "),
                  call(path, "id"),
                  n.has("predicate") ? concat(text(" "), call(path, "predicate")) : EMPTY,
                  text(";")));
      case DECLARE_VARIABLE ->
          printFlowDeclaration(
              path,
              concat(
                  text(n.has("kind") ? n.getString("kind") + " " : "var "),
                  call(path, "id"),
                  text(";")));
      case DECLARE_MODULE ->
          printFlowDeclaration(
              path, concat(text("module "), call(path, "id"), text(" "), call(path, "body")));
      case DECLARE_MODULE_EXPORTS ->
          printFlowDeclaration(
              path, concat(text("module.exports"), call(path, "typeAnnotation"), text(";")));
      case DECLARE_EXPORT_DECLARATION -> concat(text("declare "), printExportDeclaration(path));
      case DECLARE_EXPORT_ALL_DECLARATION -> printExportAll("declare export *", path);
      case INFERRED_PREDICATE -> text("%checks");
      case DECLARED_PREDICATE -> concat(text("%checks("), call(path, "value"), text(")"));

      case COMMENT_BLOCK -> text("/*" + nullToEmpty(n.getString("value")) + "*/");
      case COMMENT_LINE -> text("//" + nullToEmpty(n.getString("value")));

      case TEMPLATE_PROGRAM,
          ELEMENT_NODE,
          ATTR_NODE,
          TEXT_NODE,
          MUSTACHE_STATEMENT,
          PATH_EXPRESSION,
          MUSTACHE_COMMENT_STATEMENT ->
          throw new UnsupportedNodeException(n.getToken(), "JavaScript");
    };
  }

  // Helpers for descending into fields. A missing field prints as nothing.

  private Doc call(NodePath path, String field) {
    if (path.getNode().getNode(field) == null) {
      return EMPTY;
    }
    return path.call(this::print, field);
  }

  private ImmutableList<Doc> map(NodePath path, String field) {
    return path.map(this::print, field);
  }

  private Doc indent(Doc contents) {
    return Docs.indent(tabWidth, contents);
  }

  // Comments

  private ImmutableList<Comment> trailingComments(Node n) {
    ImmutableList<Comment> trailing = comments.getTrailing(n);
    if (trailing.isEmpty() || !printsDanglingComments(n)) {
      return trailing;
    }
    ImmutableList.Builder<Comment> result = ImmutableList.builder();
    for (Comment comment : trailing) {
      if (!comment.isDangling()) {
        result.add(comment);
      }
    }
    return result.build();
  }

  /** Nodes that print comments found inside their empty bodies themselves. */
  private static boolean printsDanglingComments(Node n) {
    return n.is(Token.BLOCK_STATEMENT) || n.is(Token.CLASS_BODY) || n.is(Token.PROGRAM);
  }

  private ImmutableList<Doc> danglingComments(Node n) {
    ImmutableList.Builder<Doc> result = ImmutableList.builder();
    for (Comment comment : comments.getTrailing(n)) {
      if (comment.isDangling()) {
        result.add(text(comment.toSource()));
      }
    }
    return result.build();
  }

  private void addLeadingComments(DocBuilder parts, Node host, List<Comment> leading) {
    for (int i = 0; i < leading.size(); i++) {
      Comment comment = leading.get(i);
      parts.add(comment.toSource());
      int nextLine;
      if (i + 1 < leading.size()) {
        nextLine = leading.get(i + 1).getStart().getLine();
      } else if (host.getStart() != null) {
        nextLine = host.getStart().getLine();
      } else {
        nextLine = comment.getEnd().getLine() + 1;
      }
      if (comment.getStyle() == Comment.Style.BLOCK && nextLine == comment.getEnd().getLine()) {
        parts.add(" ");
      } else {
        parts.add(HARDLINE);
        addBlankLines(parts, nextLine - comment.getEnd().getLine() - 1);
      }
    }
  }

  private void addTrailingComments(DocBuilder parts, Node host, List<Comment> trailing) {
    int previousLine = host.getEnd() != null ? host.getEnd().getLine() : -1;
    for (Comment comment : trailing) {
      int line = comment.getStart().getLine();
      if (previousLine >= 0 && line > previousLine) {
        parts.add(HARDLINE);
        addBlankLines(parts, line - previousLine - 1);
      } else {
        parts.add(" ");
      }
      parts.add(comment.toSource());
      if (comment.getStyle() == Comment.Style.LINE) {
        parts.add(BREAK_PARENT);
      }
      previousLine = comment.getEnd().getLine();
    }
  }

  private void addBlankLines(DocBuilder parts, int blankLines) {
    int count = Math.min(blankLines, options.getMaxBlankLinesAroundComments());
    for (int i = 0; i < count; i++) {
      parts.add(HARDLINE);
    }
  }

  // Statements

  private Doc printProgram(NodePath path) {
    List<Doc> items = new ArrayList<>();
    for (Doc directive : map(path, "directives")) {
      items.add(concat(directive, text(";")));
    }
    items.addAll(printStatements(path, "body"));
    items.addAll(danglingComments(path.getNode()));
    return concat(join(HARDLINE, items), HARDLINE);
  }

  /** Prints the statements of a list field, dropping empty statements. */
  private List<Doc> printStatements(NodePath path, String field) {
    List<Doc> printed = new ArrayList<>();
    path.each(
        statement -> {
          if (!statement.getNode().is(Token.EMPTY_STATEMENT)) {
            printed.add(print(statement));
          }
        },
        field);
    return printed;
  }

  private Doc printBlock(NodePath path) {
    List<Doc> items = new ArrayList<>();
    for (Doc directive : map(path, "directives")) {
      items.add(concat(directive, text(";")));
    }
    items.addAll(printStatements(path, "body"));
    items.addAll(danglingComments(path.getNode()));
    if (items.isEmpty()) {
      return text("{}");
    }
    return concat(text("{"), indent(concat(HARDLINE, join(HARDLINE, items))), HARDLINE, text("}"));
  }

  /**
   * Keeps a braced clause on the line of its keyword. Any other clause follows the keyword when
   * it fits and moves to its own indented line when it does not.
   */
  private Doc adjustClause(Doc clause) {
    if (Docs.startsWith(clause, "{")) {
      return concat(text(" "), clause);
    }
    return group(indent(concat(LINE, clause)));
  }

  private Doc printReturn(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder().add("return");
    if (n.has("argument")) {
      Doc argument = call(path, "argument");
      if (n.getNode("argument").is(Token.JSX_ELEMENT) && Docs.hasHardLine(argument)) {
        parts.add(" (").add(indent(concat(HARDLINE, argument))).add(HARDLINE).add(")");
      } else {
        parts.add(" ").add(argument);
      }
    }
    return parts.add(";").build();
  }

  private Doc printIf(NodePath path) {
    Node n = path.getNode();
    Doc consequent = call(path, "consequent");
    DocBuilder parts =
        new DocBuilder()
            .add("if (")
            .add(group(concat(indent(concat(SOFTLINE, call(path, "test"))), SOFTLINE)))
            .add(")")
            .add(adjustClause(consequent));
    if (n.has("alternate")) {
      parts.add(Docs.startsWith(consequent, "{") ? text(" else") : concat(HARDLINE, text("else")));
      Doc alternate = call(path, "alternate");
      if (n.getNode("alternate").is(Token.IF_STATEMENT)) {
        parts.add(" ").add(alternate);
      } else {
        parts.add(adjustClause(alternate));
      }
    }
    return parts.build();
  }

  private Doc printFor(NodePath path) {
    Node n = path.getNode();
    Doc body = adjustClause(call(path, "body"));
    if (!n.has("init") && !n.has("test") && !n.has("update")) {
      return concat(text("for (;;)"), body);
    }
    return concat(
        text("for ("),
        group(
            concat(
                indent(
                    concat(
                        SOFTLINE,
                        call(path, "init"),
                        text(";"),
                        LINE,
                        call(path, "test"),
                        text(";"),
                        LINE,
                        call(path, "update"))),
                SOFTLINE)),
        text(")"),
        body);
  }

  private Doc printForEach(NodePath path, String head, String keyword) {
    return concat(
        text(head),
        call(path, "left"),
        text(keyword),
        call(path, "right"),
        text(")"),
        adjustClause(call(path, "body")));
  }

  private Doc printDoWhile(NodePath path) {
    Doc body = call(path, "body");
    return concat(
        text("do"),
        adjustClause(body),
        Docs.startsWith(body, "{") ? text(" while") : concat(HARDLINE, text("while")),
        text(" ("),
        call(path, "test"),
        text(");"));
  }

  private Doc printJump(String keyword, NodePath path) {
    if (path.getNode().has("label")) {
      return concat(text(keyword + " "), call(path, "label"), text(";"));
    }
    return text(keyword + ";");
  }

  private Doc printTry(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder().add("try ").add(call(path, "block"));
    if (n.has("handler")) {
      parts.add(" ").add(call(path, "handler"));
    }
    if (n.has("finalizer")) {
      parts.add(" finally ").add(call(path, "finalizer"));
    }
    return parts.build();
  }

  private Doc printCatch(NodePath path) {
    if (!path.getNode().has("param")) {
      return concat(text("catch "), call(path, "body"));
    }
    return concat(text("catch ("), call(path, "param"), text(") "), call(path, "body"));
  }

  private Doc printSwitch(NodePath path) {
    Doc head = concat(text("switch ("), call(path, "discriminant"), text(") "));
    ImmutableList<Doc> cases = map(path, "cases");
    if (cases.isEmpty()) {
      return concat(head, text("{}"));
    }
    return concat(
        head, text("{"), indent(concat(HARDLINE, join(HARDLINE, cases))), HARDLINE, text("}"));
  }

  private Doc printSwitchCase(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder();
    if (n.has("test")) {
      parts.add("case ").add(call(path, "test")).add(":");
    } else {
      parts.add("default:");
    }
    List<Doc> consequent = printStatements(path, "consequent");
    if (!consequent.isEmpty()) {
      parts.add(indent(concat(HARDLINE, join(HARDLINE, consequent))));
    }
    return parts.build();
  }

  private Doc printVariableDeclaration(NodePath path) {
    Node n = path.getNode();
    ImmutableList<Doc> printed = map(path, "declarations");
    checkState(!printed.isEmpty(), "declaration without declarators");
    DocBuilder rest = new DocBuilder();
    for (Doc declarator : printed.subList(1, printed.size())) {
      rest.add(",").add(LINE).add(declarator);
    }
    DocBuilder parts =
        new DocBuilder()
            .add(n.getString("kind"))
            .add(" ")
            .add(printed.get(0))
            .add(indent(rest.build()));
    if (!isForHead(path)) {
      parts.add(";");
    }
    return multilineGroup(parts.build());
  }

  private static boolean isForHead(NodePath path) {
    Node parent = path.getParentNode();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case FOR_STATEMENT:
        return "init".equals(path.getField());
      case FOR_IN_STATEMENT:
      case FOR_OF_STATEMENT:
      case FOR_AWAIT_STATEMENT:
        return "left".equals(path.getField());
      default:
        return false;
    }
  }

  // Expressions

  private Doc printStringLiteral(NodePath path) {
    String value = path.getNode().getString("value");
    Node parent = path.getParentNode();
    if (parent != null && parent.is(Token.JSX_ATTRIBUTE)) {
      return text(jsxAttributeString(value));
    }
    return text(nodeStr(value));
  }

  private Doc printMember(NodePath path) {
    Doc object = call(path, "object");
    Doc property = call(path, "property");
    if (path.getNode().getBoolean("computed")) {
      return concat(object, text("["), property, text("]"));
    }
    return concat(object, text("."), property);
  }

  private Doc printKeywordExpression(String keyword, boolean star, NodePath path) {
    DocBuilder parts = new DocBuilder().add(keyword);
    if (star) {
      parts.add("*");
    }
    if (path.getNode().has("argument")) {
      parts.add(" ").add(call(path, "argument"));
    }
    return parts.build();
  }

  private Doc printUnary(NodePath path) {
    Node n = path.getNode();
    String operator = n.getString("operator");
    DocBuilder parts = new DocBuilder().add(operator);
    Node argument = n.getNode("argument");
    if (CharMatcher.inRange('a', 'z').matches(operator.charAt(operator.length() - 1))
        || startsWithOperator(argument, operator)) {
      parts.add(" ");
    }
    return parts.add(call(path, "argument")).build();
  }

  /** Whether printing {@code argument} right after {@code operator} would merge the tokens. */
  private static boolean startsWithOperator(Node argument, String operator) {
    if (!operator.equals("-") && !operator.equals("+")) {
      return false;
    }
    if (argument.is(Token.UNARY_EXPRESSION)) {
      return argument.getString("operator").startsWith(operator);
    }
    if (argument.is(Token.UPDATE_EXPRESSION) && argument.getBoolean("prefix")) {
      return argument.getString("operator").startsWith(operator);
    }
    return false;
  }

  private Doc printArgumentsList(NodePath path) {
    ImmutableList<Doc> printed = map(path, "arguments");
    Doc args;
    if (printed.isEmpty()) {
      args = EMPTY;
    } else if (printed.size() == 1 && Docs.startsWith(printed.get(0), "{")) {
      // A lone object argument keeps its braces next to the parentheses.
      args = printed.get(0);
    } else {
      args =
          concat(
              indent(
                  concat(
                      SOFTLINE,
                      join(concat(text(","), LINE), printed),
                      options.getTrailingComma() == TrailingComma.ALL
                              && !endsWithRest(path.getNode().getNodes("arguments"))
                          ? ifBreak(text(","))
                          : EMPTY)),
              SOFTLINE);
    }
    return multilineGroup(concat(text("("), args, text(")")));
  }

  private Doc printFunctionParams(NodePath path) {
    List<Doc> printed = new ArrayList<>(map(path, "params"));
    if (path.getNode().has("rest")) {
      printed.add(concat(text("..."), call(path, "rest")));
    }
    return group(join(concat(text(","), LINE), printed));
  }

  private Doc printReturnType(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder().add(call(path, "returnType"));
    if (n.has("predicate")) {
      parts.add(n.has("returnType") ? " " : ": ").add(call(path, "predicate"));
    }
    return parts.build();
  }

  private Doc printFunction(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder();
    if (n.getBoolean("async")) {
      parts.add("async ");
    }
    parts.add("function");
    if (n.getBoolean("generator")) {
      parts.add("*");
    }
    if (n.has("id")) {
      parts.add(" ").add(call(path, "id"));
    }
    parts
        .add(call(path, "typeParameters"))
        .add(
            group(
                concat(
                    text("("),
                    indent(concat(SOFTLINE, printFunctionParams(path))),
                    SOFTLINE,
                    text(")"))))
        .add(printReturnType(path))
        .add(" ")
        .add(call(path, "body"));
    return group(parts.build());
  }

  private Doc printArrowFunction(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder();
    if (n.getBoolean("async")) {
      parts.add("async ");
    }
    parts.add(call(path, "typeParameters"));
    if (canOmitArrowParens(n)) {
      parts.add(map(path, "params").get(0));
    } else {
      parts.add("(").add(printFunctionParams(path)).add(")").add(printReturnType(path));
    }
    return parts.add(" => ").add(call(path, "body")).build();
  }

  private boolean canOmitArrowParens(Node n) {
    if (options.getArrowParensAlways()) {
      return false;
    }
    ImmutableList<Node> params = n.getNodes("params");
    return params.size() == 1
        && !n.has("rest")
        && params.get(0).is(Token.IDENTIFIER)
        && !params.get(0).has("typeAnnotation")
        && !params.get(0).getBoolean("optional")
        && !n.has("typeParameters")
        && !n.has("predicate")
        && !n.has("returnType");
  }

  private Doc printObject(NodePath path) {
    Node n = path.getNode();
    boolean isTypeAnnotation = n.is(Token.OBJECT_TYPE_ANNOTATION);
    String separator = isTypeAnnotation ? ";" : ",";
    boolean exact = n.getBoolean("exact");

    List<Doc> props = new ArrayList<>();
    List<String> fields =
        isTypeAnnotation
            ? ImmutableList.of("indexers", "callProperties", "properties")
            : ImmutableList.of("properties");
    for (String field : fields) {
      path.each(prop -> props.add(group(print(prop))), field);
    }
    if (props.isEmpty()) {
      return concat(text(exact ? "{||}" : "{}"), call(path, "typeAnnotation"));
    }

    Doc padding = options.getObjectCurlySpacing() ? LINE : SOFTLINE;
    boolean trailingComma =
        !isTypeAnnotation
            && options.getTrailingComma() != TrailingComma.NONE
            && !endsWithRest(n.getNodes("properties"));
    return multilineGroup(
        concat(
            text(exact ? "{|" : "{"),
            indent(
                concat(
                    padding,
                    join(concat(text(separator), LINE), props),
                    trailingComma ? ifBreak(text(",")) : EMPTY)),
            padding,
            text(exact ? "|}" : "}"),
            call(path, "typeAnnotation")));
  }

  private static boolean endsWithRest(List<Node> elements) {
    if (elements.isEmpty()) {
      return false;
    }
    Node last = elements.get(elements.size() - 1);
    return last.is(Token.REST_ELEMENT) || last.is(Token.REST_PROPERTY);
  }

  private Doc printProperty(NodePath path) {
    Node n = path.getNode();
    String kind = n.getString("kind");
    if (n.getBoolean("method") || "get".equals(kind) || "set".equals(kind)) {
      return printMethod(path);
    }
    Node value = n.getNode("value");
    if (n.getBoolean("shorthand") && value != null && value.is(Token.ASSIGNMENT_PATTERN)) {
      return call(path, "value");
    }
    DocBuilder parts = new DocBuilder().add(printKey(path));
    if (!n.getBoolean("shorthand")) {
      parts.add(": ").add(call(path, "value"));
    }
    return parts.build();
  }

  private Doc printKey(NodePath path) {
    Doc key = call(path, "key");
    return path.getNode().getBoolean("computed") ? concat(text("["), key, text("]")) : key;
  }

  /**
   * Prints an object or class method. Babel methods carry the function fields themselves; ESTree
   * methods hold a function expression in {@code value}.
   */
  private Doc printMethod(NodePath path) {
    Node n = path.getNode();
    boolean inline = n.is(Token.OBJECT_METHOD) || n.is(Token.CLASS_METHOD);
    Node function = inline ? n : n.getNode("value");
    checkState(
        function != null && (inline || function.is(Token.FUNCTION_EXPRESSION)),
        "method without a function: %s",
        n);

    DocBuilder parts = new DocBuilder();
    if (function.getBoolean("async")) {
      parts.add("async ");
    }
    String kind = n.getString("kind");
    if ("get".equals(kind) || "set".equals(kind)) {
      parts.add(kind).add(" ");
    } else if (function.getBoolean("generator")) {
      parts.add("*");
    }
    parts.add(printKey(path));
    if (inline) {
      parts.add(printSignatureAndBody(path));
    } else {
      parts.add(path.call(this::printSignatureAndBody, "value"));
    }
    return parts.build();
  }

  private Doc printSignatureAndBody(NodePath path) {
    return concat(
        call(path, "typeParameters"),
        text("("),
        printFunctionParams(path),
        text(")"),
        printReturnType(path),
        text(" "),
        call(path, "body"));
  }

  private Doc printArray(NodePath path) {
    Node n = path.getNode();
    ImmutableList<Node> elements = n.getNodes("elements");
    if (elements.isEmpty()) {
      return concat(text("[]"), call(path, "typeAnnotation"));
    }
    Node last = elements.get(elements.size() - 1);
    Doc tail;
    if (last.is(Token.NOOP)) {
      // A trailing hole needs its own comma to count.
      tail = text(",");
    } else if (options.getTrailingComma() != TrailingComma.NONE && !endsWithRest(elements)) {
      tail = ifBreak(text(","));
    } else {
      tail = EMPTY;
    }
    return concat(
        multilineGroup(
            concat(
                text("["),
                indent(concat(LINE, join(concat(text(","), LINE), map(path, "elements")), tail)),
                LINE,
                text("]"))),
        call(path, "typeAnnotation"));
  }

  private Doc printTemplateLiteral(NodePath path) {
    ImmutableList<Doc> expressions = map(path, "expressions");
    DocBuilder parts = new DocBuilder().add("`");
    path.each(
        quasi -> {
          parts.add(print(quasi));
          int i = quasi.getIndex();
          if (i < expressions.size()) {
            parts.add("${").add(expressions.get(i)).add("}");
          }
        },
        "quasis");
    return parts.add("`").build();
  }

  private static Doc printTemplateElement(Node n) {
    List<Doc> lines = new ArrayList<>();
    for (String line : NEWLINE_SPLITTER.split(n.getString("raw"))) {
      lines.add(text(line));
    }
    return join(LITERALLINE, lines);
  }

  // Classes

  private Doc printClass(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder().add("class");
    if (n.has("id")) {
      parts.add(" ").add(call(path, "id")).add(call(path, "typeParameters"));
    }
    if (n.has("superClass")) {
      parts
          .add(" extends ")
          .add(call(path, "superClass"))
          .add(call(path, "superTypeParameters"));
    } else if (n.has("extends")) {
      parts.add(" extends ").add(join(", ", map(path, "extends")));
    }
    if (n.has("implements")) {
      parts.add(" implements ").add(join(", ", map(path, "implements")));
    }
    return parts.add(" ").add(call(path, "body")).build();
  }

  private Doc printClassBody(NodePath path) {
    List<Doc> members = new ArrayList<>(printStatements(path, "body"));
    members.addAll(danglingComments(path.getNode()));
    if (members.isEmpty()) {
      return text("{}");
    }
    return concat(
        text("{"), indent(concat(HARDLINE, join(HARDLINE, members))), HARDLINE, text("}"));
  }

  private Doc printClassProperty(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder();
    if (n.getBoolean("static")) {
      parts.add("static ");
    }
    Doc key = call(path, "key");
    if (n.getBoolean("computed")) {
      key = concat(text("["), key, text("]"));
    } else {
      key = concat(text(variance(n)), key);
    }
    parts.add(key).add(call(path, "typeAnnotation"));
    if (n.has("value")) {
      parts.add(" = ").add(call(path, "value"));
    }
    return parts.add(";").build();
  }

  private static String variance(Node n) {
    String variance = n.getString("variance");
    if ("plus".equals(variance)) {
      return "+";
    } else if ("minus".equals(variance)) {
      return "-";
    }
    return "";
  }

  // Modules

  private Doc printImport(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder().add("import ");
    String importKind = n.getString("importKind");
    if (importKind != null && !importKind.equals("value")) {
      parts.add(importKind + " ");
    }
    if (n.has("specifiers")) {
      parts.add(printSpecifierList(path)).add(" from ");
    }
    return parts.add(call(path, "source")).add(";").build();
  }

  /**
   * Prints import or export specifiers. Default and namespace specifiers print bare; the named
   * ones share a single pair of braces.
   */
  private Doc printSpecifierList(NodePath path) {
    List<Doc> bare = new ArrayList<>();
    List<Doc> named = new ArrayList<>();
    path.each(
        specifier -> {
          switch (specifier.getNode().getToken()) {
            case IMPORT_DEFAULT_SPECIFIER:
            case IMPORT_NAMESPACE_SPECIFIER:
            case EXPORT_DEFAULT_SPECIFIER:
            case EXPORT_NAMESPACE_SPECIFIER:
            case EXPORT_BATCH_SPECIFIER:
              checkState(named.isEmpty(), "%s after a named specifier", specifier.getNode());
              bare.add(print(specifier));
              break;
            default:
              named.add(print(specifier));
          }
        },
        "specifiers");
    List<Doc> groups = new ArrayList<>(bare);
    if (!named.isEmpty()) {
      String open = options.getObjectCurlySpacing() ? "{ " : "{";
      String close = options.getObjectCurlySpacing() ? " }" : "}";
      groups.add(concat(text(open), join(", ", named), text(close)));
    }
    return join(", ", groups);
  }

  private Doc printSpecifier(NodePath path, String nameField, String aliasField) {
    Node n = path.getNode();
    Node name = n.getNode(nameField);
    Node alias = n.getNode(aliasField);
    if (name == null) {
      return call(path, aliasField);
    }
    Doc printed = call(path, nameField);
    if (alias != null && !sameName(name, alias)) {
      return concat(printed, text(" as "), call(path, aliasField));
    }
    return printed;
  }

  private static boolean sameName(Node a, Node b) {
    String name = a.getString("name");
    return name != null && name.equals(b.getString("name"));
  }

  private Doc printExportDeclaration(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder().add("export ");
    boolean isDefault = n.is(Token.EXPORT_DEFAULT_DECLARATION) || n.getBoolean("default");
    if (isDefault) {
      parts.add("default ");
    }
    if (n.has("declaration")) {
      parts.add(call(path, "declaration"));
      Node declaration = n.getNode("declaration");
      if (isDefault && !NodeUtil.isStatement(declaration) && !isDeclarationLike(declaration)) {
        parts.add(";");
      }
      return parts.build();
    }
    if ("type".equals(n.getString("exportKind"))) {
      parts.add("type ");
    }
    if (n.has("specifiers")) {
      parts.add(printSpecifierList(path));
    } else {
      parts.add("{}");
    }
    if (n.has("source")) {
      parts.add(" from ").add(call(path, "source"));
    }
    return parts.add(";").build();
  }

  /** Function and class expressions after {@code export default} end without a semicolon. */
  private static boolean isDeclarationLike(Node n) {
    return n.is(Token.FUNCTION_EXPRESSION) || n.is(Token.CLASS_EXPRESSION);
  }

  private Doc printExportAll(String head, NodePath path) {
    DocBuilder parts = new DocBuilder().add(head);
    if (path.getNode().has("exported")) {
      parts.add(" as ").add(call(path, "exported"));
    }
    return parts.add(" from ").add(call(path, "source")).add(";").build();
  }

  // JSX

  private Doc printJsxElement(NodePath path) {
    Node n = path.getNode();
    Doc opening = call(path, "openingElement");
    if (n.getNode("openingElement").getBoolean("selfClosing")) {
      checkState(!n.has("closingElement"), "self-closing element with a closing tag: %s", n);
      return opening;
    }

    List<Doc> children = new ArrayList<>();
    path.each(child -> children.add(printJsxChild(child)), "children");
    Doc last = children.isEmpty() ? EMPTY : children.remove(children.size() - 1);
    return concat(opening, indent(concat(children)), last, call(path, "closingElement"));
  }

  private Doc printJsxChild(NodePath path) {
    Node child = path.getNode();
    if (child.is(Token.JSX_TEXT)) {
      String value = child.getString("value");
      if (!WHITESPACE.matchesAllOf(value)) {
        List<Doc> lines = new ArrayList<>();
        for (String line : NEWLINE_SPLITTER.split(WHITESPACE.trimFrom(value))) {
          lines.add(text(WHITESPACE.trimAndCollapseFrom(line, ' ')));
        }
        return join(HARDLINE, lines);
      } else if (value.indexOf('\n') >= 0) {
        return HARDLINE;
      }
    }
    return print(path);
  }

  private Doc printJsxOpeningElement(NodePath path) {
    Node n = path.getNode();
    List<Doc> attributes = new ArrayList<>();
    path.each(attribute -> attributes.add(concat(text(" "), print(attribute))), "attributes");
    return group(
        concat(
            text("<"),
            call(path, "name"),
            concat(attributes),
            text(n.getBoolean("selfClosing") ? "/>" : ">")));
  }

  // Flow

  private Doc printTypeAnnotation(NodePath path) {
    Node type = path.getNode().getNode("typeAnnotation");
    if (type == null) {
      return EMPTY;
    }
    if (type.is(Token.FUNCTION_TYPE_ANNOTATION)) {
      return call(path, "typeAnnotation");
    }
    return concat(text(": "), call(path, "typeAnnotation"));
  }

  private Doc printTypeAlias(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder();
    Node parent = path.getParentNode();
    Node grandparent = path.getAncestor(2);
    boolean exportClaimsDeclare = parent != null && parent.is(Token.DECLARE_EXPORT_DECLARATION);
    if (!exportClaimsDeclare
        && (n.is(Token.DECLARE_TYPE_ALIAS)
            || (grandparent != null && grandparent.is(Token.DECLARE_MODULE)))) {
      parts.add("declare ");
    }
    return parts
        .add("type ")
        .add(call(path, "id"))
        .add(call(path, "typeParameters"))
        .add(" = ")
        .add(call(path, "right"))
        .add(";")
        .build();
  }

  private Doc printTypeParameter(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder().add(variance(n)).add(n.getString("name"));
    parts.add(call(path, "bound"));
    if (n.has("default")) {
      parts.add("=").add(call(path, "default"));
    }
    return parts.build();
  }

  /**
   * Function types print in arrow form ({@code (a: A) => B}) except where they describe a method
   * or a declared function, which use a colon before the return type.
   */
  private Doc printFunctionType(NodePath path) {
    Node n = path.getNode();
    Node parent = path.getParentNode();
    Node declaration = path.getAncestor(3);
    boolean isMethod =
        parent != null
            && ((parent.is(Token.OBJECT_TYPE_PROPERTY)
                    && !parent.has("variance")
                    && !parent.getBoolean("optional"))
                || parent.is(Token.OBJECT_TYPE_CALL_PROPERTY));
    boolean isArrow =
        !(isMethod || (declaration != null && declaration.is(Token.DECLARE_FUNCTION)));

    DocBuilder parts = new DocBuilder();
    if (isArrow && parent != null && parent.is(Token.TYPE_ANNOTATION)) {
      parts.add(": ");
    }
    parts.add(call(path, "typeParameters")).add("(").add(printFunctionParams(path)).add(")");
    if (n.has("returnType") || n.has("predicate")) {
      parts
          .add(isArrow ? " => " : ": ")
          .add(call(path, "returnType"))
          .add(call(path, "predicate"));
    }
    return parts.build();
  }

  private Doc printFunctionTypeParam(NodePath path) {
    Node n = path.getNode();
    if (!n.has("name")) {
      return call(path, "typeAnnotation");
    }
    return concat(
        call(path, "name"),
        text(n.getBoolean("optional") ? "?" : ""),
        text(": "),
        call(path, "typeAnnotation"));
  }

  private Doc printObjectTypeProperty(NodePath path) {
    Node n = path.getNode();
    Node value = n.getNode("value");
    boolean isMethod =
        !n.has("variance")
            && !n.getBoolean("optional")
            && value != null
            && value.is(Token.FUNCTION_TYPE_ANNOTATION);
    return concat(
        text(n.getBoolean("static") ? "static " : ""),
        text(variance(n)),
        call(path, "key"),
        text(n.getBoolean("optional") ? "?" : ""),
        text(isMethod ? "" : ": "),
        call(path, "value"));
  }

  private Doc printInterface(NodePath path) {
    Node n = path.getNode();
    DocBuilder parts = new DocBuilder();
    parts
        .add("interface ")
        .add(call(path, "id"))
        .add(call(path, "typeParameters"));
    if (n.has("extends")) {
      parts.add(" extends ").add(join(", ", map(path, "extends")));
    }
    parts.add(" ").add(call(path, "body"));
    if (n.is(Token.DECLARE_INTERFACE)) {
      return printFlowDeclaration(path, parts.build());
    }
    return parts.build();
  }

  /**
   * Prefixes a declaration with {@code declare} unless an enclosing {@code declare export}
   * already printed it.
   */
  private Doc printFlowDeclaration(NodePath path, Doc declaration) {
    Node parent = path.getParentNode();
    if (parent != null
        && NodeUtil.isExportDeclaration(parent)
        && "declaration".equals(path.getField())) {
      checkState(
          parent.is(Token.DECLARE_EXPORT_DECLARATION),
          "%s exported by %s",
          path.getNode(),
          parent);
      return declaration;
    }
    return concat(text("declare "), declaration);
  }

  // Literals

  /** Numbers print as written when the source text is known. */
  static String numberToSource(Node n) {
    String raw = n.getString("raw");
    if (raw != null) {
      return raw;
    }
    return formatNumber(n.getDouble("value"));
  }

  static String formatNumber(double x) {
    if (Double.isNaN(x)) {
      return "NaN";
    }
    if (Double.isInfinite(x)) {
      return x > 0 ? "Infinity" : "-Infinity";
    }
    if ((long) x == x) {
      return Long.toString((long) x);
    }
    String s = String.valueOf(x);
    int exponent = s.indexOf('E');
    if (exponent < 0) {
      return s;
    }
    // Plain notation between 1e-6 and 1e21, exponent notation outside.
    double abs = Math.abs(x);
    if (abs >= 1e-6 && abs < 1e21) {
      return new BigDecimal(s).stripTrailingZeros().toPlainString();
    }
    String mantissa = s.substring(0, exponent);
    if (mantissa.endsWith(".0")) {
      mantissa = mantissa.substring(0, mantissa.length() - 2);
    }
    String power = s.substring(exponent + 1);
    return mantissa + "e" + (power.startsWith("-") ? power : "+" + power);
  }

  /** Quotes a string value with the configured quote character. */
  String nodeStr(String s) {
    int singleq = 0;
    int doubleq = 0;
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
        case '"': doubleq++; break;
        case '\'': singleq++; break;
        default: // skip non-quote characters
      }
    }

    QuoteStyle quote = options.getQuote();
    boolean useSingle =
        quote == QuoteStyle.SINGLE || (quote == QuoteStyle.AUTO && singleq < doubleq);
    if (useSingle) {
      return '\'' + strEscape(s, "\"", "\\'") + '\'';
    }
    return '"' + strEscape(s, "\\\"", "'") + '"';
  }

  private static String strEscape(String s, String doublequoteEscape, String singlequoteEscape) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\0': sb.append("\\x00"); break;
        case '\u000B': sb.append("\\x0B"); break;
        case '\b': sb.append("\\b"); break;
        case '\f': sb.append("\\f"); break;
        case '\n': sb.append("\\n"); break;
        case '\r': sb.append("\\r"); break;
        case '\t': sb.append("\\t"); break;
        case '\\': sb.append("\\\\"); break;
        case '\"': sb.append(doublequoteEscape); break;
        case '\'': sb.append(singlequoteEscape); break;

        // From LineTerminators (ES5 Section 7.3, Table 3)
        case '\u2028': sb.append("\\u2028"); break;
        case '\u2029': sb.append("\\u2029"); break;

        default:
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02X", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  /**
   * JSX attribute strings have no escapes, so the quote is picked to avoid the value's quotes and
   * remaining double quotes become entities.
   */
  private static String jsxAttributeString(String s) {
    if (s.indexOf('"') >= 0 && s.indexOf('\'') < 0) {
      return '\'' + s + '\'';
    }
    return '"' + s.replace("\"", "&quot;") + '"';
  }

}
