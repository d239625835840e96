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
import com.google.javascript.jsfmt.FormatOptions.QuoteStyle;
import com.google.javascript.jsfmt.FormatOptions.TrailingComma;
import com.google.javascript.jsfmt.ast.IR;
import com.google.javascript.jsfmt.ast.Node;
import com.google.javascript.jsfmt.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest extends CodePrinterTestBase {

  private static Node name(String name) {
    return IR.name(name);
  }

  private static Node callStatement(String callee) {
    return IR.exprResult(IR.call(name(callee)));
  }

  @Test
  public void testIfWithoutBraces() {
    assertPrint("if (a) b();", IR.ifNode(name("a"), callStatement("b")));
  }

  @Test
  public void testIfElseWithoutBraces() {
    assertPrint(
        "if (a) b();\nelse c();", IR.ifNode(name("a"), callStatement("b"), callStatement("c")));
  }

  @Test
  public void testIfElseWithBraces() {
    assertPrint(
        "if (a) {\n  b();\n} else {\n  c();\n}",
        IR.ifNode(name("a"), IR.block(callStatement("b")), IR.block(callStatement("c"))));
  }

  @Test
  public void testElseIf() {
    assertPrint(
        "if (a) {\n  b();\n} else if (c) {\n  d();\n}",
        IR.ifNode(
            name("a"),
            IR.block(callStatement("b")),
            IR.ifNode(name("c"), IR.block(callStatement("d")))));
  }

  @Test
  public void testUnbracedClauseBreaksWhenTooLong() {
    setOptions(options.toBuilder().setPrintWidth(10));
    assertPrint(
        "if (a)\n  something();", IR.ifNode(name("a"), callStatement("something")));
  }

  @Test
  public void testObjectFitsOnOneLine() {
    assertPrint(
        "var x = { a: 1, b: 2 };",
        IR.var(
            name("x"),
            IR.objectlit(IR.property("a", IR.number(1)), IR.property("b", IR.number(2)))));
  }

  @Test
  public void testObjectBreaksOnePropertyPerLine() {
    setOptions(options.toBuilder().setPrintWidth(5));
    assertPrint(
        "var x = {\n  a: 1,\n  b: 2\n};",
        IR.var(
            name("x"),
            IR.objectlit(IR.property("a", IR.number(1)), IR.property("b", IR.number(2)))));
  }

  @Test
  public void testObjectCurlySpacing() {
    setOptions(options.toBuilder().setObjectCurlySpacing(false));
    assertPrint("var x = {a: 1};", IR.var(name("x"), IR.objectlit(IR.property("a", IR.number(1)))));
  }

  @Test
  public void testEmptyObject() {
    assertPrint("var x = {};", IR.var(name("x"), IR.objectlit()));
  }

  @Test
  public void testObjectLiteralStatementGetsParens() {
    assertPrintExpression("({})", IR.objectlit());
  }

  @Test
  public void testSingleObjectArgumentHugsParens() {
    assertPrintExpression(
        "f({ a: 1 })", IR.call(name("f"), IR.objectlit(IR.property("a", IR.number(1)))));
  }

  @Test
  public void testCallArgumentsBreak() {
    setOptions(options.toBuilder().setPrintWidth(10));
    assertPrintExpression("f(\n  aaaa,\n  bbbb\n)", IR.call(name("f"), name("aaaa"), name("bbbb")));
  }

  @Test
  public void testTrailingCommaAllInCallArguments() {
    setOptions(options.toBuilder().setPrintWidth(10).setTrailingComma(TrailingComma.ALL));
    assertPrintExpression(
        "f(\n  aaaa,\n  bbbb,\n)", IR.call(name("f"), name("aaaa"), name("bbbb")));
  }

  @Test
  public void testTrailingCommaEs5SkipsCallArguments() {
    setOptions(options.toBuilder().setPrintWidth(10).setTrailingComma(TrailingComma.ES5));
    assertPrintExpression("f(\n  aaaa,\n  bbbb\n)", IR.call(name("f"), name("aaaa"), name("bbbb")));
  }

  @Test
  public void testTrailingCommaEs5InBrokenObject() {
    setOptions(options.toBuilder().setPrintWidth(5).setTrailingComma(TrailingComma.ES5));
    assertPrint(
        "var x = {\n  a: 1,\n  b: 2,\n};",
        IR.var(
            name("x"),
            IR.objectlit(IR.property("a", IR.number(1)), IR.property("b", IR.number(2)))));
  }

  @Test
  public void testTrailingCommaOnlyWhenBroken() {
    setOptions(options.toBuilder().setTrailingComma(TrailingComma.ALL));
    assertPrint(
        "var x = { a: 1 };", IR.var(name("x"), IR.objectlit(IR.property("a", IR.number(1)))));
  }

  @Test
  public void testNoTrailingCommaAfterRest() {
    setOptions(options.toBuilder().setPrintWidth(5).setTrailingComma(TrailingComma.ALL));
    assertPrint(
        "var {\n  a,\n  ...b\n} = c;",
        IR.var(IR.objectPattern(IR.shorthandProperty("a"), IR.rest(name("b"))), name("c")));
  }

  @Test
  public void testArrays() {
    assertPrintExpression("[]", IR.arraylit());
    assertPrintExpression("[ 1, 2 ]", IR.arraylit(IR.number(1), IR.number(2)));
    assertPrintExpression("[ , a ]", IR.arraylit(IR.hole(), name("a")));
    assertPrintExpression("[ a, , ]", IR.arraylit(name("a"), IR.hole()));
  }

  @Test
  public void testDefaultImportNeverGetsBraces() {
    assertPrint(
        "import Foo from \"m\";",
        IR.importDeclaration(ImmutableList.of(IR.importDefaultSpecifier("Foo")), "m"));
  }

  @Test
  public void testImportSpecifiers() {
    assertPrint(
        "import a, { b, c as d } from \"m\";",
        IR.importDeclaration(
            ImmutableList.of(
                IR.importDefaultSpecifier("a"),
                IR.importSpecifier("b", "b"),
                IR.importSpecifier("c", "d")),
            "m"));
    assertPrint(
        "import * as ns from \"m\";",
        IR.importDeclaration(ImmutableList.of(IR.importNamespaceSpecifier("ns")), "m"));
    assertPrint("import \"m\";", IR.importDeclaration(ImmutableList.of(), "m"));
  }

  @Test
  public void testImportSpecifiersWithoutCurlySpacing() {
    setOptions(options.toBuilder().setObjectCurlySpacing(false));
    assertPrint(
        "import {b} from \"m\";",
        IR.importDeclaration(ImmutableList.of(IR.importSpecifier("b", "b")), "m"));
  }

  @Test
  public void testImportType() {
    Node declaration =
        IR.importDeclaration(ImmutableList.of(IR.importSpecifier("T", "T")), "m")
            .toBuilder()
            .set("importKind", "type")
            .build();
    assertPrint("import type { T } from \"m\";", declaration);
  }

  @Test
  public void testExports() {
    assertPrint(
        "export { a, b as c };",
        IR.exportSpecifiers(
            ImmutableList.of(IR.exportSpecifier("a", "a"), IR.exportSpecifier("b", "c")), null));
    assertPrint(
        "export { a } from \"m\";",
        IR.exportSpecifiers(ImmutableList.of(IR.exportSpecifier("a", "a")), "m"));
    assertPrint("export {};", IR.exportSpecifiers(ImmutableList.of(), null));
    assertPrint("export * from \"m\";", IR.exportAll("m"));
    assertPrint("export default x;", IR.exportDefault(name("x")));
    assertPrint("export const x = 1;", IR.exportNamed(IR.constNode(name("x"), IR.number(1))));
    assertPrint(
        "export default function f() {}",
        IR.exportDefault(IR.functionDeclaration(name("f"), ImmutableList.of(), IR.block())));
  }

  @Test
  public void testStringQuotes() {
    assertPrintExpression("\"a\"", IR.string("a"));
    assertPrintExpression("\"it's\"", IR.string("it's"));
    assertPrintExpression("'say \"hi\"'", IR.string("say \"hi\""));
    // Ties choose double quotes.
    assertPrintExpression("\"'\\\"\"", IR.string("'\""));
  }

  @Test
  public void testForcedQuotes() {
    setOptions(options.toBuilder().setQuote(QuoteStyle.SINGLE));
    assertPrintExpression("'a'", IR.string("a"));
    assertPrintExpression("'it\\'s'", IR.string("it's"));

    setOptions(options.toBuilder().setQuote(QuoteStyle.DOUBLE));
    assertPrintExpression("\"say \\\"hi\\\"\"", IR.string("say \"hi\""));
  }

  @Test
  public void testStringEscapes() {
    assertPrintExpression("\"a\\nb\\t\\\\\"", IR.string("a\nb\t\\"));
    assertPrintExpression("\"\\x00\\u2028\"", IR.string("\0\u2028"));
  }

  @Test
  public void testNumbers() {
    assertPrintExpression("1", IR.number(1));
    assertPrintExpression("1.5", IR.number(1.5));
    assertPrintExpression("0xFF", IR.number(255, "0xFF"));
    assertPrintExpression("1e+21", IR.number(1e21));
    assertPrintExpression("1.5e-7", IR.number(1.5e-7));
    assertPrintExpression("0.0001", IR.number(0.0001));
    assertPrintExpression("12345678.5", IR.number(12345678.5));
  }

  @Test
  public void testRegExp() {
    assertPrintExpression("/a+/g", IR.regexp("a+", "g"));
  }

  @Test
  public void testBinaryPrecedence() {
    assertPrintExpression(
        "(a + b) * c", IR.mul(IR.add(name("a"), name("b")), name("c")));
    assertPrintExpression("a + b * c", IR.add(name("a"), IR.mul(name("b"), name("c"))));
    assertPrintExpression("a - b - c", IR.sub(IR.sub(name("a"), name("b")), name("c")));
    assertPrintExpression("a - (b - c)", IR.sub(name("a"), IR.sub(name("b"), name("c"))));
    assertPrintExpression(
        "(a ** b) ** c",
        IR.binary("**", IR.binary("**", name("a"), name("b")), name("c")));
    assertPrintExpression(
        "a ** b ** c", IR.binary("**", name("a"), IR.binary("**", name("b"), name("c"))));
  }

  @Test
  public void testNullishCoalescingMixedWithLogicalOr() {
    assertPrintExpression(
        "(a ?? b) || c", IR.or(IR.binary("??", name("a"), name("b")), name("c")));
  }

  @Test
  public void testNullishCoalescingMixedWithLogicalAnd() {
    assertPrintExpression(
        "a ?? (b && c)", IR.binary("??", name("a"), IR.and(name("b"), name("c"))));
    assertPrintExpression(
        "(a && b) ?? c", IR.binary("??", IR.and(name("a"), name("b")), name("c")));
  }

  @Test
  public void testBinaryBreaksAfterOperator() {
    setOptions(options.toBuilder().setPrintWidth(10));
    assertPrintExpression(
        "aaaaaa +\n  bbbbbb", IR.add(name("aaaaaa"), name("bbbbbb")));
  }

  @Test
  public void testStatementSemicolonCountsTowardsWidth() {
    setOptions(options.toBuilder().setPrintWidth(11));
    assertPrintExpression("aaaa +\n  bbbb", IR.add(name("aaaa"), name("bbbb")));
    setOptions(options.toBuilder().setPrintWidth(12));
    assertPrintExpression("aaaa + bbbb", IR.add(name("aaaa"), name("bbbb")));
  }

  @Test
  public void testUnary() {
    assertPrintExpression("!a", IR.not(name("a")));
    assertPrintExpression("typeof a", IR.unary("typeof", name("a")));
    assertPrintExpression("- -a", IR.unary("-", IR.unary("-", name("a"))));
    assertPrintExpression("- --a", IR.unary("-", IR.update("--", name("a"), true)));
    assertPrintExpression("a++", IR.update("++", name("a"), false));
    assertPrintExpression("(-a).b", IR.getprop(IR.unary("-", name("a")), "b"));
    assertPrintExpression("(-a)()", IR.call(IR.unary("-", name("a"))));
    assertPrintExpression("(a++).b", IR.getprop(IR.update("++", name("a"), false), "b"));
    assertPrintExpression("(++a)()", IR.call(IR.update("++", name("a"), true)));
  }

  @Test
  public void testExpressionParens() {
    assertPrintExpression("new (f())()", IR.newNode(IR.call(name("f"))));
    assertPrintExpression(
        "(a ? b : c) + d", IR.add(IR.hook(name("a"), name("b"), name("c")), name("d")));
    assertPrintExpression("(1).toString", IR.getprop(IR.number(1), "toString"));
    assertPrintExpression("(a = b).c", IR.getprop(IR.assign(name("a"), name("b")), "c"));
    assertPrintExpression("(a || b)()", IR.call(IR.or(name("a"), name("b"))));
  }

  @Test
  public void testFunctionExpressionStatementGetsParens() {
    assertPrintExpression(
        "(function() {})()",
        IR.call(IR.function(null, ImmutableList.of(), IR.block())));
  }

  @Test
  public void testSequence() {
    assertPrintExpression("a, b", IR.comma(name("a"), name("b")));
    assertPrint("var x = (a, b);", IR.var(name("x"), IR.comma(name("a"), name("b"))));
    assertPrint("return a, b;", IR.returnNode(IR.comma(name("a"), name("b"))));
  }

  @Test
  public void testObjectPatternAssignmentGetsParens() {
    assertPrintExpression(
        "({ a } = b)", IR.assign(IR.objectPattern(IR.shorthandProperty("a")), name("b")));
  }

  @Test
  public void testConditional() {
    assertPrintExpression("a ? b : c", IR.hook(name("a"), name("b"), name("c")));
    setOptions(options.toBuilder().setPrintWidth(10));
    assertPrintExpression(
        "aaaa\n  ? bbbb\n  : cccc", IR.hook(name("aaaa"), name("bbbb"), name("cccc")));
  }

  @Test
  public void testVariableDeclarations() {
    assertPrint(
        "let a = 1, b;",
        IR.declaration(
            "let", IR.declarator(name("a"), IR.number(1)), IR.declarator(name("b"), null)));
  }

  @Test
  public void testVariableDeclarationsBreak() {
    setOptions(options.toBuilder().setPrintWidth(10));
    assertPrint(
        "var aaaa,\n  bbbb;",
        IR.declaration(
            "var", IR.declarator(name("aaaa"), null), IR.declarator(name("bbbb"), null)));
  }

  @Test
  public void testLoops() {
    assertPrint(
        "for (var i = 0; i < n; i++) {}",
        IR.forNode(
            IR.var(name("i"), IR.number(0)),
            IR.binary("<", name("i"), name("n")),
            IR.update("++", name("i"), false),
            IR.block()));
    assertPrint("for (;;) {}", IR.forNode(null, null, null, IR.block()));
    assertPrint(
        "for (const x of xs) {}",
        IR.forOf(
            IR.declaration("const", IR.declarator(name("x"), null)), name("xs"), IR.block()));
    assertPrint("for (k in o) {}", IR.forIn(name("k"), name("o"), IR.block()));
    assertPrint(
        "for await (x of xs) {}", IR.forAwaitOf(name("x"), name("xs"), IR.block()));
    assertPrint("while (a) b();", IR.whileNode(name("a"), callStatement("b")));
    assertPrint(
        "do {\n  b();\n} while (a);", IR.doNode(IR.block(callStatement("b")), name("a")));
    assertPrint("do b();\nwhile (a);", IR.doNode(callStatement("b"), name("a")));
  }

  @Test
  public void testSwitch() {
    assertPrint(
        "switch (x) {\n  case 1:\n    f();\n    break;\n  default:\n}",
        IR.switchNode(
            name("x"),
            IR.caseNode(IR.number(1), callStatement("f"), IR.breakNode()),
            IR.defaultCase()));
    assertPrint("switch (x) {}", IR.switchNode(name("x")));
  }

  @Test
  public void testTryCatchFinally() {
    assertPrint(
        "try {} catch (e) {} finally {}",
        IR.tryCatchFinally(IR.block(), IR.catchNode(name("e"), IR.block()), IR.block()));
    assertPrint("try {} catch {}", IR.tryCatch(IR.block(), IR.catchNode(null, IR.block())));
  }

  @Test
  public void testJumps() {
    assertPrint("break;", IR.breakNode());
    assertPrint("continue outer;", IR.continueNode(name("outer")));
    assertPrint("return;", IR.returnNode());
    assertPrint("throw e;", IR.throwNode(name("e")));
    assertPrint("debugger;", IR.debugger());
  }

  @Test
  public void testEmptyStatementsAreDropped() {
    assertPrint("a();\nb();", callStatement("a"), IR.empty(), callStatement("b"));
  }

  @Test
  public void testDirectives() {
    Node program =
        IR.program(callStatement("f"))
            .toBuilder()
            .setNodes("directives", ImmutableList.of(IR.directive("use strict")))
            .build();
    assertThat(print(program)).isEqualTo("\"use strict\";\nf();\n");
  }

  @Test
  public void testFunctions() {
    assertPrint(
        "function f(a, b) {\n  return a;\n}",
        IR.functionDeclaration(
            name("f"),
            ImmutableList.of(name("a"), name("b")),
            IR.block(IR.returnNode(name("a")))));
    Node asyncGenerator =
        IR.functionDeclaration(name("f"), ImmutableList.of(), IR.block())
            .toBuilder()
            .set("async", true)
            .set("generator", true)
            .build();
    assertPrint("async function* f() {}", asyncGenerator);
  }

  @Test
  public void testArrowFunctions() {
    assertPrintExpression("x => x", IR.arrowFunction(ImmutableList.of(name("x")), name("x")));
    assertPrintExpression(
        "(a, b) => a", IR.arrowFunction(ImmutableList.of(name("a"), name("b")), name("a")));
    assertPrintExpression("() => {}", IR.arrowFunction(ImmutableList.of(), IR.block()));
    assertPrintExpression(
        "(x: number) => x",
        IR.arrowFunction(
            ImmutableList.of(IR.typedName("x", IR.keywordType(Token.NUMBER_TYPE_ANNOTATION))),
            name("x")));
    assertPrintExpression(
        "x => ({})", IR.arrowFunction(ImmutableList.of(name("x")), IR.objectlit()));
  }

  @Test
  public void testArrowParensAlways() {
    setOptions(options.toBuilder().setArrowParensAlways(true));
    assertPrintExpression("(x) => x", IR.arrowFunction(ImmutableList.of(name("x")), name("x")));
  }

  @Test
  public void testYieldAndAwait() {
    assertPrintExpression("yield", IR.yield(null));
    assertPrintExpression("yield a", IR.yield(name("a")));
    assertPrintExpression("await a", IR.await(name("a")));
    assertPrintExpression("(await a)()", IR.call(IR.await(name("a"))));
    assertPrintExpression("(await a).b", IR.getprop(IR.await(name("a")), "b"));
  }

  @Test
  public void testMembers() {
    assertPrintExpression("a.b", IR.getprop(name("a"), "b"));
    assertPrintExpression("a[0]", IR.getelem(name("a"), IR.number(0)));
    assertPrintExpression("new A(b)", IR.newNode(name("A"), name("b")));
  }

  @Test
  public void testObjectMembers() {
    assertPrint(
        "var o = { a, [b]: 1 };",
        IR.var(
            name("o"),
            IR.objectlit(IR.shorthandProperty("a"), IR.computedProperty(name("b"), IR.number(1)))));
    assertPrint(
        "var o = {\n  get x() {\n    return 1;\n  }\n};",
        IR.var(
            name("o"),
            IR.objectlit(
                IR.objectMethod(
                    "get", name("x"), ImmutableList.of(), IR.block(IR.returnNode(IR.number(1)))))));
  }

  @Test
  public void testTemplateLiterals() {
    assertPrintExpression(
        "`a${x}b`", IR.templateLiteral(ImmutableList.of("a", "b"), ImmutableList.of(name("x"))));
    assertPrintExpression(
        "tag`a`",
        IR.taggedTemplate(
            name("tag"), IR.templateLiteral(ImmutableList.of("a"), ImmutableList.of())));
  }

  @Test
  public void testTemplateLiteralKeepsLinesVerbatim() {
    Node literal = IR.templateLiteral(ImmutableList.of("a\n    b "), ImmutableList.of());
    assertPrint(
        "function f() {\n  return `a\n    b `;\n}",
        IR.functionDeclaration(
            name("f"), ImmutableList.of(), IR.block(IR.returnNode(literal))));
  }

  @Test
  public void testClasses() {
    Node staticMethod =
        IR.classMethod("method", name("m"), ImmutableList.of(), IR.block())
            .toBuilder()
            .set("static", true)
            .build();
    assertPrint(
        "class A extends B {\n  constructor() {}\n  x = 1;\n  static m() {}\n}",
        IR.classNode(
            name("A"),
            name("B"),
            IR.classBody(
                IR.classMethod("constructor", name("constructor"), ImmutableList.of(), IR.block()),
                IR.classProperty(name("x"), IR.number(1)),
                staticMethod)));
    assertPrint("class A {}", IR.classNode(name("A"), null, IR.classBody()));
  }

  @Test
  public void testDecorators() {
    Node decorated =
        IR.classNode(name("A"), null, IR.classBody())
            .toBuilder()
            .setNodes("decorators", ImmutableList.of(IR.decorator(name("dec"))))
            .build();
    assertPrint("@dec\nclass A {}", decorated);
    // The export prints the decorators of the class it exports.
    assertPrint("@dec\nexport class A {}", IR.exportNamed(decorated));
  }

  @Test
  public void testJsx() {
    assertPrintExpression(
        "<div id=\"a\"/>",
        IR.jsxElement(
            IR.jsxOpening("div", true, IR.jsxAttribute("id", IR.string("a"))),
            null,
            ImmutableList.of()));
    assertPrintExpression(
        "<div>hello</div>",
        IR.jsxElement(
            IR.jsxOpening("div", false),
            IR.jsxClosing("div"),
            ImmutableList.of(IR.jsxText("hello"))));
    assertPrintExpression(
        "<a onClick={f} disabled/>",
        IR.jsxElement(
            IR.jsxOpening(
                "a",
                true,
                IR.jsxAttribute("onClick", IR.jsxExpression(name("f"))),
                IR.jsxAttribute("disabled", null)),
            null,
            ImmutableList.of()));
  }

  @Test
  public void testJsxAttributeQuotes() {
    assertPrintExpression(
        "<a title='say \"hi\"'/>",
        IR.jsxElement(
            IR.jsxOpening("a", true, IR.jsxAttribute("title", IR.string("say \"hi\""))),
            null,
            ImmutableList.of()));
    assertPrintExpression(
        "<a title=\"it's &quot;x&quot;\"/>",
        IR.jsxElement(
            IR.jsxOpening("a", true, IR.jsxAttribute("title", IR.string("it's \"x\""))),
            null,
            ImmutableList.of()));
  }

  @Test
  public void testJsxChildrenOnTheirOwnLines() {
    Node inner =
        IR.jsxElement(IR.jsxOpening("br", true), null, ImmutableList.of());
    Node outer =
        IR.jsxElement(
            IR.jsxOpening("div", false),
            IR.jsxClosing("div"),
            ImmutableList.of(IR.jsxText("\n  "), inner, IR.jsxText("\n")));
    assertPrint(
        "function f() {\n  return (\n    <div>\n      <br/>\n    </div>\n  );\n}",
        IR.functionDeclaration(name("f"), ImmutableList.of(), IR.block(IR.returnNode(outer))));
  }

  @Test
  public void testJsxTextCollapsesWhitespace() {
    assertPrintExpression(
        "<p>a b</p>",
        IR.jsxElement(
            IR.jsxOpening("p", false),
            IR.jsxClosing("p"),
            ImmutableList.of(IR.jsxText("  a   b  "))));
  }

  @Test
  public void testFlowTypes() {
    assertPrint(
        "type T = number | string;",
        IR.typeAlias(
            "T",
            IR.unionType(
                IR.keywordType(Token.NUMBER_TYPE_ANNOTATION),
                IR.keywordType(Token.STRING_TYPE_ANNOTATION))));
    assertPrint(
        "var x: ?Array<string>;",
        IR.var(
            IR.typedName(
                "x",
                IR.nullableType(
                    IR.genericType("Array", IR.keywordType(Token.STRING_TYPE_ANNOTATION)))),
            null));
    Node arrayOfUnion =
        Node.builder(Token.ARRAY_TYPE_ANNOTATION)
            .set(
                "elementType",
                IR.unionType(
                    IR.keywordType(Token.NUMBER_TYPE_ANNOTATION),
                    IR.keywordType(Token.STRING_TYPE_ANNOTATION)))
            .build();
    assertPrint("type A = (number | string)[];", IR.typeAlias("A", arrayOfUnion));
  }

  private static Node functionType() {
    Node param =
        Node.builder(Token.FUNCTION_TYPE_PARAM)
            .set("name", name("x"))
            .set("typeAnnotation", IR.keywordType(Token.NUMBER_TYPE_ANNOTATION))
            .build();
    return Node.builder(Token.FUNCTION_TYPE_ANNOTATION)
        .setNodes("params", ImmutableList.of(param))
        .set("returnType", IR.keywordType(Token.VOID_TYPE_ANNOTATION))
        .build();
  }

  @Test
  public void testFunctionTypes() {
    assertPrint("type F = (x: number) => void;", IR.typeAlias("F", functionType()));
    Node declareFunction =
        Node.builder(Token.DECLARE_FUNCTION).set("id", IR.typedName("f", functionType())).build();
    assertPrint("declare function f(x: number): void;", declareFunction);

    Node declareExport =
        Node.builder(Token.DECLARE_EXPORT_DECLARATION)
            .set("declaration", declareFunction)
            .build();
    assertPrint("declare export function f(x: number): void;", declareExport);
  }

  @Test
  public void testExactObjectType() {
    Node property =
        Node.builder(Token.OBJECT_TYPE_PROPERTY)
            .set("key", name("a"))
            .set("value", IR.keywordType(Token.NUMBER_TYPE_ANNOTATION))
            .build();
    Node objectType =
        Node.builder(Token.OBJECT_TYPE_ANNOTATION)
            .setNodes("properties", ImmutableList.of(property))
            .set("exact", true)
            .build();
    assertPrint("type O = {| a: number |};", IR.typeAlias("O", objectType));
  }

  @Test
  public void testLeadingAndTrailingComments() {
    Node program =
        at(
                IR.program(
                    at(callStatement("a"), 2, 0, 2, 4), at(callStatement("b"), 3, 0, 3, 4)),
                1,
                0,
                3,
                13)
            .toBuilder()
            .setNodes(
                "comments",
                ImmutableList.of(
                    at(IR.lineComment(" lead"), 1, 0, 1, 7),
                    at(IR.lineComment(" trail"), 3, 5, 3, 13)))
            .build();
    assertThat(print(program)).isEqualTo("// lead\na();\nb(); // trail\n");
  }

  @Test
  public void testBlankLineAfterCommentIsPreserved() {
    Node program =
        IR.program(at(callStatement("a"), 3, 0, 3, 4))
            .toBuilder()
            .setNodes("comments", ImmutableList.of(at(IR.blockComment(" c "), 1, 0, 1, 7)))
            .build();
    assertThat(print(program)).isEqualTo("/* c */\n\na();\n");

    setOptions(options.toBuilder().setMaxBlankLinesAroundComments(0));
    assertThat(print(program)).isEqualTo("/* c */\na();\n");
  }

  @Test
  public void testBlockCommentOnTheSameLine() {
    Node program =
        IR.program(at(callStatement("a"), 1, 8, 1, 12))
            .toBuilder()
            .setNodes("comments", ImmutableList.of(at(IR.blockComment(" x "), 1, 0, 1, 7)))
            .build();
    assertThat(print(program)).isEqualTo("/* x */ a();\n");
  }

  @Test
  public void testCommentInsideEmptyBlock() {
    Node program =
        IR.program(at(IR.block(), 1, 0, 1, 15))
            .toBuilder()
            .setNodes("comments", ImmutableList.of(at(IR.blockComment(" empty "), 1, 2, 1, 13)))
            .build();
    assertThat(print(program)).isEqualTo("{\n  /* empty */\n}\n");
  }

  @Test
  public void testTemplateRootUsesTemplateDialect() {
    assertThat(print(IR.templateProgram(IR.mustache("a.b")))).isEqualTo("{{a.b}}");
  }

  @Test
  public void testTemplateNodeInJavaScriptIsUnsupported() {
    UnsupportedNodeException e =
        assertThrows(
            UnsupportedNodeException.class,
            () -> print(IR.program(IR.exprResult(IR.arraylit(IR.textNode("x"))))));
    assertThat(e.getToken()).isEqualTo(Token.TEXT_NODE);
  }

  @Test
  public void testSourceMap() {
    setOptions(options.toBuilder().setSourceMapOutputName("out.js"));
    Node program =
        IR.program(at(callStatement("a"), 1, 0, 1, 4), at(callStatement("b"), 2, 2, 2, 6));
    PrintResult result =
        new CodePrinter.Builder(program).setOptions(options).setSourceFileName("in.js").build();
    assertThat(result.getCode()).isEqualTo("a();\nb();\n");
    assertThat(result.getSourceMap())
        .isEqualTo(
            "{\"version\":3,\"file\":\"out.js\",\"sources\":[\"in.js\"],\"names\":[],"
                + "\"mappings\":\"AAAA;AACE\"}");
  }

  @Test
  public void testNoSourceMapByDefault() {
    assertThat(printResult(IR.program(callStatement("a"))).getSourceMap()).isNull();
  }

  @Test
  public void testSourceMapComposedWithInputMap() {
    String inputMap =
        "{\"version\":3,\"file\":\"in.js\",\"sources\":[\"orig.ts\"],\"names\":[],"
            + "\"mappings\":\"AAAA;AAEA\"}";
    setOptions(
        options.toBuilder().setSourceMapOutputName("out.js").setInputSourceMap(inputMap));
    Node program =
        IR.program(at(callStatement("a"), 1, 0, 1, 4), at(callStatement("b"), 2, 2, 2, 6));
    assertThat(printResult(program).getSourceMap())
        .isEqualTo(
            "{\"version\":3,\"file\":\"out.js\",\"sources\":[\"orig.ts\"],\"names\":[],"
                + "\"mappings\":\"AAAA;AAEA\"}");
  }

  @Test
  public void testUnreadableInputMap() {
    setOptions(
        options.toBuilder().setSourceMapOutputName("out.js").setInputSourceMap("{\"version\":2}"));
    assertThrows(
        IllegalArgumentException.class,
        () -> print(IR.program(at(callStatement("a"), 1, 0, 1, 4))));
  }
}
