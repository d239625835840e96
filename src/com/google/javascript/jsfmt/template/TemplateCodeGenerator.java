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

package com.google.javascript.jsfmt.template;

import static com.google.common.base.Preconditions.checkState;
import static com.google.javascript.jsfmt.layout.Docs.HARDLINE;
import static com.google.javascript.jsfmt.layout.Docs.LINE;
import static com.google.javascript.jsfmt.layout.Docs.SOFTLINE;
import static com.google.javascript.jsfmt.layout.Docs.concat;
import static com.google.javascript.jsfmt.layout.Docs.group;
import static com.google.javascript.jsfmt.layout.Docs.join;
import static com.google.javascript.jsfmt.layout.Docs.text;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.jsfmt.FormatOptions;
import com.google.javascript.jsfmt.UnsupportedNodeException;
import com.google.javascript.jsfmt.ast.Node;
import com.google.javascript.jsfmt.layout.Doc;
import com.google.javascript.jsfmt.layout.Docs;
import java.util.ArrayList;
import java.util.List;

/** Translates a Handlebars/Glimmer template AST into a layout {@link Doc}. */
public final class TemplateCodeGenerator {
  // http://w3c.github.io/html/single-page.html#void-elements
  static final ImmutableSet<String> VOID_TAGS =
      ImmutableSet.of(
          "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param",
          "source", "track", "wbr");

  private final int tabWidth;

  public TemplateCodeGenerator(FormatOptions options) {
    this.tabWidth = options.getTabWidth();
  }

  public Doc generate(Node root) {
    return print(root);
  }

  private Doc print(Node n) {
    return switch (n.getToken()) {
      case TEMPLATE_PROGRAM -> printChildren(n.getNodes("body"));
      case ELEMENT_NODE -> printElement(n);
      case ATTR_NODE -> printAttribute(n);
      case TEXT_NODE ->
          text(CharMatcher.whitespace().trimAndCollapseFrom(n.getString("chars"), ' '));
      case MUSTACHE_STATEMENT -> group(concat(text("{{"), print(n.getNode("path")), text("}}")));
      case PATH_EXPRESSION -> text(String.join(".", n.getStrings("parts")));
      case MUSTACHE_COMMENT_STATEMENT -> printComment(n);
      default -> throw new UnsupportedNodeException(n.getToken(), "template");
    };
  }

  private Doc printChildren(List<Node> children) {
    List<Doc> printed = new ArrayList<>();
    for (Node child : children) {
      printed.add(print(child));
    }
    return concat(printed);
  }

  /**
   * Void elements never have content and close with a bare {@code >}. Other elements close with
   * {@code />} when empty and with a closing tag otherwise.
   */
  private Doc printElement(Node n) {
    String tag = n.getString("tag");
    boolean isVoid = VOID_TAGS.contains(tag);
    ImmutableList<Node> children = isVoid ? ImmutableList.of() : n.getNodes("children");

    List<Doc> attributes = new ArrayList<>();
    for (Node attribute : n.getNodes("attributes")) {
      attributes.add(print(attribute));
    }
    Doc printedAttributes =
        concat(
            text(attributes.isEmpty() ? "" : " "),
            Docs.indent(tabWidth, join(LINE, attributes)));

    boolean hasChildren = !children.isEmpty();
    return group(
        concat(
            text("<"),
            text(tag),
            printedAttributes,
            text(hasChildren || isVoid ? ">" : " />"),
            Docs.indent(tabWidth, printChildren(children)),
            hasChildren ? concat(SOFTLINE, text("</" + tag + ">")) : HARDLINE));
  }

  private Doc printAttribute(Node n) {
    String name = n.getString("name");
    Node value = n.getNode("value");
    checkState(value != null, "attribute without a value: %s", n);
    switch (value.getToken()) {
      case TEXT_NODE:
        if (isEmptySpan(value)) {
          return text(name);
        }
        return text(name + "=\"" + value.getString("chars") + "\"");
      case MUSTACHE_STATEMENT:
        return concat(text(name + "="), print(value));
      default:
        throw new IllegalStateException("unsupported attribute value: " + value);
    }
  }

  /** A valueless attribute carries a text node that covers no source. */
  private static boolean isEmptySpan(Node value) {
    if (value.hasSourceRange()) {
      return value.getStart().equals(value.getEnd());
    }
    return value.getString("chars").isEmpty();
  }

  private Doc printComment(Node n) {
    String value = n.getString("value").trim();
    boolean hasBraces = value.contains("{{") || value.contains("}}");
    String open = hasBraces ? "{{!--" : "{{!";
    String close = hasBraces ? "--}}" : "}}";
    return group(concat(text(open), LINE, text(value), LINE, text(close)));
  }
}
