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

package com.google.javascript.jsfmt.layout;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.javascript.jsfmt.ast.SourcePosition;

/**
 * A node of the layout document: the intermediate representation between the AST and the
 * printed text.
 *
 * <p>Documents are immutable values and never reference the AST, so the same document always
 * renders to the same text. Build them with {@link Docs}; render them with {@link DocPrinter}.
 */
public abstract class Doc {

  /** The variant of a {@link Doc}. */
  public enum Kind {
    TEXT,
    CONCAT,
    LINE,
    INDENT,
    GROUP,
    IF_BREAK,
    BREAK_PARENT,
    SOURCE_MARK
  }

  /** How a {@link Line} renders. */
  public enum LineKind {
    /** A space when flat, a newline plus indentation when broken. */
    LINE,
    /** Nothing when flat, a newline plus indentation when broken. */
    SOFT,
    /** Always a newline plus indentation; breaks every enclosing group. */
    HARD,
    /** Always a bare newline without indentation; breaks every enclosing group. */
    LITERAL
  }

  private Doc() {}

  public abstract Kind getKind();

  /** Unbreakable text. */
  public static final class Text extends Doc {
    private final String text;

    Text(String text) {
      this.text = checkNotNull(text);
    }

    public String getText() {
      return text;
    }

    @Override
    public Kind getKind() {
      return Kind.TEXT;
    }

    @Override
    public String toString() {
      return '"' + text + '"';
    }
  }

  /** An ordered sequence of documents. */
  public static final class Concat extends Doc {
    private final ImmutableList<Doc> parts;

    Concat(ImmutableList<Doc> parts) {
      this.parts = parts;
    }

    public ImmutableList<Doc> getParts() {
      return parts;
    }

    @Override
    public Kind getKind() {
      return Kind.CONCAT;
    }

    @Override
    public String toString() {
      return "concat" + parts;
    }
  }

  /** A possible line break. */
  public static final class Line extends Doc {
    private final LineKind lineKind;

    Line(LineKind lineKind) {
      this.lineKind = checkNotNull(lineKind);
    }

    public LineKind getLineKind() {
      return lineKind;
    }

    public boolean isHard() {
      return lineKind == LineKind.HARD || lineKind == LineKind.LITERAL;
    }

    @Override
    public Kind getKind() {
      return Kind.LINE;
    }

    @Override
    public String toString() {
      return lineKind == LineKind.LINE ? "line" : lineKind.name().toLowerCase() + "line";
    }
  }

  /** Adds {@code width} columns to the indentation of every break inside the contents. */
  public static final class Indent extends Doc {
    private final int width;
    private final Doc contents;

    Indent(int width, Doc contents) {
      checkArgument(width >= 0, "negative indent: %s", width);
      this.width = width;
      this.contents = checkNotNull(contents);
    }

    public int getWidth() {
      return width;
    }

    public Doc getContents() {
      return contents;
    }

    @Override
    public Kind getKind() {
      return Kind.INDENT;
    }

    @Override
    public String toString() {
      return "indent(" + width + ", " + contents + ")";
    }
  }

  /**
   * A unit whose lines break together. Whether it stays flat depends on its contents and on the
   * rest of the output line it shares with the surrounding content. An exclusive group marks a
   * separator-joined list, such as call arguments or object entries, whose separators break all
   * at once.
   */
  public static final class Group extends Doc {
    private final Doc contents;
    private final boolean exclusive;

    Group(Doc contents, boolean exclusive) {
      this.contents = checkNotNull(contents);
      this.exclusive = exclusive;
    }

    public Doc getContents() {
      return contents;
    }

    public boolean isExclusive() {
      return exclusive;
    }

    @Override
    public Kind getKind() {
      return Kind.GROUP;
    }

    @Override
    public String toString() {
      return (exclusive ? "multilineGroup(" : "group(") + contents + ")";
    }
  }

  /** Chooses between two documents by the mode of the enclosing group. */
  public static final class IfBreak extends Doc {
    private final Doc breakContents;
    private final Doc flatContents;

    IfBreak(Doc breakContents, Doc flatContents) {
      this.breakContents = checkNotNull(breakContents);
      this.flatContents = checkNotNull(flatContents);
    }

    public Doc getBreakContents() {
      return breakContents;
    }

    public Doc getFlatContents() {
      return flatContents;
    }

    @Override
    public Kind getKind() {
      return Kind.IF_BREAK;
    }

    @Override
    public String toString() {
      return "ifBreak(" + breakContents + ", " + flatContents + ")";
    }
  }

  /** Renders nothing, but prevents every enclosing group from staying flat. */
  public static final class BreakParent extends Doc {
    static final BreakParent INSTANCE = new BreakParent();

    private BreakParent() {}

    @Override
    public Kind getKind() {
      return Kind.BREAK_PARENT;
    }

    @Override
    public String toString() {
      return "breakParent";
    }
  }

  /** Renders nothing; ties the current output position to a position in the original source. */
  public static final class SourceMark extends Doc {
    private final SourcePosition original;

    SourceMark(SourcePosition original) {
      this.original = checkNotNull(original);
    }

    public SourcePosition getOriginal() {
      return original;
    }

    @Override
    public Kind getKind() {
      return Kind.SOURCE_MARK;
    }

    @Override
    public String toString() {
      return "mark(" + original + ")";
    }
  }
}
