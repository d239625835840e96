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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.jsfmt.ast.SourcePosition;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Factory methods and queries for {@link Doc} trees. */
public final class Docs {
  public static final Doc EMPTY = new Doc.Text("");
  public static final Doc LINE = new Doc.Line(Doc.LineKind.LINE);
  public static final Doc SOFTLINE = new Doc.Line(Doc.LineKind.SOFT);
  public static final Doc HARDLINE = new Doc.Line(Doc.LineKind.HARD);
  public static final Doc LITERALLINE = new Doc.Line(Doc.LineKind.LITERAL);
  public static final Doc BREAK_PARENT = Doc.BreakParent.INSTANCE;

  private Docs() {}

  public static Doc text(String text) {
    return text.isEmpty() ? EMPTY : new Doc.Text(text);
  }

  public static Doc concat(Doc... parts) {
    return concat(ImmutableList.copyOf(parts));
  }

  public static Doc concat(List<Doc> parts) {
    if (parts.size() == 1) {
      return parts.get(0);
    }
    return new Doc.Concat(ImmutableList.copyOf(parts));
  }

  public static Doc join(String separator, List<Doc> docs) {
    return join(text(separator), docs);
  }

  public static Doc join(Doc separator, List<Doc> docs) {
    DocBuilder builder = new DocBuilder();
    for (int i = 0; i < docs.size(); i++) {
      if (i > 0) {
        builder.add(separator);
      }
      builder.add(docs.get(i));
    }
    return builder.build();
  }

  public static Doc indent(int width, Doc contents) {
    return new Doc.Indent(width, contents);
  }

  public static Doc group(Doc contents) {
    return new Doc.Group(contents, false);
  }

  /** A group holding a separator-joined list whose separators all break or none do. */
  public static Doc multilineGroup(Doc contents) {
    return new Doc.Group(contents, true);
  }

  public static Doc ifBreak(Doc breakContents, Doc flatContents) {
    return new Doc.IfBreak(breakContents, flatContents);
  }

  public static Doc ifBreak(Doc breakContents) {
    return new Doc.IfBreak(breakContents, EMPTY);
  }

  public static Doc mark(SourcePosition original) {
    return new Doc.SourceMark(original);
  }

  /**
   * Returns the first non-empty text the document renders, or {@code null} if it starts with a
   * line break or renders nothing.
   */
  public static @Nullable String getFirstString(Doc doc) {
    switch (doc.getKind()) {
      case TEXT:
        String text = ((Doc.Text) doc).getText();
        return text.isEmpty() ? null : text;
      case CONCAT:
        for (Doc part : ((Doc.Concat) doc).getParts()) {
          String first = getFirstString(part);
          if (first != null) {
            return first;
          }
          if (part.getKind() == Doc.Kind.LINE) {
            return null;
          }
        }
        return null;
      case INDENT:
        return getFirstString(((Doc.Indent) doc).getContents());
      case GROUP:
        return getFirstString(((Doc.Group) doc).getContents());
      default:
        return null;
    }
  }

  /** Whether the document renders text that starts with {@code prefix}. */
  public static boolean startsWith(Doc doc, String prefix) {
    String first = getFirstString(doc);
    return first != null && first.startsWith(prefix);
  }

  /** Whether the document contains a hard or literal line anywhere. */
  public static boolean hasHardLine(Doc doc) {
    switch (doc.getKind()) {
      case LINE:
        return ((Doc.Line) doc).isHard();
      case BREAK_PARENT:
        return true;
      case CONCAT:
        for (Doc part : ((Doc.Concat) doc).getParts()) {
          if (hasHardLine(part)) {
            return true;
          }
        }
        return false;
      case INDENT:
        return hasHardLine(((Doc.Indent) doc).getContents());
      case GROUP:
        return hasHardLine(((Doc.Group) doc).getContents());
      case IF_BREAK:
        Doc.IfBreak ifBreak = (Doc.IfBreak) doc;
        return hasHardLine(ifBreak.getBreakContents()) || hasHardLine(ifBreak.getFlatContents());
      default:
        return false;
    }
  }

  /** Whether the document renders no text at all. */
  public static boolean isEmpty(Doc doc) {
    switch (doc.getKind()) {
      case TEXT:
        return ((Doc.Text) doc).getText().isEmpty();
      case CONCAT:
        for (Doc part : ((Doc.Concat) doc).getParts()) {
          if (!isEmpty(part)) {
            return false;
          }
        }
        return true;
      case SOURCE_MARK:
        return true;
      default:
        return false;
    }
  }

  /** Accumulates the parts of a {@link Doc.Concat}. */
  public static final class DocBuilder {
    private final List<Doc> parts = new ArrayList<>();

    @CanIgnoreReturnValue
    public DocBuilder add(String text) {
      if (!text.isEmpty()) {
        parts.add(text(text));
      }
      return this;
    }

    @CanIgnoreReturnValue
    public DocBuilder add(Doc doc) {
      if (doc != EMPTY) {
        parts.add(doc);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public DocBuilder addAll(List<Doc> docs) {
      for (Doc doc : docs) {
        add(doc);
      }
      return this;
    }

    public boolean isEmpty() {
      return parts.isEmpty();
    }

    public Doc build() {
      if (parts.isEmpty()) {
        return EMPTY;
      }
      return concat(parts);
    }
  }
}
