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

import com.google.auto.value.AutoValue;
import com.google.javascript.jsfmt.ast.Node;
import com.google.javascript.jsfmt.ast.SourcePosition;

/** A source comment together with the node that prints it. */
@AutoValue
public abstract class Comment {

  /** The comment syntax. */
  public enum Style {
    /** {@code /* ... *}{@code /} */
    BLOCK,
    /** {@code // ...} */
    LINE
  }

  /** Which side of its host a comment prints on. */
  public enum Attachment {
    LEADING,
    TRAILING
  }

  static Comment create(
      String text,
      Style style,
      SourcePosition start,
      SourcePosition end,
      Attachment attachment,
      Node host) {
    return new AutoValue_Comment(text, style, start, end, attachment, host);
  }

  /** The comment body without its delimiters. */
  public abstract String getText();

  public abstract Style getStyle();

  public abstract SourcePosition getStart();

  public abstract SourcePosition getEnd();

  public abstract Attachment getAttachment();

  public abstract Node getHost();

  public boolean isLeading() {
    return getAttachment() == Attachment.LEADING;
  }

  /** Whether the comment lies inside its host's source range rather than next to it. */
  boolean isDangling() {
    Node host = getHost();
    return host.hasSourceRange()
        && !getStart().isBefore(host.getStart())
        && !host.getEnd().isBefore(getEnd());
  }

  /** The comment with its delimiters. */
  public String toSource() {
    return getStyle() == Style.BLOCK ? "/*" + getText() + "*/" : "//" + getText();
  }
}
