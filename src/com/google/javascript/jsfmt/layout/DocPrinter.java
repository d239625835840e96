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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import org.jspecify.annotations.Nullable;

/**
 * Renders a {@link Doc} into text no wider than a given width where possible.
 *
 * <p>The printer walks the document with an explicit command stack. Each group is tested once,
 * when it is reached, by measuring its contents laid out flat, followed by whatever the enclosing
 * content prints before its next line break, against the room left on the current line; groups
 * that fit render their lines flat, the others break them. A printer holds no state between
 * calls to {@link #print}.
 */
public final class DocPrinter {

  private enum Mode {
    BREAK,
    FLAT
  }

  private static final class Command {
    final int indent;
    final Mode mode;
    final Doc doc;
    final boolean rest;

    Command(int indent, Mode mode, Doc doc) {
      this(indent, mode, doc, false);
    }

    Command(int indent, Mode mode, Doc doc, boolean rest) {
      this.indent = indent;
      this.mode = mode;
      this.doc = doc;
      this.rest = rest;
    }
  }

  private static final CharMatcher TRAILING_WHITESPACE = CharMatcher.anyOf(" \t");

  private final int printWidth;
  private final int initialColumn;
  private final @Nullable SourceMappingListener listener;

  public DocPrinter(int printWidth) {
    this(printWidth, 0, null);
  }

  /**
   * @param printWidth the maximum line length
   * @param initialColumn the column at which the first line of output starts
   * @param listener receives the output position of every source mark, may be null
   */
  public DocPrinter(int printWidth, int initialColumn, @Nullable SourceMappingListener listener) {
    checkArgument(printWidth > 0, "printWidth must be positive: %s", printWidth);
    checkArgument(initialColumn >= 0, "initialColumn must be non-negative: %s", initialColumn);
    this.printWidth = printWidth;
    this.initialColumn = initialColumn;
    this.listener = listener;
  }

  public String print(Doc doc) {
    StringBuilder out = new StringBuilder();
    int column = initialColumn;
    int outputLine = 0;

    Deque<Command> commands = new ArrayDeque<>();
    commands.push(new Command(0, Mode.BREAK, doc));
    while (!commands.isEmpty()) {
      Command cmd = commands.pop();
      switch (cmd.doc.getKind()) {
        case TEXT:
          String text = ((Doc.Text) cmd.doc).getText();
          out.append(text);
          int lastNewline = text.lastIndexOf('\n');
          if (lastNewline >= 0) {
            outputLine += CharMatcher.is('\n').countIn(text);
            column = text.length() - lastNewline - 1;
          } else {
            column += text.length();
          }
          break;

        case CONCAT:
          pushAll(commands, cmd, ((Doc.Concat) cmd.doc));
          break;

        case INDENT:
          Doc.Indent indent = (Doc.Indent) cmd.doc;
          commands.push(
              new Command(cmd.indent + indent.getWidth(), cmd.mode, indent.getContents()));
          break;

        case GROUP:
          Doc.Group group = (Doc.Group) cmd.doc;
          if (cmd.mode == Mode.FLAT) {
            commands.push(new Command(cmd.indent, Mode.FLAT, group.getContents()));
          } else {
            Command flat = new Command(cmd.indent, Mode.FLAT, group.getContents());
            boolean fits = fits(flat, commands, printWidth - column);
            commands.push(fits ? flat : new Command(cmd.indent, Mode.BREAK, group.getContents()));
          }
          break;

        case IF_BREAK:
          Doc.IfBreak ifBreak = (Doc.IfBreak) cmd.doc;
          commands.push(
              new Command(
                  cmd.indent,
                  cmd.mode,
                  cmd.mode == Mode.BREAK ? ifBreak.getBreakContents() : ifBreak.getFlatContents()));
          break;

        case BREAK_PARENT:
          break;

        case SOURCE_MARK:
          if (listener != null) {
            listener.addMapping(((Doc.SourceMark) cmd.doc).getOriginal(), outputLine, column);
          }
          break;

        case LINE:
          Doc.Line line = (Doc.Line) cmd.doc;
          if (cmd.mode == Mode.FLAT && !line.isHard()) {
            if (line.getLineKind() == Doc.LineKind.LINE) {
              out.append(' ');
              column++;
            }
            break;
          }
          // Text before a literal line is verbatim content such as a template literal segment.
          if (line.getLineKind() != Doc.LineKind.LITERAL) {
            trimTrailingWhitespace(out);
          }
          out.append('\n');
          outputLine++;
          if (line.getLineKind() == Doc.LineKind.LITERAL) {
            column = 0;
          } else {
            out.append(Strings.repeat(" ", cmd.indent));
            column = cmd.indent;
          }
          break;
      }
    }
    trimTrailingWhitespace(out);
    return out.toString();
  }

  private static void pushAll(Deque<Command> commands, Command parent, Doc.Concat concat) {
    for (int i = concat.getParts().size() - 1; i >= 0; i--) {
      commands.push(
          new Command(parent.indent, parent.mode, concat.getParts().get(i), parent.rest));
    }
  }

  /**
   * Measures {@code next} laid out flat against {@code width} columns, then the commands of
   * {@code rest} up to the first line they break.
   */
  private static boolean fits(Command next, Deque<Command> rest, int width) {
    Iterator<Command> restCommands = rest.iterator();
    Deque<Command> stack = new ArrayDeque<>();
    stack.push(next);
    while (width >= 0) {
      if (stack.isEmpty()) {
        if (!restCommands.hasNext()) {
          return true;
        }
        Command cmd = restCommands.next();
        stack.push(new Command(cmd.indent, cmd.mode, cmd.doc, true));
        continue;
      }

      Command cmd = stack.pop();
      switch (cmd.doc.getKind()) {
        case TEXT:
          String text = ((Doc.Text) cmd.doc).getText();
          int newline = text.indexOf('\n');
          if (newline >= 0) {
            return width - newline >= 0;
          }
          width -= text.length();
          break;

        case CONCAT:
          pushAll(stack, cmd, (Doc.Concat) cmd.doc);
          break;

        case INDENT:
          stack.push(
              new Command(cmd.indent, cmd.mode, ((Doc.Indent) cmd.doc).getContents(), cmd.rest));
          break;

        case GROUP:
          stack.push(
              new Command(cmd.indent, cmd.mode, ((Doc.Group) cmd.doc).getContents(), cmd.rest));
          break;

        case IF_BREAK:
          Doc.IfBreak ifBreak = (Doc.IfBreak) cmd.doc;
          Doc chosen =
              cmd.mode == Mode.BREAK ? ifBreak.getBreakContents() : ifBreak.getFlatContents();
          stack.push(new Command(cmd.indent, cmd.mode, chosen, cmd.rest));
          break;

        case BREAK_PARENT:
          if (!cmd.rest) {
            return false;
          }
          break;

        case SOURCE_MARK:
          break;

        case LINE:
          Doc.Line line = (Doc.Line) cmd.doc;
          if (cmd.mode == Mode.BREAK) {
            return true;
          }
          if (line.isHard()) {
            return cmd.rest;
          }
          if (line.getLineKind() == Doc.LineKind.LINE) {
            width--;
          }
          break;
      }
    }
    return false;
  }

  private static void trimTrailingWhitespace(StringBuilder out) {
    int end = out.length();
    while (end > 0 && TRAILING_WHITESPACE.matches(out.charAt(end - 1))) {
      end--;
    }
    out.setLength(end);
  }
}
