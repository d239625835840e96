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

package com.google.javascript.jsfmt.sourcemap;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.javascript.jsfmt.ast.SourcePosition;
import com.google.javascript.jsfmt.sourcemap.Base64VLQ.CharIterator;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Reads a V3 source map and answers original-position lookups. */
public final class SourceMapConsumer {
  private static final int UNMAPPED = -1;

  /** A segment of a generated line; unmapped segments have no source. */
  private record Entry(int generatedColumn, int sourceIndex, int sourceLine, int sourceColumn) {}

  /** Receives every mapped segment in output order. Generated positions are 0-based. */
  public interface EntryVisitor {
    void visit(String sourceName, SourcePosition original, int generatedLine, int generatedColumn);
  }

  private final @Nullable String file;
  private final @Nullable String sourceRoot;
  private final ImmutableList<String> sources;
  private final ImmutableList<ImmutableList<Entry>> lines;

  private SourceMapConsumer(
      @Nullable String file,
      @Nullable String sourceRoot,
      ImmutableList<String> sources,
      ImmutableList<ImmutableList<Entry>> lines) {
    this.file = file;
    this.sourceRoot = sourceRoot;
    this.sources = sources;
    this.lines = lines;
  }

  public static SourceMapConsumer parse(String contents) throws SourceMapParseException {
    try {
      JsonObject root = new Gson().fromJson(contents, JsonObject.class);
      if (root == null) {
        throw new SourceMapParseException("empty source map");
      }
      if (!root.has("version") || root.get("version").getAsInt() != 3) {
        throw new SourceMapParseException("unsupported source map version: " + root.get("version"));
      }
      if (root.has("sections")) {
        throw new SourceMapParseException("index maps are not supported");
      }
      ImmutableList<String> sources = getStrings(root, "sources");
      String mappings = root.has("mappings") ? root.get("mappings").getAsString() : "";
      return new SourceMapConsumer(
          getOptionalString(root, "file"),
          getOptionalString(root, "sourceRoot"),
          sources,
          new MappingParser(mappings, sources.size()).parse());
    } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
      throw new SourceMapParseException("malformed source map: " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new SourceMapParseException("malformed mappings: " + e.getMessage(), e);
    }
  }

  private static ImmutableList<String> getStrings(JsonObject root, String key) {
    if (!root.has(key)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonElement element : root.getAsJsonArray(key)) {
      result.add(element.isJsonNull() ? "" : element.getAsString());
    }
    return result.build();
  }

  private static @Nullable String getOptionalString(JsonObject root, String key) {
    JsonElement value = root.get(key);
    return value == null || value.isJsonNull() ? null : value.getAsString();
  }

  public @Nullable String getFile() {
    return file;
  }

  public @Nullable String getSourceRoot() {
    return sourceRoot;
  }

  public ImmutableList<String> getOriginalSources() {
    return sources;
  }

  /**
   * Returns the original position of the generated position, both 1-based, or null when it is
   * unmapped. A position before the first segment of its line takes the last mapping of an
   * earlier line.
   */
  public @Nullable OriginalMapping getMappingForLine(int lineNumber, int column) {
    // Normalize the line and column numbers to 0.
    lineNumber--;
    column--;
    if (lineNumber < 0 || lineNumber >= lines.size() || column < 0) {
      return null;
    }

    ImmutableList<Entry> entries = lines.get(lineNumber);
    if (entries.isEmpty() || entries.get(0).generatedColumn() > column) {
      return getPreviousMapping(lineNumber);
    }
    return toOriginalMapping(entries.get(search(entries, column)));
  }

  /** Index of the last entry starting at or before {@code column}. */
  private static int search(List<Entry> entries, int column) {
    int low = 0;
    int high = entries.size() - 1;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (entries.get(mid).generatedColumn() <= column) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }

  private @Nullable OriginalMapping getPreviousMapping(int lineNumber) {
    for (int line = lineNumber - 1; line >= 0; line--) {
      ImmutableList<Entry> entries = lines.get(line);
      if (!entries.isEmpty()) {
        return toOriginalMapping(entries.get(entries.size() - 1));
      }
    }
    return null;
  }

  private @Nullable OriginalMapping toOriginalMapping(Entry entry) {
    if (entry.sourceIndex() == UNMAPPED) {
      return null;
    }
    return OriginalMapping.create(
        sources.get(entry.sourceIndex()),
        SourcePosition.create(entry.sourceLine() + 1, entry.sourceColumn()));
  }

  public void visitMappings(EntryVisitor visitor) {
    for (int line = 0; line < lines.size(); line++) {
      for (Entry entry : lines.get(line)) {
        if (entry.sourceIndex() != UNMAPPED) {
          visitor.visit(
              sources.get(entry.sourceIndex()),
              SourcePosition.create(entry.sourceLine() + 1, entry.sourceColumn()),
              line,
              entry.generatedColumn());
        }
      }
    }
  }

  /** Decodes the "mappings" field. Fields other than the generated column are relative. */
  private static class MappingParser implements CharIterator {
    private final String content;
    private final int sourceCount;
    private int position = 0;

    private int previousSource = 0;
    private int previousSourceLine = 0;
    private int previousSourceColumn = 0;

    MappingParser(String content, int sourceCount) {
      this.content = content;
      this.sourceCount = sourceCount;
    }

    ImmutableList<ImmutableList<Entry>> parse() {
      ImmutableList.Builder<ImmutableList<Entry>> result = ImmutableList.builder();
      List<Entry> line = new ArrayList<>();
      int previousColumn = 0;
      while (hasNext()) {
        char c = peek();
        if (c == ';') {
          position++;
          result.add(ImmutableList.copyOf(line));
          line.clear();
          previousColumn = 0;
        } else if (c == ',') {
          position++;
        } else {
          Entry entry = decodeEntry(previousColumn);
          previousColumn = entry.generatedColumn();
          line.add(entry);
        }
      }
      result.add(ImmutableList.copyOf(line));
      return result.build();
    }

    private Entry decodeEntry(int previousColumn) {
      List<Integer> values = new ArrayList<>(5);
      while (hasNext() && peek() != ',' && peek() != ';') {
        values.add(Base64VLQ.decode(this));
      }
      int column = previousColumn + values.get(0);
      switch (values.size()) {
        case 1:
          return new Entry(column, UNMAPPED, 0, 0);
        case 4:
        case 5:
          previousSource += values.get(1);
          previousSourceLine += values.get(2);
          previousSourceColumn += values.get(3);
          if (previousSource < 0 || previousSource >= sourceCount) {
            throw new IllegalArgumentException("source index out of range: " + previousSource);
          }
          if (column < 0 || previousSourceLine < 0 || previousSourceColumn < 0) {
            throw new IllegalArgumentException("negative position in segment");
          }
          return new Entry(column, previousSource, previousSourceLine, previousSourceColumn);
        default:
          throw new IllegalArgumentException("segment with " + values.size() + " fields");
      }
    }

    private char peek() {
      return content.charAt(position);
    }

    @Override
    public boolean hasNext() {
      return position < content.length();
    }

    @Override
    public char next() {
      return content.charAt(position++);
    }
  }
}
