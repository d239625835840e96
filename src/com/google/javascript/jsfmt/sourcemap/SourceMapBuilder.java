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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.javascript.jsfmt.ast.SourcePosition;
import com.google.javascript.jsfmt.layout.SourceMappingListener;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Collects mappings from output positions to original positions and writes them as a V3 source
 * map.
 *
 * <p>Mappings must arrive in output order, which is the order the renderer produces them in. Only
 * the first mapping of an output position is kept.
 */
public final class SourceMapBuilder implements SourceMappingListener {
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private record Segment(
      int outputLine, int outputColumn, int sourceIndex, SourcePosition original) {}

  private final @Nullable String defaultSource;
  private final Map<String, Integer> sourceIndices = new LinkedHashMap<>();
  private final List<Segment> segments = new ArrayList<>();

  /** Creates a builder whose mappings name their source explicitly. */
  public SourceMapBuilder() {
    this.defaultSource = null;
  }

  /** Creates a builder that attributes renderer mappings to {@code defaultSource}. */
  public SourceMapBuilder(String defaultSource) {
    this.defaultSource = checkNotNull(defaultSource);
  }

  @Override
  public void addMapping(SourcePosition original, int outputLine, int outputColumn) {
    checkState(defaultSource != null, "no default source for renderer mappings");
    addMapping(defaultSource, original, outputLine, outputColumn);
  }

  public void addMapping(
      String source, SourcePosition original, int outputLine, int outputColumn) {
    checkArgument(outputLine >= 0 && outputColumn >= 0, "%s:%s", outputLine, outputColumn);
    if (!segments.isEmpty()) {
      Segment last = segments.get(segments.size() - 1);
      checkArgument(
          outputLine > last.outputLine()
              || (outputLine == last.outputLine() && outputColumn >= last.outputColumn()),
          "mapping for %s:%s after %s:%s",
          outputLine,
          outputColumn,
          last.outputLine(),
          last.outputColumn());
      if (outputLine == last.outputLine() && outputColumn == last.outputColumn()) {
        return;
      }
    }
    Integer index = sourceIndices.get(source);
    if (index == null) {
      index = sourceIndices.size();
      sourceIndices.put(source, index);
    }
    segments.add(new Segment(outputLine, outputColumn, index, original));
  }

  public int getMappingCount() {
    return segments.size();
  }

  /** Returns the map as JSON. */
  public String build(@Nullable String file, @Nullable String sourceRoot) {
    JsonObject map = new JsonObject();
    map.addProperty("version", 3);
    if (file != null) {
      map.addProperty("file", file);
    }
    if (sourceRoot != null) {
      map.addProperty("sourceRoot", sourceRoot);
    }
    JsonArray sources = new JsonArray();
    for (String source : sourceIndices.keySet()) {
      sources.add(source);
    }
    map.add("sources", sources);
    map.add("names", new JsonArray());
    map.addProperty("mappings", encodeMappings());
    return GSON.toJson(map);
  }

  private String encodeMappings() {
    StringBuilder out = new StringBuilder();
    int line = 0;
    int previousColumn = 0;
    int previousSource = 0;
    int previousSourceLine = 0;
    int previousSourceColumn = 0;
    boolean firstOnLine = true;
    for (Segment segment : segments) {
      while (line < segment.outputLine()) {
        out.append(';');
        line++;
        previousColumn = 0;
        firstOnLine = true;
      }
      if (!firstOnLine) {
        out.append(',');
      }
      firstOnLine = false;

      // Source lines are 0-based in the encoding.
      int sourceLine = segment.original().getLine() - 1;
      int sourceColumn = segment.original().getColumn();
      Base64VLQ.encode(out, segment.outputColumn() - previousColumn);
      Base64VLQ.encode(out, segment.sourceIndex() - previousSource);
      Base64VLQ.encode(out, sourceLine - previousSourceLine);
      Base64VLQ.encode(out, sourceColumn - previousSourceColumn);
      previousColumn = segment.outputColumn();
      previousSource = segment.sourceIndex();
      previousSourceLine = sourceLine;
      previousSourceColumn = sourceColumn;
    }
    return out.toString();
  }
}
