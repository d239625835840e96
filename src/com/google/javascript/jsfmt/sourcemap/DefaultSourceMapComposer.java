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

/**
 * Remaps each generated mapping through the input map. Mappings whose input position the input
 * map does not cover are dropped.
 */
public final class DefaultSourceMapComposer implements SourceMapComposer {
  @Override
  public String compose(String inputSourceMap, String generatedSourceMap)
      throws SourceMapParseException {
    SourceMapConsumer input = SourceMapConsumer.parse(inputSourceMap);
    SourceMapConsumer generated = SourceMapConsumer.parse(generatedSourceMap);
    SourceMapBuilder composed = new SourceMapBuilder();
    generated.visitMappings(
        (sourceName, original, generatedLine, generatedColumn) -> {
          OriginalMapping mapping =
              input.getMappingForLine(original.getLine(), original.getColumn() + 1);
          if (mapping != null) {
            composed.addMapping(
                mapping.getSourceFile(), mapping.getPosition(), generatedLine, generatedColumn);
          }
        });
    return composed.build(generated.getFile(), input.getSourceRoot());
  }
}
