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
 * Combines the map of a formatting run with the map of the step that produced its input, so the
 * result points from formatted output back to the original sources.
 */
public interface SourceMapComposer {
  /**
   * @param inputSourceMap the map from the formatter's input to the original sources
   * @param generatedSourceMap the map from the formatter's output to its input
   * @return the map from the formatter's output to the original sources
   */
  String compose(String inputSourceMap, String generatedSourceMap)
      throws SourceMapParseException;
}
