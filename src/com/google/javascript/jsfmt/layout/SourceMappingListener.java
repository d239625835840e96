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

import com.google.javascript.jsfmt.ast.SourcePosition;

/** Receives the output positions of the {@link Doc.SourceMark}s a {@link DocPrinter} renders. */
public interface SourceMappingListener {

  /**
   * @param original the position in the original source
   * @param outputLine the 0-based line of the generated text
   * @param outputColumn the 0-based column of the generated text
   */
  void addMapping(SourcePosition original, int outputLine, int outputColumn);
}
