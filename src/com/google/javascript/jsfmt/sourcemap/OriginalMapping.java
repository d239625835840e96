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

import com.google.auto.value.AutoValue;
import com.google.javascript.jsfmt.ast.SourcePosition;

/** A position in one of the original sources of a source map. */
@AutoValue
public abstract class OriginalMapping {
  public static OriginalMapping create(String sourceFile, SourcePosition position) {
    return new AutoValue_OriginalMapping(sourceFile, position);
  }

  public abstract String getSourceFile();

  /** The original position; lines are 1-based and columns 0-based. */
  public abstract SourcePosition getPosition();
}
