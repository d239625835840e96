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
import org.jspecify.annotations.Nullable;

/** The formatted code and, when one was requested, its V3 source map as JSON. */
@AutoValue
public abstract class PrintResult {
  static PrintResult create(String code, @Nullable String sourceMap) {
    return new AutoValue_PrintResult(code, sourceMap);
  }

  public abstract String getCode();

  public abstract @Nullable String getSourceMap();
}
