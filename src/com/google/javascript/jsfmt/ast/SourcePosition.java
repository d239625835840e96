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

package com.google.javascript.jsfmt.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * A position in the original source text. Lines are 1-based and columns are 0-based, matching the
 * locations reported by ESTree parsers.
 */
@AutoValue
public abstract class SourcePosition implements Comparable<SourcePosition> {

  public static SourcePosition create(int line, int column) {
    checkArgument(line >= 1, "line must be 1-based: %s", line);
    checkArgument(column >= 0, "column must be non-negative: %s", column);
    return new AutoValue_SourcePosition(line, column);
  }

  public abstract int getLine();

  public abstract int getColumn();

  public boolean isBefore(SourcePosition other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(SourcePosition other) {
    if (getLine() != other.getLine()) {
      return Integer.compare(getLine(), other.getLine());
    }
    return Integer.compare(getColumn(), other.getColumn());
  }

  @Override
  public final String toString() {
    return getLine() + ":" + getColumn();
  }
}
