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

import com.google.javascript.jsfmt.ast.Token;

/** Thrown when a printer meets a node kind it has no rule for. The print is abandoned. */
public class UnsupportedNodeException extends RuntimeException {
  private final Token token;

  public UnsupportedNodeException(Token token, String dialect) {
    super("Unsupported " + dialect + " node: " + token);
    this.token = token;
  }

  public Token getToken() {
    return token;
  }
}
