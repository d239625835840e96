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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.javascript.jsfmt.ast.SourcePosition;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DefaultSourceMapComposerTest {

  // mid.js line 1 comes from orig.ts line 10, and mid.js line 2 from orig.ts line 11.
  private static final String INPUT_MAP =
      "{\"version\":3,\"sourceRoot\":\"/src\",\"sources\":[\"orig.ts\"],\"names\":[],"
          + "\"mappings\":\"AASA;AACI\"}";

  private static String generatedMap() {
    SourceMapBuilder builder = new SourceMapBuilder("mid.js");
    builder.addMapping(SourcePosition.create(1, 4), 0, 0);
    builder.addMapping(SourcePosition.create(2, 7), 1, 2);
    builder.addMapping(SourcePosition.create(3, 0), 2, 0);
    return builder.build("out.js", null);
  }

  @Test
  public void testComposeRemapsThroughInputMap() throws Exception {
    String composed = new DefaultSourceMapComposer().compose(INPUT_MAP, generatedMap());

    assertThat(composed)
        .isEqualTo(
            "{\"version\":3,\"file\":\"out.js\",\"sourceRoot\":\"/src\","
                + "\"sources\":[\"orig.ts\"],\"names\":[],\"mappings\":\"AASA;EACI\"}");

    SourceMapConsumer consumer = SourceMapConsumer.parse(composed);
    assertThat(consumer.getMappingForLine(2, 3).getPosition())
        .isEqualTo(SourcePosition.create(11, 4));
  }

  @Test
  public void testComposeRejectsMalformedInput() {
    assertThrows(
        SourceMapParseException.class,
        () -> new DefaultSourceMapComposer().compose("not a map", generatedMap()));
  }
}
