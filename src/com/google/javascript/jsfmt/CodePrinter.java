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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.javascript.jsfmt.ast.Node;
import com.google.javascript.jsfmt.ast.Token;
import com.google.javascript.jsfmt.layout.Doc;
import com.google.javascript.jsfmt.layout.DocPrinter;
import com.google.javascript.jsfmt.sourcemap.DefaultSourceMapComposer;
import com.google.javascript.jsfmt.sourcemap.SourceMapBuilder;
import com.google.javascript.jsfmt.sourcemap.SourceMapComposer;
import com.google.javascript.jsfmt.sourcemap.SourceMapParseException;
import com.google.javascript.jsfmt.template.TemplateCodeGenerator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Prints an AST as formatted source code.
 *
 * <p>Printing attaches the AST's comments to nodes, translates the AST into a layout document and
 * renders the document within the configured width. Template ASTs skip comment attachment.
 *
 * <pre>{@code
 * PrintResult result = new CodePrinter.Builder(root).setOptions(options).build();
 * }</pre>
 */
public final class CodePrinter {
  private static final Logger logger = Logger.getLogger(CodePrinter.class.getName());

  // There are no instances of this class.
  private CodePrinter() {}

  private static PrintResult print(
      Node root,
      FormatOptions options,
      @Nullable String sourceFileName,
      SourceMapComposer composer) {
    long start = System.nanoTime();
    String outputName = options.getSourceMapOutputName();
    SourceMapBuilder sourceMap =
        outputName != null
            ? new SourceMapBuilder(sourceFileName != null ? sourceFileName : outputName)
            : null;

    Doc doc;
    if (root.getToken().getDialect() == Token.Dialect.TEMPLATE) {
      doc = new TemplateCodeGenerator(options).generate(root);
    } else {
      CommentMap comments = CommentAttacher.attach(root);
      doc = new CodeGenerator(options, comments, sourceMap != null).generate(root);
    }
    String code = new DocPrinter(options.getPrintWidth(), 0, sourceMap).print(doc);

    String map = null;
    if (sourceMap != null) {
      map = sourceMap.build(outputName, options.getSourceRoot());
      String inputSourceMap = options.getInputSourceMap();
      if (inputSourceMap != null) {
        try {
          map = composer.compose(inputSourceMap, map);
        } catch (SourceMapParseException e) {
          logger.log(Level.WARNING, "Input source map of " + outputName + " is unusable", e);
          throw new IllegalArgumentException("Invalid input source map: " + e.getMessage(), e);
        }
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Printed "
              + root.getToken()
              + " as "
              + code.length()
              + " characters in "
              + (System.nanoTime() - start) / 1000
              + "us");
    }
    return PrintResult.create(code, map);
  }

  public static final class Builder {
    private final Node root;
    private FormatOptions options = FormatOptions.defaults();
    private @Nullable String sourceFileName = null;
    private SourceMapComposer sourceMapComposer = new DefaultSourceMapComposer();

    /**
     * Sets the root node from which to generate the source code.
     * @param node A {@code FILE}, {@code PROGRAM} or any other node, or a {@code TEMPLATE_PROGRAM}.
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    public Builder setOptions(FormatOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    /**
     * Sets the name the source map records for the printed input. Defaults to the source map's
     * output name.
     */
    public Builder setSourceFileName(String sourceFileName) {
      this.sourceFileName = checkNotNull(sourceFileName);
      return this;
    }

    /** Sets how the generated source map is combined with the input source map. */
    public Builder setSourceMapComposer(SourceMapComposer composer) {
      this.sourceMapComposer = checkNotNull(composer);
      return this;
    }

    /**
     * Generates the source code and returns it.
     *
     * @throws UnsupportedNodeException if the AST holds a node the translator cannot print
     * @throws IllegalArgumentException if the input source map cannot be read
     */
    public PrintResult build() {
      return print(root, options, sourceFileName, sourceMapComposer);
    }
  }
}
