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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Immutable settings for one print. */
@AutoValue
public abstract class FormatOptions {

  /** Which quote character string literals use. */
  public enum QuoteStyle {
    /** Whichever needs fewer escapes; double quotes on a tie. */
    AUTO,
    SINGLE,
    DOUBLE
  }

  /** Where a trailing comma is added to a list that breaks over several lines. */
  public enum TrailingComma {
    NONE,
    /** Object and array literals. */
    ES5,
    /** Object and array literals and call arguments. */
    ALL
  }

  public abstract int getTabWidth();

  public abstract int getPrintWidth();

  public abstract QuoteStyle getQuote();

  /** Whether braces of objects and import/export lists are padded with spaces. */
  public abstract boolean getObjectCurlySpacing();

  public abstract TrailingComma getTrailingComma();

  /** Whether a lone arrow function parameter keeps its parentheses. */
  public abstract boolean getArrowParensAlways();

  /** How many blank lines between a comment and the code next to it survive. */
  public abstract int getMaxBlankLinesAroundComments();

  /** The {@code file} recorded in generated source maps; a map is produced only when set. */
  public abstract @Nullable String getSourceMapOutputName();

  public abstract @Nullable String getSourceRoot();

  /** A V3 source map, as JSON, from the original sources to the printed AST's input. */
  public abstract @Nullable String getInputSourceMap();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_FormatOptions.Builder()
        .setTabWidth(2)
        .setPrintWidth(80)
        .setQuote(QuoteStyle.AUTO)
        .setObjectCurlySpacing(true)
        .setTrailingComma(TrailingComma.NONE)
        .setArrowParensAlways(false)
        .setMaxBlankLinesAroundComments(1);
  }

  public static FormatOptions defaults() {
    return builder().build();
  }

  /**
   * Reads options from a JSON object such as {@code {"printWidth": 100, "quote": "single"}}.
   * Keys that are absent keep their defaults.
   *
   * @throws IllegalArgumentException for malformed JSON, unknown keys or out-of-range values
   */
  public static FormatOptions fromJson(String json) {
    JsonObject object;
    try {
      object = new Gson().fromJson(json, JsonObject.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed format options: " + e.getMessage(), e);
    }
    checkArgument(object != null, "Empty format options");

    Builder builder = builder();
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      JsonElement value = entry.getValue();
      try {
        switch (entry.getKey()) {
          case "tabWidth":
            builder.setTabWidth(value.getAsInt());
            break;
          case "printWidth":
            builder.setPrintWidth(value.getAsInt());
            break;
          case "quote":
            builder.setQuote(QuoteStyle.valueOf(Ascii.toUpperCase(value.getAsString())));
            break;
          case "objectCurlySpacing":
            builder.setObjectCurlySpacing(value.getAsBoolean());
            break;
          case "trailingComma":
            builder.setTrailingComma(
                TrailingComma.valueOf(Ascii.toUpperCase(value.getAsString())));
            break;
          case "arrowParensAlways":
            builder.setArrowParensAlways(value.getAsBoolean());
            break;
          case "maxBlankLinesAroundComments":
            builder.setMaxBlankLinesAroundComments(value.getAsInt());
            break;
          case "sourceMapOutputName":
            builder.setSourceMapOutputName(value.getAsString());
            break;
          case "sourceRoot":
            builder.setSourceRoot(value.getAsString());
            break;
          case "inputSourceMap":
            builder.setInputSourceMap(
                value.isJsonObject() ? value.toString() : value.getAsString());
            break;
          default:
            throw new IllegalArgumentException("Unknown format option: " + entry.getKey());
        }
      } catch (UnsupportedOperationException | IllegalStateException | NumberFormatException e) {
        throw new IllegalArgumentException(
            "Bad value for format option " + entry.getKey() + ": " + value, e);
      }
    }
    return builder.build();
  }

  /** Builder for {@link FormatOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setTabWidth(int tabWidth);

    public abstract Builder setPrintWidth(int printWidth);

    public abstract Builder setQuote(QuoteStyle quote);

    public abstract Builder setObjectCurlySpacing(boolean objectCurlySpacing);

    public abstract Builder setTrailingComma(TrailingComma trailingComma);

    public abstract Builder setArrowParensAlways(boolean arrowParensAlways);

    public abstract Builder setMaxBlankLinesAroundComments(int maxBlankLines);

    public abstract Builder setSourceMapOutputName(@Nullable String sourceMapOutputName);

    public abstract Builder setSourceRoot(@Nullable String sourceRoot);

    public abstract Builder setInputSourceMap(@Nullable String inputSourceMap);

    abstract FormatOptions autoBuild();

    public FormatOptions build() {
      FormatOptions options = autoBuild();
      checkArgument(options.getTabWidth() > 0, "tabWidth must be positive");
      checkArgument(options.getPrintWidth() > 0, "printWidth must be positive");
      checkArgument(
          options.getMaxBlankLinesAroundComments() >= 0,
          "maxBlankLinesAroundComments must not be negative");
      return options;
    }
  }
}
