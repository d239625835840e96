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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An immutable AST node: a {@link Token} kind plus named fields.
 *
 * <p>Field values are one of {@link Node}, a list of nodes, {@link String}, a list of strings,
 * {@link Boolean} or {@link Double}. A field that was never set reads as absent: {@code null} for
 * single values, an empty list for lists and {@code false} for booleans.
 *
 * <p>Nodes do not override {@code equals}, so maps keyed by nodes compare by identity.
 */
public final class Node {
  private final Token token;
  private final ImmutableMap<String, Object> fields;
  private final @Nullable SourcePosition start;
  private final @Nullable SourcePosition end;

  private Node(Builder builder) {
    this.token = builder.token;
    this.fields = ImmutableMap.copyOf(builder.fields);
    this.start = builder.start;
    this.end = builder.end;
  }

  public static Builder builder(Token token) {
    return new Builder(token);
  }

  /** Returns a builder seeded with this node's kind, fields and source range. */
  public Builder toBuilder() {
    Builder builder = new Builder(token);
    builder.fields.putAll(fields);
    builder.start = start;
    builder.end = end;
    return builder;
  }

  public Token getToken() {
    return token;
  }

  public boolean is(Token kind) {
    return token == kind;
  }

  /** Whether the field is set to a non-empty value. */
  public boolean has(String field) {
    Object value = fields.get(field);
    if (value instanceof List) {
      return !((List<?>) value).isEmpty();
    }
    return value != null;
  }

  public @Nullable Object get(String field) {
    return fields.get(field);
  }

  public @Nullable Node getNode(String field) {
    Object value = fields.get(field);
    if (value == null) {
      return null;
    }
    checkState(value instanceof Node, "%s.%s is not a node: %s", token, field, value);
    return (Node) value;
  }

  @SuppressWarnings("unchecked")
  public ImmutableList<Node> getNodes(String field) {
    Object value = fields.get(field);
    if (value == null) {
      return ImmutableList.of();
    }
    checkState(isListOf(value, Node.class), "%s.%s is not a node list: %s", token, field, value);
    return (ImmutableList<Node>) value;
  }

  public @Nullable String getString(String field) {
    Object value = fields.get(field);
    if (value == null) {
      return null;
    }
    checkState(value instanceof String, "%s.%s is not a string: %s", token, field, value);
    return (String) value;
  }

  @SuppressWarnings("unchecked")
  public ImmutableList<String> getStrings(String field) {
    Object value = fields.get(field);
    if (value == null) {
      return ImmutableList.of();
    }
    checkState(
        isListOf(value, String.class), "%s.%s is not a string list: %s", token, field, value);
    return (ImmutableList<String>) value;
  }

  public boolean getBoolean(String field) {
    Object value = fields.get(field);
    if (value == null) {
      return false;
    }
    checkState(value instanceof Boolean, "%s.%s is not a boolean: %s", token, field, value);
    return (Boolean) value;
  }

  public double getDouble(String field) {
    Object value = fields.get(field);
    checkState(value instanceof Double, "%s.%s is not a number: %s", token, field, value);
    return (Double) value;
  }

  public ImmutableSet<String> getFieldNames() {
    return fields.keySet();
  }

  /** All child nodes, in field order, with list fields flattened. */
  public ImmutableList<Node> getChildren() {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (Object value : fields.values()) {
      if (value instanceof Node) {
        children.add((Node) value);
      } else if (isListOf(value, Node.class)) {
        for (Object element : (List<?>) value) {
          children.add((Node) element);
        }
      }
    }
    return children.build();
  }

  public @Nullable SourcePosition getStart() {
    return start;
  }

  public @Nullable SourcePosition getEnd() {
    return end;
  }

  public boolean hasSourceRange() {
    return start != null && end != null;
  }

  private static boolean isListOf(Object value, Class<?> elementType) {
    if (!(value instanceof ImmutableList)) {
      return false;
    }
    List<?> list = (List<?>) value;
    return list.isEmpty() || elementType.isInstance(list.get(0));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof String || value instanceof Boolean || value instanceof Double) {
        sb.append(' ').append(entry.getKey()).append('=').append(value);
      }
    }
    if (hasSourceRange()) {
      sb.append(" [").append(start).append('-').append(end).append(']');
    }
    return sb.toString();
  }

  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    try {
      appendStringTree(sb);
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
    return sb.toString();
  }

  public void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, null, 0, appendable);
  }

  private static void toStringTreeHelper(
      Node n, @Nullable String field, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    if (field != null) {
      sb.append(field).append(": ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Map.Entry<String, Object> entry : n.fields.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Node) {
        toStringTreeHelper((Node) value, entry.getKey(), level + 1, sb);
      } else if (isListOf(value, Node.class)) {
        for (Object element : (List<?>) value) {
          toStringTreeHelper((Node) element, entry.getKey(), level + 1, sb);
        }
      }
    }
  }

  /** Accumulates the fields of a {@link Node}. Setting a field to {@code null} removes it. */
  public static final class Builder {
    private final Token token;
    private final Map<String, Object> fields = new LinkedHashMap<>();
    private @Nullable SourcePosition start;
    private @Nullable SourcePosition end;

    private Builder(Token token) {
      this.token = checkNotNull(token);
    }

    @CanIgnoreReturnValue
    public Builder set(String field, @Nullable Node value) {
      return put(field, value);
    }

    @CanIgnoreReturnValue
    public Builder set(String field, @Nullable String value) {
      return put(field, value);
    }

    @CanIgnoreReturnValue
    public Builder set(String field, boolean value) {
      return put(field, value);
    }

    @CanIgnoreReturnValue
    public Builder set(String field, double value) {
      return put(field, value);
    }

    @CanIgnoreReturnValue
    public Builder setNodes(String field, List<Node> value) {
      return put(field, ImmutableList.copyOf(value));
    }

    @CanIgnoreReturnValue
    public Builder setStrings(String field, List<String> value) {
      return put(field, ImmutableList.copyOf(value));
    }

    @CanIgnoreReturnValue
    public Builder setRange(SourcePosition start, SourcePosition end) {
      checkArgument(!end.isBefore(start), "range ends before it starts: %s-%s", start, end);
      this.start = start;
      this.end = end;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setRange(int startLine, int startColumn, int endLine, int endColumn) {
      return setRange(
          SourcePosition.create(startLine, startColumn), SourcePosition.create(endLine, endColumn));
    }

    @CanIgnoreReturnValue
    private Builder put(String field, @Nullable Object value) {
      checkNotNull(field);
      if (value == null) {
        fields.remove(field);
      } else {
        fields.put(field, value);
      }
      return this;
    }

    public Node build() {
      return new Node(this);
    }
  }
}
