/*
 * Copyright (C) 2026 Google, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.escapedjango;

import com.google.common.collect.ImmutableList;

/**
 * A node in the compiled template tree. Each node knows the template and line it came from, so
 * that rendering errors can say where they happened.
 *
 * <p>Nodes are immutable once compiled, so one compiled template can be rendered by several
 * threads at once, each with its own {@link Context}.
 */
public abstract class Node {
  final String resourceName;
  final int lineNumber;

  protected Node(String resourceName, int lineNumber) {
    this.resourceName = resourceName;
    this.lineNumber = lineNumber;
  }

  /** Appends the output of this node to {@code output}. */
  public abstract void render(Context context, StringBuilder output);

  /** Returns the output of this node as a string. */
  public final String render(Context context) {
    StringBuilder output = new StringBuilder();
    render(context, output);
    return output.toString();
  }

  /** The node lists nested inside this node, such as the branches of an {@code if}. */
  public ImmutableList<NodeList> childNodeLists() {
    return ImmutableList.of();
  }

  /** Returns this node, if it has the given type, and matching nodes nested inside it. */
  public <T extends Node> ImmutableList<T> getNodesByType(Class<T> type) {
    ImmutableList.Builder<T> nodes = ImmutableList.builder();
    if (type.isInstance(this)) {
      nodes.add(type.cast(this));
    }
    for (NodeList nodeList : childNodeLists()) {
      nodes.addAll(nodeList.getNodesByType(type));
    }
    return nodes.build();
  }

  /** True if this node may only be preceded by text in its template. */
  boolean mustBeFirst() {
    return false;
  }

  public String resourceName() {
    return resourceName;
  }

  public int lineNumber() {
    return lineNumber;
  }

  String where() {
    return ParseException.where(resourceName, lineNumber);
  }

  protected EvaluationException evaluationException(String message) {
    return new EvaluationException("In tag " + where() + ": " + message);
  }

  protected EvaluationException evaluationException(Throwable cause) {
    return new EvaluationException("In tag " + where(), cause);
  }
}
