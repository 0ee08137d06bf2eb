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
import java.util.Iterator;
import java.util.List;

/**
 * A sequence of nodes, such as the body of a tag or a whole template. A list made only of text
 * renders its text directly.
 */
public final class NodeList implements Iterable<Node> {
  static final NodeList EMPTY = new NodeList(ImmutableList.of());

  private final ImmutableList<Node> nodes;
  private final boolean containsNonText;
  private final String text;

  public NodeList(List<? extends Node> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
    this.containsNonText = this.nodes.stream().anyMatch(node -> !(node instanceof TextNode));
    if (containsNonText) {
      this.text = null;
    } else {
      StringBuilder text = new StringBuilder();
      for (Node node : this.nodes) {
        text.append(((TextNode) node).text());
      }
      this.text = text.toString();
    }
  }

  public void render(Context context, StringBuilder output) {
    if (text != null) {
      output.append(text);
      return;
    }
    for (Node node : nodes) {
      node.render(context, output);
    }
  }

  public String render(Context context) {
    StringBuilder output = new StringBuilder();
    render(context, output);
    return output.toString();
  }

  /** True if any node is something other than literal text. */
  public boolean containsNonText() {
    return containsNonText;
  }

  /** The concatenated text of this list, or null if it {@linkplain #containsNonText has tags}. */
  String text() {
    return text;
  }

  public ImmutableList<Node> nodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public Node get(int index) {
    return nodes.get(index);
  }

  @Override
  public Iterator<Node> iterator() {
    return nodes.iterator();
  }

  /** Returns the nodes of the given type in this list, including nested ones, in source order. */
  public <T extends Node> ImmutableList<T> getNodesByType(Class<T> type) {
    ImmutableList.Builder<T> matching = ImmutableList.builder();
    for (Node node : nodes) {
      matching.addAll(node.getNodesByType(type));
    }
    return matching.build();
  }
}
