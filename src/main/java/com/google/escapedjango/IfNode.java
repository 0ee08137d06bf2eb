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
 * A node representing an {@code if} tag with its {@code elif} and {@code else} branches. The
 * first branch whose condition is true is rendered. The {@code else} branch has a null condition.
 */
final class IfNode extends Node {
  /** A condition and the nodes to render if it is the first true one. */
  static final class Branch {
    final ExpressionNode condition;
    final NodeList nodeList;

    Branch(ExpressionNode condition, NodeList nodeList) {
      this.condition = condition;
      this.nodeList = nodeList;
    }
  }

  private final ImmutableList<Branch> branches;

  IfNode(String resourceName, int lineNumber, ImmutableList<Branch> branches) {
    super(resourceName, lineNumber);
    this.branches = branches;
  }

  @Override
  public void render(Context context, StringBuilder output) {
    for (Branch branch : branches) {
      if (branch.condition == null || branch.condition.isTrue(context)) {
        branch.nodeList.render(context, output);
        return;
      }
    }
  }

  @Override
  public ImmutableList<NodeList> childNodeLists() {
    return branches.stream().map(b -> b.nodeList).collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return "IfNode"
        + branches.stream()
            .map(b -> String.valueOf(b.condition))
            .collect(ImmutableList.toImmutableList());
  }
}
