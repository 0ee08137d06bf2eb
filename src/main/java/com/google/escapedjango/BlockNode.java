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
 * A node representing a <code>{% block name %}</code> tag. Outside inheritance it just renders its
 * body. When its template is part of an inheritance chain, it renders the most derived override of
 * the block with the same name instead.
 */
final class BlockNode extends Node {
  private final String name;
  private final NodeList nodeList;

  BlockNode(String resourceName, int lineNumber, String name, NodeList nodeList) {
    super(resourceName, lineNumber);
    this.name = name;
    this.nodeList = nodeList;
  }

  String name() {
    return name;
  }

  @Override
  public void render(Context context, StringBuilder output) {
    BlockContext blockContext = (BlockContext) context.renderContext().get(BlockContext.KEY);
    try (Context.Scope scope = context.push()) {
      if (blockContext == null) {
        context.set("block", new BlockReference(this, context, null));
        nodeList.render(context, output);
        return;
      }
      BlockNode override = blockContext.pop(name);
      BlockNode block = override == null ? this : override;
      context.set("block", new BlockReference(block, context, blockContext));
      try {
        block.nodeList.render(context, output);
      } finally {
        if (override != null) {
          blockContext.push(name, override);
        }
      }
    }
  }

  @Override
  public ImmutableList<NodeList> childNodeLists() {
    return ImmutableList.of(nodeList);
  }

  @Override
  public String toString() {
    return "BlockNode{" + name + "}";
  }
}
