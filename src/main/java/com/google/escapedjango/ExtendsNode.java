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
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A node representing an <code>{% extends parent %}</code> tag, which must come before any other
 * tag in its template. The rest of the template is its body, but only the blocks in the body
 * matter: rendering the node renders the root template of the inheritance chain, with each block
 * replaced by its most derived override.
 *
 * <p>The whole chain is resolved before anything is rendered, from this template up to the first
 * ancestor that does not itself extend another template. A chain where a template is its own
 * ancestor is rejected.
 */
final class ExtendsNode extends Node {
  private final FilterExpression parentName;
  private final NodeList nodeList;
  private final ImmutableMap<String, BlockNode> blocks;

  ExtendsNode(String resourceName, int lineNumber, FilterExpression parentName, NodeList nodeList) {
    super(resourceName, lineNumber);
    this.parentName = parentName;
    this.nodeList = nodeList;
    ImmutableMap.Builder<String, BlockNode> blocks = ImmutableMap.builder();
    for (BlockNode block : nodeList.getNodesByType(BlockNode.class)) {
      blocks.put(block.name(), block);
    }
    this.blocks = blocks.buildOrThrow();
  }

  @Override
  boolean mustBeFirst() {
    return true;
  }

  ImmutableMap<String, BlockNode> blocks() {
    return blocks;
  }

  @Override
  public void render(Context context, StringBuilder output) {
    ImmutableList<Template> ancestors = resolveAncestors(context);
    BlockContext blockContext = new BlockContext();
    blockContext.addBlocks(blocks);
    Template root = ancestors.get(ancestors.size() - 1);
    for (Template ancestor : ancestors) {
      ExtendsNode extendsNode = ancestor.extendsNode();
      blockContext.addBlocks(extendsNode == null ? rootBlocks(ancestor) : extendsNode.blocks());
    }
    try (RenderContext.State state = context.renderContext().pushState(false)) {
      context.renderContext().put(BlockContext.KEY, blockContext);
      root.nodeList().render(context, output);
    }
  }

  /** Returns the parent, grandparent and so on of this template, ending with the root. */
  private ImmutableList<Template> resolveAncestors(Context context) {
    List<String> seen = new ArrayList<>();
    seen.add(resourceName);
    ImmutableList.Builder<Template> ancestors = ImmutableList.builder();
    ExtendsNode current = this;
    while (current != null) {
      Template parent = current.parent(context);
      if (parent.name() != null && seen.contains(parent.name())) {
        seen.add(parent.name());
        throw new TemplateStructureException(
            "Template inheritance loop: " + String.join(" -> ", seen));
      }
      seen.add(parent.name());
      ancestors.add(parent);
      current = parent.extendsNode();
    }
    return ancestors.build();
  }

  private Template parent(Context context) {
    Object parent = parentName.resolve(context);
    if (parent instanceof Template) {
      return (Template) parent;
    }
    if (!(parent instanceof CharSequence) || ((CharSequence) parent).length() == 0) {
      throw new TemplateStructureException(
          "Invalid template name in 'extends' tag "
              + where()
              + ": "
              + Values.toDisplayString(parent)
              + ". Got this from the '"
              + parentName
              + "' variable.");
    }
    String name = parent.toString();
    try {
      return context.engine().getTemplate(name);
    } catch (IOException | ParseException e) {
      throw new TemplateStructureException(
          "Cannot load template '" + name + "' extended " + where(), e);
    }
  }

  private static ImmutableMap<String, BlockNode> rootBlocks(Template root) {
    ImmutableMap.Builder<String, BlockNode> blocks = ImmutableMap.builder();
    for (BlockNode block : root.nodeList().getNodesByType(BlockNode.class)) {
      blocks.put(block.name(), block);
    }
    return blocks.buildOrThrow();
  }

  @Override
  public ImmutableList<NodeList> childNodeLists() {
    return ImmutableList.of(nodeList);
  }

  @Override
  public String toString() {
    return "ExtendsNode{" + parentName + "}";
  }
}
