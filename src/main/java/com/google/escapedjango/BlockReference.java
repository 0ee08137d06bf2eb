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

/**
 * The value of {@code block} inside a <code>{% block %}</code> body. Its {@code super} property
 * renders the next override of the same block up the inheritance chain, which lets a child
 * template extend its parent's block content instead of replacing it.
 */
public final class BlockReference {
  private final BlockNode block;
  private final Context context;
  private final BlockContext blockContext;

  BlockReference(BlockNode block, Context context, BlockContext blockContext) {
    this.block = block;
    this.context = context;
    this.blockContext = blockContext;
  }

  public String getName() {
    return block.name();
  }

  /**
   * Renders the parent template's version of this block, or returns an empty string if there is
   * none. The result is safe, since its parts were escaped as they were rendered.
   */
  public SafeString getSuper() {
    if (blockContext == null || blockContext.peek(block.name()) == null) {
      return SafeString.of("");
    }
    StringBuilder output = new StringBuilder();
    block.render(context, output);
    return SafeString.of(output);
  }

  @Override
  public String toString() {
    return "<block " + block.name() + ">";
  }
}
