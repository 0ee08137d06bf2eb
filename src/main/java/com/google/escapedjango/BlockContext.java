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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * The overrides of each block name along an inheritance chain, kept in the {@link RenderContext}
 * while the root template of the chain renders. The most derived override of a block is the one
 * rendered. While it renders, it is taken off its stack so that rendering {@code block.super} finds
 * the next override up the chain.
 */
final class BlockContext {
  static final Object KEY = new Object();

  private final Map<String, Deque<BlockNode>> blocks = new HashMap<>();

  /**
   * Adds blocks from a template that is an ancestor of every template whose blocks were already
   * added, so they are found only after those.
   */
  void addBlocks(Map<String, BlockNode> ancestorBlocks) {
    ancestorBlocks.forEach(
        (name, block) -> blocks.computeIfAbsent(name, k -> new ArrayDeque<>()).addFirst(block));
  }

  /** Removes and returns the most derived remaining override of {@code name}, or null. */
  BlockNode pop(String name) {
    Deque<BlockNode> stack = blocks.get(name);
    return stack == null ? null : stack.pollLast();
  }

  void push(String name, BlockNode block) {
    blocks.computeIfAbsent(name, k -> new ArrayDeque<>()).addLast(block);
  }

  /** Returns the most derived remaining override of {@code name} without removing it, or null. */
  BlockNode peek(String name) {
    Deque<BlockNode> stack = blocks.get(name);
    return stack == null ? null : stack.peekLast();
  }
}
