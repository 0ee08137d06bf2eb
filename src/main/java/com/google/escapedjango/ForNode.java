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
import com.google.common.collect.Lists;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A node representing a {@code for} tag. While rendering <code>{% for x in things %}</code>,
 * {@code x} is set to each element of {@code things} in turn, and {@code forloop} is set to a
 * {@link LoopState} describing the iteration. Both are defined in a scope that is popped when the
 * loop finishes. If {@code things} is empty, the {@code empty} branch is rendered instead.
 *
 * <p>With a single loop variable, the body is rendered following a {@link LoopBodyPlan} computed
 * on first use. Loops that unpack each item into several variables, and every loop when the
 * engine is in debug mode, render the body node by node.
 */
final class ForNode extends Node {
  private static final Logger logger = LoggerFactory.getLogger(ForNode.class);

  private final ImmutableList<String> loopVariables;
  private final FilterExpression sequence;
  private final boolean reversed;
  private final NodeList body;
  private final NodeList empty;

  /**
   * Computed on first render. Two threads might both compute it, but they compute the same thing.
   */
  private volatile LoopBodyPlan plan;

  ForNode(
      String resourceName,
      int lineNumber,
      ImmutableList<String> loopVariables,
      FilterExpression sequence,
      boolean reversed,
      NodeList body,
      NodeList empty) {
    super(resourceName, lineNumber);
    this.loopVariables = loopVariables;
    this.sequence = sequence;
    this.reversed = reversed;
    this.body = body;
    this.empty = empty;
  }

  @Override
  public void render(Context context, StringBuilder output) {
    Object parentLoop = context.get("forloop");
    try (Context.Scope scope = context.push()) {
      Object values = sequence.resolve(context, true);
      List<?> items;
      try {
        items = Values.toList(values);
      } catch (IllegalArgumentException e) {
        throw evaluationException(e.getMessage());
      }
      if (items.isEmpty()) {
        empty.render(context, output);
        return;
      }
      if (reversed) {
        items = Lists.reverse(items);
      }
      LoopState loop =
          new LoopState(
              items.size(), parentLoop instanceof LoopState ? (LoopState) parentLoop : null);
      context.set("forloop", loop);
      LoopBodyPlan plan =
          loopVariables.size() == 1 && !context.engine().isDebug() ? plan() : null;
      for (int i = 0; i < items.size(); i++) {
        loop.setIndex(i);
        Object item = items.get(i);
        if (plan == null) {
          renderGeneric(item, context, output);
        } else {
          if (!plan.isFullyAccelerated()) {
            context.set(loopVariables.get(0), item);
          }
          plan.render(context, item, loop, output);
        }
      }
    }
  }

  private void renderGeneric(Object item, Context context, StringBuilder output) {
    if (loopVariables.size() == 1) {
      context.set(loopVariables.get(0), item);
      body.render(context, output);
      return;
    }
    List<?> parts = Values.unpack(item);
    if (parts.size() != loopVariables.size()) {
      throw evaluationException(
          "Need "
              + loopVariables.size()
              + " values to unpack in for loop; got "
              + parts.size()
              + ".");
    }
    try (Context.Scope scope = context.push()) {
      for (int i = 0; i < parts.size(); i++) {
        context.set(loopVariables.get(i), parts.get(i));
      }
      body.render(context, output);
    }
  }

  LoopBodyPlan plan() {
    LoopBodyPlan result = plan;
    if (result == null) {
      result = LoopBodyPlan.classify(body, loopVariables.get(0));
      plan = result;
      logger.trace("Classified body of for loop {} as {}", where(), result.kinds());
    }
    return result;
  }

  @Override
  public ImmutableList<NodeList> childNodeLists() {
    return ImmutableList.of(body, empty);
  }

  @Override
  public String toString() {
    return "ForNode{" + loopVariables + " in " + sequence + (reversed ? " reversed" : "") + "}";
  }
}
