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
 * A classification of the top-level nodes of a {@code for} body, computed once per loop node and
 * reused for every render. Text and variable tags that read only the loop variable or {@code
 * forloop} can be rendered straight from the current item and {@link LoopState}, without looking
 * anything up in the {@link Context}, but only if every node can be rendered that way. Then the
 * loop does not even need to store the loop variable in the context. Otherwise another tag in the
 * body may rebind either name, so only the text is rendered directly.
 */
final class LoopBodyPlan {
  enum Kind {
    /** Literal text. */
    TEXT,
    /** A variable tag whose variable starts with the loop variable. */
    LOOP_VARIABLE,
    /** A variable tag whose variable starts with {@code forloop}. */
    LOOP_STATE,
    /** Anything else, rendered normally. */
    GENERIC,
  }

  private static final class Step {
    final Kind kind;
    final Node node;
    final String text;
    final FilterExpression expression;

    Step(Kind kind, Node node, String text, FilterExpression expression) {
      this.kind = kind;
      this.node = node;
      this.text = text;
      this.expression = expression;
    }
  }

  private final ImmutableList<Step> steps;
  private final boolean fullyAccelerated;

  private LoopBodyPlan(ImmutableList<Step> steps) {
    this.steps = steps;
    this.fullyAccelerated = steps.stream().noneMatch(step -> step.kind == Kind.GENERIC);
  }

  static LoopBodyPlan classify(NodeList body, String loopVariable) {
    ImmutableList.Builder<Step> steps = ImmutableList.builder();
    for (Node node : body) {
      steps.add(classify(node, loopVariable));
    }
    return new LoopBodyPlan(steps.build());
  }

  private static Step classify(Node node, String loopVariable) {
    if (node instanceof TextNode) {
      return new Step(Kind.TEXT, node, ((TextNode) node).text(), null);
    }
    if (node instanceof VariableNode) {
      FilterExpression expression = ((VariableNode) node).expression();
      // A filter argument might read the loop variable from the context, so it must be there.
      if (!expression.argumentsReference(loopVariable)) {
        String first = expression.firstSegment().orElse(null);
        if (loopVariable.equals(first)) {
          return new Step(Kind.LOOP_VARIABLE, node, null, expression);
        } else if ("forloop".equals(first) && !loopVariable.equals("forloop")) {
          return new Step(Kind.LOOP_STATE, node, null, expression);
        }
      }
    }
    return new Step(Kind.GENERIC, node, null, null);
  }

  /** True if no node needs to find the loop variable in the context. */
  boolean isFullyAccelerated() {
    return fullyAccelerated;
  }

  ImmutableList<Kind> kinds() {
    return steps.stream().map(step -> step.kind).collect(ImmutableList.toImmutableList());
  }

  void render(Context context, Object item, LoopState loop, StringBuilder output) {
    for (Step step : steps) {
      switch (step.kind) {
        case TEXT:
          output.append(step.text);
          break;
        case LOOP_VARIABLE:
        case LOOP_STATE:
          if (fullyAccelerated) {
            Object first = step.kind == Kind.LOOP_VARIABLE ? item : loop;
            VariableNode.renderValue(
                step.expression.resolveGivenFirst(first, context), context, output);
          } else {
            // A sibling tag such as {% firstof ... as x %} may have rebound the name.
            step.node.render(context, output);
          }
          break;
        case GENERIC:
          step.node.render(context, output);
          break;
      }
    }
  }
}
