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

import java.util.Map;

/**
 * A compiled template. Compile templates with an {@link Engine}, then render them as often as
 * needed, possibly from several threads at once.
 *
 * <pre>{@code
 *   Engine engine = Engine.builder().build();
 *   Template template = engine.fromString("Hello {{ name|title }}!");
 *   String greeting = template.render(ImmutableMap.of("name", "world"));
 * }</pre>
 */
public final class Template {
  private final Engine engine;
  private final String name;
  private final NodeList nodeList;

  Template(Engine engine, String name, NodeList nodeList) {
    this.engine = engine;
    this.name = name;
    this.nodeList = nodeList;
  }

  /**
   * Renders the template with the given variables, using the engine's default settings for
   * autoescaping and localization.
   *
   * @param vars a map where the keys are variable names and the values are the corresponding
   *     variable values. For example, if {@code "x"} maps to 23, then <code>{{ x }}</code> in the
   *     template will expand to 23.
   * @return the rendered text.
   * @throws EvaluationException if rendering failed, for example because an included template
   *     could not be found. If the failure was caused by another exception, such as a {@link
   *     ParseException} or {@link java.io.IOException} when an included template was read and
   *     compiled, that exception will be the {@linkplain Throwable#getCause() cause}.
   */
  public String render(Map<String, ?> vars) {
    return render(engine.newContext(vars));
  }

  /** Renders the template with the given context. The context is left as it was found. */
  public String render(Context context) {
    // The default size of 16 is going to be too small for the vast majority of rendered templates.
    // We use a somewhat arbitrary larger starting size instead.
    StringBuilder output = new StringBuilder(1024);
    render(context, output);
    return output.toString();
  }

  void render(Context context, StringBuilder output) {
    try (RenderContext.State state = context.renderContext().pushState(true)) {
      if (context.template() == null) {
        context.bindTemplate(this);
        try {
          nodeList.render(context, output);
        } finally {
          context.bindTemplate(null);
        }
      } else {
        nodeList.render(context, output);
      }
    }
  }

  /** The name this template was loaded with, or null if it was compiled from a string. */
  public String name() {
    return name;
  }

  public Engine engine() {
    return engine;
  }

  public NodeList nodeList() {
    return nodeList;
  }

  /** The {@code extends} node of this template, or null if it does not extend another. */
  ExtendsNode extendsNode() {
    for (Node node : nodeList) {
      if (!(node instanceof TextNode)) {
        return node instanceof ExtendsNode ? (ExtendsNode) node : null;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return name == null ? "<template>" : name;
  }
}
