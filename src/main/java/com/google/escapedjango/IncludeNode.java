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

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Representation of an {@code include} tag in the parse tree.
 *
 * <p>An <code>{% include name %}</code> tag does nothing until the template is rendered. Then
 * {@code name} should evaluate to a string, which is used to get a {@link Template} from the
 * {@link Engine}, or to a {@code Template} itself. The engine caches the templates it compiles, so
 * each name is only read and compiled once. The included template is rendered with the current
 * context, with any {@code with} arguments pushed as an extra scope, or with only the {@code with}
 * arguments if the tag says {@code only}.
 */
final class IncludeNode extends Node {
  private final FilterExpression templateName;
  private final ImmutableMap<String, FilterExpression> extraContext;
  private final boolean isolated;

  IncludeNode(
      String resourceName,
      int lineNumber,
      FilterExpression templateName,
      ImmutableMap<String, FilterExpression> extraContext,
      boolean isolated) {
    super(resourceName, lineNumber);
    this.templateName = templateName;
    this.extraContext = extraContext;
    this.isolated = isolated;
  }

  @Override
  public void render(Context context, StringBuilder output) {
    Template template = template(context);
    Map<String, Object> values = new LinkedHashMap<>();
    extraContext.forEach((name, expression) -> values.put(name, expression.resolve(context)));
    if (isolated) {
      template.render(context.newContext(values), output);
    } else {
      try (Context.Scope scope = context.push(values)) {
        template.render(context, output);
      }
    }
  }

  private Template template(Context context) {
    Object name = templateName.resolve(context);
    if (name instanceof Template) {
      return (Template) name;
    }
    if (!(name instanceof CharSequence) || ((CharSequence) name).length() == 0) {
      throw evaluationException(
          "Argument to include must be a template name or a Template, not "
              + Values.typeName(name));
    }
    try {
      return context.engine().getTemplate(name.toString());
    } catch (ParseException | IOException e) {
      throw evaluationException(e);
    }
  }

  @Override
  public String toString() {
    return "IncludeNode{" + templateName + (isolated ? " only" : "") + "}";
  }
}
