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
 * A <code>{{ expression }}</code> in a template. The value of the expression is localized if
 * localization is on, then converted to text and HTML-escaped unless autoescaping is off or the
 * value is already a {@link SafeString}.
 */
final class VariableNode extends Node {
  private final FilterExpression expression;

  VariableNode(String resourceName, int lineNumber, FilterExpression expression) {
    super(resourceName, lineNumber);
    this.expression = expression;
  }

  FilterExpression expression() {
    return expression;
  }

  @Override
  public void render(Context context, StringBuilder output) {
    renderValue(expression.resolve(context), context, output);
  }

  /** Appends {@code value} the way a variable tag would, with localization and escaping. */
  static void renderValue(Object value, Context context, StringBuilder output) {
    if (value instanceof SafeString) {
      output.append((SafeString) value);
      return;
    }
    if (context.isUseTz()) {
      value = Filter.toLocalTime(value, context);
    }
    String text =
        context.isUseL10n()
            ? context.engine().formatter().localize(value)
            : Values.toDisplayString(value);
    if (context.isAutoescape()) {
      output.append(Html.escape(text));
    } else {
      output.append(text);
    }
  }

  @Override
  public String toString() {
    return "{{ " + expression + " }}";
  }
}
