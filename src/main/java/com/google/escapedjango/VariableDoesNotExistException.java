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
 * Thrown when a variable cannot be resolved and the engine was configured with {@link
 * Engine.Builder#strictVariables strict variables}. Without that setting a missing variable
 * renders as the engine's {@linkplain Engine.Builder#stringIfInvalid invalid-value string}.
 */
public class VariableDoesNotExistException extends EvaluationException {
  private static final long serialVersionUID = 1;

  private final String variable;

  VariableDoesNotExistException(String variable, String templateName) {
    super(
        "Failed lookup for variable '"
            + variable
            + "' in template '"
            + (templateName == null ? "unknown" : templateName)
            + "'");
    this.variable = variable;
  }

  /** The text of the variable as it appeared in the template, for example {@code user.name}. */
  public String variable() {
    return variable;
  }
}
