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
 * Thrown when the inheritance structure of a template is unusable: a parent template that cannot
 * be found, a parent name that resolves to nothing, or a chain of {@code extends} tags that loops
 * back on itself.
 */
public class TemplateStructureException extends EvaluationException {
  private static final long serialVersionUID = 1;

  TemplateStructureException(String message) {
    super(message);
  }

  TemplateStructureException(String message, Throwable cause) {
    super(message, cause);
  }
}
