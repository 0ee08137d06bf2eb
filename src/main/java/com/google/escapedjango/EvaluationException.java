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
 * An exception that occurred while rendering a template, for example because an included template
 * could not be found or a value could not be iterated. If the problem was caused by another
 * exception, such as an {@link java.io.IOException} from a {@link ResourceOpener}, that exception
 * is the {@linkplain Throwable#getCause() cause}.
 */
public class EvaluationException extends RuntimeException {
  private static final long serialVersionUID = 1;

  public EvaluationException(String message) {
    super(message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(cause == null ? message : message + ": " + cause, cause);
  }
}
