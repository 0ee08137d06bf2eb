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

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/** HTML escaping of rendered values. */
public final class Html {
  private static final Escaper HTML_ESCAPER =
      Escapers.builder()
          .addEscape('&', "&amp;")
          .addEscape('<', "&lt;")
          .addEscape('>', "&gt;")
          .addEscape('"', "&quot;")
          .addEscape('\'', "&#x27;")
          .build();

  private Html() {}

  /**
   * Escapes the display form of {@code value} and marks the result safe. Unlike {@link
   * #conditionalEscape}, this escapes even text that is already safe.
   */
  public static SafeString escape(Object value) {
    return SafeString.of(HTML_ESCAPER.escape(Values.toDisplayString(value)));
  }

  /** Escapes {@code value} unless it is already a {@link SafeString}. */
  public static SafeString conditionalEscape(Object value) {
    if (value instanceof SafeString) {
      return (SafeString) value;
    }
    return escape(value);
  }

  /** Marks the display form of {@code value} as safe without escaping it. */
  public static SafeString markSafe(Object value) {
    if (value instanceof SafeString) {
      return (SafeString) value;
    }
    return SafeString.of(Values.toDisplayString(value));
  }
}
