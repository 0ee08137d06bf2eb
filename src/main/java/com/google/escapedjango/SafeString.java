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
 * A string that has been marked as safe for HTML output, so automatic escaping leaves it alone.
 * String literals in templates, the output of filters flagged {@link Filter.Flag#IS_SAFE} applied
 * to safe input, and the result of the {@code safe} and {@code escape} filters are all safe
 * strings. Concatenating a safe string with anything else produces an ordinary string.
 */
public final class SafeString implements CharSequence {
  private final String value;

  private SafeString(String value) {
    this.value = value;
  }

  /** Marks the given text as safe. If it is already a {@code SafeString}, returns it unchanged. */
  public static SafeString of(CharSequence text) {
    if (text instanceof SafeString) {
      return (SafeString) text;
    }
    return new SafeString(text.toString());
  }

  @Override
  public int length() {
    return value.length();
  }

  @Override
  public char charAt(int index) {
    return value.charAt(index);
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    return value.subSequence(start, end);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SafeString && ((SafeString) o).value.equals(value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
