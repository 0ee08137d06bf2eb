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
 * Locale-aware formatting of values, used when a {@link Context} has localization turned on.
 *
 * @see DefaultFormatter
 */
public interface Formatter {
  /** Returns the localized display form of {@code value}. */
  String localize(Object value);

  /** Returns {@code value} formatted with exactly {@code decimalPlaces} digits after the point. */
  String formatNumber(Number value, int decimalPlaces);
}
