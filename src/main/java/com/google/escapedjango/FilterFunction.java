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
 * The implementation of a filter. The {@code arg} is null when the filter was written without an
 * argument. The {@code autoescape} flag is the current autoescape setting if the filter was
 * registered with {@link Filter.Flag#NEEDS_AUTOESCAPE}, and is otherwise always true.
 */
@FunctionalInterface
public interface FilterFunction {
  Object apply(Object value, Object arg, boolean autoescape);
}
