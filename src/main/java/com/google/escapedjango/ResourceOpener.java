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

import java.io.IOException;
import java.io.Reader;

/**
 * Used to read the source of templates named in {@link Engine#getTemplate}, and in {@code include}
 * and {@code extends} tags.
 *
 * <p>Here is an example that opens templates as resources relative to the calling class:
 *
 * <pre>{@code
 *   ResourceOpener resourceOpener = resourceName -> {
 *     InputStream inputStream = getClass().getResourceAsStream(resourceName);
 *     if (inputStream == null) {
 *       throw new IOException("Unknown resource: " + resourceName);
 *     }
 *     return new InputStreamReader(inputStream, StandardCharsets.UTF_8);
 *   };
 *   Engine engine = Engine.builder().resourceOpener(resourceOpener).build();
 * }</pre>
 */
@FunctionalInterface
public interface ResourceOpener {

  /**
   * Returns a {@code Reader} that will be used to read the given resource, then closed.
   *
   * @param resourceName the name of the resource to be read.
   * @return a {@code Reader} for the resource.
   * @throws IOException if the resource cannot be opened, for example because it does not exist.
   */
  Reader openResource(String resourceName) throws IOException;
}
