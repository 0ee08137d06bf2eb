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

/** Thrown when a block tag names a tag that is not registered in any loaded library. */
public class InvalidTagException extends ParseException {
  private static final long serialVersionUID = 1;

  private final String tagName;

  InvalidTagException(String message, String tagName, String resourceName, int lineNumber) {
    super(message, resourceName, lineNumber);
    this.tagName = tagName;
  }

  public String tagName() {
    return tagName;
  }
}
