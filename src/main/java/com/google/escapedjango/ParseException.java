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
 * An exception that occurred while compiling a template, for example because a delimiter was not
 * closed, a tag was not recognized, or a block tag had no matching end tag.
 */
public class ParseException extends RuntimeException {
  private static final long serialVersionUID = 1;

  private final String resourceName;
  private final int lineNumber;

  public ParseException(String message, String resourceName, int lineNumber) {
    super(message + ", " + where(resourceName, lineNumber));
    this.resourceName = resourceName;
    this.lineNumber = lineNumber;
  }

  ParseException(String message, String resourceName, int lineNumber, String context) {
    super(message + ", " + where(resourceName, lineNumber) + ", at text starting: " + context);
    this.resourceName = resourceName;
    this.lineNumber = lineNumber;
  }

  /** The name of the template where the problem was found, or null if it has no name. */
  public String resourceName() {
    return resourceName;
  }

  /** The 1-based line where the offending tag starts. */
  public int lineNumber() {
    return lineNumber;
  }

  static String where(String resourceName, int lineNumber) {
    if (resourceName == null) {
      return "on line " + lineNumber;
    } else {
      return "on line " + lineNumber + " of " + resourceName;
    }
  }
}
