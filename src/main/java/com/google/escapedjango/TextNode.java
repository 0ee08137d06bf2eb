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

/** Literal template text, copied to the output unchanged. */
final class TextNode extends Node {
  private final String text;

  TextNode(String resourceName, int lineNumber, String text) {
    super(resourceName, lineNumber);
    this.text = text;
  }

  String text() {
    return text;
  }

  @Override
  public void render(Context context, StringBuilder output) {
    output.append(text);
  }

  @Override
  public String toString() {
    return "TextNode{" + (text.length() > 20 ? text.substring(0, 20) + "..." : text) + "}";
  }
}
