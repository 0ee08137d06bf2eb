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
 * Compiles a block tag into a {@link Node}. A compiler receives the parser positioned just after
 * the tag, so a tag with a body can call {@link Parser#parse(String...)} to compile the nodes up
 * to its end tag, and then {@link Parser#nextToken()} to consume the end tag.
 *
 * <p>Here is a compiler for a tag <code>{% upper %}...{% endupper %}</code> that renders its
 * body in upper case:
 *
 * <pre>{@code
 * TagCompiler upper = (parser, token) -> {
 *   NodeList body = parser.parse("endupper");
 *   parser.deleteFirstToken();
 *   return new Node(parser.resourceName(), token.lineNumber()) {
 *     public void render(Context context, StringBuilder output) {
 *       output.append(body.render(context).toUpperCase());
 *     }
 *   };
 * };
 * }</pre>
 */
@FunctionalInterface
public interface TagCompiler {
  /**
   * Returns the node for the block tag {@code token}.
   *
   * @throws ParseException if the tag is malformed, normally via {@link Parser#syntaxError}.
   */
  Node compile(Parser parser, Token token);
}
