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

import com.google.common.collect.ImmutableList;

/**
 * Splits template source into {@link Token}s. Text outside delimiters becomes {@link
 * Token.Kind#TEXT} tokens. Inside <code>{{ }}</code> and <code>{% %}</code>, quoted strings are
 * skipped over so that a closing delimiter inside quotes does not end the tag. Between
 * <code>{% verbatim %}</code> and its matching end tag, every tag is returned as text.
 */
final class Lexer {
  private final String source;
  private final String resourceName;

  private int pos;
  private int lineNumber = 1;

  /**
   * The block contents that will end the current verbatim section, such as {@code endverbatim}
   * or {@code endverbatim myblock}, or null if we are not in a verbatim section.
   */
  private String verbatimEnd;

  Lexer(String source, String resourceName) {
    this.source = source;
    this.resourceName = resourceName;
  }

  ImmutableList<Token> tokenize() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (pos < source.length()) {
      int tagStart = nextTagStart(pos);
      if (tagStart < 0) {
        tokens.add(text(pos, source.length()));
        break;
      }
      if (tagStart > pos) {
        tokens.add(text(pos, tagStart));
      }
      tokens.add(tag(tagStart));
    }
    return tokens.build();
  }

  private int nextTagStart(int from) {
    for (int i = source.indexOf('{', from); i >= 0; i = source.indexOf('{', i + 1)) {
      if (i + 1 < source.length()) {
        char next = source.charAt(i + 1);
        if (next == '{' || next == '%' || next == '#') {
          return i;
        }
      }
    }
    return -1;
  }

  private Token text(int start, int end) {
    Token token = new Token(Token.Kind.TEXT, source.substring(start, end), lineNumber, start);
    advanceTo(end);
    return token;
  }

  private Token tag(int start) {
    char opener = source.charAt(start + 1);
    int startLine = lineNumber;
    int end;
    Token.Kind kind;
    switch (opener) {
      case '{':
        kind = Token.Kind.VAR;
        end = findClose(start + 2, '}', true);
        break;
      case '%':
        kind = Token.Kind.BLOCK;
        end = findClose(start + 2, '%', true);
        break;
      default:
        kind = Token.Kind.COMMENT;
        end = findClose(start + 2, '#', false);
        break;
    }
    if (end < 0) {
      throw new ParseException(
          "Unclosed tag '" + source.substring(start, start + 2) + "'",
          resourceName,
          startLine,
          context(start));
    }
    String tokenString = source.substring(start, end + 2);
    String contents = source.substring(start + 2, end).trim();
    advanceTo(end + 2);
    if (verbatimEnd != null) {
      if (kind == Token.Kind.BLOCK && contents.equals(verbatimEnd)) {
        verbatimEnd = null;
        return new Token(kind, contents, startLine, start);
      }
      return new Token(Token.Kind.TEXT, tokenString, startLine, start);
    }
    if (kind == Token.Kind.BLOCK
        && (contents.equals("verbatim") || contents.startsWith("verbatim "))) {
      verbatimEnd = "end" + contents;
    }
    return new Token(kind, contents, startLine, start);
  }

  /**
   * Returns the index of the closing delimiter that starts with {@code closer} and ends with
   * <code>}</code>, or -1 if there is none. If {@code quoteAware}, quoted strings inside the tag
   * are skipped, so <code>{{ "}}" }}</code> is a single tag.
   */
  private int findClose(int from, char closer, boolean quoteAware) {
    int i = from;
    while (i + 1 < source.length()) {
      char c = source.charAt(i);
      if (c == closer && source.charAt(i + 1) == '}') {
        return i;
      }
      if (quoteAware && (c == '"' || c == '\'')) {
        i = skipQuoted(i, c);
        if (i < 0) {
          return -1;
        }
      }
      i++;
    }
    return -1;
  }

  /** Returns the index of the quote that closes the string starting at {@code start}, or -1. */
  private int skipQuoted(int start, char quote) {
    for (int i = start + 1; i < source.length(); i++) {
      char c = source.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == quote) {
        return i;
      }
    }
    return -1;
  }

  private void advanceTo(int end) {
    for (int i = pos; i < end; i++) {
      if (source.charAt(i) == '\n') {
        lineNumber++;
      }
    }
    pos = end;
  }

  private String context(int start) {
    int end = Math.min(source.length(), start + 20);
    return source.substring(start, end);
  }
}
