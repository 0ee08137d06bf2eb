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
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A lexical unit of template source: a run of literal text, the inside of a <code>{{ }}</code>
 * variable tag, the inside of a <code>{% %}</code> block tag, or a <code>{# #}</code> comment.
 * For tags, {@link #contents} has the delimiters and surrounding whitespace removed.
 */
public final class Token {
  /** The kind of a token, according to its delimiters. */
  public enum Kind {
    TEXT,
    VAR,
    BLOCK,
    COMMENT,
  }

  // Words are separated by whitespace, except that quoted strings stay together even if they
  // contain whitespace. A quoted string can be glued to unquoted text, as in name="a b".
  private static final Pattern SMART_SPLIT =
      Pattern.compile(
          "((?:[^\\s'\"]*(?:(?:\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*')[^\\s'\"]*)+)|\\S+)");

  private final Kind kind;
  private final String contents;
  private final int lineNumber;
  private final int position;

  Token(Kind kind, String contents, int lineNumber, int position) {
    this.kind = kind;
    this.contents = contents;
    this.lineNumber = lineNumber;
    this.position = position;
  }

  public Kind kind() {
    return kind;
  }

  public String contents() {
    return contents;
  }

  public int lineNumber() {
    return lineNumber;
  }

  /** Offset of the start of this token, including any opening delimiter, in the source text. */
  public int position() {
    return position;
  }

  /**
   * Splits the contents of this token into words. Quoted strings are kept intact, and a
   * translation marker such as {@code _("two words")} is reassembled into a single word.
   */
  public ImmutableList<String> splitContents() {
    List<String> words = new ArrayList<>();
    Matcher matcher = SMART_SPLIT.matcher(contents);
    while (matcher.find()) {
      words.add(matcher.group());
    }
    ImmutableList.Builder<String> split = ImmutableList.builder();
    for (int i = 0; i < words.size(); i++) {
      String word = words.get(i);
      if (word.startsWith("_(\"") || word.startsWith("_('")) {
        String sentinel = word.charAt(2) + ")";
        StringBuilder translated = new StringBuilder(word);
        while (!word.endsWith(sentinel) && i + 1 < words.size()) {
          word = words.get(++i);
          translated.append(' ').append(word);
        }
        word = translated.toString();
      }
      split.add(word);
    }
    return split.build();
  }

  /** The first word of a block tag, which is the name of the tag. */
  String command() {
    int space = 0;
    while (space < contents.length() && !Character.isWhitespace(contents.charAt(space))) {
      space++;
    }
    return contents.substring(0, space);
  }

  @Override
  public String toString() {
    String shown = contents.length() > 20 ? contents.substring(0, 20) + "..." : contents;
    return kind + " token \"" + shown.replace("\n", "\\n") + "\" on line " + lineNumber;
  }
}
