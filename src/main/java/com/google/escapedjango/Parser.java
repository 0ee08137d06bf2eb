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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a sequence of {@link Token}s into a tree of {@link Node}s. Text and variable tokens are
 * compiled directly. A block token is compiled by the {@link TagCompiler} registered for its first
 * word, which can in turn call {@link #parse(String...)} to compile its body.
 *
 * <p>One parser compiles one template. It starts out knowing the engine's built-in tags and
 * filters, and learns more from each <code>{% load %}</code> tag.
 */
public final class Parser {
  private static final Pattern KEYWORD_ARGUMENT = Pattern.compile("(?:(\\w+)=)?(.+)");

  private final Engine engine;
  private final String resourceName;
  private final Deque<Token> tokens;
  private final Map<String, TagCompiler> tags = new HashMap<>();
  private final Map<String, Filter> filters = new HashMap<>();

  /** The block tags whose bodies are being compiled, innermost last. */
  private final Deque<Token> commandStack = new ArrayDeque<>();

  /** State that tag compilers keep for the duration of this parse, keyed by the compiler. */
  private final Map<Object, Object> extraData = new HashMap<>();

  /** The token most recently taken from {@link #tokens}, used to position syntax errors. */
  private Token currentToken;

  Parser(Engine engine, String resourceName, List<Token> tokens, Library builtins) {
    this.engine = engine;
    this.resourceName = resourceName;
    this.tokens = new ArrayDeque<>(tokens);
    addLibrary(builtins);
  }

  /**
   * Compiles tokens into nodes until reaching a block tag whose name is one of {@code parseUntil},
   * or until the end of the template if {@code parseUntil} is empty. The stopping tag is left as
   * the next token, so the caller can examine it with {@link #nextToken()}.
   *
   * @throws ParseException if {@code parseUntil} is not empty and none of its tags is found, or if
   *     any of the tokens is malformed.
   */
  public NodeList parse(String... parseUntil) {
    List<String> stops = Arrays.asList(parseUntil);
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    boolean containsNonText = false;
    while (!tokens.isEmpty()) {
      Token token = nextToken();
      Node node;
      switch (token.kind()) {
        case TEXT:
          node = new TextNode(resourceName, token.lineNumber(), token.contents());
          break;
        case VAR:
          if (token.contents().isEmpty()) {
            throw syntaxError(token, "Empty variable tag");
          }
          node =
              new VariableNode(resourceName, token.lineNumber(), compileFilter(token.contents()));
          break;
        case BLOCK:
          String command = token.command();
          if (command.isEmpty()) {
            throw syntaxError(token, "Empty block tag");
          }
          if (stops.contains(command)) {
            prependToken(token);
            return new NodeList(nodes.build());
          }
          TagCompiler compiler = tags.get(command);
          if (compiler == null) {
            throw invalidBlockTag(token, command, stops);
          }
          commandStack.addLast(token);
          node = compiler.compile(this, token);
          commandStack.removeLast();
          break;
        default:
          continue;
      }
      if (node.mustBeFirst() && containsNonText) {
        throw syntaxError(token, "'" + token.command() + "' must be the first tag in the template");
      }
      if (!(node instanceof TextNode)) {
        containsNonText = true;
      }
      nodes.add(node);
    }
    if (!stops.isEmpty()) {
      throw unclosedBlockTag(stops);
    }
    return new NodeList(nodes.build());
  }

  /**
   * Discards tokens up to and including the block tag whose contents are exactly {@code endTag}.
   * The discarded tokens are not compiled, so they may contain anything.
   */
  public void skipPast(String endTag) {
    while (!tokens.isEmpty()) {
      Token token = nextToken();
      if (token.kind() == Token.Kind.BLOCK && token.contents().equals(endTag)) {
        return;
      }
    }
    throw unclosedBlockTag(ImmutableList.of(endTag));
  }

  /**
   * Removes and returns the next token.
   *
   * @throws ParseException if there are no more tokens.
   */
  public Token nextToken() {
    Token token = tokens.pollFirst();
    if (token == null) {
      throw new ParseException("Unexpected end of template", resourceName, currentLine());
    }
    currentToken = token;
    return token;
  }

  /** Puts back a token so that it will be the next one returned. */
  public void prependToken(Token token) {
    tokens.addFirst(token);
  }

  /** Discards the next token, normally the end tag that made {@link #parse} return. */
  public void deleteFirstToken() {
    nextToken();
  }

  public FilterExpression compileFilter(String token) {
    return FilterExpression.compile(token, this);
  }

  /**
   * Returns the filter with the given name among the built-in filters and those of loaded
   * libraries.
   *
   * @throws FilterDoesNotExistException if there is no such filter.
   */
  public Filter findFilter(String name) {
    Filter filter = filters.get(name);
    if (filter == null) {
      throw new FilterDoesNotExistException(name, resourceName, currentLine());
    }
    return filter;
  }

  /** Makes the tags and filters of {@code library} available to the rest of this template. */
  public void addLibrary(Library library) {
    tags.putAll(library.tags());
    filters.putAll(library.filters());
  }

  /**
   * Parses {@code name=value} arguments from the front of {@code bits}, removing the words it
   * consumes. If {@code supportLegacy} is true, the older {@code value as name and value as name}
   * form is also accepted. Parsing stops at the first word that is not a keyword argument.
   */
  public ImmutableMap<String, FilterExpression> keywordArguments(
      Deque<String> bits, boolean supportLegacy) {
    if (bits.isEmpty()) {
      return ImmutableMap.of();
    }
    Matcher first = KEYWORD_ARGUMENT.matcher(bits.peekFirst());
    boolean keywordFormat = first.matches() && first.group(1) != null;
    if (!keywordFormat && (!supportLegacy || !isLegacyArgument(bits))) {
      return ImmutableMap.of();
    }
    Map<String, FilterExpression> arguments = new LinkedHashMap<>();
    while (!bits.isEmpty()) {
      String key;
      String value;
      if (keywordFormat) {
        Matcher matcher = KEYWORD_ARGUMENT.matcher(bits.peekFirst());
        if (!matcher.matches() || matcher.group(1) == null) {
          break;
        }
        key = matcher.group(1);
        value = matcher.group(2);
        bits.removeFirst();
      } else {
        if (!isLegacyArgument(bits)) {
          break;
        }
        value = bits.removeFirst();
        bits.removeFirst();
        key = bits.removeFirst();
      }
      arguments.put(key, compileFilter(value));
      if (!bits.isEmpty() && !keywordFormat) {
        if (!bits.peekFirst().equals("and")) {
          break;
        }
        bits.removeFirst();
      }
    }
    return ImmutableMap.copyOf(arguments);
  }

  private static boolean isLegacyArgument(Deque<String> bits) {
    if (bits.size() < 3) {
      return false;
    }
    return ImmutableList.copyOf(bits).get(1).equals("as");
  }

  /** Returns an exception positioned at the tag currently being compiled. */
  public ParseException syntaxError(String message) {
    return new ParseException(message, resourceName, currentLine());
  }

  public ParseException syntaxError(Token token, String message) {
    return new ParseException(message, resourceName, token.lineNumber());
  }

  private ParseException invalidBlockTag(Token token, String command, List<String> stops) {
    String message = "Invalid block tag '" + command + "'";
    if (!stops.isEmpty()) {
      message += ", expected '" + Joiner.on("' or '").join(stops) + "'";
    }
    message += ". Did you forget to register or load this tag?";
    return new InvalidTagException(message, command, resourceName, token.lineNumber());
  }

  private ParseException unclosedBlockTag(List<String> stops) {
    Token opener = commandStack.peekLast();
    if (opener == null) {
      return new ParseException(
          "Expected one of: " + Joiner.on(", ").join(stops), resourceName, currentLine());
    }
    return syntaxError(
        opener,
        "Unclosed tag '"
            + opener.command()
            + "'. Looking for one of: "
            + Joiner.on(", ").join(stops));
  }

  private int currentLine() {
    return currentToken == null ? 1 : currentToken.lineNumber();
  }

  /** The name of the template being compiled, or null if it has none. */
  public String resourceName() {
    return resourceName;
  }

  public Engine engine() {
    return engine;
  }

  /**
   * A map where tag compilers can keep state for the duration of this parse, such as the names of
   * the blocks seen so far. Each compiler should use a key private to it.
   */
  public Map<Object, Object> extraData() {
    return extraData;
  }
}
