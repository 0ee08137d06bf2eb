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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A named collection of tags and filters. The built-in tags and filters are libraries that every
 * template sees; other libraries are registered with an {@link Engine} under a name and made
 * visible to a template with <code>{% load name %}</code>.
 */
public final class Library {
  private final ImmutableMap<String, TagCompiler> tags;
  private final ImmutableMap<String, Filter> filters;

  private Library(ImmutableMap<String, TagCompiler> tags, ImmutableMap<String, Filter> filters) {
    this.tags = tags;
    this.filters = filters;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableMap<String, TagCompiler> tags() {
    return tags;
  }

  public ImmutableMap<String, Filter> filters() {
    return filters;
  }

  /**
   * The function behind a tag registered with {@link Builder#simpleTag}. It receives the rendering
   * context and the resolved arguments of the tag, and returns the value the tag renders.
   */
  @FunctionalInterface
  public interface SimpleTag {
    Object call(Context context, List<Object> args, Map<String, Object> kwargs);
  }

  /**
   * The function behind a tag registered with {@link Builder#inclusionTag}. It receives the
   * rendering context and the resolved arguments of the tag, and returns the variables for the
   * included template.
   */
  @FunctionalInterface
  public interface InclusionTag {
    Map<String, ?> call(Context context, List<Object> args, Map<String, Object> kwargs);
  }

  /** Builder for {@link Library}. Registering a name a second time replaces the first entry. */
  public static final class Builder {
    private final Map<String, TagCompiler> tags = new LinkedHashMap<>();
    private final Map<String, Filter> filters = new LinkedHashMap<>();

    private Builder() {}

    public Builder tag(String name, TagCompiler compiler) {
      tags.put(checkNotNull(name), checkNotNull(compiler));
      return this;
    }

    /**
     * Registers a tag <code>{% name arg... key=value... [as variable] %}</code> whose arguments are
     * resolved and passed to {@code function}. The result is rendered in place of the tag, escaped
     * if autoescaping is on and it is not a {@link SafeString}, or stored in {@code variable}.
     */
    public Builder simpleTag(String name, SimpleTag function) {
      checkNotNull(function);
      return tag(name, (parser, token) -> CustomTagNode.simpleTag(parser, token, function));
    }

    /**
     * Registers a tag <code>{% name arg... key=value... %}</code> that renders the template
     * {@code templateName} with the variables that {@code function} returns for the resolved
     * arguments. The template is loaded through the {@link Engine} when the tag is first rendered.
     */
    public Builder inclusionTag(String name, String templateName, InclusionTag function) {
      checkNotNull(templateName);
      checkNotNull(function);
      return tag(
          name,
          (parser, token) -> CustomTagNode.inclusionTag(parser, token, templateName, function));
    }

    public Builder filter(
        String name, Filter.Arity arity, FilterFunction function, Filter.Flag... flags) {
      filters.put(
          checkNotNull(name),
          new Filter(name, checkNotNull(function), arity, ImmutableSet.copyOf(flags)));
      return this;
    }

    /** Registers a filter that takes no argument. */
    public Builder filter(String name, Function<Object, Object> function, Filter.Flag... flags) {
      checkNotNull(function);
      return filter(
          name, Filter.Arity.NONE, (value, arg, autoescape) -> function.apply(value), flags);
    }

    /** Registers a filter that requires an argument. */
    public Builder filter(
        String name, BiFunction<Object, Object, Object> function, Filter.Flag... flags) {
      checkNotNull(function);
      return filter(
          name,
          Filter.Arity.REQUIRED,
          (value, arg, autoescape) -> function.apply(value, arg),
          flags);
    }

    /** Adds all the tags and filters of {@code library}, replacing any with the same names. */
    public Builder addAll(Library library) {
      tags.putAll(library.tags);
      filters.putAll(library.filters);
      return this;
    }

    /** Adds only the named tags and filters of {@code library}. */
    Builder addNamed(Library library, Iterable<String> names) {
      for (String name : names) {
        TagCompiler tag = library.tags.get(name);
        Filter filter = library.filters.get(name);
        if (tag == null && filter == null) {
          throw new IllegalArgumentException(name);
        }
        if (tag != null) {
          tags.put(name, tag);
        }
        if (filter != null) {
          filters.put(name, filter);
        }
      }
      return this;
    }

    public Library build() {
      return new Library(ImmutableMap.copyOf(tags), ImmutableMap.copyOf(filters));
    }
  }

  @Override
  public String toString() {
    return "Library{tags=" + tags.keySet() + ", filters=" + filters.keySet() + "}";
  }

  static Library merge(Iterable<Library> libraries) {
    Builder builder = builder();
    libraries.forEach(builder::addAll);
    return builder.build();
  }
}
