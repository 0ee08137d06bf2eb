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

import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.CharStreams;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.io.IOException;
import java.io.Reader;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles and caches templates, and holds the configuration they share: where to read templates
 * from, which tag and filter libraries exist, and the defaults for rendering. An {@code Engine} is
 * immutable and thread-safe.
 */
public final class Engine {
  private static final Logger logger = LoggerFactory.getLogger(Engine.class);

  private final ResourceOpener resourceOpener;
  private final Library builtins;
  private final ImmutableMap<String, Library> libraries;
  private final boolean autoescape;
  private final String stringIfInvalid;
  private final boolean strictVariables;
  private final boolean debug;
  private final boolean useL10n;
  private final boolean useTz;
  private final ZoneId timeZone;
  private final Formatter formatter;
  private final UnaryOperator<String> translator;
  private final Clock clock;

  /**
   * Caches {@link java.lang.reflect.Method} objects for properties read by templates of this
   * engine. The first time we evaluate {@code var.property} for a {@code var} of a given class,
   * we'll store the resultant {@code Method}, and every subsequent time we'll reuse it. The lookup
   * is quite slow so caching is useful.
   */
  private final MethodFinder methodFinder = new MethodFinder();

  private final LoadingCache<String, Template> templateCache;

  private Engine(Builder builder) {
    this.resourceOpener = builder.resourceOpener;
    this.builtins = Library.merge(builder.builtins);
    this.libraries = ImmutableMap.copyOf(builder.libraries);
    this.autoescape = builder.autoescape;
    this.stringIfInvalid = builder.stringIfInvalid;
    this.strictVariables = builder.strictVariables;
    this.debug = builder.debug;
    this.useL10n = builder.useL10n;
    this.useTz = builder.useTz;
    this.timeZone = builder.timeZone;
    this.formatter = builder.formatter;
    this.translator = builder.translator;
    this.clock = builder.clock;
    this.templateCache =
        CacheBuilder.newBuilder()
            .build(
                new CacheLoader<String, Template>() {
                  @Override
                  public Template load(String name) throws IOException {
                    return loadTemplate(name);
                  }
                });
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Compiles a template from source text. The template has no name and is not cached. */
  public Template fromString(String source) {
    return compile(null, source);
  }

  /**
   * Returns the template with the given name, reading it with the {@link ResourceOpener} and
   * compiling it the first time it is requested.
   *
   * @throws IOException if the template cannot be read.
   * @throws ParseException if the template cannot be compiled.
   */
  public Template getTemplate(String name) throws IOException {
    try {
      return templateCache.get(name);
    } catch (ExecutionException e) {
      Throwables.throwIfInstanceOf(e.getCause(), IOException.class);
      throw new IllegalStateException(e.getCause());
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }
  }

  private Template loadTemplate(String name) throws IOException {
    String source;
    try (Reader reader = resourceOpener.openResource(name)) {
      source = CharStreams.toString(reader);
    }
    return compile(name, source);
  }

  Template compile(String name, String source) {
    ImmutableList<Token> tokens = new Lexer(source, name).tokenize();
    Parser parser = new Parser(this, name, tokens, builtins);
    NodeList nodeList = parser.parse();
    logger.debug(
        "Compiled template {} from {} tokens", name == null ? "<string>" : name, tokens.size());
    return new Template(this, name, nodeList);
  }

  /** Returns a context with the given variables and this engine's default settings. */
  public Context newContext(Map<String, ?> vars) {
    Context context = new Context(vars);
    context.setAutoescape(autoescape);
    context.setUseL10n(useL10n);
    context.setUseTz(useTz);
    context.setTimeZone(timeZone);
    return context;
  }

  /** Returns the library registered under {@code name}, or null. */
  Library library(String name) {
    return libraries.get(name);
  }

  ImmutableMap<String, Library> libraries() {
    return libraries;
  }

  String translate(String text) {
    return translator.apply(text);
  }

  MethodFinder methodFinder() {
    return methodFinder;
  }

  Formatter formatter() {
    return formatter;
  }

  String stringIfInvalid() {
    return stringIfInvalid;
  }

  boolean isStrictVariables() {
    return strictVariables;
  }

  boolean isDebug() {
    return debug;
  }

  Clock clock() {
    return clock;
  }

  /** Builder for {@link Engine}. */
  public static final class Builder {
    private ResourceOpener resourceOpener =
        resourceName -> {
          throw new IOException("No ResourceOpener has been configured to read " + resourceName);
        };
    private final List<Library> builtins = new ArrayList<>();
    private final Map<String, Library> libraries = new LinkedHashMap<>();
    private boolean autoescape = true;
    private String stringIfInvalid = "";
    private boolean strictVariables;
    private boolean debug;
    private boolean useL10n;
    private boolean useTz;
    private ZoneId timeZone = ZoneId.of("UTC");
    private Formatter formatter = new DefaultFormatter(Locale.US);
    private UnaryOperator<String> translator = UnaryOperator.identity();
    private Clock clock = Clock.systemDefaultZone();

    private Builder() {
      builtins.add(DefaultTags.library());
      builtins.add(DefaultFilters.library());
    }

    public Builder resourceOpener(ResourceOpener resourceOpener) {
      this.resourceOpener = checkNotNull(resourceOpener);
      return this;
    }

    /** Registers a library that templates can load with <code>{% load name %}</code>. */
    public Builder addLibrary(String name, Library library) {
      libraries.put(checkNotNull(name), checkNotNull(library));
      return this;
    }

    /**
     * Adds a library whose tags and filters every template sees without loading it. Its entries
     * replace built-in ones with the same names.
     */
    public Builder addBuiltin(Library library) {
      builtins.add(checkNotNull(library));
      return this;
    }

    /** Whether contexts made by {@link Engine#newContext} escape output. Defaults to true. */
    public Builder autoescape(boolean autoescape) {
      this.autoescape = autoescape;
      return this;
    }

    /**
     * The text that a variable that cannot be resolved renders as. Defaults to the empty string.
     * If the text contains {@code %s}, it is replaced by the variable.
     */
    public Builder stringIfInvalid(String stringIfInvalid) {
      this.stringIfInvalid = checkNotNull(stringIfInvalid);
      return this;
    }

    /**
     * If true, a variable that cannot be resolved outside an {@code if} condition throws {@link
     * VariableDoesNotExistException}. Defaults to false.
     */
    public Builder strictVariables(boolean strictVariables) {
      this.strictVariables = strictVariables;
      return this;
    }

    /**
     * If true, {@code for} loops render their bodies node by node instead of following a {@link
     * LoopBodyPlan}, with the same output, and <code>{% debug %}</code> prints the context.
     * Defaults to false.
     */
    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public Builder useL10n(boolean useL10n) {
      this.useL10n = useL10n;
      return this;
    }

    public Builder useTz(boolean useTz) {
      this.useTz = useTz;
      return this;
    }

    public Builder timeZone(ZoneId timeZone) {
      this.timeZone = checkNotNull(timeZone);
      return this;
    }

    public Builder formatter(Formatter formatter) {
      this.formatter = checkNotNull(formatter);
      return this;
    }

    /** The function applied to text marked for translation with {@code _("...")}. */
    public Builder translator(UnaryOperator<String> translator) {
      this.translator = checkNotNull(translator);
      return this;
    }

    /**
     * The clock that <code>{% now %}</code> reads. Its zone is used unless time zone support is
     * enabled. Defaults to the system clock in the default zone.
     */
    public Builder clock(Clock clock) {
      this.clock = checkNotNull(clock);
      return this;
    }

    public Engine build() {
      return new Engine(this);
    }
  }
}
