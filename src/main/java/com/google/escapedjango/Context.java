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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The variables visible while rendering a template, as a stack of scopes. Lookups search from the
 * innermost scope outward. The outermost scope always defines {@code True}, {@code False} and
 * {@code None}. Tags that introduce variables, such as {@code for} and {@code with}, push a scope
 * for their body and pop it when the body has been rendered.
 *
 * <p>A {@code Context} also carries the per-render settings (autoescaping, localization and time
 * zone), the template being rendered, and the {@link RenderContext} where tags keep state that
 * must not be visible to template code.
 *
 * <p>A {@code Context} is used by one render at a time and is not thread-safe.
 */
public final class Context {
  private final List<Map<String, Object>> scopes = new ArrayList<>();
  private final RenderContext renderContext;

  private boolean autoescape = true;
  private boolean useL10n;
  private boolean useTz;
  private ZoneId timeZone = ZoneId.of("UTC");
  private Template template;

  public Context() {
    this(ImmutableMap.of());
  }

  public Context(Map<String, ?> values) {
    this(values, new RenderContext());
  }

  private Context(Map<String, ?> values, RenderContext renderContext) {
    Map<String, Object> builtins = new HashMap<>();
    builtins.put("True", true);
    builtins.put("False", false);
    builtins.put("None", null);
    scopes.add(builtins);
    scopes.add(new HashMap<>(values));
    this.renderContext = renderContext;
  }

  /**
   * Closes a scope pushed by {@link #push}. Closing a scope also removes any scopes pushed after it
   * that are still open. Closing it a second time does nothing.
   */
  public final class Scope implements AutoCloseable {
    private final int depth;
    private boolean closed;

    private Scope(int depth) {
      this.depth = depth;
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        while (scopes.size() >= depth) {
          scopes.remove(scopes.size() - 1);
        }
      }
    }
  }

  /** Pushes a new empty scope, returning an object that pops it when closed. */
  public Scope push() {
    return push(ImmutableMap.of());
  }

  /** Pushes a new scope with the given variables, returning an object that pops it when closed. */
  public Scope push(Map<String, ?> values) {
    scopes.add(new HashMap<>(values));
    return new Scope(scopes.size());
  }

  /**
   * Removes the innermost scope.
   *
   * @throws IllegalStateException if only the scopes present at construction remain.
   */
  public void pop() {
    checkState(scopes.size() > 2, "pop() has been called more times than push()");
    scopes.remove(scopes.size() - 1);
  }

  /** The number of scopes, including the scope of built-in names. */
  public int depth() {
    return scopes.size();
  }

  /** Returns the value of {@code name} in the innermost scope that defines it, or null. */
  public Object get(String name) {
    Object value = lookup(name);
    return value == Variable.UNRESOLVED ? null : value;
  }

  public boolean contains(String name) {
    return lookup(name) != Variable.UNRESOLVED;
  }

  Object lookup(String name) {
    for (int i = scopes.size() - 1; i >= 0; i--) {
      Map<String, Object> scope = scopes.get(i);
      Object value = scope.get(name);
      if (value != null || scope.containsKey(name)) {
        return value;
      }
    }
    return Variable.UNRESOLVED;
  }

  /** Sets {@code name} in the innermost scope. */
  public void set(String name, Object value) {
    scopes.get(scopes.size() - 1).put(name, value);
  }

  /**
   * Sets {@code name} in the innermost scope that already defines it, or in the innermost scope if
   * none does.
   */
  public void setUpward(String name, Object value) {
    for (int i = scopes.size() - 1; i > 0; i--) {
      if (scopes.get(i).containsKey(name)) {
        scopes.get(i).put(name, value);
        return;
      }
    }
    set(name, value);
  }

  /** The scopes, innermost first, not including the scope of built-in names. */
  List<Map<String, Object>> scopesInnermostFirst() {
    return Collections.unmodifiableList(Lists.reverse(scopes.subList(1, scopes.size())));
  }

  /** Returns every visible variable, with inner scopes taking precedence. */
  public Map<String, Object> flatten() {
    Map<String, Object> flat = new LinkedHashMap<>();
    for (Map<String, Object> scope : scopes) {
      flat.putAll(scope);
    }
    return Collections.unmodifiableMap(flat);
  }

  /**
   * Returns a context with only the given variables (plus the built-in names), sharing this
   * context's settings, template, and render state.
   */
  public Context newContext(Map<String, ?> values) {
    Context context = new Context(values, renderContext);
    context.autoescape = autoescape;
    context.useL10n = useL10n;
    context.useTz = useTz;
    context.timeZone = timeZone;
    context.template = template;
    return context;
  }

  public RenderContext renderContext() {
    return renderContext;
  }

  public boolean isAutoescape() {
    return autoescape;
  }

  public void setAutoescape(boolean autoescape) {
    this.autoescape = autoescape;
  }

  public boolean isUseL10n() {
    return useL10n;
  }

  public void setUseL10n(boolean useL10n) {
    this.useL10n = useL10n;
  }

  public boolean isUseTz() {
    return useTz;
  }

  public void setUseTz(boolean useTz) {
    this.useTz = useTz;
  }

  public ZoneId timeZone() {
    return timeZone;
  }

  public void setTimeZone(ZoneId timeZone) {
    this.timeZone = timeZone;
  }

  /** The outermost template being rendered with this context, or null if none is. */
  public Template template() {
    return template;
  }

  void bindTemplate(Template template) {
    this.template = template;
  }

  Engine engine() {
    checkState(template != null, "Context is not being used to render a template");
    return template.engine();
  }
}
