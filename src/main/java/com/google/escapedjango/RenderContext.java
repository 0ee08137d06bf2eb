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

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * State that tags keep while a template renders, invisible to template code. Keys are compared by
 * identity, so a tag normally uses its own {@link Node} as the key.
 *
 * <p>State is organized in frames. Each template render, including each included template, pushes
 * an isolated frame, so a {@code cycle} tag in an included template does not see the state from
 * the including template. The templates of an inheritance chain share a frame.
 */
public final class RenderContext {
  private static final class Frame {
    final Map<Object, Object> values = new IdentityHashMap<>();
    final boolean isolated;

    Frame(boolean isolated) {
      this.isolated = isolated;
    }
  }

  private final List<Frame> frames = new ArrayList<>();

  RenderContext() {
    frames.add(new Frame(true));
  }

  /** Pops the frame pushed by {@link #pushState} when closed. */
  public final class State implements AutoCloseable {
    private boolean closed;

    private State() {}

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        frames.remove(frames.size() - 1);
      }
    }
  }

  /**
   * Pushes a frame. If {@code isolated}, lookups do not see the frames beneath it.
   */
  public State pushState(boolean isolated) {
    frames.add(new Frame(isolated));
    return new State();
  }

  /** Returns the value for {@code key} in the current frame or the frames it can see, or null. */
  public Object get(Object key) {
    for (int i = frames.size() - 1; i >= 0; i--) {
      Frame frame = frames.get(i);
      Object value = frame.values.get(key);
      if (value != null) {
        return value;
      }
      if (frame.isolated) {
        break;
      }
    }
    return null;
  }

  /** Sets the value for {@code key} in the current frame. */
  public void put(Object key, Object value) {
    frames.get(frames.size() - 1).values.put(key, value);
  }
}
