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

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * The value of {@code forloop} inside a {@code for} tag. Templates read its properties, such as
 * {@code forloop.counter} or {@code forloop.parentloop.last}, through the public getters.
 *
 * <p>A loop also carries annotations, a side table where tags inside the loop body can keep state
 * that lasts for the duration of the loop. The {@code ifchanged} tag keeps the last value it saw
 * there.
 */
public final class LoopState {
  private final int length;
  private final LoopState parentloop;
  private final Map<Object, Object> annotations = new IdentityHashMap<>();
  private int index;

  LoopState(int length, LoopState parentloop) {
    this.length = length;
    this.parentloop = parentloop;
  }

  void setIndex(int index) {
    this.index = index;
  }

  /** The current iteration, starting from 1. */
  public int getCounter() {
    return index + 1;
  }

  /** The current iteration, starting from 0. */
  public int getCounter0() {
    return index;
  }

  /** The number of iterations from the end, ending at 1. */
  public int getRevcounter() {
    return length - index;
  }

  /** The number of iterations from the end, ending at 0. */
  public int getRevcounter0() {
    return length - index - 1;
  }

  public boolean isFirst() {
    return index == 0;
  }

  public boolean isLast() {
    return index == length - 1;
  }

  public int getLength() {
    return length;
  }

  /** The state of the enclosing loop, or null if this loop is not nested in another. */
  public LoopState getParentloop() {
    return parentloop;
  }

  public Object annotation(Object key) {
    return annotations.get(key);
  }

  public void annotate(Object key, Object value) {
    annotations.put(key, value);
  }

  @Override
  public String toString() {
    return "{counter: " + getCounter() + ", length: " + length + "}";
  }
}
