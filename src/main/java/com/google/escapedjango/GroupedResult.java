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
import java.util.Collections;
import java.util.List;

/**
 * One group produced by the {@code regroup} tag: the value that the items have in common, and the
 * items themselves. In a loop it can also be unpacked, as in <code>
 * {% for grouper, list in groups %}</code>.
 */
public final class GroupedResult {
  private final Object grouper;
  private final List<Object> list;

  GroupedResult(Object grouper, List<Object> list) {
    this.grouper = grouper;
    this.list = Collections.unmodifiableList(new ArrayList<>(list));
  }

  public Object getGrouper() {
    return grouper;
  }

  public List<Object> getList() {
    return list;
  }

  @Override
  public String toString() {
    return "GroupedResult{grouper=" + grouper + ", list=" + list + "}";
  }
}
