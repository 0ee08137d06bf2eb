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

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/** Placeholder Latin text for <code>{% lorem %}</code>. */
final class LoremIpsum {
  static final String COMMON_PARAGRAPH =
      "Lorem ipsum dolor sit amet, consectetur adipisicing elit, sed do eiusmod tempor "
          + "incididunt ut labore et dolore magna aliqua. Ut enim ad minim veniam, quis nostrud "
          + "exercitation ullamco laboris nisi ut aliquip ex ea commodo consequat. Duis aute "
          + "irure dolor in reprehenderit in voluptate velit esse cillum dolore eu fugiat nulla "
          + "pariatur. Excepteur sint occaecat cupidatat non proident, sunt in culpa qui officia "
          + "deserunt mollit anim id est laborum.";

  private static final Splitter WORD_SPLITTER = Splitter.on(' ').omitEmptyStrings();

  static final ImmutableList<String> COMMON_WORDS =
      ImmutableList.copyOf(
          WORD_SPLITTER.split(
              "lorem ipsum dolor sit amet consectetur adipisicing elit sed do eiusmod tempor "
                  + "incididunt ut labore et dolore magna aliqua"));

  private static final ImmutableList<String> WORDS =
      ImmutableList.copyOf(
          WORD_SPLITTER.split(
              "exercitationem perferendis perspiciatis laborum eveniet sunt iure nam nobis eum "
                  + "cum officiis excepturi odio consectetur quasi aut quisquam vel eligendi "
                  + "itaque non odit tempore quaerat dignissimos facilis neque nihil expedita "
                  + "vitae vero ipsum nisi animi cumque pariatur velit modi natus iusto eaque "
                  + "sequi illo sed ex et voluptatibus tempora veritatis ratione assumenda "
                  + "incidunt nostrum placeat aliquid fuga provident praesentium rem "
                  + "necessitatibus suscipit adipisci quidem possimus voluptas debitis sint "
                  + "accusantium unde sapiente voluptate qui aspernatur laudantium soluta amet "
                  + "quo aliquam saepe culpa libero ipsa dicta reiciendis nesciunt doloribus "
                  + "autem impedit minima maiores repudiandae ipsam obcaecati ullam enim totam "
                  + "delectus ducimus quis voluptates dolores molestiae harum dolorem quia "
                  + "voluptatem molestias magni distinctio omnis illum dolorum voluptatum ea "
                  + "quas quam corporis quae blanditiis atque deserunt laboriosam earum "
                  + "consequuntur hic cupiditate quibusdam accusamus ut rerum error minus eius "
                  + "ab ad nemo fugit officia at in id quos reprehenderit numquam iste fugiat "
                  + "sit inventore beatae repellendus magnam recusandae quod explicabo "
                  + "doloremque aperiam consequatur asperiores commodi optio dolor labore "
                  + "temporibus repellat veniam architecto est esse mollitia nulla a similique "
                  + "eos alias dolore tenetur deleniti porro facere maxime corrupti"));

  private LoremIpsum() {}

  /**
   * Returns {@code count} words separated by spaces. If {@code common} is true, the words start
   * with "lorem ipsum dolor sit amet".
   */
  static String words(int count, boolean common) {
    List<String> words = new ArrayList<>();
    if (common) {
      words.addAll(COMMON_WORDS.subList(0, Math.min(count, COMMON_WORDS.size())));
    }
    Random random = ThreadLocalRandom.current();
    while (words.size() < count) {
      int n = Math.min(count - words.size(), WORDS.size());
      words.addAll(sample(random, n));
    }
    return Joiner.on(' ').join(words);
  }

  /**
   * Returns {@code count} paragraphs of random sentences. If {@code common} is true, the first
   * paragraph is the standard "Lorem ipsum" one.
   */
  static List<String> paragraphs(int count, boolean common) {
    List<String> paragraphs = new ArrayList<>();
    Random random = ThreadLocalRandom.current();
    for (int i = 0; i < count; i++) {
      paragraphs.add(common && i == 0 ? COMMON_PARAGRAPH : paragraph(random));
    }
    return paragraphs;
  }

  private static String paragraph(Random random) {
    List<String> sentences = new ArrayList<>();
    int count = 1 + random.nextInt(4);
    for (int i = 0; i < count; i++) {
      sentences.add(sentence(random));
    }
    return Joiner.on(' ').join(sentences);
  }

  /** A sentence of up to five comma-separated sections, ending in a period or question mark. */
  private static String sentence(Random random) {
    List<String> sections = new ArrayList<>();
    int count = 1 + random.nextInt(5);
    for (int i = 0; i < count; i++) {
      sections.add(Joiner.on(' ').join(sample(random, 3 + random.nextInt(10))));
    }
    String s = Joiner.on(", ").join(sections);
    String end = random.nextBoolean() ? "?" : ".";
    return Ascii.toUpperCase(s.substring(0, 1)) + s.substring(1) + end;
  }

  /** Returns {@code n} distinct words chosen at random. */
  private static List<String> sample(Random random, int n) {
    List<String> shuffled = new ArrayList<>(WORDS);
    Collections.shuffle(shuffled, random);
    return shuffled.subList(0, n);
  }
}
