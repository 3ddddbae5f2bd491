/*
 * Copyright 2026 The StepScript Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.stepscript.compiler;

import com.google.common.base.Ascii;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.HashSet;
import java.util.Set;

/**
 * Generates unique camelCase statement names such as {@code setStore1} and {@code if2}.
 *
 * <p>Each prefix has its own counter. An instance belongs to a single conversion; it is not
 * thread safe.
 */
final class StatementNameGenerator {
  private static final String DEFAULT_PREFIX = "step";

  private final Multiset<String> counters = HashMultiset.create();
  private final Set<String> generated = new HashSet<>();

  /** Returns the next unused name for {@code prefix}. */
  String generate(String prefix) {
    String base = toCamelCase(prefix);
    String name;
    do {
      name = base + (counters.add(base, 1) + 1);
    } while (!generated.add(name));
    return name;
  }

  /** Marks {@code name} as taken so that it is never generated. */
  void reserve(String name) {
    generated.add(name);
  }

  /**
   * Converts {@code set_store}, {@code set-store}, {@code Set Store} and {@code SetStore} to
   * {@code setStore}. Characters other than letters and digits are dropped.
   */
  static String toCamelCase(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    boolean upperNext = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Ascii.isUpperCase(c) || Ascii.isLowerCase(c) || (c >= '0' && c <= '9')) {
        if (sb.length() == 0) {
          sb.append(Ascii.toLowerCase(c));
        } else {
          sb.append(upperNext ? Ascii.toUpperCase(c) : c);
        }
        upperNext = false;
      } else {
        upperNext = true;
      }
    }
    if (sb.length() == 0) {
      return DEFAULT_PREFIX;
    }
    if (sb.charAt(0) >= '0' && sb.charAt(0) <= '9') {
      return DEFAULT_PREFIX + sb;
    }
    return sb.toString();
  }
}
