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

import com.google.common.collect.ImmutableSet;
import dev.stepscript.compiler.parsing.trees.ExpressionTree;
import org.jspecify.annotations.Nullable;

/** Recognizes store paths, the only kind of variable the script dialect has. */
final class StorePaths {

  /** Roots an expression may read from. */
  static final ImmutableSet<String> ROOTS =
      ImmutableSet.of("Page", "Store", "Url", "Parent", "Steps", "Arguments", "Context");

  /** Roots a statement may assign to. */
  static final ImmutableSet<String> WRITABLE_ROOTS =
      ImmutableSet.of("Page", "Store", "Url", "Parent");

  private StorePaths() {}

  /** Whether {@code expression} is a root identifier or an access chain over one. */
  static boolean isStorePath(ExpressionTree expression) {
    String root = rootName(expression);
    return root != null && ROOTS.contains(root);
  }

  static boolean isWritableStorePath(ExpressionTree expression) {
    String root = rootName(expression);
    return root != null && WRITABLE_ROOTS.contains(root);
  }

  /** Returns the identifier an access chain starts from, or null for other expressions. */
  static @Nullable String rootName(ExpressionTree expression) {
    ExpressionTree current = expression;
    while (current instanceof ExpressionTree.Member member) {
      current = member.object();
    }
    return current instanceof ExpressionTree.Identifier identifier ? identifier.name() : null;
  }

  /**
   * Returns {@code a.b.c} for a chain of non-computed accesses over an identifier, or null for
   * anything else.
   */
  static @Nullable String qualifiedName(ExpressionTree expression) {
    if (expression instanceof ExpressionTree.Identifier identifier) {
      return identifier.name();
    }
    if (expression instanceof ExpressionTree.Member member && !member.computed()) {
      String object = qualifiedName(member.object());
      if (object != null && member.property() instanceof ExpressionTree.Identifier property) {
        return object + "." + property.name();
      }
    }
    return null;
  }

  /** Quotes {@code value} as a double-quoted string literal. */
  static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
