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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import dev.stepscript.compiler.parsing.trees.Literals;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import java.util.ArrayList;
import java.util.List;

/** Writes parameter references as script source. */
final class ParameterRenderer {
  /** The text of a parameter the statement does not set. */
  static final String ABSENT = "undefined";

  private ParameterRenderer() {}

  /**
   * Renders all references of {@code parameter}: a single reference as itself, several as an array
   * literal in {@code order}, or as a plain argument list if {@code spread} is set.
   */
  static String render(
      Statement statement, String parameter, boolean asIdentifier, boolean spread) {
    ImmutableList<ParameterReference> references = statement.references(parameter);
    if (references.isEmpty()) {
      return ABSENT;
    }
    if (references.size() == 1) {
      return render(references.get(0), asIdentifier);
    }
    List<String> values = new ArrayList<>(references.size());
    for (ParameterReference reference : references) {
      values.add(render(reference, asIdentifier));
    }
    String joined = String.join(", ", values);
    return spread ? joined : "[" + joined + "]";
  }

  static String render(ParameterReference reference, boolean asIdentifier) {
    if (reference instanceof ParameterReference.Expression expression) {
      return renderExpression(expression.expression());
    }
    return renderValue(((ParameterReference.Value) reference).value(), asIdentifier);
  }

  /**
   * Unwraps a {@code {{ }}} template wrapper and redundant outer parentheses, and writes the
   * runtime's equality operator as the script's.
   */
  static String renderExpression(String expression) {
    String text = expression.trim();
    if (text.startsWith("{{") && text.endsWith("}}") && text.length() >= 4) {
      text = text.substring(2, text.length() - 2);
    }
    return toScriptOperators(stripOuterParens(text));
  }

  private static String renderValue(JsonElement value, boolean asIdentifier) {
    if (value.isJsonNull()) {
      return "null";
    }
    if (!value.isJsonPrimitive()) {
      return value.toString();
    }
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean() ? "true" : "false";
    }
    if (primitive.isNumber()) {
      return Literals.formatNumber(primitive.getAsDouble());
    }
    String string = primitive.getAsString();
    return asIdentifier ? string : StorePaths.quote(string);
  }

  /**
   * Removes parentheses around the whole expression, repeatedly: {@code ((a + b))} becomes {@code
   * a + b}. A pair is kept when it does not span the whole text, as in {@code (a) + (b)}, or
   * when it encloses a top-level comma. Parentheses inside string literals are ignored.
   */
  static String stripOuterParens(String expression) {
    String text = expression.trim();
    while (text.length() >= 2
        && text.charAt(0) == '('
        && text.charAt(text.length() - 1) == ')'
        && outerPairSpansAll(text)) {
      text = text.substring(1, text.length() - 1).trim();
    }
    return text;
  }

  private static boolean outerPairSpansAll(String text) {
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      switch (c) {
        case '"', '\'', '`' -> quote = c;
        case '(', '[', '{' -> depth++;
        case ')', ']', '}' -> {
          depth--;
          if (depth == 0 && i < text.length() - 1) {
            return false;
          }
        }
        case ',' -> {
          if (depth == 1) {
            return false;
          }
        }
        default -> {}
      }
    }
    return depth == 0 && quote == 0;
  }

  /**
   * Rewrites the runtime's {@code =} comparison as {@code ==}. Other operators, and text inside
   * string literals, are left alone.
   */
  static String toScriptOperators(String expression) {
    StringBuilder sb = new StringBuilder(expression.length() + 4);
    char quote = 0;
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      sb.append(c);
      if (quote != 0) {
        if (c == '\\' && i + 1 < expression.length()) {
          sb.append(expression.charAt(++i));
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '"' || c == '\'' || c == '`') {
        quote = c;
      } else if (c == '=' && isLoneEquals(expression, i)) {
        sb.append('=');
      }
    }
    return sb.toString();
  }

  private static boolean isLoneEquals(String text, int index) {
    char previous = index > 0 ? text.charAt(index - 1) : ' ';
    char next = index + 1 < text.length() ? text.charAt(index + 1) : ' ';
    return "=!<>".indexOf(previous) < 0 && next != '=' && next != '>';
  }
}
