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
package dev.stepscript.compiler.parsing.trees;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.jspecify.annotations.Nullable;

/** Utilities for literal expressions. */
public final class Literals {

  // Doubles above this magnitude lose integer precision.
  private static final double MAX_SAFE_INTEGER = 9007199254740991d;

  private Literals() {}

  /** Formats a number the way script source writes it: {@code 1} rather than {@code 1.0}. */
  public static String formatNumber(double value) {
    if (isIntegral(value)) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  /** Returns the number as a JSON primitive, integral values as longs. */
  public static JsonPrimitive toJsonNumber(double value) {
    if (isIntegral(value)) {
      return new JsonPrimitive((long) value);
    }
    return new JsonPrimitive(value);
  }

  private static boolean isIntegral(double value) {
    return !Double.isInfinite(value)
        && value == Math.rint(value)
        && Math.abs(value) <= MAX_SAFE_INTEGER;
  }

  /** Whether the expression is a string, number, boolean or null literal. */
  public static boolean isScalar(ExpressionTree expression) {
    return expression instanceof ExpressionTree.StringLiteral
        || expression instanceof ExpressionTree.NumberLiteral
        || expression instanceof ExpressionTree.BooleanLiteral
        || expression instanceof ExpressionTree.NullLiteral;
  }

  /**
   * Converts a literal expression, including arrays and objects made only of literals, to JSON.
   * Returns null for anything that needs evaluation.
   */
  public static @Nullable JsonElement toJson(ExpressionTree expression) {
    if (expression instanceof ExpressionTree.StringLiteral string) {
      return new JsonPrimitive(string.value());
    }
    if (expression instanceof ExpressionTree.NumberLiteral number) {
      return toJsonNumber(number.value());
    }
    if (expression instanceof ExpressionTree.BooleanLiteral bool) {
      return new JsonPrimitive(bool.value());
    }
    if (expression instanceof ExpressionTree.NullLiteral) {
      return JsonNull.INSTANCE;
    }
    if (expression instanceof ExpressionTree.ArrayLiteral array) {
      JsonArray result = new JsonArray();
      for (ExpressionTree element : array.elements()) {
        JsonElement json = toJson(element);
        if (json == null) {
          return null;
        }
        result.add(json);
      }
      return result;
    }
    if (expression instanceof ExpressionTree.ObjectLiteral object) {
      JsonObject result = new JsonObject();
      for (ExpressionTree.Property property : object.properties()) {
        String name = property.keyName();
        JsonElement json = toJson(property.value());
        if (name == null || json == null) {
          return null;
        }
        result.add(name, json);
      }
      return result;
    }
    return null;
  }
}
